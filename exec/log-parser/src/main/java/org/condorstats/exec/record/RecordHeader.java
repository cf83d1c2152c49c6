/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.condorstats.exec.record;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import com.google.common.base.Preconditions;

/**
 * The fields common to every HTCondor event: the event code, the job
 * (cluster.proc.subproc) identifier and the time the event was logged.
 * HTCondor writes month, day and time but no year; the year comes from
 * the caller. The timestamp is kept both in the log's local time zone
 * and in UTC.
 * <p>
 * A header is immutable apart from {@link #addYear()}, which the
 * ingestor may call at most once when it finds that a log crossed into
 * a new year.
 */
public class RecordHeader {

  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssZ");
  public static final DateTimeFormatter UTC_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final String eventCode;
  private final String jobIdentifier;
  private ZonedDateTime localTimestamp;
  private ZonedDateTime utcTimestamp;
  private boolean yearAdded;

  public RecordHeader(String eventCode, String jobIdentifier, ZonedDateTime localTimestamp) {
    this.eventCode = eventCode;
    this.jobIdentifier = jobIdentifier;
    setTimestamp(localTimestamp);
  }

  private void setTimestamp(ZonedDateTime local) {
    localTimestamp = local;
    utcTimestamp = local.withZoneSameInstant(ZoneOffset.UTC);
  }

  /**
   * @return the event code as written in the log, such as <tt>005</tt>
   */
  public String getEventCode() { return eventCode; }

  public int eventNumber() { return Integer.parseInt(eventCode); }

  public String getJobIdentifier() { return jobIdentifier; }

  public ZonedDateTime getLocalTimestamp() { return localTimestamp; }

  public ZonedDateTime getUtcTimestamp() { return utcTimestamp; }

  public boolean isYearAdded() { return yearAdded; }

  /**
   * Move this record one calendar year forward. Feb 29 has no
   * counterpart in the following (non-leap) year, so that date moves by
   * the number of days from Jan 1 of this year to Jan 1 of the next,
   * landing on Mar 1.
   *
   * @throws IllegalStateException if the year was already added
   */
  public void addYear() {
    Preconditions.checkState(!yearAdded, "Year already added to record %s", this);
    LocalDateTime local = localTimestamp.toLocalDateTime();
    int year = local.getYear();
    LocalDateTime next;
    if (local.getMonthValue() == 2 && local.getDayOfMonth() == 29 && !Year.isLeap(year + 1)) {
      long days = ChronoUnit.DAYS.between(LocalDate.of(year, 1, 1), LocalDate.of(year + 1, 1, 1));
      next = local.plusDays(days);
    } else {
      next = local.withYear(year + 1);
    }
    setTimestamp(next.atZone(localTimestamp.getZone()));
    yearAdded = true;
  }

  public String formatLocalTimestamp() {
    return localTimestamp.format(TIMESTAMP_FORMAT);
  }

  public String formatUtcTimestamp() {
    return utcTimestamp.format(UTC_FORMAT);
  }

  /**
   * @return event code, job identifier and local timestamp, separated by
   * spaces. For diagnostics only.
   */
  public String describe() {
    return eventCode + " " + jobIdentifier + " " + formatLocalTimestamp();
  }

  public ZoneId getZone() { return localTimestamp.getZone(); }

  @Override
  public String toString() {
    return "RecordHeader [" + describe() + "]";
  }
}
