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

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.condorstats.common.exceptions.HeaderParseException;

/**
 * Parses the first line of every HTCondor event:
 * <pre>
 * 005 (3185.000.000) 03/14 12:27:39 Job terminated.
 * </pre>
 * The space after the time is required; HTCondor always follows the
 * timestamp with the event text.
 */
public final class HeaderParser {

  public static final Pattern HEADER_PATTERN = Pattern.compile(
      "(?<event>\\d+) " +
      "\\((?<jobId>.+?.)\\) " +
      "(?<month>\\d+)/(?<day>\\d+) " +
      "(?<hours>\\d+):(?<minutes>\\d+):(?<seconds>\\d+) ");

  private HeaderParser() { }

  /**
   * Parse a header line.
   *
   * @param year the year to complete the timestamp with
   * @param line first line of a line-group
   * @param zone time zone the log was written in
   * @throws HeaderParseException if the line does not match the header
   * grammar or names an impossible date or time
   */
  public static RecordHeader parse(int year, String line, ZoneId zone) {
    Matcher m = HEADER_PATTERN.matcher(line);
    if (!m.find()) {
      throw new HeaderParseException(line);
    }
    LocalDateTime local;
    try {

      // Codes too long for an int cannot be looked up.

      Integer.parseInt(m.group("event"));
      local = LocalDateTime.of(year,
          Integer.parseInt(m.group("month")),
          Integer.parseInt(m.group("day")),
          Integer.parseInt(m.group("hours")),
          Integer.parseInt(m.group("minutes")),
          Integer.parseInt(m.group("seconds")));
    } catch (NumberFormatException | DateTimeException e) {
      throw (HeaderParseException) new HeaderParseException(line, e)
          .addContext("Year", year);
    }
    return new RecordHeader(m.group("event"), m.group("jobId"), local.atZone(zone));
  }
}
