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
package org.condorstats.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.condorstats.exec.ingest.IngestStats;
import org.condorstats.exec.record.EventType;
import org.condorstats.exec.stats.CoreUsageSummary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Result of one run, serialized as JSON: what was read from each log and
 * the peak core usage overall and per execute host.
 */
@JsonPropertyOrder({"year", "timeZone", "granularity", "files", "missingFiles", "coreUsage"})
public class StatsReport {

  @JsonPropertyOrder({"source", "groups", "events", "skipped", "yearRollovers", "eventsByType"})
  public static class FileReport {
    private final IngestStats stats;

    public FileReport(IngestStats stats) {
      this.stats = stats;
    }

    @JsonProperty("source")
    public String getSource() { return stats.getSource(); }

    @JsonProperty("groups")
    public int getGroups() { return stats.getGroupCount(); }

    @JsonProperty("events")
    public int getEvents() { return stats.getEventCount(); }

    @JsonProperty("skipped")
    public int getSkipped() { return stats.getSkipCount(); }

    @JsonProperty("yearRollovers")
    public int getYearRollovers() { return stats.getYearRollovers(); }

    @JsonProperty("eventsByType")
    public Map<String, Integer> getEventsByType() {
      Map<String, Integer> counts = new LinkedHashMap<>();
      for (Map.Entry<EventType, Integer> entry : stats.getEventsByType().entrySet()) {
        counts.put(entry.getKey().name(), entry.getValue());
      }
      return counts;
    }
  }

  /**
   * Peak usage for one group. Times are ISO-8601 UTC instants, and are
   * omitted when the group has no samples.
   */
  @JsonInclude(Include.NON_NULL)
  @JsonPropertyOrder({"maximumCores", "firstTimeAtMaximum", "lastTimeAtMaximum"})
  public static class CoreReport {
    private final CoreUsageSummary summary;

    public CoreReport(CoreUsageSummary summary) {
      this.summary = summary;
    }

    @JsonProperty("maximumCores")
    public int getMaximumCores() { return summary.getMaximumCores(); }

    @JsonProperty("firstTimeAtMaximum")
    public String getFirstTimeAtMaximum() {
      return summary.hasPeak() ? summary.getFirstTimeAtMaximum().toString() : null;
    }

    @JsonProperty("lastTimeAtMaximum")
    public String getLastTimeAtMaximum() {
      return summary.hasPeak() ? summary.getLastTimeAtMaximum().toString() : null;
    }
  }

  private final int year;
  private final String timeZone;
  private final String granularity;
  private final List<FileReport> files = new ArrayList<>();
  private final List<String> missingFiles = new ArrayList<>();
  private final Map<String, CoreReport> coreUsage = new LinkedHashMap<>();

  public StatsReport(int year, String timeZone, String granularity) {
    this.year = year;
    this.timeZone = timeZone;
    this.granularity = granularity;
  }

  public void addFile(IngestStats stats) {
    files.add(new FileReport(stats));
  }

  public void addMissingFile(String file) {
    missingFiles.add(file);
  }

  public void addCoreUsage(String group, CoreUsageSummary summary) {
    coreUsage.put(group, new CoreReport(summary));
  }

  @JsonProperty("year")
  public int getYear() { return year; }

  @JsonProperty("timeZone")
  public String getTimeZone() { return timeZone; }

  @JsonProperty("granularity")
  public String getGranularity() { return granularity; }

  @JsonProperty("files")
  public List<FileReport> getFiles() { return files; }

  @JsonProperty("missingFiles")
  public List<String> getMissingFiles() { return missingFiles; }

  @JsonProperty("coreUsage")
  public Map<String, CoreReport> getCoreUsage() { return coreUsage; }
}
