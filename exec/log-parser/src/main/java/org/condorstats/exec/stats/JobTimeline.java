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
package org.condorstats.exec.stats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.condorstats.exec.record.EventType;
import org.condorstats.exec.record.Executing;
import org.condorstats.exec.record.JobEvent;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Assembles per-job run intervals from a stream of events. A run starts
 * with an execute event and ends with the first later termination,
 * eviction, abort, hold or shadow exception for the same job. Events
 * must arrive in log order.
 */
public class JobTimeline {

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(JobTimeline.class);

  public static final String UNKNOWN_HOST = "unknown";

  private static class OpenRun {
    final String host;
    final Instant start;

    OpenRun(String host, Instant start) {
      this.host = host;
      this.start = start;
    }
  }

  private final Map<String, OpenRun> running = new LinkedHashMap<>();
  private final List<JobInterval> intervals = new ArrayList<>();

  public void add(JobEvent event) {
    EventType type = event.getType();
    String jobId = event.getJobIdentifier();
    Instant when = event.getUtcTimestamp().toInstant();
    if (type.startsExecution()) {
      OpenRun previous = running.put(jobId, new OpenRun(Executing.of(event).getHostAddress(), when));
      if (previous != null) {

        // Restarted without an end event (such as after a shadow
        // reconnect). The earlier run ends where the new one starts.

        logger.debug("Job {} executing again at {} without ending run started at {}",
            jobId, when, previous.start);
        close(jobId, previous, when);
      }
    } else if (type.endsExecution()) {
      OpenRun run = running.remove(jobId);
      if (run != null) {
        close(jobId, run, when);
      }
    }
  }

  private void close(String jobId, OpenRun run, Instant end) {
    if (end.isBefore(run.start)) {
      logger.warn("Dropping run of job {}: ends at {}, before its start at {}", jobId, end, run.start);
      return;
    }
    intervals.add(new JobInterval(jobId, run.host, run.start, end));
  }

  /**
   * @return completed runs, ordered by start time
   */
  public List<JobInterval> getIntervals() {
    List<JobInterval> sorted = new ArrayList<>(intervals);
    Collections.sort(sorted, Comparator.comparing(JobInterval::getStart));
    return ImmutableList.copyOf(sorted);
  }

  /**
   * @return completed runs grouped by execute host, hosts in name order.
   * Runs with no known host are grouped under {@link #UNKNOWN_HOST}.
   */
  public Map<String, List<JobInterval>> intervalsByHost() {
    Map<String, List<JobInterval>> byHost = new TreeMap<>();
    for (JobInterval interval : getIntervals()) {
      String host = interval.getHost() == null ? UNKNOWN_HOST : interval.getHost();
      byHost.computeIfAbsent(host, k -> new ArrayList<>()).add(interval);
    }
    return byHost;
  }

  /**
   * @return jobs that started a run which has not ended
   */
  public Set<String> getRunningJobs() {
    return ImmutableSet.copyOf(running.keySet());
  }
}
