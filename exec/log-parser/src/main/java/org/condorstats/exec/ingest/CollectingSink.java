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
package org.condorstats.exec.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.condorstats.exec.record.JobEvent;
import org.condorstats.exec.stats.CoreUsageSummary;

/**
 * Holds everything it is given in memory, in arrival order.
 */
public class CollectingSink implements RecordSink {

  private final List<JobEvent> events = new ArrayList<>();
  private final Map<String, CoreUsageSummary> summaries = new LinkedHashMap<>();

  @Override
  public void accept(JobEvent event) {
    events.add(event);
  }

  @Override
  public void acceptSummary(String group, CoreUsageSummary summary) {
    summaries.put(group, summary);
  }

  public List<JobEvent> getEvents() { return events; }
  public Map<String, CoreUsageSummary> getSummaries() { return summaries; }
}
