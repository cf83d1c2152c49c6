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

import java.util.EnumMap;
import java.util.Map;

import org.condorstats.exec.record.EventType;

/**
 * Counts for one ingested log.
 */
public class IngestStats {

  private final String source;
  private int groupCount;
  private int eventCount;
  private int skipCount;
  private int yearRollovers;
  private final Map<EventType, Integer> eventsByType = new EnumMap<>(EventType.class);

  public IngestStats(String source) {
    this.source = source;
  }

  void addEvent(EventType type) {
    eventCount++;
    eventsByType.merge(type, 1, Integer::sum);
  }

  void addGroup() { groupCount++; }
  void addSkip() { skipCount++; }
  void addRollover() { yearRollovers++; }

  public String getSource() { return source; }

  /**
   * @return line-groups read, whether or not they parsed
   */
  public int getGroupCount() { return groupCount; }
  public int getEventCount() { return eventCount; }
  public int getSkipCount() { return skipCount; }
  public int getYearRollovers() { return yearRollovers; }
  public Map<EventType, Integer> getEventsByType() { return eventsByType; }

  @Override
  public String toString() {
    return String.format("%s: %d groups, %d events, %d skipped",
        source, groupCount, eventCount, skipCount);
  }
}
