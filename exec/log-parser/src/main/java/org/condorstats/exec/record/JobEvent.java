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

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.condorstats.exec.record.grammar.EventGrammar;

/**
 * One parsed HTCondor event: its type, its header and the fields its
 * grammar declares. Built only by {@link EventParser}, and only when
 * every required field parsed.
 * <p>
 * Typed access to the fields of specific event types is through the
 * views {@link Submitted}, {@link Executing}, {@link Evicted},
 * {@link Terminated} and {@link ImageSizeUpdated}.
 */
public class JobEvent {

  private final EventType type;
  private final RecordHeader header;
  private final EventGrammar grammar;
  private final EventFields fields;

  public JobEvent(EventType type, RecordHeader header, EventGrammar grammar, EventFields fields) {
    this.type = type;
    this.header = header;
    this.grammar = grammar;
    this.fields = fields;
  }

  public EventType getType() { return type; }
  public RecordHeader getHeader() { return header; }
  public EventFields getFields() { return fields; }
  public EventGrammar getGrammar() { return grammar; }

  public String getEventCode() { return header.getEventCode(); }
  public String getJobIdentifier() { return header.getJobIdentifier(); }
  public ZonedDateTime getLocalTimestamp() { return header.getLocalTimestamp(); }
  public ZonedDateTime getUtcTimestamp() { return header.getUtcTimestamp(); }

  public void addYear() {
    header.addYear();
  }

  /**
   * @return the header description followed by the <tt>label=value</tt>
   * pairs the grammar selects for this event type
   */
  public String describe() {
    StringBuilder buf = new StringBuilder(header.describe());
    for (Map.Entry<String, String> entry : grammar.getDescribe().entrySet()) {
      buf.append(" ")
         .append(entry.getKey())
         .append("=")
         .append(fieldText(entry.getValue()));
    }
    return buf.toString();
  }

  /**
   * Text form of a field: the value, or <tt>-</tt> if the log omitted it.
   */
  public String fieldText(String name) {
    return fields.has(name) ? fields.getString(name) : "-";
  }

  /**
   * Every attribute of this event as <tt>name = value</tt> lines, for
   * debugging: the header attributes, then each declared field in
   * grammar order.
   */
  public List<String> fieldDump() {
    List<String> lines = new ArrayList<>();
    lines.add("type = " + type.name());
    lines.add("eventCode = " + header.getEventCode());
    lines.add("jobIdentifier = " + header.getJobIdentifier());
    lines.add("localTimestamp = " + header.formatLocalTimestamp());
    lines.add("utcTimestamp = " + header.formatUtcTimestamp());
    for (String name : fields.names()) {
      lines.add(name + " = " + fields.get(name));
    }
    return lines;
  }

  @Override
  public String toString() {
    return "JobEvent [" + type.name() + " " + describe() + "]";
  }
}
