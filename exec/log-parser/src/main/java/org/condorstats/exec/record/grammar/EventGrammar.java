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
package org.condorstats.exec.record.grammar;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.condorstats.common.config.StatsConfigException;
import org.condorstats.exec.record.EventType;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * The layout of one HTCondor event type: how many lines its line-group
 * must have and which fields to extract from which line. The header
 * (line 0) is parsed separately for every event; rules may still read
 * line 0 for the event text that follows the timestamp.
 */
public class EventGrammar {

  private final int code;
  private final String name;
  private final int minLines;
  private final List<FieldRule> rules;
  private final Map<String, String> describe;

  @JsonCreator
  public EventGrammar(@JsonProperty("code") int code,
                      @JsonProperty("name") String name,
                      @JsonProperty("minLines") Integer minLines,
                      @JsonProperty("rules") List<FieldRule> rules,
                      @JsonProperty("describe") Map<String, String> describe) {
    this.code = code;
    this.name = name == null ? EventType.forCode(code).description() : name;
    this.minLines = minLines == null ? 1 : minLines;
    this.rules = rules == null ? ImmutableList.<FieldRule>of() : ImmutableList.copyOf(rules);
    this.describe = describe == null ? new LinkedHashMap<String, String>() : new LinkedHashMap<>(describe);
  }

  /**
   * Grammar for an event with nothing beyond its header.
   */
  public static EventGrammar headerOnly(int code) {
    return new EventGrammar(code, null, 1, null, null);
  }

  public int getCode() { return code; }
  public String getName() { return name; }
  public EventType getType() { return EventType.forCode(code); }
  public int getMinLines() { return minLines; }
  public List<FieldRule> getRules() { return rules; }

  /**
   * @return labels and the fields they show, in order, appended to the
   * header by {@link org.condorstats.exec.record.JobEvent#describe()}
   */
  public Map<String, String> getDescribe() { return describe; }

  public void validate() throws StatsConfigException {
    if (minLines < 1) {
      throw new StatsConfigException("Event " + code + ": minLines must be at least 1");
    }
    Set<String> seen = new HashSet<>();
    for (FieldRule rule : rules) {
      rule.validate(minLines);
      for (String field : rule.getFields()) {
        if (!seen.add(field)) {
          throw new StatsConfigException("Event " + code + " declares field " + field + " more than once");
        }
      }
    }
    for (String field : describe.values()) {
      if (!declares(field)) {
        throw new StatsConfigException("Event " + code + " describes undeclared field " + field);
      }
    }
  }

  public boolean declares(String field) {
    for (FieldRule rule : rules) {
      if (rule.getFields().contains(field)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "EventGrammar [code=" + code + ", name=" + name + ", minLines=" + minLines + ", rules=" + rules.size() + "]";
  }
}
