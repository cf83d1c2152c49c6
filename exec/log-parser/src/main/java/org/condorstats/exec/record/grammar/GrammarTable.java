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

import java.io.IOException;
import java.net.URL;
import java.util.List;
import java.util.Map;

import org.condorstats.common.config.StatsConfigException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;

/**
 * Maps HTCondor event codes to their grammars. The table is data, read
 * from a JSON resource, so that supporting another event type means
 * adding an entry rather than code:
 * <pre><code>
 * { "events": [
 *   { "code": 9, "minLines": 2,
 *     "rules": [ { "line": 1, "pattern": "^\\s*(?&lt;reason&gt;.*\\S)", "fields": [ "reason" ] } ] }
 * ] }
 * </code></pre>
 * Codes without an entry get a header-only grammar.
 */
public class GrammarTable {

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(GrammarTable.class);

  public static final String DEFAULT_RESOURCE = "condor-event-grammar.json";

  private final Map<Integer, EventGrammar> grammars;

  @JsonCreator
  public GrammarTable(@JsonProperty("events") List<EventGrammar> events) {
    ImmutableMap.Builder<Integer, EventGrammar> builder = ImmutableMap.builder();
    if (events != null) {
      for (EventGrammar grammar : events) {
        builder.put(grammar.getCode(), grammar);
      }
    }
    grammars = builder.build();
  }

  public static GrammarTable load() throws StatsConfigException {
    return load(DEFAULT_RESOURCE);
  }

  /**
   * Load and validate the grammar table from a class path resource.
   */
  public static GrammarTable load(String resource) throws StatsConfigException {
    URL url;
    try {
      url = Resources.getResource(resource);
    } catch (IllegalArgumentException e) {
      throw new StatsConfigException("Event grammar resource not found: " + resource, e);
    }
    GrammarTable table;
    try {
      table = new ObjectMapper().readValue(url, GrammarTable.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new StatsConfigException("Cannot read event grammar " + resource + ": " + e.getMessage(), e);
    }
    table.validate();
    logger.debug("Loaded {} event grammars from {}", table.size(), resource);
    return table;
  }

  public void validate() throws StatsConfigException {
    for (EventGrammar grammar : grammars.values()) {
      grammar.validate();
    }
  }

  /**
   * @return the grammar for the code, or a header-only grammar if the
   * table has none
   */
  public EventGrammar forCode(int code) {
    EventGrammar grammar = grammars.get(code);
    return grammar == null ? EventGrammar.headerOnly(code) : grammar;
  }

  public boolean hasGrammar(int code) {
    return grammars.containsKey(code);
  }

  public int size() {
    return grammars.size();
  }
}
