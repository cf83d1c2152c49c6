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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.condorstats.common.config.StatsConfigException;
import org.condorstats.exec.record.EventParser;
import org.condorstats.exec.record.EventType;
import org.condorstats.exec.record.JobEvent;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

public class TestGrammarTable {

  private static FieldRule named(int line, String pattern, String... fields) {
    return new FieldRule(line, null, pattern, Arrays.asList(fields), null);
  }

  private static void expectInvalid(EventGrammar grammar, String fragment) {
    try {
      new GrammarTable(Collections.singletonList(grammar)).validate();
      fail();
    } catch (StatsConfigException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(fragment));
    }
  }

  @Test
  public void testDefaultTable() throws StatsConfigException {
    GrammarTable table = GrammarTable.load();
    assertEquals(9, table.size());
    for (int code : new int[] {0, 1, 4, 5, 6, 7, 9, 12, 13}) {
      assertTrue(table.hasGrammar(code));
    }
    EventGrammar term = table.forCode(5);
    assertSame(EventType.TERMINATED, term.getType());
    assertEquals("Job terminated", term.getName());
    assertEquals(14, term.getMinLines());
    assertTrue(term.declares("memoryUsage"));
    assertFalse(term.declares("imageSize"));
    assertEquals(ImmutableMap.of("runUser", "userRunRemoteUsage", "totalUser", "userTotalRemoteUsage"),
        term.getDescribe());
  }

  @Test
  public void testHeaderOnlyFallback() throws StatsConfigException {
    GrammarTable table = GrammarTable.load();
    assertFalse(table.hasGrammar(28));
    EventGrammar grammar = table.forCode(28);
    assertEquals(28, grammar.getCode());
    assertEquals(1, grammar.getMinLines());
    assertTrue(grammar.getRules().isEmpty());
    assertEquals(EventType.JOB_AD_INFORMATION.description(), grammar.getName());
  }

  @Test
  public void testLineOutOfRange() {
    expectInvalid(new EventGrammar(9, null, 2, Arrays.asList(named(2, "(?<reason>.+)", "reason")), null),
        "outside the 2 required lines");
  }

  @Test
  public void testMissingGroup() {
    expectInvalid(new EventGrammar(9, null, 2, Arrays.asList(named(1, "(?<why>.+)", "reason")), null),
        "Field reason has no named group");
  }

  @Test
  public void testBadPattern() {
    expectInvalid(new EventGrammar(9, null, 2, Arrays.asList(named(1, "(?<reason>.+", "reason")), null),
        "Invalid pattern");
    expectInvalid(new EventGrammar(9, null, 2, Arrays.asList(named(1, null, "reason")), null),
        "has no pattern");
  }

  @Test
  public void testFieldCount() {
    expectInvalid(new EventGrammar(4, null, 3,
        Arrays.asList(new FieldRule(2, FieldKind.USR_SYS, null, Arrays.asList("user"), null)), null),
        "USR_SYS rule requires 2 fields");
  }

  @Test
  public void testTooManyTypes() {
    expectInvalid(new EventGrammar(6, null, 1,
        Arrays.asList(new FieldRule(0, FieldKind.NAMED, "(?<size>\\d+)", Arrays.asList("size"),
            Arrays.asList(FieldType.LONG, FieldType.LONG))), null),
        "More types than fields");
  }

  @Test
  public void testUndeclaredDescribe() {
    Map<String, String> describe = ImmutableMap.of("size", "imageSize");
    expectInvalid(new EventGrammar(6, null, 1, null, describe), "undeclared field imageSize");
  }

  @Test
  public void testMinLines() {
    expectInvalid(new EventGrammar(6, null, 0, null, null), "minLines must be at least 1");
  }

  @Test
  public void testDuplicateField() {
    expectInvalid(new EventGrammar(4, null, 4, Arrays.asList(
        new FieldRule(2, FieldKind.USR_SYS, null, Arrays.asList("userRunRemoteUsage", "sysRunRemoteUsage"), null),
        new FieldRule(3, FieldKind.USR_SYS, null, Arrays.asList("userRunRemoteUsage", "sysRunLocalUsage"), null)),
        null),
        "declares field userRunRemoteUsage more than once");
  }

  @Test
  public void testDuplicateFieldResource() {
    try {
      GrammarTable.load("condor/duplicate-field-grammar.json");
      fail();
    } catch (StatsConfigException e) {
      assertTrue(e.getMessage().contains("Event 6 declares field imageSize more than once"));
    }
  }

  @Test
  public void testMissingResource() {
    try {
      GrammarTable.load("condor/no-such-grammar.json");
      fail();
    } catch (StatsConfigException e) {
      assertTrue(e.getMessage().contains("not found"));
    }
  }

  @Test
  public void testUnknownProperty() {
    try {
      GrammarTable.load("condor/unknown-property-grammar.json");
      fail();
    } catch (StatsConfigException e) {
      assertTrue(e.getMessage().contains("Cannot read event grammar"));
    }
  }

  @Test
  public void testInvalidResource() {
    try {
      GrammarTable.load("condor/invalid-grammar.json");
      fail();
    } catch (StatsConfigException e) {
      assertTrue(e.getMessage().contains("reads line 3"));
    }
  }

  /**
   * A new event type is a table entry: no code changes needed to pick
   * out its fields.
   */
  @Test
  public void testAddedEventType() throws StatsConfigException {
    EventGrammar remote = new EventGrammar(21, "Remote error", 3, Arrays.asList(
        named(1, "^\\s*(?<message>.*\\S)", "message"),
        new FieldRule(2, FieldKind.USAGE_REQUEST_ALLOCATED, null,
            Arrays.asList("cpusUsage", "cpusRequest", "cpusAllocated"), null)),
        ImmutableMap.of("msg", "message"));
    GrammarTable table = new GrammarTable(Arrays.asList(remote));
    table.validate();

    EventParser parser = new EventParser(table, ZoneOffset.UTC);
    List<String> lines = Arrays.asList(
        "021 (55.0.0) 06/01 09:00:00 Error from starter on node9",
        "    Failed to start job",
        "    Cpus : 1 2 4");
    JobEvent event = parser.parse(2024, lines);
    assertSame(EventType.REMOTE_ERROR, event.getType());
    assertEquals("Failed to start job", event.getFields().getString("message"));
    assertEquals(1, event.getFields().getLong("cpusUsage"));
    assertEquals(2, event.getFields().getLong("cpusRequest"));
    assertEquals(4, event.getFields().getLong("cpusAllocated"));
    assertEquals("021 55.0.0 2024-06-01 09:00:00+0000 msg=Failed to start job", event.describe());

    // The allocated form has no fallback: a short line gives zeros.

    event = parser.parse(2024, Arrays.asList(lines.get(0), lines.get(1), "    Cpus : 1 2"));
    assertEquals(0, event.getFields().getLong("cpusRequest"));
  }
}
