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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.condorstats.common.config.StatsConfigException;
import org.condorstats.common.exceptions.HeaderParseException;
import org.condorstats.common.exceptions.InsufficientLinesException;
import org.condorstats.common.exceptions.PatternMismatchException;
import org.condorstats.exec.record.grammar.GrammarTable;
import org.junit.BeforeClass;
import org.junit.Test;

public class TestEventParser {

  private static EventParser parser;

  @BeforeClass
  public static void setup() throws StatsConfigException {
    parser = new EventParser(GrammarTable.load(), ZoneOffset.UTC);
  }

  public static List<String> terminatedLines(String memoryLine) {
    return new ArrayList<>(Arrays.asList(
        "005 (3185.000.000) 03/14 12:27:39 Job terminated.",
        "\t(1) Normal termination (return value 0)",
        "\t\tUsr 0 00:01:02, Sys 0 00:00:03  -  Run Remote Usage",
        "\t\tUsr 0 00:00:00, Sys 0 00:00:01  -  Run Local Usage",
        "\t\tUsr 0 01:02:03, Sys 0 00:00:10  -  Total Remote Usage",
        "\t\tUsr 0 00:00:00, Sys 0 00:00:02  -  Total Local Usage",
        "\t1024  -  Run Bytes Sent By Job",
        "\t2048  -  Run Bytes Received By Job",
        "\t4096  -  Total Bytes Sent By Job",
        "\t8192  -  Total Bytes Received By Job",
        "\tPartitionable Resources :    Usage  Request ",
        "\t   Cpus                 :                 1 ",
        "\t   Disk (KB)            :       15        20 ",
        memoryLine));
  }

  public static List<String> terminatedLines() {
    return terminatedLines("\t   Memory (MB)          :        3         1 ");
  }

  @Test
  public void testTerminated() {
    JobEvent event = parser.parse(2024, terminatedLines());
    assertSame(EventType.TERMINATED, event.getType());
    assertEquals("3185.000.000", event.getJobIdentifier());

    Terminated term = Terminated.of(event);
    assertEquals(1, term.getTerm());
    assertEquals(0, term.getReturnValue());
    assertEquals(62, term.getUserRunRemoteUsage());
    assertEquals(3, term.getSysRunRemoteUsage());
    assertEquals(0, term.getUserRunLocalUsage());
    assertEquals(1, term.getSysRunLocalUsage());
    assertEquals(3723, term.getUserTotalRemoteUsage());
    assertEquals(10, term.getSysTotalRemoteUsage());
    assertEquals(0, term.getUserTotalLocalUsage());
    assertEquals(2, term.getSysTotalLocalUsage());
    assertEquals(1024, term.getRunBytesSent());
    assertEquals(2048, term.getRunBytesReceived());
    assertEquals(4096, term.getTotalBytesSent());
    assertEquals(8192, term.getTotalBytesReceived());
    assertEquals(15, term.getDiskUsage());
    assertEquals(20, term.getDiskRequest());
    assertTrue(term.hasMemoryUsage());
    assertEquals(Long.valueOf(3), term.getMemoryUsage());
    assertEquals("3", term.getMemoryUsageText());
    assertEquals(1, term.getMemoryRequest());
  }

  @Test
  public void testDescribe() {
    JobEvent event = parser.parse(2024, terminatedLines());
    assertEquals("005 3185.000.000 2024-03-14 12:27:39+0000 runUser=62 totalUser=3723",
        Terminated.of(event).describe());
  }

  @Test
  public void testMissingMemoryUsage() {
    JobEvent event = parser.parse(2024, terminatedLines("\t   Memory (MB)          :         1 "));
    Terminated term = Terminated.of(event);
    assertFalse(term.hasMemoryUsage());
    assertNull(term.getMemoryUsage());
    assertEquals("-", term.getMemoryUsageText());
    assertEquals(1, term.getMemoryRequest());
  }

  @Test
  public void testInsufficientLines() {
    List<String> lines = terminatedLines();
    lines.remove(lines.size() - 1);
    try {
      parser.parse(2024, lines);
      fail();
    } catch (InsufficientLinesException e) {
      assertEquals(14, e.getRequired());
      assertEquals(13, e.getActual());
      assertEquals(lines.get(0), e.getLine());
    }
  }

  @Test
  public void testBadHeader() {
    List<String> lines = terminatedLines();
    lines.set(0, "005 3185.000.000 03/14 12:27:39 Job terminated.");
    try {
      parser.parse(2024, lines);
      fail();
    } catch (HeaderParseException e) {
      assertEquals(lines.get(0), e.getLine());
    }
  }

  @Test
  public void testFailFast() {
    List<String> lines = terminatedLines();
    lines.set(2, "\t\tUsr 0 00:01, Sys 0 00:00:03  -  Run Remote Usage");
    lines.set(6, "\tno bytes here");
    try {
      parser.parse(2024, lines);
      fail();
    } catch (PatternMismatchException e) {
      assertEquals(lines.get(2), e.getLine());
      assertEquals(FieldExtractor.USR_SYS_TIMES.pattern(), e.getPattern());
      assertTrue(e.getContext().contains("Line offset: 2"));
      assertTrue(e.getContext().contains("Job: 3185.000.000"));
    }
  }

  @Test
  public void testFieldDump() {
    JobEvent event = parser.parse(2024, terminatedLines());
    List<String> dump = event.fieldDump();
    assertEquals("type = TERMINATED", dump.get(0));
    assertEquals("eventCode = 005", dump.get(1));
    assertEquals("jobIdentifier = 3185.000.000", dump.get(2));
    assertEquals("localTimestamp = 2024-03-14 12:27:39+0000", dump.get(3));
    assertEquals("utcTimestamp = 2024-03-14 12:27:39", dump.get(4));
    assertEquals("term = 1", dump.get(5));
    assertEquals("returnValue = 0", dump.get(6));
    assertEquals("memoryRequest = 1", dump.get(dump.size() - 1));
    assertEquals(5 + event.getFields().size(), dump.size());
  }

  @Test
  public void testHeaderOnlyEvents() {
    JobEvent event = parser.parse(2024, Arrays.asList(
        "028 (3185.000.000) 03/14 12:27:40 Job ad information event triggered.",
        "JobStatus = 4"));
    assertSame(EventType.JOB_AD_INFORMATION, event.getType());
    assertEquals(0, event.getFields().size());
    assertTrue(event.getFields().asMap().isEmpty());
    assertEquals("028 3185.000.000 2024-03-14 12:27:40+0000", event.describe());

    event = parser.parse(2024, Arrays.asList("077 (1.0.0) 01/01 00:00:00 Something new"));
    assertSame(EventType.UNKNOWN, event.getType());
  }

  @Test
  public void testExecuting() {
    JobEvent event = parser.parse(2024, Arrays.asList(
        "001 (3185.000.000) 03/14 12:20:00 Job executing on host: <10.0.0.5:9618?addrs=10.0.0.5-9618&noUDP>"));
    Executing exec = Executing.of(event);
    assertEquals("10.0.0.5:9618?addrs=10.0.0.5-9618&noUDP", exec.getExecutingHost());
    assertEquals("10.0.0.5", exec.getHostAddress());
    assertTrue(event.describe().endsWith(" on=10.0.0.5:9618?addrs=10.0.0.5-9618&noUDP"));
    try {
      Terminated.of(event);
      fail();
    } catch (IllegalArgumentException e) {
      // Expected
    }
  }

  @Test
  public void testHostAddress() {
    assertEquals("10.0.0.5", Executing.hostAddress("10.0.0.5:9618"));
    assertEquals("node5", Executing.hostAddress("node5?sock=startd"));
    assertEquals("node5", Executing.hostAddress("node5"));
    assertNull(Executing.hostAddress(null));
  }

  @Test
  public void testSubmitted() {
    JobEvent event = parser.parse(2024, Arrays.asList(
        "000 (3185.000.000) 03/14 12:00:00 Job submitted from host: <10.0.0.1:9618?sock=schedd>",
        "    DAG Node: analysis"));
    Submitted sub = Submitted.of(event);
    assertEquals("10.0.0.1:9618?sock=schedd", sub.getSubmitHost());
    assertEquals("10.0.0.1", sub.getHostAddress());
  }

  @Test
  public void testImageSize() {
    JobEvent event = parser.parse(2024, Arrays.asList(
        "006 (3185.000.000) 03/14 12:21:00 Image size of job updated: 2048",
        "\t3  -  MemoryUsage of job (MB)"));
    assertEquals(2048, ImageSizeUpdated.of(event).getImageSize());
  }

  @Test
  public void testEvicted() {
    JobEvent event = parser.parse(2024, Arrays.asList(
        "004 (3186.000.000) 03/14 13:00:00 Job was evicted.",
        "\t(0) Job was not checkpointed.",
        "\t\tUsr 0 00:00:20, Sys 0 00:00:01  -  Run Remote Usage",
        "\t\tUsr 0 00:00:00, Sys 0 00:00:00  -  Run Local Usage",
        "\t512  -  Run Bytes Sent By Job",
        "\t256  -  Run Bytes Received By Job"));
    Evicted evicted = Evicted.of(event);
    assertFalse(evicted.wasCheckpointed());
    assertEquals(20, evicted.getUserRunRemoteUsage());
    assertEquals(1, evicted.getSysRunRemoteUsage());
    assertEquals(0, evicted.getUserRunLocalUsage());
    assertEquals(0, evicted.getSysRunLocalUsage());
    assertEquals(512, evicted.getRunBytesSent());
    assertEquals(256, evicted.getRunBytesReceived());
  }

  @Test
  public void testHeld() {
    JobEvent event = parser.parse(2024, Arrays.asList(
        "012 (3187.000.000) 03/14 14:00:00 Job was held.",
        "\tError from slot1@node5: Job has gone over memory limit ",
        "\tCode 34 Subcode 0"));
    assertSame(EventType.HELD, event.getType());
    assertEquals("Error from slot1@node5: Job has gone over memory limit",
        event.getFields().getString("reason"));
    try {
      parser.parse(2024, Arrays.asList("012 (3187.000.000) 03/14 14:00:00 Job was held."));
      fail();
    } catch (InsufficientLinesException e) {
      assertEquals(2, e.getRequired());
    }
  }

  @Test
  public void testAddYear() {
    JobEvent event = parser.parse(2023, terminatedLines());
    event.addYear();
    assertEquals(2024, event.getLocalTimestamp().getYear());
    assertTrue(event.getHeader().isYearAdded());
  }
}
