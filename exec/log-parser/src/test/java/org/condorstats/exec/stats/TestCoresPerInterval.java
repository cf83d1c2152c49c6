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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class TestCoresPerInterval {

  private static Instant at(String time) {
    return Instant.parse("2024-03-14T" + time + "Z");
  }

  private static JobInterval run(String job, String start, String end) {
    return new JobInterval(job, "10.0.0.5", at(start), at(end));
  }

  private static int[] counts(List<CoreUsageSample> samples) {
    int[] counts = new int[samples.size()];
    for (int i = 0; i < counts.length; i++) {
      counts[i] = samples.get(i).getActiveCores();
    }
    return counts;
  }

  @Test
  public void testEmpty() {
    CoresPer cores = CoresPerInterval.fromIntervals(Collections.<JobInterval>emptyList(), SampleGranularity.SECOND);
    assertTrue(cores.getValues().isEmpty());
    assertFalse(cores.getSummary().hasPeak());
  }

  @Test
  public void testOverlap() {
    CoresPer cores = CoresPerInterval.fromIntervals(Arrays.asList(
        run("1.0.0", "10:00:00", "10:00:05"),
        run("2.0.0", "10:00:03", "10:00:08")), SampleGranularity.SECOND);
    List<CoreUsageSample> samples = cores.getValues();
    assertEquals(at("10:00:00"), samples.get(0).getTimestamp());
    assertEquals(at("10:00:08"), samples.get(samples.size() - 1).getTimestamp());
    assertTrue(Arrays.equals(new int[] {1, 1, 2, 2, 1, 1, 0}, counts(samples)));
    assertEquals(2, cores.getMaximumCores());
    assertEquals(at("10:00:03"), cores.maximumCoresFirstUsed());
    assertEquals(at("10:00:04"), cores.maximumCoresLastUsed());
  }

  @Test
  public void testBackToBack() {
    CoresPer cores = CoresPerInterval.fromIntervals(Arrays.asList(
        run("1.0.0", "10:00:00", "10:00:02"),
        run("2.0.0", "10:00:02", "10:00:04")), SampleGranularity.SECOND);
    assertTrue(Arrays.equals(new int[] {1, 1, 0}, counts(cores.getValues())));
    assertEquals(1, cores.getMaximumCores());
    assertEquals(at("10:00:03"), cores.maximumCoresLastUsed());
  }

  @Test
  public void testInstantRun() {
    Instant when = at("10:00:00").plusMillis(500);
    CoresPer cores = CoresPerInterval.fromIntervals(Arrays.asList(
        new JobInterval("1.0.0", null, when, when)), SampleGranularity.SECOND);
    assertTrue(Arrays.equals(new int[] {1, 0}, counts(cores.getValues())));
    assertEquals(at("10:00:00"), cores.maximumCoresFirstUsed());
  }

  @Test
  public void testMinutes() {
    List<CoreUsageSample> samples = CoresPerInterval.samples(Arrays.asList(
        run("1.0.0", "10:00:30", "10:02:10"),
        run("2.0.0", "10:01:59", "10:03:00")), SampleGranularity.MINUTE);
    assertEquals(4, samples.size());
    assertEquals(at("10:00:00"), samples.get(0).getTimestamp());
    assertEquals(at("10:01:00"), samples.get(1).getTimestamp());
    assertTrue(Arrays.equals(new int[] {1, 2, 1, 0}, counts(samples)));
  }

  @Test
  public void testLongRun() {
    Instant start = at("10:00:00");
    Instant end = start.plus(30, ChronoUnit.DAYS);
    CoresPer cores = CoresPerInterval.fromIntervals(Arrays.asList(
        new JobInterval("1.0.0", "10.0.0.5", start, end)), SampleGranularity.SECOND);
    List<CoreUsageSample> samples = cores.getValues();
    assertTrue(Arrays.equals(new int[] {1, 1, 0}, counts(samples)));
    assertEquals(end.minusSeconds(1), samples.get(1).getTimestamp());
    assertEquals(end, samples.get(2).getTimestamp());
    assertEquals(start, cores.maximumCoresFirstUsed());
    assertEquals(end.minusSeconds(1), cores.maximumCoresLastUsed());
  }

  @Test
  public void testPeakAfterDrop() {

    // Starts and ends that cancel within a bucket leave no sample.

    List<CoreUsageSample> samples = CoresPerInterval.samples(Arrays.asList(
        run("1.0.0", "10:00:00", "10:00:10"),
        run("2.0.0", "10:00:02", "10:00:04"),
        run("3.0.0", "10:00:04", "10:00:06"),
        run("4.0.0", "10:00:20", "10:00:30")), SampleGranularity.SECOND);
    assertEquals(at("10:00:00"), samples.get(0).getTimestamp());
    assertTrue(Arrays.equals(new int[] {1, 1, 2, 2, 1, 1, 0, 0, 1, 1, 0}, counts(samples)));
    CoresPer cores = new CoresPer(samples);
    assertEquals(2, cores.getMaximumCores());
    assertEquals(at("10:00:02"), cores.maximumCoresFirstUsed());
    assertEquals(at("10:00:05"), cores.maximumCoresLastUsed());
  }

  @Test
  public void testGranularityNames() {
    assertEquals(SampleGranularity.MINUTE, SampleGranularity.toEnum("Minute"));
    assertEquals("second", SampleGranularity.SECOND.toValue());
    assertEquals(null, SampleGranularity.toEnum("hour"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEndBeforeStart() {
    run("1.0.0", "10:00:05", "10:00:00");
  }
}
