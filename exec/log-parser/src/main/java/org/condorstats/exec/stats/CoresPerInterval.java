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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds core usage samples from job run intervals at second or minute
 * granularity, each counting the jobs running during that bucket. Each
 * running job holds one core.
 * <p>
 * Samples are taken only where the count changes: one for the bucket
 * in which it changes and one for the last bucket before the next
 * change. A month-long run at second granularity thus yields a few
 * samples, not millions, with the same peak and peak times as a sample
 * for every bucket would give.
 * <p>
 * Times are truncated to the bucket size. A run occupies the buckets
 * from its start bucket up to, but not including, its end bucket, so
 * a slot handed from one job to the next within a bucket is not
 * counted twice. A run shorter than one bucket still occupies its
 * start bucket.
 */
public final class CoresPerInterval {

  private CoresPerInterval() { }

  public static CoresPer fromIntervals(Collection<JobInterval> intervals, SampleGranularity granularity) {
    return new CoresPer(samples(intervals, granularity));
  }

  public static List<CoreUsageSample> samples(Collection<JobInterval> intervals, SampleGranularity granularity) {
    List<CoreUsageSample> samples = new ArrayList<>();
    if (intervals.isEmpty()) {
      return samples;
    }
    ChronoUnit unit = granularity.unit();

    // Change in running jobs at each bucket where some run starts or ends.

    TreeMap<Instant, Integer> deltas = new TreeMap<>();
    for (JobInterval interval : intervals) {
      Instant start = interval.getStart().truncatedTo(unit);
      Instant end = interval.getEnd().truncatedTo(unit);
      if (!end.isAfter(start)) {
        end = start.plus(1, unit);
      }
      deltas.merge(start, 1, Integer::sum);
      deltas.merge(end, -1, Integer::sum);
    }
    deltas.values().removeIf(delta -> delta == 0);

    // The count holds until the next change point; the last bucket
    // before it gets its own sample so that the peak's last-used time
    // is exact.

    int active = 0;
    for (Map.Entry<Instant, Integer> entry : deltas.entrySet()) {
      active += entry.getValue();
      samples.add(new CoreUsageSample(entry.getKey(), active));
      Instant next = deltas.higherKey(entry.getKey());
      if (next != null) {
        Instant lastHeld = next.minus(1, unit);
        if (lastHeld.isAfter(entry.getKey())) {
          samples.add(new CoreUsageSample(lastHeld, active));
        }
      }
    }
    return samples;
  }
}
