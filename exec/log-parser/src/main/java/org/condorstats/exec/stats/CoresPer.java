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
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Peak concurrency over a time-ordered sequence of core usage samples.
 * The caller supplies the samples already in time order; they are not
 * sorted here. The peak is computed once, at construction, and the
 * accessors return the stored result.
 *
 * @see CoresPerInterval for building samples from job run intervals
 */
public class CoresPer {

  private final List<CoreUsageSample> values;
  private final CoreUsageSummary summary;

  public CoresPer(List<CoreUsageSample> values) {
    this.values = ImmutableList.copyOf(values);
    this.summary = calculateMax();
  }

  /**
   * Scan the samples once, in order. A count above the current maximum
   * becomes the new maximum and restarts the first-used time; any count
   * equal to the maximum (including the one just set) moves the
   * last-used time. The last-used time therefore includes ties that
   * follow a temporary drop.
   *
   * @return the peak, or {@link CoreUsageSummary#NONE} if there are
   * no samples
   */
  public CoreUsageSummary calculateMax() {
    if (values.isEmpty()) {
      return CoreUsageSummary.NONE;
    }
    int maximumCores = Integer.MIN_VALUE;
    CoreUsageSample first = null;
    CoreUsageSample last = null;
    for (CoreUsageSample sample : values) {
      int cores = sample.getActiveCores();
      if (cores > maximumCores) {
        maximumCores = cores;
        first = sample;
      }
      if (cores == maximumCores) {
        last = sample;
      }
    }
    return new CoreUsageSummary(maximumCores, first.getTimestamp(), last.getTimestamp());
  }

  public List<CoreUsageSample> getValues() { return values; }

  public CoreUsageSummary getSummary() { return summary; }

  public int getMaximumCores() { return summary.getMaximumCores(); }

  public Instant maximumCoresFirstUsed() { return summary.getFirstTimeAtMaximum(); }

  public Instant maximumCoresLastUsed() { return summary.getLastTimeAtMaximum(); }
}
