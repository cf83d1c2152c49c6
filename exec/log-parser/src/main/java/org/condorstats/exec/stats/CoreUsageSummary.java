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

/**
 * Peak core usage over a sample sequence: the largest number of cores
 * in use at once, and the first and last sample times at which that
 * many were in use.
 * <p>
 * An empty sample sequence has no peak. Its summary is {@link #NONE}:
 * zero cores and null times, with {@link #hasPeak()} false.
 */
public class CoreUsageSummary {

  public static final CoreUsageSummary NONE = new CoreUsageSummary(0, null, null);

  private final int maximumCores;
  private final Instant firstTimeAtMaximum;
  private final Instant lastTimeAtMaximum;

  public CoreUsageSummary(int maximumCores, Instant firstTimeAtMaximum, Instant lastTimeAtMaximum) {
    this.maximumCores = maximumCores;
    this.firstTimeAtMaximum = firstTimeAtMaximum;
    this.lastTimeAtMaximum = lastTimeAtMaximum;
  }

  public boolean hasPeak() { return firstTimeAtMaximum != null; }
  public int getMaximumCores() { return maximumCores; }
  public Instant getFirstTimeAtMaximum() { return firstTimeAtMaximum; }
  public Instant getLastTimeAtMaximum() { return lastTimeAtMaximum; }

  @Override
  public String toString() {
    if (!hasPeak()) {
      return "CoreUsageSummary [no samples]";
    }
    return "CoreUsageSummary [maximumCores=" + maximumCores +
        ", first=" + firstTimeAtMaximum + ", last=" + lastTimeAtMaximum + "]";
  }
}
