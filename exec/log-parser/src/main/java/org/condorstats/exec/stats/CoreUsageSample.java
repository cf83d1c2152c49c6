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
 * Number of cores in use at one point in time.
 */
public class CoreUsageSample {

  private final Instant timestamp;
  private final int activeCores;

  public CoreUsageSample(Instant timestamp, int activeCores) {
    this.timestamp = timestamp;
    this.activeCores = activeCores;
  }

  public Instant getTimestamp() { return timestamp; }
  public int getActiveCores() { return activeCores; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) { return true; }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    CoreUsageSample other = (CoreUsageSample) obj;
    return activeCores == other.activeCores && timestamp.equals(other.timestamp);
  }

  @Override
  public int hashCode() {
    return timestamp.hashCode() * 31 + activeCores;
  }

  @Override
  public String toString() {
    return "(" + timestamp + ", " + activeCores + ")";
  }
}
