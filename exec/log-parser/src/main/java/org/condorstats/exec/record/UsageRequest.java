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

/**
 * A resource usage/request pair, as reported in the partitionable
 * resources table of a termination event.
 */
public class UsageRequest {

  private final long usage;
  private final long request;
  private final boolean hasUsage;

  public UsageRequest(long usage, long request) {
    this(usage, request, true);
  }

  private UsageRequest(long usage, long request, boolean hasUsage) {
    this.usage = usage;
    this.request = request;
    this.hasUsage = hasUsage;
  }

  public static UsageRequest requestOnly(long request) {
    return new UsageRequest(0, request, false);
  }

  /**
   * @return the amount used, or 0 if the log line omitted it
   */
  public long getUsage() { return usage; }
  public long getRequest() { return request; }
  public boolean hasUsage() { return hasUsage; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) { return true; }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    UsageRequest other = (UsageRequest) obj;
    return usage == other.usage && request == other.request && hasUsage == other.hasUsage;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(usage) * 31 + Long.hashCode(request);
  }

  @Override
  public String toString() {
    return "(" + (hasUsage ? Long.toString(usage) : "-") + ", " + request + ")";
  }
}
