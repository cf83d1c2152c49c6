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

public class UsageRequestAllocated {

  public static final UsageRequestAllocated NONE = new UsageRequestAllocated(0, 0, 0);

  private final long usage;
  private final long request;
  private final long allocated;

  public UsageRequestAllocated(long usage, long request, long allocated) {
    this.usage = usage;
    this.request = request;
    this.allocated = allocated;
  }

  public long getUsage() { return usage; }
  public long getRequest() { return request; }
  public long getAllocated() { return allocated; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) { return true; }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    UsageRequestAllocated other = (UsageRequestAllocated) obj;
    return usage == other.usage && request == other.request && allocated == other.allocated;
  }

  @Override
  public int hashCode() {
    return (Long.hashCode(usage) * 31 + Long.hashCode(request)) * 31 + Long.hashCode(allocated);
  }

  @Override
  public String toString() {
    return "(" + usage + ", " + request + ", " + allocated + ")";
  }
}
