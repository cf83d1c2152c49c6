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
 * User and system CPU time, in seconds.
 */
public class UsrSysTimes {

  private final long userSeconds;
  private final long systemSeconds;

  public UsrSysTimes(long userSeconds, long systemSeconds) {
    this.userSeconds = userSeconds;
    this.systemSeconds = systemSeconds;
  }

  public long getUserSeconds() { return userSeconds; }
  public long getSystemSeconds() { return systemSeconds; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) { return true; }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    UsrSysTimes other = (UsrSysTimes) obj;
    return userSeconds == other.userSeconds && systemSeconds == other.systemSeconds;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(userSeconds) * 31 + Long.hashCode(systemSeconds);
  }

  @Override
  public String toString() {
    return "(usr=" + userSeconds + ", sys=" + systemSeconds + ")";
  }
}
