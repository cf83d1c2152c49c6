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

import com.google.common.base.Preconditions;

/**
 * Job started running on an execute host.
 */
public class Executing {

  private final JobEvent event;

  private Executing(JobEvent event) {
    this.event = event;
  }

  public static Executing of(JobEvent event) {
    Preconditions.checkArgument(event.getType() == EventType.EXECUTING,
        "Not an execute event: %s", event);
    return new Executing(event);
  }

  public JobEvent getEvent() { return event; }

  /**
   * @return the host's sinful string without the angle brackets,
   * such as <tt>141.142.225.136:41528?addrs=...</tt>
   */
  public String getExecutingHost() { return event.getFields().getString("executingHost"); }

  /**
   * @return the address part of the executing host, without port or
   * parameters
   */
  public String getHostAddress() {
    return hostAddress(getExecutingHost());
  }

  static String hostAddress(String sinful) {
    if (sinful == null) {
      return null;
    }
    int end = sinful.length();
    int colon = sinful.indexOf(':');
    if (colon >= 0) {
      end = colon;
    }
    int query = sinful.indexOf('?');
    if (query >= 0 && query < end) {
      end = query;
    }
    return sinful.substring(0, end);
  }
}
