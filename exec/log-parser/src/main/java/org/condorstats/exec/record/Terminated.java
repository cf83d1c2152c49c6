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
 * Job terminated: the job completed normally. Carries the job's exit
 * value, CPU usage for the last run and for the whole job, bytes
 * transferred, and disk and memory usage against the request.
 */
public class Terminated {

  private final JobEvent event;
  private final EventFields fields;

  private Terminated(JobEvent event) {
    this.event = event;
    this.fields = event.getFields();
  }

  public static Terminated of(JobEvent event) {
    Preconditions.checkArgument(event.getType() == EventType.TERMINATED,
        "Not a termination event: %s", event);
    return new Terminated(event);
  }

  public JobEvent getEvent() { return event; }

  public long getTerm() { return fields.getLong("term"); }
  public long getReturnValue() { return fields.getLong("returnValue"); }

  public long getUserRunRemoteUsage() { return fields.getLong("userRunRemoteUsage"); }
  public long getSysRunRemoteUsage() { return fields.getLong("sysRunRemoteUsage"); }
  public long getUserRunLocalUsage() { return fields.getLong("userRunLocalUsage"); }
  public long getSysRunLocalUsage() { return fields.getLong("sysRunLocalUsage"); }
  public long getUserTotalRemoteUsage() { return fields.getLong("userTotalRemoteUsage"); }
  public long getSysTotalRemoteUsage() { return fields.getLong("sysTotalRemoteUsage"); }
  public long getUserTotalLocalUsage() { return fields.getLong("userTotalLocalUsage"); }
  public long getSysTotalLocalUsage() { return fields.getLong("sysTotalLocalUsage"); }

  public long getRunBytesSent() { return fields.getLong("runBytesSent"); }
  public long getRunBytesReceived() { return fields.getLong("runBytesReceived"); }
  public long getTotalBytesSent() { return fields.getLong("totalBytesSent"); }
  public long getTotalBytesReceived() { return fields.getLong("totalBytesReceived"); }

  /**
   * @return disk used in KB, or 0 if the log did not report usage
   */
  public long getDiskUsage() { return fields.getLong("diskUsage", 0); }
  public long getDiskRequest() { return fields.getLong("diskRequest"); }

  public boolean hasMemoryUsage() { return fields.has("memoryUsage"); }

  /**
   * @return memory used in MB, or null if the log did not report usage
   */
  public Long getMemoryUsage() { return hasMemoryUsage() ? fields.getLong("memoryUsage") : null; }

  /**
   * @return memory usage as text: the number, or <tt>-</tt> when absent
   */
  public String getMemoryUsageText() { return event.fieldText("memoryUsage"); }
  public long getMemoryRequest() { return fields.getLong("memoryRequest"); }

  public String describe() { return event.describe(); }
}
