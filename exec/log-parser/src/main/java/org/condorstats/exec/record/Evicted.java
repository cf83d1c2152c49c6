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
 * Job evicted from its execute slot before completing.
 */
public class Evicted {

  private final JobEvent event;
  private final EventFields fields;

  private Evicted(JobEvent event) {
    this.event = event;
    this.fields = event.getFields();
  }

  public static Evicted of(JobEvent event) {
    Preconditions.checkArgument(event.getType() == EventType.EVICTED,
        "Not an eviction event: %s", event);
    return new Evicted(event);
  }

  public JobEvent getEvent() { return event; }

  /**
   * @return true if HTCondor checkpointed the job before evicting it
   */
  public boolean wasCheckpointed() { return fields.getLong("checkpointFlag") != 0; }

  public long getUserRunRemoteUsage() { return fields.getLong("userRunRemoteUsage"); }
  public long getSysRunRemoteUsage() { return fields.getLong("sysRunRemoteUsage"); }
  public long getUserRunLocalUsage() { return fields.getLong("userRunLocalUsage"); }
  public long getSysRunLocalUsage() { return fields.getLong("sysRunLocalUsage"); }
  public long getRunBytesSent() { return fields.getLong("runBytesSent"); }
  public long getRunBytesReceived() { return fields.getLong("runBytesReceived"); }
}
