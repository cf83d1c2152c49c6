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

import java.util.HashMap;
import java.util.Map;

/**
 * The HTCondor user log event codes. Codes not listed here map to
 * {@link #UNKNOWN}.
 */
public enum EventType {
  SUBMITTED(0, "Job submitted"),
  EXECUTING(1, "Job executing"),
  EXECUTABLE_ERROR(2, "Error in executable"),
  CHECKPOINTED(3, "Job checkpointed"),
  EVICTED(4, "Job evicted"),
  TERMINATED(5, "Job terminated"),
  IMAGE_SIZE_UPDATED(6, "Image size updated"),
  SHADOW_EXCEPTION(7, "Shadow exception"),
  GENERIC(8, "Generic event"),
  ABORTED(9, "Job aborted"),
  SUSPENDED(10, "Job suspended"),
  UNSUSPENDED(11, "Job unsuspended"),
  HELD(12, "Job held"),
  RELEASED(13, "Job released"),
  NODE_EXECUTING(14, "Parallel node executing"),
  NODE_TERMINATED(15, "Parallel node terminated"),
  POST_SCRIPT_TERMINATED(16, "POST script terminated"),
  GLOBUS_SUBMIT(17, "Job submitted to Globus"),
  GLOBUS_SUBMIT_FAILED(18, "Globus submit failed"),
  GLOBUS_RESOURCE_UP(19, "Globus resource up"),
  GLOBUS_RESOURCE_DOWN(20, "Globus resource down"),
  REMOTE_ERROR(21, "Remote error"),
  DISCONNECTED(22, "Job disconnected"),
  RECONNECTED(23, "Job reconnected"),
  RECONNECT_FAILED(24, "Job reconnect failed"),
  GRID_RESOURCE_UP(25, "Grid resource up"),
  GRID_RESOURCE_DOWN(26, "Grid resource down"),
  GRID_SUBMIT(27, "Job submitted to grid resource"),
  JOB_AD_INFORMATION(28, "Job ad information"),
  STATUS_UNKNOWN(29, "Job status unknown"),
  STATUS_KNOWN(30, "Job status known"),
  STAGE_IN(31, "Job stage in"),
  STAGE_OUT(32, "Job stage out"),
  ATTRIBUTE_UPDATE(33, "Job attribute update"),
  UNKNOWN(-1, "Unknown event");

  private static final Map<Integer, EventType> BY_CODE = new HashMap<>();

  static {
    for (EventType type : values()) {
      BY_CODE.put(type.code, type);
    }
  }

  private final int code;
  private final String description;

  private EventType(int code, String description) {
    this.code = code;
    this.description = description;
  }

  public static EventType forCode(int code) {
    EventType type = BY_CODE.get(code);
    return type == null ? UNKNOWN : type;
  }

  public int code() { return code; }
  public String description() { return description; }

  /**
   * @return true if the job starts running on an execute slot
   * with this event
   */
  public boolean startsExecution() {
    return this == EXECUTING;
  }

  /**
   * @return true if a running job gives up its slot with this event
   */
  public boolean endsExecution() {
    switch (this) {
    case TERMINATED:
    case EVICTED:
    case ABORTED:
    case HELD:
    case SHADOW_EXCEPTION:
      return true;
    default:
      return false;
    }
  }
}
