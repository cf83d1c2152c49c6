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

import com.google.common.base.Preconditions;

/**
 * One run of a job on an execute slot, from the execute event to the
 * event that ended the run.
 */
public class JobInterval {

  private final String jobIdentifier;
  private final String host;
  private final Instant start;
  private final Instant end;

  public JobInterval(String jobIdentifier, String host, Instant start, Instant end) {
    Preconditions.checkArgument(!end.isBefore(start),
        "Job %s ends (%s) before it starts (%s)", jobIdentifier, end, start);
    this.jobIdentifier = jobIdentifier;
    this.host = host;
    this.start = start;
    this.end = end;
  }

  public String getJobIdentifier() { return jobIdentifier; }

  /**
   * @return address of the execute host, or null if the log did not
   * name one
   */
  public String getHost() { return host; }
  public Instant getStart() { return start; }
  public Instant getEnd() { return end; }

  @Override
  public String toString() {
    return "JobInterval [" + jobIdentifier + " on " + host + ": " + start + " - " + end + "]";
  }
}
