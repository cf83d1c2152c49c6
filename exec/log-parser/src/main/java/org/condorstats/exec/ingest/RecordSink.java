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
package org.condorstats.exec.ingest;

import org.condorstats.exec.record.JobEvent;
import org.condorstats.exec.stats.CoreUsageSummary;

/**
 * Receives what ingestion produces: each parsed event, and core usage
 * summaries for the groupings the caller asks for. Storage is up to the
 * implementation.
 */
public interface RecordSink {

  void accept(JobEvent event);

  /**
   * @param group name of the grouping summarized, such as an execute
   * host or {@link LogIngestor#ALL_JOBS}
   */
  void acceptSummary(String group, CoreUsageSummary summary);
}
