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
package org.condorstats.client;

import org.condorstats.exec.ingest.RecordSink;
import org.condorstats.exec.record.JobEvent;
import org.condorstats.exec.stats.CoreUsageSummary;

/**
 * Feeds core usage summaries into the report. Events are not kept; in
 * verbose mode each is logged as it arrives.
 */
public class ReportSink implements RecordSink {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ReportSink.class);

  private final StatsReport report;
  private final boolean verbose;

  public ReportSink(StatsReport report, boolean verbose) {
    this.report = report;
    this.verbose = verbose;
  }

  @Override
  public void accept(JobEvent event) {
    if (verbose) {
      logger.info(event.describe());
    }
  }

  @Override
  public void acceptSummary(String group, CoreUsageSummary summary) {
    logger.debug("{}: {}", group, summary);
    report.addCoreUsage(group, summary);
  }
}
