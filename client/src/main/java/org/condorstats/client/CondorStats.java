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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.condorstats.client.CommandLineOptions.Command;
import org.condorstats.common.config.StatsConfig;
import org.condorstats.common.config.StatsConfigException;
import org.condorstats.common.exceptions.RecordParseException;
import org.condorstats.exec.ingest.LogIngestor;
import org.condorstats.exec.stats.SampleGranularity;

/**
 * Command line entry point: ingests the given HTCondor user logs and
 * writes a JSON report of what was read and of peak core usage.
 * <p>
 * Exit codes: 0 on success, -1 for bad options or configuration, 1 when
 * the run itself fails.
 */
public class CondorStats {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CondorStats.class);

  private final CommandLineOptions opts;
  private final StatsConfig config;

  public CondorStats(CommandLineOptions opts, StatsConfig config) {
    this.opts = opts;
    this.config = config;
  }

  public StatsReport run() throws ClientException {
    SampleGranularity granularity = opts.getGranularity();
    if (granularity == null) {
      granularity = SampleGranularity.toEnum(config.getGranularity());
      if (granularity == null) {
        throw new ClientException("Invalid value for " + StatsConfig.CORES_GRANULARITY +
            ": " + config.getGranularity());
      }
    }
    int year = opts.getYear();
    StatsReport report;
    LogIngestor ingestor;
    try {
      report = new StatsReport(year, config.getTimeZone().getId(), granularity.toValue());
      ingestor = LogIngestor.create(config, new ReportSink(report, opts.verbose));
    } catch (StatsConfigException e) {
      throw new ClientException(e.getMessage(), e);
    }
    for (String file : opts.getFiles()) {
      Path path = Paths.get(file);
      if (!Files.isRegularFile(path)) {
        logger.warn("Log file not found, skipping: {}", file);
        report.addMissingFile(file);
        continue;
      }
      try {
        report.addFile(ingestor.ingest(path, year));
      } catch (IOException e) {
        throw new ClientException("Cannot read log file " + file + ": " + e.getMessage(), e);
      } catch (RecordParseException e) {
        throw new ClientException("Failed to parse " + file + ": " + e.getMessage(), e);
      }
    }
    ingestor.summarize(granularity);
    return report;
  }

  public static void main(String argv[]) {
    CommandLineOptions opts = new CommandLineOptions();
    opts.parse(argv);
    if (opts.getCommand() == Command.ERROR) {
      opts.usage();
      System.exit(-1);
    }
    if (opts.getCommand() == Command.HELP) {
      opts.usage();
      return;
    }

    StatsConfig config;
    try {
      config = StatsConfig.load();
    } catch (StatsConfigException e) {
      System.err.println(e.getMessage());
      System.exit(-1);
      return;
    }

    if (opts.verbose) {
      System.err.println("----------------------------------------------");
      System.err.println("Effective Condor Stats Configuration");
      System.err.println(config.dump());
      System.err.println("----------------------------------------------");
    }

    try {
      StatsReport report = new CondorStats(opts, config).run();
      new ReportWriter().write(report, opts.getOutput());
    } catch (ClientException e) {
      System.err.println(e.getMessage());
      System.exit(1);
    }
  }
}
