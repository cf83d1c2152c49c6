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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.List;
import java.util.Map;

import org.condorstats.common.config.StatsConfig;
import org.condorstats.common.config.StatsConfig.ErrorPolicy;
import org.condorstats.common.config.StatsConfigException;
import org.condorstats.common.exceptions.HeaderParseException;
import org.condorstats.common.exceptions.RecordParseException;
import org.condorstats.exec.record.EventParser;
import org.condorstats.exec.record.JobEvent;
import org.condorstats.exec.record.grammar.GrammarTable;
import org.condorstats.exec.stats.CoresPer;
import org.condorstats.exec.stats.CoresPerInterval;
import org.condorstats.exec.stats.JobInterval;
import org.condorstats.exec.stats.JobTimeline;
import org.condorstats.exec.stats.SampleGranularity;

/**
 * Reads HTCondor user logs, parses each event and hands the results to a
 * {@link RecordSink}. Also builds the job timeline from which core usage
 * is summarized once all logs are read.
 * <p>
 * HTCondor logs carry no year. The caller supplies the year the log
 * starts in; when rollover detection is on, an event whose month is
 * earlier than the previous event's month is taken to start the next
 * year: that event gets {@link JobEvent#addYear()} and the events after
 * it are parsed with the new year. The one exception is a first new-year
 * event dated Feb 29, which may not exist in the old year: it is parsed
 * directly with the new year.
 * <p>
 * A line-group that fails to parse is either logged and skipped or
 * rethrown, per the configured {@link ErrorPolicy}. Only the first few
 * skips in each log are logged individually.
 */
public class LogIngestor {

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(LogIngestor.class);

  /**
   * Summary group covering every job.
   */
  public static final String ALL_JOBS = "all";

  private final EventParser parser;
  private final RecordSink sink;
  private final ErrorPolicy errorPolicy;
  private final int maxWarnings;
  private final boolean detectYearRollover;
  private final JobTimeline timeline = new JobTimeline();

  public LogIngestor(EventParser parser, RecordSink sink, ErrorPolicy errorPolicy,
                     int maxWarnings, boolean detectYearRollover) {
    this.parser = parser;
    this.sink = sink;
    this.errorPolicy = errorPolicy;
    this.maxWarnings = maxWarnings;
    this.detectYearRollover = detectYearRollover;
  }

  public static LogIngestor create(StatsConfig config, RecordSink sink) throws StatsConfigException {
    GrammarTable grammars = GrammarTable.load(config.getGrammarResource());
    return new LogIngestor(new EventParser(grammars, config.getTimeZone()), sink,
        config.getErrorPolicy(), config.getMaxWarnings(), config.detectYearRollover());
  }

  public IngestStats ingest(Path path, int year) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return ingest(reader, path.toString(), year);
    }
  }

  /**
   * Ingest one log.
   *
   * @param in the log text; not closed
   * @param source name of the log, for messages
   * @param year the year in which the log's first event falls
   * @throws RecordParseException for the first bad event, if the error
   * policy is {@link ErrorPolicy#FAIL}
   */
  public IngestStats ingest(Reader in, String source, int year) throws IOException {
    BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    LineGroupSplitter splitter = new LineGroupSplitter(reader);
    IngestStats stats = new IngestStats(source);
    int segmentYear = year;
    int prevMonth = 0;
    List<String> group;
    while ((group = splitter.next()) != null) {
      stats.addGroup();
      JobEvent event;
      try {
        event = parse(segmentYear, prevMonth, group);
      } catch (RecordParseException e) {
        e.addContext("Source", source)
         .addContext("Starting line", splitter.groupStartLine());
        if (errorPolicy == ErrorPolicy.FAIL) {
          throw e;
        }
        stats.addSkip();
        if (stats.getSkipCount() <= maxWarnings) {
          logger.warn("Skipping record: {}", e.getMessage());
        }
        continue;
      }
      int month = event.getLocalTimestamp().getMonthValue();
      boolean parsedInNextYear = event.getLocalTimestamp().getYear() > segmentYear;
      if (parsedInNextYear || detectYearRollover && month < prevMonth) {
        if (!parsedInNextYear) {
          event.addYear();
        }
        segmentYear++;
        stats.addRollover();
        logger.info("{}: events from line {} on fall in {}", source, splitter.groupStartLine(), segmentYear);
        month = event.getLocalTimestamp().getMonthValue();
      }
      prevMonth = month;
      sink.accept(event);
      timeline.add(event);
      stats.addEvent(event.getType());
    }
    if (stats.getSkipCount() > maxWarnings) {
      logger.warn("{}: {} more skipped records not logged", source, stats.getSkipCount() - maxWarnings);
    }
    logger.info("Ingested {}", stats);
    return stats;
  }

  /**
   * Parse one line-group in the given year. With rollover detection on,
   * a header whose date is impossible in that year (Feb 29) is parsed
   * again with the next year, and kept if it then falls earlier in the
   * calendar than the previous event.
   */
  private JobEvent parse(int year, int prevMonth, List<String> group) {
    try {
      return parser.parse(year, group);
    } catch (HeaderParseException e) {
      if (!detectYearRollover || prevMonth == 0 || !(e.getCause() instanceof DateTimeException)) {
        throw e;
      }
      JobEvent event;
      try {
        event = parser.parse(year + 1, group);
      } catch (RecordParseException retry) {
        e.addSuppressed(retry);
        throw e;
      }
      if (event.getLocalTimestamp().getMonthValue() >= prevMonth) {
        throw e;
      }
      return event;
    }
  }

  /**
   * Compute peak core usage over all runs ingested so far, overall and
   * per execute host, and pass each summary to the sink.
   *
   * @return the samples and summary for all jobs
   */
  public CoresPer summarize(SampleGranularity granularity) {
    CoresPer all = CoresPerInterval.fromIntervals(timeline.getIntervals(), granularity);
    sink.acceptSummary(ALL_JOBS, all.getSummary());
    for (Map.Entry<String, List<JobInterval>> entry : timeline.intervalsByHost().entrySet()) {
      sink.acceptSummary(entry.getKey(),
          CoresPerInterval.fromIntervals(entry.getValue(), granularity).getSummary());
    }
    if (!timeline.getRunningJobs().isEmpty()) {
      logger.info("{} jobs still running at end of logs", timeline.getRunningJobs().size());
    }
    return all;
  }

  public JobTimeline getTimeline() { return timeline; }
}
