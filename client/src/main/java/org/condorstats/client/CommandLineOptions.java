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

import java.time.Year;
import java.util.ArrayList;
import java.util.List;

import org.condorstats.exec.stats.SampleGranularity;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Condor stats command line options.
 * <p><pre>
 * condor-stats -h|--help |
 *              -f|--file log... [log...]
 *              [-y|--year year] [-o|--output file]
 *              [--granularity second|minute] [-v|--verbose]
 * </pre></p>
 * <ul>
 * <li>--file: HTCondor user logs to read, in order</li>
 * <li>--year: year in which the first event of each log falls;
 * defaults to the current year</li>
 * <li>--output: file for the JSON report; standard output if omitted</li>
 * <li>--granularity: bucket size for core usage samples</li>
 * <li>--verbose: print the effective configuration and each event</li>
 * </ul>
 */
public class CommandLineOptions {
  @Parameter(names = {"-h", "-?", "--help"}, help = true, description = "Provide description of usage.")
  private boolean help = false;

  @Parameter(names = {"-f", "--file"}, variableArity = true, description = "HTCondor user logs to ingest.")
  private List<String> files = new ArrayList<>();

  @Parameter(names = {"-y", "--year"}, description = "Year of the first event in each log.")
  private Integer year;

  @Parameter(names = {"-o", "--output"}, description = "Report file. Standard output if omitted.")
  private String output;

  @Parameter(names = {"--granularity"}, description = "Core usage sample size: second or minute.")
  private String granularity;

  @Parameter(names = {"-v", "--verbose"}, description = "Verbose output.")
  public boolean verbose = false;

  @Parameter(description = "Additional log files.")
  private List<String> extraFiles = new ArrayList<>();

  public static enum Command {
    ERROR, HELP, INGEST
  }

  Command command;

  private JCommander parser;

  /**
   * Parse the command line. Invalid options or values result in the
   * error command being set.
   */
  public void parse(String argv[]) {
    parser = JCommander.newBuilder()
        .addObject(this)
        .programName("condor-stats")
        .build();
    try {
      parser.parse(argv);
      validate();
    } catch (ParameterException e) {
      command = Command.ERROR;
    }
  }

  private void validate() {
    if (help) {
      command = Command.HELP;
      return;
    }
    files.addAll(extraFiles);
    if (files.isEmpty()) {
      command = Command.ERROR;
      return;
    }
    if (year != null && (year < 1 || year > 9999)) {
      command = Command.ERROR;
      return;
    }
    if (granularity != null && SampleGranularity.toEnum(granularity) == null) {
      command = Command.ERROR;
      return;
    }
    command = Command.INGEST;
  }

  public Command getCommand() {
    return command;
  }

  public List<String> getFiles() {
    return files;
  }

  public int getYear() {
    return year == null ? Year.now().getValue() : year;
  }

  public String getOutput() {
    return output;
  }

  /**
   * @return the granularity given on the command line, or null to use
   * the configured one
   */
  public SampleGranularity getGranularity() {
    return granularity == null ? null : SampleGranularity.toEnum(granularity);
  }

  public void usage() {
    parser.usage();
  }
}
