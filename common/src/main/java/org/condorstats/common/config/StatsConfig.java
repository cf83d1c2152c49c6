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
package org.condorstats.common.config;

import java.net.URL;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValue;

/**
 * Configuration used by the log ingestion and statistics code.
 * Refers to configuration in the user configuration file
 * (condor-stats.conf), the defaults file or overridden
 * by system properties.
 */
public class StatsConfig {

  public static final String DEFAULTS_FILE_NAME = "condor-stats-defaults.conf";
  public static final String CONFIG_FILE_NAME = "condor-stats.conf";

  public static final String STATS_PARENT = "condor.stats";
  public static final String INGEST_PARENT = append(STATS_PARENT, "ingest");
  public static final String CORES_PARENT = append(STATS_PARENT, "cores");
  public static final String GRAMMAR_PARENT = append(STATS_PARENT, "grammar");

  /**
   * Time zone in which the log writer recorded its (year-less) timestamps.
   * Empty means the time zone of this JVM.
   */
  public static final String TIME_ZONE = append(STATS_PARENT, "time-zone");

  public static final String ERROR_POLICY = append(INGEST_PARENT, "error-policy");
  public static final String MAX_WARNINGS = append(INGEST_PARENT, "max-warnings");
  public static final String DETECT_YEAR_ROLLOVER = append(INGEST_PARENT, "detect-year-rollover");

  public static final String CORES_GRANULARITY = append(CORES_PARENT, "granularity");

  public static final String GRAMMAR_RESOURCE = append(GRAMMAR_PARENT, "resource");

  /**
   * What the ingestor does with a line-group that fails to parse.
   */
  public enum ErrorPolicy {

    /**
     * Log the failure and continue with the next line-group.
     */
    SKIP("skip"),

    /**
     * Rethrow the failure, ending the ingestion run.
     */
    FAIL("fail");

    private final String value;

    private ErrorPolicy(String value) {
      this.value = value;
    }

    public static ErrorPolicy toEnum(String value) {
      for (ErrorPolicy policy : ErrorPolicy.values()) {
        if (policy.value.equalsIgnoreCase(value)) {
          return policy;
        }
      }
      return null;
    }

    public String toValue() { return value; }
  }

  private final Config config;

  public static String append(String parent, String key) {
    return parent + "." + key;
  }

  private StatsConfig(Config config) {
    this.config = config;
  }

  public static StatsConfig load() throws StatsConfigException {
    return load(ConfigFactory.empty());
  }

  /**
   * Load the configuration, applying the given overrides on top of
   * everything else.
   */
  public static StatsConfig load(Config overrides) throws StatsConfigException {

    // Resolution order, larger numbers take precedence.
    // 1. Defaults, at the root of the class path.

    URL url = StatsConfig.class.getClassLoader().getResource(DEFAULTS_FILE_NAME);
    if (url == null) {
      throw new StatsConfigException("Defaults file is missing from the class path: " + DEFAULTS_FILE_NAME);
    }
    Config config;
    try {
      config = ConfigFactory.parseURL(url);

      // 2. User's configuration, if any.
      // 3. System properties.

      config = ConfigFactory.load(CONFIG_FILE_NAME).withFallback(config);

      // 4. Explicit overrides (from the command line.)

      config = overrides.withFallback(config).resolve();
    } catch (ConfigException e) {
      throw new StatsConfigException("Invalid configuration: " + e.getMessage(), e);
    }
    StatsConfig statsConfig = new StatsConfig(config);
    statsConfig.validate();
    return statsConfig;
  }

  private void validate() throws StatsConfigException {
    getTimeZone();
    getErrorPolicy();
    if (getMaxWarnings() < 0) {
      throw new StatsConfigException(MAX_WARNINGS + " must not be negative");
    }
  }

  public Config getConfig() { return config; }

  public ZoneId getTimeZone() throws StatsConfigException {
    String zone = config.getString(TIME_ZONE);
    if (Strings.isNullOrEmpty(zone)) {
      return ZoneId.systemDefault();
    }
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw new StatsConfigException(TIME_ZONE + " is not a valid time zone: " + zone, e);
    }
  }

  public ErrorPolicy getErrorPolicy() throws StatsConfigException {
    String value = config.getString(ERROR_POLICY);
    ErrorPolicy policy = ErrorPolicy.toEnum(value);
    if (policy == null) {
      throw new StatsConfigException(ERROR_POLICY + " must be skip or fail, not: " + value);
    }
    return policy;
  }

  public int getMaxWarnings() {
    return config.getInt(MAX_WARNINGS);
  }

  public boolean detectYearRollover() {
    return config.getBoolean(DETECT_YEAR_ROLLOVER);
  }

  public String getGranularity() {
    return config.getString(CORES_GRANULARITY);
  }

  public String getGrammarResource() {
    return config.getString(GRAMMAR_RESOURCE);
  }

  /**
   * Render the effective settings under the <tt>condor.stats</tt> prefix,
   * one per line, to help diagnose configuration problems.
   */
  public String dump() {
    StringBuilder buf = new StringBuilder();
    for (Map.Entry<String, ConfigValue> entry : config.getConfig(STATS_PARENT).entrySet()) {
      buf.append(append(STATS_PARENT, entry.getKey()))
         .append(" = ")
         .append(entry.getValue().render(ConfigRenderOptions.concise()))
         .append("\n");
    }
    return buf.toString();
  }
}
