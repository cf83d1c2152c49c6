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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.condorstats.common.exceptions.PatternMismatchException;

import com.google.common.annotations.VisibleForTesting;

/**
 * Pulls named fields out of a single HTCondor log line. Patterns use
 * named capture groups and are searched for anywhere within the line
 * (a pattern need not match the whole line.) All methods are pure
 * functions of their arguments.
 */
public final class FieldExtractor {

  public static final Pattern USAGE_REQUEST =
      Pattern.compile(":\\s+(?<usage>\\d+)\\s+(?<request>\\d+)$");

  /**
   * HTCondor omits the usage column for a resource the job never touched.
   */
  public static final Pattern REQUEST_ONLY =
      Pattern.compile(":\\s+(?<request>\\d+)$");

  public static final Pattern USAGE_REQUEST_ALLOCATED =
      Pattern.compile(":\\s+(?<usage>\\d+)\\s+(?<request>\\d+)\\s+(?<allocated>\\d+)$");

  // The counters ahead of each h:m:s triple are not used.

  public static final Pattern USR_SYS_TIMES =
      Pattern.compile("Usr \\d+ (?<usrHours>\\d+):(?<usrMinutes>\\d+):(?<usrSeconds>\\d+), " +
                      "Sys \\d+ (?<sysHours>\\d+):(?<sysMinutes>\\d+):(?<sysSeconds>\\d+) ");

  private static final Pattern GROUP_NAME = Pattern.compile("(?<!\\\\)\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

  private FieldExtractor() { }

  /**
   * Extract all named groups of a pattern from a line.
   *
   * @return map of group name to matched text, in the order the groups
   * appear in the pattern. A group that did not take part in the match
   * maps to null.
   * @throws PatternMismatchException if the pattern is not found in the line
   */
  public static Map<String, String> extractValues(Pattern pattern, String line) {
    Matcher m = pattern.matcher(line);
    if (!m.find()) {
      throw new PatternMismatchException(pattern, line);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : groupNames(pattern)) {
      values.put(name, m.group(name));
    }
    return values;
  }

  public static String extract(Pattern pattern, String line, String name) {
    Matcher m = pattern.matcher(line);
    if (!m.find()) {
      throw new PatternMismatchException(pattern, line);
    }
    return m.group(name);
  }

  public static String[] extractPair(Pattern pattern, String line, String name1, String name2) {
    Matcher m = pattern.matcher(line);
    if (!m.find()) {
      throw new PatternMismatchException(pattern, line);
    }
    return new String[] {m.group(name1), m.group(name2)};
  }

  /**
   * Extract a trailing <code>: usage request</code> pair. If only a
   * request is present, usage is reported as 0 and
   * {@link UsageRequest#hasUsage()} is false.
   *
   * @throws PatternMismatchException if neither form is present
   */
  public static UsageRequest extractUsageRequest(String line) {
    String input = line.trim();
    Matcher m = USAGE_REQUEST.matcher(input);
    if (m.find()) {
      return new UsageRequest(
          parseNumber(USAGE_REQUEST, input, m.group("usage")),
          parseNumber(USAGE_REQUEST, input, m.group("request")));
    }
    String request = extract(REQUEST_ONLY, input, "request");
    return UsageRequest.requestOnly(parseNumber(REQUEST_ONLY, input, request));
  }

  /**
   * Extract a trailing <code>: usage request allocated</code> triple.
   * Unlike {@link #extractUsageRequest(String)} there is no fallback:
   * a line without all three values yields all zeros.
   */
  public static UsageRequestAllocated extractUsageRequestAllocated(String line) {
    String input = line.trim();
    Matcher m = USAGE_REQUEST_ALLOCATED.matcher(input);
    if (!m.find()) {
      return UsageRequestAllocated.NONE;
    }
    return new UsageRequestAllocated(
        parseNumber(USAGE_REQUEST_ALLOCATED, input, m.group("usage")),
        parseNumber(USAGE_REQUEST_ALLOCATED, input, m.group("request")),
        parseNumber(USAGE_REQUEST_ALLOCATED, input, m.group("allocated")));
  }

  /**
   * Extract the user and system times from a
   * <code>Usr n hh:mm:ss, Sys n hh:mm:ss </code> line, each converted
   * to seconds.
   */
  public static UsrSysTimes extractUsrSysTimes(String line) {
    Map<String, String> values = extractValues(USR_SYS_TIMES, line);
    long usr = toSeconds(
        parseNumber(USR_SYS_TIMES, line, values.get("usrHours")),
        parseNumber(USR_SYS_TIMES, line, values.get("usrMinutes")),
        parseNumber(USR_SYS_TIMES, line, values.get("usrSeconds")));
    long sys = toSeconds(
        parseNumber(USR_SYS_TIMES, line, values.get("sysHours")),
        parseNumber(USR_SYS_TIMES, line, values.get("sysMinutes")),
        parseNumber(USR_SYS_TIMES, line, values.get("sysSeconds")));
    return new UsrSysTimes(usr, sys);
  }

  public static long toSeconds(long hours, long minutes, long seconds) {
    return hours * 3600 + minutes * 60 + seconds;
  }

  /**
   * Convert a matched digit string to a number. A digit run too long for
   * a long is reported as a mismatch of the pattern that captured it.
   */
  public static long parseNumber(Pattern pattern, String line, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw (PatternMismatchException) new PatternMismatchException(pattern.pattern(), line, e)
          .addContext("Value", value);
    }
  }

  /**
   * Names of the named capture groups declared by a pattern, in
   * declaration order.
   */
  @VisibleForTesting
  public static List<String> groupNames(Pattern pattern) {
    List<String> names = new ArrayList<>();
    Matcher m = GROUP_NAME.matcher(pattern.pattern());
    while (m.find()) {
      names.add(m.group(1));
    }
    return names;
  }
}
