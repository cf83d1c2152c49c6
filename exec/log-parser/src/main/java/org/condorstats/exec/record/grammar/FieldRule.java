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
package org.condorstats.exec.record.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.condorstats.common.config.StatsConfigException;
import org.condorstats.common.exceptions.PatternMismatchException;
import org.condorstats.exec.record.EventFields;
import org.condorstats.exec.record.FieldExtractor;
import org.condorstats.exec.record.UsageRequest;
import org.condorstats.exec.record.UsageRequestAllocated;
import org.condorstats.exec.record.UsrSysTimes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * One entry of an event grammar: extract a set of named fields from the
 * line at a fixed offset within the event's line-group. For example,
 * the bytes-sent line of a termination event:
 * <pre><code>
 * { "line": 6, "kind": "NAMED", "pattern": "(?&lt;runBytesSent&gt;\\d+) ",
 *   "fields": [ "runBytesSent" ], "types": [ "LONG" ] }
 * </code></pre>
 */
public class FieldRule {

  private final int line;
  private final FieldKind kind;
  private final String pattern;
  private final List<String> fields;
  private final List<FieldType> types;
  private Pattern compiled;

  @JsonCreator
  public FieldRule(@JsonProperty("line") int line,
                   @JsonProperty("kind") FieldKind kind,
                   @JsonProperty("pattern") String pattern,
                   @JsonProperty("fields") List<String> fields,
                   @JsonProperty("types") List<FieldType> types) {
    this.line = line;
    this.kind = kind == null ? FieldKind.NAMED : kind;
    this.pattern = pattern;
    this.fields = fields == null ? ImmutableList.<String>of() : ImmutableList.copyOf(fields);
    this.types = types == null ? ImmutableList.<FieldType>of() : ImmutableList.copyOf(types);
  }

  public int getLine() { return line; }
  public FieldKind getKind() { return kind; }
  public String getPattern() { return pattern; }
  public List<String> getFields() { return fields; }
  public List<FieldType> getTypes() { return types; }

  /**
   * Check the rule against the event's minimum line count and compile
   * its pattern.
   */
  public void validate(int minLines) throws StatsConfigException {
    if (line < 0 || line >= minLines) {
      throw new StatsConfigException(String.format(
          "Rule for %s reads line %d, outside the %d required lines", fields, line, minLines));
    }
    if (kind == FieldKind.NAMED) {
      if (pattern == null) {
        throw new StatsConfigException("NAMED rule for " + fields + " has no pattern");
      }
      try {
        compiled = Pattern.compile(pattern);
      } catch (PatternSyntaxException e) {
        throw new StatsConfigException("Invalid pattern for " + fields + ": " + pattern, e);
      }
      if (fields.isEmpty()) {
        throw new StatsConfigException("NAMED rule has no fields: " + pattern);
      }
      List<String> groups = FieldExtractor.groupNames(compiled);
      for (String field : fields) {
        if (!groups.contains(field)) {
          throw new StatsConfigException(String.format(
              "Field %s has no named group in pattern %s", field, pattern));
        }
      }
      if (types.size() > fields.size()) {
        throw new StatsConfigException("More types than fields in rule for " + fields);
      }
    } else if (fields.size() != kind.fieldCount()) {
      throw new StatsConfigException(String.format(
          "%s rule requires %d fields, found %s", kind.name(), kind.fieldCount(), fields));
    }
  }

  private FieldType typeOf(int index) {
    return index < types.size() ? types.get(index) : FieldType.STRING;
  }

  /**
   * Extract this rule's fields from its line of the line-group.
   *
   * @throws PatternMismatchException if the line does not have the
   * expected form
   */
  public void apply(List<String> lines, EventFields.Builder out) {
    String text = lines.get(line);
    switch (kind) {
    case NAMED:
      applyNamed(text, out);
      break;
    case USR_SYS: {
      UsrSysTimes times = FieldExtractor.extractUsrSysTimes(text);
      out.put(fields.get(0), times.getUserSeconds());
      out.put(fields.get(1), times.getSystemSeconds());
      break;
    }
    case USAGE_REQUEST: {
      UsageRequest value = FieldExtractor.extractUsageRequest(text);
      if (value.hasUsage()) {
        out.put(fields.get(0), value.getUsage());
      }
      out.put(fields.get(1), value.getRequest());
      break;
    }
    case USAGE_REQUEST_ALLOCATED: {
      UsageRequestAllocated value = FieldExtractor.extractUsageRequestAllocated(text);
      out.put(fields.get(0), value.getUsage());
      out.put(fields.get(1), value.getRequest());
      out.put(fields.get(2), value.getAllocated());
      break;
    }
    default:
      throw new IllegalStateException("Unexpected kind: " + kind);
    }
  }

  private void applyNamed(String text, EventFields.Builder out) {
    if (compiled == null) {
      compiled = Pattern.compile(pattern);
    }
    Map<String, String> values = FieldExtractor.extractValues(compiled, text);
    List<String> missing = new ArrayList<>();
    for (int i = 0; i < fields.size(); i++) {
      String name = fields.get(i);
      String value = values.get(name);
      if (value == null) {
        missing.add(name);
        continue;
      }
      if (typeOf(i) == FieldType.LONG) {
        out.put(name, FieldExtractor.parseNumber(compiled, text, value));
      } else {
        out.put(name, value);
      }
    }
    if (!missing.isEmpty()) {
      throw (PatternMismatchException) new PatternMismatchException(compiled, text)
          .addContext("Unmatched fields", Joiner.on(", ").join(missing));
    }
  }

  @Override
  public String toString() {
    return "FieldRule [line=" + line + ", kind=" + kind + ", fields=" + fields + "]";
  }
}
