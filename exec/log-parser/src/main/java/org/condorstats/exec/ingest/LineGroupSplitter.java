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
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an HTCondor user log into line-groups, one per event. Each
 * event ends with a line holding only <tt>...</tt>. Blank lines between
 * events are dropped; an event cut off at the end of the file (no
 * terminator) is still returned.
 */
public class LineGroupSplitter {

  public static final String EVENT_TERMINATOR = "...";

  private final BufferedReader reader;
  private int lineNumber;
  private int groupStartLine;

  public LineGroupSplitter(BufferedReader reader) {
    this.reader = reader;
  }

  /**
   * @return the lines of the next event, without the terminator, or
   * null at end of input
   */
  public List<String> next() throws IOException {
    List<String> group = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.trim().equals(EVENT_TERMINATOR)) {
        if (group.isEmpty()) {
          continue;
        }
        return group;
      }
      if (group.isEmpty()) {
        if (line.trim().isEmpty()) {
          continue;
        }
        groupStartLine = lineNumber;
      }
      group.add(line);
    }
    return group.isEmpty() ? null : group;
  }

  /**
   * @return the 1-based line number of the first line of the group most
   * recently returned by {@link #next()}
   */
  public int groupStartLine() { return groupStartLine; }
}
