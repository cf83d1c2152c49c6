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
package org.condorstats.common.exceptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for failures raised while turning a group of raw HTCondor log
 * lines into a typed event. Parse failures are always fatal to the record
 * being built: the caller decides whether to skip that record or abort the
 * whole ingestion run, but no partially populated record is ever returned.
 * <p>
 * Each layer that sees the exception on its way up may add name/value
 * context entries. They are rendered after the line in the message:
 * <pre><code>
 * throw new PatternMismatchException(pattern, line)
 *     .addContext("Event", "005")
 *     .addContext("Line offset", 6);
 * </code></pre>
 */
public abstract class RecordParseException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String line;
  private final List<String> context = new ArrayList<>();

  protected RecordParseException(String message, String line) {
    super(message);
    this.line = line;
  }

  protected RecordParseException(String message, String line, Throwable cause) {
    super(message, cause);
    this.line = line;
  }

  /**
   * Add a context entry to this exception. Context entries appear, in the
   * order added, after the base message.
   *
   * @return this exception, for chaining
   */
  public RecordParseException addContext(String name, Object value) {
    context.add(name + ": " + value);
    return this;
  }

  public RecordParseException addContext(String text) {
    context.add(text);
    return this;
  }

  /**
   * @return the raw log line that failed to parse, or null if the
   * failure is not tied to a single line
   */
  public String getLine() { return line; }

  public List<String> getContext() { return context; }

  /**
   * @return the message without the context entries
   */
  public String getBaseMessage() { return super.getMessage(); }

  @Override
  public String getMessage() {
    StringBuilder buf = new StringBuilder(super.getMessage());
    if (line != null) {
      buf.append("\nLine: ").append(line);
    }
    for (String entry : context) {
      buf.append("\n").append(entry);
    }
    return buf.toString();
  }
}
