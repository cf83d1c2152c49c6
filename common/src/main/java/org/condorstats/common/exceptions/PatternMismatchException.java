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

import java.util.regex.Pattern;

/**
 * A required field pattern did not match its line.
 */
public class PatternMismatchException extends RecordParseException {

  private static final long serialVersionUID = 1L;

  private final String pattern;

  public PatternMismatchException(Pattern pattern, String line) {
    this(pattern.pattern(), line);
  }

  public PatternMismatchException(String pattern, String line) {
    super("Line does not match field pattern", line);
    this.pattern = pattern;
    addContext("Pattern", pattern);
  }

  public PatternMismatchException(String pattern, String line, Throwable cause) {
    super("Line does not match field pattern", line, cause);
    this.pattern = pattern;
    addContext("Pattern", pattern);
  }

  public String getPattern() { return pattern; }
}
