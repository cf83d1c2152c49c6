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

/**
 * How a {@link FieldRule} pulls its fields out of a line. Each kind
 * other than {@link #NAMED} has a fixed pattern and a fixed number of
 * output fields.
 */
public enum FieldKind {

  /**
   * A rule-supplied pattern; each field is the named group of the same
   * name.
   */
  NAMED(-1),

  /**
   * <code>Usr n hh:mm:ss, Sys n hh:mm:ss</code>: user and system
   * seconds.
   */
  USR_SYS(2),

  /**
   * Trailing <code>: usage request</code>, where usage may be missing.
   */
  USAGE_REQUEST(2),

  /**
   * Trailing <code>: usage request allocated</code>; all zero when
   * incomplete.
   */
  USAGE_REQUEST_ALLOCATED(3);

  private final int fieldCount;

  private FieldKind(int fieldCount) {
    this.fieldCount = fieldCount;
  }

  /**
   * @return the number of fields this kind produces, or -1 if set by
   * the rule's pattern
   */
  public int fieldCount() { return fieldCount; }
}
