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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.regex.Pattern;

import org.junit.Test;

public class TestRecordParseException {

  @Test
  public void testContextInMessage() {
    RecordParseException e = new PatternMismatchException(Pattern.compile("(?<bytes>\\d+) "), "abc")
        .addContext("Event", "005")
        .addContext("Line offset", 6);

    assertEquals("abc", e.getLine());
    assertEquals("Line does not match field pattern", e.getBaseMessage());
    String msg = e.getMessage();
    assertTrue(msg.contains("Line: abc"));
    assertTrue(msg.contains("Pattern: (?<bytes>\\d+) "));
    assertTrue(msg.contains("Event: 005"));
    assertTrue(msg.contains("Line offset: 6"));

    // Context is kept in the order added, after the pattern.

    assertEquals(3, e.getContext().size());
    assertEquals("Line offset: 6", e.getContext().get(2));
  }

  @Test
  public void testInsufficientLines() {
    InsufficientLinesException e = new InsufficientLinesException("005 (1.0.0) 01/02 03:04:05 Job terminated.", 14, 3);
    assertEquals(14, e.getRequired());
    assertEquals(3, e.getActual());
    assertEquals("Record requires 14 lines but has 3", e.getBaseMessage());
  }

  @Test
  public void testHeaderCarriesLine() {
    HeaderParseException e = new HeaderParseException("garbage");
    assertEquals("garbage", e.getLine());
    assertTrue(e instanceof RecordParseException);
  }
}
