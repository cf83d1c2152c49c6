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

/**
 * The first line of a line-group does not match the event header grammar
 * <code>&lt;code&gt; (&lt;job id&gt;) &lt;MM&gt;/&lt;DD&gt; &lt;hh&gt;:&lt;mm&gt;:&lt;ss&gt; ...</code>,
 * or matches it but names an impossible date.
 */
public class HeaderParseException extends RecordParseException {

  private static final long serialVersionUID = 1L;

  public HeaderParseException(String line) {
    super("Error parsing record header", line);
  }

  public HeaderParseException(String line, Throwable cause) {
    super("Error parsing record header", line, cause);
  }
}
