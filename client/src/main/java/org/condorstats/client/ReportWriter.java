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

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Writes a {@link StatsReport} as indented JSON.
 */
public class ReportWriter {

  private final ObjectMapper mapper;

  public ReportWriter() {
    mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
  }

  public String toJson(StatsReport report) throws ClientException {
    try {
      return mapper.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new ClientException("Cannot serialize report: " + e.getMessage(), e);
    }
  }

  /**
   * @param output file to write, replacing any existing one, or null to
   * write to standard output
   */
  public void write(StatsReport report, String output) throws ClientException {
    if (output == null) {
      Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      write(report, out, "standard output");
      return;
    }
    try (Writer out = Files.newBufferedWriter(Paths.get(output), StandardCharsets.UTF_8)) {
      write(report, out, output);
    } catch (IOException e) {
      throw new ClientException("Cannot write report to " + output + ": " + e.getMessage(), e);
    }
  }

  private void write(StatsReport report, Writer out, String target) throws ClientException {
    try {
      mapper.writeValue(out, report);
      out.write(System.lineSeparator());
      out.flush();
    } catch (IOException e) {
      throw new ClientException("Cannot write report to " + target + ": " + e.getMessage(), e);
    }
  }
}
