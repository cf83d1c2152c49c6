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

import java.time.ZoneId;
import java.util.List;

import org.condorstats.common.exceptions.HeaderParseException;
import org.condorstats.common.exceptions.InsufficientLinesException;
import org.condorstats.common.exceptions.PatternMismatchException;
import org.condorstats.common.exceptions.RecordParseException;
import org.condorstats.exec.record.grammar.EventGrammar;
import org.condorstats.exec.record.grammar.FieldRule;
import org.condorstats.exec.record.grammar.GrammarTable;

import com.google.common.base.Preconditions;

/**
 * Turns one line-group into a {@link JobEvent}. The header is parsed
 * first, its event code selects the grammar, and the grammar's rules
 * are applied in order. Parsing is fail-fast: the first rule that fails
 * aborts the event.
 * <p>
 * A parser holds no per-event state; one instance may be shared by
 * several threads.
 */
public class EventParser {

  private final GrammarTable grammars;
  private final ZoneId zone;

  public EventParser(GrammarTable grammars, ZoneId zone) {
    this.grammars = grammars;
    this.zone = zone;
  }

  /**
   * @param year the year in which the event's month and day fall
   * @param lines the line-group, header first
   * @throws HeaderParseException if the first line is not an event header
   * @throws InsufficientLinesException if the group is shorter than the
   * event type requires
   * @throws PatternMismatchException if a required field does not parse
   */
  public JobEvent parse(int year, List<String> lines) {
    Preconditions.checkArgument(!lines.isEmpty(), "Empty line-group");
    String headerLine = lines.get(0);
    RecordHeader header = HeaderParser.parse(year, headerLine, zone);
    EventGrammar grammar = grammars.forCode(header.eventNumber());
    if (lines.size() < grammar.getMinLines()) {
      throw (InsufficientLinesException) new InsufficientLinesException(
          headerLine, grammar.getMinLines(), lines.size())
          .addContext("Event", grammar.getName());
    }
    EventFields.Builder fields = EventFields.builder();
    for (FieldRule rule : grammar.getRules()) {
      try {
        rule.apply(lines, fields);
      } catch (RecordParseException e) {
        throw e.addContext("Event", header.getEventCode() + " (" + grammar.getName() + ")")
            .addContext("Job", header.getJobIdentifier())
            .addContext("Line offset", rule.getLine());
      }
    }
    return new JobEvent(grammar.getType(), header, grammar, fields.build());
  }

  public ZoneId getZone() { return zone; }
}
