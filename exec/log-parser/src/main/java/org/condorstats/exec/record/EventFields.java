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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * The type-specific values of one event, keyed by field name, in the
 * order the event grammar declares them. Values are either
 * {@link Long} or {@link String}. A field the log line legitimately
 * omitted (such as an unused resource's usage) is absent.
 */
public class EventFields {

  public static class Builder {
    private final ImmutableMap.Builder<String, Object> values = ImmutableMap.builder();

    public Builder put(String name, long value) {
      values.put(name, value);
      return this;
    }

    public Builder put(String name, String value) {
      values.put(name, value);
      return this;
    }

    public EventFields build() {
      return new EventFields(values.build());
    }
  }

  private final ImmutableMap<String, Object> values;

  private EventFields(ImmutableMap<String, Object> values) {
    this.values = values;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public Object get(String name) {
    return values.get(name);
  }

  /**
   * @throws IllegalArgumentException if the field is absent or not numeric
   */
  public long getLong(String name) {
    Object value = values.get(name);
    if (!(value instanceof Long)) {
      throw new IllegalArgumentException("No numeric field named " + name);
    }
    return (Long) value;
  }

  public long getLong(String name, long defaultValue) {
    return has(name) ? getLong(name) : defaultValue;
  }

  public String getString(String name) {
    Object value = values.get(name);
    return value == null ? null : value.toString();
  }

  public Set<String> names() {
    return values.keySet();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
