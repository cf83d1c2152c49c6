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
package org.condorstats.exec.stats;

import java.time.temporal.ChronoUnit;

/**
 * Bucket size used when turning job intervals into core usage samples.
 */
public enum SampleGranularity {
  SECOND("second", ChronoUnit.SECONDS),
  MINUTE("minute", ChronoUnit.MINUTES);

  private final String value;
  private final ChronoUnit unit;

  private SampleGranularity(String value, ChronoUnit unit) {
    this.value = value;
    this.unit = unit;
  }

  public static SampleGranularity toEnum(String value) {
    for (SampleGranularity granularity : values()) {
      if (granularity.value.equalsIgnoreCase(value)) {
        return granularity;
      }
    }
    return null;
  }

  public String toValue() { return value; }
  public ChronoUnit unit() { return unit; }
}
