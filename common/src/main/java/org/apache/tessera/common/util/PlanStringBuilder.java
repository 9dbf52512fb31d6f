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
package org.apache.tessera.common.util;

import java.util.StringJoiner;

/**
 * Builds the single line {@code toString()} form of plan nodes and descriptors:
 * {@code Name [key1=value1, key2="value2", key3=ENUM]}. Strings are quoted, enum constants are written by name and
 * null values are skipped.
 */
public class PlanStringBuilder {

  private final StringJoiner fields;

  public PlanStringBuilder(Object node) {
    fields = new StringJoiner(", ", node.getClass().getSimpleName() + " [", "]");
  }

  public PlanStringBuilder field(String key, String value) {
    return value == null ? this : append(key, '"' + value + '"');
  }

  public PlanStringBuilder field(String key, Enum<?> value) {
    return value == null ? this : append(key, value.name());
  }

  public PlanStringBuilder field(String key, Object value) {
    return value == null ? this : append(key, String.valueOf(value));
  }

  public PlanStringBuilder field(String key, long value) {
    return append(key, Long.toString(value));
  }

  private PlanStringBuilder append(String key, String value) {
    fields.add(key + "=" + value);
    return this;
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
