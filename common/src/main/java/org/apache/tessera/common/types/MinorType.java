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
package org.apache.tessera.common.types;

/**
 * Physical column types of the columnar engine.
 */
public enum MinorType {
  NULL,
  BOOLEAN,
  INT8,
  INT16,
  INT32,
  INT64,
  UINT8,
  UINT16,
  UINT32,
  UINT64,
  FLOAT32,
  FLOAT64,
  DECIMAL128,
  UTF8,
  BINARY,
  DATE,
  TIMESTAMP,
  DURATION,
  LIST,
  STRUCT;

  public boolean isTemporal() {
    return this == DATE || this == TIMESTAMP || this == DURATION;
  }

  public boolean isNested() {
    return this == LIST || this == STRUCT;
  }
}
