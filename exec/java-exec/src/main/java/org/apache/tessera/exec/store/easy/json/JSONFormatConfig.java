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
package org.apache.tessera.exec.store.easy.json;

import org.apache.tessera.common.logical.FormatPluginConfig;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Newline delimited JSON.
 */
@EqualsAndHashCode
@JsonTypeName(JSONFormatConfig.NAME)
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class JSONFormatConfig implements FormatPluginConfig {

  public static final String NAME = "json";

  @Getter private final Integer bufferSize;
  @Getter private final Integer chunkSize;

  @JsonCreator
  public JSONFormatConfig(@JsonProperty("bufferSize") Integer bufferSize,
                          @JsonProperty("chunkSize") Integer chunkSize) {
    this.bufferSize = bufferSize;
    this.chunkSize = chunkSize;
  }

  public JSONFormatConfig() {
    this(null, null);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("bufferSize", bufferSize)
        .field("chunkSize", chunkSize)
        .toString();
  }
}
