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
package org.apache.tessera.exec.store.easy.text;

import org.apache.tessera.common.logical.FormatPluginConfig;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@EqualsAndHashCode
@JsonTypeName(TextFormatConfig.NAME)
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class TextFormatConfig implements FormatPluginConfig {

  public static final String NAME = "csv";

  @Getter private final String fieldDelimiter;
  @Getter private final String quote;
  @Getter private final String escape;
  @Getter private final String comment;
  @Getter private final boolean extractHeader;
  @Getter private final boolean allowVariableColumns;

  // Buffer sizes in bytes, null leaves the choice to the reader
  @Getter private final Integer bufferSize;
  @Getter private final Integer chunkSize;

  public TextFormatConfig() {
    this(null, null, null, null, true, false, null, null);
  }

  @JsonCreator
  @Builder
  public TextFormatConfig(
      @JsonProperty("fieldDelimiter") String fieldDelimiter,
      @JsonProperty("quote") String quote,
      @JsonProperty("escape") String escape,
      @JsonProperty("comment") String comment,
      @JsonProperty("extractHeader") Boolean extractHeader,
      @JsonProperty("allowVariableColumns") boolean allowVariableColumns,
      @JsonProperty("bufferSize") Integer bufferSize,
      @JsonProperty("chunkSize") Integer chunkSize) {
    this.fieldDelimiter = fieldDelimiter == null ? "," : fieldDelimiter;
    this.quote = quote == null ? "\"" : quote;
    this.escape = escape;
    this.comment = comment;
    this.extractHeader = extractHeader == null || extractHeader;
    this.allowVariableColumns = allowVariableColumns;
    this.bufferSize = bufferSize;
    this.chunkSize = chunkSize;
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("fieldDelimiter", fieldDelimiter)
        .field("quote", quote)
        .field("escape", escape)
        .field("comment", comment)
        .field("extractHeader", extractHeader)
        .field("allowVariableColumns", allowVariableColumns)
        .field("bufferSize", bufferSize)
        .field("chunkSize", chunkSize)
        .toString();
  }
}
