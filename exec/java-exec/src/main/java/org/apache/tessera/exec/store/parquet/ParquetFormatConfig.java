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
package org.apache.tessera.exec.store.parquet;

import org.apache.tessera.common.logical.FormatPluginConfig;
import org.apache.tessera.common.types.DataType;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@EqualsAndHashCode
@JsonTypeName(ParquetFormatConfig.NAME)
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class ParquetFormatConfig implements FormatPluginConfig {

  public static final String NAME = "parquet";

  /**
   * Unit that legacy INT96 timestamps are read as. Writers used nanoseconds, which overflows for dates far from
   * the epoch, so readers may coerce to a coarser unit.
   */
  @Getter private final DataType.TimeUnit coerceInt96TimestampUnit;

  /**
   * Number of row groups read by one scan task, null lets the scheduler decide.
   */
  @Getter private final Integer rowGroupsPerTask;

  // Write side options, null means the writer default
  @Getter private final Integer blockSize;
  @Getter private final Integer pageSize;
  @Getter private final String writerCompressionType;

  public ParquetFormatConfig() {
    this(null, null, null, null, null);
  }

  @JsonCreator
  @Builder
  public ParquetFormatConfig(
      @JsonProperty("coerceInt96TimestampUnit") DataType.TimeUnit coerceInt96TimestampUnit,
      @JsonProperty("rowGroupsPerTask") Integer rowGroupsPerTask,
      @JsonProperty("blockSize") Integer blockSize,
      @JsonProperty("pageSize") Integer pageSize,
      @JsonProperty("writerCompressionType") String writerCompressionType) {
    this.coerceInt96TimestampUnit = coerceInt96TimestampUnit == null
        ? DataType.TimeUnit.NANOSECONDS : coerceInt96TimestampUnit;
    this.rowGroupsPerTask = rowGroupsPerTask;
    this.blockSize = blockSize;
    this.pageSize = pageSize;
    this.writerCompressionType = writerCompressionType;
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("coerceInt96TimestampUnit", coerceInt96TimestampUnit)
        .field("rowGroupsPerTask", rowGroupsPerTask)
        .field("blockSize", blockSize)
        .field("pageSize", pageSize)
        .field("writerCompressionType", writerCompressionType)
        .toString();
  }
}
