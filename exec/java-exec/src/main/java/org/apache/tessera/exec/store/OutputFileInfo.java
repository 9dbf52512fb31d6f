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
package org.apache.tessera.exec.store;

import java.util.List;
import java.util.Objects;

import org.apache.tessera.common.expression.LogicalExpression;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Destination of a write: the root directory, the file format, optional partition columns used to lay out
 * sub-directories and an optional compression codec name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutputFileInfo {

  private final String rootDir;
  private final FileFormat fileFormat;
  private final List<LogicalExpression> partitionCols;
  private final String compression;

  @JsonCreator
  public OutputFileInfo(@JsonProperty("rootDir") String rootDir,
                        @JsonProperty("fileFormat") FileFormat fileFormat,
                        @JsonProperty("partitionCols") List<LogicalExpression> partitionCols,
                        @JsonProperty("compression") String compression) {
    this.rootDir = Preconditions.checkNotNull(rootDir, "rootDir");
    this.fileFormat = Preconditions.checkNotNull(fileFormat, "fileFormat");
    this.partitionCols = partitionCols == null ? null : ImmutableList.copyOf(partitionCols);
    this.compression = compression;
  }

  public OutputFileInfo(String rootDir, FileFormat fileFormat) {
    this(rootDir, fileFormat, null, null);
  }

  @JsonProperty
  public String getRootDir() {
    return rootDir;
  }

  @JsonProperty
  public FileFormat getFileFormat() {
    return fileFormat;
  }

  @JsonProperty
  public List<LogicalExpression> getPartitionCols() {
    return partitionCols;
  }

  @JsonProperty
  public String getCompression() {
    return compression;
  }

  @JsonIgnore
  public boolean isPartitioned() {
    return partitionCols != null && !partitionCols.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    OutputFileInfo that = (OutputFileInfo) o;
    return rootDir.equals(that.rootDir)
        && fileFormat == that.fileFormat
        && Objects.equals(partitionCols, that.partitionCols)
        && Objects.equals(compression, that.compression);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rootDir, fileFormat, partitionCols, compression);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("rootDir", rootDir)
        .field("fileFormat", fileFormat)
        .field("partitionCols", partitionCols)
        .field("compression", compression)
        .toString();
  }
}
