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

import java.util.Objects;

import org.apache.tessera.common.logical.FormatPluginConfig;
import org.apache.tessera.common.logical.StoragePluginConfig;
import org.apache.tessera.common.record.Schema;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Where a dataset lives and how its files are encoded, together with the full schema of the dataset.
 */
public class ExternalSourceInfo {

  private final Schema sourceSchema;
  private final InputFileInfos fileInfos;
  private final FormatPluginConfig fileFormatConfig;
  private final StoragePluginConfig storageConfig;

  @JsonCreator
  public ExternalSourceInfo(@JsonProperty("sourceSchema") Schema sourceSchema,
                            @JsonProperty("fileInfos") InputFileInfos fileInfos,
                            @JsonProperty("fileFormatConfig") FormatPluginConfig fileFormatConfig,
                            @JsonProperty("storageConfig") StoragePluginConfig storageConfig) {
    this.sourceSchema = Preconditions.checkNotNull(sourceSchema, "sourceSchema");
    this.fileInfos = Preconditions.checkNotNull(fileInfos, "fileInfos");
    this.fileFormatConfig = Preconditions.checkNotNull(fileFormatConfig, "fileFormatConfig");
    this.storageConfig = Preconditions.checkNotNull(storageConfig, "storageConfig");
  }

  @JsonProperty
  public Schema getSourceSchema() {
    return sourceSchema;
  }

  @JsonProperty
  public InputFileInfos getFileInfos() {
    return fileInfos;
  }

  @JsonProperty
  public FormatPluginConfig getFileFormatConfig() {
    return fileFormatConfig;
  }

  @JsonProperty
  public StoragePluginConfig getStorageConfig() {
    return storageConfig;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ExternalSourceInfo that = (ExternalSourceInfo) o;
    return sourceSchema.equals(that.sourceSchema)
        && fileInfos.equals(that.fileInfos)
        && fileFormatConfig.equals(that.fileFormatConfig)
        && storageConfig.equals(that.storageConfig);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceSchema, fileInfos, fileFormatConfig, storageConfig);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("files", fileInfos.size())
        .field("format", fileFormatConfig)
        .field("storage", storageConfig)
        .toString();
  }
}
