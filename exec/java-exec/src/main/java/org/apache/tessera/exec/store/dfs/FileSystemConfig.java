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
package org.apache.tessera.exec.store.dfs;

import java.util.Map;
import java.util.Objects;

import org.apache.tessera.common.logical.StoragePluginConfig;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableMap;

/**
 * File system or object store reached through a connection URI such as {@code file:///} or {@code s3://bucket}.
 * The {@code config} map carries io properties (credentials, endpoints, retry settings) handed to the reader.
 */
@JsonTypeName(FileSystemConfig.NAME)
public class FileSystemConfig extends StoragePluginConfig {

  public static final String NAME = "file";

  private final String connection;
  private final boolean multithreadedIo;
  private final Map<String, String> config;

  @JsonCreator
  public FileSystemConfig(@JsonProperty("connection") String connection,
                          @JsonProperty("multithreadedIo") Boolean multithreadedIo,
                          @JsonProperty("config") Map<String, String> config) {
    this.connection = connection;
    this.multithreadedIo = multithreadedIo == null || multithreadedIo;
    this.config = config == null ? ImmutableMap.of() : ImmutableMap.copyOf(config);
  }

  public static FileSystemConfig local() {
    return new FileSystemConfig("file:///", null, null);
  }

  @JsonProperty
  public String getConnection() {
    return connection;
  }

  // a missing flag reads back as true
  @JsonProperty
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public boolean isMultithreadedIo() {
    return multithreadedIo;
  }

  @JsonProperty
  public Map<String, String> getConfig() {
    return config;
  }

  public String getValue(String key) {
    return config.get(key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(connection, multithreadedIo, config);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FileSystemConfig other = (FileSystemConfig) obj;
    return multithreadedIo == other.multithreadedIo
        && Objects.equals(connection, other.connection)
        && config.equals(other.config);
  }

  @Override
  public String toString() {
    // io properties may hold secrets, only their keys are shown
    return new PlanStringBuilder(this)
        .field("connection", connection)
        .field("multithreadedIo", multithreadedIo)
        .field("config", config.keySet())
        .toString();
  }
}
