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

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * A named, typed column.
 */
@JsonPropertyOrder({"name", "type", "metadata"})
public final class Field {

  private final String name;
  private final DataType type;
  private final Map<String, String> metadata;

  public Field(String name, DataType type) {
    this(name, type, null);
  }

  @JsonCreator
  public Field(@JsonProperty("name") String name,
               @JsonProperty("type") DataType type,
               @JsonProperty("metadata") Map<String, String> metadata) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.type = Preconditions.checkNotNull(type, "type");
    this.metadata = metadata == null ? ImmutableMap.of() : ImmutableMap.copyOf(metadata);
  }

  public static Field of(String name, MinorType type) {
    return new Field(name, DataType.of(type));
  }

  @JsonProperty
  public String getName() {
    return name;
  }

  @JsonProperty
  public DataType getType() {
    return type;
  }

  @JsonProperty
  @JsonInclude(Include.NON_EMPTY)
  public Map<String, String> getMetadata() {
    return metadata;
  }

  public Field withName(String newName) {
    return new Field(newName, type, metadata);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Field that = (Field) o;
    return name.equals(that.name) && type.equals(that.type) && metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, metadata);
  }

  @Override
  public String toString() {
    return name + "#" + type;
  }
}
