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
package org.apache.tessera.common.record;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.tessera.common.types.DataType;
import org.apache.tessera.common.types.Field;
import org.apache.tessera.common.types.MinorType;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

/**
 * Ordered list of uniquely named columns. Schemas are immutable and freely shared between plan nodes.
 */
public final class Schema implements Iterable<Field> {

  private static final Schema EMPTY = new Schema(ImmutableList.of());

  private final List<Field> fields;
  private final Map<String, Integer> indexByName;

  @JsonCreator
  public Schema(@JsonProperty("fields") List<Field> fields) {
    this.fields = fields == null ? ImmutableList.of() : ImmutableList.copyOf(fields);
    ImmutableMap.Builder<String, Integer> index = ImmutableMap.builder();
    for (int i = 0; i < this.fields.size(); i++) {
      index.put(this.fields.get(i).getName(), i);
    }
    try {
      this.indexByName = index.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Duplicate column name in schema " + this.fields, e);
    }
  }

  public static Schema empty() {
    return EMPTY;
  }

  public static Schema of(Field... fields) {
    return new Schema(Arrays.asList(fields));
  }

  public static SchemaBuilder newBuilder() {
    return new SchemaBuilder();
  }

  @JsonProperty
  public List<Field> getFields() {
    return fields;
  }

  @JsonIgnore
  public int getFieldCount() {
    return fields.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  public Field getColumn(int index) {
    if (index < 0 || index >= fields.size()) {
      return null;
    }
    return fields.get(index);
  }

  /**
   * @return the field with the given name, or {@code null} when the schema has no such column
   */
  public Field getField(String name) {
    Integer index = indexByName.get(name);
    return index == null ? null : fields.get(index);
  }

  public boolean contains(String name) {
    return indexByName.containsKey(name);
  }

  @JsonIgnore
  public List<String> getNames() {
    return ImmutableList.copyOf(indexByName.keySet());
  }

  /**
   * Returns a new schema holding the named columns, in the order given.
   *
   * @throws IllegalArgumentException if a name is not part of this schema
   */
  public Schema project(List<String> names) {
    List<Field> projected = Lists.newArrayListWithCapacity(names.size());
    for (String name : names) {
      Field field = getField(name);
      Preconditions.checkArgument(field != null, "Column %s not found in schema %s", name, this);
      projected.add(field);
    }
    return new Schema(projected);
  }

  @Override
  public Iterator<Field> iterator() {
    return fields.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return fields.equals(((Schema) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "Schema " + fields;
  }

  public static class SchemaBuilder {
    private final ImmutableList.Builder<Field> fields = ImmutableList.builder();

    private SchemaBuilder() {
    }

    public SchemaBuilder addField(Field field) {
      fields.add(field);
      return this;
    }

    public SchemaBuilder addField(String name, MinorType type) {
      return addField(Field.of(name, type));
    }

    public SchemaBuilder addField(String name, DataType type) {
      return addField(new Field(name, type));
    }

    public SchemaBuilder addFields(Iterable<Field> others) {
      fields.addAll(others);
      return this;
    }

    public Schema build() {
      return new Schema(fields.build());
    }
  }
}
