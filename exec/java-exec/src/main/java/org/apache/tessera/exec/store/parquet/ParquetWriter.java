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

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.apache.tessera.common.expression.FieldReference;
import org.apache.tessera.common.expression.LogicalExpression;
import org.apache.tessera.common.record.Schema;
import org.apache.tessera.common.types.Field;
import org.apache.tessera.common.types.MinorType;
import org.apache.tessera.common.util.PlanStringBuilder;
import org.apache.tessera.exec.physical.base.AbstractSingle;
import org.apache.tessera.exec.physical.base.CoreOperatorType;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.physical.base.PhysicalVisitor;
import org.apache.tessera.exec.physical.base.Writer;
import org.apache.tessera.exec.store.OutputFileInfo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Runs its child and writes the rows it produces under {@link OutputFileInfo#getRootDir()}. The child is held by
 * reference and may be shared with other parents. The node produces one row per written file: the file path,
 * followed by the partition values of that file when the output is partitioned.
 */
@JsonTypeName("parquet-writer")
public class ParquetWriter extends AbstractSingle implements Writer {

  public static final String PATH_COLUMN = "path";

  private final Schema schema;
  private final OutputFileInfo fileInfo;

  @JsonCreator
  public ParquetWriter(@JsonProperty("schema") Schema schema,
                       @JsonProperty("fileInfo") OutputFileInfo fileInfo,
                       @JsonProperty("child") PhysicalOperator child) {
    super(child);
    this.schema = schema;
    this.fileInfo = fileInfo;
  }

  @Override
  @JsonProperty
  public Schema getSchema() {
    return schema;
  }

  @Override
  @JsonProperty
  public OutputFileInfo getFileInfo() {
    return fileInfo;
  }

  @Override
  protected PhysicalOperator getNewWithChild(PhysicalOperator child) {
    return new ParquetWriter(schema, fileInfo, child);
  }

  @Override
  public <T, X, E extends Throwable> T accept(PhysicalVisitor<T, X, E> physicalVisitor, X value) throws E {
    return physicalVisitor.visitParquetWriter(this, value);
  }

  /**
   * A {@code path} column, then one column per distinct output partition expression. Plain column references keep
   * the type they have in the written schema; anything else is rendered as a string. A partition column whose name
   * is already taken, {@code path} included, gets the first free {@code _1}, {@code _2}, ... suffix.
   */
  @Override
  public Schema getOutputSchema() {
    Schema.SchemaBuilder builder = Schema.newBuilder().addField(PATH_COLUMN, MinorType.UTF8);
    if (fileInfo == null || !fileInfo.isPartitioned()) {
      return builder.build();
    }
    Set<String> names = new HashSet<>();
    names.add(PATH_COLUMN);
    Set<LogicalExpression> seen = new HashSet<>();
    for (LogicalExpression expr : fileInfo.getPartitionCols()) {
      if (!seen.add(expr)) {
        continue;
      }
      Field field = partitionField(expr);
      String name = field.getName();
      for (int suffix = 1; !names.add(name); suffix++) {
        name = field.getName() + "_" + suffix;
      }
      builder.addField(field.withName(name));
    }
    return builder.build();
  }

  private Field partitionField(LogicalExpression expr) {
    if (expr instanceof FieldReference) {
      String name = ((FieldReference) expr).getName();
      Field field = schema == null ? null : schema.getField(name);
      return field != null ? field : Field.of(name, MinorType.UTF8);
    }
    return Field.of(expr.toExpressionString(), MinorType.UTF8);
  }

  @Override
  public CoreOperatorType getOperatorType() {
    return CoreOperatorType.PARQUET_WRITER;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ParquetWriter that = (ParquetWriter) o;
    return Objects.equals(schema, that.schema)
        && Objects.equals(fileInfo, that.fileInfo)
        && Objects.equals(child, that.child);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, fileInfo, child);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("schema", schema == null ? null : schema.getFields())
        .field("fileInfo", fileInfo)
        .toString();
  }
}
