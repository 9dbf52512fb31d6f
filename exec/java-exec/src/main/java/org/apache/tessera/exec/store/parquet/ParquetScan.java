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

import java.util.Objects;

import org.apache.tessera.common.record.Schema;
import org.apache.tessera.common.util.PlanStringBuilder;
import org.apache.tessera.exec.physical.PartitionSpec;
import org.apache.tessera.exec.physical.base.AbstractLeaf;
import org.apache.tessera.exec.physical.base.CoreOperatorType;
import org.apache.tessera.exec.physical.base.PhysicalVisitor;
import org.apache.tessera.exec.physical.base.Scan;
import org.apache.tessera.exec.store.ExternalSourceInfo;
import org.apache.tessera.exec.store.Pushdowns;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Reads a partitioned Parquet dataset. The node only describes the read: which columns to materialize, where
 * the files are, how the table is partitioned and which hints the reader may use. Nothing is checked here;
 * a projection or pushdown naming a column missing from the source schema is a planner bug, reported by
 * {@link org.apache.tessera.exec.planner.PlanValidator}.
 */
@JsonTypeName("parquet-scan")
public class ParquetScan extends AbstractLeaf implements Scan {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ParquetScan.class);

  private final Schema projectionSchema;
  private final ExternalSourceInfo sourceInfo;
  private final PartitionSpec partitionSpec;
  private final Pushdowns pushdowns;

  @JsonCreator
  public ParquetScan(@JsonProperty("projectionSchema") Schema projectionSchema,
                     @JsonProperty("sourceInfo") ExternalSourceInfo sourceInfo,
                     @JsonProperty("partitionSpec") PartitionSpec partitionSpec,
                     @JsonProperty("pushdowns") Pushdowns pushdowns) {
    this.projectionSchema = projectionSchema;
    this.sourceInfo = sourceInfo;
    this.partitionSpec = partitionSpec;
    this.pushdowns = pushdowns;
  }

  @Override
  @JsonProperty
  public Schema getProjectionSchema() {
    return projectionSchema;
  }

  @Override
  @JsonProperty
  public ExternalSourceInfo getSourceInfo() {
    return sourceInfo;
  }

  @Override
  @JsonProperty
  public PartitionSpec getPartitionSpec() {
    return partitionSpec;
  }

  @Override
  @JsonProperty
  public Pushdowns getPushdowns() {
    return pushdowns;
  }

  public ParquetScan withProjectionSchema(Schema projectionSchema) {
    logger.debug("Narrowing scan projection to {}", projectionSchema);
    return new ParquetScan(projectionSchema, sourceInfo, partitionSpec, pushdowns);
  }

  public ParquetScan withPushdowns(Pushdowns pushdowns) {
    return new ParquetScan(projectionSchema, sourceInfo, partitionSpec, pushdowns);
  }

  public ParquetScan withPartitionSpec(PartitionSpec partitionSpec) {
    return new ParquetScan(projectionSchema, sourceInfo, partitionSpec, pushdowns);
  }

  @Override
  public <T, X, E extends Throwable> T accept(PhysicalVisitor<T, X, E> physicalVisitor, X value) throws E {
    return physicalVisitor.visitParquetScan(this, value);
  }

  @Override
  public Schema getOutputSchema() {
    return projectionSchema;
  }

  @Override
  public CoreOperatorType getOperatorType() {
    return CoreOperatorType.PARQUET_SCAN;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ParquetScan that = (ParquetScan) o;
    return Objects.equals(projectionSchema, that.projectionSchema)
        && Objects.equals(sourceInfo, that.sourceInfo)
        && Objects.equals(partitionSpec, that.partitionSpec)
        && Objects.equals(pushdowns, that.pushdowns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(projectionSchema, sourceInfo, partitionSpec, pushdowns);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("projection", projectionSchema == null ? null : projectionSchema.getFields())
        .field("source", sourceInfo)
        .field("partitionSpec", partitionSpec)
        .field("pushdowns", pushdowns == null || pushdowns.isEmpty() ? null : pushdowns)
        .toString();
  }
}
