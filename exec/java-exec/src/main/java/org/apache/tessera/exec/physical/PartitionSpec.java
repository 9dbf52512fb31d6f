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
package org.apache.tessera.exec.physical;

import java.util.List;
import java.util.Objects;

import org.apache.tessera.common.expression.LogicalExpression;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * How the rows of a dataset are divided into partitions. A spec is a value and may be referenced by any number
 * of plan nodes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PartitionSpec {

  public enum PartitionScheme {
    UNKNOWN,
    HASH,
    RANGE,
    RANDOM
  }

  private final PartitionScheme scheme;
  private final int numPartitions;
  private final List<LogicalExpression> by;

  @JsonCreator
  public PartitionSpec(@JsonProperty("scheme") PartitionScheme scheme,
                       @JsonProperty("numPartitions") int numPartitions,
                       @JsonProperty("by") List<LogicalExpression> by) {
    Preconditions.checkArgument(numPartitions >= 1, "numPartitions must be positive, got %s", numPartitions);
    this.scheme = scheme == null ? PartitionScheme.UNKNOWN : scheme;
    this.numPartitions = numPartitions;
    this.by = by == null ? null : ImmutableList.copyOf(by);
  }

  public static PartitionSpec unknown(int numPartitions) {
    return new PartitionSpec(PartitionScheme.UNKNOWN, numPartitions, null);
  }

  @JsonProperty
  public PartitionScheme getScheme() {
    return scheme;
  }

  @JsonProperty
  public int getNumPartitions() {
    return numPartitions;
  }

  /**
   * @return partitioning expressions, or {@code null} when the scheme has none
   */
  @JsonProperty
  public List<LogicalExpression> getBy() {
    return by;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PartitionSpec that = (PartitionSpec) o;
    return numPartitions == that.numPartitions
        && scheme == that.scheme
        && Objects.equals(by, that.by);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scheme, numPartitions, by);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("scheme", scheme)
        .field("numPartitions", numPartitions)
        .field("by", by)
        .toString();
  }
}
