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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.tessera.common.expression.LogicalExpression;
import org.apache.tessera.common.util.PlanStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Hints a scan may use to read less data: a row filter, a filter over partition values, the columns needed and a
 * row limit. Hints are advisory; a reader may return more rows or columns than asked for.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Pushdowns {

  private static final Pushdowns NONE = new Pushdowns(null, null, null, null);

  private final LogicalExpression filters;
  private final LogicalExpression partitionFilters;
  private final List<String> columns;
  private final Long limit;

  @JsonCreator
  public Pushdowns(@JsonProperty("filters") LogicalExpression filters,
                   @JsonProperty("partitionFilters") LogicalExpression partitionFilters,
                   @JsonProperty("columns") List<String> columns,
                   @JsonProperty("limit") Long limit) {
    Preconditions.checkArgument(limit == null || limit >= 0, "limit must not be negative, got %s", limit);
    this.filters = filters;
    this.partitionFilters = partitionFilters;
    this.columns = columns == null ? null : ImmutableList.copyOf(columns);
    this.limit = limit;
  }

  public static Pushdowns none() {
    return NONE;
  }

  @JsonProperty
  public LogicalExpression getFilters() {
    return filters;
  }

  @JsonProperty
  public LogicalExpression getPartitionFilters() {
    return partitionFilters;
  }

  @JsonProperty
  public List<String> getColumns() {
    return columns;
  }

  @JsonProperty
  public Long getLimit() {
    return limit;
  }

  public Pushdowns withFilters(LogicalExpression filters) {
    return new Pushdowns(filters, partitionFilters, columns, limit);
  }

  public Pushdowns withPartitionFilters(LogicalExpression partitionFilters) {
    return new Pushdowns(filters, partitionFilters, columns, limit);
  }

  public Pushdowns withColumns(List<String> columns) {
    return new Pushdowns(filters, partitionFilters, columns, limit);
  }

  public Pushdowns withLimit(Long limit) {
    return new Pushdowns(filters, partitionFilters, columns, limit);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return filters == null && partitionFilters == null && columns == null && limit == null;
  }

  /**
   * Column names mentioned by the row filter and the column list, in first-seen order. Partition filters are
   * left out since they name partition values rather than data columns.
   */
  public Set<String> referencedColumns() {
    Set<String> names = new LinkedHashSet<>();
    if (filters != null) {
      names.addAll(filters.getReferencedColumns());
    }
    if (columns != null) {
      names.addAll(columns);
    }
    return names;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Pushdowns that = (Pushdowns) o;
    return Objects.equals(filters, that.filters)
        && Objects.equals(partitionFilters, that.partitionFilters)
        && Objects.equals(columns, that.columns)
        && Objects.equals(limit, that.limit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filters, partitionFilters, columns, limit);
  }

  @Override
  public String toString() {
    return new PlanStringBuilder(this)
        .field("filters", filters)
        .field("partitionFilters", partitionFilters)
        .field("columns", columns)
        .field("limit", limit)
        .toString();
  }
}
