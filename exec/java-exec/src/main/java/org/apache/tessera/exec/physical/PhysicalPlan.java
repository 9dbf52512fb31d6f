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

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import org.apache.tessera.common.logical.PlanProperties;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.physical.base.PhysicalOperatorUtil;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The shippable form of a plan: a head describing the plan and the root operators of the graph, normally its
 * sinks. Operators reachable from more than one root are written once.
 */
@JsonPropertyOrder({ "head", "graph" })
public class PhysicalPlan {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PhysicalPlan.class);

  private final PlanProperties properties;
  private final List<PhysicalOperator> graph;

  @JsonCreator
  public PhysicalPlan(@JsonProperty("head") PlanProperties properties,
                      @JsonProperty("graph") List<PhysicalOperator> graph) {
    this.properties = Preconditions.checkNotNull(properties, "head");
    this.graph = graph == null ? ImmutableList.of() : ImmutableList.copyOf(graph);
  }

  @JsonProperty("head")
  public PlanProperties getProperties() {
    return properties;
  }

  @JsonProperty("graph")
  public List<PhysicalOperator> getGraph() {
    return graph;
  }

  /**
   * @return every distinct operator of the plan, leaves first
   */
  @JsonIgnore
  public List<PhysicalOperator> getSortedOperators() {
    return PhysicalOperatorUtil.getOperators(graph);
  }

  public static PhysicalPlan parse(ObjectReader reader, String planString) throws IOException {
    return reader.readValue(planString);
  }

  public String unparse(ObjectWriter writer) throws JsonProcessingException {
    return writer.writeValueAsString(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PhysicalPlan that = (PhysicalPlan) o;
    return properties.equals(that.properties) && graph.equals(that.graph);
  }

  @Override
  public int hashCode() {
    return Objects.hash(properties, graph);
  }
}
