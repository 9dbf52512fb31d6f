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
package org.apache.tessera.exec.physical.base;

import java.util.List;

import org.apache.tessera.common.record.Schema;

import com.fasterxml.jackson.annotation.JsonIdentityInfo;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.ObjectIdGenerators;

/**
 * A node of a physical plan. Operators are immutable; a plan is a DAG since one operator instance may be the
 * child of several parents.
 * <p>
 * Within one serialized document every operator instance is written once, tagged with a generated {@code @id},
 * and later occurrences of the same instance are written as that id. Reading the document back links every
 * parent to a single instance again.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "@id" })
@JsonIdentityInfo(generator = ObjectIdGenerators.IntSequenceGenerator.class, property = "@id")
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "pop")
public interface PhysicalOperator extends Iterable<PhysicalOperator> {

  /**
   * Provides capability to build a set of output based on traversing a query graph tree.
   */
  <T, X, E extends Throwable> T accept(PhysicalVisitor<T, X, E> physicalVisitor, X value) throws E;

  /**
   * Regenerate this node with a new set of children. This is used by optimizer rewrites; the receiver is left
   * untouched.
   *
   * @throws IllegalArgumentException if the number of children does not fit the operator
   */
  @JsonIgnore
  PhysicalOperator getNewWithChildren(List<PhysicalOperator> children);

  /**
   * @return schema of the rows this operator produces
   */
  @JsonIgnore
  Schema getOutputSchema();

  @JsonIgnore
  CoreOperatorType getOperatorType();
}
