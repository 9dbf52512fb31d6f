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
package org.apache.tessera.common.expression;

import java.util.Set;

import org.apache.tessera.common.expression.ValueExpressions.BooleanExpression;
import org.apache.tessera.common.expression.ValueExpressions.DoubleExpression;
import org.apache.tessera.common.expression.ValueExpressions.LongExpression;
import org.apache.tessera.common.expression.ValueExpressions.NullExpression;
import org.apache.tessera.common.expression.ValueExpressions.QuotedString;
import org.apache.tessera.common.expression.visitors.ColumnReferenceCollector;
import org.apache.tessera.common.expression.visitors.ExprVisitor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Immutable expression tree carried by plan descriptors (pushed down filters, partitioning keys). Expressions are
 * never evaluated at the plan layer; they are shipped with the plan and inspected by the execution layer.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "expr")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FieldReference.class, name = "field"),
    @JsonSubTypes.Type(value = FunctionCall.class, name = "call"),
    @JsonSubTypes.Type(value = BooleanExpression.class, name = "boolean"),
    @JsonSubTypes.Type(value = LongExpression.class, name = "long"),
    @JsonSubTypes.Type(value = DoubleExpression.class, name = "double"),
    @JsonSubTypes.Type(value = QuotedString.class, name = "string"),
    @JsonSubTypes.Type(value = NullExpression.class, name = "null")
})
public interface LogicalExpression {

  <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E;

  /**
   * @return names of all columns referenced anywhere in this expression
   */
  @JsonIgnore
  default Set<String> getReferencedColumns() {
    return ColumnReferenceCollector.collect(this);
  }

  /**
   * @return readable rendering of this expression, as shown in plan explain output
   */
  default String toExpressionString() {
    return ExpressionStringBuilder.toString(this);
  }
}
