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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.apache.tessera.common.expression.visitors.ExprVisitor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Named function applied to argument expressions, e.g. {@code greater_than(a, 10)}. The function name is opaque
 * here; resolving it is up to the execution layer.
 */
public class FunctionCall implements LogicalExpression {

  private final String name;
  private final ImmutableList<LogicalExpression> args;

  @JsonCreator
  public FunctionCall(@JsonProperty("name") String name, @JsonProperty("args") List<LogicalExpression> args) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.args = args == null ? ImmutableList.of() : ImmutableList.copyOf(args);
  }

  public static FunctionCall call(String name, LogicalExpression... args) {
    return new FunctionCall(name, Arrays.asList(args));
  }

  @JsonProperty
  public String getName() {
    return name;
  }

  @JsonProperty
  public List<LogicalExpression> getArgs() {
    return args;
  }

  @Override
  public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
    return visitor.visitFunctionCall(this, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FunctionCall that = (FunctionCall) o;
    return name.equals(that.name) && args.equals(that.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public String toString() {
    return toExpressionString();
  }
}
