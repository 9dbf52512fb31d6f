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

import org.apache.tessera.common.expression.visitors.ExprVisitor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Preconditions;

public class ValueExpressions {

  public static LogicalExpression getBoolean(boolean b) {
    return new BooleanExpression(b);
  }

  public static LogicalExpression getLong(long l) {
    return new LongExpression(l);
  }

  public static LogicalExpression getDouble(double d) {
    return new DoubleExpression(d);
  }

  public static LogicalExpression getChar(String s) {
    return new QuotedString(s);
  }

  public static LogicalExpression getNull() {
    return new NullExpression();
  }

  @JsonTypeName("boolean")
  public static class BooleanExpression implements LogicalExpression {
    private final boolean value;

    @JsonCreator
    public BooleanExpression(@JsonProperty("value") boolean value) {
      this.value = value;
    }

    @JsonProperty("value")
    public boolean getBoolean() {
      return value;
    }

    @Override
    public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
      return visitor.visitBooleanConstant(this, value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BooleanExpression && ((BooleanExpression) o).value == value;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
      return toExpressionString();
    }
  }

  @JsonTypeName("long")
  public static class LongExpression implements LogicalExpression {
    private final long value;

    @JsonCreator
    public LongExpression(@JsonProperty("value") long value) {
      this.value = value;
    }

    @JsonProperty("value")
    public long getLong() {
      return value;
    }

    @Override
    public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
      return visitor.visitLongConstant(this, value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof LongExpression && ((LongExpression) o).value == value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public String toString() {
      return toExpressionString();
    }
  }

  @JsonTypeName("double")
  public static class DoubleExpression implements LogicalExpression {
    private final double value;

    @JsonCreator
    public DoubleExpression(@JsonProperty("value") double value) {
      this.value = value;
    }

    @JsonProperty("value")
    public double getDouble() {
      return value;
    }

    @Override
    public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
      return visitor.visitDoubleConstant(this, value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof DoubleExpression && Double.compare(((DoubleExpression) o).value, value) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return toExpressionString();
    }
  }

  @JsonTypeName("string")
  public static class QuotedString implements LogicalExpression {
    private final String value;

    @JsonCreator
    public QuotedString(@JsonProperty("value") String value) {
      this.value = Preconditions.checkNotNull(value, "value");
    }

    @JsonProperty("value")
    public String getString() {
      return value;
    }

    @Override
    public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
      return visitor.visitQuotedStringConstant(this, value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof QuotedString && ((QuotedString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return toExpressionString();
    }
  }

  @JsonTypeName("null")
  public static class NullExpression implements LogicalExpression {

    @JsonCreator
    public NullExpression() {
    }

    @Override
    public <T, V, E extends Exception> T accept(ExprVisitor<T, V, E> visitor, V value) throws E {
      return visitor.visitNullConstant(this, value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof NullExpression;
    }

    @Override
    public int hashCode() {
      return NullExpression.class.hashCode();
    }

    @Override
    public String toString() {
      return toExpressionString();
    }
  }
}
