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

import java.util.List;

import org.apache.tessera.common.expression.ValueExpressions.BooleanExpression;
import org.apache.tessera.common.expression.ValueExpressions.DoubleExpression;
import org.apache.tessera.common.expression.ValueExpressions.LongExpression;
import org.apache.tessera.common.expression.ValueExpressions.NullExpression;
import org.apache.tessera.common.expression.ValueExpressions.QuotedString;
import org.apache.tessera.common.expression.visitors.AbstractExprVisitor;

public class ExpressionStringBuilder extends AbstractExprVisitor<Void, StringBuilder, RuntimeException> {

  private static final ExpressionStringBuilder INSTANCE = new ExpressionStringBuilder();

  public static String toString(LogicalExpression expr) {
    StringBuilder sb = new StringBuilder();
    expr.accept(INSTANCE, sb);
    return sb.toString();
  }

  @Override
  public Void visitFunctionCall(FunctionCall call, StringBuilder sb) {
    List<LogicalExpression> args = call.getArgs();
    sb.append(call.getName());
    sb.append("(");
    for (int i = 0; i < args.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      args.get(i).accept(this, sb);
    }
    sb.append(")");
    return null;
  }

  @Override
  public Void visitFieldReference(FieldReference field, StringBuilder sb) {
    sb.append("col(").append(field.getName()).append(")");
    return null;
  }

  @Override
  public Void visitBooleanConstant(BooleanExpression e, StringBuilder sb) {
    sb.append(e.getBoolean());
    return null;
  }

  @Override
  public Void visitLongConstant(LongExpression lExpr, StringBuilder sb) {
    sb.append(lExpr.getLong());
    return null;
  }

  @Override
  public Void visitDoubleConstant(DoubleExpression dExpr, StringBuilder sb) {
    sb.append(dExpr.getDouble());
    return null;
  }

  @Override
  public Void visitQuotedStringConstant(QuotedString e, StringBuilder sb) {
    sb.append("\"");
    sb.append(e.getString());
    sb.append("\"");
    return null;
  }

  @Override
  public Void visitNullConstant(NullExpression e, StringBuilder sb) {
    sb.append("null");
    return null;
  }
}
