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
package org.apache.tessera.common.expression.visitors;

import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.tessera.common.expression.FieldReference;
import org.apache.tessera.common.expression.FunctionCall;
import org.apache.tessera.common.expression.LogicalExpression;

import com.google.common.collect.ImmutableSet;

/**
 * Gathers the names of the columns an expression reads, in order of first appearance.
 */
public class ColumnReferenceCollector extends AbstractExprVisitor<Void, Set<String>, RuntimeException> {

  private static final ColumnReferenceCollector INSTANCE = new ColumnReferenceCollector();

  public static Set<String> collect(LogicalExpression expr) {
    Set<String> columns = new LinkedHashSet<>();
    expr.accept(INSTANCE, columns);
    return ImmutableSet.copyOf(columns);
  }

  @Override
  public Void visitFunctionCall(FunctionCall call, Set<String> columns) {
    for (LogicalExpression arg : call.getArgs()) {
      arg.accept(this, columns);
    }
    return null;
  }

  @Override
  public Void visitFieldReference(FieldReference field, Set<String> columns) {
    columns.add(field.getName());
    return null;
  }

  // constants reference no column
  @Override
  public Void visitUnknown(LogicalExpression e, Set<String> columns) {
    return null;
  }
}
