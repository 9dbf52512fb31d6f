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
package org.apache.tessera.exec.planner;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.tessera.exec.physical.PhysicalPlan;
import org.apache.tessera.exec.physical.base.AbstractPhysicalVisitor;
import org.apache.tessera.exec.physical.base.PhysicalOperator;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Renders a plan as indented text, one operator per line, children indented under their parent:
 *
 * <pre>
 * ParquetWriter [schema=[...], fileInfo=OutputFileInfo [...]] #1
 *   ParquetScan [projection=[...], ...] #2
 * ParquetWriter [schema=[...], fileInfo=OutputFileInfo [...]] #3
 *   ^ #2
 * </pre>
 *
 * Each operator is numbered the first time it is printed. An operator reached again through another parent is
 * printed as a back reference to that number instead of repeating its subtree.
 */
public class PlanExplainer extends AbstractPhysicalVisitor<Void, Integer, RuntimeException> {

  private static final String INDENT = "  ";

  private final StringBuilder sb = new StringBuilder();
  private final Map<PhysicalOperator, Integer> printed = new IdentityHashMap<>();

  private PlanExplainer() {
  }

  public static String explain(PhysicalPlan plan) {
    return explain(plan.getGraph());
  }

  public static String explain(PhysicalOperator root) {
    return explain(ImmutableList.of(root));
  }

  public static String explain(List<PhysicalOperator> roots) {
    PlanExplainer explainer = new PlanExplainer();
    for (PhysicalOperator root : roots) {
      root.accept(explainer, 0);
    }
    return explainer.sb.toString();
  }

  @Override
  public Void visitOp(PhysicalOperator op, Integer depth) {
    String indent = Strings.repeat(INDENT, depth);
    Integer seen = printed.get(op);
    if (seen != null) {
      sb.append(indent).append("^ #").append(seen).append('\n');
      return null;
    }
    int id = printed.size() + 1;
    printed.put(op, id);
    sb.append(indent).append(op).append(" #").append(id).append('\n');
    return visitChildren(op, depth + 1);
  }
}
