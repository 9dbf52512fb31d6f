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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

public class PhysicalOperatorUtil {

  private PhysicalOperatorUtil() {}

  /**
   * Collects the distinct operators reachable from the given roots, children before parents. Operators are
   * compared by identity, so a subtree shared by several parents is listed once while equal but separate
   * instances are all listed.
   */
  public static List<PhysicalOperator> getOperators(List<? extends PhysicalOperator> roots) {
    Set<PhysicalOperator> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    ImmutableList.Builder<PhysicalOperator> ops = ImmutableList.builder();
    for (PhysicalOperator root : roots) {
      collect(root, seen, ops);
    }
    return ops.build();
  }

  public static List<PhysicalOperator> getOperators(PhysicalOperator root) {
    return getOperators(Collections.singletonList(root));
  }

  /**
   * @return the distinct operators without children under the given root, in visiting order
   */
  public static List<PhysicalOperator> getLeaves(PhysicalOperator root) {
    ImmutableList.Builder<PhysicalOperator> leaves = ImmutableList.builder();
    for (PhysicalOperator op : getOperators(root)) {
      if (!op.iterator().hasNext()) {
        leaves.add(op);
      }
    }
    return leaves.build();
  }

  private static void collect(PhysicalOperator op, Set<PhysicalOperator> seen,
                              ImmutableList.Builder<PhysicalOperator> ops) {
    if (!seen.add(op)) {
      return;
    }
    for (PhysicalOperator child : op) {
      collect(child, seen, ops);
    }
    ops.add(op);
  }
}
