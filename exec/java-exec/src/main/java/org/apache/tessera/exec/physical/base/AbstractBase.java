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

import com.google.common.base.Preconditions;

public abstract class AbstractBase implements PhysicalOperator {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractBase.class);

  protected static void checkChildCount(PhysicalOperator pop, List<PhysicalOperator> children, int expected) {
    Preconditions.checkNotNull(children, "Null children for pop %s.", pop.getOperatorType());
    Preconditions.checkArgument(children.size() == expected,
        "%s expects %s children, got %s.", pop.getOperatorType(), expected, children.size());
    for (PhysicalOperator child : children) {
      Preconditions.checkArgument(child != null, "Null child for pop %s.", pop.getOperatorType());
    }
  }
}
