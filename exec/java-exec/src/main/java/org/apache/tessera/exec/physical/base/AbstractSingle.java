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
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Iterators;

/**
 * Describes an operator that expects a single child operator as its input. The child is held by reference, so
 * the same child instance may feed several parents. A missing child is not rejected here; such an operator
 * simply has no children and is reported by the plan validator.
 */
public abstract class AbstractSingle extends AbstractBase {

  protected final PhysicalOperator child;

  public AbstractSingle(PhysicalOperator child) {
    this.child = child;
  }

  @Override
  public Iterator<PhysicalOperator> iterator() {
    if (child == null) {
      return Collections.emptyIterator();
    }
    return Iterators.singletonIterator(child);
  }

  @JsonProperty("child")
  public PhysicalOperator getChild() {
    return child;
  }

  @Override
  public PhysicalOperator getNewWithChildren(List<PhysicalOperator> children) {
    checkChildCount(this, children, 1);
    return getNewWithChild(children.get(0));
  }

  protected abstract PhysicalOperator getNewWithChild(PhysicalOperator child);
}
