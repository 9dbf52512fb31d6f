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

import org.apache.tessera.exec.store.parquet.ParquetScan;
import org.apache.tessera.exec.store.parquet.ParquetWriter;

public abstract class AbstractPhysicalVisitor<T, X, E extends Throwable> implements PhysicalVisitor<T, X, E> {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractPhysicalVisitor.class);

  @Override
  public T visitParquetScan(ParquetScan scan, X value) throws E {
    return visitOp(scan, value);
  }

  @Override
  public T visitParquetWriter(ParquetWriter writer, X value) throws E {
    return visitOp(writer, value);
  }

  /**
   * Visits every child of the given operator, discarding the results.
   */
  public T visitChildren(PhysicalOperator op, X value) throws E {
    for (PhysicalOperator child : op) {
      child.accept(this, value);
    }
    return null;
  }

  @Override
  public T visitOp(PhysicalOperator op, X value) throws E {
    throw new UnsupportedOperationException(String.format(
        "The PhysicalVisitor of type %s does not currently support visiting the PhysicalOperator type %s.",
        this.getClass().getCanonicalName(), op.getClass().getCanonicalName()));
  }
}
