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

/**
 * Visitor class designed to traverse a physical plan. Operators call back into the method matching their kind;
 * {@link #visitOp} is the fallback for operators without a dedicated method.
 *
 * @param <RETURN> The class associated with the return of each visit method.
 * @param <EXTRA> The class object associated with an extra payload/option that can be passed to each method.
 * @param <EXCEP> An optional exception class that can be thrown when a portion of a visit method fails.
 */
public interface PhysicalVisitor<RETURN, EXTRA, EXCEP extends Throwable> {

  RETURN visitParquetScan(ParquetScan scan, EXTRA value) throws EXCEP;

  RETURN visitParquetWriter(ParquetWriter writer, EXTRA value) throws EXCEP;

  RETURN visitOp(PhysicalOperator op, EXTRA value) throws EXCEP;
}
