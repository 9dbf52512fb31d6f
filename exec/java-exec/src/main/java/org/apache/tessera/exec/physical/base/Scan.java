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

import org.apache.tessera.common.record.Schema;
import org.apache.tessera.exec.physical.PartitionSpec;
import org.apache.tessera.exec.store.ExternalSourceInfo;
import org.apache.tessera.exec.store.Pushdowns;

/**
 * A leaf that reads a dataset described by an {@link ExternalSourceInfo}.
 */
public interface Scan extends PhysicalOperator {

  Schema getProjectionSchema();

  ExternalSourceInfo getSourceInfo();

  PartitionSpec getPartitionSpec();

  Pushdowns getPushdowns();
}
