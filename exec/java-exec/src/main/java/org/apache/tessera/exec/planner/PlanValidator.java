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

import java.util.ArrayList;
import java.util.List;

import org.apache.tessera.common.expression.LogicalExpression;
import org.apache.tessera.common.record.Schema;
import org.apache.tessera.common.types.Field;
import org.apache.tessera.exec.physical.PartitionSpec;
import org.apache.tessera.exec.physical.PartitionSpec.PartitionScheme;
import org.apache.tessera.exec.physical.PhysicalPlan;
import org.apache.tessera.exec.physical.base.AbstractPhysicalVisitor;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.physical.base.PhysicalOperatorUtil;
import org.apache.tessera.exec.store.OutputFileInfo;
import org.apache.tessera.exec.store.parquet.ParquetScan;
import org.apache.tessera.exec.store.parquet.ParquetWriter;

import com.google.common.collect.ImmutableList;

/**
 * Checks the cross-field assumptions that operator constructors leave to the planner: a scan only names columns
 * of its dataset, with their declared types, and a writer writes what its input produces. Each distinct operator
 * is checked once; problems are returned as messages rather than thrown.
 */
public class PlanValidator extends AbstractPhysicalVisitor<Void, List<String>, RuntimeException> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PlanValidator.class);

  private static final PlanValidator INSTANCE = new PlanValidator();

  private PlanValidator() {
  }

  public static List<String> validate(PhysicalPlan plan) {
    return validate(plan.getGraph());
  }

  public static List<String> validate(PhysicalOperator root) {
    return validate(ImmutableList.of(root));
  }

  public static List<String> validate(List<PhysicalOperator> roots) {
    List<String> problems = new ArrayList<>();
    for (PhysicalOperator op : PhysicalOperatorUtil.getOperators(roots)) {
      op.accept(INSTANCE, problems);
    }
    if (!problems.isEmpty()) {
      logger.debug("Plan has {} problems: {}", problems.size(), problems);
    }
    return problems;
  }

  @Override
  public Void visitParquetScan(ParquetScan scan, List<String> problems) {
    checkPartitionSpec(scan, scan.getPartitionSpec(), problems);
    if (scan.getSourceInfo() == null) {
      problems.add(String.format("%s: no source info", scan.getOperatorType()));
      return null;
    }
    Schema source = scan.getSourceInfo().getSourceSchema();
    if (scan.getProjectionSchema() != null) {
      for (Field field : scan.getProjectionSchema()) {
        Field declared = source.getField(field.getName());
        if (declared == null) {
          problems.add(String.format("%s: projected column %s not found in source schema",
              scan.getOperatorType(), field.getName()));
        } else if (!declared.getType().equals(field.getType())) {
          problems.add(String.format("%s: projected column %s has type %s, source schema declares %s",
              scan.getOperatorType(), field.getName(), field.getType(), declared.getType()));
        }
      }
    }
    if (scan.getPushdowns() != null) {
      for (String name : scan.getPushdowns().referencedColumns()) {
        if (!source.contains(name)) {
          problems.add(String.format("%s: pushdown column %s not found in source schema",
              scan.getOperatorType(), name));
        }
      }
    }
    return null;
  }

  @Override
  public Void visitParquetWriter(ParquetWriter writer, List<String> problems) {
    Schema schema = writer.getSchema();
    if (writer.getChild() == null) {
      problems.add(String.format("%s: no input", writer.getOperatorType()));
    } else if (schema != null) {
      Schema input = writer.getChild().getOutputSchema();
      if (!schema.equals(input)) {
        problems.add(String.format("%s: schema %s does not match input schema %s",
            writer.getOperatorType(), schema.getFields(), input == null ? null : input.getFields()));
      }
    }
    OutputFileInfo fileInfo = writer.getFileInfo();
    if (fileInfo != null && fileInfo.isPartitioned() && schema != null) {
      for (LogicalExpression expr : fileInfo.getPartitionCols()) {
        for (String name : expr.getReferencedColumns()) {
          if (!schema.contains(name)) {
            problems.add(String.format("%s: partition column %s not found in writer schema",
                writer.getOperatorType(), name));
          }
        }
      }
    }
    return null;
  }

  @Override
  public Void visitOp(PhysicalOperator op, List<String> problems) {
    // nothing to check for other operators
    return null;
  }

  private static void checkPartitionSpec(PhysicalOperator op, PartitionSpec spec, List<String> problems) {
    if (spec == null) {
      return;
    }
    boolean keyed = spec.getScheme() == PartitionScheme.HASH || spec.getScheme() == PartitionScheme.RANGE;
    if (keyed && (spec.getBy() == null || spec.getBy().isEmpty())) {
      problems.add(String.format("%s: %s partition spec without partitioning expressions",
          op.getOperatorType(), spec.getScheme()));
    }
  }
}
