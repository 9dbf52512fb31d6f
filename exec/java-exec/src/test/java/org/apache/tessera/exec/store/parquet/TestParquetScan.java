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
package org.apache.tessera.exec.store.parquet;

import static org.apache.tessera.common.expression.FieldReference.col;
import static org.apache.tessera.exec.PlanFixtures.fullPushdowns;
import static org.apache.tessera.exec.PlanFixtures.hashByCustomer;
import static org.apache.tessera.exec.PlanFixtures.ordersScan;
import static org.apache.tessera.exec.PlanFixtures.ordersSchema;
import static org.apache.tessera.exec.PlanFixtures.ordersSource;
import static org.apache.tessera.exec.PlanFixtures.projection;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.Collections;

import org.apache.tessera.common.record.Schema;
import org.apache.tessera.common.types.Field;
import org.apache.tessera.common.types.MinorType;
import org.apache.tessera.exec.physical.PartitionSpec;
import org.apache.tessera.exec.physical.base.AbstractPhysicalVisitor;
import org.apache.tessera.exec.physical.base.CoreOperatorType;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.store.ExternalSourceInfo;
import org.apache.tessera.exec.store.InputFileInfos;
import org.apache.tessera.exec.store.Pushdowns;
import org.apache.tessera.exec.store.dfs.FileSystemConfig;
import org.apache.tessera.test.BaseTest;
import org.junit.Test;

public class TestParquetScan extends BaseTest {

  @Test
  public void testFieldsReadBack() {
    Schema projection = projection("o_total", "o_orderkey");
    PartitionSpec spec = hashByCustomer(8);
    Pushdowns pushdowns = fullPushdowns();
    ParquetScan scan = new ParquetScan(projection, ordersSource(), spec, pushdowns);

    assertSame(projection, scan.getProjectionSchema());
    assertEquals(ordersSource(), scan.getSourceInfo());
    assertSame(spec, scan.getPartitionSpec());
    assertSame(pushdowns, scan.getPushdowns());
    assertEquals(Arrays.asList("o_total", "o_orderkey"), scan.getOutputSchema().getNames());
    assertEquals(CoreOperatorType.PARQUET_SCAN, scan.getOperatorType());
    assertFalse(scan.iterator().hasNext());
  }

  @Test
  public void testEmptyProjection() {
    ParquetScan scan = new ParquetScan(Schema.empty(), ordersSource(), PartitionSpec.unknown(1), Pushdowns.none());
    assertEquals(0, scan.getOutputSchema().getFieldCount());
  }

  @Test
  public void testConstructionDoesNotCheckColumns() {
    // projection and pushdowns name columns the dataset does not have
    Schema projection = Schema.of(Field.of("o_missing", MinorType.BOOLEAN), Field.of("o_orderkey", MinorType.UTF8));
    Pushdowns pushdowns = Pushdowns.none().withColumns(Collections.singletonList("no_such_column"));
    ParquetScan scan = new ParquetScan(projection, ordersSource(), PartitionSpec.unknown(1), pushdowns);
    assertSame(projection, scan.getProjectionSchema());
    assertSame(pushdowns, scan.getPushdowns());

    ParquetScan unset = new ParquetScan(null, null, null, null);
    assertEquals(unset, new ParquetScan(null, null, null, null));
  }

  @Test
  public void testEquality() {
    ParquetScan scan = ordersScan();
    assertEquals(ordersScan(), scan);
    assertEquals(ordersScan().hashCode(), scan.hashCode());

    assertNotEquals(scan, scan.withProjectionSchema(projection("o_orderkey")));
    assertNotEquals(scan, scan.withPartitionSpec(PartitionSpec.unknown(3)));
    assertNotEquals(scan, scan.withPushdowns(Pushdowns.none().withLimit(1L)));
    ParquetScan otherSource = new ParquetScan(scan.getProjectionSchema(),
        new ExternalSourceInfo(ordersSchema(),
            InputFileInfos.ofPaths(Collections.singletonList("/tmp/orders.parquet")),
            new ParquetFormatConfig(), FileSystemConfig.local()),
        scan.getPartitionSpec(), scan.getPushdowns());
    assertNotEquals(scan, otherSource);
  }

  @Test
  public void testCopiesLeaveOriginalUntouched() {
    ParquetScan scan = ordersScan();
    ParquetScan pushed = scan.withPushdowns(fullPushdowns());
    assertEquals(Pushdowns.none(), scan.getPushdowns());
    assertEquals(fullPushdowns(), pushed.getPushdowns());
    assertSame(scan.getSourceInfo(), pushed.getSourceInfo());

    ParquetScan repartitioned = scan.withPartitionSpec(hashByCustomer(4));
    assertEquals(PartitionSpec.PartitionScheme.HASH, repartitioned.getPartitionSpec().getScheme());
    assertEquals(Collections.singletonList(col("o_custkey")), repartitioned.getPartitionSpec().getBy());
    assertEquals(PartitionSpec.unknown(2), scan.getPartitionSpec());
  }

  @Test
  public void testNewWithChildren() {
    ParquetScan scan = ordersScan();
    assertSame(scan, scan.getNewWithChildren(Collections.<PhysicalOperator>emptyList()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNewWithChildrenRejectsChildren() {
    ParquetScan scan = ordersScan();
    scan.getNewWithChildren(Collections.<PhysicalOperator>singletonList(ordersScan()));
  }

  @Test
  public void testVisitorDispatch() {
    String kind = ordersScan().accept(new AbstractPhysicalVisitor<String, Void, RuntimeException>() {
      @Override
      public String visitParquetScan(ParquetScan scan, Void value) {
        return "scan of " + scan.getSourceInfo().getFileInfos().size() + " files";
      }
    }, null);
    assertEquals("scan of 2 files", kind);
  }

  @Test
  public void testToString() {
    String text = ordersScan().withPushdowns(fullPushdowns()).toString();
    assertThat(text, containsString("ParquetScan [projection=[o_orderkey#INT64, o_status#UTF8]"));
    assertThat(text, containsString("limit=10"));
  }
}
