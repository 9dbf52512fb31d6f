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
import static org.apache.tessera.common.expression.FunctionCall.call;
import static org.apache.tessera.exec.PlanFixtures.ordersScan;
import static org.apache.tessera.exec.PlanFixtures.ordersSchema;
import static org.apache.tessera.exec.PlanFixtures.outputTo;
import static org.apache.tessera.exec.PlanFixtures.projection;
import static org.apache.tessera.exec.PlanFixtures.writerOver;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;

import org.apache.tessera.common.record.Schema;
import org.apache.tessera.common.types.DataType;
import org.apache.tessera.common.types.Field;
import org.apache.tessera.common.types.MinorType;
import org.apache.tessera.exec.physical.base.CoreOperatorType;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.store.FileFormat;
import org.apache.tessera.exec.store.OutputFileInfo;
import org.apache.tessera.test.BaseTest;
import org.junit.Test;

public class TestParquetWriter extends BaseTest {

  @Test
  public void testFieldsReadBack() {
    ParquetScan scan = ordersScan();
    Schema schema = scan.getOutputSchema();
    OutputFileInfo fileInfo = new OutputFileInfo("s3://warehouse/out", FileFormat.PARQUET, null, "zstd");
    ParquetWriter writer = new ParquetWriter(schema, fileInfo, scan);

    assertSame(schema, writer.getSchema());
    assertSame(fileInfo, writer.getFileInfo());
    assertSame(scan, writer.getChild());
    assertEquals(CoreOperatorType.PARQUET_WRITER, writer.getOperatorType());

    Iterator<PhysicalOperator> children = writer.iterator();
    assertSame(scan, children.next());
    assertEquals(false, children.hasNext());
  }

  @Test
  public void testChildIsShared() {
    ParquetScan scan = ordersScan();
    ParquetWriter first = writerOver(scan, "/out/a");
    ParquetWriter second = new ParquetWriter(scan.getOutputSchema(), outputTo("/out/b"), scan);
    assertSame(first.getChild(), second.getChild());
  }

  @Test
  public void testConstructionDoesNotCheckSchema() {
    // written schema disagrees with what the scan produces
    ParquetWriter writer = new ParquetWriter(ordersSchema(), outputTo("/out"), ordersScan());
    assertEquals(ordersSchema(), writer.getSchema());
    assertNotEquals(writer.getSchema(), writer.getChild().getOutputSchema());
  }

  @Test
  public void testEquality() {
    ParquetWriter writer = writerOver(ordersScan(), "/out");
    assertEquals(writerOver(ordersScan(), "/out"), writer);
    assertEquals(writerOver(ordersScan(), "/out").hashCode(), writer.hashCode());

    assertNotEquals(writer, writerOver(ordersScan(), "/elsewhere"));
    assertNotEquals(writer, new ParquetWriter(ordersSchema(), writer.getFileInfo(), writer.getChild()));
    assertNotEquals(writer, new ParquetWriter(writer.getSchema(), writer.getFileInfo(),
        ordersScan().withProjectionSchema(projection("o_orderkey"))));
  }

  @Test
  public void testNewWithChildren() {
    ParquetWriter writer = writerOver(ordersScan(), "/out");
    ParquetScan other = ordersScan().withProjectionSchema(projection("o_status"));
    ParquetWriter copy = (ParquetWriter) writer.getNewWithChildren(Collections.<PhysicalOperator>singletonList(other));
    assertSame(other, copy.getChild());
    assertSame(writer.getSchema(), copy.getSchema());
    assertSame(writer.getFileInfo(), copy.getFileInfo());
    assertEquals(ordersScan(), writer.getChild());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNewWithChildrenRequiresOneChild() {
    writerOver(ordersScan(), "/out").getNewWithChildren(Collections.<PhysicalOperator>emptyList());
  }

  @Test
  public void testOutputSchemaUnpartitioned() {
    ParquetWriter writer = writerOver(ordersScan(), "/out");
    assertEquals(Schema.newBuilder().addField("path", MinorType.UTF8).build(), writer.getOutputSchema());
  }

  @Test
  public void testOutputSchemaPartitioned() {
    OutputFileInfo fileInfo = new OutputFileInfo("/out", FileFormat.CSV,
        Arrays.asList(col("o_date"), col("o_total"), call("year", col("o_date")), col("o_date")), null);
    ParquetWriter writer = new ParquetWriter(ordersSchema(), fileInfo, ordersScan());

    Schema expected = Schema.newBuilder()
        .addField("path", MinorType.UTF8)
        .addField("o_date", MinorType.DATE)
        .addField("o_total", DataType.decimal(15, 2))
        .addField("year(col(o_date))", MinorType.UTF8)
        .build();
    assertEquals(expected, writer.getOutputSchema());
  }

  @Test
  public void testOutputSchemaRenamesClashingPartitionColumns() {
    Schema schema = Schema.of(Field.of("path", MinorType.INT64), Field.of("path_1", MinorType.DATE));
    OutputFileInfo fileInfo = new OutputFileInfo("/out", FileFormat.PARQUET,
        Arrays.asList(col("path"), col("path_1"), col("path")), null);
    ParquetWriter writer = new ParquetWriter(schema, fileInfo, null);

    Schema expected = Schema.newBuilder()
        .addField("path", MinorType.UTF8)
        .addField("path_1", MinorType.INT64)
        .addField("path_1_1", MinorType.DATE)
        .build();
    assertEquals(expected, writer.getOutputSchema());
  }
}
