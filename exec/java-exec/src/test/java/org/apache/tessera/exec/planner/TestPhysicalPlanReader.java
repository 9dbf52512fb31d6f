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

import static org.apache.tessera.common.expression.FieldReference.col;
import static org.apache.tessera.exec.PlanFixtures.fullPushdowns;
import static org.apache.tessera.exec.PlanFixtures.hashByCustomer;
import static org.apache.tessera.exec.PlanFixtures.ordersScan;
import static org.apache.tessera.exec.PlanFixtures.ordersSchema;
import static org.apache.tessera.exec.PlanFixtures.ordersSource;
import static org.apache.tessera.exec.PlanFixtures.projection;
import static org.apache.tessera.exec.PlanFixtures.writerOver;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.tessera.common.config.TesseraConfig;
import org.apache.tessera.common.exceptions.UserException;
import org.apache.tessera.common.logical.PlanProperties;
import org.apache.tessera.common.record.Schema;
import org.apache.tessera.exec.ExecConstants;
import org.apache.tessera.exec.physical.PartitionSpec;
import org.apache.tessera.exec.physical.PhysicalPlan;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.store.ExternalSourceInfo;
import org.apache.tessera.exec.store.FileFormat;
import org.apache.tessera.exec.store.InputFileInfos;
import org.apache.tessera.exec.store.OutputFileInfo;
import org.apache.tessera.exec.store.Pushdowns;
import org.apache.tessera.exec.store.dfs.FileSystemConfig;
import org.apache.tessera.exec.store.easy.json.JSONFormatConfig;
import org.apache.tessera.exec.store.easy.text.TextFormatConfig;
import org.apache.tessera.exec.store.parquet.ParquetScan;
import org.apache.tessera.exec.store.parquet.ParquetWriter;
import org.apache.tessera.test.BaseTest;
import org.junit.BeforeClass;
import org.junit.Test;

public class TestPhysicalPlanReader extends BaseTest {

  private static PhysicalPlanReader reader;
  private static PhysicalPlanReader compactReader;

  @BeforeClass
  public static void setupReaders() {
    reader = new PhysicalPlanReader(TesseraConfig.create());
    Properties props = new Properties();
    props.setProperty(ExecConstants.PLAN_PRETTY_PRINT, "false");
    compactReader = new PhysicalPlanReader(TesseraConfig.create(props));
  }

  private static PhysicalPlan roundTrip(PhysicalPlan plan) {
    String json = reader.writeJson(plan);
    return reader.readPhysicalPlan(json);
  }

  private static PhysicalOperator roundTrip(PhysicalOperator op) {
    return reader.readOperator(reader.writeOperator(op));
  }

  @Test
  public void testScanRoundTrip() {
    for (Schema projection : Arrays.asList(Schema.empty(), projection("o_total"), ordersSchema())) {
      ParquetScan scan = new ParquetScan(projection, ordersSource(), PartitionSpec.unknown(1), Pushdowns.none());
      assertEquals(scan, roundTrip(scan));
    }
  }

  @Test
  public void testPushdownsRoundTrip() {
    ParquetScan empty = ordersScan();
    ParquetScan full = ordersScan().withPushdowns(fullPushdowns()).withPartitionSpec(hashByCustomer(16));
    assertEquals(empty, roundTrip(empty));
    assertEquals(full, roundTrip(full));
    assertEquals(fullPushdowns(), ((ParquetScan) roundTrip(full)).getPushdowns());
  }

  @Test
  public void testFormatsAndStorageRoundTrip() {
    FileSystemConfig storage = new FileSystemConfig("file:///data", true, Collections.singletonMap("retries", "3"));
    InputFileInfos files = InputFileInfos.ofPaths(Arrays.asList("/data/orders.csv"));
    TextFormatConfig csv = TextFormatConfig.builder()
        .fieldDelimiter("|")
        .extractHeader(false)
        .allowVariableColumns(true)
        .build();
    for (ExternalSourceInfo source : Arrays.asList(
        new ExternalSourceInfo(ordersSchema(), files, csv, storage),
        new ExternalSourceInfo(ordersSchema(), files, new TextFormatConfig(), FileSystemConfig.local()),
        new ExternalSourceInfo(ordersSchema(), files, new JSONFormatConfig(1 << 20, null), storage))) {
      ParquetScan scan = ordersScan().withProjectionSchema(ordersSchema());
      scan = new ParquetScan(scan.getProjectionSchema(), source, scan.getPartitionSpec(), scan.getPushdowns());
      assertEquals(scan, roundTrip(scan));
    }
  }

  @Test
  public void testWriterRoundTrip() {
    OutputFileInfo partitioned = new OutputFileInfo("s3://warehouse/out", FileFormat.JSON,
        Arrays.asList(col("o_date")), "gzip");
    ParquetWriter writer = new ParquetWriter(ordersSchema(), partitioned, ordersScan());
    PhysicalOperator read = roundTrip(writer);
    assertEquals(writer, read);
    assertEquals(ordersScan(), ((ParquetWriter) read).getChild());
  }

  @Test
  public void testPlanRoundTrip() {
    PhysicalPlan plan = reader.createPlan(Arrays.<PhysicalOperator>asList(writerOver(ordersScan(), "/out")));
    PhysicalPlan read = roundTrip(plan);
    assertEquals(plan, read);
    assertEquals(PlanProperties.PlanType.TESSERA_PHYSICAL, read.getProperties().type);
    assertEquals(1, read.getProperties().version);
    assertEquals(2, read.getSortedOperators().size());
  }

  @Test
  public void testSharedSubtreeIsPreserved() {
    ParquetScan scan = ordersScan();
    PhysicalPlan plan = reader.createPlan(Arrays.<PhysicalOperator>asList(
        writerOver(scan, "/out/a"), writerOver(scan, "/out/b")));

    String json = compactReader.writeJson(plan);
    // the scan is written in full under the first writer only
    assertEquals(json.indexOf("\"pop\":\"parquet-scan\""), json.lastIndexOf("\"pop\":\"parquet-scan\""));
    assertThat(json, containsString("\"child\":2"));

    PhysicalPlan read = compactReader.readPhysicalPlan(json);
    List<PhysicalOperator> graph = read.getGraph();
    ParquetWriter first = (ParquetWriter) graph.get(0);
    ParquetWriter second = (ParquetWriter) graph.get(1);
    assertSame(first.getChild(), second.getChild());
    assertEquals(scan, first.getChild());
    assertEquals(3, read.getSortedOperators().size());
  }

  @Test
  public void testEqualSubtreesStayDistinct() {
    PhysicalPlan plan = reader.createPlan(Arrays.<PhysicalOperator>asList(
        writerOver(ordersScan(), "/out/a"), writerOver(ordersScan(), "/out/b")));

    String json = compactReader.writeJson(plan);
    assertThat(json, not(containsString("\"child\":2")));

    PhysicalPlan read = compactReader.readPhysicalPlan(json);
    ParquetWriter first = (ParquetWriter) read.getGraph().get(0);
    ParquetWriter second = (ParquetWriter) read.getGraph().get(1);
    assertEquals(first.getChild(), second.getChild());
    assertNotSame(first.getChild(), second.getChild());
    assertEquals(4, read.getSortedOperators().size());
  }

  @Test
  public void testPrettyPrintFollowsConfig() {
    PhysicalPlan plan = reader.createPlan(Arrays.<PhysicalOperator>asList(ordersScan()));
    assertThat(reader.writeJson(plan), containsString("\n"));
    assertThat(compactReader.writeJson(plan), not(containsString("\n")));
  }

  @Test
  public void testReadPlanFromResource() throws Exception {
    PhysicalPlan plan = reader.readPhysicalPlan(getResourceAsString("plans/orders_write.json"));
    assertEquals(2, plan.getGraph().size());
    ParquetWriter first = (ParquetWriter) plan.getGraph().get(0);
    ParquetWriter second = (ParquetWriter) plan.getGraph().get(1);
    assertSame(first.getChild(), second.getChild());
    ParquetScan scan = (ParquetScan) first.getChild();
    assertEquals(Arrays.asList("o_orderkey", "o_status"), scan.getProjectionSchema().getNames());
    assertEquals(Long.valueOf(10), scan.getPushdowns().getLimit());
    assertEquals(PartitionSpec.PartitionScheme.HASH, scan.getPartitionSpec().getScheme());
    assertEquals(Collections.emptyList(), PlanValidator.validate(plan));
  }

  @Test
  public void testMalformedJson() {
    expectPlanError("{\"head\": {\"type\": \"TESSERA_PHYSICAL\", \"version\": 1}, \"graph\": [");
  }

  @Test
  public void testUnknownOperatorType() {
    expectPlanError("{\"head\": {\"type\": \"TESSERA_PHYSICAL\", \"version\": 1}, "
        + "\"graph\": [{\"pop\": \"hash-join\", \"@id\": 1}]}");
  }

  @Test
  public void testUnknownProperty() {
    String json = reader.writeOperator(ordersScan()).replaceFirst("\\{", "{\"rowCount\": 12,");
    try {
      reader.readOperator(json);
      fail("Expected a plan error");
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.PLAN, e.getErrorType());
    }
  }

  @Test
  public void testInvalidDescriptorValue() {
    String json = reader.writeOperator(ordersScan()).replace("\"numPartitions\" : 2", "\"numPartitions\" : 0");
    try {
      reader.readOperator(json);
      fail("Expected a plan error");
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.PLAN, e.getErrorType());
      assertThat(e.getMessage(), containsString("numPartitions must be positive"));
    }
  }

  private static void expectPlanError(String json) {
    try {
      reader.readPhysicalPlan(json);
      fail("Expected a plan error");
    } catch (UserException e) {
      assertEquals(UserException.ErrorType.PLAN, e.getErrorType());
      assertThat(e.getMessage(), containsString("Failure while reading physical plan"));
    }
  }
}
