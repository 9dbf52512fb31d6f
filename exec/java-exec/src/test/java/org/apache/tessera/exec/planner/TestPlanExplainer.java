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

import static org.apache.tessera.exec.PlanFixtures.ordersScan;
import static org.apache.tessera.exec.PlanFixtures.outputTo;
import static org.apache.tessera.exec.PlanFixtures.writerOver;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.apache.tessera.common.config.TesseraConfig;
import org.apache.tessera.common.record.Schema;
import org.apache.tessera.exec.physical.PhysicalPlan;
import org.apache.tessera.exec.physical.base.PhysicalOperator;
import org.apache.tessera.exec.store.parquet.ParquetScan;
import org.apache.tessera.exec.store.parquet.ParquetWriter;
import org.apache.tessera.test.BaseTest;
import org.junit.Test;

public class TestPlanExplainer extends BaseTest {

  @Test
  public void testSingleScan() {
    ParquetScan scan = ordersScan();
    assertEquals(scan + " #1\n", PlanExplainer.explain(scan));
  }

  @Test
  public void testSharedScanPrintedOnce() {
    ParquetScan scan = ordersScan();
    ParquetWriter first = writerOver(scan, "/out/a");
    ParquetWriter second = writerOver(scan, "/out/b");

    String expected = first + " #1\n"
        + "  " + scan + " #2\n"
        + second + " #3\n"
        + "  ^ #2\n";
    assertEquals(expected, PlanExplainer.explain(Arrays.<PhysicalOperator>asList(first, second)));
  }

  @Test
  public void testEqualScansPrintedTwice() {
    ParquetWriter first = writerOver(ordersScan(), "/out/a");
    ParquetWriter second = writerOver(ordersScan(), "/out/b");

    String expected = first + " #1\n"
        + "  " + first.getChild() + " #2\n"
        + second + " #3\n"
        + "  " + second.getChild() + " #4\n";
    assertEquals(expected, PlanExplainer.explain(Arrays.<PhysicalOperator>asList(first, second)));
  }

  @Test
  public void testExplainSurvivesRoundTrip() {
    PhysicalPlanReader reader = new PhysicalPlanReader(TesseraConfig.create());
    ParquetScan scan = ordersScan();
    PhysicalPlan plan = reader.createPlan(Arrays.<PhysicalOperator>asList(
        writerOver(scan, "/out/a"), writerOver(scan, "/out/b")));
    String explain = PlanExplainer.explain(plan);
    assertEquals(explain, PlanExplainer.explain(reader.readPhysicalPlan(reader.writeJson(plan))));
  }

  @Test
  public void testNodeLine() {
    ParquetWriter writer = writerOver(ordersScan(), "/out");
    String line = PlanExplainer.explain(writer).split("\n")[0];
    assertEquals("ParquetWriter [schema=[o_orderkey#INT64, o_status#UTF8], "
        + "fileInfo=OutputFileInfo [rootDir=\"/out\", fileFormat=PARQUET]] #1", line);
  }

  @Test
  public void testWriterWithoutInput() {
    ParquetWriter writer = new ParquetWriter(Schema.empty(), outputTo("/x"), null);
    assertEquals(writer + " #1\n", PlanExplainer.explain(writer));
  }
}
