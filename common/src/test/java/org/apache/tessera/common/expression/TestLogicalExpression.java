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
package org.apache.tessera.common.expression;

import static org.apache.tessera.common.expression.FieldReference.col;
import static org.apache.tessera.common.expression.FunctionCall.call;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashSet;

import org.apache.tessera.common.util.JacksonUtils;
import org.apache.tessera.test.BaseTest;
import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

public class TestLogicalExpression extends BaseTest {

  private static final ObjectMapper mapper = JacksonUtils.createObjectMapper();

  private static LogicalExpression predicate() {
    return call("and",
        call("greater_than", col("l_quantity"), ValueExpressions.getLong(10)),
        call("or",
            call("equal", col("l_shipmode"), ValueExpressions.getChar("AIR")),
            call("is_null", col("l_quantity"))));
  }

  @Test
  public void testReferencedColumns() {
    assertEquals(new LinkedHashSet<>(Arrays.asList("l_quantity", "l_shipmode")),
        predicate().getReferencedColumns());
    assertTrue(ValueExpressions.getDouble(1.5).getReferencedColumns().isEmpty());
  }

  @Test
  public void testExpressionString() {
    assertEquals("and(greater_than(col(l_quantity), 10), or(equal(col(l_shipmode), \"AIR\"), is_null(col(l_quantity))))",
        predicate().toExpressionString());
    assertEquals("null", ValueExpressions.getNull().toString());
    assertEquals("false", ValueExpressions.getBoolean(false).toString());
  }

  @Test
  public void testEquality() {
    assertEquals(predicate(), predicate());
    assertEquals(predicate().hashCode(), predicate().hashCode());
    assertNotEquals(call("f", col("a")), call("f", col("b")));
    assertNotEquals(ValueExpressions.getLong(1), ValueExpressions.getDouble(1));
  }

  @Test
  public void testJsonRoundTrip() throws Exception {
    LogicalExpression expr = call("f", predicate(), ValueExpressions.getDouble(0.25),
        ValueExpressions.getBoolean(true), ValueExpressions.getNull());
    String json = mapper.writeValueAsString(expr);
    assertTrue(json, json.contains("\"expr\":\"call\""));
    assertEquals(expr, mapper.readValue(json, LogicalExpression.class));
  }
}
