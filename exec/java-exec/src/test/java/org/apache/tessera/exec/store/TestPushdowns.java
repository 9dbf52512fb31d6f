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
package org.apache.tessera.exec.store;

import static org.apache.tessera.common.expression.FieldReference.col;
import static org.apache.tessera.common.expression.FunctionCall.call;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashSet;

import org.apache.tessera.common.expression.ValueExpressions;
import org.apache.tessera.test.BaseTest;
import org.junit.Test;

public class TestPushdowns extends BaseTest {

  @Test
  public void testNone() {
    Pushdowns none = Pushdowns.none();
    assertTrue(none.isEmpty());
    assertTrue(none.referencedColumns().isEmpty());
    assertEquals(new Pushdowns(null, null, null, null), none);
    assertEquals("Pushdowns []", none.toString());
  }

  @Test
  public void testCopies() {
    Pushdowns limited = Pushdowns.none().withLimit(0L);
    assertFalse(limited.isEmpty());
    assertEquals(Long.valueOf(0), limited.getLimit());
    assertNull(Pushdowns.none().getLimit());
    assertTrue(limited.withLimit(null).isEmpty());
  }

  @Test
  public void testReferencedColumns() {
    Pushdowns pushdowns = Pushdowns.none()
        .withFilters(call("and", call("is_null", col("b")), call("less_than", col("a"), ValueExpressions.getLong(3))))
        .withPartitionFilters(call("equal", col("dt"), ValueExpressions.getChar("2024")))
        .withColumns(Arrays.asList("a", "c"));
    assertEquals(new LinkedHashSet<>(Arrays.asList("b", "a", "c")), pushdowns.referencedColumns());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLimit() {
    Pushdowns.none().withLimit(-1L);
  }
}
