/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.kudu.minicluster.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.kudu.minicluster.MiniClusterClassTestRule;
import org.apache.kudu.minicluster.testclassification.SmallTests;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(SmallTests.class)
public class TestDeadlineTracker {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestDeadlineTracker.class);

  private ManualEnvironmentEdge edge;

  @Before
  public void setUp() {
    edge = new ManualEnvironmentEdge();
    edge.setValue(1000);
  }

  @Test
  public void testElapsed() {
    DeadlineTracker tracker = new DeadlineTracker(edge);
    assertEquals(0, tracker.getElapsedMillis());
    edge.incValue(250);
    assertEquals(250, tracker.getElapsedMillis());
  }

  @Test
  public void testTimedOutIsInclusive() {
    DeadlineTracker tracker = new DeadlineTracker(edge);
    edge.incValue(199);
    assertFalse(tracker.timedOut(200));
    assertEquals(1, tracker.getRemainingMillis(200));
    edge.incValue(1);
    assertTrue(tracker.timedOut(200));
    assertEquals(0, tracker.getRemainingMillis(200));
    edge.incValue(1000);
    assertEquals(0, tracker.getRemainingMillis(200));
  }

  @Test
  public void testReset() {
    DeadlineTracker tracker = new DeadlineTracker(edge);
    edge.incValue(500);
    tracker.reset();
    assertEquals(0, tracker.getElapsedMillis());
    assertFalse(tracker.timedOut(1));
  }

  @Test
  public void testDefaultEdgeMovesForward() throws InterruptedException {
    DeadlineTracker tracker = new DeadlineTracker();
    Thread.sleep(20);
    assertTrue(tracker.getElapsedMillis() >= 20);
  }
}
