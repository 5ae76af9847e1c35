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
package org.apache.kudu.minicluster.net;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.net.HostAndPort;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kudu.minicluster.MiniClusterClassTestRule;
import org.apache.kudu.minicluster.exceptions.LaunchFailureException;
import org.apache.kudu.minicluster.exceptions.TimeoutIOException;
import org.apache.kudu.minicluster.testclassification.SmallTests;
import org.apache.kudu.minicluster.util.DeadlineTracker;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(SmallTests.class)
public class TestPortReadinessProbe {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestPortReadinessProbe.class);

  private static final String HOST = "127.0.0.1";

  private PortReadinessProbe probe;

  @Before
  public void setUp() {
    probe = new PortReadinessProbe(50, 200);
  }

  private static ServerSocket listen() throws IOException {
    return new ServerSocket(0, 50, InetAddress.getByName(HOST));
  }

  @Test
  public void testIsOpen() throws IOException {
    HostAndPort address;
    try (ServerSocket server = listen()) {
      address = HostAndPort.fromParts(HOST, server.getLocalPort());
      assertTrue(probe.isOpen(address));
    }
    assertFalse(probe.isOpen(address));
  }

  @Test
  public void testWaitForOpenAndClosed() throws IOException {
    try (ServerSocket server = listen()) {
      HostAndPort address = HostAndPort.fromParts(HOST, server.getLocalPort());
      probe.waitForState(address, true, 1000);
      server.close();
      probe.waitForState(address, false, 1000);
    }
  }

  @Test
  public void testTimesOut() throws IOException {
    HostAndPort address;
    try (ServerSocket server = listen()) {
      address = HostAndPort.fromParts(HOST, server.getLocalPort());
    }
    DeadlineTracker tracker = new DeadlineTracker();
    try {
      probe.waitForState(address, true, 300);
      fail("Expected a timeout, " + address + " has no listener");
    } catch (TimeoutIOException e) {
      assertTrue(tracker.getElapsedMillis() >= 300);
      assertTrue(e.getMessage(), e.getMessage().contains("still closed"));
    }
  }

  @Test
  public void testCheckAbortsWait() throws IOException {
    HostAndPort address;
    try (ServerSocket server = listen()) {
      address = HostAndPort.fromParts(HOST, server.getLocalPort());
    }
    AtomicInteger attempts = new AtomicInteger();
    LaunchFailureException failure = new LaunchFailureException("process died");
    try {
      probe.waitForState(address, true, 10000, () -> {
        if (attempts.incrementAndGet() == 3) {
          throw failure;
        }
      });
      fail("Expected the check to abort the wait");
    } catch (LaunchFailureException e) {
      assertSame(failure, e);
    }
  }
}
