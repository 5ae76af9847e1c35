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
package org.apache.kudu.minicluster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.net.HostAndPort;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.exceptions.IllegalNodeStateException;
import org.apache.kudu.minicluster.exceptions.TimeoutIOException;
import org.apache.kudu.minicluster.net.PortReadinessProbe;
import org.apache.kudu.minicluster.net.ReservedPort;
import org.apache.kudu.minicluster.process.ProcessController;
import org.apache.kudu.minicluster.process.Signal;
import org.apache.kudu.minicluster.process.StopResult;
import org.apache.kudu.minicluster.testclassification.SmallTests;
import org.junit.After;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.TemporaryFolder;
import org.mockito.InOrder;

/**
 * State machine of a single node, with the process and the probe mocked out.
 */
@Category(SmallTests.class)
public class TestNodeProcess {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestNodeProcess.class);

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private ReservedPort port;
  private CommandProvider provider;
  private PortReadinessProbe probe;
  private ProcessController controller;
  private NodeProcess node;

  @Before
  public void setUp() throws IOException {
    port = ReservedPort.reserve(MiniClusterConstants.LOOPBACK_HOST);
    provider = mock(CommandProvider.class);
    probe = mock(PortReadinessProbe.class);
    controller = mock(ProcessController.class);
    when(controller.getPid()).thenReturn(4242L);
    Configuration conf = new Configuration(false);
    conf.setLong(MiniClusterConstants.PORT_REACQUIRE_TIMEOUT_KEY, 1000);
    File dataDir = new File(folder.getRoot(), "tserver-0");
    node = new NodeProcess(ServiceType.TSERVER, "tserver-0", port, dataDir,
        new File(folder.getRoot(), "tserver-0.log"), provider, conf, probe, controller);
  }

  @After
  public void tearDown() {
    port.close();
  }

  private void startNode() throws IOException {
    when(controller.isAlive()).thenReturn(true);
    node.start();
  }

  @Test
  public void testStartReleasesPortAndRuns() throws IOException {
    assertEquals(NodeState.STOPPED, node.getState());
    assertEquals(-1, node.getPid());
    startNode();
    assertEquals(NodeState.RUNNING, node.getState());
    assertEquals(4242L, node.getPid());
    assertFalse(port.isHeld());
    assertTrue(node.getDataDir().isDirectory());
    HostAndPort address = port.getAddress();
    verify(provider).prepare(address);
    verify(provider).getCommand(address);
    verify(probe).waitForState(eq(address), eq(true), anyLong(),
      any(PortReadinessProbe.Check.class));
  }

  @Test
  public void testStartTimeoutQuitsAndKills() throws IOException {
    when(controller.isAlive()).thenReturn(true);
    doThrow(new TimeoutIOException("still closed")).when(probe).waitForState(any(HostAndPort.class),
      eq(true), anyLong(), any(PortReadinessProbe.Check.class));
    try {
      node.start();
      fail("Expected TimeoutIOException");
    } catch (TimeoutIOException e) {
      // expected
    }
    verify(controller).killAndWait(eq(Signal.QUIT), anyLong());
    when(controller.isAlive()).thenReturn(false);
    assertEquals(NodeState.STOPPED, node.getState());
    assertTrue(port.isHeld());
  }

  @Test
  public void testKillPausedNodeContinuesFirst() throws IOException {
    startNode();
    node.pause();
    assertEquals(NodeState.PAUSED, node.getState());
    when(controller.killAndWait(Signal.TERM, MiniClusterConstants.DEFAULT_STOP_TIMEOUT_MS))
        .thenReturn(StopResult.EXITED);
    node.kill();
    InOrder inOrder = inOrder(controller);
    inOrder.verify(controller).signal(Signal.STOP);
    inOrder.verify(controller).signal(Signal.CONT);
    inOrder.verify(controller).killAndWait(Signal.TERM,
      MiniClusterConstants.DEFAULT_STOP_TIMEOUT_MS);
    verify(probe).waitForState(port.getAddress(), false,
      MiniClusterConstants.DEFAULT_STOP_TIMEOUT_MS);
    assertEquals(NodeState.STOPPED, node.getState());
    assertTrue(port.isHeld());
  }

  @Test
  public void testForcedKillStillStops() throws IOException {
    startNode();
    when(controller.killAndWait(eq(Signal.TERM), anyLong())).thenReturn(StopResult.FORCED_KILL);
    node.kill();
    assertEquals(NodeState.STOPPED, node.getState());
  }

  @Test
  public void testKillStoppedNodeIsNoOp() throws IOException {
    node.kill();
    verify(controller, never()).killAndWait(any(Signal.class), anyLong());
    assertEquals(NodeState.STOPPED, node.getState());
  }

  @Test
  public void testUnexpectedExitIsNoticed() throws IOException {
    startNode();
    when(controller.isAlive()).thenReturn(false);
    when(controller.getExitStatus()).thenReturn(139);
    assertEquals(NodeState.STOPPED, node.getState());
    assertTrue(port.isHeld());
    try {
      node.resume();
      fail("Expected IllegalNodeStateException");
    } catch (IllegalNodeStateException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("STOPPED"));
    }
  }

  @Test
  public void testStatusSourceOnlyAskedWhenRunning() throws IOException {
    ServiceStatusSource source = mock(ServiceStatusSource.class);
    NodeStatus stopped = node.snapshot(source);
    assertEquals(NodeState.STOPPED, stopped.getState());
    verify(source, never()).fetch(any(ServiceType.class), any(HostAndPort.class));

    startNode();
    when(source.fetch(ServiceType.TSERVER, port.getAddress()))
        .thenThrow(new IllegalStateException("boom"));
    NodeStatus running = node.snapshot(source);
    assertEquals(NodeState.RUNNING, running.getState());
    assertEquals(4242L, running.getPid());
    assertTrue(running.getServiceStatus().isEmpty());
  }

  @Test
  public void testStatusSourceReturningNullLeavesFieldsEmpty() throws IOException {
    startNode();
    NodeStatus status = node.snapshot((type, address) -> null);
    assertEquals(NodeState.RUNNING, status.getState());
    assertTrue(status.getServiceStatus().isEmpty());
  }

  @Test
  public void testStatusSourceWithNullKeyLeavesFieldsEmpty() throws IOException {
    startNode();
    Map<String, String> fields = new HashMap<>();
    fields.put("uptime", "12s");
    fields.put(null, "orphan");
    NodeStatus status = node.snapshot((type, address) -> fields);
    assertEquals(NodeState.RUNNING, status.getState());
    assertTrue(status.getServiceStatus().isEmpty());
  }

  @Test
  public void testStatusFieldsAreCopied() throws IOException {
    startNode();
    Map<String, String> fields = new HashMap<>();
    fields.put("uptime", "12s");
    NodeStatus status = node.snapshot((type, address) -> fields);
    fields.put("uptime", "13s");
    assertEquals("12s", status.getServiceStatus().get("uptime"));
  }

  @Test
  public void testClosedNodeCannotStart() throws IOException {
    node.close();
    try {
      node.start();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("closed"));
    }
    verify(controller, never()).start(any(), any(), any(File.class));
    assertFalse(port.isHeld());
  }
}
