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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.io.FileUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.exceptions.IllegalNodeStateException;
import org.apache.kudu.minicluster.exceptions.LaunchFailureException;
import org.apache.kudu.minicluster.net.PortReadinessProbe;
import org.apache.kudu.minicluster.net.ReservedPort;
import org.apache.kudu.minicluster.process.ProcessController;
import org.apache.kudu.minicluster.process.Signal;
import org.apache.kudu.minicluster.process.StopResult;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One node of a mini cluster: a fixed address, the reservation that keeps it while the node is
 * down, and the process currently serving it.
 * <p>
 * All transitions are synchronized on the node, so nodes can be driven from different threads
 * independently. A process that exits on its own is noticed on the next operation, which then
 * finds the node {@link NodeState#STOPPED}.
 */
@InterfaceAudience.Private
public class NodeProcess implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(NodeProcess.class);

  /** How long a node that failed to start gets to write its SIGQUIT dump before SIGKILL. */
  private static final long QUIT_GRACE_MS = 1000;

  private final ServiceType type;
  private final String name;
  private final ReservedPort port;
  private final File dataDir;
  private final File logFile;
  private final CommandProvider provider;
  private final PortReadinessProbe probe;
  private final ProcessController controller;
  private final long startTimeoutMs;
  private final long stopTimeoutMs;
  private final long reacquireTimeoutMs;

  private NodeState state = NodeState.STOPPED;
  private boolean closed = false;

  /**
   * @param type kind of service
   * @param name unique within the cluster, e.g. "tserver-2"
   * @param port reservation of the node's address; owned by the node from now on
   * @param dataDir the node's private directory
   * @param logFile where the process output goes
   * @param provider command line and environment of the process
   * @param conf timeouts and probe settings
   */
  public NodeProcess(ServiceType type, String name, ReservedPort port, File dataDir, File logFile,
      CommandProvider provider, Configuration conf) {
    this(type, name, port, dataDir, logFile, provider, conf, new PortReadinessProbe(conf),
        new ProcessController(name));
  }

  @VisibleForTesting
  NodeProcess(ServiceType type, String name, ReservedPort port, File dataDir, File logFile,
      CommandProvider provider, Configuration conf, PortReadinessProbe probe,
      ProcessController controller) {
    this.type = type;
    this.name = name;
    this.port = port;
    this.dataDir = dataDir;
    this.logFile = logFile;
    this.provider = provider;
    this.probe = probe;
    this.controller = controller;
    this.startTimeoutMs = conf.getLong(MiniClusterConstants.START_TIMEOUT_KEY,
      MiniClusterConstants.DEFAULT_START_TIMEOUT_MS);
    this.stopTimeoutMs = conf.getLong(MiniClusterConstants.STOP_TIMEOUT_KEY,
      MiniClusterConstants.DEFAULT_STOP_TIMEOUT_MS);
    this.reacquireTimeoutMs = conf.getLong(MiniClusterConstants.PORT_REACQUIRE_TIMEOUT_KEY,
      MiniClusterConstants.DEFAULT_PORT_REACQUIRE_TIMEOUT_MS);
  }

  public ServiceType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public HostAndPort getAddress() {
    return port.getAddress();
  }

  public File getDataDir() {
    return dataDir;
  }

  public File getLogFile() {
    return logFile;
  }

  public synchronized NodeState getState() {
    refreshState();
    return state;
  }

  /**
   * @return pid of the running or paused process, -1 when stopped
   */
  public synchronized long getPid() {
    refreshState();
    return state == NodeState.STOPPED ? -1 : controller.getPid();
  }

  /**
   * Launches the process and waits until it listens on the node's address.
   * @throws IllegalNodeStateException unless the node is stopped
   * @throws LaunchFailureException if the process could not be run or exited while starting
   * @throws org.apache.kudu.minicluster.exceptions.TimeoutIOException if it did not listen within
   *   the start timeout; the process got SIGQUIT and was then killed
   * @throws IllegalStateException if the node was closed
   */
  public synchronized void start() throws IOException {
    Preconditions.checkState(!closed, "%s on %s is closed", name, getAddress());
    refreshState();
    if (state != NodeState.STOPPED) {
      throw new IllegalNodeStateException("Cannot start " + name + " on " + getAddress()
          + ": it is " + state);
    }
    FileUtils.forceMkdir(dataDir);
    HostAndPort address = getAddress();
    provider.prepare(address);
    List<String> command = provider.getCommand(address);
    Map<String, String> env = provider.getEnvironment();

    port.release();
    try {
      controller.start(command, env, logFile);
    } catch (IOException e) {
      port.reacquire(reacquireTimeoutMs);
      throw e;
    }
    try {
      probe.waitForState(address, true, startTimeoutMs, this::checkStillRunning);
    } catch (IOException e) {
      abortStart(e);
      throw e;
    }
    state = NodeState.RUNNING;
    LOG.info("Started {} on {} with pid {}", name, address, controller.getPid());
  }

  private void checkStillRunning() throws IOException {
    if (!controller.isAlive()) {
      throw new LaunchFailureException(name + " exited with status " + controller.getExitStatus()
          + " before listening on " + getAddress() + ", see " + logFile);
    }
  }

  private void abortStart(IOException cause) {
    if (controller.isAlive()) {
      LOG.warn("{} did not start properly, sending {} for a stack dump", name, Signal.QUIT);
      try {
        controller.killAndWait(Signal.QUIT, QUIT_GRACE_MS);
      } catch (IOException e) {
        cause.addSuppressed(e);
      }
    }
    try {
      port.reacquire(reacquireTimeoutMs);
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  /**
   * Stops the process with SIGTERM, escalating to SIGKILL after the stop timeout, and waits for
   * the address to stop accepting connections. No-op if the node is already stopped.
   */
  public synchronized void kill() throws IOException {
    refreshState();
    if (state == NodeState.STOPPED) {
      LOG.debug("{} on {} is already stopped", name, getAddress());
      return;
    }
    if (state == NodeState.PAUSED) {
      // A stopped process does not act on SIGTERM until it is continued.
      signalIfAlive(Signal.CONT);
    }
    try {
      StopResult result = controller.killAndWait(Signal.TERM, stopTimeoutMs);
      if (result == StopResult.FORCED_KILL) {
        LOG.warn("{} on {} had to be killed forcibly", name, getAddress());
      }
    } catch (IllegalNodeStateException e) {
      if (controller.isAlive()) {
        throw e;
      }
      LOG.info("{} exited by itself before it could be stopped", name);
    }
    probe.waitForState(getAddress(), false, stopTimeoutMs);
    markStopped();
    LOG.info("Killed {} on {}", name, getAddress());
  }

  /**
   * Freezes the process with SIGSTOP. Its port stays bound.
   * @throws IllegalNodeStateException unless the node is running
   */
  public synchronized void pause() throws IOException {
    refreshState();
    if (state != NodeState.RUNNING) {
      throw new IllegalNodeStateException("Cannot pause " + name + " on " + getAddress()
          + ": it is " + state);
    }
    controller.signal(Signal.STOP);
    state = NodeState.PAUSED;
    LOG.info("Paused {} on {}", name, getAddress());
  }

  /**
   * Continues a paused process with SIGCONT.
   * @throws IllegalNodeStateException unless the node is paused
   */
  public synchronized void resume() throws IOException {
    refreshState();
    if (state != NodeState.PAUSED) {
      throw new IllegalNodeStateException("Cannot resume " + name + " on " + getAddress()
          + ": it is " + state);
    }
    controller.signal(Signal.CONT);
    state = NodeState.RUNNING;
    LOG.info("Resumed {} on {}", name, getAddress());
  }

  /**
   * @param source asked for service fields when the node is running
   */
  public NodeStatus snapshot(ServiceStatusSource source) {
    NodeState currentState;
    long pid;
    synchronized (this) {
      currentState = getState();
      pid = getPid();
    }
    Map<String, String> fields = Collections.emptyMap();
    if (currentState == NodeState.RUNNING) {
      try {
        Map<String, String> fetched = source.fetch(type, getAddress());
        if (fetched != null) {
          fields = new TreeMap<>(fetched);
        }
      } catch (IOException | RuntimeException e) {
        LOG.warn("Failed to fetch status of {} on {}", name, getAddress(), e);
      }
    }
    return new NodeStatus(type, getAddress(), currentState, pid, fields);
  }

  /**
   * Stops the process if needed and gives up the port. The node cannot be started afterwards.
   */
  @Override
  public synchronized void close() throws IOException {
    closed = true;
    try {
      kill();
    } finally {
      port.close();
    }
  }

  private void signalIfAlive(Signal signal) throws IOException {
    try {
      controller.signal(signal);
    } catch (IllegalNodeStateException e) {
      if (controller.isAlive()) {
        throw e;
      }
      LOG.debug("{} already exited, not sending {}", name, signal);
    }
  }

  private void refreshState() {
    if (state != NodeState.STOPPED && !controller.isAlive()) {
      LOG.warn("{} on {} exited unexpectedly with status {}", name, getAddress(),
        controller.getExitStatus());
      markStopped();
    }
  }

  private void markStopped() {
    state = NodeState.STOPPED;
    try {
      if (!port.reacquire(reacquireTimeoutMs)) {
        LOG.warn("{} stays unreserved while {} is down", getAddress(), name);
      }
    } catch (IOException e) {
      LOG.warn("Interrupted re-reserving {} for {}", getAddress(), name, e);
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public String toString() {
    return "NodeProcess(" + name + ", " + getAddress() + ", " + state + ")";
  }
}
