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

import com.google.common.net.HostAndPort;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.MiniClusterConstants;
import org.apache.kudu.minicluster.exceptions.TimeoutIOException;
import org.apache.kudu.minicluster.util.DeadlineTracker;
import org.apache.kudu.minicluster.util.DefaultEnvironmentEdge;
import org.apache.kudu.minicluster.util.EnvironmentEdge;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tells whether something accepts TCP connections on an address. Connectability is the only
 * signal we have that a node bound (or released) its listener, so startup and shutdown are both
 * confirmed by polling it.
 */
@InterfaceAudience.Private
public class PortReadinessProbe {
  private static final Logger LOG = LoggerFactory.getLogger(PortReadinessProbe.class);

  /**
   * Evaluated before every poll. Throwing aborts the wait, e.g. because the process that was
   * supposed to bind the port already exited.
   */
  @FunctionalInterface
  public interface Check {
    void verify() throws IOException;
  }

  private static final Check NO_CHECK = () -> {};

  private final long intervalMs;
  private final int connectTimeoutMs;
  private final EnvironmentEdge edge;

  public PortReadinessProbe(Configuration conf) {
    this(conf.getLong(MiniClusterConstants.PROBE_INTERVAL_KEY,
          MiniClusterConstants.DEFAULT_PROBE_INTERVAL_MS),
        conf.getInt(MiniClusterConstants.PROBE_CONNECT_TIMEOUT_KEY,
          MiniClusterConstants.DEFAULT_PROBE_CONNECT_TIMEOUT_MS));
  }

  public PortReadinessProbe(long intervalMs, int connectTimeoutMs) {
    this(intervalMs, connectTimeoutMs, DefaultEnvironmentEdge.INSTANCE);
  }

  public PortReadinessProbe(long intervalMs, int connectTimeoutMs, EnvironmentEdge edge) {
    this.intervalMs = intervalMs;
    this.connectTimeoutMs = connectTimeoutMs;
    this.edge = edge;
  }

  public long getIntervalMs() {
    return intervalMs;
  }

  /**
   * @return true if a TCP connection to {@code address} could be established
   */
  public boolean isOpen(HostAndPort address) {
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(address.getHost(), address.getPort()),
        connectTimeoutMs);
      return true;
    } catch (IOException e) {
      LOG.trace("{} is closed: {}", address, e.getMessage());
      return false;
    }
  }

  public void waitForState(HostAndPort address, boolean desiredOpen, long timeoutMs)
      throws IOException {
    waitForState(address, desiredOpen, timeoutMs, NO_CHECK);
  }

  /**
   * Polls {@code address} until its openness matches {@code desiredOpen}.
   * @param address the address to connect to
   * @param desiredOpen true to wait for a listener, false to wait for it to go away
   * @param timeoutMs how long to keep polling
   * @param check evaluated before every attempt; its exception is propagated as is
   * @throws TimeoutIOException if the state was not observed in time
   * @throws InterruptedIOException if interrupted while sleeping between attempts
   */
  public void waitForState(HostAndPort address, boolean desiredOpen, long timeoutMs, Check check)
      throws IOException {
    DeadlineTracker tracker = new DeadlineTracker(edge);
    String desired = desiredOpen ? "open" : "closed";
    LOG.debug("Waiting up to {} ms for {} to be {}", timeoutMs, address, desired);
    while (true) {
      check.verify();
      if (isOpen(address) == desiredOpen) {
        LOG.debug("{} is {} after {} ms", address, desired, tracker.getElapsedMillis());
        return;
      }
      if (tracker.timedOut(timeoutMs)) {
        throw new TimeoutIOException(address + " is still " + (desiredOpen ? "closed" : "open")
            + " after " + tracker.getElapsedMillis() + " ms");
      }
      try {
        Thread.sleep(Math.max(1, Math.min(intervalMs, tracker.getRemainingMillis(timeoutMs))));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw (InterruptedIOException) new InterruptedIOException(
            "Interrupted waiting for " + address + " to be " + desired).initCause(e);
      }
    }
  }
}
