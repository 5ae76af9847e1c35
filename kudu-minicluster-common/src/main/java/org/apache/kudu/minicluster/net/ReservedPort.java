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
import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.Socket;
import org.apache.kudu.minicluster.util.DeadlineTracker;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a port assigned to a node while the node is not running.
 * <p>
 * The reservation is a bound but unconnected, non listening socket with SO_REUSEADDR. Probing the
 * port still reports it closed, and the kernel will not hand it out as an ephemeral port to
 * anybody else. The owner releases the reservation right before spawning the process that binds
 * the port, and re-acquires it after that process exited, so a restarted node gets the very same
 * address.
 * <p>
 * This only keeps the port out of ephemeral allocation. A socket that sets SO_REUSEADDR itself
 * and binds the port explicitly still succeeds while the reservation is held; on Linux that
 * includes a plain {@link java.net.ServerSocket}, which enables the option by default.
 */
@InterfaceAudience.Private
public class ReservedPort implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ReservedPort.class);

  private static final long REBIND_RETRY_INTERVAL_MS = 100;

  private final HostAndPort address;
  private Socket socket;

  private ReservedPort(HostAndPort address, Socket socket) {
    this.address = address;
    this.socket = socket;
  }

  /**
   * Picks a free port on {@code host} and holds it.
   */
  public static ReservedPort reserve(String host) throws IOException {
    Socket socket = new Socket();
    try {
      socket.setReuseAddress(true);
      socket.bind(new InetSocketAddress(host, 0));
    } catch (IOException e) {
      socket.close();
      throw e;
    }
    HostAndPort address = HostAndPort.fromParts(host, socket.getLocalPort());
    LOG.debug("Reserved {}", address);
    return new ReservedPort(address, socket);
  }

  public HostAndPort getAddress() {
    return address;
  }

  public synchronized boolean isHeld() {
    return socket != null;
  }

  /**
   * Gives up the reservation so a child process can bind the port. No-op if not held.
   */
  public synchronized void release() {
    if (socket == null) {
      return;
    }
    try {
      socket.close();
    } catch (IOException e) {
      LOG.warn("Failed closing reservation of {}", address, e);
    }
    socket = null;
    LOG.debug("Released {}", address);
  }

  /**
   * Takes the port back after its process went away. The kernel may need a moment before the
   * address is bindable again, so this retries until {@code timeoutMs} elapsed.
   * @return true if the port is held when this returns
   */
  public synchronized boolean reacquire(long timeoutMs) throws InterruptedIOException {
    if (socket != null) {
      return true;
    }
    DeadlineTracker tracker = new DeadlineTracker();
    while (true) {
      Socket candidate = new Socket();
      try {
        candidate.setReuseAddress(true);
        candidate.bind(new InetSocketAddress(address.getHost(), address.getPort()));
        socket = candidate;
        LOG.debug("Re-acquired {} after {} ms", address, tracker.getElapsedMillis());
        return true;
      } catch (IOException e) {
        closeCandidate(candidate);
        if (!(e instanceof BindException) || tracker.timedOut(timeoutMs)) {
          LOG.warn("Could not re-acquire {}; it stays unreserved until the node restarts",
            address, e);
          return false;
        }
      }
      try {
        Thread.sleep(REBIND_RETRY_INTERVAL_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw (InterruptedIOException) new InterruptedIOException(
            "Interrupted re-acquiring " + address).initCause(e);
      }
    }
  }

  private void closeCandidate(Socket candidate) {
    try {
      candidate.close();
    } catch (IOException e) {
      LOG.debug("Failed closing unbound socket for {}", address, e);
    }
  }

  @Override
  public void close() {
    release();
  }

  @Override
  public String toString() {
    return "ReservedPort(" + address + ", held=" + isHeld() + ")";
  }
}
