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

import org.apache.yetus.audience.InterfaceAudience;

/**
 * Measures the time elapsed since it was created or last reset. Every polling loop of the mini
 * cluster uses one of these to decide when to give up.
 * <p>
 * Not thread safe. Create one per wait.
 */
@InterfaceAudience.Private
public class DeadlineTracker {

  private final EnvironmentEdge edge;
  private long start;

  public DeadlineTracker() {
    this(DefaultEnvironmentEdge.INSTANCE);
  }

  public DeadlineTracker(EnvironmentEdge edge) {
    this.edge = edge;
    this.start = edge.currentTime();
  }

  /** Restarts the measurement from now. */
  public void reset() {
    start = edge.currentTime();
  }

  public long getElapsedMillis() {
    return edge.currentTime() - start;
  }

  /**
   * @param timeoutMs the deadline, relative to the start
   * @return milliseconds left before the deadline, never negative
   */
  public long getRemainingMillis(long timeoutMs) {
    return Math.max(0, timeoutMs - getElapsedMillis());
  }

  /**
   * @param timeoutMs the deadline, relative to the start
   * @return true once at least {@code timeoutMs} have elapsed
   */
  public boolean timedOut(long timeoutMs) {
    return getElapsedMillis() >= timeoutMs;
  }

  @Override
  public String toString() {
    return "DeadlineTracker(elapsed=" + getElapsedMillis() + "ms)";
  }
}
