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
package org.apache.kudu.minicluster.process;

import org.apache.yetus.audience.InterfaceAudience;

/**
 * Signals the mini cluster sends to the processes it manages.
 */
@InterfaceAudience.Public
public enum Signal {
  /** Suspends the process; used to simulate a hung node. */
  STOP("STOP", true),
  /** Resumes a stopped process. */
  CONT("CONT", true),
  /** Asks the process to shut down. */
  TERM("TERM", false),
  /** Asks the process to dump diagnostics and quit; sent to nodes that failed to start. */
  QUIT("QUIT", true),
  /** Unconditional kill. */
  KILL("KILL", false);

  private final String name;
  private final boolean posixOnly;

  Signal(String name, boolean posixOnly) {
    this.name = name;
    this.posixOnly = posixOnly;
  }

  public String getName() {
    return name;
  }

  /**
   * @return true if the JDK has no portable way of delivering this signal, so it has to be sent
   *   with the kill command
   */
  public boolean isPosixOnly() {
    return posixOnly;
  }

  @Override
  public String toString() {
    return "SIG" + name;
  }
}
