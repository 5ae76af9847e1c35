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

import org.apache.yetus.audience.InterfaceAudience;

/**
 * Lifecycle state of a node as driven through the mini cluster.
 */
@InterfaceAudience.Public
public enum NodeState {
  /** No process; the port is reserved for the next start. */
  STOPPED,
  /** The process is listening on its port. */
  RUNNING,
  /** The process got SIGSTOP. Its port stays bound but nothing is served. */
  PAUSED
}
