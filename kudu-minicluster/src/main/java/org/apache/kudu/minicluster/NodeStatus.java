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

import com.google.common.net.HostAndPort;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Point in time view of one node.
 */
@InterfaceAudience.Public
public final class NodeStatus {
  private final ServiceType type;
  private final HostAndPort address;
  private final NodeState state;
  private final long pid;
  private final Map<String, String> serviceStatus;

  public NodeStatus(ServiceType type, HostAndPort address, NodeState state, long pid,
      Map<String, String> serviceStatus) {
    this.type = type;
    this.address = address;
    this.state = state;
    this.pid = pid;
    this.serviceStatus = Collections.unmodifiableMap(new TreeMap<>(serviceStatus));
  }

  public ServiceType getType() {
    return type;
  }

  public HostAndPort getAddress() {
    return address;
  }

  public NodeState getState() {
    return state;
  }

  /**
   * @return pid of the node's process, -1 when it is stopped
   */
  public long getPid() {
    return pid;
  }

  /**
   * @return fields reported by the {@link ServiceStatusSource}, empty when the node is not running
   *   or the source failed
   */
  public Map<String, String> getServiceStatus() {
    return serviceStatus;
  }

  @Override
  public String toString() {
    return "NodeStatus{type=" + type + ", address=" + address + ", state=" + state + ", pid=" + pid
        + ", serviceStatus=" + serviceStatus + '}';
  }
}
