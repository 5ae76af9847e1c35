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
import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Fetches service reported status fields of a running node, e.g. from its status page. The mini
 * cluster copies whatever is returned into {@link NodeStatus#getServiceStatus()} without looking
 * at it.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@FunctionalInterface
public interface ServiceStatusSource {

  /** Reports nothing. */
  ServiceStatusSource NONE = (type, address) -> Collections.emptyMap();

  /**
   * @return the fields, keyed by non-null names; null is taken as no fields
   */
  Map<String, String> fetch(ServiceType type, HostAndPort address) throws IOException;
}
