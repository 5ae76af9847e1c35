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
 * Type of the service daemon
 */
@InterfaceAudience.Public
public enum ServiceType {
  MASTER("master", "kudu-master"),
  TSERVER("tserver", "kudu-tserver"),
  HIVE_METASTORE("hms", null);

  private final String name;
  private final String executable;

  ServiceType(String name, String executable) {
    this.name = name;
    this.executable = executable;
  }

  public String getName() {
    return name;
  }

  /**
   * @return name of the binary in the kudu bin directory, null for services that are not kudu
   *   daemons
   */
  public String getExecutable() {
    return executable;
  }

  @Override
  public String toString() {
    return getName();
  }
}
