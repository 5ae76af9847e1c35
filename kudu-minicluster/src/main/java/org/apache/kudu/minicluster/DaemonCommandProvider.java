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

import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.kudu.minicluster.security.SecurityConfig;
import org.apache.kudu.minicluster.security.SecurityConfigurator;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * CommandProvider to run a kudu-master or kudu-tserver out of the kudu bin directory.
 */
@InterfaceAudience.Private
class DaemonCommandProvider extends CommandProvider {
  static final String KUDU_HOME_ENV = "KUDU_HOME";

  private final ServiceType type;
  private final File binDir;
  private final File dataDir;
  private final String masterAddresses;
  private final String hmsUris;
  private final SecurityConfig securityConfig;
  private final List<String> extraFlags;

  /**
   * @param type {@link ServiceType#MASTER} or {@link ServiceType#TSERVER}
   * @param binDir directory holding the executable
   * @param dataDir passed as --fs_data_dir
   * @param masterAddresses comma separated addresses of all masters
   * @param hmsUris thrift URI of the metastore masters integrate with, null for none
   * @param securityConfig identity of the daemon, null when unsecured
   * @param extraFlags appended after the generated flags
   */
  DaemonCommandProvider(ServiceType type, File binDir, File dataDir, String masterAddresses,
      String hmsUris, SecurityConfig securityConfig, List<String> extraFlags) {
    Preconditions.checkArgument(type.getExecutable() != null, "%s is not a kudu daemon", type);
    this.type = type;
    this.binDir = binDir;
    this.dataDir = dataDir;
    this.masterAddresses = masterAddresses;
    this.hmsUris = hmsUris;
    this.securityConfig = securityConfig;
    this.extraFlags = extraFlags;
  }

  @Override
  public List<String> getCommand(HostAndPort address) {
    List<String> command = new ArrayList<>();
    command.add(new File(binDir, type.getExecutable()).getAbsolutePath());
    command.add("--fs_data_dir=" + dataDir.getAbsolutePath());
    if (type == ServiceType.MASTER) {
      command.add("--master_addresses=" + masterAddresses);
      if (hmsUris != null) {
        command.add("--hive_metastore_uris=" + hmsUris);
      }
    } else {
      command.add("--tserver_master_addrs=" + masterAddresses);
    }
    command.addAll(SecurityConfigurator.getDaemonFlags(securityConfig));
    command.addAll(extraFlags);
    command.add("--port=" + address.getPort());
    return command;
  }

  @Override
  public Map<String, String> getEnvironment() {
    Map<String, String> env = new TreeMap<>();
    File kuduHome = binDir.getAbsoluteFile().getParentFile();
    env.put(KUDU_HOME_ENV, (kuduHome == null ? binDir.getAbsoluteFile() : kuduHome).getPath());
    env.put(MiniClusterConstants.BIN_DIR_ENV, binDir.getAbsolutePath());
    env.putAll(SecurityConfigurator.getEnvironment(securityConfig));
    return Collections.unmodifiableMap(env);
  }
}
