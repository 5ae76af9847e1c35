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
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.kudu.minicluster.security.SaslProtection;
import org.apache.kudu.minicluster.security.SecurityConfig;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Describes the cluster to start: how many masters and tablet servers, whether it runs secured,
 * whether it gets a Hive Metastore, and extra flags for the daemons.
 *
 * To create an object, use a {@link Builder}.
 * Example usage:
 * <pre>
 *    ClusterSpec spec = ClusterSpec.builder()
 *        .numMasters(3).numTservers(3).enableHiveMetastore().build();
 * </pre>
 *
 * Default values can be found in {@link Builder}.
 */
@InterfaceAudience.Public
public final class ClusterSpec {
  /**
   * Number of masters to start. Zero is allowed; tablet servers then get an empty master list.
   */
  private final int numMasters;

  /**
   * Number of tablet servers to start.
   */
  private final int numTservers;

  /**
   * Whether the daemons (and the metastore) run with Kerberos.
   */
  private final boolean kerberosEnabled;

  /**
   * Identity the daemons run under. Null with Kerberos enabled means the cluster starts its own
   * KDC and creates the identities there.
   */
  private final SecurityConfig securityConfig;

  /**
   * Wire protection of identities created by the cluster's own KDC.
   */
  private final SaslProtection protection;

  /**
   * Whether to start a Hive Metastore and point the masters at it.
   */
  private final boolean hiveMetastoreEnabled;

  private final List<String> extraMasterFlags;

  private final List<String> extraTserverFlags;

  /**
   * Overrides {@link MiniClusterConstants#START_TIMEOUT_KEY} when positive.
   */
  private final long startupTimeoutMs;

  /**
   * Directory for all cluster data. Null to get a fresh directory under the base test directory,
   * which is removed again on close.
   */
  private final File clusterRoot;

  /**
   * Private constructor. Use {@link Builder#build()}.
   */
  private ClusterSpec(int numMasters, int numTservers, boolean kerberosEnabled,
      SecurityConfig securityConfig, SaslProtection protection, boolean hiveMetastoreEnabled,
      List<String> extraMasterFlags, List<String> extraTserverFlags, long startupTimeoutMs,
      File clusterRoot) {
    this.numMasters = numMasters;
    this.numTservers = numTservers;
    this.kerberosEnabled = kerberosEnabled;
    this.securityConfig = securityConfig;
    this.protection = protection;
    this.hiveMetastoreEnabled = hiveMetastoreEnabled;
    this.extraMasterFlags = extraMasterFlags;
    this.extraTserverFlags = extraTserverFlags;
    this.startupTimeoutMs = startupTimeoutMs;
    this.clusterRoot = clusterRoot;
  }

  public int getNumMasters() {
    return numMasters;
  }

  public int getNumTservers() {
    return numTservers;
  }

  public boolean isKerberosEnabled() {
    return kerberosEnabled;
  }

  public SecurityConfig getSecurityConfig() {
    return securityConfig;
  }

  public SaslProtection getProtection() {
    return protection;
  }

  public boolean isHiveMetastoreEnabled() {
    return hiveMetastoreEnabled;
  }

  public List<String> getExtraMasterFlags() {
    return extraMasterFlags;
  }

  public List<String> getExtraTserverFlags() {
    return extraTserverFlags;
  }

  /**
   * @return the start timeout for this cluster, or a non positive value to use the configured one
   */
  public long getStartupTimeoutMs() {
    return startupTimeoutMs;
  }

  public File getClusterRoot() {
    return clusterRoot;
  }

  @Override
  public String toString() {
    return "ClusterSpec{numMasters=" + numMasters + ", numTservers=" + numTservers
        + ", kerberosEnabled=" + kerberosEnabled + ", securityConfig=" + securityConfig
        + ", protection=" + protection + ", hiveMetastoreEnabled=" + hiveMetastoreEnabled
        + ", extraMasterFlags=" + extraMasterFlags + ", extraTserverFlags=" + extraTserverFlags
        + ", startupTimeoutMs=" + startupTimeoutMs + ", clusterRoot=" + clusterRoot + '}';
  }

  /**
   * @return a new builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder pattern for creating a {@link ClusterSpec}.
   *
   * The default values of its fields should be considered public and constant. Changing the default
   * values may cause other tests fail.
   */
  public static final class Builder {
    private int numMasters = 1;
    private int numTservers = 3;
    private boolean kerberosEnabled = false;
    private SecurityConfig securityConfig = null;
    private SaslProtection protection = SaslProtection.AUTHENTICATION;
    private boolean hiveMetastoreEnabled = false;
    private final List<String> extraMasterFlags = new ArrayList<>();
    private final List<String> extraTserverFlags = new ArrayList<>();
    private long startupTimeoutMs = 0;
    private File clusterRoot = null;

    private Builder() {
    }

    public ClusterSpec build() {
      Preconditions.checkArgument(numMasters >= 0, "numMasters must not be negative: %s",
        numMasters);
      Preconditions.checkArgument(numTservers >= 0, "numTservers must not be negative: %s",
        numTservers);
      return new ClusterSpec(numMasters, numTservers, kerberosEnabled || securityConfig != null,
          securityConfig, protection, hiveMetastoreEnabled,
          Collections.unmodifiableList(new ArrayList<>(extraMasterFlags)),
          Collections.unmodifiableList(new ArrayList<>(extraTserverFlags)), startupTimeoutMs,
          clusterRoot);
    }

    public Builder numMasters(int numMasters) {
      this.numMasters = numMasters;
      return this;
    }

    public Builder numTservers(int numTservers) {
      this.numTservers = numTservers;
      return this;
    }

    /**
     * Runs the cluster secured, with identities from a KDC the cluster starts itself.
     */
    public Builder enableKerberos() {
      this.kerberosEnabled = true;
      return this;
    }

    /**
     * Runs the cluster secured under an existing identity.
     */
    public Builder securityConfig(SecurityConfig securityConfig) {
      this.securityConfig = securityConfig;
      return this;
    }

    public Builder protection(SaslProtection protection) {
      this.protection = Preconditions.checkNotNull(protection, "protection");
      return this;
    }

    public Builder enableHiveMetastore() {
      this.hiveMetastoreEnabled = true;
      return this;
    }

    public Builder addMasterFlags(String... flags) {
      this.extraMasterFlags.addAll(Arrays.asList(flags));
      return this;
    }

    public Builder addTserverFlags(String... flags) {
      this.extraTserverFlags.addAll(Arrays.asList(flags));
      return this;
    }

    public Builder startupTimeoutMs(long startupTimeoutMs) {
      this.startupTimeoutMs = startupTimeoutMs;
      return this;
    }

    public Builder clusterRoot(File clusterRoot) {
      this.clusterRoot = clusterRoot;
      return this;
    }
  }
}
