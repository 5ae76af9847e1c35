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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.MultipleIOException;
import org.apache.kudu.minicluster.exceptions.IllegalNodeStateException;
import org.apache.kudu.minicluster.exceptions.MiniClusterIOException;
import org.apache.kudu.minicluster.exceptions.NotFoundException;
import org.apache.kudu.minicluster.hms.MiniHms;
import org.apache.kudu.minicluster.net.ReservedPort;
import org.apache.kudu.minicluster.security.ClusterKdc;
import org.apache.kudu.minicluster.security.SaslProtection;
import org.apache.kudu.minicluster.security.SecurityConfig;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Kudu cluster of separate master and tablet server processes, plus optionally a Hive
 * Metastore, all running on the loopback interface for the duration of a test.
 * <p>
 * Every node gets a port that is reserved for it when the cluster is built and kept until the
 * cluster is closed, so a node restarted after {@link #killOnAddress(HostAndPort)} comes back on
 * the very same address. Nodes are addressed by that {@link HostAndPort}.
 * <p>
 * Example usage:
 * <pre>
 *   try (MiniKuduCluster cluster = new MiniKuduCluster.MiniKuduClusterBuilder()
 *       .numMasters(1).numTservers(3).build()) {
 *     HostAndPort ts = cluster.getTserverHostPorts().get(0);
 *     cluster.killTabletServerOnHostPort(ts);
 *     cluster.restartDeadTabletServerOnHostPort(ts);
 *   }
 * </pre>
 * The daemons are taken from the directory named by {@link MiniClusterConstants#BIN_DIR_KEY} or
 * the {@link MiniClusterConstants#BIN_DIR_ENV} environment variable.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class MiniKuduCluster implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(MiniKuduCluster.class);

  static final String KDC_DIR = "kdc";
  static final String HMS_DIR = "hms";
  static final String LOG_DIR = "logs";
  static final String KUDU_SERVICE_NAME = "kudu";
  static final String HIVE_SERVICE_NAME = "hive";

  private final ClusterSpec spec;
  private final Configuration conf;
  private final MiniClusterCommonTestingUtility testUtil;

  /** Every node in start order. */
  private final Map<HostAndPort, NodeProcess> nodes = new LinkedHashMap<>();
  private final List<NodeProcess> masters = new ArrayList<>();
  private final List<NodeProcess> tservers = new ArrayList<>();
  private final List<ReservedPort> ports = new ArrayList<>();

  private File binDir;
  private File clusterRoot;
  private boolean ownsClusterRoot;
  private ClusterKdc kdc;
  private SecurityConfig securityConfig;
  private SecurityConfig hmsSecurityConfig;
  private MiniHms hms;
  private volatile ServiceStatusSource statusSource = ServiceStatusSource.NONE;
  private volatile boolean closed = false;

  MiniKuduCluster(ClusterSpec spec, Configuration conf) {
    this.spec = spec;
    this.conf = new Configuration(conf);
    if (spec.getStartupTimeoutMs() > 0) {
      this.conf.setLong(MiniClusterConstants.START_TIMEOUT_KEY, spec.getStartupTimeoutMs());
    }
    this.testUtil = new MiniClusterCommonTestingUtility(this.conf);
  }

  /**
   * Starts a cluster as described by {@code spec} with the default configuration.
   * @see #build(ClusterSpec, Configuration)
   */
  public static MiniKuduCluster build(ClusterSpec spec) throws IOException {
    return build(spec, MiniClusterConfiguration.create());
  }

  /**
   * Starts a cluster: the metastore if requested, then the masters, then the tablet servers.
   * Returns once every node listens on its address. If anything fails, whatever was started is
   * torn down again and the original error is thrown, carrying teardown failures as suppressed
   * exceptions.
   * @throws NotFoundException if the kudu binaries (or the metastore's installations) are missing
   * @throws org.apache.kudu.minicluster.exceptions.TimeoutIOException if a node did not listen in
   *   time
   * @throws org.apache.kudu.minicluster.exceptions.LaunchFailureException if a node could not be
   *   run or exited while starting
   */
  public static MiniKuduCluster build(ClusterSpec spec, Configuration conf) throws IOException {
    return startOrTearDown(new MiniKuduCluster(spec, conf));
  }

  @VisibleForTesting
  static MiniKuduCluster startOrTearDown(MiniKuduCluster cluster) throws IOException {
    try {
      cluster.start();
    } catch (IOException | RuntimeException e) {
      LOG.error("Failed to start mini cluster {}, tearing it down", cluster.spec, e);
      try {
        cluster.close();
      } catch (IOException t) {
        e.addSuppressed(t);
      }
      throw e;
    }
    return cluster;
  }

  void start() throws IOException {
    binDir = resolveBinDir();
    setupClusterRoot();
    File logDir = new File(clusterRoot, LOG_DIR);
    FileUtils.forceMkdir(logDir);
    String host = conf.get(MiniClusterConstants.BIND_HOST_KEY,
      MiniClusterConstants.DEFAULT_BIND_HOST);
    setupSecurity(host);

    if (spec.isHiveMetastoreEnabled()) {
      hms = new MiniHms(conf, binDir, new File(clusterRoot, HMS_DIR), reserve(host));
      if (hmsSecurityConfig != null) {
        hms.enableKerberos(hmsSecurityConfig);
      }
      register(hms.getNode());
    }

    List<ReservedPort> masterPorts = new ArrayList<>();
    for (int i = 0; i < spec.getNumMasters(); i++) {
      masterPorts.add(reserve(host));
    }
    List<HostAndPort> masterAddresses = new ArrayList<>();
    for (ReservedPort port : masterPorts) {
      masterAddresses.add(port.getAddress());
    }
    String masterAddressesString = StringUtils.join(masterAddresses, ",");
    String hmsUris = hms == null ? null : hms.getUris();

    for (int i = 0; i < masterPorts.size(); i++) {
      masters.add(createDaemon(ServiceType.MASTER, i, masterPorts.get(i), logDir,
        masterAddressesString, hmsUris, spec.getExtraMasterFlags()));
    }
    for (int i = 0; i < spec.getNumTservers(); i++) {
      tservers.add(createDaemon(ServiceType.TSERVER, i, reserve(host), logDir,
        masterAddressesString, null, spec.getExtraTserverFlags()));
    }

    if (hms != null) {
      hms.start();
    }
    for (NodeProcess master : masters) {
      master.start();
    }
    for (NodeProcess tserver : tservers) {
      tserver.start();
    }
    LOG.info("Started mini cluster in {}: masters {}, tablet servers {}{}", clusterRoot,
      getMasterHostPorts(), getTserverHostPorts(), hms == null ? "" : ", metastore " + hms);
  }

  private File resolveBinDir() throws NotFoundException {
    String dir = conf.get(MiniClusterConstants.BIN_DIR_KEY);
    if (dir == null) {
      dir = System.getenv(MiniClusterConstants.BIN_DIR_ENV);
    }
    if (dir == null) {
      throw new NotFoundException("Kudu bin directory is not configured, set "
          + MiniClusterConstants.BIN_DIR_KEY + " or " + MiniClusterConstants.BIN_DIR_ENV);
    }
    File bin = new File(dir).getAbsoluteFile();
    if (!bin.isDirectory()) {
      throw new NotFoundException("Kudu bin directory does not exist", bin.getPath());
    }
    if (spec.getNumMasters() > 0) {
      checkExecutable(bin, ServiceType.MASTER);
    }
    if (spec.getNumTservers() > 0) {
      checkExecutable(bin, ServiceType.TSERVER);
    }
    return bin;
  }

  private static void checkExecutable(File bin, ServiceType type) throws NotFoundException {
    File exe = new File(bin, type.getExecutable());
    if (!exe.isFile() || !exe.canExecute()) {
      throw new NotFoundException(type.getExecutable() + " executable not found", exe.getPath());
    }
  }

  private void setupClusterRoot() throws IOException {
    if (spec.getClusterRoot() != null) {
      testUtil.setDataTestDir(spec.getClusterRoot());
      ownsClusterRoot = false;
    } else {
      ownsClusterRoot = true;
    }
    clusterRoot = testUtil.getDataTestDir();
    FileUtils.forceMkdir(clusterRoot);
  }

  private void setupSecurity(String host) throws IOException {
    if (!spec.isKerberosEnabled()) {
      return;
    }
    if (spec.getSecurityConfig() != null) {
      securityConfig = spec.getSecurityConfig();
      hmsSecurityConfig = securityConfig;
      return;
    }
    kdc = ClusterKdc.start(new File(clusterRoot, KDC_DIR));
    SaslProtection protection = spec.getProtection();
    securityConfig = kdc.createServiceIdentity(KUDU_SERVICE_NAME, host, protection);
    if (spec.isHiveMetastoreEnabled()) {
      hmsSecurityConfig = kdc.createServiceIdentity(HIVE_SERVICE_NAME, host, protection);
    }
  }

  private ReservedPort reserve(String host) throws IOException {
    ReservedPort port = ReservedPort.reserve(host);
    ports.add(port);
    return port;
  }

  private NodeProcess createDaemon(ServiceType type, int index, ReservedPort port, File logDir,
      String masterAddresses, String hmsUris, List<String> extraFlags) throws IOException {
    String name = type.getName() + "-" + index;
    File dataDir = new File(clusterRoot, name);
    CommandProvider provider = new DaemonCommandProvider(type, binDir, dataDir, masterAddresses,
        hmsUris, securityConfig, extraFlags);
    NodeProcess node = new NodeProcess(type, name, port, dataDir, new File(logDir, name + ".log"),
        provider, conf);
    register(node);
    return node;
  }

  @VisibleForTesting
  void register(NodeProcess node) throws MiniClusterIOException {
    NodeProcess existing = nodes.putIfAbsent(node.getAddress(), node);
    if (existing != null) {
      throw new MiniClusterIOException("Duplicate address " + node.getAddress() + " for "
          + existing.getName() + " and " + node.getName());
    }
  }

  private NodeProcess lookup(HostAndPort address) throws NotFoundException {
    NodeProcess node = nodes.get(address);
    if (node == null) {
      throw new NotFoundException("No node is running on " + address);
    }
    return node;
  }

  private NodeProcess lookup(HostAndPort address, ServiceType type) throws NotFoundException {
    NodeProcess node = nodes.get(address);
    if (node == null || node.getType() != type) {
      throw new NotFoundException("No " + type + " is running on " + address);
    }
    return node;
  }

  private void checkOpen() {
    Preconditions.checkState(!closed, "Mini cluster in %s is closed", clusterRoot);
  }

  /**
   * Kills the node on {@code address}: SIGTERM, SIGKILL if it does not exit within the stop
   * timeout, then waits for the address to stop accepting connections. Does nothing if the node
   * is already stopped.
   * @throws NotFoundException if no node has that address
   */
  public void killOnAddress(HostAndPort address) throws IOException {
    checkOpen();
    lookup(address).kill();
  }

  /**
   * Starts the stopped node on {@code address} again, on the same address and with the same
   * configuration.
   * @throws NotFoundException if no node has that address
   * @throws IllegalNodeStateException if the node is not stopped
   */
  public void restartDeadOnAddress(HostAndPort address) throws IOException {
    checkOpen();
    lookup(address).start();
  }

  /**
   * Freezes the node on {@code address} with SIGSTOP. Its port stays bound.
   * @throws IllegalNodeStateException if the node is not running
   */
  public void pauseOnAddress(HostAndPort address) throws IOException {
    checkOpen();
    lookup(address).pause();
  }

  /**
   * Continues the paused node on {@code address} with SIGCONT.
   * @throws IllegalNodeStateException if the node is not paused
   */
  public void resumeOnAddress(HostAndPort address) throws IOException {
    checkOpen();
    lookup(address).resume();
  }

  /**
   * Kills the master on the given address.
   * @throws NotFoundException if no master has that address
   */
  public void killMasterOnHostPort(HostAndPort hostAndPort) throws IOException {
    checkOpen();
    lookup(hostAndPort, ServiceType.MASTER).kill();
  }

  /**
   * Restarts the dead master on the given address.
   * @throws NotFoundException if no master has that address
   * @throws IllegalNodeStateException if it is not stopped
   */
  public void restartDeadMasterOnHostPort(HostAndPort hostAndPort) throws IOException {
    checkOpen();
    lookup(hostAndPort, ServiceType.MASTER).start();
  }

  /**
   * Kills the tablet server on the given address.
   * @throws NotFoundException if no tablet server has that address
   */
  public void killTabletServerOnHostPort(HostAndPort hostAndPort) throws IOException {
    checkOpen();
    lookup(hostAndPort, ServiceType.TSERVER).kill();
  }

  /**
   * Restarts the dead tablet server on the given address.
   * @throws NotFoundException if no tablet server has that address
   * @throws IllegalNodeStateException if it is not stopped
   */
  public void restartDeadTabletServerOnHostPort(HostAndPort hostAndPort) throws IOException {
    checkOpen();
    lookup(hostAndPort, ServiceType.TSERVER).start();
  }

  public void killAllMasterServers() throws IOException {
    checkOpen();
    for (NodeProcess master : masters) {
      master.kill();
    }
  }

  public void killAllTabletServers() throws IOException {
    checkOpen();
    for (NodeProcess tserver : tservers) {
      tserver.kill();
    }
  }

  /**
   * Starts every master that is currently stopped.
   */
  public void restartDeadMasters() throws IOException {
    checkOpen();
    restartDead(masters);
  }

  /**
   * Starts every tablet server that is currently stopped.
   */
  public void restartDeadTabletServers() throws IOException {
    checkOpen();
    restartDead(tservers);
  }

  private static void restartDead(List<NodeProcess> group) throws IOException {
    for (NodeProcess node : group) {
      if (node.getState() == NodeState.STOPPED) {
        node.start();
      }
    }
  }

  public List<HostAndPort> getMasterHostPorts() {
    return addresses(masters);
  }

  public List<HostAndPort> getTserverHostPorts() {
    return addresses(tservers);
  }

  private static List<HostAndPort> addresses(List<NodeProcess> group) {
    List<HostAndPort> result = new ArrayList<>(group.size());
    for (NodeProcess node : group) {
      result.add(node.getAddress());
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * @return comma separated host:port of all masters, empty without masters
   */
  public String getMasterAddressesAsString() {
    return StringUtils.join(getMasterHostPorts(), ",");
  }

  /**
   * @return the metastore, or null if the cluster runs without one
   */
  public MiniHms getHiveMetastore() {
    return hms;
  }

  public File getClusterRoot() {
    return clusterRoot;
  }

  /**
   * @return identity the daemons run under, or null if the cluster is not secured
   */
  public SecurityConfig getSecurityConfig() {
    return securityConfig;
  }

  public Configuration getConfiguration() {
    return conf;
  }

  /**
   * @throws NotFoundException if no node has that address
   */
  public NodeState getNodeState(HostAndPort address) throws NotFoundException {
    return lookup(address).getState();
  }

  /**
   * Sets where {@link #getNodeStatuses()} gets service reported fields of running nodes from.
   */
  public void setServiceStatusSource(ServiceStatusSource source) {
    this.statusSource = Preconditions.checkNotNull(source, "source");
  }

  /**
   * @return a status per node, in start order
   */
  public List<NodeStatus> getNodeStatuses() {
    List<NodeStatus> statuses = new ArrayList<>(nodes.size());
    for (NodeProcess node : nodes.values()) {
      statuses.add(node.snapshot(statusSource));
    }
    return Collections.unmodifiableList(statuses);
  }

  /**
   * Stops every node in reverse start order, stops the KDC, and removes the cluster directory
   * unless it was passed in or {@link MiniClusterConstants#PRESERVE_TEST_DIR_KEY} is set. Calling
   * it again does nothing.
   * @throws IOException aggregating every failure, after all teardown steps have been attempted
   */
  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    List<IOException> exceptions = new ArrayList<>();
    List<NodeProcess> reversed = new ArrayList<>(nodes.values());
    Collections.reverse(reversed);
    for (NodeProcess node : reversed) {
      try {
        node.close();
      } catch (IOException e) {
        LOG.warn("Failed to stop {}", node, e);
        exceptions.add(e);
      }
    }
    for (ReservedPort port : ports) {
      port.close();
    }
    if (kdc != null) {
      try {
        kdc.close();
      } catch (RuntimeException e) {
        LOG.warn("Failed to stop KDC", e);
        exceptions.add(new MiniClusterIOException("Failed to stop KDC", e));
      }
    }
    if (ownsClusterRoot && !testUtil.cleanupTestDir()) {
      exceptions.add(new MiniClusterIOException("Failed to delete " + clusterRoot));
    }
    LOG.info("Closed mini cluster in {}", clusterRoot);
    if (!exceptions.isEmpty()) {
      throw MultipleIOException.createIOException(exceptions);
    }
  }

  @Override
  public String toString() {
    return "MiniKuduCluster(" + clusterRoot + ", masters=" + getMasterHostPorts()
        + ", tservers=" + getTserverHostPorts() + ")";
  }

  /**
   * Builder for {@link MiniKuduCluster}, a shortcut over {@link ClusterSpec.Builder}.
   */
  @InterfaceAudience.Public
  @InterfaceStability.Evolving
  public static class MiniKuduClusterBuilder {
    private final ClusterSpec.Builder spec = ClusterSpec.builder();
    private Configuration conf = null;

    public MiniKuduClusterBuilder numMasters(int numMasters) {
      spec.numMasters(numMasters);
      return this;
    }

    public MiniKuduClusterBuilder numTservers(int numTservers) {
      spec.numTservers(numTservers);
      return this;
    }

    /**
     * Enables Kerberos on the mini cluster, with a KDC started by the cluster.
     */
    public MiniKuduClusterBuilder enableKerberos() {
      spec.enableKerberos();
      return this;
    }

    public MiniKuduClusterBuilder securityConfig(SecurityConfig securityConfig) {
      spec.securityConfig(securityConfig);
      return this;
    }

    public MiniKuduClusterBuilder protection(SaslProtection protection) {
      spec.protection(protection);
      return this;
    }

    public MiniKuduClusterBuilder enableHiveMetastore() {
      spec.enableHiveMetastore();
      return this;
    }

    /**
     * Adds a new flag to be passed to the master daemons on start.
     */
    public MiniKuduClusterBuilder addMasterServerFlag(String flag) {
      spec.addMasterFlags(flag);
      return this;
    }

    /**
     * Adds a new flag to be passed to the tablet server daemons on start.
     */
    public MiniKuduClusterBuilder addTabletServerFlag(String flag) {
      spec.addTserverFlags(flag);
      return this;
    }

    public MiniKuduClusterBuilder startupTimeoutMs(long startupTimeoutMs) {
      spec.startupTimeoutMs(startupTimeoutMs);
      return this;
    }

    public MiniKuduClusterBuilder clusterRoot(File clusterRoot) {
      spec.clusterRoot(clusterRoot);
      return this;
    }

    /**
     * Uses {@code conf} instead of {@link MiniClusterConfiguration#create()}.
     */
    public MiniKuduClusterBuilder configuration(Configuration conf) {
      this.conf = conf;
      return this;
    }

    public ClusterSpec toSpec() {
      return spec.build();
    }

    /**
     * Builds and starts a new {@link MiniKuduCluster} using builder state.
     * @return the newly started {@link MiniKuduCluster}
     * @throws IOException if something went wrong starting the cluster
     */
    public MiniKuduCluster build() throws IOException {
      ClusterSpec clusterSpec = spec.build();
      return conf == null ? MiniKuduCluster.build(clusterSpec)
          : MiniKuduCluster.build(clusterSpec, conf);
    }
  }
}
