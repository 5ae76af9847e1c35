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
package org.apache.kudu.minicluster.hms;

import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.CommandProvider;
import org.apache.kudu.minicluster.MiniClusterConstants;
import org.apache.kudu.minicluster.NodeProcess;
import org.apache.kudu.minicluster.NodeState;
import org.apache.kudu.minicluster.ServiceType;
import org.apache.kudu.minicluster.conf.SiteConfigGenerator;
import org.apache.kudu.minicluster.net.ReservedPort;
import org.apache.kudu.minicluster.security.SaslProtection;
import org.apache.kudu.minicluster.security.SecurityConfig;
import org.apache.kudu.minicluster.security.SecurityConfigurator;
import org.apache.kudu.minicluster.util.HomeDirectories;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Hive Metastore running as a child process, backed by an in-memory Derby database.
 * <p>
 * The metastore is launched through {@code $HIVE_HOME/bin/hive --service metastore}. Hadoop, Hive
 * and Java installations are located with {@link HomeDirectories}; the Kudu metastore plugin is
 * expected as {@code hms-plugin.jar} in the kudu bin directory. Its {@code hive-site.xml} and
 * {@code core-site.xml} are rendered into the metastore's data directory before every start.
 * <p>
 * Usable on its own, or owned by a {@link org.apache.kudu.minicluster.MiniKuduCluster}.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class MiniHms implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(MiniHms.class);

  static final String JAVA_HOME_ENV = "JAVA_HOME";
  static final String HADOOP_HOME_ENV = "HADOOP_HOME";
  static final String HIVE_AUX_JARS_PATH_ENV = "HIVE_AUX_JARS_PATH";
  static final String HIVE_CONF_DIR_ENV = "HIVE_CONF_DIR";
  static final String HADOOP_CONF_DIR_ENV = "HADOOP_CONF_DIR";
  static final String JAVA_TOOL_OPTIONS_ENV = "JAVA_TOOL_OPTIONS";
  static final String PATH_ENV = "PATH";

  static final String PLUGIN_JAR = "hms-plugin.jar";

  private final Configuration conf;
  private final File binDir;
  private final File dataDir;
  private final NodeProcess node;

  private long notificationLogTtlSec;
  private SecurityConfig securityConfig;
  private boolean started = false;

  /**
   * Reserves a port for the metastore on the configured bind host.
   * @param conf mini cluster configuration
   * @param binDir the kudu bin directory
   * @param dataDir the metastore's private directory
   */
  public MiniHms(Configuration conf, File binDir, File dataDir) throws IOException {
    this(conf, binDir, dataDir, ReservedPort.reserve(conf.get(MiniClusterConstants.BIND_HOST_KEY,
      MiniClusterConstants.DEFAULT_BIND_HOST)));
  }

  /**
   * @param port reservation of the metastore's address, owned by the metastore from now on
   */
  public MiniHms(Configuration conf, File binDir, File dataDir, ReservedPort port) {
    this.conf = conf;
    this.binDir = Preconditions.checkNotNull(binDir, "binDir");
    this.dataDir = dataDir.getAbsoluteFile();
    this.notificationLogTtlSec = conf.getLong(MiniClusterConstants.HMS_NOTIFICATION_LOG_TTL_KEY,
      MiniClusterConstants.DEFAULT_HMS_NOTIFICATION_LOG_TTL_SEC);
    this.node = new NodeProcess(ServiceType.HIVE_METASTORE, ServiceType.HIVE_METASTORE.getName(),
        port, this.dataDir, new File(this.dataDir, "hms.log"), new HmsCommandProvider(), conf);
  }

  /**
   * Configures the metastore to use Kerberos for its Thrift interface. Only allowed before the
   * first start.
   */
  public void enableKerberos(String krb5Conf, String servicePrincipal, String keytabFile,
      SaslProtection protection) {
    enableKerberos(new SecurityConfig(krb5Conf, servicePrincipal, keytabFile, protection));
  }

  public synchronized void enableKerberos(SecurityConfig sc) {
    Preconditions.checkState(!started, "Kerberos must be enabled before the metastore starts");
    this.securityConfig = Preconditions.checkNotNull(sc, "securityConfig");
  }

  /**
   * Sets how long the metastore keeps notification log events. Takes effect on the next start.
   */
  public synchronized void setNotificationLogTtl(long ttl, TimeUnit unit) {
    Preconditions.checkArgument(ttl >= 0, "ttl must not be negative: %s", ttl);
    this.notificationLogTtlSec = unit.toSeconds(ttl);
  }

  public synchronized long getNotificationLogTtlSec() {
    return notificationLogTtlSec;
  }

  public synchronized SecurityConfig getSecurityConfig() {
    return securityConfig;
  }

  /**
   * Starts the metastore and waits until it listens.
   */
  public void start() throws IOException {
    synchronized (this) {
      started = true;
    }
    LOG.debug("Starting HMS");
    node.start();
  }

  /**
   * Stops the metastore. No-op if it is not running.
   */
  public void stop() throws IOException {
    LOG.debug("Stopping HMS");
    node.kill();
  }

  public void pause() throws IOException {
    node.pause();
  }

  public void resume() throws IOException {
    node.resume();
  }

  public HostAndPort getAddress() {
    return node.getAddress();
  }

  /**
   * @return the URI clients connect to, e.g. thrift://127.0.0.1:9083
   */
  public String getUris() {
    return "thrift://" + getAddress();
  }

  public NodeState getState() {
    return node.getState();
  }

  /**
   * @return directory holding the generated site files
   */
  public File getConfDir() {
    return dataDir;
  }

  @InterfaceAudience.Private
  public NodeProcess getNode() {
    return node;
  }

  @Override
  public void close() throws IOException {
    node.close();
  }

  @Override
  public String toString() {
    return "MiniHms(" + getAddress() + ")";
  }

  /**
   * Renders the site files and resolves the installations right before each launch, so a
   * restarted metastore picks up the current settings.
   */
  private class HmsCommandProvider extends CommandProvider {
    private File hadoopHome;
    private File hiveHome;
    private File javaHome;
    private SecurityConfig launchSecurity;

    @Override
    public void prepare(HostAndPort address) throws IOException {
      hadoopHome = HomeDirectories.find("hadoop", conf, binDir);
      hiveHome = HomeDirectories.find("hive", conf, binDir);
      javaHome = HomeDirectories.find("java", conf, binDir);
      long ttlSec;
      synchronized (MiniHms.this) {
        ttlSec = notificationLogTtlSec;
        launchSecurity = securityConfig;
      }
      SiteConfigGenerator.writeHiveSite(dataDir, ttlSec, launchSecurity);
      SiteConfigGenerator.writeCoreSite(dataDir, launchSecurity);
    }

    @Override
    public List<String> getCommand(HostAndPort address) {
      return Arrays.asList(new File(hiveHome, "bin/hive").getAbsolutePath(),
        "--service", "metastore", "-v", "-p", String.valueOf(address.getPort()));
    }

    @Override
    public Map<String, String> getEnvironment() {
      Map<String, String> env = new TreeMap<>();
      env.put(JAVA_HOME_ENV, javaHome.getAbsolutePath());
      env.put(HADOOP_HOME_ENV, hadoopHome.getAbsolutePath());
      // Comma-separated list of additional jars to add to the metastore classpath.
      env.put(HIVE_AUX_JARS_PATH_ENV, new File(binDir, PLUGIN_JAR).getAbsolutePath());
      env.put(HIVE_CONF_DIR_ENV, dataDir.getPath());
      env.put(HADOOP_CONF_DIR_ENV, dataDir.getPath());
      env.put(JAVA_TOOL_OPTIONS_ENV, SecurityConfigurator.getJavaToolOptions(
        conf.get(MiniClusterConstants.HMS_JAVA_TOOL_OPTIONS_KEY,
          MiniClusterConstants.DEFAULT_HMS_JAVA_TOOL_OPTIONS), launchSecurity));
      env.putAll(SecurityConfigurator.getEnvironment(launchSecurity));
      // The hive launcher is a shell script relying on the usual tools.
      String path = System.getenv(PATH_ENV);
      if (path != null) {
        env.put(PATH_ENV, path);
      }
      return Collections.unmodifiableMap(env);
    }
  }
}
