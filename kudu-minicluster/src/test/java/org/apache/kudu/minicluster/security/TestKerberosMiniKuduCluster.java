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
package org.apache.kudu.minicluster.security;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.List;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.kudu.minicluster.FakeKuduBinaries;
import org.apache.kudu.minicluster.MiniClusterClassTestRule;
import org.apache.kudu.minicluster.MiniClusterConfiguration;
import org.apache.kudu.minicluster.MiniKuduCluster;
import org.apache.kudu.minicluster.conf.SiteConfigGenerator;
import org.apache.kudu.minicluster.hms.MiniHms;
import org.apache.kudu.minicluster.net.PortReadinessProbe;
import org.apache.kudu.minicluster.testclassification.LargeTests;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.TemporaryFolder;

/**
 * A secured cluster with its own KDC and a metastore.
 */
@Category(LargeTests.class)
public class TestKerberosMiniKuduCluster {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestKerberosMiniKuduCluster.class);

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private Configuration conf;

  @Before
  public void setUp() throws IOException {
    File binDir = FakeKuduBinaries.create(folder.getRoot());
    conf = FakeKuduBinaries.configure(MiniClusterConfiguration.create(), binDir);
  }

  @Test
  public void testSecuredCluster() throws Exception {
    File kdcDir;
    try (MiniKuduCluster cluster = new MiniKuduCluster.MiniKuduClusterBuilder()
        .numMasters(1)
        .numTservers(1)
        .enableKerberos()
        .enableHiveMetastore()
        .protection(SaslProtection.PRIVACY)
        .configuration(conf)
        .build()) {
      SecurityConfig sc = cluster.getSecurityConfig();
      assertNotNull(sc);
      assertTrue(sc.getServicePrincipal().startsWith("kudu/127.0.0.1@"));
      assertTrue(new File(sc.getKeytabFile()).isFile());
      assertTrue(new File(sc.getKrb5Conf()).isFile());
      assertEquals(SaslProtection.PRIVACY, sc.getProtection());
      kdcDir = new File(sc.getKeytabFile()).getParentFile();

      File masterDir = new File(cluster.getClusterRoot(), "master-0");
      List<String> args = FakeKuduBinaries.readArgs(masterDir);
      assertTrue(args.contains("--rpc_authentication=required"));
      assertTrue(args.contains("--rpc_encryption=required"));
      assertTrue(args.contains("--keytab_file=" + sc.getKeytabFile()));
      assertTrue(args.contains("--principal=" + sc.getServicePrincipal()));
      MiniHms hms = cluster.getHiveMetastore();
      assertTrue(args.contains("--hive_metastore_uris=" + hms.getUris()));
      assertTrue(FakeKuduBinaries.readInvocation(masterDir)
          .contains("env.KRB5_CONFIG=" + sc.getKrb5Conf()));

      SecurityConfig hmsSc = hms.getSecurityConfig();
      assertTrue(hmsSc.getServicePrincipal().startsWith("hive/127.0.0.1@"));
      Configuration hiveSite = new Configuration(false);
      hiveSite.addResource(new Path(
          new File(hms.getConfDir(), SiteConfigGenerator.HIVE_SITE).getAbsolutePath()));
      assertEquals("true", hiveSite.get("hive.metastore.sasl.enabled"));
      assertEquals(hmsSc.getKeytabFile(), hiveSite.get("hive.metastore.kerberos.keytab.file"));
      assertEquals("privacy", hiveSite.get("hadoop.rpc.protection"));
      List<String> hmsInvocation = FakeKuduBinaries.readInvocation(hms.getConfDir());
      assertTrue(hmsInvocation.contains("env.JAVA_TOOL_OPTIONS=" + SecurityConfigurator
          .getJavaToolOptions(conf.get("kudu.minicluster.hms.java.tool.options"), hmsSc)));

      // The metastore is a node like any other.
      PortReadinessProbe probe = new PortReadinessProbe(50, 500);
      cluster.killOnAddress(hms.getAddress());
      assertFalse(probe.isOpen(hms.getAddress()));
      cluster.restartDeadOnAddress(hms.getAddress());
      assertTrue(probe.isOpen(hms.getAddress()));
    }
    // Closing removed the cluster directory, KDC files included.
    assertFalse(kdcDir.exists());
  }
}
