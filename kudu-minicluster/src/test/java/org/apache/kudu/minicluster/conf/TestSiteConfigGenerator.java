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
package org.apache.kudu.minicluster.conf;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.apache.commons.io.FileUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.kudu.minicluster.MiniClusterClassTestRule;
import org.apache.kudu.minicluster.security.SaslProtection;
import org.apache.kudu.minicluster.security.SecurityConfig;
import org.apache.kudu.minicluster.testclassification.SmallTests;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.TemporaryFolder;

@Category(SmallTests.class)
public class TestSiteConfigGenerator {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestSiteConfigGenerator.class);

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File dir;

  @Before
  public void setUp() throws IOException {
    dir = folder.newFolder("hms");
  }

  private static Configuration read(File file) {
    Configuration conf = new Configuration(false);
    conf.addResource(new Path(file.getAbsolutePath()));
    return conf;
  }

  @Test
  public void testUnsecuredHiveSite() throws IOException {
    File file = SiteConfigGenerator.writeHiveSite(dir, 86400, null);
    Configuration site = read(file);
    assertEquals(SiteConfigGenerator.LISTENER_CLASSES,
      site.get(SiteConfigGenerator.EVENT_LISTENERS));
    assertEquals("true", site.get(SiteConfigGenerator.AUTO_CREATE_ALL));
    assertEquals("false", site.get(SiteConfigGenerator.SCHEMA_VERIFICATION));
    assertEquals("file://" + dir.getAbsolutePath() + "/warehouse/",
      site.get(SiteConfigGenerator.WAREHOUSE_DIR));
    assertEquals("jdbc:derby:memory:" + dir.getAbsolutePath() + "/metadb;create=true",
      site.get(SiteConfigGenerator.CONNECTION_URL));
    assertEquals("86400s", site.get(SiteConfigGenerator.NOTIFICATION_LOG_TTL));
    assertEquals("false", site.get("hive.metastore.sasl.enabled"));
    // Empty values are written out explicitly.
    String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    assertTrue(text, text.contains("<name>hive.metastore.kerberos.keytab.file</name>"));
    assertTrue(text, text.contains("<name>hive.metastore.kerberos.principal</name>"));
    assertEquals("", site.get("hive.metastore.kerberos.keytab.file", ""));
    assertEquals("", site.get("hive.metastore.kerberos.principal", ""));
    assertEquals("authentication", site.get("hadoop.rpc.protection"));
    assertNull(site.get("hadoop.security.authentication"));

    Configuration core = read(SiteConfigGenerator.writeCoreSite(dir, null));
    assertEquals("simple", core.get("hadoop.security.authentication"));
  }

  @Test
  public void testSecuredSites() throws IOException {
    SecurityConfig sc = new SecurityConfig("/kdc/krb5.conf", "hive/127.0.0.1@KRBTEST.COM",
        "/kdc/hive.keytab", SaslProtection.PRIVACY);
    Configuration site = read(SiteConfigGenerator.writeHiveSite(dir, 60, sc));
    assertEquals("60s", site.get(SiteConfigGenerator.NOTIFICATION_LOG_TTL));
    assertEquals("true", site.get("hive.metastore.sasl.enabled"));
    assertEquals("/kdc/hive.keytab", site.get("hive.metastore.kerberos.keytab.file"));
    assertEquals("hive/127.0.0.1@KRBTEST.COM", site.get("hive.metastore.kerberos.principal"));
    assertEquals("privacy", site.get("hadoop.rpc.protection"));

    Configuration core = read(SiteConfigGenerator.writeCoreSite(dir, sc));
    assertEquals("kerberos", core.get("hadoop.security.authentication"));
  }

  @Test
  public void testOutputIsStable() throws IOException {
    File first = folder.newFolder("first");
    File second = folder.newFolder("second");
    SecurityConfig sc = new SecurityConfig("/kdc/krb5.conf", "hive/127.0.0.1@KRBTEST.COM",
        "/kdc/hive.keytab", SaslProtection.AUTHENTICATION);
    byte[] hiveSite = Files.readAllBytes(SiteConfigGenerator.writeHiveSite(dir, 120, sc).toPath());
    byte[] coreSite = Files.readAllBytes(SiteConfigGenerator.writeCoreSite(first, sc).toPath());
    assertArrayEquals(hiveSite,
      Files.readAllBytes(SiteConfigGenerator.writeHiveSite(dir, 120, sc).toPath()));
    assertArrayEquals(coreSite,
      Files.readAllBytes(SiteConfigGenerator.writeCoreSite(second, sc).toPath()));
  }
}
