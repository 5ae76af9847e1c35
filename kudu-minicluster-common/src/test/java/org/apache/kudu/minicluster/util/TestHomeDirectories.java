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
package org.apache.kudu.minicluster.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.MiniClusterClassTestRule;
import org.apache.kudu.minicluster.exceptions.NotFoundException;
import org.apache.kudu.minicluster.testclassification.SmallTests;
import org.junit.Before;
import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.TemporaryFolder;

@Category(SmallTests.class)
public class TestHomeDirectories {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestHomeDirectories.class);

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private Configuration conf;
  private File binDir;

  @Before
  public void setUp() throws IOException {
    conf = new Configuration(false);
    binDir = folder.newFolder("bin");
  }

  @Test
  public void testConfigurationWins() throws IOException {
    File confHome = folder.newFolder("from-conf");
    File envHome = folder.newFolder("from-env");
    conf.set("kudu.minicluster.hive.home", confHome.getPath());
    Map<String, String> env = Collections.singletonMap("HIVE_HOME", envHome.getPath());
    assertEquals(confHome, HomeDirectories.find("hive", conf, binDir, env));
  }

  @Test
  public void testEnvironmentBeforeBinDir() throws IOException {
    File envHome = folder.newFolder("from-env");
    assertTrue(new File(binDir, "hadoop-home").mkdir());
    Map<String, String> env = Collections.singletonMap("HADOOP_HOME", envHome.getPath());
    assertEquals(envHome, HomeDirectories.find("hadoop", conf, binDir, env));
  }

  @Test
  public void testBinDirFallback() throws IOException {
    File expected = new File(binDir, "java-home");
    assertTrue(expected.mkdir());
    assertEquals(expected,
      HomeDirectories.find("java", conf, binDir, Collections.<String, String> emptyMap()));
  }

  @Test
  public void testMissingDirectory() {
    Map<String, String> env = Collections.singletonMap("HIVE_HOME",
      new File(folder.getRoot(), "nope").getPath());
    try {
      HomeDirectories.find("hive", conf, binDir, env);
      fail("Expected NotFoundException");
    } catch (NotFoundException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("HIVE_HOME directory does not exist"));
    }
  }

  @Test(expected = NotFoundException.class)
  public void testNothingToLookIn() throws IOException {
    HomeDirectories.find("hive", conf, null, Collections.<String, String> emptyMap());
  }
}
