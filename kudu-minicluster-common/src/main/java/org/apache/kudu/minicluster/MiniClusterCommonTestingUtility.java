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

import java.io.File;
import java.io.IOException;
import java.util.UUID;
import org.apache.commons.io.FileUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common helpers for tests that do not depend on a running cluster, chiefly the per instance
 * scratch directory every cluster writes its configuration, data and logs to.
 * <p>
 * Each instance gets its own randomly named directory, so two live clusters never share one.
 */
@InterfaceAudience.Public
@InterfaceStability.Unstable
public class MiniClusterCommonTestingUtility {
  private static final Logger LOG = LoggerFactory.getLogger(MiniClusterCommonTestingUtility.class);

  protected final Configuration conf;

  /**
   * Directory where we put the data for this instance
   */
  private File dataTestDir = null;

  public MiniClusterCommonTestingUtility() {
    this(MiniClusterConfiguration.create());
  }

  public MiniClusterCommonTestingUtility(Configuration conf) {
    this.conf = conf;
  }

  /**
   * Returns this classes's instance of {@link Configuration}.
   */
  public Configuration getConfiguration() {
    return this.conf;
  }

  /**
   * @return Where to write test data on local filesystem, specific to this instance. Creates it
   *   if it does not exist already.
   */
  public File getDataTestDir() throws IOException {
    if (this.dataTestDir == null) {
      setupDataTestDir();
    }
    return this.dataTestDir;
  }

  /**
   * @param subdirName name of the subdirectory
   * @return a subdirectory named <code>subdirName</code> under {@link #getDataTestDir()}, created
   *   if needed.
   */
  public File getDataTestDir(final String subdirName) throws IOException {
    File dir = new File(getDataTestDir(), subdirName);
    FileUtils.forceMkdir(dir);
    return dir;
  }

  /**
   * Uses {@code dir} instead of a random directory under the base test directory. Must be called
   * before anything was written.
   */
  public void setDataTestDir(File dir) {
    if (this.dataTestDir != null) {
      throw new IllegalStateException("Data test dir already set up in " + dataTestDir);
    }
    this.dataTestDir = dir.getAbsoluteFile();
  }

  /**
   * Sets up a directory for a test to use.
   */
  protected void setupDataTestDir() throws IOException {
    if (this.dataTestDir != null) {
      LOG.warn("Data test dir already setup in {}", dataTestDir.getAbsolutePath());
      return;
    }
    this.dataTestDir = new File(getBaseTestDir(), UUID.randomUUID().toString()).getAbsoluteFile();
    FileUtils.forceMkdir(this.dataTestDir);
    LOG.info("Created test data directory {}", dataTestDir);
  }

  /**
   * @return True if we should delete testing dirs on cleanup.
   */
  boolean deleteOnExit() {
    String v = System.getProperty(MiniClusterConstants.PRESERVE_TEST_DIR_KEY);
    // Let default be true, to delete on exit.
    return v == null || !Boolean.parseBoolean(v);
  }

  /**
   * @return True if we removed the test dirs
   */
  public boolean cleanupTestDir() {
    if (deleteDir(this.dataTestDir)) {
      this.dataTestDir = null;
      return true;
    }
    return false;
  }

  /**
   * @return Where to write test data on local filesystem; usually
   *   {@link MiniClusterConstants#DEFAULT_BASE_TEST_DIRECTORY}. The system property wins over the
   *   configuration so surefire can point every module at its own target directory.
   */
  private File getBaseTestDir() {
    String pathName = System.getProperty(MiniClusterConstants.BASE_TEST_DIRECTORY_KEY,
      conf.get(MiniClusterConstants.BASE_TEST_DIRECTORY_KEY,
        MiniClusterConstants.DEFAULT_BASE_TEST_DIRECTORY));
    return new File(pathName);
  }

  /**
   * @param dir Directory to delete
   * @return True if we deleted it.
   */
  boolean deleteDir(final File dir) {
    if (dir == null || !dir.exists()) {
      return true;
    }
    if (!deleteOnExit()) {
      LOG.info("Preserving {} as requested by {}", dir, MiniClusterConstants.PRESERVE_TEST_DIR_KEY);
      return true;
    }
    int ntries = 0;
    do {
      ntries += 1;
      try {
        FileUtils.deleteDirectory(dir);
        return true;
      } catch (IOException ex) {
        LOG.warn("Failed to delete {}", dir.getAbsolutePath());
      } catch (IllegalArgumentException ex) {
        LOG.warn("Failed to delete {}", dir.getAbsolutePath(), ex);
      }
    } while (ntries < 30);
    return false;
  }
}
