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

import java.io.File;
import java.util.Locale;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.MiniClusterConstants;
import org.apache.kudu.minicluster.exceptions.NotFoundException;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the installation directories of the third party components the mini cluster runs
 * (hadoop, hive, java).
 * <p>
 * For a component {@code name} the lookup order is:
 * <ol>
 *   <li>the {@code kudu.minicluster.<name>.home} configuration key</li>
 *   <li>the {@code <NAME>_HOME} environment variable</li>
 *   <li>{@code <binDir>/<name>-home}</li>
 * </ol>
 */
@InterfaceAudience.Private
public final class HomeDirectories {
  private static final Logger LOG = LoggerFactory.getLogger(HomeDirectories.class);

  private HomeDirectories() {
  }

  public static File find(String name, Configuration conf, File binDir) throws NotFoundException {
    return find(name, conf, binDir, System.getenv());
  }

  /**
   * @param name component name, e.g. "hive"
   * @param conf configuration that may carry an override
   * @param binDir directory of the kudu binaries, may be null
   * @param env the environment to consult
   * @return the existing home directory
   * @throws NotFoundException if the resolved directory does not exist
   */
  public static File find(String name, Configuration conf, File binDir, Map<String, String> env)
      throws NotFoundException {
    String envVar = name.toUpperCase(Locale.ROOT) + "_HOME";
    String home = conf.get(String.format(MiniClusterConstants.HOME_DIR_KEY_FORMAT, name));
    if (home == null) {
      home = env.get(envVar);
    }
    if (home == null) {
      if (binDir == null) {
        throw new NotFoundException(envVar + " is not set and there is no bin directory to "
            + "look for " + name + "-home in");
      }
      home = new File(binDir, name + "-home").getPath();
    }
    File dir = new File(home);
    if (!dir.isDirectory()) {
      throw new NotFoundException(envVar + " directory does not exist", home);
    }
    LOG.debug("Using {} for {}", dir, envVar);
    return dir;
  }
}
