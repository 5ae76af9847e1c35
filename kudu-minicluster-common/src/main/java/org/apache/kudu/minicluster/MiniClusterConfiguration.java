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

import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Adds mini cluster configuration files to a Configuration
 */
@InterfaceAudience.Public
public final class MiniClusterConfiguration {

  static final String DEFAULT_RESOURCE = "kudu-minicluster-default.xml";
  static final String SITE_RESOURCE = "kudu-minicluster-site.xml";

  private MiniClusterConfiguration() {
  }

  public static Configuration addMiniClusterResources(Configuration conf) {
    conf.addResource(DEFAULT_RESOURCE);
    conf.addResource(SITE_RESOURCE);
    return conf;
  }

  /**
   * Creates a Configuration with mini cluster resources
   * @return a Configuration with mini cluster resources
   */
  public static Configuration create() {
    Configuration conf = new Configuration();
    // In case this class is loaded from a different classloader than Configuration, conf needs
    // to be set with appropriate class loader to resolve our resources.
    conf.setClassLoader(MiniClusterConfiguration.class.getClassLoader());
    return addMiniClusterResources(conf);
  }

  /**
   * @param that Configuration to clone.
   * @return a Configuration created with the kudu-minicluster-*.xml files plus the given
   *   configuration.
   */
  public static Configuration create(final Configuration that) {
    Configuration conf = create();
    merge(conf, that);
    return conf;
  }

  /**
   * Merge two configurations.
   * @param destConf the configuration that will be overwritten with items from the srcConf
   * @param srcConf the source configuration
   */
  public static void merge(Configuration destConf, Configuration srcConf) {
    for (Map.Entry<String, String> e : srcConf) {
      destConf.set(e.getKey(), e.getValue());
    }
  }
}
