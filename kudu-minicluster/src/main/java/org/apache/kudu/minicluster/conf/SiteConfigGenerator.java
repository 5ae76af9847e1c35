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

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import org.apache.commons.io.FileUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.kudu.minicluster.security.SecurityConfig;
import org.apache.kudu.minicluster.security.SecurityConfigurator;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the Hadoop style site files the Hive Metastore reads at startup.
 * <p>
 * The documents are built from a {@link Configuration} without default resources, so nothing but
 * the properties set here ends up in them, and the same inputs always produce the same bytes.
 */
@InterfaceAudience.Private
public final class SiteConfigGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(SiteConfigGenerator.class);

  public static final String HIVE_SITE = "hive-site.xml";
  public static final String CORE_SITE = "core-site.xml";

  public static final String EVENT_LISTENERS = "hive.metastore.transactional.event.listeners";
  public static final String AUTO_CREATE_ALL = "datanucleus.schema.autoCreateAll";
  public static final String SCHEMA_VERIFICATION = "hive.metastore.schema.verification";
  public static final String WAREHOUSE_DIR = "hive.metastore.warehouse.dir";
  public static final String CONNECTION_URL = "javax.jdo.option.ConnectionURL";
  public static final String NOTIFICATION_LOG_TTL = "hive.metastore.event.db.listener.timetolive";

  /**
   * The notification listener feeds the event log, the Kudu plugin validates Kudu table
   * operations.
   */
  static final String LISTENER_CLASSES =
      "org.apache.hive.hcatalog.listener.DbNotificationListener,"
          + "org.apache.kudu.hive.metastore.KuduMetastorePlugin";

  private SiteConfigGenerator() {
  }

  /**
   * @param dir directory holding the metastore's warehouse and in-memory database name
   * @param notificationLogTtlSec how long notification log events are kept
   * @param sc identity of the metastore, null when unsecured
   */
  public static Configuration createHiveSite(File dir, long notificationLogTtlSec,
      SecurityConfig sc) {
    Configuration conf = new Configuration(false);
    conf.set(EVENT_LISTENERS, LISTENER_CLASSES);
    // Lets the metastore run without first running the schema tool.
    conf.setBoolean(AUTO_CREATE_ALL, true);
    conf.setBoolean(SCHEMA_VERIFICATION, false);
    conf.set(WAREHOUSE_DIR, "file://" + dir.getAbsolutePath() + "/warehouse/");
    conf.set(CONNECTION_URL, "jdbc:derby:memory:" + dir.getAbsolutePath() + "/metadb;create=true");
    conf.set(NOTIFICATION_LOG_TTL, notificationLogTtlSec + "s");
    return SecurityConfigurator.applySiteProperties(conf, sc);
  }

  /**
   * Hadoop's UGI refuses a Kerberos login unless hadoop.security.authentication says so, and it
   * only looks for that in core-site.xml.
   */
  public static Configuration createCoreSite(SecurityConfig sc) {
    Configuration conf = new Configuration(false);
    conf.set(SecurityConfigurator.HADOOP_SECURITY_AUTHENTICATION,
      SecurityConfigurator.getAuthenticationMode(sc));
    return conf;
  }

  /**
   * Writes {@value #HIVE_SITE} into {@code dir}.
   * @return the written file
   */
  public static File writeHiveSite(File dir, long notificationLogTtlSec, SecurityConfig sc)
      throws IOException {
    return write(createHiveSite(dir, notificationLogTtlSec, sc), new File(dir, HIVE_SITE));
  }

  /**
   * Writes {@value #CORE_SITE} into {@code dir}.
   * @return the written file
   */
  public static File writeCoreSite(File dir, SecurityConfig sc) throws IOException {
    return write(createCoreSite(sc), new File(dir, CORE_SITE));
  }

  private static File write(Configuration conf, File file) throws IOException {
    FileUtils.forceMkdir(file.getParentFile());
    try (OutputStream out = new FileOutputStream(file)) {
      conf.writeXml(out);
    }
    LOG.debug("Wrote {}", file);
    return file;
  }
}
