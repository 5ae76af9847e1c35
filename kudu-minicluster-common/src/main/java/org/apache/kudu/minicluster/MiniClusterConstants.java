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

import org.apache.yetus.audience.InterfaceAudience;

/**
 * MiniClusterConstants holds a bunch of mini cluster related constants
 */
@InterfaceAudience.Public
public final class MiniClusterConstants {

  /** Directory holding the kudu-master and kudu-tserver executables */
  public static final String BIN_DIR_KEY = "kudu.minicluster.bin.dir";

  /** Environment variable consulted when {@link #BIN_DIR_KEY} is not set */
  public static final String BIN_DIR_ENV = "KUDU_BIN_DIR";

  /** Address every node binds to */
  public static final String BIND_HOST_KEY = "kudu.minicluster.bind.host";
  public static final String DEFAULT_BIND_HOST = "127.0.0.1";

  /** How long to wait for a node to start listening */
  public static final String START_TIMEOUT_KEY = "kudu.minicluster.start.timeout.ms";
  public static final long DEFAULT_START_TIMEOUT_MS = 60000;

  /** How long a graceful stop may take before the process is killed */
  public static final String STOP_TIMEOUT_KEY = "kudu.minicluster.stop.timeout.ms";
  public static final long DEFAULT_STOP_TIMEOUT_MS = 30000;

  /** Poll interval of the port readiness probe */
  public static final String PROBE_INTERVAL_KEY = "kudu.minicluster.probe.interval.ms";
  public static final long DEFAULT_PROBE_INTERVAL_MS = 200;

  /** Connect timeout of a single probe attempt */
  public static final String PROBE_CONNECT_TIMEOUT_KEY =
      "kudu.minicluster.probe.connect.timeout.ms";
  public static final int DEFAULT_PROBE_CONNECT_TIMEOUT_MS = 500;

  /** How long to retry binding a port reservation after its node exited */
  public static final String PORT_REACQUIRE_TIMEOUT_KEY =
      "kudu.minicluster.port.reacquire.timeout.ms";
  public static final long DEFAULT_PORT_REACQUIRE_TIMEOUT_MS = 5000;

  /** How long the metastore keeps notification log events */
  public static final String HMS_NOTIFICATION_LOG_TTL_KEY =
      "kudu.minicluster.hms.notification.log.ttl.sec";
  public static final long DEFAULT_HMS_NOTIFICATION_LOG_TTL_SEC = 86400;

  /** JAVA_TOOL_OPTIONS handed to the metastore JVM */
  public static final String HMS_JAVA_TOOL_OPTIONS_KEY = "kudu.minicluster.hms.java.tool.options";
  public static final String DEFAULT_HMS_JAVA_TOOL_OPTIONS =
      "-Dhive.log.level=WARN -Dhive.root.logger=console";

  /** Format of the per-component home directory override, e.g. kudu.minicluster.hive.home */
  public static final String HOME_DIR_KEY_FORMAT = "kudu.minicluster.%s.home";

  /** System property (or configuration key) naming the base directory for cluster data */
  public static final String BASE_TEST_DIRECTORY_KEY = "kudu.minicluster.test.dir";
  public static final String DEFAULT_BASE_TEST_DIRECTORY = "target/test-data";

  /** System property that keeps cluster directories around after close */
  public static final String PRESERVE_TEST_DIR_KEY = "kudu.minicluster.preserve.testdir";

  /** Address used for everything spawned locally */
  public static final String LOOPBACK_HOST = "127.0.0.1";

  private MiniClusterConstants() {
    // Can't be instantiated with this ctor.
  }
}
