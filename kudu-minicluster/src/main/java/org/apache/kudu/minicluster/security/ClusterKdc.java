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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.BindException;
import java.util.Properties;
import org.apache.commons.io.FileUtils;
import org.apache.hadoop.minikdc.MiniKdc;
import org.apache.kudu.minicluster.exceptions.MiniClusterIOException;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Kerberos realm backed by {@link MiniKdc}, started in a directory of the cluster it serves.
 * Every service that runs secured gets its own principal and keytab from it.
 */
@InterfaceAudience.Private
public class ClusterKdc implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ClusterKdc.class);

  private static final int MAX_START_ATTEMPTS = 3;

  private final MiniKdc kdc;
  private final File dir;
  private boolean stopped = false;

  private ClusterKdc(MiniKdc kdc, File dir) {
    this.kdc = kdc;
    this.dir = dir;
  }

  /**
   * Starts a KDC working in {@code dir}.
   */
  public static ClusterKdc start(File dir) throws IOException {
    Properties conf = MiniKdc.createConf();
    // There is time lag between selecting a port and trying to bind with it. It's possible that
    // another service captures the port in between which'll result in BindException.
    int numTries = 0;
    while (true) {
      FileUtils.forceMkdir(dir);
      try {
        MiniKdc kdc = new MiniKdc(conf, dir);
        kdc.start();
        LOG.info("Started KDC for realm {} on port {} in {}", kdc.getRealm(), kdc.getPort(), dir);
        return new ClusterKdc(kdc, dir);
      } catch (BindException e) {
        FileUtils.deleteDirectory(dir);
        numTries++;
        if (numTries == MAX_START_ATTEMPTS) {
          LOG.error("Failed setting up MiniKdc. Tried {} times.", numTries);
          throw e;
        }
        LOG.warn("BindException encountered when setting up MiniKdc. Trying again.");
      } catch (Exception e) {
        throw new MiniClusterIOException("Failed to start MiniKdc in " + dir, e);
      }
    }
  }

  public String getRealm() {
    return kdc.getRealm();
  }

  public File getKrb5Conf() {
    return kdc.getKrb5conf();
  }

  /**
   * Creates principal {@code service/host@REALM} with its own keytab.
   * @return the identity a node of {@code service} runs under
   */
  public SecurityConfig createServiceIdentity(String service, String host,
      SaslProtection protection) throws IOException {
    String principal = service + "/" + host;
    File keytab = new File(dir, service + ".keytab");
    try {
      kdc.createPrincipal(keytab, principal);
    } catch (Exception e) {
      throw new MiniClusterIOException("Failed to create principal " + principal, e);
    }
    String fullPrincipal = principal + "@" + kdc.getRealm();
    LOG.debug("Created {} in {}", fullPrincipal, keytab);
    return new SecurityConfig(getKrb5Conf().getAbsolutePath(), fullPrincipal,
        keytab.getAbsolutePath(), protection);
  }

  @Override
  public synchronized void close() {
    if (stopped) {
      return;
    }
    stopped = true;
    kdc.stop();
    LOG.info("Stopped KDC for realm {}", kdc.getRealm());
  }
}
