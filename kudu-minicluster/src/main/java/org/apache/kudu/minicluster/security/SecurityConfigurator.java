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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Translates a {@link SecurityConfig} into what each kind of process needs to run under it:
 * environment variables, daemon command line flags and Hadoop site properties. A null
 * {@link SecurityConfig} stands for an unsecured node; every method then returns the explicit
 * "security off" settings.
 */
@InterfaceAudience.Private
public final class SecurityConfigurator {

  public static final String KRB5_CONFIG_ENV = "KRB5_CONFIG";

  public static final String HADOOP_SECURITY_AUTHENTICATION = "hadoop.security.authentication";
  public static final String HADOOP_RPC_PROTECTION = "hadoop.rpc.protection";
  public static final String HMS_SASL_ENABLED = "hive.metastore.sasl.enabled";
  public static final String HMS_KEYTAB_FILE = "hive.metastore.kerberos.keytab.file";
  public static final String HMS_PRINCIPAL = "hive.metastore.kerberos.principal";

  /** Protection written to site files of unsecured nodes. */
  static final SaslProtection DEFAULT_PROTECTION = SaslProtection.AUTHENTICATION;

  private SecurityConfigurator() {
  }

  /**
   * @return KRB5_CONFIG pointing at the realm's krb5.conf, or nothing for an unsecured node
   */
  public static Map<String, String> getEnvironment(SecurityConfig sc) {
    if (sc == null) {
      return Collections.emptyMap();
    }
    return Collections.singletonMap(KRB5_CONFIG_ENV, sc.getKrb5Conf());
  }

  /**
   * Appends the krb5.conf system property to {@code base} so a JVM started with the result as
   * JAVA_TOOL_OPTIONS finds the realm.
   */
  public static String getJavaToolOptions(String base, SecurityConfig sc) {
    if (sc == null) {
      return base;
    }
    return base + " -Djava.security.krb5.conf=" + sc.getKrb5Conf();
  }

  /**
   * @return RPC security flags for a kudu-master or kudu-tserver
   */
  public static List<String> getDaemonFlags(SecurityConfig sc) {
    List<String> flags = new ArrayList<>();
    if (sc == null) {
      flags.add("--rpc_authentication=disabled");
      return flags;
    }
    flags.add("--rpc_authentication=required");
    flags.add("--rpc_encryption="
        + (sc.getProtection() == SaslProtection.PRIVACY ? "required" : "optional"));
    flags.add("--keytab_file=" + sc.getKeytabFile());
    flags.add("--principal=" + sc.getServicePrincipal());
    return flags;
  }

  /**
   * @return "kerberos" for a secured node, "simple" otherwise
   */
  public static String getAuthenticationMode(SecurityConfig sc) {
    return sc == null ? "simple" : "kerberos";
  }

  /**
   * Sets the metastore's SASL properties on {@code conf}.
   */
  public static Configuration applySiteProperties(Configuration conf, SecurityConfig sc) {
    conf.setBoolean(HMS_SASL_ENABLED, sc != null);
    conf.set(HMS_KEYTAB_FILE, sc == null ? "" : sc.getKeytabFile());
    conf.set(HMS_PRINCIPAL, sc == null ? "" : sc.getServicePrincipal());
    conf.set(HADOOP_RPC_PROTECTION,
      (sc == null ? DEFAULT_PROTECTION : sc.getProtection()).getName());
    return conf;
  }
}
