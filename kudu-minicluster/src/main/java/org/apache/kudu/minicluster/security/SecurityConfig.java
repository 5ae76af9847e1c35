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

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Kerberos identity a node runs under. A node that was started with one keeps it until it is
 * discarded.
 */
@InterfaceAudience.Public
public final class SecurityConfig {
  private final String krb5Conf;
  private final String servicePrincipal;
  private final String keytabFile;
  private final SaslProtection protection;

  /**
   * @param krb5Conf path of the krb5.conf describing the realm
   * @param servicePrincipal principal the service logs in as, e.g. kudu/127.0.0.1@EXAMPLE.COM
   * @param keytabFile keytab holding the key of {@code servicePrincipal}
   * @param protection wire protection required from clients
   */
  public SecurityConfig(String krb5Conf, String servicePrincipal, String keytabFile,
      SaslProtection protection) {
    Preconditions.checkArgument(StringUtils.isNotEmpty(krb5Conf), "krb5Conf must not be empty");
    Preconditions.checkArgument(StringUtils.isNotEmpty(servicePrincipal),
      "servicePrincipal must not be empty");
    Preconditions.checkArgument(StringUtils.isNotEmpty(keytabFile),
      "keytabFile must not be empty");
    this.krb5Conf = krb5Conf;
    this.servicePrincipal = servicePrincipal;
    this.keytabFile = keytabFile;
    this.protection = Preconditions.checkNotNull(protection, "protection");
  }

  public String getKrb5Conf() {
    return krb5Conf;
  }

  public String getServicePrincipal() {
    return servicePrincipal;
  }

  public String getKeytabFile() {
    return keytabFile;
  }

  public SaslProtection getProtection() {
    return protection;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SecurityConfig)) {
      return false;
    }
    SecurityConfig that = (SecurityConfig) o;
    return krb5Conf.equals(that.krb5Conf) && servicePrincipal.equals(that.servicePrincipal)
        && keytabFile.equals(that.keytabFile) && protection == that.protection;
  }

  @Override
  public int hashCode() {
    return Objects.hash(krb5Conf, servicePrincipal, keytabFile, protection);
  }

  @Override
  public String toString() {
    return "SecurityConfig{principal=" + servicePrincipal + ", keytab=" + keytabFile
        + ", krb5Conf=" + krb5Conf + ", protection=" + protection + '}';
  }
}
