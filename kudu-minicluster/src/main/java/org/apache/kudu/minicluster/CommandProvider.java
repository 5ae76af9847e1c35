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

import com.google.common.net.HostAndPort;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Provides the command line and environment a node is launched with. Asked again before every
 * (re)start of the node, so providers may render files the process reads at startup.
 */
@InterfaceAudience.Private
public abstract class CommandProvider {

  /**
   * Called before every launch, ahead of {@link #getCommand(HostAndPort)}.
   */
  public void prepare(HostAndPort address) throws IOException {
  }

  /**
   * @param address the address the process must listen on
   * @return executable followed by its arguments
   */
  public abstract List<String> getCommand(HostAndPort address) throws IOException;

  /**
   * @return the complete environment of the process
   */
  public abstract Map<String, String> getEnvironment() throws IOException;
}
