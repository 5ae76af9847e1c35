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
package org.apache.kudu.minicluster.exceptions;

import java.io.IOException;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * All mini cluster specific IOExceptions should be subclasses of MiniClusterIOException
 */
@InterfaceAudience.Public
public class MiniClusterIOException extends IOException {

  private static final long serialVersionUID = -3541062846829447286L;

  public MiniClusterIOException() {
    super();
  }

  public MiniClusterIOException(String message) {
    super(message);
  }

  public MiniClusterIOException(String message, Throwable cause) {
    super(message, cause);
  }

  public MiniClusterIOException(Throwable cause) {
    super(cause);
  }
}
