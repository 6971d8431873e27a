/*-
 * =================================LICENSE_START==================================
 * tether-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.tether.core;

import static java.util.Objects.requireNonNull;

@SuppressWarnings("serial")
public class ConnectionFailedException extends TetherException {
  private final String reason;

  public ConnectionFailedException(String reason) {
    super("Connection failed: " + requireNonNull(reason, "reason"));
    this.reason = reason;
  }

  public ConnectionFailedException(String reason, Throwable cause) {
    super("Connection failed: " + requireNonNull(reason, "reason"), cause);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }
}
