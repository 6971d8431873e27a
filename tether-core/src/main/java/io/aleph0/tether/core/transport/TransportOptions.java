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
package io.aleph0.tether.core.transport;

import static java.util.Objects.requireNonNull;
import java.util.List;
import java.util.Map;

/**
 * Handshake options for {@link Transport#open(java.net.URI, TransportOptions, TransportListener)}.
 */
public record TransportOptions(List<String> protocols, Map<String, String> headers) {
  public static final TransportOptions NONE = new TransportOptions(List.of(), Map.of());

  public TransportOptions {
    protocols = List.copyOf(requireNonNull(protocols, "protocols"));
    headers = Map.copyOf(requireNonNull(headers, "headers"));
  }

  public TransportOptions withoutHeaders() {
    return new TransportOptions(protocols, Map.of());
  }
}
