/*-
 * =================================LICENSE_START==================================
 * qbatch-core
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
package io.aleph0.qbatch.core.message;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import io.aleph0.qbatch.core.Message;

/**
 * Plain immutable {@link Message}. Queue clients that need extra addressing state, e.g., a receipt
 * handle, should extend this class.
 */
public class DefaultMessage implements Message {
  public static DefaultMessage of(String id, String body) {
    return new DefaultMessage(id, Map.of(), body.getBytes(StandardCharsets.UTF_8), 1);
  }

  private final String id;
  private final Map<String, String> attributes;
  private final byte[] body;
  private final int deliveryAttempt;

  public DefaultMessage(String id, Map<String, String> attributes, byte[] body,
      int deliveryAttempt) {
    if (deliveryAttempt < 0)
      throw new IllegalArgumentException("deliveryAttempt must not be negative");
    this.id = requireNonNull(id, "id");
    this.attributes =
        unmodifiableMap(new LinkedHashMap<>(requireNonNull(attributes, "attributes")));
    this.body = requireNonNull(body, "body").clone();
    this.deliveryAttempt = deliveryAttempt;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Map<String, String> attributes() {
    return attributes;
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  /**
   * Returns the body decoded as UTF-8.
   */
  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public int deliveryAttempt() {
    return deliveryAttempt;
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    DefaultMessage other = (DefaultMessage) obj;
    return id.equals(other.id) && deliveryAttempt == other.deliveryAttempt
        && attributes.equals(other.attributes) && Arrays.equals(body, other.body);
  }

  @Override
  public String toString() {
    return "DefaultMessage [id=" + id + ", deliveryAttempt=" + deliveryAttempt + "]";
  }
}
