/*
 * Copyright 2024 The building-blocks Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.rbbl.buildingblocks.messaging;

import io.github.rbbl.buildingblocks.guard.Guard;
import reactor.core.publisher.Mono;

/**
 * Abstraction over an MQTT client connected to a broker.
 *
 * <p>No transport is defined here - concrete implementations live in the infrastructure layer.
 *
 * <p>All operations are lazy: nothing happens until the returned {@link Mono} is subscribed to, and
 * disposing the subscription cancels the in-flight operation.
 *
 * <p>Instances can be used in {@code try}-with-resources blocks, closing disconnects from the broker
 * if the client is still connected.
 */
public interface MqttClientService extends AutoCloseable {
  /**
   * @return completion signal once connected to the broker
   */
  Mono<Void> connect();

  /**
   * @param topic to publish to
   * @param payload of the message
   * @param retain whether the broker should retain the message
   * @param qos quality of service level in {@code [0, 2]}
   * @return completion signal once the message was handed over to the broker
   */
  Mono<Void> publish(String topic, String payload, boolean retain, int qos);

  /**
   * Publishes a non-retained message with {@link MqttMessage#DEFAULT_QOS}.
   *
   * @param topic to publish to
   * @param payload of the message
   * @return completion signal once the message was handed over to the broker
   */
  default Mono<Void> publish(String topic, String payload) {
    return publish(topic, payload, false, MqttMessage.DEFAULT_QOS);
  }

  /**
   * @param message to publish
   * @return completion signal once the message was handed over to the broker
   */
  default Mono<Void> publish(MqttMessage message) {
    final MqttMessage nonNullMessage = Guard.notNull(message, "message");
    return publish(
        nonNullMessage.topic(),
        nonNullMessage.payload(),
        nonNullMessage.retain(),
        nonNullMessage.qos());
  }

  /**
   * @return {@code true} if the client is currently connected
   */
  boolean isConnected();

  /**
   * @return completion signal once disconnected from the broker
   */
  Mono<Void> disconnect();

  /**
   * @return completion signal once disconnected, completes immediately if not connected
   */
  default Mono<Void> closeAsync() {
    return Mono.defer(() -> isConnected() ? disconnect() : Mono.empty());
  }

  /** Blocks until {@link #closeAsync()} completes. */
  @Override
  default void close() {
    closeAsync().block();
  }
}
