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

/**
 * Lightweight, transport-agnostic MQTT message, e.g. for logging or testing - implementations of
 * {@link MqttClientService} can map it to their concrete message type.
 *
 * @param topic to publish to, must not be blank
 * @param payload of the message, must not be {@code null}
 * @param retain whether the broker should retain the message, {@code false} by default
 * @param qos quality of service level in {@code [0, 2]}, {@value #DEFAULT_QOS} by default
 */
public record MqttMessage(String topic, String payload, boolean retain, int qos) {
  /** At least once delivery. */
  public static final int DEFAULT_QOS = 1;

  public static final int MIN_QOS = 0;
  public static final int MAX_QOS = 2;

  public MqttMessage {
    Guard.notNullOrWhiteSpace(topic, "topic");
    Guard.notNull(payload, "payload");
    Guard.inRange(qos, MIN_QOS, MAX_QOS, "qos");
  }

  public MqttMessage(String topic, String payload) {
    this(topic, payload, false, DEFAULT_QOS);
  }

  public MqttMessage(String topic, String payload, boolean retain) {
    this(topic, payload, retain, DEFAULT_QOS);
  }
}
