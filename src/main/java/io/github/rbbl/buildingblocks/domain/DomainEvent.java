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

package io.github.rbbl.buildingblocks.domain;

import java.io.Serializable;
import java.time.Instant;

/**
 * Represents a business-significant fact which occurred at a specific instant.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s, as events must stay
 * immutable once constructed.
 *
 * <p>Events are raised by {@link BaseEntity} business methods, stay queued on the entity and are
 * consumed later, e.g. by {@link DomainEventDispatcher} - it should be possible to place them in a
 * message queue, which is the reason this interface extends {@link Serializable}.
 */
public interface DomainEvent extends Serializable {
  /**
   * Defined as {@code occurredAt()} rather than {@code getOccurredAt()} to be friendly towards Java
   * {@link Record}s.
   *
   * @return UTC instant when the event occurred
   */
  Instant occurredAt();
}
