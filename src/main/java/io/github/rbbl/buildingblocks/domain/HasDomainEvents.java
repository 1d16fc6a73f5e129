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

import java.util.List;

/**
 * Contract for objects which accumulate {@link DomainEvent}s.
 *
 * <p>{@link BaseEntity} already implements the mechanics, this interface allows generic handling of
 * pending events, e.g. by {@link DomainEventDispatcher}.
 */
public interface HasDomainEvents {
  /**
   * @return read-only view of pending events in the order they were raised
   */
  List<DomainEvent> getDomainEvents();

  /** Discards all pending events once they have been dispatched. */
  void clearDomainEvents();
}
