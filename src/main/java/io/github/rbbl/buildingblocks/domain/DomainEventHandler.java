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

/**
 * Reacts to a specific type of {@link DomainEvent} dispatched by {@link DomainEventDispatcher}.
 *
 * @param <E> is the type of the event
 */
@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent> {
  /**
   * Defines business logic reacting to the event.
   *
   * @param event being dispatched
   * @throws Exception if any happened during handling
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  void handle(E event) throws Exception;
}
