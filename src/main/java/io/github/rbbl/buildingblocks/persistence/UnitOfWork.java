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

package io.github.rbbl.buildingblocks.persistence;

import reactor.core.publisher.Mono;

/**
 * Boundary which commits mutations staged via {@link Repository} atomically.
 *
 * <p>Transaction scope and storage mechanics are up to the implementation. Pending domain events
 * are not dispatched here - callers hand entities to {@link
 * io.github.rbbl.buildingblocks.domain.DomainEventDispatcher} separately.
 */
@FunctionalInterface
public interface UnitOfWork {
  /**
   * @return amount of affected records, emitted once the commit completed
   */
  Mono<Integer> saveChanges();
}
