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

import io.github.rbbl.buildingblocks.domain.BaseEntity;
import java.util.UUID;
import java.util.function.Predicate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Query and mutation surface over entities of a single type.
 *
 * <p>Mutations are staged and become durable only when {@link UnitOfWork#saveChanges()} completes.
 *
 * <p>Nothing happens until the returned publisher is subscribed to. Disposing the subscription is
 * the cancellation signal - implementations must stop the in-flight operation and must not start
 * any further work for it.
 *
 * @param <T> is the type of the entity
 */
public interface Repository<T extends BaseEntity> {
  /**
   * @param id of the entity
   * @return the entity, or an empty {@link Mono} when it does not exist
   */
  Mono<T> findById(UUID id);

  /**
   * @param entity to stage for insertion
   * @return completion signal
   */
  Mono<Void> add(T entity);

  /**
   * @param entity to stage for update
   * @return completion signal
   */
  Mono<Void> update(T entity);

  /**
   * @param entity to stage for removal
   * @return completion signal
   */
  Mono<Void> delete(T entity);

  /**
   * @param predicate to filter entities with
   * @return lazily evaluated sequence of matching entities
   */
  Flux<T> query(Predicate<? super T> predicate);

  /**
   * @return lazily evaluated sequence of all entities
   */
  default Flux<T> query() {
    return query(entity -> true);
  }
}
