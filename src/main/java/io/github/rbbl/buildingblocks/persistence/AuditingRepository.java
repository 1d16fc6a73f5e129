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

import io.github.rbbl.buildingblocks.authorization.CurrentUser;
import io.github.rbbl.buildingblocks.domain.BaseEntity;
import io.github.rbbl.buildingblocks.guard.Guard;
import io.github.rbbl.buildingblocks.logging.AppLogger;
import java.util.UUID;
import java.util.function.Predicate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link Repository} decorator stamping audit fields with the {@link CurrentUser} identity:
 *
 * <ul>
 *   <li>{@link #add(BaseEntity)} calls {@link BaseEntity#setCreated(String)}, falling back to
 *       {@link CurrentUser#ANONYMOUS_USER_ID}.
 *   <li>{@link #update(BaseEntity)} calls {@link BaseEntity#setModified(String)} with the user
 *       identifier, if any.
 * </ul>
 *
 * <p>Every call is traced. Stamping and tracing happen upon subscription, right before delegating,
 * so a call which was never subscribed to leaves the entity untouched.
 *
 * @param <T> is the type of the entity
 */
public final class AuditingRepository<T extends BaseEntity> implements Repository<T> {
  private final Repository<T> delegate;
  private final CurrentUser currentUser;
  private final AppLogger<?> logger;

  /**
   * @param delegate to forward calls to
   * @param currentUser to take the identity from
   */
  public AuditingRepository(final Repository<T> delegate, final CurrentUser currentUser) {
    this(delegate, currentUser, AppLogger.noOp());
  }

  /**
   * @param delegate to forward calls to
   * @param currentUser to take the identity from
   * @param logger to trace stamping with
   */
  public AuditingRepository(
      final Repository<T> delegate,
      final CurrentUser currentUser,
      final AppLogger<?> logger) {
    this.delegate = Guard.notNull(delegate, "delegate");
    this.currentUser = Guard.notNull(currentUser, "currentUser");
    this.logger = Guard.notNull(logger, "logger");
  }

  @Override
  public Mono<T> findById(final UUID id) {
    return Mono.defer(
        () -> {
          logger.trace("Looking up entity '{}'", id);
          return delegate.findById(id);
        });
  }

  @Override
  public Mono<Void> add(final T entity) {
    final T nonNullEntity = Guard.notNull(entity, "entity");
    return Mono.defer(
        () -> {
          final String actor = currentUser.userId().orElse(CurrentUser.ANONYMOUS_USER_ID);
          nonNullEntity.setCreated(actor);
          logger.trace("Entity '{}' created by '{}'", nonNullEntity.getId(), actor);
          return delegate.add(nonNullEntity);
        });
  }

  @Override
  public Mono<Void> update(final T entity) {
    final T nonNullEntity = Guard.notNull(entity, "entity");
    return Mono.defer(
        () -> {
          final String actor = currentUser.userId().orElse(null);
          nonNullEntity.setModified(actor);
          logger.trace("Entity '{}' modified by '{}'", nonNullEntity.getId(), actor);
          return delegate.update(nonNullEntity);
        });
  }

  @Override
  public Mono<Void> delete(final T entity) {
    final T nonNullEntity = Guard.notNull(entity, "entity");
    return Mono.defer(
        () -> {
          logger.trace("Entity '{}' deleted", nonNullEntity.getId());
          return delegate.delete(nonNullEntity);
        });
  }

  @Override
  public Flux<T> query(final Predicate<? super T> predicate) {
    return Flux.defer(
        () -> {
          logger.trace("Querying entities");
          return delegate.query(predicate);
        });
  }
}
