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

import io.github.rbbl.buildingblocks.guard.Guard;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Base class for persisted domain objects: identity, audit metadata and a buffer of pending {@link
 * DomainEvent}s.
 *
 * <p>Only subclasses can append events via {@link #raiseDomainEvent(DomainEvent)}, external callers
 * can only read pending events and clear them after dispatch.
 *
 * <p>Instances are not thread-safe - a single entity must not be mutated concurrently without
 * external synchronization.
 */
public abstract class BaseEntity implements HasDomainEvents {
  private final List<DomainEvent> domainEvents = new ArrayList<>();
  private final List<DomainEvent> readOnlyDomainEvents =
      Collections.unmodifiableList(domainEvents);

  private final UUID id;
  private final Clock clock;

  private Instant createdAt;
  private String createdBy;
  private Instant modifiedAt;
  private String modifiedBy;

  /** Creates an entity with a random identifier using UTC system clock. */
  protected BaseEntity() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an entity with a random identifier.
   *
   * @param clock to take timestamps from
   */
  protected BaseEntity(final Clock clock) {
    this(UUID.randomUUID(), clock);
  }

  /**
   * Creates an entity with the given identifier, typically when it is restored from storage.
   *
   * @param id of the entity
   * @param clock to take timestamps from
   * @throws io.github.rbbl.buildingblocks.guard.NullArgumentException if any argument is {@code
   *     null}
   * @throws io.github.rbbl.buildingblocks.guard.EmptyIdentifierException if the identifier is a nil
   *     {@link UUID}
   */
  protected BaseEntity(final UUID id, final Clock clock) {
    this.id = Guard.notEmpty(id, "id");
    this.clock = Guard.notNull(clock, "clock");
    this.createdAt = clock.instant();
  }

  /**
   * @return entity identifier, never reassigned
   */
  public final UUID getId() {
    return id;
  }

  /**
   * @return UTC instant when the entity was created
   */
  public final Instant getCreatedAt() {
    return createdAt;
  }

  /**
   * @return identifier of the user who created this entity
   */
  public final Optional<String> getCreatedBy() {
    return Optional.ofNullable(createdBy);
  }

  /**
   * @return UTC instant when the entity was last modified
   */
  public final Optional<Instant> getModifiedAt() {
    return Optional.ofNullable(modifiedAt);
  }

  /**
   * @return identifier of the user who last modified this entity
   */
  public final Optional<String> getModifiedBy() {
    return Optional.ofNullable(modifiedBy);
  }

  /** {@inheritDoc} */
  @Override
  public final List<DomainEvent> getDomainEvents() {
    return readOnlyDomainEvents;
  }

  /** {@inheritDoc} */
  @Override
  public final void clearDomainEvents() {
    domainEvents.clear();
  }

  /**
   * Sets the creator and re-stamps the creation instant.
   *
   * <p>Usually called when the entity is first persisted. Every call overwrites the creation
   * instant.
   *
   * @param createdBy identifier of the creator, may be empty
   * @throws io.github.rbbl.buildingblocks.guard.NullArgumentException if the creator is {@code
   *     null}
   */
  public final void setCreated(final String createdBy) {
    this.createdBy = Guard.notNull(createdBy, "createdBy");
    this.createdAt = clock.instant();
  }

  /**
   * Marks the entity as modified by the given user.
   *
   * @param modifiedBy identifier of the modifier, can be {@code null}
   */
  public final void setModified(final String modifiedBy) {
    this.modifiedAt = clock.instant();
    this.modifiedBy = modifiedBy;
  }

  /** Marks the entity as modified by an unknown user. */
  public final void setModified() {
    setModified(null);
  }

  /**
   * Queues a new event to be dispatched later.
   *
   * @param event to queue
   * @throws io.github.rbbl.buildingblocks.guard.NullArgumentException if the event is {@code null}
   */
  protected final void raiseDomainEvent(final DomainEvent event) {
    domainEvents.add(Guard.notNull(event, "event"));
  }

  /**
   * @return the clock this entity takes timestamps from, for subclasses stamping their own events
   */
  protected final Clock clock() {
    return clock;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BaseEntity that = (BaseEntity) o;
    return id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }
}
