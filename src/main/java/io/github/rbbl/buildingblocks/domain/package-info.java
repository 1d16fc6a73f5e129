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

/**
 * Defines the entity and domain event model used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are running a parcel locker:
 *
 * <ul>
 *   <li>Each locker compartment is a {@link io.github.rbbl.buildingblocks.domain.BaseEntity}:
 *       <ul>
 *         <li>It has its own identifier, assigned once when the compartment is installed.
 *         <li>It remembers who installed it and who touched it last via {@link
 *             io.github.rbbl.buildingblocks.domain.BaseEntity#setCreated(java.lang.String)} and
 *             {@link io.github.rbbl.buildingblocks.domain.BaseEntity#setModified(java.lang.String)}.
 *       </ul>
 *   <li>When a courier drops a parcel, compartment business method raises a {@link
 *       io.github.rbbl.buildingblocks.domain.DomainEvent} {@code ParcelDeposited} - the fact is
 *       queued on the compartment, nobody is notified yet.
 *   <li>Once the compartment state is saved via {@link
 *       io.github.rbbl.buildingblocks.persistence.UnitOfWork}, the {@link
 *       io.github.rbbl.buildingblocks.domain.DomainEventDispatcher} takes queued events and hands
 *       {@code ParcelDeposited} to a {@link io.github.rbbl.buildingblocks.domain.DomainEventHandler}
 *       which sends a pickup code to the recipient.
 *   <li>After dispatch the compartment has no pending events left, the next business method starts
 *       a fresh queue.
 * </ul>
 */
package io.github.rbbl.buildingblocks.domain;
