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
import io.github.rbbl.buildingblocks.logging.AppLogger;
import io.github.rbbl.buildingblocks.result.Result;
import io.github.suppierk.java.Try;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers pending {@link DomainEvent}s of {@link HasDomainEvents} sources to registered {@link
 * DomainEventHandler}s:
 *
 * <ul>
 *   <li>Take a snapshot of pending events and clear the source.
 *   <li>Invoke every handler registered for the event class or any of its supertypes, in
 *       registration order.
 *   <li>Report the outcome as a {@link Result} - a failing handler does not prevent remaining
 *       handlers from running.
 * </ul>
 *
 * <p>Events are cleared before handlers run, so each event is delivered at most once per dispatch
 * even if some of the handlers fail. A handler throwing {@link InterruptedException} counts as a
 * failure and restores the interrupt status of the dispatching thread.
 *
 * <p>Instances are immutable and can be shared, use {@link #builder()} to create one.
 */
public final class DomainEventDispatcher {
  private final List<Registration<?>> registrations;
  private final AppLogger<DomainEventDispatcher> logger;

  private DomainEventDispatcher(final Builder builder) {
    this.registrations = List.copyOf(builder.registrations);
    this.logger = builder.logger;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches pending events of a single source.
   *
   * @param source to take events from
   * @return successful result with the amount of handler invocations, or a failure if at least one
   *     handler threw an exception
   * @throws io.github.rbbl.buildingblocks.guard.NullArgumentException if the source is {@code null}
   */
  public Result<Integer> dispatch(final HasDomainEvents source) {
    final HasDomainEvents nonNullSource = Guard.notNull(source, "source");
    final List<DomainEvent> pending = new ArrayList<>(nonNullSource.getDomainEvents());
    nonNullSource.clearDomainEvents();

    int invocations = 0;
    final AtomicInteger failures = new AtomicInteger();

    for (DomainEvent event : pending) {
      if (event == null) {
        logger.warn("Skipping null event queued on {}", nonNullSource.getClass().getSimpleName());
        continue;
      }

      boolean handled = false;
      for (Registration<?> registration : registrations) {
        if (!registration.supports(event)) {
          continue;
        }

        handled = true;
        invocations++;

        Try.of(() -> registration.invoke(event))
            .ifFailure(
                cause -> {
                  if (cause instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                  }

                  failures.incrementAndGet();
                  logger.error(
                      cause,
                      "Handler for '{}' failed on '{}'",
                      registration.eventClass().getSimpleName(),
                      event.getClass().getSimpleName());
                });
      }

      if (!handled) {
        logger.trace("No handlers registered for '{}'", event.getClass().getSimpleName());
      }
    }

    logger.trace("Dispatched {} event(s) with {} handler invocation(s)", pending.size(), invocations);

    if (failures.get() > 0) {
      return Result.failure(
          "%d of %d handler invocations failed".formatted(failures.get(), invocations));
    }

    return Result.success(invocations);
  }

  /**
   * Dispatches pending events of every source, see {@link #dispatch(HasDomainEvents)}.
   *
   * @param sources to take events from
   * @return successful result with the total amount of handler invocations, or a failure if at
   *     least one of the sources failed to dispatch
   * @throws io.github.rbbl.buildingblocks.guard.NullArgumentException if the collection or any of
   *     its elements is {@code null}, no source is dispatched in that case
   */
  public Result<Integer> dispatchAll(final Collection<? extends HasDomainEvents> sources) {
    final Collection<? extends HasDomainEvents> nonNullSources = Guard.notNull(sources, "sources");
    for (HasDomainEvents source : nonNullSources) {
      Guard.notNull(source, "source");
    }

    int invocations = 0;
    int failedSources = 0;

    for (HasDomainEvents source : nonNullSources) {
      final Result<Integer> result = dispatch(source);
      if (result.isFailure()) {
        failedSources++;
      }

      invocations += result.value().orElse(0);
    }

    if (failedSources > 0) {
      return Result.failure(
          "%d of %d sources failed to dispatch".formatted(failedSources, nonNullSources.size()));
    }

    return Result.success(invocations);
  }

  /** Handler bound to the event class it accepts. */
  private record Registration<E extends DomainEvent>(
      Class<E> eventClass, DomainEventHandler<? super E> handler) {
    boolean supports(final DomainEvent event) {
      return eventClass.isInstance(event);
    }

    E invoke(final DomainEvent event) throws Exception {
      final E typedEvent = eventClass.cast(event);
      handler.handle(typedEvent);
      return typedEvent;
    }
  }

  /** Collects handlers and settings for {@link DomainEventDispatcher}. */
  public static final class Builder {
    private final List<Registration<?>> registrations = new ArrayList<>();
    private AppLogger<DomainEventDispatcher> logger = AppLogger.noOp();

    private Builder() {
      // Use DomainEventDispatcher.builder()
    }

    /**
     * Registers a handler for the given event class and all of its subclasses.
     *
     * @param eventClass the handler is intended for
     * @param handler to invoke
     * @param <E> is the type of the event
     * @return this builder
     */
    public <E extends DomainEvent> Builder handler(
        final Class<E> eventClass, final DomainEventHandler<? super E> handler) {
      registrations.add(
          new Registration<>(
              Guard.notNull(eventClass, "eventClass"), Guard.notNull(handler, "handler")));
      return this;
    }

    /**
     * @param logger to report handler failures to, silent by default
     * @return this builder
     */
    public Builder logger(final AppLogger<DomainEventDispatcher> logger) {
      this.logger = Guard.notNull(logger, "logger");
      return this;
    }

    /**
     * @return a new dispatcher
     */
    public DomainEventDispatcher build() {
      return new DomainEventDispatcher(this);
    }
  }
}
