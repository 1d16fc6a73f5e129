package io.github.rbbl.buildingblocks.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.rbbl.buildingblocks.guard.EmptyIdentifierException;
import io.github.rbbl.buildingblocks.guard.NullArgumentException;
import io.github.rbbl.test.LockerCompartment;
import io.github.rbbl.test.LockerCompartment.ParcelDeposited;
import io.github.rbbl.test.LockerCompartment.ParcelPickedUp;
import io.github.rbbl.test.TickingClock;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BaseEntityTest {
  @Nested
  class Construction {
    @Test
    void when_entity_is_constructed_identifier_is_assigned_and_unique() {
      final var ids = new HashSet<UUID>();

      IntStream.range(0, 1_000)
          .mapToObj(i -> new LockerCompartment())
          .forEach(
              entity -> {
                assertNotNull(entity.getId());
                assertNotEquals(new UUID(0L, 0L), entity.getId());
                ids.add(entity.getId());
              });

      assertEquals(1_000, ids.size());
    }

    @Test
    void when_entity_is_constructed_only_creation_instant_is_stamped() {
      final var entity = new LockerCompartment(new TickingClock());

      assertEquals(TickingClock.START, entity.getCreatedAt());
      assertEquals(Optional.empty(), entity.getCreatedBy());
      assertEquals(Optional.empty(), entity.getModifiedAt());
      assertEquals(Optional.empty(), entity.getModifiedBy());
      assertTrue(entity.getDomainEvents().isEmpty());
    }

    @Test
    void when_restored_with_nil_identifier_empty_identifier_exception_is_thrown() {
      final var clock = Clock.systemUTC();

      assertThrows(
          EmptyIdentifierException.class, () -> new LockerCompartment(new UUID(0L, 0L), clock));
      assertThrows(NullArgumentException.class, () -> new LockerCompartment(null, clock));
      assertThrows(
          NullArgumentException.class, () -> new LockerCompartment(UUID.randomUUID(), null));
    }

    @Test
    void when_restored_with_identifier_it_is_kept() {
      final var id = UUID.randomUUID();

      assertEquals(id, new LockerCompartment(id, Clock.systemUTC()).getId());
    }
  }

  @Nested
  class Audit {
    @Test
    void when_set_created_is_called_creator_is_set_and_creation_instant_is_restamped() {
      final var entity = new LockerCompartment(new TickingClock());

      entity.setCreated("alice");
      assertEquals(Optional.of("alice"), entity.getCreatedBy());
      assertEquals(TickingClock.START.plus(Duration.ofSeconds(1)), entity.getCreatedAt());

      entity.setCreated("");
      assertEquals(Optional.of(""), entity.getCreatedBy());
      assertEquals(TickingClock.START.plus(Duration.ofSeconds(2)), entity.getCreatedAt());
    }

    @Test
    void when_set_created_is_called_with_null_null_argument_exception_is_thrown() {
      final var entity = new LockerCompartment();

      assertThrows(NullArgumentException.class, () -> entity.setCreated(null));
    }

    @Test
    void when_set_modified_is_called_creation_instant_and_identifier_stay_intact() {
      final var entity = new LockerCompartment(new TickingClock());
      final var id = entity.getId();
      final var createdAt = entity.getCreatedAt();

      entity.setModified("bob");
      assertEquals(id, entity.getId());
      assertEquals(createdAt, entity.getCreatedAt());
      assertEquals(Optional.of("bob"), entity.getModifiedBy());
      assertEquals(
          Optional.of(TickingClock.START.plus(Duration.ofSeconds(1))), entity.getModifiedAt());

      entity.setModified();
      assertEquals(id, entity.getId());
      assertEquals(createdAt, entity.getCreatedAt());
      assertEquals(Optional.empty(), entity.getModifiedBy());
      assertEquals(
          Optional.of(TickingClock.START.plus(Duration.ofSeconds(2))), entity.getModifiedAt());
    }
  }

  @Nested
  class DomainEvents {
    @Test
    void when_events_are_raised_they_are_kept_in_raise_order_until_cleared() {
      final var entity = new LockerCompartment();

      entity.deposit("parcel-1");
      entity.pickUp();

      assertEquals(2, entity.getDomainEvents().size());
      assertTrue(entity.getDomainEvents().get(0) instanceof ParcelDeposited);
      assertTrue(entity.getDomainEvents().get(1) instanceof ParcelPickedUp);

      entity.clearDomainEvents();
      assertEquals(0, entity.getDomainEvents().size());
    }

    @Test
    void when_events_are_cleared_twice_nothing_fails() {
      final var entity = new LockerCompartment();
      entity.deposit("parcel-1");

      entity.clearDomainEvents();
      entity.clearDomainEvents();

      assertTrue(entity.getDomainEvents().isEmpty());
    }

    @Test
    void when_same_event_is_raised_twice_both_occurrences_are_kept() {
      final var entity = new LockerCompartment();
      final var event = new ParcelDeposited(entity.getId(), "parcel-1", TickingClock.START);

      entity.raise(event);
      entity.raise(event);

      assertEquals(2, entity.getDomainEvents().size());
    }

    @Test
    void when_external_caller_mutates_events_view_unsupported_operation_exception_is_thrown() {
      final var entity = new LockerCompartment();
      entity.deposit("parcel-1");
      final var events = entity.getDomainEvents();

      assertThrows(UnsupportedOperationException.class, events::clear);
      assertThrows(
          UnsupportedOperationException.class,
          () -> events.add(new ParcelPickedUp(entity.getId(), "parcel-1", TickingClock.START)));
    }

    @Test
    void when_null_event_is_raised_null_argument_exception_is_thrown() {
      final var entity = new LockerCompartment();

      assertThrows(NullArgumentException.class, () -> entity.raise(null));
      assertTrue(entity.getDomainEvents().isEmpty());
    }

    @Test
    void when_events_are_raised_with_entity_clock_they_carry_its_instant() {
      final var entity = new LockerCompartment(new TickingClock());

      entity.deposit("parcel-1");

      assertEquals(
          TickingClock.START.plus(Duration.ofSeconds(1)),
          entity.getDomainEvents().get(0).occurredAt());
    }
  }

  @Test
  void entities_are_equal_only_when_identifiers_are_equal() {
    final var id = UUID.randomUUID();
    final var clock = Clock.systemUTC();

    assertEquals(new LockerCompartment(id, clock), new LockerCompartment(id, clock));
    assertEquals(
        new LockerCompartment(id, clock).hashCode(), new LockerCompartment(id, clock).hashCode());
    assertNotEquals(new LockerCompartment(clock), new LockerCompartment(clock));
  }
}
