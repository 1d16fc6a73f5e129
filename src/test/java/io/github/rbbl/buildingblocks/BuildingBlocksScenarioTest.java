package io.github.rbbl.buildingblocks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.rbbl.buildingblocks.domain.DomainEventDispatcher;
import io.github.rbbl.buildingblocks.logging.AppLogger;
import io.github.rbbl.buildingblocks.messaging.MqttMessage;
import io.github.rbbl.buildingblocks.persistence.AuditingRepository;
import io.github.rbbl.test.FixedCurrentUser;
import io.github.rbbl.test.InMemoryEntityStore;
import io.github.rbbl.test.LockerCompartment;
import io.github.rbbl.test.LockerCompartment.ParcelDeposited;
import io.github.rbbl.test.RecordingMqttClient;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

/** Walks through the typical flow: mutate, stage, commit, then dispatch pending events. */
class BuildingBlocksScenarioTest {
  @Test
  void when_entity_is_saved_and_dispatched_events_are_published_and_cleared() {
    final var store = new InMemoryEntityStore<LockerCompartment>();
    final var repository =
        new AuditingRepository<>(
            store,
            FixedCurrentUser.authenticated("courier-7"),
            AppLogger.forClass(AuditingRepository.class));
    final var mqtt = new RecordingMqttClient();
    final var dispatcher =
        DomainEventDispatcher.builder()
            .logger(AppLogger.forClass(DomainEventDispatcher.class))
            .handler(
                ParcelDeposited.class,
                event ->
                    mqtt.publish(
                            "lockers/%s/parcels".formatted(event.compartmentId()),
                            event.parcelId())
                        .block())
            .build();

    StepVerifier.create(mqtt.connect()).verifyComplete();

    final var compartment = new LockerCompartment();
    compartment.deposit("parcel-1");
    compartment.deposit("parcel-2");
    assertEquals(2, compartment.getDomainEvents().size());

    StepVerifier.create(repository.add(compartment).then(store.saveChanges()))
        .expectNext(1)
        .verifyComplete();
    assertEquals(Optional.of("courier-7"), compartment.getCreatedBy());

    final var result = dispatcher.dispatch(compartment);

    assertEquals(Optional.of(2), result.value());
    assertTrue(compartment.getDomainEvents().isEmpty());
    assertEquals(
        List.of(
            new MqttMessage("lockers/%s/parcels".formatted(compartment.getId()), "parcel-1"),
            new MqttMessage("lockers/%s/parcels".formatted(compartment.getId()), "parcel-2")),
        mqtt.published());

    mqtt.close();
    assertEquals(1, mqtt.disconnects());
  }
}
