package io.backbork;

import io.backbork.core.Destination;

import java.util.Optional;

@FunctionalInterface
public interface DestinationRegistry {

    Optional<Destination> find(String destinationId);
}
