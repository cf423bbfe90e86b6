package io.backbork.config;

import io.backbork.DestinationRegistry;
import io.backbork.core.Destination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Destinations declared under {@code backbork.destinations}.
 */
public class ConfiguredDestinationRegistry implements DestinationRegistry {

    private final Map<String, Destination> destinations;

    public ConfiguredDestinationRegistry(List<BackborkProperties.DestinationProperties> configured) {
        Map<String, Destination> byId = new LinkedHashMap<>();
        for (BackborkProperties.DestinationProperties p : configured) {
            if (p.getId() == null || p.getId().isBlank()) {
                throw new IllegalArgumentException("backbork.destinations[].id must not be blank");
            }
            Destination d = new Destination(p.getId(), p.getName(), p.getType(), p.isEnabled());
            if (byId.putIfAbsent(d.id(), d) != null) {
                throw new IllegalArgumentException("Duplicate destination id: " + d.id());
            }
        }
        this.destinations = Collections.unmodifiableMap(byId);
    }

    @Override
    public Optional<Destination> find(String destinationId) {
        return Optional.ofNullable(destinations.get(destinationId));
    }

    public Map<String, Destination> all() {
        return destinations;
    }
}
