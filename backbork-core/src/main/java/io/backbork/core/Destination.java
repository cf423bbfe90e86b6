package io.backbork.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A configured storage destination.
 */
public record Destination(String id, String name, String type, boolean enabled) {

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }

    @JsonIgnore
    public boolean isLocal() {
        return type == null || "local".equalsIgnoreCase(type);
    }
}
