package io.backbork.core;

public class NotFoundException extends BackborkException {

    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.id = id;
    }

    public String id() {
        return id;
    }
}
