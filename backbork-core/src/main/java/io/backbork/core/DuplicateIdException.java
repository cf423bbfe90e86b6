package io.backbork.core;

public class DuplicateIdException extends BackborkException {

    public DuplicateIdException(String id) {
        super("Id already issued: " + id);
    }
}
