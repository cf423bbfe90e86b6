package io.backbork.core;

public record TransportResult(boolean success, String message) {

    public static TransportResult ok() {
        return new TransportResult(true, "OK");
    }

    public static TransportResult failed(String message) {
        return new TransportResult(false, message);
    }
}
