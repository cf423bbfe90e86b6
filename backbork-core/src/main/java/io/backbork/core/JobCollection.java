package io.backbork.core;

/**
 * Record collections a job moves through. A job lives in exactly one of them at a time.
 */
public enum JobCollection {
    QUEUED("queue"),
    RUNNING("running"),
    COMPLETED("completed");

    private final String storageName;

    JobCollection(String storageName) {
        this.storageName = storageName;
    }

    /**
     * Directory or discriminator name used by the stores.
     */
    public String storageName() {
        return storageName;
    }
}
