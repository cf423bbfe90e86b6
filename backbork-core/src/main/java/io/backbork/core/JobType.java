package io.backbork.core;

public enum JobType {
    BACKUP {
        @Override
        public boolean producesArtifacts() {
            return true;
        }
    },
    RESTORE {
        @Override
        public boolean producesArtifacts() {
            return false;
        }
    };

    public abstract boolean producesArtifacts();
}
