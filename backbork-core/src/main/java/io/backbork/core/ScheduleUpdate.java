package io.backbork.core;

/**
 * Partial change to a {@link Schedule}. Only set fields are applied.
 */
public final class ScheduleUpdate {

    private final AccountSelection accounts;
    private final String destinationId;
    private final Frequency frequency;
    private final Integer retention;
    private final Integer preferredHour;
    private final Integer dayOfWeek;
    private final Boolean enabled;

    private ScheduleUpdate(Builder b) {
        this.accounts = b.accounts;
        this.destinationId = b.destinationId;
        this.frequency = b.frequency;
        this.retention = b.retention;
        this.preferredHour = b.preferredHour;
        this.dayOfWeek = b.dayOfWeek;
        this.enabled = b.enabled;
    }

    public AccountSelection accounts() {
        return accounts;
    }

    public String destinationId() {
        return destinationId;
    }

    public Frequency frequency() {
        return frequency;
    }

    public Integer retention() {
        return retention;
    }

    public Integer preferredHour() {
        return preferredHour;
    }

    public Integer dayOfWeek() {
        return dayOfWeek;
    }

    public Boolean enabled() {
        return enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AccountSelection accounts;
        private String destinationId;
        private Frequency frequency;
        private Integer retention;
        private Integer preferredHour;
        private Integer dayOfWeek;
        private Boolean enabled;

        public Builder accounts(AccountSelection accounts) {
            this.accounts = accounts;
            return this;
        }

        public Builder destination(String destinationId) {
            this.destinationId = destinationId;
            return this;
        }

        public Builder frequency(Frequency frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder retention(int retention) {
            if (retention < 0) {
                throw new IllegalArgumentException("retention must not be negative");
            }
            this.retention = retention;
            return this;
        }

        public Builder preferredHour(int preferredHour) {
            if (preferredHour < 0 || preferredHour > 23) {
                throw new IllegalArgumentException("preferredHour must be within 0..23");
            }
            this.preferredHour = preferredHour;
            return this;
        }

        public Builder dayOfWeek(int dayOfWeek) {
            if (dayOfWeek < 0 || dayOfWeek > 6) {
                throw new IllegalArgumentException("dayOfWeek must be within 0..6");
            }
            this.dayOfWeek = dayOfWeek;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ScheduleUpdate build() {
            if (accounts == null && destinationId == null && frequency == null && retention == null
                    && preferredHour == null && dayOfWeek == null && enabled == null) {
                throw new IllegalStateException("ScheduleUpdate must change at least one field");
            }
            return new ScheduleUpdate(this);
        }
    }
}
