package io.backbork.internal;

import io.backbork.JobBuilder;
import io.backbork.core.AccountSelection;
import io.backbork.core.Frequency;
import io.backbork.core.JobRequest;
import io.backbork.core.JobType;
import io.backbork.core.SubmitResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation.
 */
public class SimpleJobBuilder implements JobBuilder {

    static final String DEFAULT_OWNER = "root";

    private final JobType type;
    private final AccountSelection accounts;
    private final String destinationId;
    private final Function<JobRequest, SubmitResult> submitter;

    private String owner = DEFAULT_OWNER;
    private int retention;
    private final Map<String, String> options = new LinkedHashMap<>();

    private Frequency frequency;
    private int preferredHour;
    private int dayOfWeek;

    public SimpleJobBuilder(JobType type,
                            AccountSelection accounts,
                            String destinationId,
                            Function<JobRequest, SubmitResult> submitter) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
        this.destinationId = Objects.requireNonNull(destinationId, "destinationId must not be null");
        this.submitter = Objects.requireNonNull(submitter, "submitter must not be null");
    }

    @Override
    public JobBuilder owner(String owner) {
        Objects.requireNonNull(owner, "owner must not be null");
        if (owner.isBlank()) throw new IllegalArgumentException("owner must not be blank");
        this.owner = owner;
        return this;
    }

    @Override
    public JobBuilder retention(int retention) {
        if (retention < 0) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }
        this.retention = retention;
        return this;
    }

    @Override
    public JobBuilder option(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) throw new IllegalArgumentException("option key must not be blank");
        if (value == null) {
            throw new IllegalArgumentException("option value must not be null for key: " + key);
        }
        options.put(key, value);
        return this;
    }

    @Override
    public JobBuilder options(Map<String, String> options) {
        Objects.requireNonNull(options, "options must not be null");
        options.forEach(this::option);
        return this;
    }

    @Override
    public JobBuilder hourly() {
        return recurring(Frequency.HOURLY, 0, 0);
    }

    @Override
    public JobBuilder daily(int hour) {
        return recurring(Frequency.DAILY, hour, 0);
    }

    @Override
    public JobBuilder weekly(int dayOfWeek, int hour) {
        return recurring(Frequency.WEEKLY, hour, dayOfWeek);
    }

    @Override
    public JobBuilder monthly(int hour) {
        return recurring(Frequency.MONTHLY, hour, 0);
    }

    @Override
    public JobRequest build() {
        return new JobRequest(type, accounts, destinationId, owner, frequency, preferredHour, dayOfWeek, retention, options);
    }

    @Override
    public SubmitResult save() {
        return submitter.apply(build());
    }

    private JobBuilder recurring(Frequency frequency, int hour, int dayOfWeek) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be within 0..23: " + hour);
        }
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be within 0..6: " + dayOfWeek);
        }
        this.frequency = frequency;
        this.preferredHour = hour;
        this.dayOfWeek = dayOfWeek;
        return this;
    }
}
