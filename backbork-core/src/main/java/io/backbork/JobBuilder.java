package io.backbork;

import io.backbork.core.JobRequest;
import io.backbork.core.SubmitResult;

import java.util.Map;

/**
 * Fluent builder for a one-time job or a recurring schedule.
 *
 * <p>Without a frequency the request is a one-time job; calling one of {@link #hourly()},
 * {@link #daily(int)}, {@link #weekly(int, int)} or {@link #monthly(int)} turns it into a schedule.
 *
 * <ul>
 *   <li>build(): returns an in-memory request</li>
 *   <li>save(): build() + persist</li>
 * </ul>
 */
public interface JobBuilder {

    JobBuilder owner(String owner);

    /**
     * Artifacts to keep per account; 0 keeps everything.
     */
    JobBuilder retention(int retention);

    JobBuilder option(String key, String value);

    JobBuilder options(Map<String, String> options);

    JobBuilder hourly();

    /**
     * Every day at {@code hour}:00.
     */
    JobBuilder daily(int hour);

    /**
     * Every week on {@code dayOfWeek} (0=Sunday .. 6=Saturday) at {@code hour}:00.
     */
    JobBuilder weekly(int dayOfWeek, int hour);

    /**
     * The first day of every month at {@code hour}:00.
     */
    JobBuilder monthly(int hour);

    JobRequest build();

    SubmitResult save();
}
