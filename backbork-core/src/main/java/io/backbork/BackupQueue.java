package io.backbork;

import io.backbork.core.AccountSelection;
import io.backbork.core.CancelResult;
import io.backbork.core.Job;
import io.backbork.core.JobRequest;
import io.backbork.core.KillResult;
import io.backbork.core.QueueSnapshot;
import io.backbork.core.QueueStats;
import io.backbork.core.Schedule;
import io.backbork.core.ScheduleUpdate;
import io.backbork.core.SubmitResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Request-side API of the backup queue.
 *
 * <p>Jobs and schedules are created here; the {@code QueueProcessor} executes them on its next pass.
 *
 * <pre>{@code
 * queue.backup(AccountSelection.explicit("alice"), "offsite")
 *      .owner("root")
 *      .daily(2)
 *      .retention(7)
 *      .save();
 *
 * queue.backup(AccountSelection.allAccessible(), "local").owner("reseller1").save();
 * }</pre>
 */
public interface BackupQueue {

    JobBuilder backup(AccountSelection accounts, String destinationId);

    /**
     * Restore {@code account} from the artifact {@code backupFile} stored on the destination.
     */
    JobBuilder restore(String account, String destinationId, String backupFile);

    /**
     * Persist a job or schedule.
     *
     * @throws io.backbork.core.InvalidDestinationException if the destination is unknown, or disabled for a schedule
     */
    SubmitResult submit(JobRequest request);

    Schedule updateSchedule(String scheduleId, ScheduleUpdate update);

    /**
     * Delete a schedule. Artifacts it produced are kept.
     */
    void removeSchedule(String scheduleId);

    /**
     * Delete a job that has not started yet.
     */
    void removeQueued(String jobId);

    /**
     * Cancel a job: queued jobs are removed, processing jobs stop after their current account.
     *
     * @throws io.backbork.core.AlreadyTerminalException if the job has already finished
     * @throws io.backbork.core.NotFoundException        if no job has this id
     */
    CancelResult cancel(String jobId, String requestedBy);

    Optional<Job> findJob(String jobId);

    Optional<Schedule> findSchedule(String scheduleId);

    QueueSnapshot snapshot();

    List<Job> completed();

    QueueStats stats();

    int clearCompleted();

    int clearFailed();

    /**
     * Re-queue every failed job as a new job.
     */
    int retryFailed();

    /**
     * Delete finished job records older than {@code olderThan}.
     */
    int cleanupCompletedJobs(Duration olderThan);

    /**
     * Drop the whole queue and ask every running job to stop.
     */
    KillResult killAll();

    /**
     * True while a valid processing lock is held.
     */
    boolean isProcessing();
}
