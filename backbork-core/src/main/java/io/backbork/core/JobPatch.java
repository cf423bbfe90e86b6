package io.backbork.core;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a {@link Job}. Unset fields keep their current value.
 */
public final class JobPatch {

    private JobStatus status;
    private AccountSelection accounts;
    private Progress progress;
    private List<AccountResult> accountResults;
    private Instant startedAt;
    private Instant finishedAt;
    private String message;
    private String error;

    public static JobPatch of() {
        return new JobPatch();
    }

    public JobPatch status(JobStatus status) {
        this.status = status;
        return this;
    }

    public JobPatch accounts(AccountSelection accounts) {
        this.accounts = accounts;
        return this;
    }

    public JobPatch progress(Progress progress) {
        this.progress = progress;
        return this;
    }

    public JobPatch accountResults(List<AccountResult> accountResults) {
        this.accountResults = accountResults == null ? null : List.copyOf(accountResults);
        return this;
    }

    public JobPatch startedAt(Instant startedAt) {
        this.startedAt = startedAt;
        return this;
    }

    public JobPatch finishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
        return this;
    }

    public JobPatch message(String message) {
        this.message = message;
        return this;
    }

    public JobPatch error(String error) {
        this.error = error;
        return this;
    }

    public JobStatus status() {
        return status;
    }

    public AccountSelection accounts() {
        return accounts;
    }

    public Progress progress() {
        return progress;
    }

    public List<AccountResult> accountResults() {
        return accountResults;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String message() {
        return message;
    }

    public String error() {
        return error;
    }

    public boolean isEmpty() {
        return status == null && accounts == null && progress == null && accountResults == null
                && startedAt == null && finishedAt == null && message == null && error == null;
    }

    /**
     * Returns a copy of {@code job} with every set field replaced.
     *
     * @throws IllegalArgumentException if the patch would move completed progress backwards
     */
    public Job applyTo(Job job) {
        Progress nextProgress = job.progress();
        if (progress != null) {
            if (progress.accountsTotal() == job.progress().accountsTotal()
                    && progress.accountsCompleted() < job.progress().accountsCompleted()) {
                throw new IllegalArgumentException("progress must not decrease for job " + job.id());
            }
            nextProgress = progress;
        }
        return new Job(
                job.id(),
                job.type(),
                job.owner(),
                job.createdAt(),
                accounts != null ? accounts : job.accounts(),
                job.destinationId(),
                job.destinationName(),
                job.options(),
                job.scheduleId(),
                job.retention(),
                job.retryOf(),
                status != null ? status : job.status(),
                nextProgress,
                accountResults != null ? accountResults : job.accountResults(),
                startedAt != null ? startedAt : job.startedAt(),
                finishedAt != null ? finishedAt : job.finishedAt(),
                message != null ? message : job.message(),
                error != null ? error : job.error()
        );
    }

    @Override
    public String toString() {
        return "JobPatch{status=" + status + ", progress=" + progress + ", finishedAt=" + finishedAt + "}";
    }
}
