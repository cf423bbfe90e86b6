package io.backbork;

import io.backbork.core.AccountOperation;
import io.backbork.core.AccountResult;

/**
 * Performs the actual backup or restore of a single account.
 *
 * <p>Called once per account per job and never retried by the processor. The call may block for
 * minutes or hours. Implementations may consult {@code cancellation} to skip optional work, but an
 * operation that has started must run to completion so no half-written artifact is left behind.
 */
public interface ExecutionEngine {

    /**
     * @return the account outcome; a thrown exception is recorded as a failed account
     */
    AccountResult runAccountOperation(AccountOperation operation, CancellationToken cancellation);
}
