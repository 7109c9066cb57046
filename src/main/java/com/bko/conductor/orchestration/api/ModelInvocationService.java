package com.bko.conductor.orchestration.api;

import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.InvocationResult;
import com.bko.conductor.orchestration.service.CancellationSignal;

import java.util.concurrent.CompletableFuture;

/**
 * Runs one model invocation to completion or timeout.
 */
public interface ModelInvocationService {

    /**
     * Starts an invocation and streams accumulated text through {@link InvocationRequest#onStreamingText()}.
     * Expected failures (timeouts, provider errors, rate limits) complete the future with an
     * {@code ERROR} or {@code PARTIAL} result rather than exceptionally. The invocation id is tracked on
     * the signal while it is in flight.
     *
     * @param request The invocation parameters.
     * @param signal The run's cancellation signal.
     * @return A future completing with the result, or with {@code null} when the signal was aborted
     *         before or during the invocation.
     */
    CompletableFuture<InvocationResult> invoke(InvocationRequest request, CancellationSignal signal);

    /**
     * Terminates an in-flight invocation by id. Unknown or finished ids are ignored.
     *
     * @param invocationId The id tracked on the run's signal.
     * @return {@code true} if an in-flight invocation was terminated.
     */
    boolean terminate(String invocationId);
}
