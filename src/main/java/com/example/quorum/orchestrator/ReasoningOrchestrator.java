package com.example.quorum.orchestrator;

import com.example.quorum.config.QuorumProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one reasoning process per request and streams its stdout to the
 * caller as it arrives.
 * <p>
 * Every run ends in exactly one call to the request's {@link TranscriptSink}
 * with non-empty text: the fragments emitted so far, or a synthesized
 * fragment when the process produced nothing (not installed, nonzero exit,
 * timeout, empty answer). Runs share no lock; each holds two threads of the
 * orchestrator executor (stdout and stderr) for its lifetime and one timeout
 * task on the orchestrator scheduler.
 */
@Slf4j
@Service
public class ReasoningOrchestrator {

    private static final int READ_BUFFER_CHARS = 1024;

    private final ReasoningProcessLauncher launcher;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final QuorumProperties properties;
    private final MeterRegistry meterRegistry;

    public ReasoningOrchestrator(ReasoningProcessLauncher launcher,
                                 @Qualifier("orchestratorExecutor") Executor executor,
                                 @Qualifier("orchestratorScheduler") TaskScheduler scheduler,
                                 QuorumProperties properties,
                                 MeterRegistry meterRegistry) {
        this.launcher = launcher;
        this.executor = executor;
        this.scheduler = scheduler;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Start the run on subscription. The returned Flux is single-use: a second
     * subscriber receives an {@link IllegalStateException}.
     */
    public Flux<String> run(OrchestrationRequest request) {
        AtomicBoolean subscribed = new AtomicBoolean(false);
        return Flux.create(sink -> {
            if (!subscribed.compareAndSet(false, true)) {
                sink.error(new IllegalStateException(
                        "Reasoning run for session " + request.sessionId() + " was already started"));
                return;
            }
            new Run(request, sink).start();
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private final class Run {

        private final OrchestrationRequest request;
        private final FluxSink<String> sink;
        private final Object lock = new Object();
        private final StringBuilder transcript = new StringBuilder();
        private final Timer.Sample sample;

        /** guarded by lock */
        private boolean finished;
        private volatile boolean timedOut;
        private volatile ReasoningProcess process;
        private volatile ScheduledFuture<?> timeoutTask;

        Run(OrchestrationRequest request, FluxSink<String> sink) {
            this.request = request;
            this.sink = sink;
            this.sample = Timer.start(meterRegistry);
        }

        void start() {
            sink.onCancel(this::onCancel);
            log.info("Reasoning run starting for session {} on behalf of {} (timeout {}s)",
                    request.sessionId(), request.context().actor(), request.timeout().toSeconds());
            try {
                process = launcher.launch(request.payload(), request.sessionId(), request.timeout());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to spawn reasoning process for session {}: {}", request.sessionId(), e.getMessage());
                complete(OrchestrationOutcome.SPAWN_FAILED, FallbackMessages.notAvailable(request.fallbackLabel()));
                return;
            }

            timeoutTask = scheduler.schedule(this::onTimeout, Instant.now().plus(request.timeout()));
            try {
                executor.execute(this::drainDiagnostics);
                executor.execute(this::pumpOutput);
            } catch (TaskRejectedException e) {
                log.error("No orchestrator thread available for session {}: {}", request.sessionId(), e.getMessage());
                process.terminate();
                complete(OrchestrationOutcome.FAILED, FallbackMessages.streamFailed(request.fallbackLabel()));
            }
        }

        private void pumpOutput() {
            IOException streamError = null;
            try (Reader reader = new InputStreamReader(process.output(), StandardCharsets.UTF_8)) {
                char[] buffer = new char[READ_BUFFER_CHARS];
                int n;
                while ((n = reader.read(buffer)) != -1) {
                    if (n > 0 && !emit(new String(buffer, 0, n))) break;
                }
            } catch (IOException e) {
                streamError = e;
            }

            if (isFinished()) return;

            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.terminate();
                complete(OrchestrationOutcome.FAILED, FallbackMessages.streamFailed(request.fallbackLabel()));
                return;
            }

            if (timedOut) {
                complete(OrchestrationOutcome.TIMED_OUT,
                        FallbackMessages.timedOut(request.fallbackLabel(), request.timeout().toSeconds()));
            } else if (exitCode != 0) {
                log.warn("Reasoning process for session {} exited with code {}", request.sessionId(), exitCode);
                complete(OrchestrationOutcome.FAILED, FallbackMessages.exited(request.fallbackLabel(), exitCode));
            } else if (streamError != null) {
                log.warn("Reasoning output stream for session {} failed: {}", request.sessionId(),
                        streamError.getMessage());
                complete(OrchestrationOutcome.FAILED, FallbackMessages.streamFailed(request.fallbackLabel()));
            } else {
                complete(OrchestrationOutcome.COMPLETED, FallbackMessages.emptyResult(request.fallbackLabel()));
            }
        }

        private void drainDiagnostics() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.diagnostics(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!line.isBlank()) {
                        log.warn("[{}] reasoning stderr: {}", request.sessionId(), line);
                    }
                }
            } catch (IOException e) {
                log.debug("Reasoning stderr for session {} closed: {}", request.sessionId(), e.getMessage());
            }
        }

        /**
         * Append and forward one fragment.
         *
         * @return false once the run is finished and output must be dropped
         */
        private boolean emit(String fragment) {
            synchronized (lock) {
                if (finished) return false;
                transcript.append(fragment);
                sink.next(fragment);
                return true;
            }
        }

        private boolean isFinished() {
            synchronized (lock) {
                return finished;
            }
        }

        private void onTimeout() {
            if (isFinished()) return;
            timedOut = true;
            log.warn("Reasoning run for session {} timed out after {}s, terminating",
                    request.sessionId(), request.timeout().toSeconds());
            process.terminate();
            complete(OrchestrationOutcome.TIMED_OUT,
                    FallbackMessages.timedOut(request.fallbackLabel(), request.timeout().toSeconds()));
        }

        private void onCancel() {
            if (isFinished()) return;
            log.info("Caller disconnected from session {}", request.sessionId());
            if (process != null && properties.getReasoning().isTerminateOnDisconnect()) {
                process.terminate();
            }
            complete(OrchestrationOutcome.CANCELLED, null);
        }

        /**
         * Finish the run once: synthesize a fragment if nothing was emitted,
         * persist the transcript and complete the stream.
         */
        private void complete(OrchestrationOutcome outcome, String fallbackIfEmpty) {
            String text;
            synchronized (lock) {
                if (finished) return;
                finished = true;
                if (transcript.length() == 0) {
                    if (outcome == OrchestrationOutcome.CANCELLED) {
                        // nobody is listening; keep the stored record non-empty
                        transcript.append(FallbackMessages.cancelled(request.fallbackLabel()));
                    } else {
                        transcript.append(fallbackIfEmpty);
                        sink.next(fallbackIfEmpty);
                    }
                }
                text = transcript.toString();
            }

            ScheduledFuture<?> task = timeoutTask;
            if (task != null) task.cancel(false);

            String outcomeTag = outcome.value();
            meterRegistry.counter("quorum.orchestrator.runs", "outcome", outcomeTag).increment();
            sample.stop(meterRegistry.timer("quorum.orchestrator.duration", "outcome", outcomeTag));

            try {
                request.sink().persist(text, outcome);
            } catch (RuntimeException e) {
                log.error("Failed to persist transcript for session {}: {}", request.sessionId(), e.getMessage(), e);
            }
            log.info("Reasoning run for session {} finished: {} ({} chars)", request.sessionId(), outcome,
                    text.length());

            if (outcome != OrchestrationOutcome.CANCELLED) {
                sink.complete();
            }
        }
    }
}
