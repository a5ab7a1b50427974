package com.e2eq.conformance.repair;

import com.e2eq.conformance.core.ConformanceEngine;
import com.e2eq.conformance.core.DocumentContext;
import com.e2eq.conformance.core.ViolationReport;
import com.e2eq.conformance.exceptions.DocumentParseException;
import com.e2eq.conformance.exceptions.RepairAbortedException;
import com.e2eq.conformance.exceptions.RepairCancelledException;
import com.e2eq.conformance.exceptions.TransducerException;
import com.e2eq.conformance.spi.CandidateDocument;
import com.e2eq.conformance.spi.DocumentDecoder;
import com.e2eq.conformance.spi.PromptPayload;
import com.e2eq.conformance.spi.TextTransducer;
import io.quarkus.logging.Log;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded validate / regenerate loop.
 * <pre>
 * VALIDATING --no violations--------------------------&gt; CONFORMANT
 * VALIDATING --violations, attempt == ceiling----------&gt; EXHAUSTED_BUDGET
 * VALIDATING --violations, attempts left---------------&gt; AWAITING_REGENERATION
 * AWAITING_REGENERATION --new document, attempt + 1----&gt; VALIDATING
 * AWAITING_REGENERATION --transducer/decoder failure---&gt; EXHAUSTED_BUDGET (raised)
 * </pre>
 * The orchestrator holds no per-session state; concurrent sessions share only the read-only
 * engine configuration.
 */
public class RepairOrchestrator implements AutoCloseable {

    private final ConformanceEngine engine;
    private final TextTransducer transducer;
    private final DocumentDecoder decoder;
    private final RepairSettings settings;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public RepairOrchestrator(ConformanceEngine engine, TextTransducer transducer, DocumentDecoder decoder,
                              RepairSettings settings) {
        this(engine, transducer, decoder, settings, Executors.newCachedThreadPool(new TransducerThreadFactory()), true);
    }

    public RepairOrchestrator(ConformanceEngine engine, TextTransducer transducer, DocumentDecoder decoder,
                              RepairSettings settings, ExecutorService executor) {
        this(engine, transducer, decoder, settings, executor, false);
    }

    private RepairOrchestrator(ConformanceEngine engine, TextTransducer transducer, DocumentDecoder decoder,
                               RepairSettings settings, ExecutorService executor, boolean ownsExecutor) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.transducer = Objects.requireNonNull(transducer, "transducer");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.settings = settings != null ? settings : RepairSettings.defaults();
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    public RepairOutcome repair(DocumentContext context, CandidateDocument initial) {
        return repair(context, initial, CancellationToken.none());
    }

    /**
     * Runs one repair session.
     *
     * @throws RepairAbortedException when the transducer or decoder fails; the attached outcome
     *                                is in {@link RepairState#EXHAUSTED_BUDGET}
     * @throws RepairCancelledException when the token is cancelled before a validation pass
     */
    public RepairOutcome repair(DocumentContext context, CandidateDocument initial, CancellationToken token) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(initial, "initial");
        CancellationToken cancel = token != null ? token : CancellationToken.none();

        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        RepairSession session = new RepairSession(sessionId, settings.maxAttempts());
        CandidateDocument current = initial;
        Log.infof("[%s] Repair session started, ceiling=%d", sessionId, settings.maxAttempts());

        while (true) {
            int attempt = session.attemptIndex();
            if (cancel.isCancelled()) {
                Log.infof("[%s] Cancelled before attempt %d", sessionId, attempt);
                throw new RepairCancelledException(attempt, session.attempts());
            }

            ViolationReport report = engine.validate(context.withDocument(current.text()), current.graph());
            Log.infof("[%s] Attempt %d/%d: %s", sessionId, attempt, settings.maxAttempts(),
                    report.isValid() ? "VALID" : report.size() + " violation(s)");

            if (report.isValid()) {
                session.record(new ConformanceAttempt(attempt, current, report, true, null));
                session.transition(RepairState.CONFORMANT);
                Log.infof("[%s] Conformant after %d attempt(s)", sessionId, attempt);
                return session.outcome(current, List.of(), null);
            }

            if (session.isLastAttempt()) {
                session.record(new ConformanceAttempt(attempt, current, report, true, null));
                session.transition(RepairState.EXHAUSTED_BUDGET);
                Log.infof("[%s] Attempt budget exhausted with %d unresolved violation(s)", sessionId, report.size());
                return session.outcome(current, report.getViolations(), null);
            }

            session.transition(RepairState.AWAITING_REGENERATION);
            CandidateDocument next;
            try {
                next = regenerate(context, current, report, attempt);
            } catch (TransducerException | DocumentParseException e) {
                Log.warnf(e, "[%s] Regeneration failed at attempt %d", sessionId, attempt);
                String failure = e.getMessage();
                session.record(new ConformanceAttempt(attempt, current, report, true, Optional.ofNullable(failure)));
                session.transition(RepairState.EXHAUSTED_BUDGET);
                RepairOutcome outcome = session.outcome(current, report.getViolations(), failure);
                throw new RepairAbortedException(attempt, report, outcome, e);
            }

            session.record(new ConformanceAttempt(attempt, current, report, false, null));
            session.nextAttempt();
            session.transition(RepairState.VALIDATING);
            current = next;
        }
    }

    private CandidateDocument regenerate(DocumentContext context, CandidateDocument current, ViolationReport report,
                                         int attempt) {
        PromptPayload payload = PromptPayload.regeneration(context.requestText(), current.text(),
                report.renderFeedback(), attempt);
        String raw = invokeWithTimeout(payload);
        if (raw == null || raw.isBlank()) {
            throw new TransducerException("Transducer returned no output");
        }
        return decoder.decode(raw);
    }

    private String invokeWithTimeout(PromptPayload payload) {
        Future<String> future = executor.submit(() -> transducer.transduce(payload));
        try {
            return future.get(settings.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw TransducerException.timedOut("Transducer did not answer within " + settings.attemptTimeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransducerException) {
                throw (TransducerException) cause;
            }
            throw new TransducerException("Transducer failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransducerException("Interrupted while waiting for the transducer", e);
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static final class TransducerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "conformance-transducer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
