package org.smileyface.minespec.harvest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.minespec.fetch.DocumentFetcher;
import org.smileyface.minespec.fetch.FetchResult;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.ValidatedSpec;
import org.smileyface.minespec.qa.EquipmentReport;
import org.smileyface.minespec.service.SpecPipeline;
import org.smileyface.minespec.store.SpecRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Harvests one {@link WorkItem}: fetches all of its URLs, waits until every fetch has finished, then
 * extracts and scores each document and merges the results into the repository key by key.
 *
 * <p>The wait is the barrier of the item: no key is reconciled before all documents of the item are
 * in. A failure while storing one key is logged and counted, the other keys are still stored and the
 * item ends in ERROR. A stopped processor cancels its pending fetches and stores nothing.</p>
 */
public class HarvestProcessor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HarvestProcessor.class);

    private final String id;
    private final WorkItem item;
    private final DocumentFetcher fetcher;
    private final SpecPipeline pipeline;
    private final SpecRepository repository;
    private final long barrierTimeoutMs;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicInteger documentsProcessed = new AtomicInteger();
    private final AtomicInteger recordsStored = new AtomicInteger();
    private final AtomicInteger keysFailed = new AtomicInteger();
    private final List<CompletableFuture<FetchResult>> inFlight = new ArrayList<>();

    private volatile ProcessorState state = ProcessorState.NEW;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public HarvestProcessor(String id, WorkItem item, DocumentFetcher fetcher, SpecPipeline pipeline,
                            SpecRepository repository, long barrierTimeoutMs) {
        this.id = Objects.requireNonNull(id, "id");
        this.item = Objects.requireNonNull(item, "item");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.barrierTimeoutMs = Math.max(1, barrierTimeoutMs);
    }

    public String getId() {
        return id;
    }

    public WorkItem getItem() {
        return item;
    }

    /**
     * Requests the processor to stop. Pending fetches are cancelled; a processor that has not started
     * yet goes straight to STOPPED.
     */
    public void stop() {
        stopRequested.set(true);
        synchronized (inFlight) {
            for (CompletableFuture<FetchResult> f : inFlight) {
                f.cancel(true);
            }
        }
        if (state == ProcessorState.NEW) {
            transitionTo(ProcessorState.STOPPED, null);
        }
    }

    public ProcessorStatus getStatus() {
        return new ProcessorStatus(id, item.brand(), item.model(), state, item.urls().size(),
                documentsProcessed.get(), recordsStored.get(), keysFailed.get(), lastUrl, lastError,
                startedAt, finishedAt);
    }

    @Override
    public void run() {
        if (state != ProcessorState.NEW) {
            return;
        }
        transitionTo(ProcessorState.RUNNING, null);
        try {
            List<FetchResult> results = fetchAll();
            if (stopRequested.get()) {
                transitionTo(ProcessorState.STOPPED, null);
                return;
            }
            Map<String, List<ScoredCandidate>> byKey = new TreeMap<>();
            Map<String, SpecKey> keys = new TreeMap<>();
            List<RimpullCurve> curves = new ArrayList<>();
            for (FetchResult r : results) {
                Optional<RawDocument> doc = r.document();
                if (doc.isEmpty()) {
                    log.debug("Processor {} no document from {}: {} {}", id, r.getUrl(), r.getStatus(), r.getDetail());
                    continue;
                }
                lastUrl = r.getUrl();
                try {
                    SpecPipeline.DocumentResult processed = pipeline.process(doc.get(), item.brand(), item.model());
                    for (ScoredCandidate c : processed.candidates()) {
                        keys.putIfAbsent(c.key().id(), c.key());
                        byKey.computeIfAbsent(c.key().id(), k -> new ArrayList<>()).add(c);
                    }
                    curves.addAll(processed.curves());
                    documentsProcessed.incrementAndGet();
                } catch (RuntimeException e) {
                    log.warn("Processor {} could not process {}: {}", id, r.getUrl(), e.toString());
                }
            }
            if (stopRequested.get()) {
                transitionTo(ProcessorState.STOPPED, null);
                return;
            }
            store(keys, byKey, curves);
            if (keysFailed.get() > 0) {
                lastError = keysFailed.get() + " key(s) failed to store, last: " + lastError;
                transitionTo(ProcessorState.ERROR, null);
                return;
            }
            transitionTo(ProcessorState.COMPLETED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(ProcessorState.ERROR, t);
        }
    }

    private List<FetchResult> fetchAll() throws InterruptedException {
        List<CompletableFuture<FetchResult>> futures = new ArrayList<>();
        synchronized (inFlight) {
            for (String url : item.urls()) {
                if (stopRequested.get()) break;
                CompletableFuture<FetchResult> f = fetcher.fetchAsync(url);
                futures.add(f);
                inFlight.add(f);
            }
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(barrierTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Processor {} barrier timed out after {} ms for {}", id, barrierTimeoutMs, item.label());
        } catch (ExecutionException | CancellationException e) {
            log.debug("Processor {} fetches of {} ended with {}", id, item.label(), e.toString());
        }
        List<FetchResult> results = new ArrayList<>();
        for (CompletableFuture<FetchResult> f : futures) {
            if (f.isDone() && !f.isCompletedExceptionally()) {
                results.add(f.join());
            } else {
                f.cancel(true);
            }
        }
        synchronized (inFlight) {
            inFlight.clear();
        }
        return results;
    }

    private void store(Map<String, SpecKey> keys, Map<String, List<ScoredCandidate>> byKey, List<RimpullCurve> curves) {
        for (Map.Entry<String, List<ScoredCandidate>> e : byKey.entrySet()) {
            SpecKey key = keys.get(e.getKey());
            try {
                Optional<ValidatedSpec> stored = repository.mergeAndReconcile(key, e.getValue(), pipeline::derive);
                if (stored.isPresent()) recordsStored.incrementAndGet();
            } catch (RuntimeException ex) {
                keysFailed.incrementAndGet();
                lastError = ex.getMessage();
                log.error("Processor {} failed to store {}", id, key.id(), ex);
            }
        }
        if (!curves.isEmpty()) {
            try {
                repository.mergeRimpull(item.brand(), item.model(), curves, pipeline::mergeCurves);
            } catch (RuntimeException ex) {
                keysFailed.incrementAndGet();
                lastError = ex.getMessage();
                log.error("Processor {} failed to store rimpull curves of {}", id, item.label(), ex);
            }
        }
        if (!byKey.isEmpty()) {
            EquipmentReport report = pipeline.qa().checkEquipment(item.brand(), item.model(),
                    repository.getSpecs(item.brand(), item.model()));
            if (!report.warnings().isEmpty()) {
                log.warn("Processor {} {} warnings: {}", id, item.label(), report.warnings());
            }
            log.info("Processor {} {} completeness {} (missing {})", id, item.label(),
                    report.completeness(), report.missingCoreParameters());
        }
    }

    /**
     * Centralized state transition with structured logging. Ensures timestamps are set
     * and duration is included for terminal states (STOPPED/COMPLETED/ERROR).
     */
    private synchronized void transitionTo(ProcessorState newState, Throwable error) {
        ProcessorState old = this.state;
        if (old.isTerminal()) {
            return;
        }
        if (newState == ProcessorState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = ProcessorState.RUNNING;
            log.info("Processor {} ({}) state {} -> {} (urls={})", id, item.label(), old, this.state, item.urls().size());
            return;
        }

        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? durationMs(startedAt, finishedAt) : 0L;
        switch (newState) {
            case STOPPED -> log.info("Processor {} ({}) state {} -> STOPPED after {} ms", id, item.label(), old, dur);
            case COMPLETED -> log.info("Processor {} ({}) state {} -> COMPLETED after {} ms (documents={}, records={}, failedKeys={})",
                    id, item.label(), old, dur, documentsProcessed.get(), recordsStored.get(), keysFailed.get());
            case ERROR -> {
                String msg = lastError != null ? lastError : (error != null ? error.getMessage() : null);
                if (error != null) {
                    log.error("Processor {} ({}) state {} -> ERROR after {} ms (lastUrl={}, error={})", id, item.label(), old, dur, lastUrl, msg, error);
                } else {
                    log.error("Processor {} ({}) state {} -> ERROR after {} ms (lastUrl={}, error={})", id, item.label(), old, dur, lastUrl, msg);
                }
            }
            default -> {}
        }
    }

    private static long durationMs(Instant start, Instant end) {
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }
}
