package org.smileyface.minespec.harvest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.minespec.config.HarvestProperties;
import org.smileyface.minespec.fetch.DocumentFetcher;
import org.smileyface.minespec.service.SpecPipeline;
import org.smileyface.minespec.store.SpecRepository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link HarvestProcessor}s for submitted work items on a fixed pool of worker threads.
 * Provides APIs to submit, cancel per brand, and query statuses of processors.
 */
public class HarvestManager {

    private static final Logger log = LogManager.getLogger();

    /** Finished processors kept for status queries; older ones are dropped first. */
    static final int MAX_RETAINED = 1000;

    private final DocumentFetcher fetcher;
    private final SpecPipeline pipeline;
    private final SpecRepository repository;
    private final long barrierTimeoutMs;
    private final ExecutorService executor;

    private final Map<String, Tracked> processors = new LinkedHashMap<>();

    private record Tracked(HarvestProcessor processor, Future<?> future) {
    }

    public HarvestManager(HarvestProperties properties, DocumentFetcher fetcher, SpecPipeline pipeline,
                          SpecRepository repository) {
        Objects.requireNonNull(properties, "properties");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.barrierTimeoutMs = properties.getFetchDeadlineMs() + 5_000L;
        int workers = Math.max(1, properties.getWorkerCount());
        this.executor = Executors.newFixedThreadPool(workers, namedThreads("harvest-"));
        log.info("HarvestManager created with {} workers", workers);
    }

    /**
     * Queues a work item.
     *
     * @return the id of the processor handling it
     */
    public synchronized String submit(WorkItem item) {
        Objects.requireNonNull(item, "item");
        if (executor.isShutdown()) {
            throw new IllegalStateException("HarvestManager is shut down");
        }
        prune();
        String id = "harvest-" + UUID.randomUUID();
        HarvestProcessor p = new HarvestProcessor(id, item, fetcher, pipeline, repository, barrierTimeoutMs);
        Future<?> f = executor.submit(p);
        processors.put(id, new Tracked(p, f));
        log.info("Submitted {} for {} ({} urls)", id, item.label(), item.urls().size());
        return id;
    }

    /**
     * Cancels every queued or running item of a brand (case-insensitive). Items that already
     * finished are not touched.
     *
     * @return the number of items cancelled
     */
    public synchronized int cancelBrand(String brand) {
        if (brand == null || brand.isBlank()) return 0;
        int cancelled = 0;
        for (Tracked t : processors.values()) {
            HarvestProcessor p = t.processor();
            if (!p.getItem().brand().equalsIgnoreCase(brand.trim())) continue;
            if (p.getStatus().getState().isTerminal()) continue;
            p.stop();
            t.future().cancel(false);
            cancelled++;
        }
        log.info("Cancelled {} item(s) of brand {}", cancelled, brand);
        return cancelled;
    }

    public synchronized List<ProcessorStatus> getStatuses() {
        List<ProcessorStatus> list = new ArrayList<>(processors.size());
        for (Tracked t : processors.values()) {
            list.add(t.processor().getStatus());
        }
        return list;
    }

    public synchronized Optional<ProcessorStatus> getStatus(String id) {
        Tracked t = processors.get(id);
        return t == null ? Optional.empty() : Optional.of(t.processor().getStatus());
    }

    public synchronized boolean isRunning() {
        for (Tracked t : processors.values()) {
            if (!t.future().isDone()) return true;
        }
        return false;
    }

    /**
     * Wait until all submitted processors exit or the timeout elapses.
     * @return true if all processors finished before timeout, false otherwise.
     */
    public boolean awaitAll(Duration timeout) {
        List<Future<?>> futures;
        synchronized (this) {
            futures = new ArrayList<>();
            for (Tracked t : processors.values()) futures.add(t.future());
        }
        long remainingMs = timeout == null ? Long.MAX_VALUE : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            if (f.isCancelled()) continue;
            long nanosLeft = deadline - System.nanoTime();
            if (nanosLeft <= 0) return false;
            try {
                f.get(nanosLeft, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logAggregate("AWAIT INTERRUPTED");
                return false;
            } catch (Exception e) {
                log.debug("Processor ended abnormally: {}", e.toString());
            }
        }
        logAggregate("ALL COMPLETED");
        return true;
    }

    /**
     * Stops all processors and the worker pool.
     */
    public void shutdown() {
        synchronized (this) {
            for (Tracked t : processors.values()) {
                t.processor().stop();
                t.future().cancel(false);
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logAggregate("STOPPED");
    }

    private void prune() {
        Iterator<Map.Entry<String, Tracked>> it = processors.entrySet().iterator();
        while (processors.size() >= MAX_RETAINED && it.hasNext()) {
            Tracked t = it.next().getValue();
            if (t.future().isDone()) it.remove();
        }
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long records = 0L;
        List<ProcessorStatus> statuses = getStatuses();
        for (ProcessorStatus s : statuses) {
            records += s.getRecordsStored();
            ProcessorState st = s.getState();
            if (st == ProcessorState.COMPLETED) completed++;
            else if (st == ProcessorState.STOPPED) stopped++;
            else if (st == ProcessorState.ERROR) error++;
        }
        log.info("HarvestManager {}: items -> completed={}, stopped={}, error={}, recordsStored={} (items={})",
                event, completed, stopped, error, records, statuses.size());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
