package com.docloom.source;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docloom.model.Document;
import com.docloom.model.SourceType;

/**
 * Routes source descriptors to their loaders and concatenates the results in input order.
 * Malformed descriptors and failing sources are reported per source instead of aborting the batch.
 */
public class MultiSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(MultiSourceLoader.class);

    private final Map<SourceType, SourceLoader> loaders;
    private final int concurrency;

    public MultiSourceLoader(Map<SourceType, SourceLoader> loaders, int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.loaders = loaders.isEmpty() ? new EnumMap<>(SourceType.class) : new EnumMap<>(loaders);
        this.concurrency = concurrency;
    }

    public LoadResult load(LoadRequest request) {
        List<Slot> slots = new ArrayList<>();
        for (String raw : request.sources()) {
            slots.add(plan(raw));
        }

        long pending = slots.stream().filter(slot -> slot.descriptor != null).count();
        if (pending == 0) {
            return collect(slots, request, null);
        }

        ExecutorService executor = Executors.newFixedThreadPool((int) Math.min(concurrency, pending), new LoaderThreadFactory());
        try {
            for (Slot slot : slots) {
                if (slot.descriptor != null) {
                    SourceDescriptor descriptor = slot.descriptor;
                    SourceLoader loader = slot.loader;
                    Instant since = request.sinceFor(descriptor);
                    slot.future = executor.submit(() -> loadOne(loader, descriptor, since));
                }
            }
            return collect(slots, request, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private Slot plan(String raw) {
        SourceDescriptor descriptor;
        try {
            descriptor = SourceDescriptor.parse(raw);
        } catch (InvalidSourceException e) {
            log.warn("Skipping source '{}': {}", raw, e.getMessage());
            return Slot.skipped(raw, e.getMessage());
        }
        SourceLoader loader = loaders.get(descriptor.type());
        if (loader == null) {
            String reason = "no loader registered for source type '" + descriptor.type().prefix() + "'";
            log.warn("Skipping source '{}': {}", raw, reason);
            return Slot.skipped(raw, reason);
        }
        return new Slot(raw, descriptor, loader, null);
    }

    private List<Document> loadOne(SourceLoader loader, SourceDescriptor descriptor, Instant since) throws SourceLoadException {
        long start = System.nanoTime();
        log.info("Loading source={} since={}", descriptor, since);
        List<Document> documents = loader.load(descriptor, since);
        log.info("Loaded source={} documents={} elapsedMs={}",
                descriptor, documents.size(), (System.nanoTime() - start) / 1_000_000);
        return documents;
    }

    private LoadResult collect(List<Slot> slots, LoadRequest request, ExecutorService executor) {
        long deadline = System.nanoTime() + request.deadline().toNanos();
        List<Document> documents = new ArrayList<>();
        List<SourceOutcome> outcomes = new ArrayList<>();
        boolean interrupted = false;

        for (Slot slot : slots) {
            if (slot.future == null) {
                outcomes.add(SourceOutcome.skipped(slot.raw, slot.skipReason));
                continue;
            }
            if (interrupted) {
                slot.future.cancel(true);
                outcomes.add(SourceOutcome.timedOut(slot.raw, "load interrupted"));
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                List<Document> loaded = slot.future.get(remaining, TimeUnit.NANOSECONDS);
                documents.addAll(loaded);
                outcomes.add(SourceOutcome.loaded(slot.raw, loaded.size()));
            } catch (TimeoutException e) {
                slot.future.cancel(true);
                String detail = "deadline of " + request.deadline().toMillis() + " ms exceeded";
                log.error("Abandoning source={}: {}", slot.raw, detail);
                outcomes.add(SourceOutcome.timedOut(slot.raw, detail));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                slot.future.cancel(true);
                outcomes.add(SourceOutcome.timedOut(slot.raw, "load interrupted"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof UpstreamDataException) {
                    log.error("Aborting load: upstream data anomaly in source={}", slot.raw, cause);
                    if (executor != null) {
                        executor.shutdownNow();
                    }
                    throw (UpstreamDataException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                log.error("Source failed source={}", slot.raw, cause);
                outcomes.add(SourceOutcome.failed(slot.raw, describe(cause)));
            }
        }

        LoadReport report = new LoadReport(outcomes);
        log.info("Load finished sources={} loaded={} skipped={} failed={} timedOut={} documents={}",
                outcomes.size(),
                report.count(SourceOutcome.Status.LOADED),
                report.count(SourceOutcome.Status.SKIPPED),
                report.count(SourceOutcome.Status.FAILED),
                report.count(SourceOutcome.Status.TIMED_OUT),
                documents.size());
        return new LoadResult(documents, report);
    }

    private static String describe(Throwable failure) {
        StringBuilder detail = new StringBuilder(String.valueOf(failure.getMessage()));
        Throwable cause = failure.getCause();
        if (cause != null && cause != failure) {
            detail.append(" (caused by ").append(cause.getClass().getSimpleName());
            if (cause.getMessage() != null) {
                detail.append(": ").append(cause.getMessage());
            }
            detail.append(')');
        }
        return detail.toString();
    }

    private static final class Slot {
        private final String raw;
        private final SourceDescriptor descriptor;
        private final SourceLoader loader;
        private final String skipReason;
        private Future<List<Document>> future;

        private Slot(String raw, SourceDescriptor descriptor, SourceLoader loader, String skipReason) {
            this.raw = raw;
            this.descriptor = descriptor;
            this.loader = loader;
            this.skipReason = skipReason;
        }

        private static Slot skipped(String raw, String reason) {
            return new Slot(raw, null, null, reason);
        }
    }

    private static final class LoaderThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "source-loader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
