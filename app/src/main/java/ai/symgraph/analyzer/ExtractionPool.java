package ai.symgraph.analyzer;

import ai.symgraph.util.ExecutorServiceUtil;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs extractors over a batch of files on a fixed pool of worker threads.
 *
 * <p>Every file is handled by exactly one worker. Per-file failures of any kind end up in
 * {@link BatchResult#errors()}; they never fail the batch or hide another file's result.
 *
 * <p>When the batch deadline passes, files still queued are cancelled and never start. A file whose extraction is
 * already running cannot be interrupted: it runs to completion on its worker, its result is discarded, and the thread
 * is freed only then (or when the pool is closed).
 */
public final class ExtractionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionPool.class);

    static final String TIMED_OUT = "extraction timed out";

    private final ExtractorRegistry registry;
    private final ExecutorService executor;
    private final int workers;
    private final int progressInterval;
    private final Optional<Duration> batchTimeout;

    public ExtractionPool(ExtractorRegistry registry) {
        this(registry, registry.settings().effectiveWorkers());
    }

    public ExtractionPool(ExtractorRegistry registry, int workers) {
        this.registry = registry;
        this.workers = workers;
        this.progressInterval = registry.settings().progressInterval();
        this.batchTimeout = registry.settings().timeout();
        this.executor = ExecutorServiceUtil.newFixedThreadExecutor(workers, "symgraph-extract-");
    }

    /** Worker count suited to a batch of {@code fileCount} files. */
    public static int optimalWorkerCount(int fileCount) {
        int cpus = Runtime.getRuntime().availableProcessors();
        if (fileCount < 10) {
            return Math.min(2, cpus);
        }
        if (fileCount < 50) {
            return Math.max(1, cpus / 2);
        }
        return Math.min(cpus, ExtractionSettings.MAX_DEFAULT_WORKERS);
    }

    public int workers() {
        return workers;
    }

    public BatchResult process(List<SourceFile> files) {
        var parsedFiles = new ConcurrentLinkedQueue<ParsedFile>();
        var errors = new ConcurrentLinkedQueue<DetailedParseError>();
        var completed = new AtomicInteger();
        var jobs = new ArrayList<Job>(files.size());
        long start = System.nanoTime();

        for (var file : files) {
            var extractor = registry.forLanguage(file.language());
            if (extractor.isEmpty()) {
                log.debug("No extractor for {} ({})", file.path(), file.language());
                errors.add(DetailedParseError.mapping(file.path(), "unsupported language: " + file.language().tag()));
                continue;
            }

            var claimed = new AtomicBoolean();
            var work = CompletableFuture.supplyAsync(() -> extractor.get().extract(file), executor);
            var future = work.whenComplete((result, ex) -> {
                        if (!claimed.compareAndSet(false, true)) {
                            // the batch deadline already reported this file
                            if (result != null && result.file() != null) result.file().releaseTree();
                            return;
                        }
                        if (ex == null) {
                            collect(result, parsedFiles, errors);
                        } else {
                            errors.add(failure(file, ex));
                        }
                        logProgress(completed.incrementAndGet(), files.size());
                    })
                    .exceptionally(ex -> null); // logged and recorded above, don't re-throw
            jobs.add(new Job(file, claimed, work, future));
        }

        awaitAll(jobs, errors);

        if (!errors.isEmpty()) {
            log.warn(
                    "Extraction summary: {} files, {} parsed, {} errors in {} ms",
                    files.size(),
                    parsedFiles.size(),
                    errors.size(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        } else {
            log.info(
                    "Extraction summary: {} files parsed in {} ms",
                    parsedFiles.size(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
        return new BatchResult(new ArrayList<>(parsedFiles), new ArrayList<>(errors));
    }

    private void awaitAll(List<Job> jobs, ConcurrentLinkedQueue<DetailedParseError> errors) {
        var all = CompletableFuture.allOf(jobs.stream().map(Job::future).toArray(CompletableFuture[]::new));
        if (batchTimeout.isEmpty()) {
            all.join();
            return;
        }
        var deadline = batchTimeout.get();
        try {
            all.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Batch deadline of {} exceeded; abandoning unfinished files", deadline);
            abandonUnfinished(jobs, errors, TIMED_OUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for extraction; abandoning unfinished files");
            abandonUnfinished(jobs, errors, "extraction interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch future failed despite per-file handling", e.getCause());
        }
    }

    private static void abandonUnfinished(
            List<Job> jobs, ConcurrentLinkedQueue<DetailedParseError> errors, String message) {
        for (var job : jobs) {
            if (job.claimed().compareAndSet(false, true)) {
                job.work().cancel(true);
                errors.add(DetailedParseError.mapping(job.file().path(), message));
            }
        }
    }

    private static void collect(
            ExtractionResult result,
            ConcurrentLinkedQueue<ParsedFile> parsedFiles,
            ConcurrentLinkedQueue<DetailedParseError> errors) {
        var file = result.file();
        if (file != null) {
            parsedFiles.add(file);
        }
        var error = result.error();
        if (error != null) {
            errors.add(error);
        }
    }

    private static DetailedParseError failure(SourceFile file, Throwable ex) {
        Throwable cause = (ex instanceof CompletionException ce && ce.getCause() != null) ? ce.getCause() : ex;
        if (cause instanceof UncheckedIOException uioe) {
            var ioe = uioe.getCause();
            log.warn("IO error extracting {}: {}", file.path(), ioe != null ? ioe.getMessage() : uioe.getMessage());
        } else if (cause instanceof RuntimeException re) {
            log.error("Runtime error extracting {}: {}", file.path(), re.getMessage(), re);
        } else {
            log.warn("Error extracting {}: {}", file.path(), cause.getMessage(), cause);
        }
        return DetailedParseError.mapping(file.path(), "extraction failed: " + cause);
    }

    private void logProgress(int done, int total) {
        if (progressInterval > 0 && (done % progressInterval == 0 || done == total)) {
            log.info("Extracted {}/{} files", done, total);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * {@code claimed} is set by whichever reports the file first: its completion or the batch deadline. {@code work} is
     * the extraction itself, {@code future} the reporting stage chained on it.
     */
    private record Job(
            SourceFile file, AtomicBoolean claimed, CompletableFuture<ExtractionResult> work, CompletableFuture<?> future) {}
}
