package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.ImageEditException;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import com.ttennebkram.imageeditor.model.RasterSnapshot;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs mutating session operations on a background thread, one at a time.
 *
 * The processing flag is claimed with a compare-and-set before anything is submitted, so two
 * callers racing on the same tick cannot both get in. A request that finds the flag set is
 * rejected with {@link SessionBusyException}; nothing is queued behind a running filter.
 */
public class SessionWorker implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SessionWorker.class.getName());

    private final EditSession session;
    private final ExecutorService executor;
    private final AtomicBoolean processing = new AtomicBoolean(false);

    public SessionWorker(EditSession session) {
        this.session = session;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ImageEditor-Worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * True while an accepted operation has not finished yet.
     */
    public boolean isProcessing() {
        return processing.get();
    }

    public CompletableFuture<RasterSnapshot> submitLoad(RasterBuffer buffer) {
        return submit("load", () -> session.load(buffer));
    }

    public CompletableFuture<RasterSnapshot> submitApply(FilterType type, FilterParameters params) {
        return submit("apply " + (type != null ? type.getDisplayName() : FilterType.NONE.getDisplayName()),
                () -> session.apply(type, params));
    }

    public CompletableFuture<RasterSnapshot> submitUndo() {
        return submit("undo", session::undo);
    }

    public CompletableFuture<RasterSnapshot> submitRedo() {
        return submit("redo", session::redo);
    }

    public CompletableFuture<RasterSnapshot> submitReset() {
        return submit("reset", session::reset);
    }

    /**
     * Re-run the last adjustable filter with new parameters (live preview).
     * Fails with IllegalStateException if the last edit was not an adjustable filter.
     */
    public CompletableFuture<RasterSnapshot> submitPreview(FilterParameters params) {
        return submit("preview", () -> session.reapplyLast(params));
    }

    private CompletableFuture<RasterSnapshot> submit(String operation, Supplier<RasterSnapshot> task) {
        if (!processing.compareAndSet(false, true)) {
            logger.warning("Rejected " + operation + ": another operation is in progress");
            return CompletableFuture.failedFuture(new SessionBusyException(operation));
        }

        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return task.get();
                } finally {
                    processing.set(false);
                }
            }, executor).whenComplete((result, error) -> {
                if (error != null) {
                    logFailure(operation, error);
                }
            });
        } catch (RejectedExecutionException e) {
            processing.set(false);
            logger.warning("Rejected " + operation + ": worker has been shut down");
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void logFailure(String operation, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ImageEditException || cause instanceof IllegalStateException) {
            logger.warning(operation + " failed: " + cause.getMessage());
        } else {
            logger.log(Level.SEVERE, operation + " failed", cause);
        }
    }

    /**
     * Stop accepting work and wait briefly for the running operation to finish.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
