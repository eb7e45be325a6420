package io.catalogsync.orchestration;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Bounded fan-out/fan-in over a batch of items.
 * <p>
 * Each call runs the worker once per item on a pool of at most
 * {@code parallelism} threads, flattens the results and tears the pool down.
 * A failing item is logged and skipped; it never stops the others.
 * Result order is unspecified.
 */
public class ConcurrentExecutor {

    private static final Logger LOG = Logger.getLogger(ConcurrentExecutor.class);

    /**
     * Work applied to a single item. A null or empty result contributes nothing.
     */
    @FunctionalInterface
    public interface Worker<A, R> {
        Collection<? extends R> process(A item) throws Exception;
    }

    private final String stageName;
    private final int parallelism;

    public ConcurrentExecutor(String stageName, int parallelism) {
        if (stageName == null || stageName.isBlank()) {
            throw new IllegalArgumentException("stageName cannot be blank");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.stageName = stageName;
        this.parallelism = parallelism;
    }

    public String stageName() {
        return stageName;
    }

    public int parallelism() {
        return parallelism;
    }

    public <A, R> List<R> execute(Worker<? super A, ? extends R> worker, Collection<? extends A> items) {
        return execute(worker, items, (item, error) -> { });
    }

    /**
     * Run {@code worker} for every item and collect the successful results.
     *
     * @param onFailure called with the item and the cause of every failed invocation
     */
    public <A, R> List<R> execute(Worker<? super A, ? extends R> worker,
                                  Collection<? extends A> items,
                                  BiConsumer<? super A, ? super Throwable> onFailure) {
        List<R> results = new ArrayList<>();
        if (items.isEmpty()) {
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(parallelism, items.size()), threadFactory());
        CompletionService<Collection<? extends R>> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Collection<? extends R>>, A> pending = new HashMap<>();

        try {
            for (A item : items) {
                pending.put(completion.submit(() -> worker.process(item)), item);
            }

            for (int done = 0; done < items.size(); done++) {
                Future<Collection<? extends R>> future = completion.take();
                A item = pending.remove(future);
                try {
                    Collection<? extends R> result = future.get();
                    if (result != null) {
                        results.addAll(result);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    LOG.errorf(cause, "%s: failed processing %s: %s", stageName, item, cause.getMessage());
                    onFailure.accept(item, cause);
                }
            }
        } catch (InterruptedException e) {
            LOG.warnf("%s: interrupted with %d item(s) outstanding", stageName, pending.size());
            pending.keySet().forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdownNow();
        }

        LOG.debugf("%s: %d item(s) produced %d result(s)", stageName, items.size(), results.size());
        return results;
    }

    private ThreadFactory threadFactory() {
        AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            Thread thread = new Thread(r, stageName + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
