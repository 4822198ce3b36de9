package io.marcfilter.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent pipelines over disjoint shards of the input on a fixed pool.
 * <p>
 * Every shard gets its own pipeline, built on the worker thread from the supplied factory,
 * with its own source and sinks. Nothing is shared between shards, so no locking is needed;
 * results come back in shard order regardless of completion order.
 */
public final class ShardedRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShardedRunner.class);

    private final ExecutorService workerPool;

    public ShardedRunner(int threads) {
        AtomicInteger n = new AtomicInteger();
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "pipeline-shard-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs every shard and waits for all of them.
     *
     * @return one result per shard, in the order of {@code shards}
     * @throws RuntimeException the first shard failure in shard order, with later ones suppressed
     */
    public List<PipelineResult> run(List<? extends Callable<? extends Pipeline<?, ?>>> shards) throws InterruptedException {
        List<Callable<PipelineResult>> tasks = new ArrayList<>(shards.size());
        for (int i = 0; i < shards.size(); i++) {
            Callable<? extends Pipeline<?, ?>> factory = shards.get(i);
            int shard = i;
            tasks.add(() -> {
                try (Pipeline<?, ?> p = factory.call()) {
                    PipelineResult r = p.run();
                    log.debug("Shard {} finished: read={} matched={} errored={}", shard, r.read(), r.matched(), r.errored());
                    return r;
                }
            });
        }
        List<Future<PipelineResult>> futures = workerPool.invokeAll(tasks);
        List<PipelineResult> results = new ArrayList<>(futures.size());
        RuntimeException failure = null;
        for (Future<PipelineResult> f : futures) {
            try {
                results.add(f.get());
            } catch (ExecutionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException re
                        ? re : new IllegalStateException("Shard failed", e.getCause());
                if (failure == null) failure = cause; else failure.addSuppressed(cause);
            }
        }
        if (failure != null) throw failure;
        return results;
    }

    @Override
    public void close() {
        workerPool.shutdownNow();
    }
}
