package com.conversio.service.core.funnel.query;

import com.conversio.service.core.config.FunnelProperties;
import com.conversio.service.core.funnel.sequence.ActorPartition;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Evaluates partitions in batches on a bounded pool. Results come back in partition order and only once every
 * batch finished; on interruption all outstanding batches are cancelled.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FunnelPartitionExecutor {

    private final FunnelProperties properties;

    private ExecutorService executor;
    private int batchSize;

    @PostConstruct
    void start() {
        FunnelProperties.Engine engine = properties.getEngine();
        init(engine.getWorkers(), engine.getBatchSize());
    }

    void init(int workers, int batchSize) {
        this.batchSize = Math.max(1, batchSize);
        executor = Executors.newFixedThreadPool(Math.max(1, workers));
        log.info("Funnel partition executor started workers={}, batchSize={}", workers, this.batchSize);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public <T> List<T> processAll(List<ActorPartition> partitions, Function<ActorPartition, T> work) {
        List<Future<List<T>>> futures = new ArrayList<>();
        for (int start = 0; start < partitions.size(); start += batchSize) {
            List<ActorPartition> batch = partitions.subList(start, Math.min(partitions.size(), start + batchSize));
            int batchStart = start;
            futures.add(executor.submit(() -> {
                log.debug("Evaluating partitions [{}, {})", batchStart, batchStart + batch.size());
                return batch.stream().map(work).toList();
            }));
        }
        List<T> results = new ArrayList<>(partitions.size());
        try {
            for (Future<List<T>> future : futures) {
                results.addAll(future.get());
            }
        } catch (InterruptedException ie) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new FunnelQueryCancelledException("Interrupted while evaluating funnel partitions", ie);
        } catch (CancellationException ce) {
            cancelAll(futures);
            throw new FunnelQueryCancelledException("Funnel partition evaluation was cancelled", ce);
        } catch (ExecutionException ee) {
            cancelAll(futures);
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Funnel partition evaluation failed", cause);
        }
        return results;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
