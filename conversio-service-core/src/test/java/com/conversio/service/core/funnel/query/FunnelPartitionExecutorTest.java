package com.conversio.service.core.funnel.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.conversio.service.core.config.FunnelProperties;
import com.conversio.service.core.funnel.sequence.ActorPartition;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FunnelPartitionExecutorTest {

    private FunnelPartitionExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new FunnelPartitionExecutor(new FunnelProperties());
        executor.init(3, 2);
    }

    @AfterEach
    void tearDown() {
        executor.stop();
    }

    @Test
    void returnsResultsInPartitionOrder() {
        List<ActorPartition> partitions = partitions(7);

        List<String> results = executor.processAll(partitions, ActorPartition::actorId);

        assertThat(results).containsExactly("a0", "a1", "a2", "a3", "a4", "a5", "a6");
    }

    @Test
    void propagatesPartitionFailures() {
        assertThatThrownBy(() -> executor.processAll(partitions(4), partition -> {
                    if (partition.actorId().equals("a3")) {
                        throw new IllegalStateException("boom");
                    }
                    return partition.actorId();
                }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void interruptionCancelsTheQuery() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                executor.processAll(partitions(2), partition -> {
                    started.countDown();
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return partition.actorId();
                });
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();
        caller.join(5_000);

        assertThat(failure.get()).isInstanceOf(FunnelQueryCancelledException.class);
    }

    private static List<ActorPartition> partitions(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new ActorPartition("a" + i, null, List.of()))
                .toList();
    }
}
