package com.ordoAetheris.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

/**
 * Producer/consumer emulation on top of {@link Buffer}.
 *
 * <p>Producers: a source of work ids (think packets off a socket) pushing single items and batches.
 * Consumers: workers polling the buffer. Even-numbered workers take one item at a time with
 * {@link Buffer#pop()}, odd-numbered ones grab everything with {@link Buffer#drain()}.
 * The buffer never blocks, so an idle worker parks for a few microseconds and polls again.
 */
public class BufferDemo {

    private static final Logger logger = LoggerFactory.getLogger(BufferDemo.class);

    private static final long IDLE_PARK_NANOS = 20_000;

    private final Function<BufferDemoConfig, Buffer<Integer>> bufferFactory;

    public BufferDemo() {
        this(config -> new Buffer<>(config.pushType(), config.popType()));
    }

    public BufferDemo(Function<BufferDemoConfig, Buffer<Integer>> bufferFactory) {
        if (bufferFactory == null) throw new IllegalArgumentException("bufferFactory must not be null");
        this.bufferFactory = bufferFactory;
    }

    public static void main(String[] args) throws Exception {
        BufferDemoConfig config = BufferDemoConfig.load();
        logger.info("Starting with {}", config);

        DemoResult result = new BufferDemo().run(config);

        if (result.isComplete()) {
            logger.info("Done: {}", result);
        } else {
            logger.warn("Incomplete run: {}", result);
        }
    }

    public DemoResult run(BufferDemoConfig config) throws InterruptedException {
        Buffer<Integer> buffer = bufferFactory.apply(config);
        int total = config.totalItems();

        ExecutorService pool = Executors.newFixedThreadPool(config.producers() + config.consumers());

        AtomicInteger produced = new AtomicInteger();
        AtomicInteger consumed = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();
        BitSet seen = new BitSet(total);

        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> workers = new ArrayList<>();

        for (int c = 0; c < config.consumers(); c++) {
            final boolean drainer = (c & 1) == 1;
            workers.add(pool.submit(() -> {
                await(start);
                while (consumed.get() < total && !Thread.currentThread().isInterrupted()) {
                    List<Integer> taken = drainer ? buffer.drain() : single(buffer.pop());
                    if (taken.isEmpty()) {
                        LockSupport.parkNanos(IDLE_PARK_NANOS);
                        continue;
                    }
                    synchronized (seen) {
                        for (Integer id : taken) {
                            if (seen.get(id)) {
                                duplicates.incrementAndGet();
                                logger.error("Duplicate item {}", id);
                            }
                            seen.set(id);
                        }
                    }
                    consumed.addAndGet(taken.size());
                    microJitter();
                }
            }));
        }

        for (int p = 0; p < config.producers(); p++) {
            final int base = p * config.perProducer();
            workers.add(pool.submit(() -> {
                await(start);
                int i = 0;
                boolean batch = false;
                while (i < config.perProducer()) {
                    if (batch) {
                        int end = Math.min(i + config.batchSize(), config.perProducer());
                        List<Integer> ids = new ArrayList<>(end - i);
                        for (; i < end; i++) ids.add(base + i);
                        buffer.push(ids);
                        produced.addAndGet(ids.size());
                    } else {
                        buffer.push(base + i++);
                        produced.incrementAndGet();
                    }
                    batch = !batch;
                    microJitter();
                }
            }));
        }

        start.countDown();

        pool.shutdown();
        boolean finished = pool.awaitTermination(config.timeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            logger.warn("Workers didn't finish in {}s; calling shutdownNow()", config.timeoutSeconds());
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.SECONDS);
        }

        int failures = 0;
        for (Future<?> worker : workers) {
            if (!worker.isDone() || worker.isCancelled()) continue;
            try {
                worker.get();
            } catch (ExecutionException e) {
                failures++;
                logger.error("Worker failed", e.getCause());
            }
        }

        int distinct;
        synchronized (seen) {
            distinct = seen.cardinality();
        }
        return new DemoResult(total, produced.get(), consumed.get(), distinct, duplicates.get(),
                buffer.size(), failures, finished);
    }

    private static List<Integer> single(Optional<Integer> item) {
        return item.map(List::of).orElse(List.of());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted before start", e);
        }
    }

    private static void microJitter() {
        // 1/64 chance, up to 50µs
        if ((ThreadLocalRandom.current().nextInt() & 63) != 0) return;
        LockSupport.parkNanos(ThreadLocalRandom.current().nextInt(50_000));
    }

    /**
     * Counters collected by one {@link #run(BufferDemoConfig)}.
     */
    public static final class DemoResult {
        private final int expected;
        private final int produced;
        private final int consumed;
        private final int distinct;
        private final int duplicates;
        private final int leftover;
        private final int failures;
        private final boolean finished;

        DemoResult(int expected, int produced, int consumed, int distinct, int duplicates,
                   int leftover, int failures, boolean finished) {
            this.expected = expected;
            this.produced = produced;
            this.consumed = consumed;
            this.distinct = distinct;
            this.duplicates = duplicates;
            this.leftover = leftover;
            this.failures = failures;
            this.finished = finished;
        }

        public int expected() {
            return expected;
        }

        public int produced() {
            return produced;
        }

        public int consumed() {
            return consumed;
        }

        public int distinct() {
            return distinct;
        }

        public int duplicates() {
            return duplicates;
        }

        public int leftover() {
            return leftover;
        }

        /** Workers that ended with an exception. */
        public int failures() {
            return failures;
        }

        public boolean finished() {
            return finished;
        }

        /** Every produced id was consumed exactly once and nothing is left in the buffer. */
        public boolean isComplete() {
            return finished && produced == expected && consumed == expected
                    && distinct == expected && duplicates == 0 && leftover == 0 && failures == 0;
        }

        @Override
        public String toString() {
            return "DemoResult{expected=" + expected + ", produced=" + produced + ", consumed=" + consumed
                    + ", distinct=" + distinct + ", duplicates=" + duplicates + ", leftover=" + leftover
                    + ", failures=" + failures + ", finished=" + finished + "}";
        }
    }
}
