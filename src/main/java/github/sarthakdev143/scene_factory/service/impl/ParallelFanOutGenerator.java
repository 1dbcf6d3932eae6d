package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import github.sarthakdev143.scene_factory.model.FanOutOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs independent generation tasks with a per-call cap on tasks in flight.
 * <p>
 * No thread waits for a free slot: the first {@code min(limit, n)} tasks are launched up front and
 * every finished task launches the next queued one. Outcomes are aligned by index with the input
 * list, and one task failing never affects its siblings.
 */
@Component
public class ParallelFanOutGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ParallelFanOutGenerator.class);

    private final TaskExecutor taskExecutor;
    private final int concurrencyLimit;

    @Autowired
    public ParallelFanOutGenerator(
            @Qualifier("generationTaskExecutor") TaskExecutor taskExecutor,
            SceneFactoryProperties properties) {
        this(taskExecutor, properties.generation().fanOutConcurrency());
    }

    ParallelFanOutGenerator(TaskExecutor taskExecutor, int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1.");
        }
        this.taskExecutor = taskExecutor;
        this.concurrencyLimit = concurrencyLimit;
    }

    @FunctionalInterface
    public interface GenerationTask<T> {
        T call() throws Exception;
    }

    /**
     * Turns a successful result into a reusable reference handle.
     */
    @FunctionalInterface
    public interface ReferenceRegistrar<T> {
        String register(T result) throws Exception;
    }

    public <T> CompletableFuture<List<FanOutOutcome<T>>> submitAll(List<GenerationTask<T>> tasks) {
        return submitAll(tasks, null);
    }

    /**
     * Starts every task and returns a future that completes once all of them have an outcome. The
     * future never completes exceptionally.
     *
     * @param registrar runs after each successful task when not null; a failing registration keeps the
     *                  result but leaves the outcome without a reusable handle
     */
    public <T> CompletableFuture<List<FanOutOutcome<T>>> submitAll(
            List<GenerationTask<T>> tasks,
            ReferenceRegistrar<T> registrar) {
        if (tasks.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        FanOutRun<T> run = new FanOutRun<>(List.copyOf(tasks), registrar);
        int initial = Math.min(concurrencyLimit, tasks.size());
        for (int slot = 0; slot < initial; slot++) {
            run.launchNext();
        }
        return run.completion;
    }

    public <T> List<FanOutOutcome<T>> generateAll(List<GenerationTask<T>> tasks) throws InterruptedException {
        return generateAll(tasks, null);
    }

    public <T> List<FanOutOutcome<T>> generateAll(
            List<GenerationTask<T>> tasks,
            ReferenceRegistrar<T> registrar) throws InterruptedException {
        return awaitOutcomes(submitAll(tasks, registrar));
    }

    public static <T> List<FanOutOutcome<T>> awaitOutcomes(CompletableFuture<List<FanOutOutcome<T>>> future)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Fan-out completion failed unexpectedly.", e.getCause());
        }
    }

    private final class FanOutRun<T> {

        private final List<GenerationTask<T>> tasks;
        private final ReferenceRegistrar<T> registrar;
        private final AtomicReferenceArray<FanOutOutcome<T>> outcomes;
        private final AtomicInteger nextIndex = new AtomicInteger();
        private final AtomicInteger remaining;
        private final CompletableFuture<List<FanOutOutcome<T>>> completion = new CompletableFuture<>();

        private FanOutRun(List<GenerationTask<T>> tasks, ReferenceRegistrar<T> registrar) {
            this.tasks = tasks;
            this.registrar = registrar;
            this.outcomes = new AtomicReferenceArray<>(tasks.size());
            this.remaining = new AtomicInteger(tasks.size());
        }

        private void launchNext() {
            while (true) {
                int index = nextIndex.getAndIncrement();
                if (index >= tasks.size()) {
                    return;
                }
                try {
                    taskExecutor.execute(() -> runTask(index));
                    return;
                } catch (RuntimeException rejected) {
                    logger.error("Fan-out task {} could not be scheduled", index, rejected);
                    finish(index, FanOutOutcome.failure(index, "Task could not be scheduled: " + rejected.getMessage()));
                }
            }
        }

        private void runTask(int index) {
            FanOutOutcome<T> outcome = null;
            try {
                T result = tasks.get(index).call();
                outcome = FanOutOutcome.success(index, result, register(index, result));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = FanOutOutcome.failure(index, "Task was interrupted.");
            } catch (Exception e) {
                logger.warn("Fan-out task {} failed: {}", index, e.getMessage());
                outcome = FanOutOutcome.failure(index, describe(e));
            } catch (Error e) {
                logger.error("Fan-out task {} failed with an error", index, e);
                outcome = FanOutOutcome.failure(index, describe(e));
                throw e;
            } finally {
                launchNext();
                finish(index, outcome);
            }
        }

        private String register(int index, T result) throws InterruptedException {
            if (registrar == null) {
                return null;
            }
            try {
                return registrar.register(result);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                logger.warn("Reference registration for fan-out task {} failed: {}", index, e.getMessage());
                return null;
            }
        }

        private void finish(int index, FanOutOutcome<T> outcome) {
            outcomes.set(index, outcome);
            if (remaining.decrementAndGet() == 0) {
                List<FanOutOutcome<T>> ordered = new ArrayList<>(tasks.size());
                for (int position = 0; position < tasks.size(); position++) {
                    ordered.add(outcomes.get(position));
                }
                completion.complete(List.copyOf(ordered));
            }
        }

        private String describe(Throwable e) {
            String message = e.getMessage();
            return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
        }
    }
}
