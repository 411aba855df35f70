package com.tablecraft.service;

import com.tablecraft.api.TransformRequest;
import com.tablecraft.engine.ValidationException;
import com.tablecraft.model.BatchItemResult;
import com.tablecraft.model.TransformationResult;
import com.tablecraft.util.ErrorCodes;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent transformation requests through the dispatcher on a fixed worker pool.
 *
 * <p>Results keep the order of the requests. One item's failure is reported at its index and
 * never prevents the other items from running. Workers run each item with the logging context
 * of the calling thread.
 */
@Component
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final TransformationDispatcher dispatcher;
    private final ExecutorService workers;
    private final int maxRows;

    public BatchRunner(
            TransformationDispatcher dispatcher,
            @Value("${tablecraft.batch.parallelism:4}") int parallelism,
            @Value("${tablecraft.max-rows:10000}") int maxRows
    ) {
        this.dispatcher = dispatcher;
        this.maxRows = maxRows;
        this.workers = Executors.newFixedThreadPool(Math.max(1, parallelism), new WorkerThreadFactory());
    }

    /**
     * Execute every request independently.
     *
     * @param requests requests to run
     * @return one entry per request, same order
     */
    public List<BatchItemResult> executeAll(List<TransformRequest> requests) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        List<Future<TransformationResult>> futures = new ArrayList<>(requests.size());
        for (TransformRequest request : requests) {
            futures.add(workers.submit(() -> executeItem(request, context)));
        }

        List<BatchItemResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(i, futures.get(i)));
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Batch completed: items={}, failed={}", results.size(), failed);
        return results;
    }

    private TransformationResult executeItem(TransformRequest request, Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            if (request != null && request.getData() != null && request.getData().size() > maxRows) {
                throw new ValidationException("data exceeds " + maxRows + " rows: " + request.getData().size());
            }
            return dispatcher.execute(request);
        } finally {
            MDC.clear();
        }
    }

    private BatchItemResult await(int index, Future<TransformationResult> future) {
        try {
            return BatchItemResult.builder()
                    .index(index)
                    .success(true)
                    .result(future.get())
                    .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String code = ErrorCodes.codeFor(cause);
            if (ErrorCodes.INTERNAL_SERVER_ERROR.equals(code)) {
                log.error("Batch item {} failed unexpectedly", index, cause);
            } else {
                log.warn("Batch item {} failed: code={}, message={}", index, code, cause.getMessage());
            }
            return failure(index, code, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failure(index, ErrorCodes.INTERNAL_SERVER_ERROR, "Batch interrupted");
        }
    }

    private static BatchItemResult failure(int index, String code, String message) {
        return BatchItemResult.builder()
                .index(index)
                .success(false)
                .errorCode(code)
                .errorMessage(message)
                .build();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "batch-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
