package com.pulsenms.core;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

import java.util.Queue;

import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Drains a list of work items in fixed-size batches, one batch in flight at a time.
 *
 * The discovery sweep uses it to cap the number of addresses probed at once: the next
 * batch is pulled only when the previous batch's future completed. A failed batch is
 * handed to handleBatchFailure() and the sweep moves on.
 *
 * @param <T> Work item type
 * @param <R> Result type collected across batches
 */
public abstract class QueueBatchProcessor<T, R>
{
    private static final Logger logger = LoggerFactory.getLogger(QueueBatchProcessor.class);

    private final Queue<T> remainingItems;

    private final List<R> allResults;

    private final int batchSize;

    private final int totalItems;

    private int processedBatches;

    /**
     * @param items Items to process
     * @param batchSize Maximum number of items per batch (at least 1)
     */
    public QueueBatchProcessor(List<T> items, int batchSize)
    {
        this.remainingItems = new ConcurrentLinkedQueue<>(items);

        this.allResults = new ArrayList<>();

        this.batchSize = Math.max(1, batchSize);

        this.totalItems = items.size();

        logger.debug("Queue initialized: {} items, batch size: {}", totalItems, this.batchSize);
    }

    /**
     * Process the next batch from the queue recursively until the queue is empty.
     *
     * @param promise Promise completed with all accumulated results when processing finishes
     */
    public void processNext(Promise<List<R>> promise)
    {
        var currentBatch = pollBatchFromQueue();

        if (currentBatch.isEmpty())
        {
            logger.debug("All {} batches completed: {} results from {} items", processedBatches, allResults.size(), totalItems);

            promise.complete(allResults);

            return;
        }

        processedBatches++;

        var batchNumber = processedBatches;

        logger.debug("Processing batch {} ({} items, {} remaining in queue)", batchNumber, currentBatch.size(), remainingItems.size());

        processBatch(currentBatch)
            .onSuccess(batchResults ->
            {
                if (batchResults != null)
                {
                    allResults.addAll(batchResults);
                }

                processNext(promise);
            })
            .onFailure(cause ->
            {
                logger.error("Batch {} failed: {}", batchNumber, cause.getMessage());

                handleBatchFailure(currentBatch, cause);

                processNext(promise);
            });
    }

    private List<T> pollBatchFromQueue()
    {
        var batch = new ArrayList<T>();

        for (var i = 0; i < batchSize && !remainingItems.isEmpty(); i++)
        {
            var item = remainingItems.poll();

            if (item != null)
            {
                batch.add(item);
            }
        }

        return batch;
    }

    /**
     * Process a single batch of items.
     *
     * @param batch Items of this batch
     * @return Future containing the batch results
     */
    protected abstract Future<List<R>> processBatch(List<T> batch);

    /**
     * Called when processBatch() failed. Processing continues with the next batch.
     *
     * @param batch The batch that failed
     * @param cause Failure cause
     */
    protected abstract void handleBatchFailure(List<T> batch, Throwable cause);
}
