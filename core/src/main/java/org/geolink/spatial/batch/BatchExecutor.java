/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [http://neo4j.com]
 *
 * This file is part of Neo4j Spatial.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package org.geolink.spatial.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Logger;
import org.geolink.spatial.api.ProviderUnavailableException;
import org.geolink.spatial.api.SpatialResolutionException;

/**
 * Runs the items of a batch in parallel on a fixed pool, returning their results in input order.
 */
public class BatchExecutor implements AutoCloseable {

	private static final Logger LOGGER = Logger.getLogger(BatchExecutor.class.getName());

	private final ExecutorService executor;

	public BatchExecutor(int parallelism) {
		AtomicInteger threads = new AtomicInteger();
		this.executor = Executors.newFixedThreadPool(parallelism, runnable -> {
			Thread thread = new Thread(runnable, "geolink-batch-" + threads.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Applies work to every item. An item whose turn comes after the batch was cancelled is not run, and
	 * {@code whenCancelled} supplies its result instead.
	 *
	 * @throws SpatialResolutionException if an item fails with an exception the work did not handle
	 */
	public <T, R> List<R> map(List<T> items, Function<T, R> work, Function<T, R> whenCancelled,
			Cancellation cancellation) {
		List<Future<R>> futures = new ArrayList<>(items.size());
		for (T item : items) {
			futures.add(executor.submit(() -> cancellation.isCancelled() ? whenCancelled.apply(item) : work.apply(item)));
		}
		List<R> results = new ArrayList<>(items.size());
		for (Future<R> future : futures) {
			try {
				results.add(future.get());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				cancellation.cancel();
				futures.forEach(f -> f.cancel(true));
				throw new ProviderUnavailableException("Interrupted while waiting for batch results", e);
			} catch (ExecutionException e) {
				if (e.getCause() instanceof SpatialResolutionException resolution) {
					throw resolution;
				}
				throw new SpatialResolutionException("Batch item failed: " + e.getCause(), e.getCause());
			}
		}
		return results;
	}

	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
				LOGGER.warning("Batch workers did not stop within 10 seconds, interrupting them");
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
