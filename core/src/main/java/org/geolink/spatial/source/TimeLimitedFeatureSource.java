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
package org.geolink.spatial.source;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.ProviderUnavailableException;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.locationtech.jts.geom.Envelope;

/**
 * Bounds every query of a delegate catalog by a timeout. A query that times out, is interrupted or fails with an
 * unexpected exception is reported as {@link ProviderUnavailableException}; schema violations raised by the
 * delegate pass through unchanged.
 */
public class TimeLimitedFeatureSource implements FeatureSource, AutoCloseable {

	private static final Logger LOGGER = Logger.getLogger(TimeLimitedFeatureSource.class.getName());

	private final FeatureSource delegate;
	private final long timeoutMs;
	private final ExecutorService executor;

	public TimeLimitedFeatureSource(FeatureSource delegate, long timeoutMs) {
		this.delegate = delegate;
		this.timeoutMs = timeoutMs;
		AtomicInteger threads = new AtomicInteger();
		this.executor = Executors.newCachedThreadPool(runnable -> {
			Thread thread = new Thread(runnable, "geolink-source-" + threads.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
	}

	public FeatureSource getDelegate() {
		return delegate;
	}

	@Override
	public List<Feature> query(FeatureKind kind, Envelope bbox, int limit) {
		Future<List<Feature>> future = executor.submit(() -> delegate.query(kind, bbox, limit));
		try {
			return future.get(timeoutMs, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			LOGGER.warning("Feature query for " + kind + " in " + bbox + " timed out after " + timeoutMs + "ms");
			throw new ProviderUnavailableException("Feature query for " + kind + " timed out after " + timeoutMs
					+ "ms", e);
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new ProviderUnavailableException("Interrupted while querying " + kind, e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof SpatialResolutionException resolution) {
				throw resolution;
			}
			throw new ProviderUnavailableException("Feature query for " + kind + " failed: " + cause.getMessage(),
					cause);
		}
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}
}
