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
package org.geolink.spatial.link;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.batch.Cancellation;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Runs the requested resolutions for a batch of subjects.
 * <p>
 * Subjects are resolved in parallel. Within a subject the subject node is merged first, then every requested
 * resolution runs in {@link ResolverKind} order, each on its own: a failure in one is recorded as its
 * {@link Resolution} and the next one still runs. Cancelling the batch stops resolutions that have not started.
 */
public class SpatialLinker {

	private static final Logger LOGGER = Logger.getLogger(SpatialLinker.class.getName());

	private final ResolverRegistry registry;
	private final GraphWriter writer;
	private final BatchExecutor executor;

	public SpatialLinker(ResolverRegistry registry, GraphWriter writer, BatchExecutor executor) {
		this.registry = registry;
		this.writer = writer;
		this.executor = executor;
	}

	public List<Resolution> link(List<? extends SpatialSubject> subjects, Set<ResolverKind> kinds) {
		return link(subjects, kinds, Cancellation.create());
	}

	/**
	 * @return one resolution per subject and requested kind, grouped by subject in input order
	 * @throws ConfigurationException if a requested kind has no registered resolver
	 */
	public List<Resolution> link(List<? extends SpatialSubject> subjects, Set<ResolverKind> kinds,
			Cancellation cancellation) {
		List<PointResolver> resolvers = new ArrayList<>();
		for (ResolverKind kind : kinds.isEmpty() ? EnumSet.noneOf(ResolverKind.class) : EnumSet.copyOf(kinds)) {
			resolvers.add(registry.get(kind));
		}
		List<SpatialSubject> items = new ArrayList<>(subjects);
		List<List<Resolution>> perSubject = executor.map(items,
				subject -> resolveAll(subject, resolvers, cancellation),
				subject -> cancelledAll(subject, resolvers),
				cancellation);
		List<Resolution> results = new ArrayList<>();
		perSubject.forEach(results::addAll);
		long linked = results.stream().filter(Resolution::isLinked).count();
		long failed = results.stream().filter(r -> r.outcome() == ResolutionOutcome.FAILED).count();
		LOGGER.info("Linked " + subjects.size() + " subjects: " + linked + " links, " + failed + " failures out of "
				+ results.size() + " resolutions");
		return results;
	}

	private List<Resolution> resolveAll(SpatialSubject subject, List<PointResolver> resolvers,
			Cancellation cancellation) {
		List<Resolution> results = new ArrayList<>();
		NodeRef ref = subject.ref();
		if (subject.hasCoordinates()) {
			try {
				writer.merge(subject);
			} catch (RuntimeException e) {
				LOGGER.log(Level.WARNING, "Could not store " + ref, e);
				resolvers.forEach(resolver -> results.add(Resolution.failed(ref, resolver.kind(), e)));
				return results;
			}
		}
		for (PointResolver resolver : resolvers) {
			results.add(resolveOne(subject, resolver, cancellation));
		}
		return results;
	}

	private Resolution resolveOne(SpatialSubject subject, PointResolver resolver, Cancellation cancellation) {
		NodeRef ref = subject.ref();
		if (cancellation.isCancelled()) {
			return Resolution.cancelled(ref, resolver.kind());
		}
		if (!resolver.accepts(subject)) {
			return Resolution.notApplicable(ref, resolver.kind());
		}
		if (!subject.hasCoordinates()) {
			LOGGER.fine("Skipping " + resolver.kind() + " for " + ref + " without coordinates");
			return Resolution.missingCoordinates(ref, resolver.kind());
		}
		try {
			Resolution resolution = resolver.resolve(subject);
			if (resolution.outcome() == ResolutionOutcome.NO_CANDIDATE) {
				LOGGER.fine(resolver.kind() + " for " + ref + ": " + resolution.message());
			}
			return resolution;
		} catch (RuntimeException e) {
			LOGGER.log(Level.WARNING, resolver.kind() + " failed for " + ref, e);
			return Resolution.failed(ref, resolver.kind(), e);
		}
	}

	private static List<Resolution> cancelledAll(SpatialSubject subject, List<PointResolver> resolvers) {
		return resolvers.stream().map(resolver -> Resolution.cancelled(subject.ref(), resolver.kind())).toList();
	}
}
