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
package org.geolink.spatial.network;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.batch.Cancellation;
import org.geolink.spatial.geometry.BoundingBoxes;
import org.geolink.spatial.geometry.GeodesicDistance;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.Intersection;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;
import org.locationtech.jts.geom.Envelope;

/**
 * Loads the road network around a batch of points into the graph and links every point to its nearest
 * intersection.
 * <p>
 * A load has three phases. All catalog reads run first, in parallel, and are merged in input order: a connector or
 * segment read around several points is kept once, as first read. Then every unique connector is merged as an
 * {@code Intersection} and every segment with two known end connectors as a {@code ROAD_SEGMENT} relationship keyed
 * by its id. Finally each point is linked to the nearest intersection of the batch with
 * {@code NEAREST_INTERSECTION}. Every write is a merge, so loading the same batch again changes nothing.
 * <p>
 * The stored segment length is never shorter than the great-circle distance between its two intersections, which
 * keeps the straight line heuristic of A* admissible.
 */
public class RoadNetworkBuilder {

	private static final Logger LOGGER = Logger.getLogger(RoadNetworkBuilder.class.getName());

	public static final String SEGMENT_KEY = "segment_id";
	public static final String LENGTH = "length";
	public static final String REGION_ID = "region_id";

	private final FeatureSource source;
	private final GraphWriter writer;
	private final BatchExecutor executor;
	private final int limit;

	private record SubjectRead(List<Feature> segments, List<Feature> connectors) {

	}

	public RoadNetworkBuilder(FeatureSource source, GraphWriter writer, BatchExecutor executor, int limit) {
		this.source = source;
		this.writer = writer;
		this.executor = executor;
		this.limit = limit;
	}

	public NetworkLoadReport load(NetworkBatch batch) {
		return load(batch, Cancellation.create());
	}

	public NetworkLoadReport load(NetworkBatch batch, Cancellation cancellation) {
		List<SpatialSubject> located = new ArrayList<>();
		int skipped = 0;
		for (SpatialSubject subject : batch.subjects()) {
			if (subject.hasCoordinates()) {
				located.add(subject);
			} else {
				LOGGER.fine("Skipping " + subject.ref() + " without coordinates");
				skipped++;
			}
		}

		List<Optional<SubjectRead>> reads = executor.map(located, subject -> read(subject, batch),
				subject -> Optional.empty(), cancellation);
		Map<String, Feature> connectors = new LinkedHashMap<>();
		Map<String, Feature> segments = new LinkedHashMap<>();
		int failedQueries = 0;
		for (Optional<SubjectRead> read : reads) {
			if (read.isEmpty()) {
				failedQueries++;
				continue;
			}
			read.get().connectors().forEach(c -> connectors.putIfAbsent(c.getId(), c));
			for (Feature segment : read.get().segments()) {
				if (batch.keeps(segment.getString("road_class"))) {
					segments.putIfAbsent(segment.getId(), segment);
				}
			}
		}
		LOGGER.info("Read " + connectors.size() + " unique connectors and " + segments.size() + " segments around "
				+ located.size() + " points");
		if (cancellation.isCancelled()) {
			LOGGER.info("Network load cancelled before commit");
			return new NetworkLoadReport(connectors.size(), 0, 0, 0, 0, batch.subjects().size(), failedQueries, true);
		}

		Map<String, Intersection> intersections = commitIntersections(connectors, batch.regionId());
		int committed = 0;
		int dropped = 0;
		for (Feature segment : segments.values()) {
			if (commitSegment(segment, intersections)) {
				committed++;
			} else {
				dropped++;
			}
		}

		int linked = 0;
		for (SpatialSubject subject : located) {
			if (linkNearest(subject, intersections, batch.regionId())) {
				linked++;
			} else {
				skipped++;
			}
		}
		NetworkLoadReport report = new NetworkLoadReport(connectors.size(), intersections.size(), committed, dropped,
				linked, skipped, failedQueries, false);
		LOGGER.info("Road network loaded: " + report);
		return report;
	}

	private Optional<SubjectRead> read(SpatialSubject subject, NetworkBatch batch) {
		Envelope window = BoundingBoxes.radius(subject.latitude(), subject.longitude(), batch.radiusKm());
		try {
			List<Feature> segments = source.query(FeatureKind.ROAD_SEGMENT, window, limit);
			List<Feature> connectors = source.query(FeatureKind.ROAD_CONNECTOR, window, limit);
			LOGGER.fine("Found " + connectors.size() + " connectors and " + segments.size() + " segments near "
					+ subject.ref());
			return Optional.of(new SubjectRead(segments, connectors));
		} catch (RuntimeException e) {
			LOGGER.log(Level.WARNING, "Road network query failed near " + subject.ref(), e);
			return Optional.empty();
		}
	}

	private Map<String, Intersection> commitIntersections(Map<String, Feature> connectors, String regionId) {
		Map<String, Intersection> committed = new LinkedHashMap<>();
		for (Feature connector : connectors.values()) {
			Intersection intersection = Intersection.fromFeature(connector, regionId);
			try {
				writer.merge(intersection);
				committed.put(intersection.intersectionId(), intersection);
			} catch (SpatialResolutionException e) {
				LOGGER.log(Level.WARNING, "Could not store intersection " + intersection.intersectionId(), e);
			}
		}
		return committed;
	}

	/**
	 * @return false if the segment was dropped
	 */
	private boolean commitSegment(Feature segment, Map<String, Intersection> intersections) {
		List<String> connectorIds = segment.getStringList("connectors");
		if (connectorIds.size() < 2) {
			LOGGER.fine("Dropping segment " + segment.getId() + " with " + connectorIds.size() + " connectors");
			return false;
		}
		Intersection start = intersections.get(connectorIds.get(0));
		Intersection end = intersections.get(connectorIds.get(connectorIds.size() - 1));
		if (start == null || end == null) {
			LOGGER.fine("Dropping segment " + segment.getId() + " with a connector outside the loaded network");
			return false;
		}
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("name", segment.getPrimaryName());
		attributes.put("road_class", segment.getString("road_class"));
		attributes.put(LENGTH, segmentLength(segment, start, end));
		attributes.put("oneway", segment.getAttribute("oneway"));
		try {
			writer.getStore().upsertEdge(GraphRelationships.ROAD_SEGMENT.name(), start.ref(), end.ref(), attributes,
					SEGMENT_KEY, segment.getId());
			return true;
		} catch (SpatialResolutionException e) {
			LOGGER.log(Level.WARNING, "Could not store segment " + segment.getId(), e);
			return false;
		}
	}

	/**
	 * The largest of the catalog length, the great-circle length of the segment line and the great-circle distance
	 * between its end intersections, in meters.
	 */
	static double segmentLength(Feature segment, Intersection start, Intersection end) {
		Double supplied = segment.getDouble("length_m");
		double line = GeodesicDistance.lengthMeters(segment.getGeometry());
		double direct = GeodesicDistance.meters(start.latitude(), start.longitude(), end.latitude(),
				end.longitude());
		return Math.max(supplied == null ? 0.0 : supplied, Math.max(line, direct));
	}

	private boolean linkNearest(SpatialSubject subject, Map<String, Intersection> intersections, String regionId) {
		Optional<Match<Intersection>> nearest = GeometryMatcher.nearest(subject.point(), intersections.values(),
				Intersection::point, Double.POSITIVE_INFINITY);
		if (nearest.isEmpty()) {
			LOGGER.fine("No intersection to link " + subject.ref() + " to");
			return false;
		}
		try {
			writer.merge(subject);
			if (regionId != null) {
				writer.update(subject, REGION_ID, regionId);
			}
			writer.link(subject, GraphRelationships.NEAREST_INTERSECTION, nearest.get().candidate());
			return true;
		} catch (SpatialResolutionException e) {
			LOGGER.log(Level.WARNING, "Could not link " + subject.ref() + " to the road network", e);
			return false;
		}
	}
}
