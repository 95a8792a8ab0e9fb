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

import java.util.List;
import java.util.Optional;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.geometry.BoundingBoxes;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.RoadSegment;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Links a point to the nearest road segment in the search radius with {@code LOCATED_ON}. Segments are lines, so
 * there is no containment step and no distance bound.
 */
public class StreetResolver implements PointResolver {

	private final FeatureSource source;
	private final GraphWriter writer;
	private final double radiusKm;
	private final int limit;

	public StreetResolver(FeatureSource source, GraphWriter writer, double radiusKm, int limit) {
		this.source = source;
		this.writer = writer;
		this.radiusKm = radiusKm;
		this.limit = limit;
	}

	@Override
	public ResolverKind kind() {
		return ResolverKind.STREET;
	}

	@Override
	public boolean accepts(SpatialSubject subject) {
		return true;
	}

	@Override
	public Resolution resolve(SpatialSubject subject) {
		List<Feature> segments = source.query(FeatureKind.ROAD_SEGMENT,
				BoundingBoxes.radius(subject.latitude(), subject.longitude(), radiusKm), limit);
		Optional<Match<Feature>> nearest = GeometryMatcher.nearest(subject.point(), segments,
				Double.POSITIVE_INFINITY);
		if (nearest.isEmpty()) {
			return Resolution.noCandidate(subject.ref(), kind(), "No road segment within " + radiusKm + " km");
		}
		RoadSegment segment = RoadSegment.fromFeature(nearest.get().candidate(), subject.point());
		writer.merge(segment);
		writer.link(subject, GraphRelationships.LOCATED_ON, segment);
		return Resolution.linked(subject.ref(), kind(), List.of(segment.ref()));
	}
}
