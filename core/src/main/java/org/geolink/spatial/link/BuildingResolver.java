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
import java.util.logging.Logger;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.geometry.BoundingBoxes;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.Building;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Links a point to the building whose footprint contains it, or failing that to the nearest building within the
 * fallback distance, with {@code LOCATED_IN}.
 */
public class BuildingResolver implements PointResolver {

	private static final Logger LOGGER = Logger.getLogger(BuildingResolver.class.getName());

	private final FeatureSource source;
	private final GraphWriter writer;
	private final double buffer;
	private final double maxDistance;
	private final int limit;

	public BuildingResolver(FeatureSource source, GraphWriter writer, double buffer, double maxDistance, int limit) {
		this.source = source;
		this.writer = writer;
		this.buffer = buffer;
		this.maxDistance = maxDistance;
		this.limit = limit;
	}

	@Override
	public ResolverKind kind() {
		return ResolverKind.BUILDING;
	}

	@Override
	public boolean accepts(SpatialSubject subject) {
		return true;
	}

	@Override
	public Resolution resolve(SpatialSubject subject) {
		List<Feature> buildings = source.query(FeatureKind.BUILDING,
				BoundingBoxes.around(subject.latitude(), subject.longitude(), buffer), limit);
		Optional<Match<Feature>> match = GeometryMatcher.containingOrNearest(subject.point(), buildings, maxDistance);
		if (match.isEmpty()) {
			return Resolution.noCandidate(subject.ref(), kind(),
					"No building within " + maxDistance + " degrees among " + buildings.size() + " candidates");
		}
		Building building = Building.fromFeature(match.get().candidate());
		LOGGER.fine("Building " + building.gersId() + " at distance " + match.get().distance() + " for "
				+ subject.ref());
		writer.merge(building);
		writer.link(subject, GraphRelationships.LOCATED_IN, building);
		return Resolution.linked(subject.ref(), kind(), List.of(building.ref()));
	}
}
