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
import org.geolink.spatial.geometry.BoundingBoxes;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Matches a point to the address feature strictly closer than the match distance.
 */
public abstract class AbstractAddressResolver implements PointResolver {

	protected final FeatureSource source;
	protected final GraphWriter writer;
	private final double buffer;
	private final double maxDistance;
	private final int limit;

	protected AbstractAddressResolver(FeatureSource source, GraphWriter writer, double buffer, double maxDistance,
			int limit) {
		this.source = source;
		this.writer = writer;
		this.buffer = buffer;
		this.maxDistance = maxDistance;
		this.limit = limit;
	}

	protected Optional<Match<Feature>> nearestAddress(SpatialSubject subject) {
		List<Feature> addresses = source.query(FeatureKind.ADDRESS,
				BoundingBoxes.around(subject.latitude(), subject.longitude(), buffer), limit);
		return GeometryMatcher.nearest(subject.point(), addresses, maxDistance);
	}

	protected Resolution noAddress(SpatialSubject subject) {
		return Resolution.noCandidate(subject.ref(), kind(), "No address within " + maxDistance + " degrees");
	}
}
