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
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.Location;
import org.geolink.spatial.model.Place;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Links a place to the canonical location of its address with {@code HAS_ADDRESS}.
 */
public class PlaceAddressResolver extends AbstractAddressResolver {

	public PlaceAddressResolver(FeatureSource source, GraphWriter writer, double buffer, double maxDistance,
			int limit) {
		super(source, writer, buffer, maxDistance, limit);
	}

	@Override
	public ResolverKind kind() {
		return ResolverKind.PLACE_ADDRESS;
	}

	@Override
	public boolean accepts(SpatialSubject subject) {
		return subject instanceof Place;
	}

	@Override
	public Resolution resolve(SpatialSubject subject) {
		Place place = (Place) subject;
		Optional<Match<Feature>> match = nearestAddress(place);
		if (match.isEmpty()) {
			return noAddress(place);
		}
		Location address = Location.canonical(match.get().candidate(), place.address(), null, null);
		writer.merge(address);
		writer.link(place, GraphRelationships.HAS_ADDRESS, address);
		return Resolution.linked(place.ref(), kind(), List.of(address.ref()));
	}
}
