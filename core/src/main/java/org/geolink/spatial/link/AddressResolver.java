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
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.division.DivisionHierarchyResolver;
import org.geolink.spatial.division.DivisionResolution;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.Division;
import org.geolink.spatial.model.Location;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Canonicalizes a location against the address catalog. The matched address becomes a canonical location keyed by
 * its GERS id, linked from the input with {@code SAME_AS}, and the canonical location is then placed in its
 * division hierarchy. A failure while resolving the divisions does not undo the address link.
 */
public class AddressResolver extends AbstractAddressResolver {

	private static final Logger LOGGER = Logger.getLogger(AddressResolver.class.getName());

	private final DivisionHierarchyResolver divisions;

	public AddressResolver(FeatureSource source, GraphWriter writer, DivisionHierarchyResolver divisions,
			double buffer, double maxDistance, int limit) {
		super(source, writer, buffer, maxDistance, limit);
		this.divisions = divisions;
	}

	@Override
	public ResolverKind kind() {
		return ResolverKind.ADDRESS;
	}

	@Override
	public boolean accepts(SpatialSubject subject) {
		return subject instanceof Location;
	}

	@Override
	public Resolution resolve(SpatialSubject subject) {
		Location location = (Location) subject;
		Optional<Match<Feature>> match = nearestAddress(location);
		if (match.isEmpty()) {
			return noAddress(location);
		}
		Location canonical = Location.canonical(match.get().candidate(), location.address(), location.city(),
				location.country());
		LOGGER.info("Matched " + location.ref() + " to address " + canonical.gersId() + " at distance "
				+ match.get().distance());
		writer.merge(canonical);
		if (!canonical.ref().equals(location.ref())) {
			writer.link(location, GraphRelationships.SAME_AS, canonical);
		}
		List<NodeRef> linked = new ArrayList<>();
		linked.add(canonical.ref());
		try {
			DivisionResolution resolution = divisions.resolve(canonical);
			resolution.divisions().stream().map(Division::ref).forEach(linked::add);
		} catch (SpatialResolutionException e) {
			LOGGER.log(Level.WARNING, "Could not resolve divisions of " + canonical.ref(), e);
		}
		return Resolution.linked(location.ref(), kind(), linked);
	}
}
