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
package org.geolink.spatial.routing;

import java.util.logging.Logger;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.api.routing.RouteResult;
import org.geolink.spatial.model.Intersection;
import org.geolink.spatial.network.RoadNetworkBuilder;

/**
 * Route and network status queries over the stored road network.
 */
public class RoutingService {

	private static final Logger LOGGER = Logger.getLogger(RoutingService.class.getName());

	private final GraphStore store;
	private final RouteResolver resolver;

	public RoutingService(GraphStore store, RouteResolver resolver) {
		this.store = store;
		this.resolver = resolver;
	}

	/**
	 * @throws org.geolink.spatial.api.UnlinkedEndpointException if an endpoint is missing or not linked to the
	 *                                                           network
	 */
	public RouteResponse route(RouteQuery query) {
		RouteResult result = resolver.resolve(query.origin(), query.destination(), query.algorithm());
		RouteResponse response = RouteResponse.from(result);
		LOGGER.info(query.algorithm() + " route " + query.origin() + " -> " + query.destination() + ": "
				+ response.message());
		return response;
	}

	/**
	 * Counts the intersections, segments and linked points tagged with the region. A null region counts the whole
	 * network.
	 */
	public NetworkStatus networkStatus(String regionId) {
		String property = regionId == null ? null : RoadNetworkBuilder.REGION_ID;
		long intersections = store.countNodes(Intersection.LABEL, property, regionId);
		long segments = store.countRelationships(GraphRelationships.ROAD_SEGMENT.name(), property, regionId);
		long linked = store.countNodesWithRelationship(GraphRelationships.NEAREST_INTERSECTION.name(), property,
				regionId);
		return new NetworkStatus(regionId, intersections, segments, linked);
	}
}
