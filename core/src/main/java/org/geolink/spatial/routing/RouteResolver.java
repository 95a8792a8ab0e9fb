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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.api.UnlinkedEndpointException;
import org.geolink.spatial.api.graph.GraphNode;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.api.routing.PathAlgorithm;
import org.geolink.spatial.api.routing.RouteResult;
import org.geolink.spatial.model.Intersection;

/**
 * Routes between two stored points over the road network. Each point enters the network at the intersection its
 * {@code NEAREST_INTERSECTION} relationship points to; the path between those intersections is then searched with
 * the requested algorithm. Queries only read, so any number may run at once.
 */
public class RouteResolver {

	private static final Logger LOGGER = Logger.getLogger(RouteResolver.class.getName());

	private final GraphStore store;
	private final Map<PathAlgorithm, ShortestPathStrategy> strategies = new EnumMap<>(PathAlgorithm.class);

	public RouteResolver(GraphStore store) {
		this(store, List.of(new DijkstraStrategy(), new AStarStrategy()));
	}

	public RouteResolver(GraphStore store, List<ShortestPathStrategy> strategies) {
		this.store = store;
		for (ShortestPathStrategy strategy : strategies) {
			this.strategies.put(strategy.algorithm(), strategy);
		}
	}

	/**
	 * @throws UnlinkedEndpointException if either point does not exist or is not linked to the road network
	 */
	public RouteResult resolve(NodeRef origin, NodeRef destination, PathAlgorithm algorithm) {
		ShortestPathStrategy strategy = strategies.get(algorithm);
		if (strategy == null) {
			throw new ConfigurationException("No path strategy for " + algorithm);
		}
		String source = entryIntersection(origin, "Origin");
		String target = entryIntersection(destination, "Destination");
		LOGGER.fine("Routing " + origin + " -> " + destination + " from intersection " + source + " to " + target
				+ " with " + algorithm);
		return strategy.findPath(new GraphStoreRoutingGraph(store), source, target);
	}

	private String entryIntersection(NodeRef endpoint, String role) {
		if (store.findNode(endpoint).isEmpty()) {
			throw new UnlinkedEndpointException(endpoint, role + " " + endpoint + " does not exist");
		}
		GraphNode intersection = store.findRelated(endpoint, GraphRelationships.NEAREST_INTERSECTION.name())
				.orElseThrow(() -> new UnlinkedEndpointException(endpoint, role + " " + endpoint
						+ " is not linked to the road network. Load the road network around it first."));
		Object id = intersection.getProperty(Intersection.KEY);
		return id != null ? id.toString() : intersection.ref().keyValue();
	}
}
