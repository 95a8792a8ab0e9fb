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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.api.graph.GraphEdge;
import org.geolink.spatial.api.graph.GraphNode;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.api.routing.Waypoint;
import org.geolink.spatial.model.Intersection;
import org.geolink.spatial.network.RoadNetworkBuilder;

/**
 * The road network stored in a {@link GraphStore}: intersections joined by {@code ROAD_SEGMENT} relationships,
 * traversed in both directions and weighted by their {@code length}. Segments with a missing, negative or
 * non-finite length are left out. Intersections are cached for the life of the view, so one view serves one query.
 */
public class GraphStoreRoutingGraph implements RoutingGraph {

	private static final Logger LOGGER = Logger.getLogger(GraphStoreRoutingGraph.class.getName());

	private final GraphStore store;
	private final Map<String, Waypoint> waypoints = new ConcurrentHashMap<>();

	public GraphStoreRoutingGraph(GraphStore store) {
		this.store = store;
	}

	public static NodeRef intersection(String id) {
		return new NodeRef(Intersection.LABEL, Intersection.KEY, id);
	}

	@Override
	public Optional<Waypoint> node(String id) {
		Waypoint cached = waypoints.get(id);
		if (cached != null) {
			return Optional.of(cached);
		}
		return store.findNode(intersection(id)).map(node -> remember(id, node));
	}

	@Override
	public List<Arc> arcs(String id) {
		List<Arc> arcs = new ArrayList<>();
		for (GraphEdge edge : store.expand(intersection(id), GraphRelationships.ROAD_SEGMENT.name())) {
			Object neighbourId = edge.neighbour().getProperty(Intersection.KEY);
			String target = neighbourId != null ? neighbourId.toString() : edge.neighbour().ref().keyValue();
			Double weight = edge.getDouble(RoadNetworkBuilder.LENGTH);
			if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0) {
				LOGGER.warning("Ignoring road segment " + edge.properties().get(RoadNetworkBuilder.SEGMENT_KEY)
						+ " between " + id + " and " + target + " with unusable length " + weight);
				continue;
			}
			remember(target, edge.neighbour());
			arcs.add(new Arc(target, weight));
		}
		return arcs;
	}

	private Waypoint remember(String id, GraphNode node) {
		Double latitude = node.getDouble("latitude");
		Double longitude = node.getDouble("longitude");
		Waypoint waypoint = new Waypoint(id, latitude == null ? Double.NaN : latitude,
				longitude == null ? Double.NaN : longitude);
		waypoints.put(id, waypoint);
		return waypoint;
	}
}
