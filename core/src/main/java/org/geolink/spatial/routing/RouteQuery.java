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

import java.util.Objects;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.api.routing.PathAlgorithm;

/**
 * A request for the shortest route between two stored points.
 */
public record RouteQuery(NodeRef origin, NodeRef destination, PathAlgorithm algorithm) {

	public RouteQuery {
		Objects.requireNonNull(origin, "origin");
		Objects.requireNonNull(destination, "destination");
		algorithm = algorithm == null ? PathAlgorithm.DIJKSTRA : algorithm;
	}

	/**
	 * A query naming the algorithm as text, {@code "dijkstra"} or {@code "astar"}.
	 */
	public static RouteQuery of(NodeRef origin, NodeRef destination, String algorithm) {
		return new RouteQuery(origin, destination, PathAlgorithm.fromName(algorithm));
	}
}
