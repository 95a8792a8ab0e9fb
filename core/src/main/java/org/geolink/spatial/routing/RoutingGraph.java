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

import java.util.List;
import java.util.Optional;
import org.geolink.spatial.api.routing.Waypoint;

/**
 * A weighted graph of intersections as seen by the path search.
 */
public interface RoutingGraph {

	/**
	 * A traversable connection to a neighbouring intersection.
	 */
	record Arc(String target, double weight) {

	}

	/**
	 * @return the intersection and its position, if it exists
	 */
	Optional<Waypoint> node(String id);

	/**
	 * @return the arcs leaving the intersection, all with a non-negative weight
	 */
	List<Arc> arcs(String id);
}
