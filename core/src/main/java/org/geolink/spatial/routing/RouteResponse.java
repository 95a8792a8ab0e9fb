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
import org.geolink.spatial.api.routing.RouteResult;
import org.geolink.spatial.api.routing.Waypoint;

/**
 * A computed route as reported to callers.
 *
 * @param route             the route as {@code [latitude, longitude]} pairs
 * @param distanceMeters    total route length
 * @param intersectionCount number of intersections on the route
 * @param found             false if no path connects the two points
 * @param message           a short description of the outcome
 */
public record RouteResponse(List<double[]> route, double distanceMeters, int intersectionCount, boolean found,
		String message) {

	public static RouteResponse from(RouteResult result) {
		if (!result.found()) {
			return new RouteResponse(List.of(), 0.0, 0, false,
					"No path found between the specified locations. The road network may be incomplete.");
		}
		List<double[]> route = result.waypoints().stream().map(Waypoint::toLatLon).toList();
		return new RouteResponse(route, result.totalWeight(), result.nodeCount(), true,
				"Route found with " + result.nodeCount() + " intersections");
	}
}
