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
package org.geolink.spatial.api.routing;

import java.util.List;

/**
 * The outcome of a shortest path search. A search that finds no connecting path is a legitimate negative result
 * with {@code found == false}, no waypoints and zero weight.
 */
public record RouteResult(List<Waypoint> waypoints, double totalWeight, int nodeCount, boolean found) {

	private static final RouteResult NOT_FOUND = new RouteResult(List.of(), 0.0, 0, false);

	public RouteResult {
		waypoints = List.copyOf(waypoints);
	}

	public static RouteResult found(List<Waypoint> waypoints, double totalWeight) {
		return new RouteResult(waypoints, totalWeight, waypoints.size(), true);
	}

	public static RouteResult notFound() {
		return NOT_FOUND;
	}
}
