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

import org.geolink.spatial.api.routing.PathAlgorithm;
import org.geolink.spatial.api.routing.Waypoint;
import org.geolink.spatial.geometry.GeodesicDistance;

/**
 * A* with the great-circle distance to the target as heuristic. This is admissible and consistent when no arc
 * weighs less than the great-circle distance between its ends, which holds for segments loaded by the road network
 * builder.
 */
public class AStarStrategy extends BestFirstSearch {

	@Override
	public PathAlgorithm algorithm() {
		return PathAlgorithm.ASTAR;
	}

	@Override
	protected double estimate(Waypoint from, Waypoint target) {
		double estimate = GeodesicDistance.meters(from.latitude(), from.longitude(), target.latitude(),
				target.longitude());
		// unknown positions fall back to uniform cost
		return Double.isNaN(estimate) ? 0.0 : estimate;
	}
}
