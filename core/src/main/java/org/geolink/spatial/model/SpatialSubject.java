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
package org.geolink.spatial.model;

import org.geolink.spatial.api.MissingCoordinatesException;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.locationtech.jts.geom.Point;

/**
 * An input to the resolution passes: a node with an optional WGS84 position.
 */
public interface SpatialSubject extends GraphEntity {

	Double latitude();

	Double longitude();

	default boolean hasCoordinates() {
		return latitude() != null && longitude() != null;
	}

	/**
	 * @throws MissingCoordinatesException if the subject has no position
	 */
	default Point point() {
		if (!hasCoordinates()) {
			throw new MissingCoordinatesException(ref().toString());
		}
		return GeometryMatcher.point(latitude(), longitude());
	}
}
