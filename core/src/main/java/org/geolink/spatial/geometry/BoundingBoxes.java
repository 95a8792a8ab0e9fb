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
package org.geolink.spatial.geometry;

import org.locationtech.jts.geom.Envelope;

/**
 * Query windows around a point, in WGS84 degrees with x = longitude and y = latitude.
 */
public final class BoundingBoxes {

	public static final double KM_PER_DEGREE = 111.0;

	private BoundingBoxes() {
	}

	/**
	 * A square window of {@code bufferDegrees} on each side of the point.
	 */
	public static Envelope around(double latitude, double longitude, double bufferDegrees) {
		return new Envelope(longitude - bufferDegrees, longitude + bufferDegrees,
				latitude - bufferDegrees, latitude + bufferDegrees);
	}

	/**
	 * A window reaching {@code radiusKm} from the point on each side, using 111 km per degree of latitude and
	 * widening the longitude span by {@code 1 / cos(latitude)}.
	 */
	public static Envelope radius(double latitude, double longitude, double radiusKm) {
		double latDelta = radiusKm / KM_PER_DEGREE;
		double cos = Math.cos(Math.toRadians(latitude));
		// at the poles every longitude is in range
		double lonDelta = cos < 1e-9 ? 180.0 : radiusKm / (KM_PER_DEGREE * cos);
		return new Envelope(longitude - lonDelta, longitude + lonDelta, latitude - latDelta, latitude + latDelta);
	}
}
