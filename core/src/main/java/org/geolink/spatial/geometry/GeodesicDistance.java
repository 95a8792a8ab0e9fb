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

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

/**
 * Great-circle distances for WGS84 coordinates in degrees (x = longitude, y = latitude).
 * <p>
 * <a href="https://www.movable-type.co.uk/scripts/latlong.html">Algorithm reference</a>
 */
public final class GeodesicDistance {

	public static final double EARTH_RADIUS_METERS = 6_371_000.0;

	private GeodesicDistance() {
	}

	/**
	 * Haversine distance in meters.
	 */
	public static double meters(double lat1, double lon1, double lat2, double lon2) {
		double dLat = Math.toRadians(lat2 - lat1);
		double dLon = Math.toRadians(lon2 - lon1);
		double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
				+ Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
				* Math.sin(dLon / 2) * Math.sin(dLon / 2);
		return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(a)));
	}

	public static double meters(Coordinate from, Coordinate to) {
		return meters(from.y, from.x, to.y, to.x);
	}

	/**
	 * The length of the lines of a geometry along the sphere, as the sum of the great-circle distances between
	 * consecutive vertices. For a single line this is never less than the great-circle distance between its end
	 * points. Parts that are not lines count for nothing.
	 */
	public static double lengthMeters(Geometry geometry) {
		double length = 0.0;
		for (int part = 0; part < geometry.getNumGeometries(); part++) {
			if (geometry.getGeometryN(part) instanceof LineString line) {
				Coordinate[] coordinates = line.getCoordinates();
				for (int i = 1; i < coordinates.length; i++) {
					length += meters(coordinates[i - 1], coordinates[i]);
				}
			}
		}
		return length;
	}
}
