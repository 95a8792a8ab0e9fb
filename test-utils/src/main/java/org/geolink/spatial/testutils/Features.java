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
package org.geolink.spatial.testutils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * Builders for test features. Positions are given as (latitude, longitude) and stored with x = longitude.
 */
public final class Features {

	public static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

	private Features() {
	}

	/**
	 * An axis aligned rectangle.
	 */
	public static Polygon box(double minLat, double minLon, double maxLat, double maxLon) {
		return FACTORY.createPolygon(new Coordinate[]{
				new Coordinate(minLon, minLat),
				new Coordinate(maxLon, minLat),
				new Coordinate(maxLon, maxLat),
				new Coordinate(minLon, maxLat),
				new Coordinate(minLon, minLat)
		});
	}

	public static Feature building(String id, Polygon footprint, String typeClass) {
		return new Feature(id, FeatureKind.BUILDING, footprint, attributes("class", typeClass));
	}

	public static Feature division(String id, String subtype, String name, Polygon boundary) {
		return new Feature(id, FeatureKind.DIVISION, boundary,
				attributes("subtype", subtype, "names", names(name), "country_iso", "FR"));
	}

	public static Feature address(String id, double lat, double lon, String number, String street) {
		return new Feature(id, FeatureKind.ADDRESS, point(lat, lon),
				attributes("number", number, "street", street, "postcode", "75001"));
	}

	public static Feature place(String id, double lat, double lon, String name, String category) {
		return new Feature(id, FeatureKind.PLACE, point(lat, lon),
				attributes("names", names(name), "category", category));
	}

	public static Feature connector(String id, double lat, double lon) {
		return new Feature(id, FeatureKind.ROAD_CONNECTOR, point(lat, lon), Map.of());
	}

	/**
	 * A straight segment between two connectors, through the given (latitude, longitude) positions.
	 */
	public static Feature segment(String id, String roadClass, String name, Double lengthMeters,
			List<String> connectors, double[]... positions) {
		Coordinate[] coordinates = new Coordinate[positions.length];
		for (int i = 0; i < positions.length; i++) {
			coordinates[i] = new Coordinate(positions[i][1], positions[i][0]);
		}
		return new Feature(id, FeatureKind.ROAD_SEGMENT, FACTORY.createLineString(coordinates),
				attributes("connectors", connectors, "road_class", roadClass,
						"names", name == null ? null : names(name), "length_m", lengthMeters));
	}

	public static Point point(double lat, double lon) {
		return FACTORY.createPoint(new Coordinate(lon, lat));
	}

	public static Map<String, Object> names(String primary) {
		return Map.of("primary", primary);
	}

	/**
	 * Alternating keys and values; null values are left out.
	 */
	public static Map<String, Object> attributes(Object... keysAndValues) {
		Map<String, Object> attributes = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			if (keysAndValues[i + 1] != null) {
				attributes.put((String) keysAndValues[i], keysAndValues[i + 1]);
			}
		}
		return attributes;
	}
}
