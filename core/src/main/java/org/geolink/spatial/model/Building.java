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

import java.util.Map;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.io.WKTWriter;

/**
 * A building footprint, positioned at its centroid.
 */
public record Building(String gersId, String name, Double height, Integer levels, String typeClass,
		double latitude, double longitude, String geometry) implements GraphEntity {

	public static final String LABEL = "Building";
	public static final String KEY = "gers_id";

	public static Building fromFeature(Feature building) {
		Coordinate centroid = GeometryMatcher.centroid(building.getGeometry());
		String typeClass = building.getString("class");
		String name = typeClass == null ? "Building" : "Building (" + typeClass + ")";
		return new Building(building.getId(), name, building.getDouble("height"), building.getInteger("num_floors"),
				typeClass, centroid.y, centroid.x, new WKTWriter().write(building.getGeometry()));
	}

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public String keyField() {
		return KEY;
	}

	@Override
	public String key() {
		return gersId;
	}

	@Override
	public Map<String, Object> attributes() {
		return Attributes.of()
				.put("name", name)
				.put("height", height)
				.put("levels", levels)
				.put("type_class", typeClass)
				.put("latitude", latitude)
				.put("longitude", longitude)
				.put("geometry", geometry)
				.build();
	}
}
