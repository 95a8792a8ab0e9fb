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

/**
 * A point of interest.
 */
public record Place(String placeId, String name, String category, String address, Double confidence,
		Double latitude, Double longitude) implements SpatialSubject {

	public static final String LABEL = "Place";
	public static final String KEY = "place_id";

	public static Place of(String placeId, String name, double latitude, double longitude) {
		return new Place(placeId, name, null, null, null, latitude, longitude);
	}

	public static Place fromFeature(Feature place) {
		Coordinate position = GeometryMatcher.centroid(place.getGeometry());
		String name = place.getPrimaryName();
		return new Place(place.getId(), name == null ? "Unknown" : name, place.getString("category"),
				place.getString("address"), place.getDouble("confidence"), position.y, position.x);
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
		return placeId;
	}

	@Override
	public Map<String, Object> attributes() {
		return Attributes.of()
				.put("name", name)
				.put("category", category)
				.put("address", address)
				.put("confidence", confidence)
				.put("latitude", latitude)
				.put("longitude", longitude)
				.build();
	}
}
