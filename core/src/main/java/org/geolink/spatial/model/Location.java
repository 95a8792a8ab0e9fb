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
 * A postal location. Input locations are keyed by whatever id the caller gave them; canonical locations derived
 * from an address feature use the feature's GERS id as their {@code location_id}.
 */
public record Location(String locationId, String address, String city, String country, String zip, String gersId,
		Double latitude, Double longitude) implements SpatialSubject {

	public static final String LABEL = "Location";
	public static final String KEY = "location_id";

	public static Location of(String locationId, double latitude, double longitude) {
		return new Location(locationId, null, null, null, null, null, latitude, longitude);
	}

	/**
	 * The canonical location of an address feature: {@code "number street"} when the feature has both, otherwise
	 * the fallback address text, positioned at the feature's point (or centroid).
	 */
	public static Location canonical(Feature address, String fallbackAddress, String city, String country) {
		String number = address.getString("number");
		String street = address.getString("street");
		String text = number != null && street != null ? number + " " + street : fallbackAddress;
		Coordinate position = GeometryMatcher.centroid(address.getGeometry());
		return new Location(address.getId(), text, city, country, address.getString("postcode"), address.getId(),
				position.y, position.x);
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
		return locationId;
	}

	@Override
	public Map<String, Object> attributes() {
		return Attributes.of()
				.put("address", address)
				.put("city", city)
				.put("country", country)
				.put("zip", zip)
				.put("gers_id", gersId)
				.put("latitude", latitude)
				.put("longitude", longitude)
				.build();
	}
}
