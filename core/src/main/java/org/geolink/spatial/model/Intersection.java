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
import org.locationtech.jts.geom.Point;

/**
 * A road network vertex, made from a connector feature.
 */
public record Intersection(String intersectionId, double latitude, double longitude, String source, String regionId)
		implements GraphEntity {

	public static final String LABEL = "Intersection";
	public static final String KEY = "intersection_id";
	public static final String DEFAULT_SOURCE = "overture";

	public static Intersection fromFeature(Feature connector, String regionId) {
		Coordinate position = GeometryMatcher.centroid(connector.getGeometry());
		return new Intersection(connector.getId(), position.y, position.x, DEFAULT_SOURCE, regionId);
	}

	public Point point() {
		return GeometryMatcher.point(latitude, longitude);
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
		return intersectionId;
	}

	@Override
	public Map<String, Object> attributes() {
		return Attributes.of()
				.put("latitude", latitude)
				.put("longitude", longitude)
				.put("source", source)
				.put("region_id", regionId)
				.build();
	}
}
