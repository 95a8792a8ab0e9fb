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
 * A street a point lies on, positioned where the point snaps onto the segment.
 */
public record RoadSegment(String segmentId, String name, String roadClass, double latitude, double longitude)
		implements GraphEntity {

	public static final String LABEL = "RoadSegment";
	public static final String KEY = "segment_id";
	public static final String UNNAMED = "Unnamed Road";
	public static final String UNKNOWN_CLASS = "unknown";

	public static RoadSegment fromFeature(Feature segment, Point from) {
		Coordinate snapped = GeometryMatcher.nearestPointOn(segment.getGeometry(), from);
		String name = segment.getPrimaryName();
		String roadClass = segment.getString("road_class");
		return new RoadSegment(segment.getId(), name == null ? UNNAMED : name,
				roadClass == null ? UNKNOWN_CLASS : roadClass, snapped.y, snapped.x);
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
		return segmentId;
	}

	@Override
	public Map<String, Object> attributes() {
		return Attributes.of()
				.put("name", name)
				.put("road_class", roadClass)
				.put("latitude", latitude)
				.put("longitude", longitude)
				.build();
	}
}
