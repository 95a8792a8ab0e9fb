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
package org.geolink.spatial.api.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.geolink.spatial.api.GeometryParseException;
import org.locationtech.jts.geom.Geometry;

/**
 * A feature delivered by a feature catalog: a stable external id (GERS id), its kind, a WGS84 geometry
 * (x = longitude, y = latitude) and kind specific attributes. Features are validated on construction and are
 * read-only afterwards.
 */
public final class Feature {

	private final String id;
	private final FeatureKind kind;
	private final Geometry geometry;
	private final Map<String, Object> attributes;

	public Feature(String id, FeatureKind kind, Geometry geometry, Map<String, Object> attributes) {
		if (id == null || id.isBlank()) {
			throw new GeometryParseException(String.valueOf(id), "feature has no id");
		}
		if (kind == null) {
			throw new GeometryParseException(id, "feature has no kind");
		}
		if (geometry == null || geometry.isEmpty()) {
			throw new GeometryParseException(id, "feature has no geometry");
		}
		Map<String, Object> copy = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
		kind.validate(id, copy);
		this.id = id;
		this.kind = kind;
		this.geometry = geometry;
		this.attributes = Collections.unmodifiableMap(copy);
	}

	public String getId() {
		return id;
	}

	public FeatureKind getKind() {
		return kind;
	}

	public Geometry getGeometry() {
		return geometry;
	}

	public Map<String, Object> getAttributes() {
		return attributes;
	}

	public Object getAttribute(String key) {
		return attributes.get(key);
	}

	public String getString(String key) {
		Object value = attributes.get(key);
		return value == null ? null : value.toString();
	}

	public Double getDouble(String key) {
		Object value = attributes.get(key);
		return value instanceof Number number ? number.doubleValue() : null;
	}

	public Integer getInteger(String key) {
		Object value = attributes.get(key);
		return value instanceof Number number ? number.intValue() : null;
	}

	public boolean getBoolean(String key) {
		return Boolean.TRUE.equals(attributes.get(key));
	}

	@SuppressWarnings("unchecked")
	public List<String> getStringList(String key) {
		Object value = attributes.get(key);
		return value instanceof List<?> list ? (List<String>) list : List.of();
	}

	/**
	 * The display name of the feature, taken from {@code names.primary}, falling back to the first entry of
	 * {@code names.common}.
	 *
	 * @return the name, or null if the feature carries none
	 */
	public String getPrimaryName() {
		if (!(attributes.get("names") instanceof Map<?, ?> names)) {
			return null;
		}
		Object primary = names.get("primary");
		if (primary != null) {
			return primary.toString();
		}
		if (names.get("common") instanceof List<?> common && !common.isEmpty()
				&& common.get(0) instanceof Map<?, ?> first && first.get("value") != null) {
			return first.get("value").toString();
		}
		return null;
	}

	@Override
	public String toString() {
		return kind + "[" + id + "]";
	}
}
