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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds attribute maps for node writes, skipping null values.
 */
final class Attributes {

	private final Map<String, Object> values = new LinkedHashMap<>();

	static Attributes of() {
		return new Attributes();
	}

	Attributes put(String key, Object value) {
		if (value != null) {
			values.put(key, value);
		}
		return this;
	}

	Map<String, Object> build() {
		return values;
	}
}
