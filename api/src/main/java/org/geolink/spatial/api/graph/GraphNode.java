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
package org.geolink.spatial.api.graph;

import java.util.Map;

/**
 * A snapshot of a stored node and its properties.
 */
public record GraphNode(NodeRef ref, Map<String, Object> properties) {

	public GraphNode {
		properties = Map.copyOf(properties);
	}

	public Object getProperty(String key) {
		return properties.get(key);
	}

	public Double getDouble(String key) {
		return properties.get(key) instanceof Number number ? number.doubleValue() : null;
	}
}
