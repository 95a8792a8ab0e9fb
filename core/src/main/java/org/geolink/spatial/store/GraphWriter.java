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
package org.geolink.spatial.store;

import java.util.Map;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.model.GraphEntity;

/**
 * Writes model entities and the relationships between them to a {@link GraphStore}.
 */
public class GraphWriter {

	private final GraphStore store;

	public GraphWriter(GraphStore store) {
		this.store = store;
	}

	public GraphStore getStore() {
		return store;
	}

	public void merge(GraphEntity entity) {
		store.upsertNode(entity.label(), entity.keyField(), entity.key(), entity.attributes());
	}

	/**
	 * Merges a relationship between two entities that are already stored.
	 */
	public void link(GraphEntity from, GraphRelationships type, GraphEntity to) {
		link(from, type, to, Map.of());
	}

	public void link(GraphEntity from, GraphRelationships type, GraphEntity to, Map<String, Object> attributes) {
		store.upsertEdge(type.name(), from.ref(), to.ref(), attributes);
	}

	/**
	 * Sets a single property on a stored entity without touching the others.
	 */
	public void update(GraphEntity entity, String property, Object value) {
		store.upsertNode(entity.label(), entity.keyField(), entity.key(), Map.of(property, value));
	}
}
