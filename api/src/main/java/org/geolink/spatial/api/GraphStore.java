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
package org.geolink.spatial.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.geolink.spatial.api.graph.GraphEdge;
import org.geolink.spatial.api.graph.GraphNode;
import org.geolink.spatial.api.graph.NodeRef;

/**
 * A property graph with merge-by-key writes. Every write must be idempotent and commutative, so the same upsert
 * may be applied repeatedly or concurrently without creating duplicates. Attribute values of {@code null} are
 * ignored and never clear a stored value.
 */
public interface GraphStore extends AutoCloseable {

	/**
	 * Create the node identified by label and key if it is absent, then set the given attributes on it.
	 */
	void upsertNode(String label, String keyField, String keyValue, Map<String, Object> attributes);

	/**
	 * Create or update the relationship of the given type between two existing nodes, merged on the
	 * (from, to, type) tuple.
	 *
	 * @throws SpatialResolutionException if either node does not exist
	 */
	void upsertEdge(String type, NodeRef from, NodeRef to, Map<String, Object> attributes);

	/**
	 * Create or update the relationship of the given type between two existing nodes, merged on the value of the
	 * relationship key property.
	 *
	 * @throws SpatialResolutionException if either node does not exist
	 */
	void upsertEdge(String type, NodeRef from, NodeRef to, Map<String, Object> attributes, String edgeKeyField,
			String edgeKeyValue);

	Optional<GraphNode> findNode(NodeRef ref);

	/**
	 * @return the end node of the first outgoing relationship of the given type, if any
	 */
	Optional<GraphNode> findRelated(NodeRef from, String type);

	/**
	 * @return every relationship of the given type touching the node, in either direction
	 */
	List<GraphEdge> expand(NodeRef node, String type);

	/**
	 * Count nodes with the given label, restricted to those where {@code property = value} unless property is
	 * null.
	 */
	long countNodes(String label, String property, Object value);

	/**
	 * Count relationships of the given type whose start node has {@code property = value}, or all of them if
	 * property is null.
	 */
	long countRelationships(String type, String property, Object value);

	/**
	 * Count distinct nodes having {@code property = value} (any node if property is null) with at least one
	 * outgoing relationship of the given type.
	 */
	long countNodesWithRelationship(String type, String property, Object value);

	@Override
	void close();
}
