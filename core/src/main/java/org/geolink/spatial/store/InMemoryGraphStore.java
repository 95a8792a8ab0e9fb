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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.graph.GraphEdge;
import org.geolink.spatial.api.graph.GraphNode;
import org.geolink.spatial.api.graph.NodeRef;

/**
 * A {@link GraphStore} held in memory, with the same merge semantics as the Neo4j store. Writes are serialized by a
 * single lock, reads share it.
 */
public class InMemoryGraphStore implements GraphStore {

	private final ReadWriteLock lock = new ReentrantReadWriteLock();
	private final Map<NodeRef, Map<String, Object>> nodes = new LinkedHashMap<>();
	private final List<StoredEdge> edges = new ArrayList<>();

	private static final class StoredEdge {
		final String type;
		final NodeRef from;
		final NodeRef to;
		final Map<String, Object> properties = new LinkedHashMap<>();

		StoredEdge(String type, NodeRef from, NodeRef to) {
			this.type = type;
			this.from = from;
			this.to = to;
		}
	}

	@Override
	public void upsertNode(String label, String keyField, String keyValue, Map<String, Object> attributes) {
		NodeRef ref = new NodeRef(label, keyField, keyValue);
		Map<String, Object> properties = PropertyValues.normalize(attributes);
		lock.writeLock().lock();
		try {
			Map<String, Object> node = nodes.computeIfAbsent(ref, r -> {
				Map<String, Object> created = new LinkedHashMap<>();
				created.put(keyField, keyValue);
				return created;
			});
			properties.remove(keyField);
			node.putAll(properties);
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public void upsertEdge(String type, NodeRef from, NodeRef to, Map<String, Object> attributes) {
		mergeEdge(type, from, to, attributes, null, null);
	}

	@Override
	public void upsertEdge(String type, NodeRef from, NodeRef to, Map<String, Object> attributes,
			String edgeKeyField, String edgeKeyValue) {
		mergeEdge(type, from, to, attributes, edgeKeyField, edgeKeyValue);
	}

	private void mergeEdge(String type, NodeRef from, NodeRef to, Map<String, Object> attributes,
			String edgeKeyField, String edgeKeyValue) {
		Map<String, Object> properties = PropertyValues.normalize(attributes);
		lock.writeLock().lock();
		try {
			requireNode(from);
			requireNode(to);
			StoredEdge edge = null;
			for (StoredEdge candidate : edges) {
				if (candidate.type.equals(type) && candidate.from.equals(from) && candidate.to.equals(to)
						&& (edgeKeyField == null
						|| Objects.equals(edgeKeyValue, candidate.properties.get(edgeKeyField)))) {
					edge = candidate;
					break;
				}
			}
			if (edge == null) {
				edge = new StoredEdge(type, from, to);
				edges.add(edge);
			}
			if (edgeKeyField != null) {
				edge.properties.put(edgeKeyField, edgeKeyValue);
			}
			edge.properties.putAll(properties);
		} finally {
			lock.writeLock().unlock();
		}
	}

	private void requireNode(NodeRef ref) {
		if (!nodes.containsKey(ref)) {
			throw new SpatialResolutionException("No node " + ref);
		}
	}

	@Override
	public Optional<GraphNode> findNode(NodeRef ref) {
		lock.readLock().lock();
		try {
			Map<String, Object> node = nodes.get(ref);
			return node == null ? Optional.empty() : Optional.of(new GraphNode(ref, node));
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public Optional<GraphNode> findRelated(NodeRef from, String type) {
		lock.readLock().lock();
		try {
			for (StoredEdge edge : edges) {
				if (edge.type.equals(type) && edge.from.equals(from)) {
					return Optional.of(new GraphNode(edge.to, nodes.get(edge.to)));
				}
			}
			return Optional.empty();
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public List<GraphEdge> expand(NodeRef node, String type) {
		lock.readLock().lock();
		try {
			List<GraphEdge> result = new ArrayList<>();
			for (StoredEdge edge : edges) {
				if (!edge.type.equals(type)) {
					continue;
				}
				if (edge.from.equals(node)) {
					result.add(new GraphEdge(type, new GraphNode(edge.to, nodes.get(edge.to)), edge.properties, true));
				} else if (edge.to.equals(node)) {
					result.add(new GraphEdge(type, new GraphNode(edge.from, nodes.get(edge.from)), edge.properties,
							false));
				}
			}
			return result;
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public long countNodes(String label, String property, Object value) {
		lock.readLock().lock();
		try {
			return nodes.entrySet().stream()
					.filter(e -> e.getKey().label().equals(label))
					.filter(e -> matches(e.getValue(), property, value))
					.count();
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public long countRelationships(String type, String property, Object value) {
		lock.readLock().lock();
		try {
			return edges.stream()
					.filter(e -> e.type.equals(type))
					.filter(e -> matches(nodes.get(e.from), property, value))
					.count();
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public long countNodesWithRelationship(String type, String property, Object value) {
		lock.readLock().lock();
		try {
			return edges.stream()
					.filter(e -> e.type.equals(type))
					.filter(e -> matches(nodes.get(e.from), property, value))
					.map(e -> e.from)
					.distinct()
					.count();
		} finally {
			lock.readLock().unlock();
		}
	}

	private static boolean matches(Map<String, Object> properties, String property, Object value) {
		return property == null || PropertyValues.sameValue(properties.get(property), PropertyValues.normalize(value));
	}

	/**
	 * Total number of nodes, for any label.
	 */
	public int nodeCount() {
		lock.readLock().lock();
		try {
			return nodes.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	public int edgeCount() {
		lock.readLock().lock();
		try {
			return edges.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public void close() {
		lock.writeLock().lock();
		try {
			nodes.clear();
			edges.clear();
		} finally {
			lock.writeLock().unlock();
		}
	}
}
