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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.api.ProviderUnavailableException;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.graph.GraphEdge;
import org.geolink.spatial.api.graph.GraphNode;
import org.geolink.spatial.api.graph.NodeRef;
import org.neo4j.dbms.api.DatabaseManagementService;
import org.neo4j.graphdb.ConstraintViolationException;
import org.neo4j.graphdb.Direction;
import org.neo4j.graphdb.GraphDatabaseService;
import org.neo4j.graphdb.Label;
import org.neo4j.graphdb.Node;
import org.neo4j.graphdb.Relationship;
import org.neo4j.graphdb.RelationshipType;
import org.neo4j.graphdb.ResourceIterable;
import org.neo4j.graphdb.ResourceIterator;
import org.neo4j.graphdb.Transaction;
import org.neo4j.graphdb.TransactionFailureException;
import org.neo4j.graphdb.TransientFailureException;
import org.neo4j.graphdb.schema.ConstraintDefinition;
import org.neo4j.graphdb.schema.ConstraintType;

/**
 * A {@link GraphStore} on an embedded Neo4j database.
 * <p>
 * Every call runs in its own transaction, bounded by the configured timeout. Nodes are merged on a uniqueness
 * constraint per (label, key), created the first time the pair is written, so two writers racing to create the
 * same node cannot both succeed. The loser of such a race retries once and finds the winner's node. Relationship
 * merges take a write lock on the start node before looking for an existing relationship, which serializes
 * concurrent merges of edges leaving the same node.
 */
public class Neo4jGraphStore implements GraphStore {

	private static final Logger LOGGER = Logger.getLogger(Neo4jGraphStore.class.getName());

	private final GraphDatabaseService database;
	private final DatabaseManagementService managementService;
	private final long timeoutMs;
	private final Set<String> constrained = ConcurrentHashMap.newKeySet();
	private final Map<String, String> nodeKeys = new ConcurrentHashMap<>();

	/**
	 * A store on a database whose lifecycle is managed by the caller.
	 */
	public Neo4jGraphStore(GraphDatabaseService database, long timeoutMs) {
		this(database, null, timeoutMs);
	}

	/**
	 * A store that shuts the management service down when it is closed.
	 */
	public Neo4jGraphStore(GraphDatabaseService database, DatabaseManagementService managementService,
			long timeoutMs) {
		if (database == null) {
			throw new ConfigurationException("No graph database to store into");
		}
		if (!database.isAvailable(timeoutMs)) {
			throw new ConfigurationException("Graph database '" + database.databaseName()
					+ "' is not available after " + timeoutMs + "ms");
		}
		this.database = database;
		this.managementService = managementService;
		this.timeoutMs = timeoutMs;
		loadConstraints();
	}

	private void loadConstraints() {
		read(tx -> {
			for (ConstraintDefinition constraint : tx.schema().getConstraints()) {
				List<String> keys = toList(constraint.getPropertyKeys());
				if (constraint.isConstraintType(ConstraintType.UNIQUENESS) && keys.size() == 1) {
					String label = constraint.getLabel().name();
					constrained.add(label + ":" + keys.get(0));
					nodeKeys.putIfAbsent(label, keys.get(0));
				}
			}
			return null;
		});
	}

	@Override
	public void upsertNode(String label, String keyField, String keyValue, Map<String, Object> attributes) {
		ensureUniqueness(label, keyField);
		Map<String, Object> properties = PropertyValues.normalize(attributes);
		try {
			write(tx -> mergeNode(tx, label, keyField, keyValue, properties));
		} catch (ConstraintViolationException e) {
			LOGGER.fine("Concurrent creation of " + new NodeRef(label, keyField, keyValue) + ", merging again");
			write(tx -> mergeNode(tx, label, keyField, keyValue, properties));
		}
	}

	private static Node mergeNode(Transaction tx, String label, String keyField, String keyValue,
			Map<String, Object> properties) {
		Node node = tx.findNode(Label.label(label), keyField, keyValue);
		if (node == null) {
			node = tx.createNode(Label.label(label));
			node.setProperty(keyField, keyValue);
		}
		for (Map.Entry<String, Object> entry : properties.entrySet()) {
			if (!entry.getKey().equals(keyField)) {
				node.setProperty(entry.getKey(), entry.getValue());
			}
		}
		return node;
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
		RelationshipType relType = RelationshipType.withName(type);
		write(tx -> {
			Node start = requireNode(tx, from);
			Node end = requireNode(tx, to);
			tx.acquireWriteLock(start);
			Relationship existing = null;
			try (ResourceIterable<Relationship> relationships = start.getRelationships(Direction.OUTGOING, relType)) {
				for (Relationship relationship : relationships) {
					if (!relationship.getEndNode().equals(end)) {
						continue;
					}
					if (edgeKeyField == null
							|| edgeKeyValue.equals(relationship.getProperty(edgeKeyField, null))) {
						existing = relationship;
						break;
					}
				}
			}
			Relationship relationship = existing != null ? existing : start.createRelationshipTo(end, relType);
			if (edgeKeyField != null) {
				relationship.setProperty(edgeKeyField, edgeKeyValue);
			}
			properties.forEach(relationship::setProperty);
			return relationship;
		});
	}

	private static Node requireNode(Transaction tx, NodeRef ref) {
		Node node = tx.findNode(Label.label(ref.label()), ref.keyField(), ref.keyValue());
		if (node == null) {
			throw new SpatialResolutionException("No node " + ref);
		}
		return node;
	}

	@Override
	public Optional<GraphNode> findNode(NodeRef ref) {
		return read(tx -> {
			Node node = tx.findNode(Label.label(ref.label()), ref.keyField(), ref.keyValue());
			return node == null ? Optional.empty() : Optional.of(new GraphNode(ref, node.getAllProperties()));
		});
	}

	@Override
	public Optional<GraphNode> findRelated(NodeRef from, String type) {
		return read(tx -> {
			Node node = tx.findNode(Label.label(from.label()), from.keyField(), from.keyValue());
			if (node == null) {
				return Optional.empty();
			}
			try (ResourceIterable<Relationship> relationships = node.getRelationships(Direction.OUTGOING,
					RelationshipType.withName(type))) {
				for (Relationship relationship : relationships) {
					return Optional.of(toGraphNode(relationship.getEndNode()));
				}
			}
			return Optional.empty();
		});
	}

	@Override
	public List<GraphEdge> expand(NodeRef ref, String type) {
		return read(tx -> {
			List<GraphEdge> edges = new ArrayList<>();
			Node node = tx.findNode(Label.label(ref.label()), ref.keyField(), ref.keyValue());
			if (node == null) {
				return edges;
			}
			try (ResourceIterable<Relationship> relationships = node.getRelationships(Direction.BOTH,
					RelationshipType.withName(type))) {
				for (Relationship relationship : relationships) {
					Node other = relationship.getOtherNode(node);
					edges.add(new GraphEdge(type, toGraphNode(other), relationship.getAllProperties(),
							relationship.getStartNode().equals(node)));
				}
			}
			return edges;
		});
	}

	/**
	 * A snapshot of a node, identified by the key of its first label that has a uniqueness constraint, falling back
	 * to the element id.
	 */
	private GraphNode toGraphNode(Node node) {
		Map<String, Object> properties = node.getAllProperties();
		String firstLabel = "";
		for (Label label : node.getLabels()) {
			String key = nodeKeys.get(label.name());
			if (key != null && properties.get(key) != null) {
				return new GraphNode(new NodeRef(label.name(), key, properties.get(key).toString()), properties);
			}
			if (firstLabel.isEmpty()) {
				firstLabel = label.name();
			}
		}
		return new GraphNode(new NodeRef(firstLabel, "elementId", node.getElementId()), properties);
	}

	@Override
	public long countNodes(String label, String property, Object value) {
		return count("MATCH (n:" + quote(label) + ") WHERE $property IS NULL OR n[$property] = $value"
				+ " RETURN count(n) AS count", property, value);
	}

	@Override
	public long countRelationships(String type, String property, Object value) {
		return count("MATCH (a)-[r:" + quote(type) + "]->() WHERE $property IS NULL OR a[$property] = $value"
				+ " RETURN count(r) AS count", property, value);
	}

	@Override
	public long countNodesWithRelationship(String type, String property, Object value) {
		return count("MATCH (a)-[:" + quote(type) + "]->() WHERE $property IS NULL OR a[$property] = $value"
				+ " RETURN count(DISTINCT a) AS count", property, value);
	}

	private long count(String query, String property, Object value) {
		Map<String, Object> params = new HashMap<>();
		params.put("property", property);
		params.put("value", PropertyValues.normalize(value));
		return read(tx -> {
			try (ResourceIterator<Long> counts = tx.execute(query, params).columnAs("count")) {
				return counts.hasNext() ? counts.next() : 0L;
			}
		});
	}

	private static String quote(String name) {
		return "`" + name.replace("`", "``") + "`";
	}

	/**
	 * Creates the uniqueness constraint backing merges of the given label and key, unless this store already did
	 * or an equivalent constraint exists.
	 */
	private void ensureUniqueness(String label, String keyField) {
		String id = label + ":" + keyField;
		if (constrained.contains(id)) {
			return;
		}
		synchronized (constrained) {
			if (constrained.contains(id)) {
				return;
			}
			try {
				boolean created = write(tx -> {
					for (ConstraintDefinition constraint : tx.schema().getConstraints(Label.label(label))) {
						if (constraint.isConstraintType(ConstraintType.UNIQUENESS)
								&& List.of(keyField).equals(toList(constraint.getPropertyKeys()))) {
							return false;
						}
					}
					tx.schema().constraintFor(Label.label(label)).assertPropertyIsUnique(keyField)
							.withName("geolink_" + label + "_" + keyField).create();
					return true;
				});
				if (created) {
					LOGGER.info("Created uniqueness constraint on :" + label + "(" + keyField + ")");
					try (Transaction tx = database.beginTx(timeoutMs, TimeUnit.MILLISECONDS)) {
						tx.schema().awaitIndexesOnline(timeoutMs, TimeUnit.MILLISECONDS);
						tx.commit();
					}
				}
			} catch (ConstraintViolationException e) {
				// another process created it first
				LOGGER.log(Level.FINE, "Uniqueness constraint on :" + label + "(" + keyField + ") already exists", e);
			}
			constrained.add(id);
			nodeKeys.putIfAbsent(label, keyField);
		}
	}

	private static List<String> toList(Iterable<String> keys) {
		List<String> list = new ArrayList<>();
		keys.forEach(list::add);
		return list;
	}

	private <T> T write(Function<Transaction, T> work) {
		try (Transaction tx = database.beginTx(timeoutMs, TimeUnit.MILLISECONDS)) {
			T result = work.apply(tx);
			tx.commit();
			return result;
		} catch (ConstraintViolationException e) {
			throw e;
		} catch (TransientFailureException e) {
			throw new ProviderUnavailableException("Transient graph store failure: " + e.getMessage(), e);
		} catch (TransactionFailureException e) {
			if (e.getCause() instanceof ConstraintViolationException violation) {
				throw violation;
			}
			throw new ProviderUnavailableException("Graph store transaction failed: " + e.getMessage(), e);
		}
	}

	private <T> T read(Function<Transaction, T> work) {
		try (Transaction tx = database.beginTx(timeoutMs, TimeUnit.MILLISECONDS)) {
			T result = work.apply(tx);
			tx.commit();
			return result;
		} catch (TransientFailureException e) {
			throw new ProviderUnavailableException("Transient graph store failure: " + e.getMessage(), e);
		} catch (TransactionFailureException e) {
			throw new ProviderUnavailableException("Graph store transaction failed: " + e.getMessage(), e);
		}
	}

	public GraphDatabaseService getDatabase() {
		return database;
	}

	@Override
	public void close() {
		if (managementService != null) {
			LOGGER.info("Shutting down graph database '" + database.databaseName() + "'");
			managementService.shutdown();
		}
	}
}
