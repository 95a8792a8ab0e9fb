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
package org.geolink.spatial.testutils;

import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.neo4j.graphdb.GraphDatabaseService;
import org.neo4j.graphdb.ResourceIterator;
import org.neo4j.graphdb.Transaction;
import org.neo4j.harness.Neo4j;
import org.neo4j.harness.Neo4jBuilders;

/**
 * Starts a fresh in-process Neo4j database, without the HTTP server, for every test.
 */
public abstract class AbstractGraphTest {

	private Neo4j neo4j;
	protected GraphDatabaseService db;

	@BeforeEach
	public void setUp() {
		neo4j = Neo4jBuilders.newInProcessBuilder()
				.withDisabledServer()
				.build();
		db = neo4j.defaultDatabaseService();
	}

	@AfterEach
	public void tearDown() {
		if (neo4j != null) {
			neo4j.close();
		}
	}

	protected long count(String query) {
		return count(query, null);
	}

	/**
	 * Runs a query returning a single {@code count} column.
	 */
	protected long count(String query, Map<String, Object> params) {
		try (Transaction tx = db.beginTx()) {
			try (ResourceIterator<Long> counts = tx.execute(query,
					params == null ? Collections.emptyMap() : params).columnAs("count")) {
				long count = counts.next();
				tx.commit();
				return count;
			}
		}
	}

	protected long countNodes() {
		return count("MATCH (n) RETURN count(n) AS count");
	}

	protected long countRelationships() {
		return count("MATCH ()-[r]->() RETURN count(r) AS count");
	}
}
