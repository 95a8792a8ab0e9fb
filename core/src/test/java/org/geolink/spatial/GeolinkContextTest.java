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
package org.geolink.spatial;

import static org.geolink.spatial.testutils.Features.box;
import static org.geolink.spatial.testutils.Features.connector;
import static org.geolink.spatial.testutils.Features.segment;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.routing.PathAlgorithm;
import org.geolink.spatial.config.GeolinkConfig;
import org.geolink.spatial.link.Resolution;
import org.geolink.spatial.link.ResolverKind;
import org.geolink.spatial.model.Location;
import org.geolink.spatial.network.NetworkBatch;
import org.geolink.spatial.network.NetworkLoadReport;
import org.geolink.spatial.routing.RouteQuery;
import org.geolink.spatial.routing.RouteResponse;
import org.geolink.spatial.source.InMemoryFeatureSource;
import org.geolink.spatial.store.Neo4jGraphStore;
import org.geolink.spatial.testutils.AbstractGraphTest;
import org.geolink.spatial.testutils.Features;
import org.junit.jupiter.api.Test;

public class GeolinkContextTest extends AbstractGraphTest {

	private static InMemoryFeatureSource catalog() {
		return new InMemoryFeatureSource()
				.add(Features.building("b1", box(0.0005, 0, 0.0015, 0.001), "commercial"))
				.add(Features.address("addr-1", 0.001, 0.0005, "1", "Main Street"))
				.add(Features.division("paris", "locality", "Paris", box(-1, -1, 1, 1)))
				.add(Features.division("idf", "region", "Ile-de-France", box(-2, -2, 2, 2)))
				.add(connector("A", 0.0, 0.0))
				.add(connector("B", 0.0, 0.01))
				.add(segment("AB", "primary", "Main Street", null, List.of("A", "B"),
						new double[]{0, 0}, new double[]{0, 0.01}));
	}

	@Test
	public void shouldResolveLoadAndRouteOnNeo4j() {
		Location p = Location.of("P", 0.001, 0.0005);
		Location q = Location.of("Q", -0.001, 0.0095);
		GeolinkConfig config = GeolinkConfig.defaults();
		try (GeolinkContext context = GeolinkContext.create(config, catalog(), new Neo4jGraphStore(db, 10000))) {
			List<Resolution> resolutions = context.getLinker().link(List.of(p, q),
					EnumSet.of(ResolverKind.BUILDING, ResolverKind.ADDRESS, ResolverKind.DIVISIONS));
			assertEquals(6, resolutions.size());
			assertTrue(resolutions.get(0).isLinked());
			assertTrue(resolutions.get(1).isLinked());

			NetworkLoadReport report = context.getNetworkBuilder().load(NetworkBatch.of(List.of(p, q), "paris",
					config));
			assertEquals(2, report.intersections());
			assertEquals(1, report.segmentsCommitted());
			assertEquals(2, report.subjectsLinked());

			long nodes = countNodes();
			long relationships = countRelationships();
			context.getNetworkBuilder().load(NetworkBatch.of(List.of(p, q), "paris", config));
			assertEquals(nodes, countNodes());
			assertEquals(relationships, countRelationships());

			for (PathAlgorithm algorithm : PathAlgorithm.values()) {
				RouteResponse response = context.getRouting().route(new RouteQuery(p.ref(), q.ref(), algorithm));
				assertTrue(response.found());
				assertEquals(2, response.intersectionCount());
				assertThat(response.distanceMeters(), closeTo(1111.95, 0.01));
			}
			assertEquals(1, count("MATCH (:Location {location_id: 'P'})-[:LOCATED_IN]->(b:Building) "
					+ "RETURN count(b) AS count"));
			assertEquals(1, count("MATCH (:Location {location_id: 'P'})-[:SAME_AS]->(:Location {location_id: 'addr-1'})"
					+ "-[:WITHIN_DIVISION]->(:Division {gers_id: 'paris'})-[:WITHIN_DIVISION]->(d:Division) "
					+ "RETURN count(d) AS count"));
			assertEquals(2, context.getRouting().networkStatus("paris").linkedPointCount());
		}
	}

	@Test
	public void shouldRequireSourceAndStore() {
		assertThrows(ConfigurationException.class,
				() -> GeolinkContext.create(GeolinkConfig.defaults(), null, new Neo4jGraphStore(db, 10000)));
	}
}
