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
package org.geolink.spatial.routing;

import static org.geolink.spatial.testutils.Features.connector;
import static org.geolink.spatial.testutils.Features.segment;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.geolink.spatial.api.UnlinkedEndpointException;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.api.routing.PathAlgorithm;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.model.Location;
import org.geolink.spatial.network.NetworkBatch;
import org.geolink.spatial.network.RoadNetworkBuilder;
import org.geolink.spatial.source.InMemoryFeatureSource;
import org.geolink.spatial.store.GraphWriter;
import org.geolink.spatial.store.InMemoryGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RoutingServiceTest {

	private final InMemoryFeatureSource catalog = new InMemoryFeatureSource();
	private final InMemoryGraphStore store = new InMemoryGraphStore();
	private final RoutingService routing = new RoutingService(store, new RouteResolver(store));
	private final Location p = Location.of("P", 0.001, 0.0005);
	private final Location q = Location.of("Q", -0.001, 0.0095);
	private BatchExecutor executor;

	@BeforeEach
	public void setUp() {
		executor = new BatchExecutor(2);
		catalog.add(connector("A", 0.0, 0.0))
				.add(connector("B", 0.0, 0.01))
				.add(segment("AB", "primary", "Main Street", null, List.of("A", "B"),
						new double[]{0, 0}, new double[]{0, 0.01}));
		load(new NetworkBatch(List.of(p, q), "paris", 2.0, List.of()));
	}

	@AfterEach
	public void tearDown() {
		executor.close();
	}

	private void load(NetworkBatch batch) {
		new RoadNetworkBuilder(catalog, new GraphWriter(store), executor, 5000).load(batch);
	}

	@Test
	public void shouldRouteBetweenLinkedPoints() {
		for (PathAlgorithm algorithm : PathAlgorithm.values()) {
			RouteResponse response = routing.route(new RouteQuery(p.ref(), q.ref(), algorithm));
			assertTrue(response.found());
			assertEquals(2, response.intersectionCount());
			assertThat(response.distanceMeters(), closeTo(1111.95, 0.01));
			assertArrayEquals(new double[]{0.0, 0.0}, response.route().get(0));
			assertArrayEquals(new double[]{0.0, 0.01}, response.route().get(1));
			assertEquals("Route found with 2 intersections", response.message());
		}
	}

	@Test
	public void shouldDefaultToDijkstra() {
		RouteQuery query = RouteQuery.of(p.ref(), q.ref(), "something else");
		assertEquals(PathAlgorithm.DIJKSTRA, query.algorithm());
		assertEquals(PathAlgorithm.ASTAR, RouteQuery.of(p.ref(), q.ref(), "AStar").algorithm());
		assertEquals(PathAlgorithm.DIJKSTRA, new RouteQuery(p.ref(), q.ref(), null).algorithm());
	}

	@Test
	public void shouldReturnSingleIntersectionForPointsSharingIt() {
		Location near = Location.of("P2", 0.0002, 0.0001);
		load(new NetworkBatch(List.of(near), "paris", 2.0, List.of()));
		RouteResponse response = routing.route(new RouteQuery(p.ref(), near.ref(), PathAlgorithm.ASTAR));
		assertTrue(response.found());
		assertEquals(1, response.intersectionCount());
		assertEquals(0.0, response.distanceMeters());
	}

	@Test
	public void shouldReportDisconnectedNetworks() {
		catalog.add(connector("C", 0.5, 0.5))
				.add(connector("D", 0.5, 0.51))
				.add(segment("CD", "primary", null, null, List.of("C", "D"),
						new double[]{0.5, 0.5}, new double[]{0.5, 0.51}));
		Location far = Location.of("F", 0.5, 0.505);
		load(new NetworkBatch(List.of(far), "elsewhere", 1.0, List.of()));

		RouteResponse response = routing.route(new RouteQuery(p.ref(), far.ref(), PathAlgorithm.DIJKSTRA));
		assertFalse(response.found());
		assertTrue(response.route().isEmpty());
		assertEquals(0.0, response.distanceMeters());
		assertEquals(0, response.intersectionCount());
		assertEquals("No path found between the specified locations. The road network may be incomplete.",
				response.message());
	}

	@Test
	public void shouldRejectUnlinkedEndpoints() {
		Location unlinked = Location.of("U", 1.0, 1.0);
		new GraphWriter(store).merge(unlinked);
		UnlinkedEndpointException e = assertThrows(UnlinkedEndpointException.class,
				() -> routing.route(new RouteQuery(p.ref(), unlinked.ref(), PathAlgorithm.DIJKSTRA)));
		assertEquals(unlinked.ref(), e.getEndpoint());

		NodeRef missing = new NodeRef(Location.LABEL, Location.KEY, "missing");
		assertThrows(UnlinkedEndpointException.class,
				() -> routing.route(new RouteQuery(missing, q.ref(), PathAlgorithm.DIJKSTRA)));
	}

	@Test
	public void shouldReportNetworkStatusPerRegion() {
		NetworkStatus paris = routing.networkStatus("paris");
		assertEquals(2, paris.intersectionCount());
		assertEquals(1, paris.segmentCount());
		assertEquals(2, paris.linkedPointCount());
		assertTrue(paris.hasNetwork());

		NetworkStatus unknown = routing.networkStatus("nowhere");
		assertFalse(unknown.hasNetwork());
		assertEquals(0, unknown.linkedPointCount());
	}

	@Test
	public void shouldSkipSegmentsWithoutUsableLength() {
		store.upsertNode("Intersection", "intersection_id", "X", Map.of("latitude", 0.0, "longitude", 0.02));
		store.upsertEdge("ROAD_SEGMENT", GraphStoreRoutingGraph.intersection("B"),
				GraphStoreRoutingGraph.intersection("X"), Map.of("length", -5.0));
		store.upsertNode("Intersection", "intersection_id", "Y", Map.of("latitude", 0.0, "longitude", 0.03));
		store.upsertEdge("ROAD_SEGMENT", GraphStoreRoutingGraph.intersection("B"),
				GraphStoreRoutingGraph.intersection("Y"), Map.of("length", Double.NaN));
		GraphStoreRoutingGraph graph = new GraphStoreRoutingGraph(store);
		assertEquals(List.of("A"), graph.arcs("B").stream().map(RoutingGraph.Arc::target).toList());
	}

	@Test
	public void shouldKeepZeroLengthSegments() {
		store.upsertNode("Intersection", "intersection_id", "X", Map.of("latitude", 0.0, "longitude", 0.01));
		store.upsertEdge("ROAD_SEGMENT", GraphStoreRoutingGraph.intersection("B"),
				GraphStoreRoutingGraph.intersection("X"), Map.of("length", 0.0));
		GraphStoreRoutingGraph graph = new GraphStoreRoutingGraph(store);
		assertEquals(List.of("A", "X"), graph.arcs("B").stream().map(RoutingGraph.Arc::target).sorted().toList());
		assertEquals(List.of(new RoutingGraph.Arc("B", 0.0)), graph.arcs("X"));
	}
}
