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
package org.geolink.spatial.link;

import static org.geolink.spatial.testutils.Features.box;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.ProviderUnavailableException;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.api.graph.GraphNode;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.batch.Cancellation;
import org.geolink.spatial.config.GeolinkConfig;
import org.geolink.spatial.division.DivisionHierarchyResolver;
import org.geolink.spatial.model.Location;
import org.geolink.spatial.model.Place;
import org.geolink.spatial.source.InMemoryFeatureSource;
import org.geolink.spatial.store.GraphWriter;
import org.geolink.spatial.store.InMemoryGraphStore;
import org.geolink.spatial.testutils.Features;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SpatialLinkerTest {

	private final InMemoryFeatureSource catalog = new InMemoryFeatureSource();
	private final InMemoryGraphStore store = new InMemoryGraphStore();
	private final GraphWriter writer = new GraphWriter(store);
	private final GeolinkConfig config = GeolinkConfig.defaults();
	private BatchExecutor executor;

	@BeforeEach
	public void setUp() {
		executor = new BatchExecutor(2);
		catalog.add(Features.building("b1", box(0, 0, 0.001, 0.001), "residential"));
		catalog.add(Features.segment("s1", "primary", "Rue de Rivoli", null, List.of("a", "b"),
				new double[]{0, 0}, new double[]{0, 0.01}));
		catalog.add(Features.address("addr-1", 0.0005, 0.0005, "12", "Rue de Rivoli"));
		catalog.add(Features.division("paris", "locality", "Paris", box(-1, -1, 1, 1)));
	}

	@AfterEach
	public void tearDown() {
		executor.close();
	}

	private SpatialLinker linker(FeatureSource source) {
		DivisionHierarchyResolver divisions = new DivisionHierarchyResolver(source, writer, config);
		return new SpatialLinker(ResolverRegistry.standard(source, writer, config, divisions), writer, executor);
	}

	@Test
	public void shouldLinkContainingBuilding() {
		Location location = Location.of("loc-1", 0.0005, 0.0005);
		List<Resolution> results = linker(catalog).link(List.of(location), Set.of(ResolverKind.BUILDING));
		assertEquals(1, results.size());
		assertTrue(results.get(0).isLinked());
		GraphNode building = store.findRelated(location.ref(), GraphRelationships.LOCATED_IN.name()).orElseThrow();
		assertEquals("b1", building.getProperty("gers_id"));
		assertEquals("Building (residential)", building.getProperty("name"));
		assertTrue(store.findNode(location.ref()).isPresent());
	}

	@Test
	public void shouldFallBackToNearestBuilding() {
		Location outside = Location.of("loc-2", 0.0012, 0.0005);
		Location farAway = Location.of("loc-3", 0.5, 0.5);
		List<Resolution> results = linker(catalog).link(List.of(outside, farAway), Set.of(ResolverKind.BUILDING));
		assertEquals(ResolutionOutcome.LINKED, results.get(0).outcome());
		assertEquals(ResolutionOutcome.NO_CANDIDATE, results.get(1).outcome());
		assertFalse(results.get(1).retryable());
	}

	@Test
	public void shouldLinkNearestStreetAtSnappedPosition() {
		Location location = Location.of("loc-1", 0.0005, 0.005);
		List<Resolution> results = linker(catalog).link(List.of(location), Set.of(ResolverKind.STREET));
		assertTrue(results.get(0).isLinked());
		GraphNode street = store.findRelated(location.ref(), GraphRelationships.LOCATED_ON.name()).orElseThrow();
		assertEquals("Rue de Rivoli", street.getProperty("name"));
		assertThat(street.getDouble("latitude"), closeTo(0.0, 1e-12));
		assertThat(street.getDouble("longitude"), closeTo(0.005, 1e-12));
	}

	@Test
	public void shouldCanonicalizeAddressAndResolveItsDivisions() {
		Location location = Location.of("loc-1", 0.0006, 0.0005);
		List<Resolution> results = linker(catalog).link(List.of(location), Set.of(ResolverKind.ADDRESS));
		Resolution resolution = results.get(0);
		assertTrue(resolution.isLinked());
		NodeRef canonical = new NodeRef(Location.LABEL, Location.KEY, "addr-1");
		assertEquals(List.of(canonical, new NodeRef("Division", "gers_id", "paris")), resolution.linked());

		GraphNode same = store.findRelated(location.ref(), GraphRelationships.SAME_AS.name()).orElseThrow();
		assertEquals("12 Rue de Rivoli", same.getProperty("address"));
		assertEquals("75001", same.getProperty("zip"));
		assertTrue(store.findRelated(canonical, GraphRelationships.WITHIN_DIVISION.name()).isPresent());
	}

	@Test
	public void shouldNotMatchAddressBeyondMatchDistance() {
		Location location = Location.of("loc-1", 0.0008, 0.0005);
		Resolution resolution = linker(catalog).link(List.of(location), Set.of(ResolverKind.ADDRESS)).get(0);
		assertEquals(ResolutionOutcome.NO_CANDIDATE, resolution.outcome());
		assertEquals(0, store.countRelationships(GraphRelationships.SAME_AS.name(), null, null));
	}

	@Test
	public void shouldLinkPlaceToItsAddress() {
		Place place = Place.of("place-1", "Cafe", 0.0005, 0.0006);
		List<Resolution> results = linker(catalog).link(List.of(place),
				EnumSet.of(ResolverKind.ADDRESS, ResolverKind.PLACE_ADDRESS));
		assertEquals(ResolutionOutcome.NOT_APPLICABLE, results.get(0).outcome());
		assertEquals(ResolutionOutcome.LINKED, results.get(1).outcome());
		assertEquals("addr-1", store.findRelated(place.ref(), GraphRelationships.HAS_ADDRESS.name()).orElseThrow()
				.getProperty(Location.KEY));
	}

	@Test
	public void shouldIsolateFailuresPerResolution() {
		FeatureSource flaky = (kind, bbox, limit) -> {
			if (kind == FeatureKind.BUILDING) {
				throw new ProviderUnavailableException("building catalog is down");
			}
			return catalog.query(kind, bbox, limit);
		};
		Location location = Location.of("loc-1", 0.0005, 0.005);
		List<Resolution> results = linker(flaky).link(List.of(location),
				EnumSet.of(ResolverKind.STREET, ResolverKind.BUILDING));
		assertEquals(ResolverKind.BUILDING, results.get(0).kind());
		assertEquals(ResolutionOutcome.FAILED, results.get(0).outcome());
		assertTrue(results.get(0).retryable());
		assertEquals(ResolverKind.STREET, results.get(1).kind());
		assertTrue(results.get(1).isLinked());
	}

	@Test
	public void shouldReportMissingCoordinatesWithoutWriting() {
		Location nowhere = new Location("nowhere", "1 Main Street", null, null, null, null, null, null);
		List<Resolution> results = linker(catalog).link(List.of(nowhere),
				EnumSet.of(ResolverKind.BUILDING, ResolverKind.DIVISIONS));
		assertEquals(2, results.size());
		results.forEach(r -> assertEquals(ResolutionOutcome.MISSING_COORDINATES, r.outcome()));
		assertEquals(0, store.nodeCount());
	}

	@Test
	public void shouldNotRunResolutionsOfCancelledBatch() {
		Cancellation cancellation = Cancellation.create();
		cancellation.cancel();
		List<Resolution> results = linker(catalog).link(
				List.of(Location.of("loc-1", 0.0005, 0.0005), Location.of("loc-2", 0.0005, 0.005)),
				EnumSet.of(ResolverKind.BUILDING, ResolverKind.STREET), cancellation);
		assertEquals(4, results.size());
		results.forEach(r -> assertEquals(ResolutionOutcome.CANCELLED, r.outcome()));
		assertEquals(0, store.nodeCount());
	}

	@Test
	public void shouldBeIdempotent() {
		Location location = Location.of("loc-1", 0.0006, 0.0005);
		Set<ResolverKind> kinds = EnumSet.allOf(ResolverKind.class);
		linker(catalog).link(List.of(location), kinds);
		int nodes = store.nodeCount();
		int edges = store.edgeCount();
		linker(catalog).link(List.of(location), kinds);
		assertEquals(nodes, store.nodeCount());
		assertEquals(edges, store.edgeCount());
	}

	@Test
	public void shouldRejectUnregisteredAndDuplicateResolvers() {
		ResolverRegistry registry = new ResolverRegistry()
				.register(new StreetResolver(catalog, writer, 1.0, 10));
		SpatialLinker linker = new SpatialLinker(registry, writer, executor);
		assertThrows(ConfigurationException.class,
				() -> linker.link(List.of(Location.of("loc-1", 0, 0)), Set.of(ResolverKind.BUILDING)));
		assertThrows(ConfigurationException.class,
				() -> registry.register(new StreetResolver(catalog, writer, 2.0, 10)));
		assertEquals(Set.of(ResolverKind.STREET), registry.getKinds());
	}
}
