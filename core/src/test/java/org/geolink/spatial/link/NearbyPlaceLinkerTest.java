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

import static org.geolink.spatial.testutils.Features.place;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.ProviderUnavailableException;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.batch.Cancellation;
import org.geolink.spatial.link.NearbyPlaceLinker.NearbyPlaces;
import org.geolink.spatial.model.IpAddress;
import org.geolink.spatial.model.Location;
import org.geolink.spatial.model.Place;
import org.geolink.spatial.source.InMemoryFeatureSource;
import org.geolink.spatial.store.GraphWriter;
import org.geolink.spatial.store.InMemoryGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class NearbyPlaceLinkerTest {

	private final InMemoryFeatureSource catalog = new InMemoryFeatureSource();
	private final InMemoryGraphStore store = new InMemoryGraphStore();
	private final GraphWriter writer = new GraphWriter(store);
	private final IpAddress ip = new IpAddress("192.0.2.1", 0.0, 0.0);
	private final Location location = Location.of("loc-1", 0.0, 0.005);
	private BatchExecutor executor;

	@BeforeEach
	public void setUp() {
		executor = new BatchExecutor(2);
		catalog.add(place("p1", 0.0, 0.001, "Le Petit Cafe", "cafe"));
		catalog.add(place("p2", 0.0, 0.0045, "Chez Marcel", "french_restaurant"));
		catalog.add(place("p3", 0.0, 0.003, "Louvre", "museum"));
	}

	@AfterEach
	public void tearDown() {
		executor.close();
	}

	@Test
	public void shouldLinkEachPlaceToNearestSubject() {
		NearbyPlaceLinker linker = new NearbyPlaceLinker(catalog, writer, executor, 1.0, 25);
		NearbyPlaces result = linker.link(List.of(ip, location), List.of("CAFE", "restaurant"),
				Cancellation.create());

		assertEquals(List.of("p1", "p2"), result.places().stream().map(Place::placeId).toList());
		assertEquals(0, result.failedQueries());
		assertEquals("p1", store.findRelated(ip.ref(), GraphRelationships.GEOLOCATES_NEAR.name()).orElseThrow()
				.getProperty(Place.KEY));
		assertEquals("p2", store.findRelated(location.ref(), GraphRelationships.HAS_NEARBY_PLACE.name())
				.orElseThrow().getProperty(Place.KEY));
		assertTrue(store.findNode(new Place("p3", null, null, null, null, null, null).ref()).isEmpty());
	}

	@Test
	public void shouldKeepAllCategoriesWhenNoneRequested() {
		NearbyPlaceLinker linker = new NearbyPlaceLinker(catalog, writer, executor, 1.0, 25);
		NearbyPlaces result = linker.link(List.of(ip, location), List.of(), Cancellation.create());
		assertEquals(3, result.places().size());
		assertEquals(3, store.countNodes(Place.LABEL, null, null));
	}

	@Test
	public void shouldCountFailedQueriesAndLinkTheRest() {
		FeatureSource flaky = (kind, bbox, limit) -> {
			if (bbox.centre().x > 0.0) {
				throw new ProviderUnavailableException("places catalog timed out");
			}
			return catalog.query(kind, bbox, limit);
		};
		NearbyPlaceLinker linker = new NearbyPlaceLinker(flaky, writer, executor, 1.0, 25);
		NearbyPlaces result = linker.link(List.of(ip, location), List.of("cafe"), Cancellation.create());
		assertEquals(1, result.failedQueries());
		assertEquals(List.of("p1"), result.places().stream().map(Place::placeId).toList());
	}

	@Test
	public void shouldLinkRemainingSubjectsWhenOneCannotBeStored() {
		InMemoryGraphStore failing = new InMemoryGraphStore() {
			@Override
			public void upsertNode(String label, String keyField, String keyValue, Map<String, Object> attributes) {
				if (IpAddress.LABEL.equals(label)) {
					throw new ProviderUnavailableException("graph store rejected " + keyValue);
				}
				super.upsertNode(label, keyField, keyValue, attributes);
			}
		};
		NearbyPlaceLinker linker = new NearbyPlaceLinker(catalog, new GraphWriter(failing), executor, 1.0, 25);
		NearbyPlaces result = linker.link(List.of(ip, location), List.of("cafe", "restaurant"),
				Cancellation.create());

		assertEquals(0, result.failedQueries());
		assertEquals(1, result.failedSubjects());
		assertEquals(List.of("p1", "p2"), result.places().stream().map(Place::placeId).toList());
		assertTrue(failing.findNode(ip.ref()).isEmpty());
		assertEquals(0, failing.countRelationships(GraphRelationships.GEOLOCATES_NEAR.name(), null, null));
		assertEquals(List.of("p1", "p2"),
				failing.expand(location.ref(), GraphRelationships.HAS_NEARBY_PLACE.name()).stream()
						.map(edge -> edge.neighbour().getProperty(Place.KEY)).toList());
	}

	@Test
	public void shouldCountUnexpectedSourceErrorsAsFailedQueries() {
		FeatureSource broken = (kind, bbox, limit) -> {
			if (bbox.centre().x > 0.0) {
				throw new IllegalStateException("malformed catalog row");
			}
			return catalog.query(kind, bbox, limit);
		};
		NearbyPlaceLinker linker = new NearbyPlaceLinker(broken, writer, executor, 1.0, 25);
		NearbyPlaces result = linker.link(List.of(ip, location), List.of("cafe"), Cancellation.create());
		assertEquals(1, result.failedQueries());
		assertEquals(List.of("p1"), result.places().stream().map(Place::placeId).toList());
		assertEquals("p1", store.findRelated(ip.ref(), GraphRelationships.GEOLOCATES_NEAR.name()).orElseThrow()
				.getProperty(Place.KEY));
	}

	@Test
	public void shouldWriteNothingForCancelledBatch() {
		Cancellation cancellation = Cancellation.create();
		cancellation.cancel();
		NearbyPlaceLinker linker = new NearbyPlaceLinker(catalog, writer, executor, 1.0, 25);
		NearbyPlaces result = linker.link(List.of(ip, location), List.of(), cancellation);
		assertTrue(result.places().isEmpty());
		assertEquals(2, result.failedQueries());
		assertEquals(0, store.countNodes(Place.LABEL, null, null));
	}
}
