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
package org.geolink.spatial.geometry;

import static org.geolink.spatial.testutils.Features.box;
import static org.geolink.spatial.testutils.Features.building;
import static org.geolink.spatial.testutils.Features.connector;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.testutils.Features;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Point;

public class GeometryMatcherTest {

	private final Point origin = GeometryMatcher.point(0.0, 0.0);

	@Test
	public void shouldFindContainingPolygonAndNeverDisjointOne() {
		Feature disjoint = building("disjoint", box(1.0, 1.0, 2.0, 2.0), null);
		Feature inside = building("inside", box(-1.0, -1.0, 1.0, 1.0), null);
		assertEquals("inside", GeometryMatcher.containing(origin, List.of(disjoint, inside)).orElseThrow().getId());
		assertTrue(GeometryMatcher.containing(origin, List.of(disjoint)).isEmpty());
	}

	@Test
	public void shouldReturnFirstContainingCandidateInInputOrder() {
		Feature outer = building("outer", box(-2.0, -2.0, 2.0, 2.0), null);
		Feature inner = building("inner", box(-1.0, -1.0, 1.0, 1.0), null);
		assertEquals("outer", GeometryMatcher.containing(origin, List.of(outer, inner)).orElseThrow().getId());
		assertEquals("inner", GeometryMatcher.containing(origin, List.of(inner, outer)).orElseThrow().getId());
	}

	@Test
	public void shouldIgnoreNonPolygonalCandidatesForContainment() {
		Feature samePoint = connector("c", 0.0, 0.0);
		assertTrue(GeometryMatcher.containing(origin, List.of(samePoint)).isEmpty());
	}

	@Test
	public void shouldFindNearestWithinThreshold() {
		Feature far = connector("far", 0.0, 0.5);
		Feature near = connector("near", 0.0, 0.25);
		Optional<Match<Feature>> match = GeometryMatcher.nearest(origin, List.of(far, near), 0.3);
		assertTrue(match.isPresent());
		assertEquals("near", match.get().candidate().getId());
		assertThat(match.get().distance(), closeTo(0.25, 1e-12));
	}

	@Test
	public void shouldRejectCandidateBeyondThreshold() {
		Feature far = connector("far", 0.0, 0.5);
		assertTrue(GeometryMatcher.nearest(origin, List.of(far), 0.25).isEmpty());
	}

	@Test
	public void shouldRejectCandidateExactlyAtThreshold() {
		Feature edge = connector("edge", 0.0, 0.5);
		assertTrue(GeometryMatcher.nearest(origin, List.of(edge), 0.5).isEmpty());
		assertTrue(GeometryMatcher.nearest(origin, List.of(edge), 0.5000001).isPresent());
	}

	@Test
	public void shouldReturnNothingForNoCandidates() {
		assertTrue(GeometryMatcher.nearest(origin, List.of(), Double.POSITIVE_INFINITY).isEmpty());
		assertTrue(GeometryMatcher.containing(origin, List.of()).isEmpty());
	}

	@Test
	public void shouldKeepEarliestOfEquallyNearCandidates() {
		Feature east = connector("east", 0.0, 0.25);
		Feature west = connector("west", 0.0, -0.25);
		assertEquals("east", GeometryMatcher.nearest(origin, List.of(east, west), 1.0).orElseThrow().candidate()
				.getId());
		assertEquals("west", GeometryMatcher.nearest(origin, List.of(west, east), 1.0).orElseThrow().candidate()
				.getId());
	}

	@Test
	public void shouldPreferContainmentOverNearerFallback() {
		Feature container = building("container", box(-1.0, -1.0, 1.0, 1.0), null);
		Feature nearby = building("nearby", box(0.0, 1.5, 0.1, 1.6), null);
		Optional<Match<Feature>> match = GeometryMatcher.containingOrNearest(origin, List.of(nearby, container),
				0.002);
		assertEquals("container", match.orElseThrow().candidate().getId());
		assertThat(match.get().distance(), equalTo(0.0));
	}

	@Test
	public void shouldListAllContainingCandidates() {
		Feature outer = building("outer", box(-2.0, -2.0, 2.0, 2.0), null);
		Feature disjoint = building("disjoint", box(3.0, 3.0, 4.0, 4.0), null);
		Feature inner = building("inner", box(-1.0, -1.0, 1.0, 1.0), null);
		List<Feature> found = GeometryMatcher.allContaining(origin, List.of(outer, disjoint, inner));
		assertEquals(List.of("outer", "inner"), found.stream().map(Feature::getId).toList());
	}

	@Test
	public void shouldComputeCentroidAndSnappedPoint() {
		Coordinate centroid = GeometryMatcher.centroid(box(0.0, 0.0, 2.0, 4.0));
		assertThat(centroid.y, closeTo(1.0, 1e-12));
		assertThat(centroid.x, closeTo(2.0, 1e-12));
		Coordinate pointItself = GeometryMatcher.centroid(Features.point(3.0, 5.0));
		assertThat(pointItself.x, equalTo(5.0));

		Feature road = Features.segment("s", "primary", null, null, List.of("a", "b"),
				new double[]{1.0, -1.0}, new double[]{1.0, 1.0});
		Coordinate snapped = GeometryMatcher.nearestPointOn(road.getGeometry(), origin);
		assertThat(snapped.y, closeTo(1.0, 1e-12));
		assertThat(snapped.x, closeTo(0.0, 1e-12));
		assertFalse(Double.isNaN(snapped.x));
	}
}
