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
package org.geolink.spatial.api.feature;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.geolink.spatial.api.GeometryParseException;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;

public class FeatureTest {

	private static final GeometryFactory FACTORY = new GeometryFactory();
	private static final Point ORIGIN = FACTORY.createPoint(new Coordinate(2.35, 48.85));

	@Test
	public void shouldAcceptAttributesMatchingTheSchema() {
		Feature building = new Feature("b1", FeatureKind.BUILDING, ORIGIN,
				Map.of("class", "residential", "height", 12.5, "num_floors", 4));
		assertEquals("residential", building.getString("class"));
		assertEquals(12.5, building.getDouble("height"));
		assertEquals(4, building.getInteger("num_floors"));
		assertEquals("BUILDING[b1]", building.toString());
	}

	@Test
	public void shouldRejectMissingRequiredAttribute() {
		GeometryParseException e = assertThrows(GeometryParseException.class,
				() -> new Feature("d1", FeatureKind.DIVISION, ORIGIN, Map.of("names", Map.of("primary", "Paris"))));
		assertEquals("d1", e.getFeatureId());
		assertTrue(e.getMessage().contains("subtype"), e.getMessage());
	}

	@Test
	public void shouldNameTheKindIndependentlyOfDefaultLocale() {
		Locale original = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
		try {
			GeometryParseException e = assertThrows(GeometryParseException.class,
					() -> new Feature("d1", FeatureKind.DIVISION, ORIGIN, Map.of()));
			assertTrue(e.getMessage().contains("missing required division attribute 'subtype'"), e.getMessage());
		} finally {
			Locale.setDefault(original);
		}
	}

	@Test
	public void shouldRejectAttributeOfWrongType() {
		assertThrows(GeometryParseException.class,
				() -> new Feature("b1", FeatureKind.BUILDING, ORIGIN, Map.of("height", "tall")));
	}

	@Test
	public void shouldRejectNonStringConnectors() {
		assertThrows(GeometryParseException.class,
				() -> new Feature("s1", FeatureKind.ROAD_SEGMENT, ORIGIN, Map.of("connectors", List.of(1, 2))));
	}

	@Test
	public void shouldRejectMissingOrEmptyGeometry() {
		assertThrows(GeometryParseException.class,
				() -> new Feature("c1", FeatureKind.ROAD_CONNECTOR, null, Map.of()));
		assertThrows(GeometryParseException.class,
				() -> new Feature("c1", FeatureKind.ROAD_CONNECTOR, FACTORY.createPoint(), Map.of()));
	}

	@Test
	public void shouldRejectBlankId() {
		assertThrows(GeometryParseException.class,
				() -> new Feature(" ", FeatureKind.ROAD_CONNECTOR, ORIGIN, Map.of()));
	}

	@Test
	public void shouldResolvePrimaryNameThenCommonName() {
		Feature primary = new Feature("p1", FeatureKind.PLACE, ORIGIN,
				Map.of("names", Map.of("primary", "Louvre", "common", List.of(Map.of("value", "Le Louvre")))));
		Feature common = new Feature("p2", FeatureKind.PLACE, ORIGIN,
				Map.of("names", Map.of("common", List.of(Map.of("value", "Le Louvre")))));
		Feature unnamed = new Feature("p3", FeatureKind.PLACE, ORIGIN, Map.of());
		assertEquals("Louvre", primary.getPrimaryName());
		assertEquals("Le Louvre", common.getPrimaryName());
		assertNull(unnamed.getPrimaryName());
	}

	@Test
	public void shouldKeepAttributesReadOnly() {
		Feature connector = new Feature("c1", FeatureKind.ROAD_CONNECTOR, ORIGIN, Map.of("extra", "x"));
		assertThrows(UnsupportedOperationException.class, () -> connector.getAttributes().put("extra", "y"));
	}
}
