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
package org.geolink.spatial.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineString;

public class GeoJsonFeatureSourceTest {

	private static final Envelope WORLD = new Envelope(-180, 180, -90, 90);

	@TempDir
	Path directory;

	@Test
	public void shouldLoadFeaturesPerKindAndSkipMalformedOnes() throws IOException {
		write(FeatureKind.ROAD_SEGMENT, """
				{"type": "FeatureCollection", "features": [
				  {"type": "Feature", "id": "s1",
				   "geometry": {"type": "LineString", "coordinates": [[0.0, 0.0], [0.01, 0.0]]},
				   "properties": {"connectors": [{"connector_id": "a", "at": 0.0}, {"connector_id": "b", "at": 1.0}],
				                  "road": {"class": "primary"}, "names": {"primary": "Main Street"}}},
				  {"type": "Feature", "id": "s2",
				   "geometry": {"type": "LineString", "coordinates": [[0.0, 0.0], [0.01, 0.0]]},
				   "properties": {"road_class": "primary"}},
				  {"type": "Feature", "id": "s3", "geometry": {"type": "Nonsense"}, "properties": {"connectors": []}}
				]}
				""");
		write(FeatureKind.ROAD_CONNECTOR, """
				{"type": "FeatureCollection", "features": [
				  {"type": "Feature", "geometry": {"type": "Point", "coordinates": [0.0, 0.0]},
				   "properties": {"id": "a"}}
				]}
				""");

		GeoJsonFeatureSource source = new GeoJsonFeatureSource(directory);

		List<Feature> segments = source.query(FeatureKind.ROAD_SEGMENT, WORLD, 10);
		assertEquals(1, segments.size());
		Feature segment = segments.get(0);
		assertEquals("s1", segment.getId());
		assertEquals(List.of("a", "b"), segment.getStringList("connectors"));
		assertEquals("primary", segment.getString("road_class"));
		assertEquals("Main Street", segment.getPrimaryName());
		assertTrue(segment.getGeometry() instanceof LineString);
		assertEquals(2, source.getSkipped());

		List<Feature> connectors = source.query(FeatureKind.ROAD_CONNECTOR, WORLD, 10);
		assertEquals("a", connectors.get(0).getId());
		assertTrue(source.query(FeatureKind.BUILDING, WORLD, 10).isEmpty());
	}

	@Test
	public void shouldRejectMissingDirectory() {
		assertThrows(ConfigurationException.class, () -> new GeoJsonFeatureSource(directory.resolve("missing")));
	}

	@Test
	public void shouldRejectFileThatIsNotAFeatureCollection() throws IOException {
		write(FeatureKind.BUILDING, "{\"type\": \"Feature\"}");
		assertThrows(ConfigurationException.class, () -> new GeoJsonFeatureSource(directory));
	}

	private void write(FeatureKind kind, String json) throws IOException {
		Files.writeString(directory.resolve(GeoJsonFeatureSource.fileName(kind)), json, StandardCharsets.UTF_8);
	}
}
