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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.GeometryParseException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;

/**
 * A feature catalog backed by GeoJSON FeatureCollection files, one per kind, named after the kind in lower case
 * ({@code building.geojson}, {@code road_segment.geojson}, ...). Kinds without a file have no features.
 * <p>
 * Features are validated when the file is read: a feature whose geometry cannot be parsed, or whose properties
 * violate the schema of its kind, is logged and left out. The rest of the file is still loaded.
 * <p>
 * Overture style segment connectors, given as objects with a {@code connector_id}, are reduced to their ids, and a
 * {@code road.class} property is read as {@code road_class}.
 */
public class GeoJsonFeatureSource implements FeatureSource {

	private static final Logger LOGGER = Logger.getLogger(GeoJsonFeatureSource.class.getName());

	public static final String EXTENSION = ".geojson";

	private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final GeoJsonReader geoJsonReader = new GeoJsonReader(GeometryMatcher.WGS84);
	private final InMemoryFeatureSource features = new InMemoryFeatureSource();
	private int skipped;

	public GeoJsonFeatureSource(Path directory) {
		if (!Files.isDirectory(directory)) {
			throw new ConfigurationException("GeoJSON feature directory does not exist: " + directory);
		}
		for (FeatureKind kind : FeatureKind.values()) {
			Path file = directory.resolve(fileName(kind));
			if (!Files.isRegularFile(file)) {
				LOGGER.fine("No " + kind + " features at " + file);
				continue;
			}
			try (InputStream in = Files.newInputStream(file)) {
				load(kind, in);
			} catch (IOException e) {
				throw new ConfigurationException("Failed to read GeoJSON features from " + file, e);
			}
		}
	}

	public static String fileName(FeatureKind kind) {
		return kind.name().toLowerCase(Locale.ROOT) + EXTENSION;
	}

	/**
	 * Reads one FeatureCollection of the given kind, adding every valid feature to this catalog.
	 *
	 * @return the number of features added
	 */
	public int load(FeatureKind kind, InputStream in) throws IOException {
		JsonNode root = objectMapper.readTree(in);
		if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
			throw new IOException("Expected a GeoJSON FeatureCollection of " + kind);
		}
		int added = 0;
		for (JsonNode node : root.path("features")) {
			try {
				features.add(toFeature(kind, node));
				added++;
			} catch (GeometryParseException e) {
				skipped++;
				LOGGER.warning("Skipping " + kind + " feature " + e.getFeatureId() + ": " + e.getMessage());
			}
		}
		LOGGER.info("Loaded " + added + " " + kind + " features");
		return added;
	}

	public int getSkipped() {
		return skipped;
	}

	private Feature toFeature(FeatureKind kind, JsonNode node) {
		Map<String, Object> properties = node.hasNonNull("properties")
				? objectMapper.convertValue(node.get("properties"), PROPERTIES_TYPE)
				: new LinkedHashMap<>();
		String id = node.hasNonNull("id") ? node.get("id").asText() : stringOrNull(properties.remove("id"));
		properties.remove("id");
		if (!node.hasNonNull("geometry")) {
			throw new GeometryParseException(String.valueOf(id), "feature has no geometry");
		}
		Geometry geometry;
		try {
			geometry = geoJsonReader.read(node.get("geometry").toString());
		} catch (ParseException | RuntimeException e) {
			throw new GeometryParseException(String.valueOf(id), "unreadable geometry: " + e.getMessage(), e);
		}
		if (kind == FeatureKind.ROAD_SEGMENT) {
			normalizeSegment(properties);
		}
		return new Feature(id, kind, geometry, properties);
	}

	private static void normalizeSegment(Map<String, Object> properties) {
		if (properties.get("connectors") instanceof List<?> connectors) {
			List<Object> ids = new ArrayList<>();
			for (Object connector : connectors) {
				if (connector instanceof Map<?, ?> reference && reference.get("connector_id") != null) {
					ids.add(reference.get("connector_id").toString());
				} else {
					ids.add(connector);
				}
			}
			properties.put("connectors", ids);
		}
		if (!properties.containsKey("road_class") && properties.get("road") instanceof Map<?, ?> road
				&& road.get("class") != null) {
			properties.put("road_class", road.get("class").toString());
		}
	}

	private static String stringOrNull(Object value) {
		return value == null ? null : value.toString();
	}

	@Override
	public List<Feature> query(FeatureKind kind, Envelope bbox, int limit) {
		return features.query(kind, bbox, limit);
	}
}
