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
package org.geolink.spatial.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;
import org.geolink.spatial.api.ConfigurationException;

/**
 * Thresholds, limits and timeouts of the resolution engine.
 * <p>
 * Values are read from the {@code geolink.properties} classpath resource, overridden by JVM system properties of
 * the same name, overridden by the properties handed to {@link #load(Properties)}. Distances are in degrees unless
 * the key says otherwise.
 */
public final class GeolinkConfig {

	private static final Logger LOGGER = Logger.getLogger(GeolinkConfig.class.getName());

	public static final String RESOURCE = "geolink.properties";
	public static final String PREFIX = "geolink.";

	public static final String BUILDING_BUFFER = "geolink.building.buffer";
	public static final String BUILDING_MAX_DISTANCE = "geolink.building.maxDistance";
	public static final String BUILDING_LIMIT = "geolink.building.limit";
	public static final String STREET_RADIUS_KM = "geolink.street.radiusKm";
	public static final String STREET_LIMIT = "geolink.street.limit";
	public static final String ADDRESS_BUFFER = "geolink.address.buffer";
	public static final String ADDRESS_MAX_DISTANCE = "geolink.address.maxDistance";
	public static final String ADDRESS_LIMIT = "geolink.address.limit";
	public static final String DIVISION_BUFFER = "geolink.division.buffer";
	public static final String DIVISION_LIMIT = "geolink.division.limit";
	public static final String DIVISION_HIERARCHY = "geolink.division.hierarchy";
	public static final String NETWORK_RADIUS_KM = "geolink.network.radiusKm";
	public static final String NETWORK_ROAD_CLASSES = "geolink.network.roadClasses";
	public static final String NETWORK_LIMIT = "geolink.network.limit";
	public static final String PLACES_RADIUS_KM = "geolink.places.radiusKm";
	public static final String PLACES_LIMIT = "geolink.places.limit";
	public static final String SOURCE_TIMEOUT_MS = "geolink.source.timeoutMs";
	public static final String STORE_TIMEOUT_MS = "geolink.store.timeoutMs";
	public static final String PARALLELISM = "geolink.parallelism";

	public static final double MIN_NETWORK_RADIUS_KM = 0.5;
	public static final double MAX_NETWORK_RADIUS_KM = 10.0;

	private final Properties properties;

	private GeolinkConfig(Properties properties) {
		this.properties = properties;
		validate();
	}

	/**
	 * The built-in defaults only, ignoring the classpath resource and system properties.
	 */
	public static GeolinkConfig defaults() {
		return new GeolinkConfig(defaultProperties());
	}

	public static GeolinkConfig load() {
		return load(new Properties());
	}

	public static GeolinkConfig load(Properties overrides) {
		Properties merged = defaultProperties();
		try (InputStream in = GeolinkConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in != null) {
				Properties resource = new Properties();
				resource.load(in);
				merged.putAll(resource);
			} else {
				LOGGER.fine("No " + RESOURCE + " on the classpath, using defaults");
			}
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read " + RESOURCE, e);
		}
		for (String name : System.getProperties().stringPropertyNames()) {
			if (name.startsWith(PREFIX)) {
				merged.setProperty(name, System.getProperty(name));
			}
		}
		if (overrides != null) {
			for (String name : overrides.stringPropertyNames()) {
				merged.setProperty(name, overrides.getProperty(name));
			}
		}
		return new GeolinkConfig(merged);
	}

	/**
	 * A copy of this configuration with one value replaced.
	 */
	public GeolinkConfig with(String key, Object value) {
		Properties copy = new Properties();
		copy.putAll(properties);
		copy.setProperty(key, String.valueOf(value));
		return new GeolinkConfig(copy);
	}

	private static Properties defaultProperties() {
		Properties defaults = new Properties();
		defaults.setProperty(BUILDING_BUFFER, "0.0005");
		defaults.setProperty(BUILDING_MAX_DISTANCE, "0.002");
		defaults.setProperty(BUILDING_LIMIT, "50");
		defaults.setProperty(STREET_RADIUS_KM, "1.0");
		defaults.setProperty(STREET_LIMIT, "100");
		defaults.setProperty(ADDRESS_BUFFER, "0.0005");
		defaults.setProperty(ADDRESS_MAX_DISTANCE, "0.0002");
		defaults.setProperty(ADDRESS_LIMIT, "20");
		defaults.setProperty(DIVISION_BUFFER, "0.05");
		defaults.setProperty(DIVISION_LIMIT, "50");
		defaults.setProperty(DIVISION_HIERARCHY, "locality,county,region,country");
		defaults.setProperty(NETWORK_RADIUS_KM, "2.0");
		defaults.setProperty(NETWORK_ROAD_CLASSES, "");
		defaults.setProperty(NETWORK_LIMIT, "5000");
		defaults.setProperty(PLACES_RADIUS_KM, "1.0");
		defaults.setProperty(PLACES_LIMIT, "25");
		defaults.setProperty(SOURCE_TIMEOUT_MS, "30000");
		defaults.setProperty(STORE_TIMEOUT_MS, "10000");
		defaults.setProperty(PARALLELISM, String.valueOf(Runtime.getRuntime().availableProcessors()));
		return defaults;
	}

	private void validate() {
		positive(BUILDING_BUFFER);
		positive(BUILDING_MAX_DISTANCE);
		positive(STREET_RADIUS_KM);
		positive(ADDRESS_BUFFER);
		positive(ADDRESS_MAX_DISTANCE);
		positive(DIVISION_BUFFER);
		positive(PLACES_RADIUS_KM);
		positive(SOURCE_TIMEOUT_MS);
		positive(STORE_TIMEOUT_MS);
		for (String key : List.of(BUILDING_LIMIT, STREET_LIMIT, ADDRESS_LIMIT, DIVISION_LIMIT, NETWORK_LIMIT,
				PLACES_LIMIT, PARALLELISM)) {
			if (getInt(key) < 1) {
				throw new ConfigurationException(key + " must be at least 1 but was " + getInt(key));
			}
		}
		double radius = getDouble(NETWORK_RADIUS_KM);
		if (radius < MIN_NETWORK_RADIUS_KM || radius > MAX_NETWORK_RADIUS_KM) {
			throw new ConfigurationException(NETWORK_RADIUS_KM + " must be between " + MIN_NETWORK_RADIUS_KM
					+ " and " + MAX_NETWORK_RADIUS_KM + " km but was " + radius);
		}
		if (getDivisionHierarchy().isEmpty()) {
			throw new ConfigurationException(DIVISION_HIERARCHY + " must name at least one division subtype");
		}
	}

	private void positive(String key) {
		double value = getDouble(key);
		if (!(value > 0)) {
			throw new ConfigurationException(key + " must be positive but was " + value);
		}
	}

	public String getString(String key) {
		String value = properties.getProperty(key);
		return value == null ? null : value.trim();
	}

	public double getDouble(String key) {
		String value = getString(key);
		try {
			return Double.parseDouble(value);
		} catch (NullPointerException | NumberFormatException e) {
			throw new ConfigurationException("Invalid number for " + key + ": '" + value + "'", e);
		}
	}

	public int getInt(String key) {
		String value = getString(key);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid integer for " + key + ": '" + value + "'", e);
		}
	}

	public long getLong(String key) {
		String value = getString(key);
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid integer for " + key + ": '" + value + "'", e);
		}
	}

	public List<String> getList(String key) {
		String value = getString(key);
		List<String> result = new ArrayList<>();
		if (value == null || value.isEmpty()) {
			return result;
		}
		Arrays.stream(value.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.forEach(result::add);
		return result;
	}

	public double getBuildingBuffer() {
		return getDouble(BUILDING_BUFFER);
	}

	public double getBuildingMaxDistance() {
		return getDouble(BUILDING_MAX_DISTANCE);
	}

	public int getBuildingLimit() {
		return getInt(BUILDING_LIMIT);
	}

	public double getStreetRadiusKm() {
		return getDouble(STREET_RADIUS_KM);
	}

	public int getStreetLimit() {
		return getInt(STREET_LIMIT);
	}

	public double getAddressBuffer() {
		return getDouble(ADDRESS_BUFFER);
	}

	public double getAddressMaxDistance() {
		return getDouble(ADDRESS_MAX_DISTANCE);
	}

	public int getAddressLimit() {
		return getInt(ADDRESS_LIMIT);
	}

	public double getDivisionBuffer() {
		return getDouble(DIVISION_BUFFER);
	}

	public int getDivisionLimit() {
		return getInt(DIVISION_LIMIT);
	}

	/**
	 * Division subtypes, smallest first.
	 */
	public List<String> getDivisionHierarchy() {
		List<String> hierarchy = new ArrayList<>();
		for (String subtype : getList(DIVISION_HIERARCHY)) {
			hierarchy.add(subtype.toLowerCase(Locale.ROOT));
		}
		return hierarchy;
	}

	public double getNetworkRadiusKm() {
		return getDouble(NETWORK_RADIUS_KM);
	}

	public List<String> getNetworkRoadClasses() {
		return getList(NETWORK_ROAD_CLASSES);
	}

	public int getNetworkLimit() {
		return getInt(NETWORK_LIMIT);
	}

	public double getPlacesRadiusKm() {
		return getDouble(PLACES_RADIUS_KM);
	}

	public int getPlacesLimit() {
		return getInt(PLACES_LIMIT);
	}

	public long getSourceTimeoutMs() {
		return getLong(SOURCE_TIMEOUT_MS);
	}

	public long getStoreTimeoutMs() {
		return getLong(STORE_TIMEOUT_MS);
	}

	public int getParallelism() {
		return getInt(PARALLELISM);
	}

	@Override
	public String toString() {
		return "GeolinkConfig" + properties;
	}
}
