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
package org.geolink.spatial.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.geolink.spatial.api.SpatialResolutionException;

/**
 * Converts attribute values to types a property graph can store: strings, numbers, booleans and arrays of those.
 * Collections become arrays typed by their elements, and maps are stored as JSON text.
 */
public final class PropertyValues {

	private static final ObjectMapper JSON = new ObjectMapper();

	private PropertyValues() {
	}

	/**
	 * @return the storable attributes, leaving out the null ones
	 */
	public static Map<String, Object> normalize(Map<String, Object> attributes) {
		Map<String, Object> result = new LinkedHashMap<>();
		if (attributes == null) {
			return result;
		}
		attributes.forEach((key, value) -> {
			Object normalized = normalize(value);
			if (normalized != null) {
				result.put(key, normalized);
			}
		});
		return result;
	}

	public static Object normalize(Object value) {
		if (value == null || value instanceof String || value instanceof Boolean || value instanceof Long
				|| value instanceof Integer || value instanceof Double || value instanceof Float
				|| value instanceof Short || value instanceof Byte) {
			return value;
		}
		if (value instanceof BigInteger big) {
			return big.longValue();
		}
		if (value instanceof BigDecimal || value instanceof Number) {
			return ((Number) value).doubleValue();
		}
		if (value instanceof Enum<?> constant) {
			return constant.name();
		}
		if (value.getClass().isArray()) {
			return value;
		}
		if (value instanceof Collection<?> collection) {
			return toArray(collection);
		}
		if (value instanceof Map<?, ?> map) {
			try {
				return JSON.writeValueAsString(map);
			} catch (JsonProcessingException e) {
				throw new SpatialResolutionException("Cannot store map value " + map, e);
			}
		}
		return value.toString();
	}

	private static Object toArray(Collection<?> collection) {
		boolean allNumbers = !collection.isEmpty();
		boolean allIntegral = !collection.isEmpty();
		boolean allBooleans = !collection.isEmpty();
		for (Object element : collection) {
			allNumbers &= element instanceof Number;
			allIntegral &= element instanceof Long || element instanceof Integer || element instanceof Short;
			allBooleans &= element instanceof Boolean;
		}
		if (allIntegral) {
			return collection.stream().mapToLong(e -> ((Number) e).longValue()).toArray();
		}
		if (allNumbers) {
			return collection.stream().mapToDouble(e -> ((Number) e).doubleValue()).toArray();
		}
		if (allBooleans) {
			boolean[] result = new boolean[collection.size()];
			int i = 0;
			for (Object element : collection) {
				result[i++] = (Boolean) element;
			}
			return result;
		}
		return collection.stream().map(e -> e == null ? "" : e.toString()).toArray(String[]::new);
	}

	/**
	 * Equality that compares arrays by content.
	 */
	public static boolean sameValue(Object a, Object b) {
		return Objects.deepEquals(a, b);
	}
}
