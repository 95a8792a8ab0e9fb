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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.geolink.spatial.api.GeometryParseException;

/**
 * The kinds of feature a {@link org.geolink.spatial.api.FeatureSource} can deliver, each with the attribute schema
 * that features of that kind are validated against.
 */
public enum FeatureKind {

	PLACE(
			optional("names", Map.class),
			optional("category", String.class),
			optional("confidence", Number.class),
			optional("address", String.class)),
	BUILDING(
			optional("names", Map.class),
			optional("height", Number.class),
			optional("num_floors", Number.class),
			optional("class", String.class)),
	ADDRESS(
			optional("number", String.class),
			optional("street", String.class),
			optional("postcode", String.class)),
	DIVISION(
			required("subtype", String.class),
			optional("names", Map.class),
			optional("country_iso", String.class)),
	ROAD_SEGMENT(
			required("connectors", List.class),
			optional("road_class", String.class),
			optional("names", Map.class),
			optional("length_m", Number.class),
			optional("oneway", Boolean.class)),
	ROAD_CONNECTOR;

	public record AttributeRule(String name, Class<?> type, boolean required) {

	}

	private final List<AttributeRule> rules;

	FeatureKind(AttributeRule... rules) {
		this.rules = List.of(rules);
	}

	public List<AttributeRule> getRules() {
		return rules;
	}

	/**
	 * Checks the attributes of a feature against this kind's schema. Attributes not named by the schema are
	 * carried along untouched.
	 *
	 * @throws GeometryParseException if a required attribute is missing or an attribute has the wrong type
	 */
	public void validate(String featureId, Map<String, Object> attributes) {
		for (AttributeRule rule : rules) {
			Object value = attributes.get(rule.name());
			if (value == null) {
				if (rule.required()) {
					throw new GeometryParseException(featureId, "missing required " + name().toLowerCase(Locale.ROOT)
							+ " attribute '" + rule.name() + "'");
				}
				continue;
			}
			if (!rule.type().isInstance(value)) {
				throw new GeometryParseException(featureId,
						"attribute '" + rule.name() + "' should be " + rule.type().getSimpleName() + " but was "
								+ value.getClass().getSimpleName());
			}
		}
		if (this == ROAD_SEGMENT) {
			for (Object connector : (List<?>) attributes.get("connectors")) {
				if (!(connector instanceof String)) {
					throw new GeometryParseException(featureId, "connector references must be strings");
				}
			}
		}
	}

	private static AttributeRule required(String name, Class<?> type) {
		return new AttributeRule(name, type, true);
	}

	private static AttributeRule optional(String name, Class<?> type) {
		return new AttributeRule(name, type, false);
	}
}
