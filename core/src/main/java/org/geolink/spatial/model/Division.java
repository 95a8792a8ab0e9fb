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
package org.geolink.spatial.model;

import java.util.Locale;
import java.util.Map;
import org.geolink.spatial.api.feature.Feature;

/**
 * An administrative division such as a locality, county, region or country.
 */
public record Division(String gersId, String name, String subtype, String countryIso) implements GraphEntity {

	public static final String LABEL = "Division";
	public static final String KEY = "gers_id";
	public static final String UNKNOWN_NAME = "Unknown";

	public static Division fromFeature(Feature division) {
		String name = division.getPrimaryName();
		return new Division(division.getId(), name == null ? UNKNOWN_NAME : name,
				division.getString("subtype").toLowerCase(Locale.ROOT), division.getString("country_iso"));
	}

	@Override
	public String label() {
		return LABEL;
	}

	@Override
	public String keyField() {
		return KEY;
	}

	@Override
	public String key() {
		return gersId;
	}

	@Override
	public Map<String, Object> attributes() {
		return Attributes.of()
				.put("division_id", gersId)
				.put("name", name)
				.put("subtype", subtype)
				.put("country_iso", countryIso)
				.build();
	}
}
