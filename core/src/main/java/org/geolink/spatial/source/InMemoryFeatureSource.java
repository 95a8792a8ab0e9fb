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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.locationtech.jts.geom.Envelope;

/**
 * A feature catalog held in memory. Queries return the features of the requested kind whose envelope intersects
 * the window, in the order they were added.
 */
public class InMemoryFeatureSource implements FeatureSource {

	private final Map<FeatureKind, List<Feature>> features = new EnumMap<>(FeatureKind.class);

	public InMemoryFeatureSource() {
		for (FeatureKind kind : FeatureKind.values()) {
			features.put(kind, new CopyOnWriteArrayList<>());
		}
	}

	public InMemoryFeatureSource add(Feature feature) {
		features.get(feature.getKind()).add(feature);
		return this;
	}

	public InMemoryFeatureSource addAll(Collection<Feature> toAdd) {
		toAdd.forEach(this::add);
		return this;
	}

	public int size(FeatureKind kind) {
		return features.get(kind).size();
	}

	@Override
	public List<Feature> query(FeatureKind kind, Envelope bbox, int limit) {
		List<Feature> result = new ArrayList<>();
		for (Feature feature : features.get(kind)) {
			if (result.size() >= limit) {
				break;
			}
			if (bbox.intersects(feature.getGeometry().getEnvelopeInternal())) {
				result.add(feature);
			}
		}
		return result;
	}
}
