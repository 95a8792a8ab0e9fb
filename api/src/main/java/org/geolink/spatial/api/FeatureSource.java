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
package org.geolink.spatial.api;

import java.util.List;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.locationtech.jts.geom.Envelope;

/**
 * A catalog of geographic features that can be queried by bounding box.
 */
public interface FeatureSource {

	/**
	 * @param kind  the kind of feature to return
	 * @param bbox  the query window in WGS84 degrees, x = longitude, y = latitude
	 * @param limit the maximum number of features to return
	 * @return the features of the given kind intersecting the window, empty if there are none
	 * @throws ProviderUnavailableException if the catalog cannot be reached in time
	 */
	List<Feature> query(FeatureKind kind, Envelope bbox, int limit);
}
