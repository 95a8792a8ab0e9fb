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
package org.geolink.spatial.network;

import java.util.List;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.config.GeolinkConfig;
import org.geolink.spatial.model.SpatialSubject;

/**
 * A road network load request: the subjects to load the network around, the search radius around each and the road
 * classes to keep.
 *
 * @param subjects    the points to load around and link into the network
 * @param regionId    tags every committed intersection and linked subject, or null
 * @param radiusKm    search radius around each subject
 * @param roadClasses road classes to keep, empty for all
 */
public record NetworkBatch(List<SpatialSubject> subjects, String regionId, double radiusKm,
		List<String> roadClasses) {

	public NetworkBatch {
		subjects = List.copyOf(subjects);
		roadClasses = roadClasses == null ? List.of() : List.copyOf(roadClasses);
		if (radiusKm < GeolinkConfig.MIN_NETWORK_RADIUS_KM || radiusKm > GeolinkConfig.MAX_NETWORK_RADIUS_KM) {
			throw new ConfigurationException("Network radius must be between " + GeolinkConfig.MIN_NETWORK_RADIUS_KM
					+ " and " + GeolinkConfig.MAX_NETWORK_RADIUS_KM + " km but was " + radiusKm);
		}
	}

	/**
	 * A batch using the configured radius and road classes.
	 */
	public static NetworkBatch of(List<? extends SpatialSubject> subjects, String regionId, GeolinkConfig config) {
		return new NetworkBatch(List.copyOf(subjects), regionId, config.getNetworkRadiusKm(),
				config.getNetworkRoadClasses());
	}

	public boolean keeps(String roadClass) {
		return roadClasses.isEmpty() || roadClasses.contains(roadClass);
	}
}
