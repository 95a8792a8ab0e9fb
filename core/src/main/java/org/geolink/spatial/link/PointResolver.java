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
package org.geolink.spatial.link;

import org.geolink.spatial.model.SpatialSubject;

/**
 * One kind of resolution for a point.
 */
public interface PointResolver {

	ResolverKind kind();

	/**
	 * @return false if this resolution never applies to subjects like this one, whatever their position
	 */
	boolean accepts(SpatialSubject subject);

	/**
	 * Resolves a subject that is stored and has coordinates, writing any result node and the relationship from the
	 * subject to it.
	 *
	 * @throws org.geolink.spatial.api.SpatialResolutionException if a provider fails
	 */
	Resolution resolve(SpatialSubject subject);
}
