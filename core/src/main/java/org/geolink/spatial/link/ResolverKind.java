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

/**
 * The resolutions a {@link SpatialLinker} can run for a point, in the order it runs them.
 */
public enum ResolverKind {
	/** The building containing the point, or the nearest one. */
	BUILDING,
	/** The road segment nearest the point. */
	STREET,
	/** The canonical address of a location, with its divisions. */
	ADDRESS,
	/** The canonical address of a place. */
	PLACE_ADDRESS,
	/** The administrative divisions containing the point. */
	DIVISIONS
}
