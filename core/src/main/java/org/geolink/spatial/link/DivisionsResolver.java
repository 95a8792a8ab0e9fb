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

import org.geolink.spatial.division.DivisionHierarchyResolver;
import org.geolink.spatial.division.DivisionResolution;
import org.geolink.spatial.model.Division;
import org.geolink.spatial.model.SpatialSubject;

/**
 * Places any point in its division hierarchy.
 */
public class DivisionsResolver implements PointResolver {

	private final DivisionHierarchyResolver divisions;

	public DivisionsResolver(DivisionHierarchyResolver divisions) {
		this.divisions = divisions;
	}

	@Override
	public ResolverKind kind() {
		return ResolverKind.DIVISIONS;
	}

	@Override
	public boolean accepts(SpatialSubject subject) {
		return true;
	}

	@Override
	public Resolution resolve(SpatialSubject subject) {
		DivisionResolution resolution = divisions.resolve(subject);
		if (resolution.isEmpty()) {
			return Resolution.noCandidate(subject.ref(), kind(), "No division contains the point");
		}
		return Resolution.linked(subject.ref(), kind(), resolution.divisions().stream().map(Division::ref).toList());
	}
}
