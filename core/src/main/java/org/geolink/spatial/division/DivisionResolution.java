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
package org.geolink.spatial.division;

import java.util.List;
import org.geolink.spatial.api.graph.NodeRef;
import org.geolink.spatial.model.Division;

/**
 * The divisions found to contain a point and the hierarchy links written between them.
 *
 * @param subject   the point that was resolved
 * @param divisions every containing division, linked from the subject, in source order
 * @param links     the child to parent links, smallest kind first
 */
public record DivisionResolution(NodeRef subject, List<Division> divisions, List<HierarchyLink> links) {

	public record HierarchyLink(Division child, Division parent) {

	}

	public DivisionResolution {
		divisions = List.copyOf(divisions);
		links = List.copyOf(links);
	}

	public boolean isEmpty() {
		return divisions.isEmpty();
	}
}
