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

/**
 * What a road network load did.
 *
 * @param uniqueConnectors   distinct connectors read across all subjects
 * @param intersections      intersections merged into the graph
 * @param segmentsCommitted  road segments merged into the graph
 * @param segmentsDropped    road segments left out for missing or unknown connectors
 * @param subjectsLinked     subjects linked to their nearest intersection
 * @param subjectsSkipped    subjects without coordinates, or with no intersection to link to
 * @param failedQueries      subjects whose catalog reads failed
 * @param cancelled          true if the batch was cancelled before committing
 */
public record NetworkLoadReport(int uniqueConnectors, int intersections, int segmentsCommitted, int segmentsDropped,
		int subjectsLinked, int subjectsSkipped, int failedQueries, boolean cancelled) {

	public boolean hasNetwork() {
		return intersections > 0 && segmentsCommitted > 0;
	}
}
