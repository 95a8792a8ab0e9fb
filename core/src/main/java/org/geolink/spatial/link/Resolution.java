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

import java.util.List;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.graph.NodeRef;

/**
 * What one resolution did for one subject.
 *
 * @param subject   the resolved subject
 * @param kind      the resolution that ran
 * @param outcome   how it ended
 * @param linked    the nodes linked from the subject, empty unless the outcome is {@link ResolutionOutcome#LINKED}
 * @param message   a human readable reason for anything but a link
 * @param retryable true if a failure came from an unavailable provider and the resolution may be retried
 */
public record Resolution(NodeRef subject, ResolverKind kind, ResolutionOutcome outcome, List<NodeRef> linked,
		String message, boolean retryable) {

	public Resolution {
		linked = List.copyOf(linked);
	}

	public static Resolution linked(NodeRef subject, ResolverKind kind, List<NodeRef> linked) {
		return new Resolution(subject, kind, ResolutionOutcome.LINKED, linked, null, false);
	}

	public static Resolution noCandidate(NodeRef subject, ResolverKind kind, String message) {
		return new Resolution(subject, kind, ResolutionOutcome.NO_CANDIDATE, List.of(), message, false);
	}

	public static Resolution missingCoordinates(NodeRef subject, ResolverKind kind) {
		return new Resolution(subject, kind, ResolutionOutcome.MISSING_COORDINATES, List.of(),
				"Missing coordinates for " + subject, false);
	}

	public static Resolution notApplicable(NodeRef subject, ResolverKind kind) {
		return new Resolution(subject, kind, ResolutionOutcome.NOT_APPLICABLE, List.of(),
				kind + " does not apply to " + subject.label(), false);
	}

	public static Resolution failed(NodeRef subject, ResolverKind kind, RuntimeException e) {
		boolean retryable = e instanceof SpatialResolutionException resolution && resolution.isRetryable();
		return new Resolution(subject, kind, ResolutionOutcome.FAILED, List.of(), String.valueOf(e.getMessage()),
				retryable);
	}

	public static Resolution cancelled(NodeRef subject, ResolverKind kind) {
		return new Resolution(subject, kind, ResolutionOutcome.CANCELLED, List.of(), "Batch cancelled", false);
	}

	public boolean isLinked() {
		return outcome == ResolutionOutcome.LINKED;
	}
}
