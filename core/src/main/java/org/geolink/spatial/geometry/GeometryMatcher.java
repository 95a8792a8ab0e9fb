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
package org.geolink.spatial.geometry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.feature.Feature;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.operation.distance.DistanceOp;

/**
 * Containment and nearest-neighbour matching of a point against a list of candidates.
 * <p>
 * Distances are planar, in degrees, which is accurate enough at the scale of a few kilometers that the resolvers
 * query. A candidate whose geometry is missing or makes JTS fail is skipped, never fatal.
 * <p>
 * Both searches are linear scans in candidate order: {@link #containing} returns the first containing candidate,
 * and {@link #nearest} keeps the earliest of equally distant candidates.
 */
public final class GeometryMatcher {

	private static final Logger LOGGER = Logger.getLogger(GeometryMatcher.class.getName());

	public static final GeometryFactory WGS84 = new GeometryFactory(new PrecisionModel(), 4326);

	/**
	 * A matched candidate and its distance to the query point (zero for containment).
	 */
	public record Match<T>(T candidate, double distance) {

	}

	private GeometryMatcher() {
	}

	public static Point point(double latitude, double longitude) {
		return WGS84.createPoint(new Coordinate(longitude, latitude));
	}

	public static Optional<Feature> containing(Point point, List<Feature> candidates) {
		return containing(point, candidates, Feature::getGeometry);
	}

	/**
	 * @return the first candidate, in input order, whose polygonal geometry strictly contains the point
	 */
	public static <T> Optional<T> containing(Point point, Collection<T> candidates, Function<T, Geometry> geometryOf) {
		for (T candidate : candidates) {
			Geometry geometry = geometryOf.apply(candidate);
			if (!(geometry instanceof Polygonal) || geometry.isEmpty()) {
				continue;
			}
			try {
				if (geometry.contains(point)) {
					return Optional.of(candidate);
				}
			} catch (RuntimeException e) {
				LOGGER.log(Level.FINE, "Skipping candidate " + candidate + " with unusable geometry", e);
			}
		}
		return Optional.empty();
	}

	/**
	 * @return every candidate whose polygonal geometry contains the point, in input order
	 */
	public static List<Feature> allContaining(Point point, List<Feature> candidates) {
		List<Feature> result = new ArrayList<>();
		for (Feature candidate : candidates) {
			containing(point, List.of(candidate)).ifPresent(result::add);
		}
		return result;
	}

	public static Optional<Match<Feature>> nearest(Point point, List<Feature> candidates, double maxDistance) {
		return nearest(point, candidates, Feature::getGeometry, maxDistance);
	}

	/**
	 * @param maxDistance exclusive upper bound on the distance, {@link Double#POSITIVE_INFINITY} for no bound
	 * @return the closest candidate whose distance is strictly less than maxDistance
	 */
	public static <T> Optional<Match<T>> nearest(Point point, Collection<T> candidates,
			Function<T, Geometry> geometryOf, double maxDistance) {
		T best = null;
		double bestDistance = Double.POSITIVE_INFINITY;
		for (T candidate : candidates) {
			Geometry geometry = geometryOf.apply(candidate);
			if (geometry == null || geometry.isEmpty()) {
				continue;
			}
			double distance;
			try {
				distance = geometry.distance(point);
			} catch (RuntimeException e) {
				LOGGER.log(Level.FINE, "Skipping candidate " + candidate + " with unusable geometry", e);
				continue;
			}
			if (distance < bestDistance) {
				bestDistance = distance;
				best = candidate;
			}
		}
		if (best == null || !(bestDistance < maxDistance)) {
			return Optional.empty();
		}
		return Optional.of(new Match<>(best, bestDistance));
	}

	/**
	 * Containment first, falling back to the nearest candidate within maxDistance.
	 */
	public static Optional<Match<Feature>> containingOrNearest(Point point, List<Feature> candidates,
			double maxDistance) {
		Optional<Feature> container = containing(point, candidates);
		if (container.isPresent()) {
			return Optional.of(new Match<>(container.get(), 0.0));
		}
		return nearest(point, candidates, maxDistance);
	}

	/**
	 * The point itself for point geometries, the centroid for anything else.
	 */
	public static Coordinate centroid(Geometry geometry) {
		if (geometry instanceof Point point) {
			return point.getCoordinate();
		}
		return geometry.getCentroid().getCoordinate();
	}

	/**
	 * The point on the geometry closest to the given point.
	 */
	public static Coordinate nearestPointOn(Geometry geometry, Point point) {
		Coordinate[] nearest = DistanceOp.nearestPoints(geometry, point);
		return nearest[0];
	}
}
