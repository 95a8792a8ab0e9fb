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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.batch.Cancellation;
import org.geolink.spatial.geometry.BoundingBoxes;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.geolink.spatial.geometry.GeometryMatcher.Match;
import org.geolink.spatial.model.IpAddress;
import org.geolink.spatial.model.Place;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;

/**
 * Finds the places around a batch of subjects and links each place from the subject nearest to it, with
 * {@code GEOLOCATES_NEAR} for IP addresses and {@code HAS_NEARBY_PLACE} for anything else.
 * <p>
 * The catalog is read for every subject first, in parallel, and places found around several subjects are kept
 * once, in the order of the first subject that found them. Only then are places written.
 */
public class NearbyPlaceLinker {

	private static final Logger LOGGER = Logger.getLogger(NearbyPlaceLinker.class.getName());

	/**
	 * The places written, the number of subjects whose catalog query failed and the number of subjects that could
	 * not be stored.
	 */
	public record NearbyPlaces(List<Place> places, int failedQueries, int failedSubjects) {

	}

	private final FeatureSource source;
	private final GraphWriter writer;
	private final BatchExecutor executor;
	private final double radiusKm;
	private final int limit;

	public NearbyPlaceLinker(FeatureSource source, GraphWriter writer, BatchExecutor executor, double radiusKm,
			int limit) {
		this.source = source;
		this.writer = writer;
		this.executor = executor;
		this.radiusKm = radiusKm;
		this.limit = limit;
	}

	/**
	 * @param categories keep only places whose category contains one of these, ignoring case; empty keeps all
	 */
	public NearbyPlaces link(List<? extends SpatialSubject> subjects, List<String> categories,
			Cancellation cancellation) {
		List<SpatialSubject> located = new ArrayList<>();
		for (SpatialSubject subject : subjects) {
			if (subject.hasCoordinates()) {
				located.add(subject);
			} else {
				LOGGER.fine("Skipping " + subject.ref() + " without coordinates");
			}
		}
		List<Optional<List<Feature>>> reads = executor.map(located, this::query, subject -> Optional.empty(),
				cancellation);
		Map<String, Feature> found = new LinkedHashMap<>();
		int failed = 0;
		for (Optional<List<Feature>> read : reads) {
			if (read.isEmpty()) {
				failed++;
				continue;
			}
			for (Feature feature : read.get()) {
				if (matchesCategory(feature, categories)) {
					found.putIfAbsent(feature.getId(), feature);
				}
			}
		}
		List<Place> places = new ArrayList<>();
		List<SpatialSubject> stored = new ArrayList<>();
		int failedSubjects = 0;
		for (SpatialSubject subject : located) {
			try {
				writer.merge(subject);
				stored.add(subject);
			} catch (SpatialResolutionException e) {
				LOGGER.log(Level.WARNING, "Could not store " + subject.ref() + ", leaving it out of the place links", e);
				failedSubjects++;
			}
		}
		for (Feature feature : found.values()) {
			if (cancellation.isCancelled()) {
				break;
			}
			try {
				Place place = Place.fromFeature(feature);
				Optional<Match<SpatialSubject>> nearest = GeometryMatcher.nearest(place.point(), stored,
						SpatialSubject::point, Double.POSITIVE_INFINITY);
				if (nearest.isEmpty()) {
					continue;
				}
				SpatialSubject subject = nearest.get().candidate();
				writer.merge(place);
				writer.link(subject, subject instanceof IpAddress ? GraphRelationships.GEOLOCATES_NEAR
						: GraphRelationships.HAS_NEARBY_PLACE, place);
				places.add(place);
			} catch (SpatialResolutionException e) {
				LOGGER.log(Level.WARNING, "Could not link place " + feature.getId(), e);
			}
		}
		LOGGER.info("Linked " + places.size() + " nearby places to " + stored.size() + " subjects");
		return new NearbyPlaces(places, failed, failedSubjects);
	}

	private Optional<List<Feature>> query(SpatialSubject subject) {
		try {
			return Optional.of(source.query(FeatureKind.PLACE,
					BoundingBoxes.radius(subject.latitude(), subject.longitude(), radiusKm), limit));
		} catch (RuntimeException e) {
			LOGGER.log(Level.WARNING, "Place query failed for " + subject.ref(), e);
			return Optional.empty();
		}
	}

	private static boolean matchesCategory(Feature place, List<String> categories) {
		if (categories == null || categories.isEmpty()) {
			return true;
		}
		String category = place.getString("category");
		if (category == null) {
			return false;
		}
		String lower = category.toLowerCase(Locale.ROOT);
		return categories.stream().anyMatch(c -> lower.contains(c.toLowerCase(Locale.ROOT)));
	}
}
