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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.SpatialResolutionException;
import org.geolink.spatial.api.feature.Feature;
import org.geolink.spatial.api.feature.FeatureKind;
import org.geolink.spatial.api.graph.GraphRelationships;
import org.geolink.spatial.config.GeolinkConfig;
import org.geolink.spatial.geometry.BoundingBoxes;
import org.geolink.spatial.geometry.GeometryMatcher;
import org.geolink.spatial.model.Division;
import org.geolink.spatial.model.SpatialSubject;
import org.geolink.spatial.store.GraphWriter;
import org.locationtech.jts.geom.Point;

/**
 * Links a point to every administrative division containing it, then chains those divisions into a strict
 * hierarchy.
 * <p>
 * Each found subtype links to the next larger subtype that was found, skipping the ones that were not: with a
 * locality and a region but no county, the locality links straight to the region. When the catalog returns two
 * containing divisions of the same subtype, the later one takes part in the chain. Subtypes outside the configured
 * hierarchy are linked from the point but never chained. A division that cannot be stored is logged and left out
 * of both the result and the chain.
 */
public class DivisionHierarchyResolver {

	private static final Logger LOGGER = Logger.getLogger(DivisionHierarchyResolver.class.getName());

	private final FeatureSource source;
	private final GraphWriter writer;
	private final List<String> hierarchy;
	private final double buffer;
	private final int limit;

	public DivisionHierarchyResolver(FeatureSource source, GraphWriter writer, GeolinkConfig config) {
		this(source, writer, config.getDivisionHierarchy(), config.getDivisionBuffer(), config.getDivisionLimit());
	}

	public DivisionHierarchyResolver(FeatureSource source, GraphWriter writer, List<String> hierarchy, double buffer,
			int limit) {
		this.source = source;
		this.writer = writer;
		this.hierarchy = List.copyOf(hierarchy);
		this.buffer = buffer;
		this.limit = limit;
	}

	public List<String> getHierarchy() {
		return hierarchy;
	}

	/**
	 * Resolves the divisions of a subject that is already stored.
	 *
	 * @throws org.geolink.spatial.api.MissingCoordinatesException if the subject has no position
	 */
	public DivisionResolution resolve(SpatialSubject subject) {
		Point point = subject.point();
		List<Feature> candidates = source.query(FeatureKind.DIVISION,
				BoundingBoxes.around(subject.latitude(), subject.longitude(), buffer), limit);
		List<Division> found = new ArrayList<>();
		Map<String, Division> byKind = new HashMap<>();
		for (Feature feature : GeometryMatcher.allContaining(point, candidates)) {
			Division division = Division.fromFeature(feature);
			try {
				writer.merge(division);
				writer.link(subject, GraphRelationships.WITHIN_DIVISION, division);
			} catch (SpatialResolutionException e) {
				LOGGER.log(Level.WARNING, "Could not link " + subject.ref() + " to division " + division.gersId(), e);
				continue;
			}
			found.add(division);
			if (hierarchy.contains(division.subtype())) {
				Division previous = byKind.put(division.subtype(), division);
				if (previous != null) {
					LOGGER.fine("Division " + division.gersId() + " replaces " + previous.gersId() + " as the "
							+ division.subtype() + " of " + subject.ref());
				}
			}
		}
		List<DivisionResolution.HierarchyLink> links = linkHierarchy(byKind);
		LOGGER.fine("Resolved " + found.size() + " divisions and " + links.size() + " hierarchy links for "
				+ subject.ref());
		return new DivisionResolution(subject.ref(), found, links);
	}

	private List<DivisionResolution.HierarchyLink> linkHierarchy(Map<String, Division> byKind) {
		List<DivisionResolution.HierarchyLink> links = new ArrayList<>();
		for (int i = 0; i < hierarchy.size() - 1; i++) {
			Division child = byKind.get(hierarchy.get(i));
			if (child == null) {
				continue;
			}
			for (int j = i + 1; j < hierarchy.size(); j++) {
				Division parent = byKind.get(hierarchy.get(j));
				if (parent != null) {
					try {
						writer.link(child, GraphRelationships.WITHIN_DIVISION, parent);
						links.add(new DivisionResolution.HierarchyLink(child, parent));
					} catch (SpatialResolutionException e) {
						LOGGER.log(Level.WARNING, "Could not link division " + child.gersId() + " to "
								+ parent.gersId(), e);
					}
					break;
				}
			}
		}
		return links;
	}
}
