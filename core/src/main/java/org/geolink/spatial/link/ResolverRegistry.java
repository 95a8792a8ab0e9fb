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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.config.GeolinkConfig;
import org.geolink.spatial.division.DivisionHierarchyResolver;
import org.geolink.spatial.store.GraphWriter;

/**
 * The resolvers available to a {@link SpatialLinker}, at most one per {@link ResolverKind}. Registries are built
 * explicitly at startup and then only read.
 */
public class ResolverRegistry {

	private final Map<ResolverKind, PointResolver> resolvers = new EnumMap<>(ResolverKind.class);

	/**
	 * A registry of every standard resolver, configured from the given config.
	 */
	public static ResolverRegistry standard(FeatureSource source, GraphWriter writer, GeolinkConfig config,
			DivisionHierarchyResolver divisions) {
		return new ResolverRegistry()
				.register(new BuildingResolver(source, writer, config.getBuildingBuffer(),
						config.getBuildingMaxDistance(), config.getBuildingLimit()))
				.register(new StreetResolver(source, writer, config.getStreetRadiusKm(), config.getStreetLimit()))
				.register(new AddressResolver(source, writer, divisions, config.getAddressBuffer(),
						config.getAddressMaxDistance(), config.getAddressLimit()))
				.register(new PlaceAddressResolver(source, writer, config.getAddressBuffer(),
						config.getAddressMaxDistance(), config.getAddressLimit()))
				.register(new DivisionsResolver(divisions));
	}

	/**
	 * @throws ConfigurationException if a resolver of the same kind is already registered
	 */
	public ResolverRegistry register(PointResolver resolver) {
		if (resolvers.putIfAbsent(resolver.kind(), resolver) != null) {
			throw new ConfigurationException("A " + resolver.kind() + " resolver is already registered");
		}
		return this;
	}

	/**
	 * @throws ConfigurationException if no resolver of that kind is registered
	 */
	public PointResolver get(ResolverKind kind) {
		PointResolver resolver = resolvers.get(kind);
		if (resolver == null) {
			throw new ConfigurationException("No " + kind + " resolver registered");
		}
		return resolver;
	}

	public Set<ResolverKind> getKinds() {
		return Collections.unmodifiableSet(resolvers.keySet());
	}
}
