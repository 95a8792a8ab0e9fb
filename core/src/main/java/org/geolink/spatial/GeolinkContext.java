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
package org.geolink.spatial;

import static org.neo4j.configuration.GraphDatabaseSettings.DEFAULT_DATABASE_NAME;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.geolink.spatial.api.ConfigurationException;
import org.geolink.spatial.api.FeatureSource;
import org.geolink.spatial.api.GraphStore;
import org.geolink.spatial.batch.BatchExecutor;
import org.geolink.spatial.config.GeolinkConfig;
import org.geolink.spatial.division.DivisionHierarchyResolver;
import org.geolink.spatial.link.NearbyPlaceLinker;
import org.geolink.spatial.link.ResolverRegistry;
import org.geolink.spatial.link.SpatialLinker;
import org.geolink.spatial.network.RoadNetworkBuilder;
import org.geolink.spatial.routing.RouteResolver;
import org.geolink.spatial.routing.RoutingService;
import org.geolink.spatial.source.TimeLimitedFeatureSource;
import org.geolink.spatial.store.GraphWriter;
import org.geolink.spatial.store.Neo4jGraphStore;
import org.neo4j.dbms.api.DatabaseManagementService;
import org.neo4j.dbms.api.DatabaseManagementServiceBuilder;

/**
 * Everything needed to resolve, load and route, wired once per process and handed to callers by reference.
 * Closing the context stops the worker threads and closes the graph store.
 */
public class GeolinkContext implements AutoCloseable {

	private static final Logger LOGGER = Logger.getLogger(GeolinkContext.class.getName());

	private final GeolinkConfig config;
	private final TimeLimitedFeatureSource source;
	private final GraphStore store;
	private final BatchExecutor executor;
	private final ResolverRegistry registry;
	private final DivisionHierarchyResolver divisions;
	private final SpatialLinker linker;
	private final RoadNetworkBuilder networkBuilder;
	private final NearbyPlaceLinker nearbyPlaces;
	private final RoutingService routing;

	private GeolinkContext(GeolinkConfig config, FeatureSource catalog, GraphStore store) {
		this.config = config;
		this.source = new TimeLimitedFeatureSource(catalog, config.getSourceTimeoutMs());
		this.store = store;
		this.executor = new BatchExecutor(config.getParallelism());
		GraphWriter writer = new GraphWriter(store);
		this.divisions = new DivisionHierarchyResolver(source, writer, config);
		this.registry = ResolverRegistry.standard(source, writer, config, divisions);
		this.linker = new SpatialLinker(registry, writer, executor);
		this.networkBuilder = new RoadNetworkBuilder(source, writer, executor, config.getNetworkLimit());
		this.nearbyPlaces = new NearbyPlaceLinker(source, writer, executor, config.getPlacesRadiusKm(),
				config.getPlacesLimit());
		this.routing = new RoutingService(store, new RouteResolver(store));
	}

	public static GeolinkContext create(GeolinkConfig config, FeatureSource catalog, GraphStore store) {
		if (catalog == null || store == null) {
			throw new ConfigurationException("A feature source and a graph store are required");
		}
		LOGGER.info("Starting geolink with " + config);
		return new GeolinkContext(config, catalog, store);
	}

	/**
	 * A context storing into an embedded Neo4j database in the given directory, shut down with the context.
	 */
	public static GeolinkContext embedded(GeolinkConfig config, FeatureSource catalog, Path databaseDirectory) {
		DatabaseManagementService managementService;
		try {
			managementService = new DatabaseManagementServiceBuilder(databaseDirectory).build();
		} catch (RuntimeException e) {
			throw new ConfigurationException("Cannot open graph database at " + databaseDirectory, e);
		}
		try {
			return create(config, catalog, new Neo4jGraphStore(managementService.database(DEFAULT_DATABASE_NAME),
					managementService, config.getStoreTimeoutMs()));
		} catch (RuntimeException e) {
			managementService.shutdown();
			throw e;
		}
	}

	public GeolinkConfig getConfig() {
		return config;
	}

	public FeatureSource getSource() {
		return source;
	}

	public GraphStore getStore() {
		return store;
	}

	public ResolverRegistry getRegistry() {
		return registry;
	}

	public DivisionHierarchyResolver getDivisions() {
		return divisions;
	}

	public SpatialLinker getLinker() {
		return linker;
	}

	public RoadNetworkBuilder getNetworkBuilder() {
		return networkBuilder;
	}

	public NearbyPlaceLinker getNearbyPlaces() {
		return nearbyPlaces;
	}

	public RoutingService getRouting() {
		return routing;
	}

	@Override
	public void close() {
		executor.close();
		source.close();
		try {
			store.close();
		} catch (RuntimeException e) {
			LOGGER.log(Level.WARNING, "Failed to close the graph store", e);
		}
	}
}
