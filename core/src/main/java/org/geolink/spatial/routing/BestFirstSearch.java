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
package org.geolink.spatial.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;
import org.geolink.spatial.api.routing.RouteResult;
import org.geolink.spatial.api.routing.Waypoint;

/**
 * Best first search with a priority queue, the shared core of Dijkstra and A*.
 * <p>
 * The frontier is ordered by priority, the tentative distance plus the heuristic estimate to the target, and equal
 * priorities are taken in the order they were queued. Outdated frontier entries are skipped when they surface
 * rather than removed. A node is settled the first time it is taken off the frontier, which yields the minimum
 * distance as long as the heuristic is consistent.
 */
public abstract class BestFirstSearch implements ShortestPathStrategy {

	private static final Logger LOGGER = Logger.getLogger(BestFirstSearch.class.getName());

	private record Entry(String node, double distance, double priority, long sequence) implements Comparable<Entry> {

		@Override
		public int compareTo(Entry other) {
			int byPriority = Double.compare(priority, other.priority);
			return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
		}
	}

	/**
	 * An estimate of the remaining distance from a node to the target, never more than the true distance.
	 */
	protected abstract double estimate(Waypoint from, Waypoint target);

	@Override
	public RouteResult findPath(RoutingGraph graph, String source, String target) {
		Optional<Waypoint> sourceNode = graph.node(source);
		Optional<Waypoint> targetNode = graph.node(target);
		if (sourceNode.isEmpty() || targetNode.isEmpty()) {
			LOGGER.fine("No path from " + source + " to " + target + ": unknown intersection");
			return RouteResult.notFound();
		}
		if (source.equals(target)) {
			return RouteResult.found(List.of(sourceNode.get()), 0.0);
		}
		Waypoint goal = targetNode.get();
		Map<String, Double> distances = new HashMap<>();
		Map<String, String> previous = new HashMap<>();
		Map<String, Waypoint> waypoints = new HashMap<>();
		Set<String> settled = new HashSet<>();
		PriorityQueue<Entry> frontier = new PriorityQueue<>();
		long sequence = 0;

		waypoints.put(source, sourceNode.get());
		waypoints.put(target, goal);
		distances.put(source, 0.0);
		frontier.add(new Entry(source, 0.0, estimate(sourceNode.get(), goal), sequence++));
		while (!frontier.isEmpty()) {
			Entry current = frontier.poll();
			if (!settled.add(current.node())) {
				continue;
			}
			if (current.node().equals(target)) {
				return RouteResult.found(path(previous, waypoints, source, target), current.distance());
			}
			for (RoutingGraph.Arc arc : graph.arcs(current.node())) {
				if (settled.contains(arc.target())) {
					continue;
				}
				double distance = current.distance() + arc.weight();
				Double known = distances.get(arc.target());
				if (known != null && known <= distance) {
					continue;
				}
				Waypoint next = waypoints.get(arc.target());
				if (next == null) {
					Optional<Waypoint> found = graph.node(arc.target());
					if (found.isEmpty()) {
						continue;
					}
					next = found.get();
					waypoints.put(arc.target(), next);
				}
				distances.put(arc.target(), distance);
				previous.put(arc.target(), current.node());
				frontier.add(new Entry(arc.target(), distance, distance + estimate(next, goal), sequence++));
			}
		}
		LOGGER.fine("No path from " + source + " to " + target + " after settling " + settled.size() + " nodes");
		return RouteResult.notFound();
	}

	private static List<Waypoint> path(Map<String, String> previous, Map<String, Waypoint> waypoints, String source,
			String target) {
		List<Waypoint> path = new ArrayList<>();
		String node = target;
		while (node != null) {
			path.add(waypoints.get(node));
			node = node.equals(source) ? null : previous.get(node);
		}
		Collections.reverse(path);
		return path;
	}
}
