package com.wastewrangler.analytics.service;

import com.wastewrangler.shared.model.Trip;

import java.util.*;

/**
 * Undirected "shared a trip" graph over employee ids.
 */
public final class WorkmateGraph {

    private final Map<Integer, Set<Integer>> adjacency = new HashMap<>();

    public static WorkmateGraph fromTrips(Collection<Trip> trips) {
        WorkmateGraph graph = new WorkmateGraph();
        for (Trip trip : trips) {
            graph.connect(trip.getDriverHigh(), trip.getDriverLow());
        }
        return graph;
    }

    public void connect(int a, int b) {
        if (a == b) {
            return;
        }
        adjacency.computeIfAbsent(a, k -> new HashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new HashSet<>()).add(a);
    }

    public Set<Integer> neighbours(int employeeId) {
        return Collections.unmodifiableSet(adjacency.getOrDefault(employeeId, Set.of()));
    }

    /**
     * Everyone reachable from {@code root} over any number of hops, excluding
     * {@code root} itself. Breadth-first.
     */
    public Set<Integer> reachableFrom(int root) {
        Set<Integer> visited = new HashSet<>();
        visited.add(root);
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int next : adjacency.getOrDefault(current, Set.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        visited.remove(root);
        return new TreeSet<>(visited);
    }
}
