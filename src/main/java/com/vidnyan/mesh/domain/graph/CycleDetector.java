package com.vidnyan.mesh.domain.graph;

import java.util.*;

/**
 * Three-colour DFS cycle detection over a small name → names adjacency map.
 * <p>
 * The search restarts from every unvisited node, so disjoint cycles are all found.
 * Each cycle is reported once, starting at its first visited member and closed by
 * repeating that member ({@code [A, B, C, A]}). Neighbours absent from the map are ignored.
 */
public final class CycleDetector {

    private CycleDetector() {
    }

    public static List<List<String>> findCycles(Map<String, ? extends Collection<String>> graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();

        for (String node : graph.keySet()) {
            if (!visited.contains(node)) {
                dfs(node, graph, visited, inStack, new ArrayList<>(), cycles, seen);
            }
        }
        return cycles;
    }

    private static void dfs(
            String current,
            Map<String, ? extends Collection<String>> graph,
            Set<String> visited,
            Set<String> inStack,
            List<String> path,
            List<List<String>> cycles,
            Set<String> seen
    ) {
        visited.add(current);
        inStack.add(current);
        path.add(current);

        Collection<String> nexts = graph.get(current);
        if (nexts == null) {
            nexts = List.of();
        }
        for (String next : nexts) {
            if (!graph.containsKey(next)) {
                continue;
            }
            if (!visited.contains(next)) {
                dfs(next, graph, visited, inStack, path, cycles, seen);
            } else if (inStack.contains(next)) {
                int start = path.indexOf(next);
                List<String> cycle = new ArrayList<>(path.subList(start, path.size()));
                if (seen.add(canonical(cycle))) {
                    cycle.add(next);
                    cycles.add(List.copyOf(cycle));
                }
            }
        }

        path.remove(path.size() - 1);
        inStack.remove(current);
    }

    /**
     * Rotation-independent key of an open cycle.
     */
    private static String canonical(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0) {
                min = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.subList(min, cycle.size()));
        rotated.addAll(cycle.subList(0, min));
        return String.join("\u0000", rotated);
    }
}
