package com.pipewright.core.scheduler;

import com.pipewright.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.Function;

/**
 * Orders items so that every item comes after the items it depends on (Kahn's algorithm).
 * <p>
 * Among items that are ready at the same time, the one with fewer declared dependencies
 * goes first, then declaration order. Used for work orders and for stages alike.
 *
 * @param <T> the ordered item type
 */
public final class DependencyGraph<T> {

    private final String kind;
    private final Map<String, T> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, Integer> declarationIndex = new HashMap<>();

    private DependencyGraph(String kind) {
        this.kind = kind;
    }

    /**
     * Builds the graph and checks it. Nothing is ordered until every reference resolves.
     *
     * @param kind  what the items are, used in error messages ("task", "stage")
     * @throws ConfigurationException on duplicate ids or references to unknown ids
     */
    public static <T> DependencyGraph<T> of(List<T> items, Function<T, String> id,
                                            Function<T, Collection<String>> dependsOn, String kind) {
        var graph = new DependencyGraph<T>(kind);
        for (T item : items) {
            String itemId = id.apply(item);
            if (graph.nodes.putIfAbsent(itemId, item) != null) {
                throw new ConfigurationException("Duplicate " + kind + " id '" + itemId + "'");
            }
            graph.declarationIndex.put(itemId, graph.declarationIndex.size());
            Collection<String> deps = dependsOn.apply(item);
            graph.dependencies.put(itemId, deps == null ? List.of() : List.copyOf(deps));
        }
        for (var entry : graph.dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!graph.nodes.containsKey(dependency)) {
                    throw new ConfigurationException(capitalize(kind) + " '" + entry.getKey()
                            + "' depends on unknown " + kind + " '" + dependency + "'");
                }
            }
        }
        return graph;
    }

    /**
     * @return items in dependency order
     * @throws ConfigurationException if the dependencies form a cycle
     */
    public List<T> topologicalSort() {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String node : nodes.keySet()) {
            inDegree.put(node, 0);
            dependents.put(node, new ArrayList<>());
        }
        for (var entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (dependency.equals(entry.getKey())) {
                    throw new ConfigurationException(capitalize(kind) + " '" + dependency + "' depends on itself");
                }
                inDegree.merge(entry.getKey(), 1, Integer::sum);
                dependents.get(dependency).add(entry.getKey());
            }
        }

        Comparator<String> readiness = Comparator
                .comparingInt((String node) -> dependencies.get(node).size())
                .thenComparingInt(declarationIndex::get);
        var ready = new PriorityQueue<>(readiness);
        for (var entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        var result = new ArrayList<T>(nodes.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            result.add(nodes.get(current));
            for (String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (result.size() != nodes.size()) {
            var remaining = nodes.keySet().stream()
                    .filter(node -> inDegree.get(node) > 0)
                    .toList();
            throw new ConfigurationException("Circular dependency detected among " + kind + "s: " + remaining);
        }
        return result;
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
