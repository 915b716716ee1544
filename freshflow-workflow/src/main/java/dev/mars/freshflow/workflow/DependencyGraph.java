/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.freshflow.workflow;

import dev.mars.freshflow.core.exceptions.CircularDependencyException;

import java.util.*;

/**
 * Represents the dependency graph between the modules of a workflow.
 * <p>
 * An edge {@code M -> N} exists when N's configuration references M's output. Modules are
 * kept in insertion order and that order breaks every tie, so sorting is deterministic.
 * Provides methods for topological sorting, batching and cycle detection.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies;
    private final Map<String, Integer> insertionIndex;

    public DependencyGraph() {
        this.dependencies = new LinkedHashMap<>();
        this.insertionIndex = new HashMap<>();
    }

    /**
     * Adds a module and the ids of the modules it references.
     *
     * @param moduleId the module id
     * @param dependsOn ids of the modules whose output it consumes
     */
    public void addModule(String moduleId, Collection<String> dependsOn) {
        Objects.requireNonNull(moduleId, "Module id cannot be null");
        insertionIndex.putIfAbsent(moduleId, insertionIndex.size());
        dependencies.put(moduleId, new LinkedHashSet<>(dependsOn != null ? dependsOn : Set.of()));
    }

    /**
     * @return module ids in insertion order
     */
    public List<String> getModuleIds() {
        return List.copyOf(dependencies.keySet());
    }

    /**
     * Gets the direct predecessors of a module.
     */
    public Set<String> getDependencies(String moduleId) {
        Set<String> deps = dependencies.get(moduleId);
        return deps != null ? Collections.unmodifiableSet(deps) : Set.of();
    }

    /**
     * Gets the modules that directly reference the given module, in insertion order.
     */
    public Set<String> getDependents(String moduleId) {
        Set<String> dependents = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(moduleId)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Gets every module that depends on the given module, directly or indirectly.
     */
    public Set<String> getTransitiveDependents(String moduleId) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(getDependents(moduleId));
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (result.add(current)) {
                pending.addAll(getDependents(current));
            }
        }
        return result;
    }

    /**
     * Gets the referenced ids that are not modules of this graph, keyed by the referencing module.
     */
    public Map<String, Set<String>> getMissingDependencies() {
        Map<String, Set<String>> missing = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!dependencies.containsKey(dependency)) {
                    missing.computeIfAbsent(entry.getKey(), k -> new LinkedHashSet<>()).add(dependency);
                }
            }
        }
        return missing;
    }

    /**
     * Looks for a cycle with a depth-first search using white/gray/black marking.
     * Roots and predecessors are visited in insertion order.
     *
     * @return the first cycle found, in edge direction, starting and ending on the same id
     */
    public Optional<List<String>> findCycle() {
        Map<String, Color> colors = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (String moduleId : dependencies.keySet()) {
            if (colors.getOrDefault(moduleId, Color.WHITE) == Color.WHITE) {
                List<String> cycle = visit(moduleId, colors, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String moduleId, Map<String, Color> colors, Deque<String> path) {
        colors.put(moduleId, Color.GRAY);
        path.addLast(moduleId);

        for (String dependency : getDependencies(moduleId)) {
            if (!dependencies.containsKey(dependency)) {
                continue;
            }
            Color color = colors.getOrDefault(dependency, Color.WHITE);
            if (color == Color.GRAY) {
                return extractCycle(path, dependency);
            }
            if (color == Color.WHITE) {
                List<String> cycle = visit(dependency, colors, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.removeLast();
        colors.put(moduleId, Color.BLACK);
        return null;
    }

    // The DFS walks "depends on" links; reverse so that each consecutive pair is a producer -> consumer edge.
    private List<String> extractCycle(Deque<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String id : path) {
            if (id.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(id);
            }
        }
        cycle.add(repeated);
        Collections.reverse(cycle);
        return cycle;
    }

    public boolean hasCycles() {
        return findCycle().isPresent();
    }

    /**
     * Performs topological sort to determine execution order.
     * Among modules that are ready at the same time, the one added first goes first.
     *
     * @return module ids in execution order
     * @throws CircularDependencyException if circular dependencies are detected
     */
    public List<String> topologicalSort() throws CircularDependencyException {
        // Kahn's algorithm for topological sorting
        Map<String, Integer> inDegree = calculateInDegree();
        PriorityQueue<String> queue = new PriorityQueue<>(Comparator.comparingInt(insertionIndex::get));
        List<String> result = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);

            for (String dependent : getDependents(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (result.size() != dependencies.size()) {
            throw new CircularDependencyException(findCycle().orElse(List.of()));
        }

        return result;
    }

    /**
     * Gets groups of modules that can be executed in parallel (no dependencies between them).
     * Each batch only depends on earlier batches; within a batch modules keep insertion order.
     *
     * @return list of parallel execution batches
     * @throws CircularDependencyException if circular dependencies are detected
     */
    public List<List<String>> getParallelExecutionBatches() throws CircularDependencyException {
        List<List<String>> batches = new ArrayList<>();
        Map<String, Integer> inDegree = calculateInDegree();
        Set<String> processed = new HashSet<>();

        while (processed.size() < dependencies.size()) {
            List<String> currentBatch = new ArrayList<>();

            for (String moduleId : dependencies.keySet()) {
                if (inDegree.get(moduleId) == 0 && !processed.contains(moduleId)) {
                    currentBatch.add(moduleId);
                }
            }

            if (currentBatch.isEmpty()) {
                throw new CircularDependencyException(findCycle().orElse(List.of()));
            }

            processed.addAll(currentBatch);
            batches.add(List.copyOf(currentBatch));

            for (String moduleId : currentBatch) {
                for (String dependent : getDependents(moduleId)) {
                    inDegree.merge(dependent, -1, Integer::sum);
                }
            }
        }

        return batches;
    }

    private Map<String, Integer> calculateInDegree() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();

        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            int degree = 0;
            for (String dependency : entry.getValue()) {
                if (dependencies.containsKey(dependency)) {
                    degree++;
                }
            }
            inDegree.put(entry.getKey(), degree);
        }

        return inDegree;
    }

    private enum Color {
        WHITE, GRAY, BLACK
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "modules=" + dependencies.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
