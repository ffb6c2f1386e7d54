/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.engram.core.graph;

import com.phonepe.engram.core.entity.EntityRef;
import com.phonepe.engram.core.errors.InvalidInputException;
import com.phonepe.engram.core.graph.model.Relationship;
import lombok.experimental.UtilityClass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.function.Predicate;

/**
 * Searches over a {@link RelationshipIndex}. Neighbours are always expanded in {@code type/id} order so results are
 * deterministic.
 */
@UtilityClass
class PathFinder {

    private record Hop(EntityRef from, Relationship via) {
    }

    private record Frontier(EntityRef node, long cost) {
    }

    private record Visit(EntityRef node, int depth, Hop hop) {
    }

    static Optional<EntityPath> find(RelationshipIndex index,
                                     EntityRef source,
                                     EntityRef target,
                                     PathAlgorithm algorithm,
                                     Predicate<Relationship> filter) {
        if (source.equals(target)) {
            return Optional.of(new EntityPath(List.of(source), List.of(), 0, algorithm));
        }
        return switch (algorithm) {
            case BFS -> breadthFirst(index, source, target, filter);
            case DFS -> depthFirst(index, source, target, filter);
            case DIJKSTRA -> dijkstra(index, source, target, filter);
        };
    }

    /**
     * Nodes reachable from the start within {@code maxDepth} hops, in visit order, start included.
     */
    static List<EntityRef> traverse(RelationshipIndex index,
                                    EntityRef start,
                                    PathAlgorithm algorithm,
                                    int maxDepth,
                                    Predicate<Relationship> filter) {
        if (maxDepth < 0) {
            throw new InvalidInputException("maxDepth must not be negative");
        }
        return switch (algorithm) {
            case BFS -> {
                final var visited = new LinkedHashSet<EntityRef>();
                final var depths = new HashMap<EntityRef, Integer>();
                final var queue = new ArrayDeque<EntityRef>();
                visited.add(start);
                depths.put(start, 0);
                queue.add(start);
                while (!queue.isEmpty()) {
                    final var node = queue.poll();
                    final var depth = depths.get(node);
                    if (depth >= maxDepth) {
                        continue;
                    }
                    for (final var step : index.neighbours(node, filter)) {
                        if (visited.add(step.to())) {
                            depths.put(step.to(), depth + 1);
                            queue.add(step.to());
                        }
                    }
                }
                yield List.copyOf(visited);
            }
            case DFS -> {
                final var visited = new LinkedHashSet<EntityRef>();
                final var stack = new ArrayDeque<Visit>();
                stack.push(new Visit(start, 0, null));
                while (!stack.isEmpty()) {
                    final var visit = stack.pop();
                    if (!visited.add(visit.node()) || visit.depth() >= maxDepth) {
                        continue;
                    }
                    pushReversed(stack, index.neighbours(visit.node(), filter), visit);
                }
                yield List.copyOf(visited);
            }
            case DIJKSTRA -> throw new InvalidInputException("traversal supports BFS and DFS only");
        };
    }

    /**
     * Pushes the steps so that the first one in {@code type/id} order is popped first.
     */
    private static void pushReversed(ArrayDeque<Visit> stack, List<GraphStep> steps, Visit from) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            final var step = steps.get(i);
            stack.push(new Visit(step.to(), from.depth() + 1, new Hop(from.node(), step.via())));
        }
    }

    private static Optional<EntityPath> breadthFirst(RelationshipIndex index,
                                                     EntityRef source,
                                                     EntityRef target,
                                                     Predicate<Relationship> filter) {
        final var cameFrom = new HashMap<EntityRef, Hop>();
        final var visited = new HashSet<EntityRef>();
        final var queue = new ArrayDeque<EntityRef>();
        visited.add(source);
        queue.add(source);
        while (!queue.isEmpty()) {
            final var node = queue.poll();
            for (final var step : index.neighbours(node, filter)) {
                if (!visited.add(step.to())) {
                    continue;
                }
                cameFrom.put(step.to(), new Hop(node, step.via()));
                if (step.to().equals(target)) {
                    return Optional.of(assemble(source, target, cameFrom, PathAlgorithm.BFS, -1));
                }
                queue.add(step.to());
            }
        }
        return Optional.empty();
    }

    private static Optional<EntityPath> depthFirst(RelationshipIndex index,
                                                   EntityRef source,
                                                   EntityRef target,
                                                   Predicate<Relationship> filter) {
        final var cameFrom = new HashMap<EntityRef, Hop>();
        final var visited = new HashSet<EntityRef>();
        final var stack = new ArrayDeque<Visit>();
        stack.push(new Visit(source, 0, null));
        while (!stack.isEmpty()) {
            final var visit = stack.pop();
            if (!visited.add(visit.node())) {
                continue;
            }
            if (visit.hop() != null) {
                cameFrom.put(visit.node(), visit.hop());
            }
            if (visit.node().equals(target)) {
                return Optional.of(assemble(source, target, cameFrom, PathAlgorithm.DFS, -1));
            }
            pushReversed(stack, index.neighbours(visit.node(), filter), visit);
        }
        return Optional.empty();
    }

    private static Optional<EntityPath> dijkstra(RelationshipIndex index,
                                                 EntityRef source,
                                                 EntityRef target,
                                                 Predicate<Relationship> filter) {
        final var distances = new HashMap<EntityRef, Long>();
        final var cameFrom = new HashMap<EntityRef, Hop>();
        final var queue = new PriorityQueue<Frontier>(Comparator.comparingLong(Frontier::cost)
                                                              .thenComparing(frontier -> frontier.node().toString()));
        distances.put(source, 0L);
        queue.add(new Frontier(source, 0L));
        while (!queue.isEmpty()) {
            final var current = queue.poll();
            if (current.cost() > distances.get(current.node())) {
                continue;
            }
            if (current.node().equals(target)) {
                return Optional.of(assemble(source, target, cameFrom, PathAlgorithm.DIJKSTRA, current.cost()));
            }
            for (final var step : index.neighbours(current.node(), filter)) {
                final var cost = current.cost() + step.via().getStrength().getCost();
                if (cost < distances.getOrDefault(step.to(), Long.MAX_VALUE)) {
                    distances.put(step.to(), cost);
                    cameFrom.put(step.to(), new Hop(current.node(), step.via()));
                    queue.add(new Frontier(step.to(), cost));
                }
            }
        }
        return Optional.empty();
    }

    private static EntityPath assemble(EntityRef source,
                                       EntityRef target,
                                       Map<EntityRef, Hop> cameFrom,
                                       PathAlgorithm algorithm,
                                       long cost) {
        final var nodes = new ArrayList<EntityRef>();
        final var edges = new ArrayList<String>();
        var node = target;
        nodes.add(node);
        while (!node.equals(source)) {
            final var hop = cameFrom.get(node);
            edges.add(hop.via().getId());
            node = hop.from();
            nodes.add(node);
        }
        Collections.reverse(nodes);
        Collections.reverse(edges);
        return new EntityPath(List.copyOf(nodes), List.copyOf(edges), cost < 0 ? edges.size() : cost, algorithm);
    }
}
