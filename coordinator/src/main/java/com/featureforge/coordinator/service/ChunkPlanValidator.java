package com.featureforge.coordinator.service;

import com.featureforge.coordinator.collaborator.ChunkPlan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects decompositions that could never finish: a chunk whose dependency
 * does not exist, or that depends on itself directly or through a cycle,
 * would stay PLANNED forever.
 */
public final class ChunkPlanValidator {

    private ChunkPlanValidator() {}

    /**
     * @throws ChunkPlanValidationException listing every problem found
     */
    public static void validate(List<ChunkPlan> plans) {
        List<String> problems = new ArrayList<>();
        if (plans == null || plans.isEmpty()) {
            throw new ChunkPlanValidationException(List.of("plan contains no chunks"));
        }

        Map<String, ChunkPlan> byId = new LinkedHashMap<>();
        for (ChunkPlan plan : plans) {
            if (plan.chunkId() == null || plan.chunkId().isBlank()) {
                problems.add("chunk without id");
                continue;
            }
            if (byId.putIfAbsent(plan.chunkId(), plan) != null) {
                problems.add("duplicate chunk id '" + plan.chunkId() + "'");
            }
            if (plan.files().isEmpty()) {
                problems.add("chunk '" + plan.chunkId() + "' declares no files");
            }
        }

        for (ChunkPlan plan : byId.values()) {
            for (String dep : plan.dependencies()) {
                if (dep.equals(plan.chunkId())) {
                    problems.add("chunk '" + plan.chunkId() + "' depends on itself");
                } else if (!byId.containsKey(dep)) {
                    problems.add("chunk '" + plan.chunkId() + "' depends on unknown chunk '" + dep + "'");
                }
            }
        }

        findCycle(byId).ifPresent(cycle -> problems.add("dependency cycle: " + String.join(" -> ", cycle)));

        if (!problems.isEmpty()) {
            throw new ChunkPlanValidationException(problems);
        }
    }

    // Depth-first search over known, non-self edges; returns the first cycle found.
    private static Optional<List<String>> findCycle(Map<String, ChunkPlan> byId) {
        Set<String> explored = new HashSet<>();
        for (String start : byId.keySet()) {
            List<String> path = new ArrayList<>();
            List<String> cycle = visit(start, byId, explored, path, new HashSet<>());
            if (cycle != null) return Optional.of(cycle);
        }
        return Optional.empty();
    }

    private static List<String> visit(String id, Map<String, ChunkPlan> byId, Set<String> explored,
                                      List<String> path, Set<String> onPath) {
        if (explored.contains(id)) return null;
        if (onPath.contains(id)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            return cycle;
        }
        onPath.add(id);
        path.add(id);
        for (String dep : byId.get(id).dependencies()) {
            if (dep.equals(id) || !byId.containsKey(dep)) continue;
            List<String> cycle = visit(dep, byId, explored, path, onPath);
            if (cycle != null) return cycle;
        }
        path.remove(path.size() - 1);
        onPath.remove(id);
        explored.add(id);
        return null;
    }
}
