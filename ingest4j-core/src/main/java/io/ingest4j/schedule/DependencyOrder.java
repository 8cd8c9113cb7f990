package io.ingest4j.schedule;

import io.ingest4j.core.ConfigurationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordering of jobs by their {@code depends_on} declarations.
 */
final class DependencyOrder {
    private DependencyOrder() {
    }

    /**
     * Fails when the declared dependencies form a cycle. Unknown ids are ignored.
     */
    static void requireAcyclic(List<ScheduledJob> jobs) {
        Map<String, ScheduledJob> byId = index(jobs);
        Map<String, Integer> state = new HashMap<>(); // 1 = visiting, 2 = done
        for (ScheduledJob job : jobs) {
            visit(job, byId, state, new ArrayDeque<>());
        }
    }

    private static void visit(ScheduledJob job, Map<String, ScheduledJob> byId, Map<String, Integer> state, Deque<String> path) {
        Integer s = state.get(job.getId());
        if (s != null && s == 2) {
            return;
        }
        path.addLast(job.getId());
        if (s != null) {
            throw new ConfigurationException("Dependency cycle in schedule: " + String.join(" -> ", path));
        }
        state.put(job.getId(), 1);
        for (String dep : job.getDependsOn()) {
            ScheduledJob target = byId.get(dep);
            if (target != null) {
                visit(target, byId, state, path);
            }
        }
        state.put(job.getId(), 2);
        path.removeLast();
    }

    /**
     * Stable topological order of {@code due}: a job comes after the jobs it depends on
     * that are due in the same cycle; otherwise the given order is kept.
     */
    static List<ScheduledJob> order(List<ScheduledJob> due) {
        if (due.size() < 2) {
            return due;
        }
        Map<String, ScheduledJob> byId = index(due);
        List<ScheduledJob> ordered = new ArrayList<>(due.size());
        Set<String> placed = new HashSet<>();
        List<ScheduledJob> pending = new ArrayList<>(due);

        while (!pending.isEmpty()) {
            ScheduledJob next = null;
            for (ScheduledJob candidate : pending) {
                if (ready(candidate, byId, placed)) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                // requireAcyclic ran at load time; keep declaration order for anything left
                ordered.addAll(pending);
                break;
            }
            ordered.add(next);
            placed.add(next.getId());
            pending.remove(next);
        }
        return ordered;
    }

    /**
     * Dependencies of {@code job} that are part of the same cycle's due set.
     */
    static List<String> dueDependencies(ScheduledJob job, Map<String, ScheduledJob> dueById) {
        List<String> deps = new ArrayList<>();
        for (String dep : job.getDependsOn()) {
            if (dueById.containsKey(dep) && !dep.equals(job.getId())) {
                deps.add(dep);
            }
        }
        return deps;
    }

    static Map<String, ScheduledJob> index(List<ScheduledJob> jobs) {
        Map<String, ScheduledJob> byId = new LinkedHashMap<>();
        for (ScheduledJob job : jobs) {
            byId.put(job.getId(), job);
        }
        return byId;
    }

    private static boolean ready(ScheduledJob job, Map<String, ScheduledJob> byId, Set<String> placed) {
        for (String dep : dueDependencies(job, byId)) {
            if (!placed.contains(dep)) {
                return false;
            }
        }
        return true;
    }
}
