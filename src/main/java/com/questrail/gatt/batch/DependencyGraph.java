package com.questrail.gatt.batch;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.characteristic.Characteristic;
import com.questrail.gatt.error.DependencyCycleException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decode order for the members of one batch.
 *
 * <p>
 * Edges run from a dependency to its dependent and are restricted to
 * characteristics present in the batch; dependencies satisfied by an
 * earlier context impose no ordering. Kahn's algorithm produces the order,
 * breaking ties by uuid so the result does not depend on map iteration
 * order. Required and optional dependencies both create edges, so an
 * optional dependency present in the batch is always decoded first.
 * </p>
 */
final class DependencyGraph
{
    private final Map<CharacteristicUuid, Characteristic<?>> members;
    private final Map<CharacteristicUuid, Set<CharacteristicUuid>> dependents = new HashMap<>();
    private final Map<CharacteristicUuid, Set<CharacteristicUuid>> dependencies = new HashMap<>();

    DependencyGraph(Map<CharacteristicUuid, Characteristic<?>> members) {
        this.members = new TreeMap<>(Objects.requireNonNull(members, "members"));
        for (CharacteristicUuid uuid : this.members.keySet()) {
            dependents.put(uuid, new TreeSet<>());
            dependencies.put(uuid, new TreeSet<>());
        }
        for (Map.Entry<CharacteristicUuid, Characteristic<?>> e : this.members.entrySet()) {
            for (CharacteristicUuid dep : e.getValue().dependencies().all()) {
                if (this.members.containsKey(dep)) {
                    dependents.get(dep).add(e.getKey());
                    dependencies.get(e.getKey()).add(dep);
                }
            }
        }
    }

    /**
     * @throws DependencyCycleException if the batch members depend on each
     *                                  other in a cycle
     */
    List<CharacteristicUuid> order() {
        Map<CharacteristicUuid, Integer> inDegree = new HashMap<>();
        TreeSet<CharacteristicUuid> ready = new TreeSet<>();
        for (CharacteristicUuid uuid : members.keySet()) {
            int degree = dependencies.get(uuid).size();
            inDegree.put(uuid, degree);
            if (degree == 0) {
                ready.add(uuid);
            }
        }

        List<CharacteristicUuid> order = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            CharacteristicUuid next = ready.pollFirst();
            order.add(next);
            for (CharacteristicUuid dependent : dependents.get(next)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < members.size()) {
            Set<CharacteristicUuid> blocked = new TreeSet<>(members.keySet());
            blocked.removeAll(order);
            throw new DependencyCycleException(describe(findCycle(blocked)));
        }
        return order;
    }

    /**
     * Follows dependency edges among the blocked nodes until a node repeats.
     * The returned path reads "requires": {@code a, b, a} means a requires b
     * and b requires a.
     * Every blocked node has at least one blocked dependency, so the walk
     * always closes.
     */
    private List<CharacteristicUuid> findCycle(Set<CharacteristicUuid> blocked) {
        List<CharacteristicUuid> path = new ArrayList<>();
        Set<CharacteristicUuid> visited = new HashSet<>();
        CharacteristicUuid current = blocked.iterator().next();
        while (visited.add(current)) {
            path.add(current);
            CharacteristicUuid next = null;
            for (CharacteristicUuid dep : dependencies.get(current)) {
                if (blocked.contains(dep)) {
                    next = dep;
                    break;
                }
            }
            current = next;
        }
        List<CharacteristicUuid> cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
        cycle.add(current);
        return cycle;
    }

    private List<String> describe(List<CharacteristicUuid> cycle) {
        List<String> names = new ArrayList<>(cycle.size());
        for (CharacteristicUuid uuid : cycle) {
            names.add(members.get(uuid).name() + " (" + uuid + ")");
        }
        return names;
    }
}
