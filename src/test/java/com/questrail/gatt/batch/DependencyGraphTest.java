package com.questrail.gatt.batch;

import com.questrail.gatt.api.CharacteristicUuid;
import com.questrail.gatt.characteristic.Characteristic;
import com.questrail.gatt.characteristic.DependencyDeclaration;
import com.questrail.gatt.characteristic.TestCharacteristics;
import com.questrail.gatt.error.DependencyCycleException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DependencyGraphTest
{
    private static final CharacteristicUuid ONE = TestCharacteristics.uuid("0001");
    private static final CharacteristicUuid TWO = TestCharacteristics.uuid("0002");
    private static final CharacteristicUuid THREE = TestCharacteristics.uuid("0003");
    private static final CharacteristicUuid OUTSIDE = TestCharacteristics.uuid("00FF");

    private static Map<CharacteristicUuid, Characteristic<?>> members(Characteristic<?>... cs) {
        Map<CharacteristicUuid, Characteristic<?>> m = new LinkedHashMap<>();
        for (Characteristic<?> c : cs) {
            m.put(c.uuid(), c);
        }
        return m;
    }

    @Test
    void independentMembersAreOrderedByUuid()
    {
        DependencyGraph graph = new DependencyGraph(members(
                TestCharacteristics.counter(THREE, "3"),
                TestCharacteristics.counter(ONE, "1"),
                TestCharacteristics.counter(TWO, "2")));

        assertEquals(List.of(ONE, TWO, THREE), graph.order());
    }

    @Test
    void chainIsOrderedDependencyFirst()
    {
        DependencyGraph graph = new DependencyGraph(members(
                TestCharacteristics.counter(ONE, "1", DependencyDeclaration.requires(TWO)),
                TestCharacteristics.counter(TWO, "2", DependencyDeclaration.requires(THREE)),
                TestCharacteristics.counter(THREE, "3")));

        assertEquals(List.of(THREE, TWO, ONE), graph.order());
    }

    @Test
    void optionalDependencyInBatchAlsoOrders()
    {
        DependencyGraph graph = new DependencyGraph(members(
                TestCharacteristics.counter(ONE, "1", DependencyDeclaration.optional(TWO)),
                TestCharacteristics.counter(TWO, "2")));

        assertEquals(List.of(TWO, ONE), graph.order());
    }

    @Test
    void dependencyOutsideBatchImposesNoOrder()
    {
        DependencyGraph graph = new DependencyGraph(members(
                TestCharacteristics.counter(ONE, "1", DependencyDeclaration.requires(OUTSIDE)),
                TestCharacteristics.counter(TWO, "2")));

        assertEquals(List.of(ONE, TWO), graph.order());
    }

    @Test
    void selfDependencyIsACycle()
    {
        DependencyGraph graph = new DependencyGraph(members(
                TestCharacteristics.counter(ONE, "Loop", DependencyDeclaration.requires(ONE))));

        DependencyCycleException e = assertThrows(DependencyCycleException.class, graph::order);
        assertEquals(List.of("Loop (" + ONE + ")", "Loop (" + ONE + ")"), e.cycle());
    }

    @Test
    void cycleReportsRequiresPath()
    {
        DependencyGraph graph = new DependencyGraph(members(
                TestCharacteristics.counter(ONE, "One", DependencyDeclaration.requires(TWO)),
                TestCharacteristics.counter(TWO, "Two", DependencyDeclaration.requires(THREE)),
                TestCharacteristics.counter(THREE, "Three", DependencyDeclaration.requires(ONE))));

        DependencyCycleException e = assertThrows(DependencyCycleException.class, graph::order);

        assertEquals(List.of(
                "One (" + ONE + ")",
                "Two (" + TWO + ")",
                "Three (" + THREE + ")",
                "One (" + ONE + ")"), e.cycle());
    }
}
