package com.neal.snowchange.service;

import com.neal.snowchange.domain.ChangeScript;
import com.neal.snowchange.domain.ScriptType;
import org.junit.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author Neal
 */
public class MigrationPlannerTest {
    private final MigrationPlanner planner = new MigrationPlanner();

    @Test
    public void testPlanSelectsVersionsAboveWatermark() {
        List<ChangeScript> plan = planner.plan(catalog("2.0", "1.2", "1.0", "1.1"), List.of("1.0", "1.1"));

        assertEquals(List.of("1.2", "2.0"), versions(plan));
    }

    @Test
    public void testWatermarkSkipsUnrecordedLowerVersion() {
        List<ChangeScript> plan = planner.plan(catalog("1.5", "2.0", "2.1"), List.of("2.0"));

        assertEquals(List.of("2.1"), versions(plan));
    }

    @Test
    public void testEmptyHistoryPlansEverythingInOrder() {
        List<ChangeScript> plan = planner.plan(catalog("10", "9", "1.10", "1.9"), List.of());

        assertEquals(List.of("1.9", "1.10", "9", "10"), versions(plan));
    }

    @Test
    public void testWatermarkUsesVersionOrderNotStorageOrder() {
        assertEquals("1.10", planner.watermark(List.of("1.10", "1.9", "1.2")).orElseThrow().getRaw());
        assertFalse(planner.watermark(List.of()).isPresent());
    }

    @Test
    public void testNothingPendingWhenUpToDate() {
        assertTrue(planner.plan(catalog("1", "2"), List.of("2", "1")).isEmpty());
    }

    private static Map<String, ChangeScript> catalog(String... versions) {
        Map<String, ChangeScript> catalog = new LinkedHashMap<>();
        for (String version : versions) {
            String name = "V" + version + "__change.sql";
            catalog.put(name, new ChangeScript(name, Path.of(name), ScriptType.VERSIONED, version, "Change"));
        }
        return catalog;
    }

    private static List<String> versions(List<ChangeScript> plan) {
        return plan.stream().map(ChangeScript::getVersion).collect(Collectors.toList());
    }
}
