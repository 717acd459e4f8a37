package com.neal.snowchange.service;

import com.neal.snowchange.domain.ChangeScript;
import com.neal.snowchange.domain.VersionKey;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects the scripts to apply. History is read as a single watermark, the highest applied
 * version; anything at or below it is skipped whether or not it was ever recorded.
 *
 * @author Neal
 */
public class MigrationPlanner {
    static final Comparator<ChangeScript> VERSION_ORDER = Comparator.comparing(ChangeScript::getVersionKey)
        .thenComparing(ChangeScript::getName);

    public Optional<VersionKey> watermark(Collection<String> appliedVersions) {
        return appliedVersions.stream().map(VersionKey::parse).max(Comparator.naturalOrder());
    }

    /**
     * @return pending scripts in the order they must be applied
     */
    public List<ChangeScript> plan(Map<String, ChangeScript> catalog, Collection<String> appliedVersions) {
        Optional<VersionKey> maxApplied = watermark(appliedVersions);
        return catalog.values().stream()
            .sorted(VERSION_ORDER)
            .filter(script -> maxApplied.map(max -> script.getVersionKey().isGreaterThan(max)).orElse(true))
            .collect(Collectors.toList());
    }
}
