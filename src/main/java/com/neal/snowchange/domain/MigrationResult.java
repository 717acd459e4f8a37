package com.neal.snowchange.domain;

import java.util.List;

/**
 * @author Neal
 */
public class MigrationResult {
    private final int applied;
    private final int skipped;
    private final List<ChangeHistory> histories;

    public MigrationResult(int skipped, List<ChangeHistory> histories) {
        this.applied = histories.size();
        this.skipped = skipped;
        this.histories = List.copyOf(histories);
    }

    public int getApplied() {
        return applied;
    }

    public int getSkipped() {
        return skipped;
    }

    public List<ChangeHistory> getHistories() {
        return histories;
    }

    public String summary() {
        return String.format("Successfully applied %d change scripts (skipping %d)", applied, skipped);
    }
}
