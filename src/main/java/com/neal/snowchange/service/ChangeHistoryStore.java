package com.neal.snowchange.service;

import com.neal.snowchange.config.ChangeHistoryTable;
import com.neal.snowchange.domain.ChangeHistory;

import java.util.List;

/**
 * The persisted ledger of applied change scripts. Rows are only ever appended.
 *
 * @author Neal
 */
public interface ChangeHistoryStore {

    /**
     * Create the database, schema and table if they are missing. Safe to call on every run.
     */
    void ensureTable(ChangeHistoryTable table);

    /**
     * Every stored VERSION value, in no particular order.
     */
    List<String> fetchAppliedVersions(ChangeHistoryTable table);

    /**
     * Append one row. INSTALLED_ON is assigned by the store.
     */
    void record(ChangeHistoryTable table, ChangeHistory history);
}
