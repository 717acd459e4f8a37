package com.neal.snowchange;

import com.neal.snowchange.config.ChangeHistoryTable;
import com.neal.snowchange.config.MigrationConfig;
import com.neal.snowchange.domain.ChangeHistory;
import com.neal.snowchange.domain.ChangeScript;
import com.neal.snowchange.domain.MigrationResult;
import com.neal.snowchange.domain.MigrationState;
import com.neal.snowchange.domain.VersionKey;
import com.neal.snowchange.jdbc.ConnectionProvider;
import com.neal.snowchange.jdbc.JdbcSqlExecutor;
import com.neal.snowchange.jdbc.SnowflakeConnectionProvider;
import com.neal.snowchange.jdbc.SqlExecutor;
import com.neal.snowchange.service.ChangeHistoryStore;
import com.neal.snowchange.service.MigrationPlanner;
import com.neal.snowchange.service.ScriptApplier;
import com.neal.snowchange.service.ScriptCatalogService;
import com.neal.snowchange.service.SnowflakeChangeHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies pending change scripts from a root folder to a Snowflake account, one at a time, in
 * version order.
 *
 * @author Neal
 */
public class SnowMigration {
    public static final String VERSION = "2.2.0";

    private final Logger logger = LoggerFactory.getLogger(SnowMigration.class);
    private final MigrationConfig config;
    private final ChangeHistoryStore historyStore;
    private final ScriptCatalogService catalogService;
    private final MigrationPlanner planner;
    private final ScriptApplier applier;
    private MigrationState state = MigrationState.INIT;

    public SnowMigration(MigrationConfig config) {
        this(config, new SnowflakeConnectionProvider(config));
    }

    private SnowMigration(MigrationConfig config, ConnectionProvider connectionProvider) {
        this(config, new SnowflakeChangeHistoryStore(connectionProvider), new JdbcSqlExecutor(connectionProvider));
    }

    public SnowMigration(MigrationConfig config, ChangeHistoryStore historyStore, SqlExecutor sqlExecutor) {
        this.config = config;
        this.historyStore = historyStore;
        this.catalogService = new ScriptCatalogService();
        this.planner = new MigrationPlanner();
        this.applier = new ScriptApplier(sqlExecutor, historyStore, config.getUser());
    }

    public MigrationState getState() {
        return state;
    }

    /**
     * do script migration
     */
    public MigrationResult migration() {
        if (state != MigrationState.INIT) {
            throw new IllegalStateException("Migration already ran, state " + state);
        }
        logger.info("snowchange version: {}", VERSION);
        logger.info("Using root folder {}", config.getRootFolder());
        try {
            return migrate();
        } catch (RuntimeException e) {
            state = MigrationState.FAILED;
            throw e;
        }
    }

    private MigrationResult migrate() {
        ChangeHistoryTable table = config.getChangeHistoryTable();
        historyStore.ensureTable(table);
        logger.info("Using change history table {}", table);
        List<String> appliedVersions = historyStore.fetchAppliedVersions(table);
        String maxApplied = planner.watermark(appliedVersions).map(VersionKey::getRaw).orElse(null);
        logger.info("Max applied change script version: {}", maxApplied == null ? "None" : maxApplied);
        logger.debug("Change history: {}", appliedVersions);
        state = MigrationState.HISTORY_READY;

        Map<String, ChangeScript> catalog = catalogService.discover(config.getRootFolder());
        state = MigrationState.CATALOGED;

        List<ChangeScript> plan = planner.plan(catalog, appliedVersions);
        if (logger.isDebugEnabled()) {
            catalog.values().stream().filter(script -> !plan.contains(script)).forEach(script ->
                logger.debug("Skipping change script {} because it's older than the most recently applied change ({})", script.getName(), maxApplied));
        }
        state = MigrationState.PLANNED;

        List<ChangeHistory> histories = new ArrayList<>();
        for (ChangeScript script : plan) {
            state = MigrationState.APPLYING;
            logger.info("Applying change script {}", script.getName());
            histories.add(applier.apply(script, table));
        }
        state = MigrationState.DONE;

        MigrationResult result = new MigrationResult(catalog.size() - plan.size(), histories);
        logger.info(result.summary());
        logger.info("Completed successfully");
        return result;
    }
}
