package com.neal.snowchange.config;

import com.neal.snowchange.exception.ConfigurationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Database, schema and table holding the change history.
 *
 * @author Neal
 */
public final class ChangeHistoryTable {
    public static final String DEFAULT_DATABASE = "METADATA";
    public static final String DEFAULT_SCHEMA = "SNOWCHANGE";
    public static final String DEFAULT_TABLE = "CHANGE_HISTORY";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    private final String databaseName;
    private final String schemaName;
    private final String tableName;

    public ChangeHistoryTable(String databaseName, String schemaName, String tableName) {
        this.databaseName = databaseName;
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    public static ChangeHistoryTable defaults() {
        return new ChangeHistoryTable(DEFAULT_DATABASE, DEFAULT_SCHEMA, DEFAULT_TABLE);
    }

    /**
     * Resolve {@code table}, {@code schema.table} or {@code database.schema.table}; missing parts
     * keep their defaults. A null override yields the defaults.
     */
    public static ChangeHistoryTable parse(String override) {
        if (override == null) {
            return defaults();
        }
        String[] parts = override.strip().split("\\.", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = validate(parts[i], override);
        }
        switch (parts.length) {
            case 1:
                return new ChangeHistoryTable(DEFAULT_DATABASE, DEFAULT_SCHEMA, parts[0]);
            case 2:
                return new ChangeHistoryTable(DEFAULT_DATABASE, parts[0], parts[1]);
            case 3:
                return new ChangeHistoryTable(parts[0], parts[1], parts[2]);
            default:
                throw new ConfigurationException("Invalid change history table name: " + override);
        }
    }

    private static String validate(String part, String override) {
        if (!IDENTIFIER.matcher(part).matches()) {
            throw new ConfigurationException("Invalid change history table name: " + override);
        }
        return part.toUpperCase(Locale.ROOT);
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * schema.table, used inside a session already bound to the database
     */
    public String schemaQualifiedName() {
        return schemaName + "." + tableName;
    }

    public String fullyQualifiedName() {
        return databaseName + "." + schemaName + "." + tableName;
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
