package com.neal.snowchange.service;

import com.neal.snowchange.config.ChangeHistoryTable;
import com.neal.snowchange.domain.ChangeHistory;
import com.neal.snowchange.exception.MigrationException;
import com.neal.snowchange.jdbc.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * @author Neal
 */
public class SnowflakeChangeHistoryStore implements ChangeHistoryStore {
    static final String COLUMNS = "VERSION VARCHAR, DESCRIPTION VARCHAR, SCRIPT VARCHAR, SCRIPT_TYPE VARCHAR, CHECKSUM VARCHAR, "
        + "EXECUTION_TIME NUMBER, STATUS VARCHAR, INSTALLED_BY VARCHAR, INSTALLED_ON TIMESTAMP_LTZ";

    private final Logger logger = LoggerFactory.getLogger(SnowflakeChangeHistoryStore.class);
    private final ConnectionProvider connectionProvider;

    public SnowflakeChangeHistoryStore(ConnectionProvider connectionProvider) {
        this.connectionProvider = connectionProvider;
    }

    @Override
    public void ensureTable(ChangeHistoryTable table) {
        execute("", "CREATE DATABASE IF NOT EXISTS " + table.getDatabaseName(), table);
        execute(table.getDatabaseName(), "CREATE SCHEMA IF NOT EXISTS " + table.getSchemaName(), table);
        execute(table.getDatabaseName(), "CREATE TABLE IF NOT EXISTS " + table.schemaQualifiedName() + " (" + COLUMNS + ")", table);
    }

    @Override
    public List<String> fetchAppliedVersions(ChangeHistoryTable table) {
        String query = "SELECT VERSION FROM " + table.schemaQualifiedName();
        logger.debug("SQL query: {}", query);
        List<String> versions = new ArrayList<>();
        try (Connection connection = connectionProvider.open(table.getDatabaseName());
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(query)) {
            while (resultSet.next()) {
                versions.add(resultSet.getString(1));
            }
        } catch (SQLException e) {
            throw new MigrationException("Can't read change history table " + table, e);
        }
        return versions;
    }

    @Override
    public void record(ChangeHistoryTable table, ChangeHistory history) {
        String insert = "INSERT INTO " + table.schemaQualifiedName()
            + " (VERSION, DESCRIPTION, SCRIPT, SCRIPT_TYPE, CHECKSUM, EXECUTION_TIME, STATUS, INSTALLED_BY, INSTALLED_ON)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)";
        logger.debug("SQL query: {} [{}]", insert, history.version);
        try (Connection connection = connectionProvider.open(table.getDatabaseName());
             PreparedStatement statement = connection.prepareStatement(insert)) {
            statement.setString(1, history.version);
            statement.setString(2, history.description);
            statement.setString(3, history.script);
            statement.setString(4, history.scriptType);
            statement.setString(5, history.checksum);
            statement.setLong(6, history.executionTime);
            statement.setString(7, history.status);
            statement.setString(8, history.installedBy);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new MigrationException(String.format("Can't record change script %s in change history table %s", history.script, table), e);
        }
    }

    private void execute(String database, String sql, ChangeHistoryTable table) {
        logger.debug("SQL query: {}", sql);
        try (Connection connection = connectionProvider.open(database);
             Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new MigrationException("Can't create change history table " + table, e);
        }
    }
}
