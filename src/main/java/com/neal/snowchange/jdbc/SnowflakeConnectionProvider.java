package com.neal.snowchange.jdbc;

import com.neal.snowchange.config.Credentials;
import com.neal.snowchange.config.MigrationConfig;
import com.neal.snowchange.exception.ConnectionException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * @author Neal
 */
public class SnowflakeConnectionProvider implements ConnectionProvider {
    private final MigrationConfig config;

    public SnowflakeConnectionProvider(MigrationConfig config) {
        this.config = config;
    }

    @Override
    public Connection open(String database) {
        try {
            return DriverManager.getConnection(url(), connectionProperties(database));
        } catch (SQLException e) {
            throw new ConnectionException(String.format("Can't connect to Snowflake account %s as %s: %s", config.getAccount(), config.getUser(), e.getMessage()), e);
        }
    }

    String url() {
        return "jdbc:snowflake://" + config.getAccount() + ".snowflakecomputing.com/";
    }

    Properties connectionProperties(String database) {
        Properties properties = new Properties();
        properties.put("user", config.getUser());
        properties.put("role", config.getRole());
        properties.put("warehouse", config.getWarehouse());
        if (database != null && !database.isEmpty()) {
            properties.put("db", database);
        }
        Credentials credentials = config.getCredentials();
        if (credentials.usesPrivateKey()) {
            properties.put("private_key_file", credentials.getPrivateKeyFile().orElseThrow().toString());
            properties.put("private_key_file_pwd", credentials.getPrivateKeyPassphrase().orElseThrow());
        } else {
            properties.put("authenticator", "snowflake");
            properties.put("password", credentials.getPassword().orElseThrow());
        }
        // scripts may hold several statements
        properties.put("MULTI_STATEMENT_COUNT", "0");
        properties.put("JDBC_QUERY_RESULT_FORMAT", "JSON");
        return properties;
    }
}
