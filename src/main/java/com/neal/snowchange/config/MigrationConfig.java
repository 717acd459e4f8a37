package com.neal.snowchange.config;

import com.neal.snowchange.exception.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Connection and run parameters, resolved once at start and shared by every database call.
 *
 * @author Neal
 */
public final class MigrationConfig {
    private final Path rootFolder;
    private final String account;
    private final String user;
    private final String role;
    private final String warehouse;
    private final ChangeHistoryTable changeHistoryTable;
    private final Credentials credentials;

    private MigrationConfig(Builder builder) {
        this.rootFolder = builder.rootFolder;
        this.account = builder.account;
        this.user = builder.user;
        this.role = builder.role;
        this.warehouse = builder.warehouse;
        this.changeHistoryTable = builder.changeHistoryTable;
        this.credentials = builder.credentials;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getRootFolder() {
        return rootFolder;
    }

    public String getAccount() {
        return account;
    }

    public String getUser() {
        return user;
    }

    public String getRole() {
        return role;
    }

    public String getWarehouse() {
        return warehouse;
    }

    public ChangeHistoryTable getChangeHistoryTable() {
        return changeHistoryTable;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public static class Builder {
        private Path rootFolder = Path.of(".");
        private String account;
        private String user;
        private String role;
        private String warehouse;
        private ChangeHistoryTable changeHistoryTable = ChangeHistoryTable.defaults();
        private Credentials credentials;

        public Builder rootFolder(Path rootFolder) {
            this.rootFolder = rootFolder;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder warehouse(String warehouse) {
            this.warehouse = warehouse;
            return this;
        }

        public Builder changeHistoryTable(ChangeHistoryTable changeHistoryTable) {
            this.changeHistoryTable = changeHistoryTable;
            return this;
        }

        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        /**
         * credentials are checked first so a missing secret fails before the filesystem is read
         */
        public MigrationConfig build() {
            if (credentials == null) {
                throw new ConfigurationException("Credentials are required");
            }
            requireText(account, "snowflake-account");
            requireText(user, "snowflake-user");
            requireText(role, "snowflake-role");
            requireText(warehouse, "snowflake-warehouse");
            Objects.requireNonNull(changeHistoryTable, "changeHistoryTable");
            rootFolder = Objects.requireNonNull(rootFolder, "rootFolder").toAbsolutePath().normalize();
            if (!Files.isDirectory(rootFolder)) {
                throw new ConfigurationException("Invalid root folder: " + rootFolder);
            }
            return new MigrationConfig(this);
        }

        private static void requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new ConfigurationException("Missing required parameter " + name);
            }
        }
    }
}
