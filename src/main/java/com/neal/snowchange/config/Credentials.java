package com.neal.snowchange.config;

import com.neal.snowchange.exception.ConfigurationException;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Authentication material read from the environment. Either a password, or a private key file
 * plus the passphrase that decrypts it.
 *
 * @author Neal
 */
public final class Credentials {
    public static final String PASSWORD_ENV = "SNOWSQL_PWD";
    public static final String PASSPHRASE_ENV = "SNOWSQL_PRIVATE_KEY_PASSPHRASE";

    private final String password;
    private final Path privateKeyFile;
    private final String privateKeyPassphrase;

    private Credentials(String password, Path privateKeyFile, String privateKeyPassphrase) {
        this.password = password;
        this.privateKeyFile = privateKeyFile;
        this.privateKeyPassphrase = privateKeyPassphrase;
    }

    public static Credentials fromEnvironment(Map<String, String> environment, Path privateKeyFile) {
        String password = environment.get(PASSWORD_ENV);
        String passphrase = environment.get(PASSPHRASE_ENV);
        if (password == null && (privateKeyFile == null || passphrase == null)) {
            throw new ConfigurationException("No value set in " + PASSWORD_ENV + " environment variable, and either the private-key-file "
                + "or the " + PASSPHRASE_ENV + " environment variable is not set. One of these authentication methods "
                + "must be used to connect to Snowflake.");
        }
        if (privateKeyFile != null && passphrase != null) {
            return new Credentials(password, privateKeyFile.toAbsolutePath(), passphrase);
        }
        return new Credentials(password, null, null);
    }

    public boolean usesPrivateKey() {
        return privateKeyFile != null;
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    public Optional<Path> getPrivateKeyFile() {
        return Optional.ofNullable(privateKeyFile);
    }

    public Optional<String> getPrivateKeyPassphrase() {
        return Optional.ofNullable(privateKeyPassphrase);
    }

    @Override
    public String toString() {
        return usesPrivateKey() ? "Credentials{privateKeyFile=" + privateKeyFile + "}" : "Credentials{password=****}";
    }
}
