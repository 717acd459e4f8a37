package com.neal.snowchange.jdbc;

import com.neal.snowchange.config.Credentials;
import com.neal.snowchange.config.MigrationConfig;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author Neal
 */
public class SnowflakeConnectionProviderTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testPasswordProperties() {
        SnowflakeConnectionProvider provider = new SnowflakeConnectionProvider(config(Credentials.fromEnvironment(Map.of(Credentials.PASSWORD_ENV, "secret"), null)));

        Properties properties = provider.connectionProperties("METADATA");

        assertEquals("jdbc:snowflake://ly12345.us-east-2.aws.snowflakecomputing.com/", provider.url());
        assertEquals("DEPLOYER", properties.get("user"));
        assertEquals("DEPLOYER_ROLE", properties.get("role"));
        assertEquals("DEPLOYER_WH", properties.get("warehouse"));
        assertEquals("METADATA", properties.get("db"));
        assertEquals("secret", properties.get("password"));
        assertEquals("0", properties.get("MULTI_STATEMENT_COUNT"));
        assertFalse(properties.containsKey("private_key_file"));
    }

    @Test
    public void testPrivateKeyProperties() {
        Credentials credentials = Credentials.fromEnvironment(Map.of(Credentials.PASSPHRASE_ENV, "phrase"), Path.of("keys", "rsa_key.p8"));
        SnowflakeConnectionProvider provider = new SnowflakeConnectionProvider(config(credentials));

        Properties properties = provider.connectionProperties("");

        assertTrue(properties.get("private_key_file").toString().endsWith("rsa_key.p8"));
        assertEquals("phrase", properties.get("private_key_file_pwd"));
        assertFalse(properties.containsKey("password"));
        assertFalse(properties.containsKey("db"));
    }

    private MigrationConfig config(Credentials credentials) {
        return MigrationConfig.builder()
            .rootFolder(folder.getRoot().toPath())
            .account("ly12345.us-east-2.aws")
            .user("DEPLOYER")
            .role("DEPLOYER_ROLE")
            .warehouse("DEPLOYER_WH")
            .credentials(credentials)
            .build();
    }
}
