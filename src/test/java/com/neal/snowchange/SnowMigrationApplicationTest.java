package com.neal.snowchange;

import com.neal.snowchange.config.Credentials;
import com.neal.snowchange.config.MigrationConfig;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * @author Neal
 */
public class SnowMigrationApplicationTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final InMemoryChangeHistoryStore store = new InMemoryChangeHistoryStore();
    private final RecordingSqlExecutor executor = new RecordingSqlExecutor();
    private final AtomicReference<MigrationConfig> created = new AtomicReference<>();

    @Test
    public void testSuccessfulRunExitsWithZero() throws IOException {
        Files.writeString(new File(folder.getRoot(), "V1__init.sql").toPath(), "SELECT 1;", StandardCharsets.UTF_8);

        int status = SnowMigrationApplication.run(args(folder.getRoot().getPath()), Map.of(Credentials.PASSWORD_ENV, "secret"), this::migration);

        assertEquals(SnowMigrationApplication.EXIT_SUCCESS, status);
        assertEquals(1, store.rows.size());
        assertEquals("DEPLOYER", created.get().getUser());
        assertEquals("METADATA.SNOWCHANGE.CHANGE_HISTORY", created.get().getChangeHistoryTable().fullyQualifiedName());
    }

    @Test
    public void testMissingCredentialsFailBeforeFilesystemAccess() {
        int status = SnowMigrationApplication.run(args("/does/not/exist"), Map.of(), this::migration);

        assertEquals(SnowMigrationApplication.EXIT_FAILURE, status);
        assertNull(created.get());
    }

    @Test
    public void testInvalidRootFolderFails() {
        int status = SnowMigrationApplication.run(args(new File(folder.getRoot(), "missing").getPath()),
            Map.of(Credentials.PASSWORD_ENV, "secret"), this::migration);

        assertEquals(SnowMigrationApplication.EXIT_FAILURE, status);
        assertNull(created.get());
    }

    @Test
    public void testScriptFailureExitsWithOne() throws IOException {
        Files.writeString(new File(folder.getRoot(), "V1__broken.sql").toPath(), "BROKEN", StandardCharsets.UTF_8);
        executor.failOn = "BROKEN";

        int status = SnowMigrationApplication.run(args(folder.getRoot().getPath()), Map.of(Credentials.PASSWORD_ENV, "secret"), this::migration);

        assertEquals(SnowMigrationApplication.EXIT_FAILURE, status);
        assertTrue(store.rows.isEmpty());
    }

    @Test
    public void testHelp() {
        assertEquals(SnowMigrationApplication.EXIT_SUCCESS, SnowMigrationApplication.run(new String[]{"--help"}, Map.of(), this::migration));
    }

    private SnowMigration migration(MigrationConfig config) {
        created.set(config);
        return new SnowMigration(config, store, executor);
    }

    private static String[] args(String rootFolder) {
        return new String[]{"-f", rootFolder, "-a", "ly12345", "-u", "DEPLOYER", "-r", "DEPLOYER_ROLE", "-w", "DEPLOYER_WH"};
    }
}
