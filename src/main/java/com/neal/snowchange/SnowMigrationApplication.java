package com.neal.snowchange;

import ch.qos.logback.classic.Level;
import com.neal.snowchange.config.ChangeHistoryTable;
import com.neal.snowchange.config.Credentials;
import com.neal.snowchange.config.MigrationConfig;
import com.neal.snowchange.exception.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

/**
 * Command line entry point.
 *
 * @author Neal
 */
public class SnowMigrationApplication {
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger logger = LoggerFactory.getLogger(SnowMigrationApplication.class);

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), SnowMigration::new));
    }

    static int run(String[] args, Map<String, String> environment, Function<MigrationConfig, SnowMigration> migrationFactory) {
        try {
            CommandLineArguments arguments = CommandLineArguments.parse(args);
            if (arguments.isHelp()) {
                logger.info(CommandLineArguments.USAGE);
                return EXIT_SUCCESS;
            }
            if (arguments.isVerbose()) {
                enableVerboseLogging();
            }
            MigrationConfig config = toConfig(arguments, environment);
            migrationFactory.apply(config).migration();
            return EXIT_SUCCESS;
        } catch (MigrationException e) {
            logger.error(e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    static MigrationConfig toConfig(CommandLineArguments arguments, Map<String, String> environment) {
        Path privateKeyFile = arguments.getPrivateKeyFile() == null ? null : Path.of(arguments.getPrivateKeyFile());
        Credentials credentials = Credentials.fromEnvironment(environment, privateKeyFile);
        return MigrationConfig.builder()
            .credentials(credentials)
            .rootFolder(Path.of(arguments.getRootFolder()))
            .account(arguments.getAccount())
            .user(arguments.getUser())
            .role(arguments.getRole())
            .warehouse(arguments.getWarehouse())
            .changeHistoryTable(ChangeHistoryTable.parse(arguments.getChangeHistoryTable()))
            .build();
    }

    private static void enableVerboseLogging() {
        ch.qos.logback.classic.Logger packageLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(SnowMigration.class.getPackageName());
        packageLogger.setLevel(Level.DEBUG);
    }
}
