package com.neal.snowchange;

import com.neal.snowchange.exception.ConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * @author Neal
 */
public class CommandLineArguments {
    static final String USAGE = String.join(System.lineSeparator(),
        "usage: snow-migration [-h] [-f ROOT_FOLDER] -a SNOWFLAKE_ACCOUNT -u SNOWFLAKE_USER [-k PRIVATE_KEY_FILE]",
        "                      -r SNOWFLAKE_ROLE -w SNOWFLAKE_WAREHOUSE [-c CHANGE_HISTORY_TABLE] [-v]",
        "",
        "Apply schema changes to a Snowflake account.",
        "",
        "  -h, --help                   show this help message and exit",
        "  -f, --root-folder            The root folder for the database change scripts (default: .)",
        "  -a, --snowflake-account      The name[.region[.provider]] of the snowflake account (e.g. ly12345.us-east-2.aws)",
        "  -u, --snowflake-user         The name of the snowflake user (e.g. DEPLOYER)",
        "  -k, --private-key-file       The path to the private key in PEM format. Requires SNOWSQL_PRIVATE_KEY_PASSPHRASE",
        "  -r, --snowflake-role         The name of the role to use (e.g. DEPLOYER_ROLE)",
        "  -w, --snowflake-warehouse    The name of the warehouse to use (e.g. DEPLOYER_WAREHOUSE)",
        "  -c, --change-history-table   Used to override the default name of the change history table (e.g. METADATA.SNOWCHANGE.CHANGE_HISTORY)",
        "  -v, --verbose                Print every SQL statement and skipped file");

    private static final Map<String, String> ALIASES = new HashMap<>();

    static {
        ALIASES.put("-f", "--root-folder");
        ALIASES.put("-a", "--snowflake-account");
        ALIASES.put("-u", "--snowflake-user");
        ALIASES.put("-k", "--private-key-file");
        ALIASES.put("-r", "--snowflake-role");
        ALIASES.put("-w", "--snowflake-warehouse");
        ALIASES.put("-c", "--change-history-table");
        ALIASES.put("-v", "--verbose");
        ALIASES.put("-h", "--help");
    }

    private String rootFolder = ".";
    private String account;
    private String user;
    private String privateKeyFile;
    private String role;
    private String warehouse;
    private String changeHistoryTable;
    private boolean verbose;
    private boolean help;

    public static CommandLineArguments parse(String... args) {
        CommandLineArguments arguments = new CommandLineArguments();
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            String value = null;
            int equals = flag.indexOf('=');
            if (flag.startsWith("--") && equals > 0) {
                value = flag.substring(equals + 1);
                flag = flag.substring(0, equals);
            }
            flag = ALIASES.getOrDefault(flag, flag);
            switch (flag) {
                case "--verbose":
                    arguments.verbose = true;
                    continue;
                case "--help":
                    arguments.help = true;
                    continue;
                default:
                    break;
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("Missing value for " + flag + System.lineSeparator() + USAGE);
                }
                value = args[++i];
            }
            arguments.assign(flag, value);
        }
        if (!arguments.help) {
            arguments.requirePresent();
        }
        return arguments;
    }

    private void assign(String flag, String value) {
        switch (flag) {
            case "--root-folder":
                rootFolder = value;
                break;
            case "--snowflake-account":
                account = value;
                break;
            case "--snowflake-user":
                user = value;
                break;
            case "--private-key-file":
                privateKeyFile = value;
                break;
            case "--snowflake-role":
                role = value;
                break;
            case "--snowflake-warehouse":
                warehouse = value;
                break;
            case "--change-history-table":
                changeHistoryTable = value;
                break;
            default:
                throw new ConfigurationException("Unknown argument " + flag + System.lineSeparator() + USAGE);
        }
    }

    private void requirePresent() {
        StringBuilder missing = new StringBuilder();
        appendIfMissing(missing, account, "--snowflake-account");
        appendIfMissing(missing, user, "--snowflake-user");
        appendIfMissing(missing, role, "--snowflake-role");
        appendIfMissing(missing, warehouse, "--snowflake-warehouse");
        if (missing.length() > 0) {
            throw new ConfigurationException("The following arguments are required: " + missing + System.lineSeparator() + USAGE);
        }
    }

    private static void appendIfMissing(StringBuilder missing, String value, String flag) {
        if (value == null) {
            missing.append(missing.length() == 0 ? "" : ", ").append(flag);
        }
    }

    public String getRootFolder() {
        return rootFolder;
    }

    public String getAccount() {
        return account;
    }

    public String getUser() {
        return user;
    }

    public String getPrivateKeyFile() {
        return privateKeyFile;
    }

    public String getRole() {
        return role;
    }

    public String getWarehouse() {
        return warehouse;
    }

    public String getChangeHistoryTable() {
        return changeHistoryTable;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isHelp() {
        return help;
    }
}
