package com.skanga.dbgate;

import com.skanga.dbgate.db.DriverFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Driver;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line handling: argument parsing, help and version output.
 * Help and version go to stdout because the protocol is not running yet when they are shown.
 */
class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    static final String SERVER_NAME = "dbgate";
    static final String SERVER_VERSION = "1.0.0";
    static final String SERVER_DESCRIPTION = "MCP gateway exposing JDBC databases as tools";

    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();
        shortToLong.put("h", "help");
        shortToLong.put("v", "version");
        shortToLong.put("c", "config");
        return shortToLong;
    }

    /**
     * Parses command line arguments into a map keyed by the upper-cased long option name.
     * Accepts {@code -k=value}, {@code -k value}, {@code --key=value}, {@code --key value},
     * and bare flags, which map to {@code "true"}.
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String key = null;
            String value;
            String optionText;
            boolean shortForm;

            if (currArg.startsWith("--")) {
                optionText = currArg.substring(2);
                shortForm = false;
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                optionText = currArg.substring(1);
                shortForm = true;
            } else {
                logger.warn("Ignoring unexpected argument: {}", currArg);
                continue;
            }

            if (optionText.contains("=")) {
                String[] argParts = optionText.split("=", 2);
                key = shortForm ? shortToLong.get(argParts[0]) : argParts[0];
                value = argParts[1];
            } else {
                key = shortForm ? shortToLong.get(optionText) : optionText;
                if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    value = args[i + 1];
                    i++;
                } else {
                    value = "true";
                }
            }

            if (key != null) {
                argsMap.put(key.toUpperCase(Locale.ROOT), value);
            } else {
                logger.warn("Unknown option: {}", currArg);
            }
        }

        return argsMap;
    }

    /**
     * Returns the configuration path given with {@code -c}/{@code --config}, or null.
     */
    static String getConfigPath(String[] args) {
        String configPath = parseArgs(args).get("CONFIG");
        return "true".equals(configPath) ? null : configPath;
    }

    /**
     * Displays help or version information if requested.
     *
     * @return true if something was displayed and the caller should exit
     */
    static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    static void displayHelp() {
        System.out.println(SERVER_NAME + " - " + SERVER_DESCRIPTION);
        System.out.println("Usage: java -jar dbgate-" + SERVER_VERSION + ".jar [OPTIONS]");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                 Show this help message and exit");
        System.out.println("  -v, --version              Show version information and exit");
        System.out.println("  -c, --config=<path>        Configuration file (.ini or .json)");
        System.out.println();
        System.out.println("CONFIGURATION LOOKUP (first match wins):");
        System.out.println("  1. --config <path>");
        System.out.println("  2. DBGATE_CONFIG environment variable or -Ddbgate.config=<path>");
        System.out.println("  3. mcpServerEnv.dbgate section of the Claude Desktop configuration");
        System.out.println("  4. ./config/config.ini");
        System.out.println();
        System.out.println("DATA SOURCES:");
        System.out.println("  Named data sources are read from DBGATE_DSN_FILE, -Ddbgate.dsn.file=<path>,");
        System.out.println("  or ~/.dbgate/datasources.ini");
        System.out.println();
        System.out.println("LOGGING:");
        System.out.println("  Logs are written to stderr. Set DBGATE_LOG_LEVEL (default: INFO).");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Versions: " + String.join(", ", McpServer.SUPPORTED_PROTOCOL_VERSIONS));
        System.out.println("Java Version: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
        System.out.println();
        showJdbcDrivers();
    }

    /**
     * Lists the JDBC drivers that are registered or loadable for the known driver families.
     */
    private static void showJdbcDrivers() {
        System.out.println("Available JDBC Drivers:");

        Map<String, String> foundDrivers = new LinkedHashMap<>();
        Enumeration<Driver> drivers = DriverManager.getDrivers();
        while (drivers.hasMoreElements()) {
            Driver driver = drivers.nextElement();
            String driverClass = driver.getClass().getName();
            foundDrivers.put(driverClass, String.format("%s v%d.%d",
                    driverClass, driver.getMajorVersion(), driver.getMinorVersion()));
        }

        for (DriverFamily driverFamily : DriverFamily.values()) {
            String driverClass = driverFamily.driverClassName();
            if (foundDrivers.containsKey(driverClass)) {
                foundDrivers.put(driverClass, driverFamily.displayName() + " -> " + foundDrivers.get(driverClass));
                continue;
            }
            try {
                Class.forName(driverClass);
                foundDrivers.put(driverClass, driverFamily.displayName() + " -> " + driverClass);
            } catch (ClassNotFoundException e) {
                logger.debug("Driver {} not on classpath", driverClass);
            }
        }

        if (foundDrivers.isEmpty()) {
            System.out.println("  No JDBC drivers found in classpath");
            return;
        }
        List<String> sortedDrivers = new ArrayList<>(foundDrivers.values());
        sortedDrivers.sort(String.CASE_INSENSITIVE_ORDER);
        for (String driverInfo : sortedDrivers) {
            System.out.println(" - " + driverInfo);
        }
    }
}
