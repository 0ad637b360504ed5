package com.skanga.dbgate;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.stefanbirkner.systemlambda.SystemLambda.tapSystemOut;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliUtilsTest {
    @Test
    void testParseArgsForms() {
        Map<String, String> argsMap = CliUtils.parseArgs(new String[]{"--config=/etc/dbgate.ini", "-v"});

        assertEquals("/etc/dbgate.ini", argsMap.get("CONFIG"));
        assertEquals("true", argsMap.get("VERSION"));
    }

    @Test
    void testParseArgsSeparateValue() {
        assertEquals("a.ini", CliUtils.parseArgs(new String[]{"-c", "a.ini"}).get("CONFIG"));
        assertEquals("b.json", CliUtils.parseArgs(new String[]{"--config", "b.json"}).get("CONFIG"));
        assertEquals("c.ini", CliUtils.parseArgs(new String[]{"-c=c.ini"}).get("CONFIG"));
    }

    @Test
    void testUnknownOptionsIgnored() {
        Map<String, String> argsMap = CliUtils.parseArgs(new String[]{"-x", "stray", "--other=1"});

        assertFalse(argsMap.containsKey("X"));
        assertEquals("1", argsMap.get("OTHER"));
        assertEquals(1, argsMap.size());
    }

    @Test
    void testGetConfigPath() {
        assertEquals("cfg.ini", CliUtils.getConfigPath(new String[]{"--config", "cfg.ini"}));
        assertNull(CliUtils.getConfigPath(new String[]{"--config"}));
        assertNull(CliUtils.getConfigPath(new String[]{}));
    }

    @Test
    void testHelp() throws Exception {
        String output = tapSystemOut(() -> assertTrue(CliUtils.handleHelpAndVersion(new String[]{"--help"})));

        assertThat(output)
                .contains("Usage: java -jar dbgate-")
                .contains("--config")
                .contains("DBGATE_CONFIG");
    }

    @Test
    void testVersion() throws Exception {
        String output = tapSystemOut(() -> assertTrue(CliUtils.handleHelpAndVersion(new String[]{"-v"})));

        assertThat(output)
                .contains("dbgate v" + CliUtils.SERVER_VERSION)
                .contains("2025-06-18")
                .contains("H2 Database");
    }

    @Test
    void testNoHelpOrVersion() {
        assertFalse(CliUtils.handleHelpAndVersion(new String[]{"--config", "x.ini"}));
    }
}
