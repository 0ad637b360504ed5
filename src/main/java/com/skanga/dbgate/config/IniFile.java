package com.skanga.dbgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal INI reader used for the server configuration and the data source registry.
 * Section names keep their case, keys are lower-cased, and both {@code key=value}
 * and {@code key: value} forms are accepted. Lines starting with {@code #} or {@code ;}
 * are comments. Section and key order is preserved.
 */
public final class IniFile {
    private static final Logger logger = LoggerFactory.getLogger(IniFile.class);

    private final Map<String, Map<String, String>> sections;

    private IniFile(Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    /**
     * Reads and parses an INI file.
     *
     * @param iniPath path of the file
     * @return the parsed file
     * @throws IOException if the file cannot be read, or a key appears before any section
     */
    public static IniFile load(Path iniPath) throws IOException {
        try (BufferedReader bufferedReader = Files.newBufferedReader(iniPath, StandardCharsets.UTF_8)) {
            return parse(bufferedReader, iniPath.toString());
        }
    }

    /**
     * Parses INI content from a reader. The source name is only used in log and error messages.
     */
    public static IniFile parse(Reader iniReader, String sourceName) throws IOException {
        Map<String, Map<String, String>> parsed = new LinkedHashMap<>();
        BufferedReader bufferedReader = iniReader instanceof BufferedReader
                ? (BufferedReader) iniReader : new BufferedReader(iniReader);

        Map<String, String> currSection = null;
        String currLine;
        int lineNumber = 0;

        while ((currLine = bufferedReader.readLine()) != null) {
            lineNumber++;
            currLine = currLine.trim();

            if (currLine.isEmpty() || currLine.startsWith("#") || currLine.startsWith(";")) {
                continue;
            }

            if (currLine.startsWith("[") && currLine.endsWith("]")) {
                String sectionName = currLine.substring(1, currLine.length() - 1).trim();
                if (sectionName.isEmpty()) {
                    logger.warn("Empty section name on line {} in {}", lineNumber, sourceName);
                    currSection = null;
                    continue;
                }
                currSection = parsed.computeIfAbsent(sectionName, k -> new LinkedHashMap<>());
                continue;
            }

            int separatorIndex = separatorIndex(currLine);
            if (separatorIndex <= 0) {
                logger.warn("Invalid line {} in {}: {}", lineNumber, sourceName, currLine);
                continue;
            }
            if (currSection == null) {
                throw new IOException(ResourceManager.getErrorMessage("config.ini.no.section", lineNumber, sourceName));
            }

            String paramKey = currLine.substring(0, separatorIndex).trim().toLowerCase(Locale.ROOT);
            String paramValue = unquote(currLine.substring(separatorIndex + 1).trim());
            currSection.put(paramKey, paramValue);
            logger.trace("Loaded ini value: {} = {}", paramKey,
                    paramKey.contains("password") || paramKey.equals("pwd") ? "***" : paramValue);
        }

        logger.debug("Parsed {} sections from {}", parsed.size(), sourceName);
        return new IniFile(parsed);
    }

    // Whichever of '=' or ':' comes first separates key from value
    private static int separatorIndex(String line) {
        int equalsIndex = line.indexOf('=');
        int colonIndex = line.indexOf(':');
        if (equalsIndex < 0) {
            return colonIndex;
        }
        if (colonIndex < 0) {
            return equalsIndex;
        }
        return Math.min(equalsIndex, colonIndex);
    }

    private static String unquote(String paramValue) {
        if (paramValue.length() >= 2) {
            if ((paramValue.startsWith("\"") && paramValue.endsWith("\""))
                    || (paramValue.startsWith("'") && paramValue.endsWith("'"))) {
                return paramValue.substring(1, paramValue.length() - 1);
            }
        }
        return paramValue;
    }

    public Map<String, Map<String, String>> sections() {
        return Collections.unmodifiableMap(sections);
    }

    public boolean hasSection(String sectionName) {
        return sections.containsKey(sectionName);
    }

    /**
     * Returns the keys of a section, or an empty map if the section does not exist.
     */
    public Map<String, String> section(String sectionName) {
        Map<String, String> section = sections.get(sectionName);
        return section == null ? Map.of() : Collections.unmodifiableMap(section);
    }
}
