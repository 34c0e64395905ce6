package com.launchpad.core.builder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses dotenv files: one {@code KEY=VALUE} per line, {@code #} comments and blank lines
 * skipped, one pair of matching surrounding quotes stripped from the value.
 * Lines without a key or without a value are ignored. Later keys override earlier ones.
 */
public final class EnvFileParser {

    private EnvFileParser() {}

    public static Map<String, String> parse(Path envFile) throws IOException {
        return parse(Files.readAllLines(envFile, StandardCharsets.UTF_8));
    }

    public static Map<String, String> parse(List<String> lines) {
        var settings = new LinkedHashMap<String, String>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int equals = line.indexOf('=');
            if (equals <= 0 || equals >= line.length() - 1) {
                continue;
            }
            String key = line.substring(0, equals).trim();
            String value = unquote(line.substring(equals + 1).trim());
            if (!key.isEmpty()) {
                settings.put(key, value);
            }
        }
        return settings;
    }

    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
