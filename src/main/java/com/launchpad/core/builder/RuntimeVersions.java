package com.launchpad.core.builder;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of toolchain version strings ("8.0.404", "v20.11.1", "Python 3.12.1").
 */
public final class RuntimeVersions {

    private static final Pattern LEADING_VERSION = Pattern.compile("^\\D*?(\\d+)(?:\\.(\\d+))?");

    private RuntimeVersions() {}

    /** "8.0.404" -> 8, "v20.11.1" -> 20. Empty when there is no number or it does not fit an int. */
    public static Optional<Integer> major(String version) {
        if (version == null) {
            return Optional.empty();
        }
        Matcher m = LEADING_VERSION.matcher(version.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** "8.0.404" -> "8.0", "Python 3.12.1" -> "3.12"; a bare major gets ".0". */
    public static Optional<String> majorMinor(String version) {
        if (version == null) {
            return Optional.empty();
        }
        Matcher m = LEADING_VERSION.matcher(version.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1) + "." + (m.group(2) != null ? m.group(2) : "0"));
    }
}
