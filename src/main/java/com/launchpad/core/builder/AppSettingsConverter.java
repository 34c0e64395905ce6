package com.launchpad.core.builder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pushes a project's {@code .env} values to an App Service web app with a single
 * {@code az webapp config appsettings set} call.
 */
@Component
public class AppSettingsConverter {

    private static final Logger log = LoggerFactory.getLogger(AppSettingsConverter.class);

    static final String ENV_FILE = ".env";
    private static final String AZ = "az";

    /**
     * @return true when there was nothing to convert or the settings were applied
     */
    public boolean convertIfPresent(Path projectDir, String resourceGroup, String appName,
                                    boolean verbose, BuildContext ctx) {
        Path envFile = projectDir.resolve(ENV_FILE);
        if (!Files.isRegularFile(envFile)) {
            log.info("No .env file found to convert to app settings");
            return true;
        }

        log.info("Converting .env file to app settings...");
        Map<String, String> settings;
        try {
            settings = EnvFileParser.parse(envFile);
        } catch (IOException e) {
            log.error("Could not read {}: {}", envFile, e.getMessage());
            return false;
        }
        if (settings.isEmpty()) {
            log.info("No valid environment variables found in .env file");
            return true;
        }
        settings.keySet().forEach(key -> log.debug("Found environment variable: {}", key));

        var args = buildArguments(resourceGroup, appName, settings);
        log.info("Setting {} environment variables as app settings...", settings.size());
        var result = BuilderSupport.run(ctx, projectDir, verbose, AZ, args);
        if (result.success()) {
            log.info("Converted {} environment variables to app settings", settings.size());
            return true;
        }
        log.error("Failed to set app settings: {}", result.stderr().strip());
        return false;
    }

    static List<String> buildArguments(String resourceGroup, String appName, Map<String, String> settings) {
        var args = new ArrayList<>(List.of("webapp", "config", "appsettings", "set",
                "-g", resourceGroup, "-n", appName, "--settings"));
        settings.forEach((key, value) -> args.add(key + "=" + value));
        return args;
    }
}
