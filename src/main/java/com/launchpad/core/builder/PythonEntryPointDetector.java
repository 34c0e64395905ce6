package com.launchpad.core.builder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Works out the start command of a published Python application by looking at its top-level files.
 * <p>
 * Checked in order: agent host scripts, well-known entry file names, framework imports and
 * main guards inside any top-level module, fallback file names, and finally the first
 * {@code .py} file by name.
 */
final class PythonEntryPointDetector {

    private static final Logger log = LoggerFactory.getLogger(PythonEntryPointDetector.class);

    static final List<String> AGENT_ENTRY_POINTS = List.of("start_with_generic_host.py", "host_agent_server.py");

    private static final Map<String, String> WELL_KNOWN_ENTRY_POINTS = new LinkedHashMap<>();
    static {
        WELL_KNOWN_ENTRY_POINTS.put("app.py", "gunicorn --bind=0.0.0.0:8000 app:app");
        WELL_KNOWN_ENTRY_POINTS.put("main.py", "python main.py");
        WELL_KNOWN_ENTRY_POINTS.put("start.py", "python start.py");
        WELL_KNOWN_ENTRY_POINTS.put("server.py", "python server.py");
        WELL_KNOWN_ENTRY_POINTS.put("run.py", "python run.py");
        WELL_KNOWN_ENTRY_POINTS.put("wsgi.py", "gunicorn --bind=0.0.0.0:8000 wsgi:application");
        WELL_KNOWN_ENTRY_POINTS.put("asgi.py", "uvicorn asgi:application --host 0.0.0.0 --port 8000");
    }

    private static final List<String> FALLBACK_FILES = List.of("app.py", "start.py", "run.py", "server.py", "main.py");
    private static final String MAIN_GUARD = "if __name__ == \"__main__\":";

    private PythonEntryPointDetector() {}

    static Optional<String> detect(Path artifactPath) throws IOException {
        var agentEntry = bestAgentEntry(artifactPath);
        if (agentEntry.isPresent()) {
            log.info("Detected agent host entry point: {}", agentEntry.get());
            return Optional.of("python " + agentEntry.get());
        }

        for (var entry : WELL_KNOWN_ENTRY_POINTS.entrySet()) {
            if (Files.isRegularFile(artifactPath.resolve(entry.getKey()))) {
                log.info("Detected entry point: {}, using command: {}", entry.getKey(), entry.getValue());
                return Optional.of(entry.getValue());
            }
        }

        List<Path> pyFiles = topLevelPythonFiles(artifactPath);
        for (Path pyFile : pyFiles) {
            String content = BuilderSupport.readText(pyFile);
            String fileName = pyFile.getFileName().toString();
            String module = fileName.substring(0, fileName.length() - ".py".length());

            if (content.contains("Flask(") || content.contains("from flask import")) {
                log.info("Detected Flask application in {}", fileName);
                return Optional.of("gunicorn --bind=0.0.0.0:8000 " + module + ":app");
            }
            if (content.contains("FastAPI(") || content.contains("from fastapi import")) {
                log.info("Detected FastAPI application in {}", fileName);
                return Optional.of("uvicorn " + module + ":app --host 0.0.0.0 --port 8000");
            }
            if (content.contains("django")) {
                log.info("Detected Django application in {}", fileName);
                return Optional.of("gunicorn --bind=0.0.0.0:8000 wsgi:application");
            }
            if (hasMain(content)) {
                log.info("Detected main function in {}", fileName);
                return Optional.of("python " + fileName);
            }
        }

        for (String file : FALLBACK_FILES) {
            if (Files.isRegularFile(artifactPath.resolve(file))) {
                log.info("Using fallback entry point: {}", file);
                return Optional.of("python " + file);
            }
        }

        if (!pyFiles.isEmpty()) {
            String first = pyFiles.get(0).getFileName().toString();
            log.warn("Could not detect a specific entry point. Using first Python file found: {}", first);
            return Optional.of("python " + first);
        }
        return Optional.empty();
    }

    /** Present agent host scripts ranked by main guard, then priority score, then name. */
    static Optional<String> bestAgentEntry(Path artifactPath) throws IOException {
        record Candidate(String file, int priority, boolean hasMain) {}

        var candidates = new ArrayList<Candidate>();
        for (String file : AGENT_ENTRY_POINTS) {
            Path path = artifactPath.resolve(file);
            if (Files.isRegularFile(path)) {
                String content = BuilderSupport.readText(path);
                var candidate = new Candidate(file, agentEntryPriority(file, content), hasMain(content));
                log.debug("Found agent entry candidate: {}", candidate);
                candidates.add(candidate);
            }
        }

        return candidates.stream()
                .min(Comparator.comparing((Candidate c) -> !c.hasMain())
                        .thenComparing(Candidate::priority, Comparator.reverseOrder())
                        .thenComparing(Candidate::file))
                .map(Candidate::file);
    }

    static int agentEntryPriority(String fileName, String content) {
        int priority = 0;
        if (fileName.contains("start")) priority += 10;
        if (fileName.contains("main")) priority += 8;
        if (fileName.contains("server")) priority += 6;
        if (content.contains(MAIN_GUARD)) priority += 15;
        if (content.contains("def main(")) priority += 10;
        if (content.contains("create_and_run_host") || content.contains("run_host")) priority += 5;
        if (content.contains("AgentFrameworkAgent")) priority += 3;
        if (content.contains("uvicorn") || content.contains("run") || content.contains("serve")) priority += 2;
        return priority;
    }

    static List<Path> topLevelPythonFiles(Path dir) throws IOException {
        try (var stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".py"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static boolean hasMain(String content) {
        return content.contains(MAIN_GUARD) || content.contains("def main(");
    }
}
