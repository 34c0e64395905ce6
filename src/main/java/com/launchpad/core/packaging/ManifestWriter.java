package com.launchpad.core.packaging;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.launchpad.core.model.DeploymentManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists a {@link DeploymentManifest} next to the artifact it describes and renders it as JSON
 * for machine-readable CLI output.
 */
@Service
public class ManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Writes the manifest as TOML into {@code artifactDir/fileName}, replacing any existing file.
     */
    public Path write(DeploymentManifest manifest, Path artifactDir, String fileName) throws IOException {
        Path target = artifactDir.resolve(fileName);
        Files.writeString(target, manifest.toToml(), StandardCharsets.UTF_8);
        log.info("Wrote deployment manifest {}", target);
        return target;
    }

    /**
     * Renders the {@code platform}, {@code version} and {@code command} of the manifest. The
     * remote build hints only matter to the TOML file the deployment host reads.
     */
    public String toJson(DeploymentManifest manifest) {
        try {
            return objectMapper.writeValueAsString(ManifestJson.of(manifest));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize manifest", e);
        }
    }

    @JsonPropertyOrder({"platform", "version", "command"})
    record ManifestJson(
        @JsonProperty("platform") String platform,
        @JsonProperty("version") String version,
        @JsonProperty("command") String command
    ) {
        static ManifestJson of(DeploymentManifest manifest) {
            return new ManifestJson(manifest.platform(), manifest.version(), manifest.command());
        }
    }
}
