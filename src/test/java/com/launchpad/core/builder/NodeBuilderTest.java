package com.launchpad.core.builder;

import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.exec.CommandResult;
import com.launchpad.core.exec.FakeCommandExecutor;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.DeploymentManifest;
import com.launchpad.core.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static com.launchpad.core.exec.FakeCommandExecutor.fail;
import static com.launchpad.core.exec.FakeCommandExecutor.ok;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link NodeBuilder}.
 */
class NodeBuilderTest {

    @TempDir
    Path tempDir;

    private FakeCommandExecutor executor;
    private LaunchpadProperties properties;
    private BuildContext ctx;
    private NodeBuilder builder;

    @BeforeEach
    void setUp() {
        executor = new FakeCommandExecutor()
                .on("node --version", ok("v20.11.1\n"))
                .on("npm --version", ok("10.2.4\n"));
        properties = new LaunchpadProperties();
        ctx = BuildContext.of(executor, properties);
        builder = new NodeBuilder(new AppSettingsConverter());
    }

    private void packageJson(String json) throws IOException {
        Files.writeString(tempDir.resolve("package.json"), json);
    }

    private DeploymentManifest manifest() throws IOException {
        Path artifact = Files.createDirectories(tempDir.resolve("publish"));
        var result = builder.createManifest(tempDir, artifact, ctx);
        assertTrue(result.isSuccess(), () -> result.error().orElseThrow().formatted());
        return result.value();
    }

    // ── Environment ─────────────────────────────────────────────────

    @Test
    @DisplayName("validateEnvironment needs both node and npm")
    void validate() {
        assertTrue(builder.validateEnvironment(ctx));

        executor.on("npm --version", fail(-1, "npm: not found"));
        assertFalse(builder.validateEnvironment(ctx));
    }

    // ── Build ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("installs with npm ci, builds and stages sources")
        void fullBuild() throws IOException {
            packageJson("{\"scripts\":{\"build\":\"tsc\"}}");
            Files.writeString(tempDir.resolve("package-lock.json"), "{}");
            Files.writeString(tempDir.resolve("tsconfig.json"), "{}");
            Files.writeString(tempDir.resolve("index.ts"), "export {}");
            Files.writeString(tempDir.resolve("README.md"), "docs");
            Files.createDirectories(tempDir.resolve("src/routes"));
            Files.writeString(tempDir.resolve("src/routes/api.ts"), "export {}");
            executor.on("npm run build", inv -> writeDist(), ok());

            var result = builder.build(tempDir, "publish", false, ctx);

            assertTrue(result.isSuccess(), () -> result.error().orElseThrow().formatted());
            Path out = result.value();
            assertTrue(executor.indexOf("npm ci") < executor.indexOf("npm run build"));
            assertFalse(executor.wasInvoked("npm install"));
            assertTrue(Files.exists(out.resolve("package.json")));
            assertTrue(Files.exists(out.resolve("package-lock.json")));
            assertTrue(Files.exists(out.resolve("tsconfig.json")));
            assertTrue(Files.exists(out.resolve("index.ts")));
            assertTrue(Files.exists(out.resolve("src/routes/api.ts")));
            assertTrue(Files.exists(out.resolve("dist/index.js")));
            assertFalse(Files.exists(out.resolve("README.md")));
            assertEquals(BuilderSupport.DEPLOYMENT_FILE_CONTENT, Files.readString(out.resolve(".deployment")));
        }

        private void writeDist() {
            try {
                Files.createDirectories(tempDir.resolve("dist"));
                Files.writeString(tempDir.resolve("dist/index.js"), "");
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        @Test
        @DisplayName("falls back to npm install when npm ci fails")
        void fallsBackToInstall() throws IOException {
            packageJson("{}");
            executor.on("npm ci", fail(1, "missing lockfile"));

            var result = builder.build(tempDir, "publish", false, ctx);

            assertTrue(result.isSuccess());
            assertTrue(executor.wasInvoked("npm install"));
            assertFalse(executor.wasInvoked("npm run build"));
        }

        @Test
        @DisplayName("does not retry after a cancelled npm ci")
        void cancelledInstall() throws IOException {
            packageJson("{}");
            executor.on("npm ci", CommandResult.cancelled("", ""));

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.CANCELLED, error.kind());
            assertFalse(executor.wasInvoked("npm install"));
        }

        @Test
        @DisplayName("a timed-out npm ci is a tool failure and is not retried")
        void timedOutInstall() throws IOException {
            packageJson("{}");
            executor.on("npm ci", CommandResult.timedOut("", "", Duration.ofSeconds(1800)));

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.TOOL_INVOCATION_FAILED, error.kind());
            assertTrue(error.message().contains("timed out"));
            assertTrue(error.diagnostics().contains("timed out after 1800000ms"));
            assertFalse(executor.wasInvoked("npm install"));
        }

        @Test
        @DisplayName("fails when both installs fail")
        void installFails() throws IOException {
            packageJson("{}");
            executor.on("npm ci", fail(1, "ci broke"));
            executor.on("npm install", fail(1, "ERESOLVE unable to resolve dependency tree"));

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.TOOL_INVOCATION_FAILED, error.kind());
            assertEquals(BuildStep.RESTORE, error.step());
            assertTrue(error.diagnostics().contains("ERESOLVE"));
        }

        @Test
        @DisplayName("a failing build script stops the build")
        void buildScriptFails() throws IOException {
            packageJson("{\"scripts\":{\"build\":\"tsc\"}}");
            executor.on("npm run build", fail(2, "TS2304: Cannot find name"));

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(BuildStep.PUBLISH, error.step());
            assertEquals("npm run build", error.command());
        }

        @Test
        @DisplayName("requires package.json")
        void noPackageJson() {
            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.PROJECT_NOT_FOUND, error.kind());
            assertTrue(executor.invocations().isEmpty());
        }
    }

    // ── Clean ───────────────────────────────────────────────────────

    @Test
    @DisplayName("clean removes node_modules")
    void clean() throws IOException {
        packageJson("{}");
        Files.createDirectories(tempDir.resolve("node_modules/left-pad"));

        assertTrue(builder.clean(tempDir, ctx).isSuccess());
        assertFalse(Files.exists(tempDir.resolve("node_modules")));
    }

    // ── Manifest ────────────────────────────────────────────────────

    @Nested
    @DisplayName("createManifest")
    class Manifest {

        @Test
        @DisplayName("uses the start script and the engines major version")
        void startScript() throws IOException {
            packageJson("{\"engines\":{\"node\":\">=18.17.0\"},\"scripts\":{\"start\":\"node dist/server.js\"}}");

            var manifest = manifest();

            assertEquals("nodejs", manifest.platform());
            assertEquals("18", manifest.version());
            assertEquals("node dist/server.js", manifest.command());
            assertFalse(manifest.buildRequired());
        }

        @Test
        @DisplayName("a build script requests a remote build")
        void buildScript() throws IOException {
            packageJson("{\"scripts\":{\"start\":\"node .\",\"build\":\"tsc\"}}");

            var manifest = manifest();

            assertTrue(manifest.buildRequired());
            assertEquals("npm run build", manifest.buildCommand());
        }

        @Test
        @DisplayName("falls back to main, then to a common entry file")
        void mainThenEntryFile() throws IOException {
            packageJson("{\"main\":\"lib/app.js\"}");
            assertEquals("node lib/app.js", manifest().command());

            packageJson("{\"scripts\":{\"start\":\"  \"}}");
            Files.writeString(tempDir.resolve("publish/index.js"), "");
            assertEquals("node index.js", manifest().command());
        }

        @Test
        @DisplayName("uses the configured version without engines")
        void fallbackVersion() throws IOException {
            packageJson("{\"main\":\"server.js\"}");
            assertEquals("20", manifest().version());

            properties.getBuild().setVersionPolicy(LaunchpadProperties.VersionPolicy.INSTALLED_TOOLCHAIN);
            executor.on("node --version", ok("v22.3.0\n"));
            assertEquals("22", manifest().version());
        }

        @Test
        @DisplayName("fails when no start command can be found")
        void noStartCommand() throws IOException {
            packageJson("{\"name\":\"lib\"}");
            Path artifact = Files.createDirectories(tempDir.resolve("publish"));

            var error = builder.createManifest(tempDir, artifact, ctx).error().orElseThrow();

            assertEquals(ErrorKind.MANIFEST_DETECTION_FAILED, error.kind());
        }

        @Test
        @DisplayName("reports malformed package.json")
        void malformedPackageJson() throws IOException {
            packageJson("{ not json");
            Path artifact = Files.createDirectories(tempDir.resolve("publish"));

            var error = builder.createManifest(tempDir, artifact, ctx).error().orElseThrow();

            assertEquals(ErrorKind.MANIFEST_DETECTION_FAILED, error.kind());
            assertTrue(error.message().contains("package.json"));
        }
    }
}
