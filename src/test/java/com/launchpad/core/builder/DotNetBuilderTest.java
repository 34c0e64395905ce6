package com.launchpad.core.builder;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.launchpad.core.config.LaunchpadProperties;
import com.launchpad.core.exec.FakeCommandExecutor;
import com.launchpad.core.exec.FakeCommandExecutor.Invocation;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.ErrorKind;
import com.launchpad.core.model.ProjectPlatform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.launchpad.core.exec.FakeCommandExecutor.fail;
import static com.launchpad.core.exec.FakeCommandExecutor.ok;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DotNetBuilder}.
 */
class DotNetBuilderTest {

    @TempDir
    Path tempDir;

    private FakeCommandExecutor executor;
    private LaunchpadProperties properties;
    private BuildContext ctx;
    private final DotNetBuilder builder = new DotNetBuilder();

    @BeforeEach
    void setUp() {
        executor = new FakeCommandExecutor().on("dotnet --version", ok("8.0.404\n"));
        properties = new LaunchpadProperties();
        ctx = BuildContext.of(executor, properties);
    }

    private void writeProject(String name, String tfm) throws IOException {
        Files.writeString(tempDir.resolve(name),
                "<Project Sdk=\"Microsoft.NET.Sdk.Web\"><PropertyGroup><TargetFramework>" + tfm
                        + "</TargetFramework></PropertyGroup></Project>");
    }

    /** Makes "dotnet publish" create the -o directory with the given files. */
    private void publishCreates(String... files) {
        executor.on("dotnet publish", inv -> createOutput(inv, files), ok("App -> publish/\n"));
    }

    private static void createOutput(Invocation inv, String... files) {
        int o = inv.args().indexOf("-o");
        Path out = inv.workingDir().resolve(inv.args().get(o + 1));
        try {
            Files.createDirectories(out);
            for (String file : files) {
                Files.writeString(out.resolve(file), "");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    @DisplayName("platform is dotnet")
    void platform() {
        assertEquals(ProjectPlatform.DOTNET, builder.platform());
    }

    // ── Environment ─────────────────────────────────────────────────

    @Nested
    @DisplayName("validateEnvironment")
    class Validate {

        @Test
        @DisplayName("true when dotnet --version succeeds")
        void sdkPresent() {
            assertTrue(builder.validateEnvironment(ctx));
            assertEquals(List.of("dotnet --version"), executor.commandLines());
        }

        @Test
        @DisplayName("false when the SDK is missing")
        void sdkMissing() {
            executor.on("dotnet --version", fail(-1, "not found"));
            assertFalse(builder.validateEnvironment(ctx));
        }
    }

    // ── Build ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("restores then publishes a framework-dependent Release build")
        void restoreThenPublish() throws IOException {
            writeProject("App.csproj", "net8.0");
            publishCreates("App.dll", "App.deps.json");

            var result = builder.build(tempDir, "publish", false, ctx);

            assertTrue(result.isSuccess(), () -> result.error().orElseThrow().formatted());
            assertEquals(tempDir.resolve("publish"), result.value());
            assertTrue(executor.indexOf("dotnet restore App.csproj") < executor.indexOf("dotnet publish"));
            assertTrue(executor.commandLines().contains(
                    "dotnet publish App.csproj -c Release -o publish --self-contained false --verbosity minimal"));
            executor.invocations().stream()
                    .filter(inv -> inv.args().get(0).equals("publish"))
                    .forEach(inv -> assertEquals(tempDir, inv.workingDir()));
        }

        @Test
        @DisplayName("uses the first project file by name when there are several")
        void severalProjects() throws IOException {
            writeProject("Zeta.csproj", "net8.0");
            writeProject("Alpha.csproj", "net8.0");
            publishCreates("Alpha.dll");

            var logger = (Logger) LoggerFactory.getLogger(BuilderSupport.class);
            var appender = new ListAppender<ILoggingEvent>();
            appender.start();
            logger.addAppender(appender);
            try {
                var result = builder.build(tempDir, "publish", false, ctx);

                assertTrue(result.isSuccess());
                assertTrue(executor.wasInvoked("dotnet publish Alpha.csproj"));
                assertFalse(executor.commandLines().stream().anyMatch(c -> c.contains("Zeta")));

                var warnings = appender.list.stream()
                        .filter(e -> e.getLevel() == Level.WARN)
                        .map(ILoggingEvent::getFormattedMessage)
                        .toList();
                assertEquals(1, warnings.size(), () -> "warnings: " + warnings);
                assertTrue(warnings.get(0).contains("using Alpha.csproj"), warnings.get(0));
                assertTrue(warnings.get(0).contains("ignoring Zeta.csproj"), warnings.get(0));
            } finally {
                logger.detachAppender(appender);
            }
        }

        @Test
        @DisplayName("fails with PROJECT_NOT_FOUND without a project file")
        void noProject() {
            var result = builder.build(tempDir, "publish", false, ctx);

            var error = result.error().orElseThrow();
            assertEquals(ErrorKind.PROJECT_NOT_FOUND, error.kind());
            assertEquals(BuildStep.RESOLVE_PROJECT, error.step());
            assertFalse(executor.wasInvoked("dotnet restore"));
        }

        @Test
        @DisplayName("stops before restore when the SDK is older than the target")
        void sdkMismatch() throws IOException {
            writeProject("App.csproj", "net9.0");

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.SDK_VERSION_MISMATCH, error.kind());
            assertEquals("net9.0", error.context().get("targetFramework"));
            assertEquals("8.0.404", error.context().get("installedSdk"));
            assertFalse(executor.wasInvoked("dotnet restore"));
        }

        @Test
        @DisplayName("restore failure carries the command and stderr")
        void restoreFails() throws IOException {
            writeProject("App.csproj", "net8.0");
            executor.on("dotnet restore", fail(1, "NU1101: Unable to find package Foo"));

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.TOOL_INVOCATION_FAILED, error.kind());
            assertEquals(BuildStep.RESTORE, error.step());
            assertEquals("dotnet restore App.csproj", error.command());
            assertTrue(error.diagnostics().contains("NU1101"));
            assertFalse(executor.wasInvoked("dotnet publish"));
        }

        @Test
        @DisplayName("publish failure is reported at the publish step")
        void publishFails() throws IOException {
            writeProject("App.csproj", "net8.0");
            executor.on("dotnet publish", fail(1, "error CS1002"));

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(BuildStep.PUBLISH, error.step());
            assertEquals("1", error.context().get("exitCode"));
        }

        @Test
        @DisplayName("a publish that produces no directory is an internal fault")
        void missingOutput() throws IOException {
            writeProject("App.csproj", "net8.0");

            var error = builder.build(tempDir, "publish", false, ctx).error().orElseThrow();

            assertEquals(ErrorKind.ARTIFACT_MISSING, error.kind());
            assertTrue(error.kind().isInternalFault());
        }

        @Test
        @DisplayName("old publish output is removed before publishing")
        void removesOldOutput() throws IOException {
            writeProject("App.csproj", "net8.0");
            Files.createDirectories(tempDir.resolve("publish"));
            Files.writeString(tempDir.resolve("publish/Stale.dll"), "");
            publishCreates("App.dll");

            builder.build(tempDir, "publish", false, ctx);

            assertFalse(Files.exists(tempDir.resolve("publish/Stale.dll")));
            assertTrue(Files.exists(tempDir.resolve("publish/App.dll")));
        }

        @Test
        @DisplayName("verbose builds stream tool output to the sink")
        void verboseStreams() throws IOException {
            writeProject("App.csproj", "net8.0");
            publishCreates("App.dll");
            var lines = new ArrayList<String>();

            builder.build(tempDir, "publish", true, ctx.withOutputSink(lines::add));

            assertTrue(lines.contains("App -> publish/"));
            assertTrue(executor.invocations().stream()
                    .filter(inv -> !inv.args().contains("--version"))
                    .allMatch(Invocation::streaming));
        }
    }

    // ── Clean ───────────────────────────────────────────────────────

    @Test
    @DisplayName("clean runs dotnet clean on the project file")
    void clean() throws IOException {
        writeProject("App.csproj", "net8.0");

        assertTrue(builder.clean(tempDir, ctx).isSuccess());
        assertTrue(executor.wasInvoked("dotnet clean App.csproj"));
    }

    // ── Manifest ────────────────────────────────────────────────────

    @Nested
    @DisplayName("createManifest")
    class Manifest {

        private Path artifact;

        @BeforeEach
        void setUp() throws IOException {
            artifact = Files.createDirectories(tempDir.resolve("publish"));
        }

        @Test
        @DisplayName("derives the entry dll from the deps.json file and the version from the project")
        void entryFromDeps() throws IOException {
            writeProject("App.csproj", "net9.0");
            Files.writeString(artifact.resolve("App.deps.json"), "{}");
            Files.writeString(artifact.resolve("App.dll"), "");

            var manifest = builder.createManifest(tempDir, artifact, ctx).value();

            assertEquals("dotnet", manifest.platform());
            assertEquals("9.0", manifest.version());
            assertEquals("dotnet App.dll", manifest.command());
            assertFalse(manifest.buildRequired());
        }

        @Test
        @DisplayName("falls back to the configured version")
        void fixedFallback() throws IOException {
            Files.writeString(artifact.resolve("Api.deps.json"), "{}");
            properties.getRuntime().setDotnetFallback("6.0");

            assertEquals("6.0", builder.createManifest(tempDir, artifact, ctx).value().version());
            assertFalse(executor.wasInvoked("dotnet --version"));
        }

        @Test
        @DisplayName("can fall back to the installed SDK version")
        void installedFallback() throws IOException {
            Files.writeString(artifact.resolve("Api.deps.json"), "{}");
            properties.getBuild().setVersionPolicy(LaunchpadProperties.VersionPolicy.INSTALLED_TOOLCHAIN);

            assertEquals("8.0", builder.createManifest(tempDir, artifact, ctx).value().version());
        }

        @Test
        @DisplayName("fails without a deps.json file")
        void noDeps() throws IOException {
            Files.writeString(artifact.resolve("App.dll"), "");

            var error = builder.createManifest(tempDir, artifact, ctx).error().orElseThrow();

            assertEquals(ErrorKind.MANIFEST_DETECTION_FAILED, error.kind());
            assertEquals(BuildStep.CREATE_MANIFEST, error.step());
        }
    }
}
