package com.launchpad.core.exec;

import com.launchpad.core.builder.BuilderSupport;
import com.launchpad.core.model.BuildStep;
import com.launchpad.core.model.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProcessCommandExecutor}. Process tests run {@code sh} and are skipped on Windows.
 */
class ProcessCommandExecutorTest {

    @TempDir
    Path tempDir;

    private final ProcessCommandExecutor executor = new ProcessCommandExecutor(Duration.ofSeconds(30), false);

    // ── Running processes ────────────────────────────────────────────

    @Nested
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("running processes")
    class Running {

        @Test
        @DisplayName("captures stdout, stderr and exit code")
        void capturesOutput() {
            var result = executor.execute("sh", List.of("-c", "echo hello; echo oops 1>&2; exit 3"),
                    tempDir, true, CancellationToken.NONE);

            assertEquals(3, result.exitCode());
            assertEquals("hello\n", result.stdout());
            assertEquals("oops\n", result.stderr());
            assertFalse(result.success());
            assertFalse(result.cancelled());
        }

        @Test
        @DisplayName("runs in the given working directory")
        void usesWorkingDirectory() throws Exception {
            Files.writeString(tempDir.resolve("marker.txt"), "x");

            var result = executor.execute("sh", List.of("-c", "ls"), tempDir, true, CancellationToken.NONE);

            assertTrue(result.success());
            assertTrue(result.stdout().contains("marker.txt"));
        }

        @Test
        @DisplayName("passes arguments with spaces without shell splitting")
        void passesArgumentsVerbatim() {
            var result = executor.execute("sh", List.of("-c", "printf '%s|' \"$@\"", "sh", "a b", "c"),
                    tempDir, true, CancellationToken.NONE);

            assertEquals("a b|c|", result.stdout().trim());
        }

        @Test
        @DisplayName("streams every line to the sink and still captures it")
        void streamsLines() {
            var lines = new CopyOnWriteArrayList<String>();

            var result = executor.executeStreaming("sh", List.of("-c", "echo one; echo two; echo three 1>&2"),
                    tempDir, lines::add, CancellationToken.NONE);

            assertTrue(result.success());
            assertTrue(lines.containsAll(List.of("one", "two", "three")));
            assertEquals("one\ntwo\n", result.stdout());
        }

        @Test
        @DisplayName("reports a missing program as a start failure")
        void reportsMissingProgram() {
            var result = executor.execute("definitely-not-a-real-tool-42", List.of(), tempDir,
                    true, CancellationToken.NONE);

            assertEquals(CommandResult.START_FAILED, result.exitCode());
            assertFalse(result.success());
            assertTrue(result.stderr().contains("definitely-not-a-real-tool-42"));
        }

        @Test
        @DisplayName("cancellation destroys the running process")
        void cancellationDestroysProcess() throws Exception {
            var token = new CancellationToken();
            var scheduler = Executors.newSingleThreadScheduledExecutor();
            try {
                scheduler.schedule(token::cancel, 300, TimeUnit.MILLISECONDS);
                long start = System.currentTimeMillis();

                var result = executor.execute("sh", List.of("-c", "sleep 30"), tempDir, true, token);

                assertTrue(result.cancelled());
                assertFalse(result.success());
                assertTrue(System.currentTimeMillis() - start < 10_000, "process should stop well before sleep ends");
            } finally {
                scheduler.shutdownNow();
            }
        }

        @Test
        @DisplayName("timeout destroys the process and marks the result timed out, not cancelled")
        void timeoutDestroysProcess() {
            var shortTimeout = new ProcessCommandExecutor(Duration.ofMillis(300), false);

            var result = shortTimeout.execute("sh", List.of("-c", "sleep 30"), tempDir, true, CancellationToken.NONE);

            assertTrue(result.timedOut());
            assertFalse(result.cancelled());
            assertFalse(result.success());
            assertEquals(CommandResult.TIMED_OUT_EXIT_CODE, result.exitCode());
            assertTrue(result.stderr().contains("timed out after 300ms"));
        }

        @Test
        @DisplayName("a timed-out tool is reported as a tool failure naming the timeout")
        void timeoutIsToolFailure() {
            var shortTimeout = new ProcessCommandExecutor(Duration.ofMillis(300), false);
            var args = List.of("-c", "sleep 30");

            var result = shortTimeout.execute("sh", args, tempDir, true, CancellationToken.NONE);
            var error = BuilderSupport.commandFailure(BuildStep.PUBLISH, "Publish failed", "sh", args, result);

            assertEquals(ErrorKind.TOOL_INVOCATION_FAILED, error.kind());
            assertEquals(1, error.kind().exitCode());
            assertTrue(error.message().contains("timed out"));
            assertEquals("true", error.context().get("timedOut"));
        }

        @Test
        @DisplayName("output written before a timeout is kept")
        void timeoutKeepsOutput() {
            var shortTimeout = new ProcessCommandExecutor(Duration.ofMillis(500), false);

            var result = shortTimeout.execute("sh", List.of("-c", "echo restored; sleep 30"), tempDir, true,
                    CancellationToken.NONE);

            assertTrue(result.timedOut());
            assertTrue(result.stdout().contains("restored"));
        }

        @Test
        @DisplayName("an already cancelled token stops the process immediately")
        void alreadyCancelled() {
            var token = new CancellationToken();
            token.cancel();

            var result = executor.execute("sh", List.of("-c", "sleep 30"), tempDir, true, token);

            assertTrue(result.cancelled());
        }
    }

    // ── Windows command wrapping ─────────────────────────────────────

    @Nested
    @DisplayName("Windows command wrapping")
    class Wrapping {

        private final ProcessCommandExecutor windowsExecutor = new ProcessCommandExecutor(Duration.ZERO, true);

        @Test
        @DisplayName("wraps npm, node and az in cmd.exe on Windows")
        void wrapsBatchLaunchers() {
            assertEquals(List.of("cmd.exe", "/c", "npm", "ci"), windowsExecutor.buildCommand("npm", List.of("ci")));
            assertEquals(List.of("cmd.exe", "/c", "az", "login"), windowsExecutor.buildCommand("az", List.of("login")));
            assertEquals(List.of("cmd.exe", "/c", "node", "-v"), windowsExecutor.buildCommand("node", List.of("-v")));
        }

        @Test
        @DisplayName("wraps .cmd and .bat files")
        void wrapsScripts() {
            assertTrue(ProcessCommandExecutor.needsCmdWrapper("C:\\tools\\build.cmd"));
            assertTrue(ProcessCommandExecutor.needsCmdWrapper("setup.BAT"));
            assertTrue(ProcessCommandExecutor.needsCmdWrapper("npx.cmd"));
        }

        @Test
        @DisplayName("leaves real executables alone")
        void leavesExecutables() {
            assertEquals(List.of("dotnet", "--version"), windowsExecutor.buildCommand("dotnet", List.of("--version")));
            assertFalse(ProcessCommandExecutor.needsCmdWrapper("python.exe"));
        }

        @Test
        @DisplayName("never wraps on other systems")
        void noWrappingElsewhere() {
            assertEquals(List.of("npm", "ci"), executor.buildCommand("npm", List.of("ci")));
        }
    }

    @Test
    @DisplayName("describe quotes arguments containing whitespace")
    void describeQuotes() {
        assertEquals("dotnet publish \"My App.csproj\" -c Release",
                CommandExecutor.describe("dotnet", List.of("publish", "My App.csproj", "-c", "Release")));
    }
}
