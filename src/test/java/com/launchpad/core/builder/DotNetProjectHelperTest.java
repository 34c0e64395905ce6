package com.launchpad.core.builder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DotNetProjectHelper} and {@link RuntimeVersions}.
 */
class DotNetProjectHelperTest {

    @TempDir
    Path tempDir;

    private Path project(String body) throws IOException {
        Path file = tempDir.resolve("App.csproj");
        Files.writeString(file, "<Project Sdk=\"Microsoft.NET.Sdk.Web\">\n  <PropertyGroup>\n"
                + body + "\n  </PropertyGroup>\n</Project>\n");
        return file;
    }

    // ── Target framework detection ──────────────────────────────────

    @Nested
    @DisplayName("target framework detection")
    class TargetFramework {

        @Test
        @DisplayName("reads a single TargetFramework")
        void single() throws IOException {
            assertEquals(Optional.of("8.0"),
                    DotNetProjectHelper.detectTargetRuntimeVersion(project("<TargetFramework>net8.0</TargetFramework>")));
        }

        @Test
        @DisplayName("takes the first of several TargetFrameworks")
        void multiple() throws IOException {
            assertEquals(Optional.of("9.0"), DotNetProjectHelper.detectTargetRuntimeVersion(
                    project("<TargetFrameworks> net9.0;net8.0 </TargetFrameworks>")));
        }

        @Test
        @DisplayName("ignores platform suffixes")
        void platformSuffix() throws IOException {
            assertEquals(Optional.of("8.0"), DotNetProjectHelper.detectTargetRuntimeVersion(
                    project("<TargetFramework>net8.0-windows</TargetFramework>")));
        }

        @Test
        @DisplayName("empty for unrecognized, missing or absent frameworks")
        void unrecognized() throws IOException {
            assertTrue(DotNetProjectHelper.detectTargetRuntimeVersion(
                    project("<TargetFramework>netstandard2.0</TargetFramework>")).isEmpty());
            assertTrue(DotNetProjectHelper.detectTargetRuntimeVersion(project("<OutputType>Exe</OutputType>")).isEmpty());
            assertTrue(DotNetProjectHelper.detectTargetRuntimeVersion(tempDir.resolve("missing.csproj")).isEmpty());
        }
    }

    // ── SDK compatibility ───────────────────────────────────────────

    @Nested
    @DisplayName("SDK compatibility")
    class SdkCompatibility {

        @Test
        @DisplayName("newer or equal SDK majors can build the target")
        void compatible() {
            assertTrue(DotNetProjectHelper.isSdkCompatible("8.0.404", "8.0"));
            assertTrue(DotNetProjectHelper.isSdkCompatible("9.0.100", "8.0"));
        }

        @Test
        @DisplayName("an older SDK major cannot")
        void incompatible() {
            assertFalse(DotNetProjectHelper.isSdkCompatible("8.0.404", "9.0"));
        }

        @Test
        @DisplayName("unparseable versions are treated as compatible")
        void unparseable() {
            assertTrue(DotNetProjectHelper.isSdkCompatible("", "9.0"));
            assertTrue(DotNetProjectHelper.isSdkCompatible("8.0.404", "preview"));
        }
    }

    // ── Version strings ─────────────────────────────────────────────

    @Test
    @DisplayName("parses toolchain version strings")
    void runtimeVersions() {
        assertEquals(Optional.of(8), RuntimeVersions.major("8.0.404"));
        assertEquals(Optional.of(20), RuntimeVersions.major("v20.11.1"));
        assertEquals(Optional.of("3.12"), RuntimeVersions.majorMinor("Python 3.12.1"));
        assertEquals(Optional.of("22.0"), RuntimeVersions.majorMinor("22"));
        assertTrue(RuntimeVersions.major("none").isEmpty());
        assertTrue(RuntimeVersions.major("10000000000.0").isEmpty());
        assertTrue(DotNetProjectHelper.isSdkCompatible("8.0.404", "10000000000.0"));
        assertTrue(RuntimeVersions.majorMinor(null).isEmpty());
    }
}
