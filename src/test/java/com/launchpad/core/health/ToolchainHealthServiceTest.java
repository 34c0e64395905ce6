package com.launchpad.core.health;

import com.launchpad.core.builder.BuildContext;
import com.launchpad.core.builder.PlatformBuilder;
import com.launchpad.core.exec.FakeCommandExecutor;
import com.launchpad.core.model.ProjectPlatform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ToolchainHealthService}.
 */
class ToolchainHealthServiceTest {

    private final BuildContext ctx = BuildContext.of(new FakeCommandExecutor(), null);

    private static PlatformBuilder builder(ProjectPlatform platform, boolean available) {
        var builder = mock(PlatformBuilder.class);
        when(builder.platform()).thenReturn(platform);
        when(builder.validateEnvironment(any())).thenReturn(available);
        return builder;
    }

    @Test
    @DisplayName("reports each toolchain in platform order")
    void reportsEachToolchain() {
        var service = new ToolchainHealthService(List.of(
                builder(ProjectPlatform.PYTHON, false),
                builder(ProjectPlatform.DOTNET, true)));

        var statuses = service.checkAll(ctx);

        assertEquals(List.of("dotnet", "python"), statuses.stream().map(HealthStatus::component).toList());
        assertEquals(HealthStatus.Status.UP, statuses.get(0).status());
        assertEquals(HealthStatus.Status.DOWN, statuses.get(1).status());
        assertEquals(HealthStatus.Status.DEGRADED, ToolchainHealthService.overall(statuses));
    }

    @Test
    @DisplayName("a throwing toolchain check counts as down")
    void throwingCheck() {
        var broken = mock(PlatformBuilder.class);
        when(broken.platform()).thenReturn(ProjectPlatform.NODEJS);
        when(broken.validateEnvironment(any())).thenThrow(new IllegalStateException("boom"));

        var statuses = new ToolchainHealthService(List.of(broken)).checkAll(ctx);

        assertEquals(HealthStatus.Status.DOWN, statuses.get(0).status());
        assertTrue(statuses.get(0).detail().contains("boom"));
        assertEquals(HealthStatus.Status.DOWN, ToolchainHealthService.overall(statuses));
    }

    @Test
    @DisplayName("overall is up when every toolchain is available")
    void overallUp() {
        var statuses = new ToolchainHealthService(List.of(
                builder(ProjectPlatform.DOTNET, true),
                builder(ProjectPlatform.NODEJS, true))).checkAll(ctx);

        assertEquals(HealthStatus.Status.UP, ToolchainHealthService.overall(statuses));
    }
}
