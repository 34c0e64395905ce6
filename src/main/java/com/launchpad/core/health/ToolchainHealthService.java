package com.launchpad.core.health;

import com.launchpad.core.builder.BuildContext;
import com.launchpad.core.builder.PlatformBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reports which platform toolchains are usable on this machine by running each builder's
 * environment check.
 */
@Service
public class ToolchainHealthService {

    private static final Logger log = LoggerFactory.getLogger(ToolchainHealthService.class);

    private final List<PlatformBuilder> builders;

    public ToolchainHealthService(List<PlatformBuilder> builders) {
        this.builders = builders.stream()
                .sorted(Comparator.comparing(PlatformBuilder::platform))
                .toList();
    }

    public List<HealthStatus> checkAll(BuildContext ctx) {
        var results = new ArrayList<HealthStatus>();
        for (PlatformBuilder builder : builders) {
            results.add(check(builder, ctx));
        }
        return results;
    }

    private HealthStatus check(PlatformBuilder builder, BuildContext ctx) {
        String component = builder.platform().tag();
        var metadata = Map.of("displayName", builder.platform().displayName());
        try {
            if (builder.validateEnvironment(ctx)) {
                return new HealthStatus(component, HealthStatus.Status.UP,
                        builder.platform().displayName() + " toolchain available", metadata);
            }
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    builder.platform().displayName() + " toolchain not found", metadata);
        } catch (RuntimeException e) {
            log.warn("{} toolchain check failed: {}", component, e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    "Toolchain check error: " + e.getMessage(), metadata);
        }
    }

    /** UP when every toolchain is usable, DEGRADED when some are, DOWN when none are. */
    public static HealthStatus.Status overall(List<HealthStatus> statuses) {
        long up = statuses.stream().filter(s -> s.status() == HealthStatus.Status.UP).count();
        if (up == statuses.size()) {
            return HealthStatus.Status.UP;
        }
        return up == 0 ? HealthStatus.Status.DOWN : HealthStatus.Status.DEGRADED;
    }
}
