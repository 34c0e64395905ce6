package com.launchpad.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing build-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String PROJECT_DIR = "projectDir";
    public static final String PLATFORM = "platform";
    public static final String BUILD_STEP = "buildStep";

    private MdcContext() {}

    public static void setBuild(String projectDir, String platform) {
        MDC.put(PROJECT_DIR, projectDir);
        MDC.put(PLATFORM, platform);
    }

    public static void setPlatform(String platform) {
        MDC.put(PLATFORM, platform);
    }

    public static void setStep(String step) {
        MDC.put(BUILD_STEP, step);
    }

    public static void clear() {
        MDC.remove(PROJECT_DIR);
        MDC.remove(PLATFORM);
        MDC.remove(BUILD_STEP);
    }
}
