package com.launchpad.core.model;

/**
 * Classification of a fatal build failure. Each kind carries a stable error code
 * and the process exit code the CLI returns for it.
 */
public enum ErrorKind {
    PROJECT_DIRECTORY_MISSING("PROJECT_DIRECTORY_MISSING", 2),
    PLATFORM_UNDETECTED("PLATFORM_UNDETECTED", 2),
    PLATFORM_UNSUPPORTED("PLATFORM_UNSUPPORTED", 2),
    ENVIRONMENT_MISSING("ENVIRONMENT_MISSING", 2),
    SDK_VERSION_MISMATCH("SDK_VERSION_MISMATCH", 2),
    PROJECT_NOT_FOUND("PROJECT_NOT_FOUND", 1),
    TOOL_INVOCATION_FAILED("TOOL_INVOCATION_FAILED", 1),
    ARTIFACT_MISSING("ARTIFACT_MISSING", 1),
    MANIFEST_DETECTION_FAILED("MANIFEST_DETECTION_FAILED", 1),
    FILESYSTEM_FAILURE("FILESYSTEM_FAILURE", 1),
    INTERNAL_ERROR("INTERNAL_ERROR", 1),
    CANCELLED("CANCELLED", 130);

    private final String code;
    private final int exitCode;

    ErrorKind(String code, int exitCode) {
        this.code = code;
        this.exitCode = exitCode;
    }

    public String code() {
        return code;
    }

    public int exitCode() {
        return exitCode;
    }

    /** Internal-consistency faults are surfaced with a stack-trace-worthy severity. */
    public boolean isInternalFault() {
        return this == ARTIFACT_MISSING || this == INTERNAL_ERROR;
    }
}
