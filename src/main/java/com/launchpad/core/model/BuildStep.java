package com.launchpad.core.model;

/**
 * Steps of an orchestrated build, in execution order. Each step runs only after the previous one
 * succeeded. {@code RESOLVE_PROJECT}, {@code RESTORE}, {@code PUBLISH} and {@code VERIFY_ARTIFACT}
 * are sub-steps of {@code BUILD} and only appear in errors.
 */
public enum BuildStep {
    DETECT("detect"),
    VALIDATE_ENVIRONMENT("validate-environment"),
    CLEAN("clean"),
    BUILD("build"),
    RESOLVE_PROJECT("resolve-project"),
    RESTORE("restore"),
    PUBLISH("publish"),
    VERIFY_ARTIFACT("verify-artifact"),
    CREATE_MANIFEST("create-manifest"),
    WRITE_MANIFEST("write-manifest"),
    DEPLOYMENT_SETTINGS("deployment-settings"),
    PACKAGE("package");

    private final String label;

    BuildStep(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
