package com.launchpad.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "launchpad")
public class LaunchpadProperties {

    private Build build = new Build();
    private Runtime runtime = new Runtime();
    private Executor executor = new Executor();

    // -- Build accessors (delegate to nested) --
    public String getOutputPath() { return build.outputPath; }
    public String getDeploymentZip() { return build.deploymentZip; }
    public String getManifestFileName() { return build.manifestFileName; }
    public VersionPolicy getVersionPolicy() { return build.versionPolicy; }

    // -- Runtime accessors (delegate to nested) --
    public String getDotnetFallback() { return runtime.dotnetFallback; }
    public String getNodeFallback() { return runtime.nodeFallback; }
    public String getPythonFallback() { return runtime.pythonFallback; }

    public int getTimeoutSeconds() { return executor.timeoutSeconds; }

    public Build getBuild() { return build; }
    public void setBuild(Build build) { this.build = build; }
    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    /**
     * How a builder picks the runtime version when the project declares none.
     */
    public enum VersionPolicy {
        /** Use the configured fallback version. */
        FIXED,
        /** Ask the installed toolchain for its version, then fall back. */
        INSTALLED_TOOLCHAIN
    }

    public static class Build {
        private String outputPath = "publish";
        private String deploymentZip = "app.zip";
        private String manifestFileName = "oryx-manifest.toml";
        private VersionPolicy versionPolicy = VersionPolicy.FIXED;

        public String getOutputPath() { return outputPath; }
        public void setOutputPath(String outputPath) { this.outputPath = outputPath; }
        public String getDeploymentZip() { return deploymentZip; }
        public void setDeploymentZip(String deploymentZip) { this.deploymentZip = deploymentZip; }
        public String getManifestFileName() { return manifestFileName; }
        public void setManifestFileName(String manifestFileName) { this.manifestFileName = manifestFileName; }
        public VersionPolicy getVersionPolicy() { return versionPolicy; }
        public void setVersionPolicy(VersionPolicy versionPolicy) { this.versionPolicy = versionPolicy; }
    }

    public static class Runtime {
        private String dotnetFallback = "8.0";
        private String nodeFallback = "20";
        private String pythonFallback = "3.11";

        public String getDotnetFallback() { return dotnetFallback; }
        public void setDotnetFallback(String dotnetFallback) { this.dotnetFallback = dotnetFallback; }
        public String getNodeFallback() { return nodeFallback; }
        public void setNodeFallback(String nodeFallback) { this.nodeFallback = nodeFallback; }
        public String getPythonFallback() { return pythonFallback; }
        public void setPythonFallback(String pythonFallback) { this.pythonFallback = pythonFallback; }
    }

    public static class Executor {
        private int timeoutSeconds = 1800;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
