package com.phillippitts.retroauto.config.properties;

import com.phillippitts.retroauto.domain.ErrorPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Engine-wide defaults. A script's {@code @config} block overrides them for its own session.
 */
@Validated
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    /** Maximum call stack depth, entry frame included. */
    @Min(1)
    @Max(10_000)
    private final int maxCallDepth;

    /** Default reaction to an image that never appears. */
    @NotNull
    private final ErrorPolicy onError;

    @Min(0)
    @Max(3_600_000)
    private final long waitTimeoutMs;

    @Min(10)
    @Max(60_000)
    private final long pollIntervalMs;

    /** If true, a missing asset is handled like a timeout instead of halting the script. */
    private final boolean tolerateMissingAssets;

    /** Script run on startup; blank means wait for the REST or hotkey trigger. */
    private final String scriptPath;

    /** Optional JSON interrupt rule file loaded with the script. */
    private final String rulesPath;

    /** Directory holding template images ({@code <assetId>.png}). */
    @NotBlank
    private final String assetsDir;

    @ConstructorBinding
    public EngineProperties(Integer maxCallDepth,
                            ErrorPolicy onError,
                            Long waitTimeoutMs,
                            Long pollIntervalMs,
                            Boolean tolerateMissingAssets,
                            String scriptPath,
                            String rulesPath,
                            String assetsDir) {
        this.maxCallDepth = maxCallDepth == null ? 100 : maxCallDepth;
        this.onError = onError == null ? ErrorPolicy.ABORT : onError;
        this.waitTimeoutMs = waitTimeoutMs == null ? 10_000 : waitTimeoutMs;
        this.pollIntervalMs = pollIntervalMs == null ? 100 : pollIntervalMs;
        this.tolerateMissingAssets = tolerateMissingAssets != null && tolerateMissingAssets;
        this.scriptPath = scriptPath == null ? "" : scriptPath;
        this.rulesPath = rulesPath == null ? "" : rulesPath;
        this.assetsDir = (assetsDir == null || assetsDir.isBlank()) ? "assets" : assetsDir;
    }

    public int getMaxCallDepth() { return maxCallDepth; }
    public ErrorPolicy getOnError() { return onError; }
    public long getWaitTimeoutMs() { return waitTimeoutMs; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public boolean isTolerateMissingAssets() { return tolerateMissingAssets; }
    public String getScriptPath() { return scriptPath; }
    public String getRulesPath() { return rulesPath; }
    public String getAssetsDir() { return assetsDir; }
}
