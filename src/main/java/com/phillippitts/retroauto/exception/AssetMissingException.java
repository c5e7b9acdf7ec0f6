package com.phillippitts.retroauto.exception;

/**
 * Thrown by the asset store or vision matcher when a template id has no backing asset,
 * including when the asset was deleted while the script runs.
 */
public class AssetMissingException extends RetroAutoException {

    private final String assetId;

    public AssetMissingException(String assetId) {
        super("Asset not found: " + assetId);
        this.assetId = assetId;
    }

    public AssetMissingException(String assetId, Throwable cause) {
        super("Asset not found: " + assetId, cause);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
