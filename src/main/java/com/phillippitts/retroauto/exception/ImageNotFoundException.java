package com.phillippitts.retroauto.exception;

/**
 * Thrown when a wait-style vision action times out (image never appeared, or never vanished).
 * Recoverable: the executor applies the configured on_error policy.
 */
public class ImageNotFoundException extends RetroAutoException {

    private final String assetId;
    private final long timeoutMs;

    public ImageNotFoundException(String assetId, long timeoutMs) {
        this("Image '" + assetId + "' not found within " + timeoutMs + "ms", assetId, timeoutMs);
    }

    private ImageNotFoundException(String message, String assetId, long timeoutMs) {
        super(message);
        this.assetId = assetId;
        this.timeoutMs = timeoutMs;
    }

    /** Timeout of {@code wait_vanish}: the image stayed on screen. */
    public static ImageNotFoundException stillVisible(String assetId, long timeoutMs) {
        return new ImageNotFoundException("Image '" + assetId + "' still visible after " + timeoutMs + "ms",
                assetId, timeoutMs);
    }

    public String getAssetId() {
        return assetId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
