package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.domain.ColorMode;
import com.phillippitts.retroauto.domain.Match;
import com.phillippitts.retroauto.domain.MatchRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Exhaustive sliding-window matcher.
 *
 * <p>Score is {@code 1 - meanAbsDiff / 255} over all template pixels (grayscale luminance or
 * per-channel RGB). Candidates are abandoned as soon as their accumulated difference can no
 * longer reach the threshold. Coordinates in the result are screen coordinates.
 */
@Component
public class PixelTemplateMatcher implements VisionMatcher {

    private static final Logger LOG = LogManager.getLogger(PixelTemplateMatcher.class);

    private final AssetStore assets;
    private final ScreenSource screen;

    public PixelTemplateMatcher(AssetStore assets, ScreenSource screen) {
        this.assets = assets;
        this.screen = screen;
    }

    @Override
    public Optional<Match> match(MatchRequest request) {
        Asset asset = assets.get(request.templateId());
        BufferedImage haystack = screen.capture(request.region());
        int offsetX = request.region() == null ? 0 : request.region().x();
        int offsetY = request.region() == null ? 0 : request.region().y();

        Optional<Match> found = search(haystack, asset.image(), request.threshold(), request.colorMode())
                .map(m -> new Match(m.x() + offsetX, m.y() + offsetY, m.width(), m.height(), m.score()));
        LOG.trace("match id={} region={} -> {}", request.templateId(), request.region(), found);
        return found;
    }

    /** Best window of {@code needle} inside {@code haystack}, in haystack coordinates. */
    static Optional<Match> search(BufferedImage haystack, BufferedImage needle, double threshold, ColorMode mode) {
        int hw = haystack.getWidth();
        int hh = haystack.getHeight();
        int nw = needle.getWidth();
        int nh = needle.getHeight();
        if (nw > hw || nh > hh) {
            return Optional.empty();
        }

        int channels = mode == ColorMode.COLOR ? 3 : 1;
        long samples = (long) nw * nh * channels;
        // largest total difference that still scores >= threshold
        double budget = (1.0 - threshold) * 255.0 * samples;

        int[] needlePixels = needle.getRGB(0, 0, nw, nh, null, 0, nw);
        int[] hayPixels = haystack.getRGB(0, 0, hw, hh, null, 0, hw);

        Match best = null;
        for (int y = 0; y <= hh - nh; y++) {
            for (int x = 0; x <= hw - nw; x++) {
                double limit = best == null ? budget : Math.min(budget, (1.0 - best.score()) * 255.0 * samples);
                long diff = difference(hayPixels, hw, x, y, needlePixels, nw, nh, mode, limit);
                if (diff <= limit) {
                    double score = 1.0 - diff / (255.0 * samples);
                    if (best == null || score > best.score()) {
                        best = new Match(x, y, nw, nh, score);
                        if (diff == 0) {
                            return Optional.of(best);
                        }
                    }
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private static long difference(int[] hay, int hayWidth, int ox, int oy,
                                   int[] needle, int nw, int nh, ColorMode mode, double limit) {
        long total = 0;
        for (int y = 0; y < nh; y++) {
            int hayRow = (oy + y) * hayWidth + ox;
            int needleRow = y * nw;
            for (int x = 0; x < nw; x++) {
                int a = hay[hayRow + x];
                int b = needle[needleRow + x];
                if (mode == ColorMode.COLOR) {
                    total += Math.abs(((a >> 16) & 0xFF) - ((b >> 16) & 0xFF))
                            + Math.abs(((a >> 8) & 0xFF) - ((b >> 8) & 0xFF))
                            + Math.abs((a & 0xFF) - (b & 0xFF));
                } else {
                    total += Math.abs(luminance(a) - luminance(b));
                }
            }
            if (total > limit) {
                return total;
            }
        }
        return total;
    }

    static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }
}
