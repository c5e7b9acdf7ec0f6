package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.domain.ColorMode;
import com.phillippitts.retroauto.domain.Match;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.domain.Region;
import com.phillippitts.retroauto.exception.AssetMissingException;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PixelTemplateMatcherTest {

    private static final int WHITE = 0xFFFFFF;
    private static final int GRAY = 0x808080;

    static class MapAssetStore implements AssetStore {
        final Map<String, Asset> assets = new HashMap<>();

        @Override
        public Asset get(String templateId) {
            Asset asset = assets.get(templateId);
            if (asset == null) {
                throw new AssetMissingException(templateId);
            }
            return asset;
        }

        @Override
        public boolean contains(String templateId) {
            return assets.containsKey(templateId);
        }
    }

    private static BufferedImage filled(int width, int height, int rgb) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    // 3x3 checkerboard of white and gray
    private static BufferedImage checker() {
        BufferedImage img = new BufferedImage(3, 3, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                img.setRGB(x, y, (x + y) % 2 == 0 ? WHITE : GRAY);
            }
        }
        return img;
    }

    private static void paste(BufferedImage target, BufferedImage source, int ox, int oy) {
        for (int y = 0; y < source.getHeight(); y++) {
            for (int x = 0; x < source.getWidth(); x++) {
                target.setRGB(ox + x, oy + y, source.getRGB(x, y));
            }
        }
    }

    @Test
    void findsExactTemplateInScreenCoordinates() {
        // Arrange
        BufferedImage screen = filled(20, 20, 0);
        paste(screen, checker(), 12, 5);
        MapAssetStore store = new MapAssetStore();
        store.assets.put("checker", new Asset("checker", checker(), Map.of()));
        AtomicReference<Region> captured = new AtomicReference<>();
        PixelTemplateMatcher matcher = new PixelTemplateMatcher(store, region -> {
            captured.set(region);
            return screen;
        });
        Region region = new Region(100, 50, 20, 20);

        // Act
        Optional<Match> match = matcher.match(new MatchRequest("checker", region, 0.9, ColorMode.GRAYSCALE));

        // Assert
        assertThat(captured.get()).isEqualTo(region);
        assertThat(match).contains(new Match(112, 55, 3, 3, 1.0));
        assertThat(match.get().centerX()).isEqualTo(113);
    }

    @Test
    void belowThresholdIsNoMatch() {
        MapAssetStore store = new MapAssetStore();
        store.assets.put("white", new Asset("white", filled(3, 3, WHITE), Map.of()));
        PixelTemplateMatcher matcher = new PixelTemplateMatcher(store, region -> filled(10, 10, 0));

        assertThat(matcher.match(MatchRequest.of("white"))).isEmpty();
    }

    @Test
    void partialMatchScoresProportionally() {
        BufferedImage needle = filled(2, 1, WHITE);
        BufferedImage hay = filled(2, 1, WHITE);
        hay.setRGB(1, 0, 0);

        Optional<Match> found = PixelTemplateMatcher.search(hay, needle, 0.4, ColorMode.GRAYSCALE);

        assertThat(found).isPresent();
        assertThat(found.get().score()).isCloseTo(0.5, within(1e-9));
        assertThat(PixelTemplateMatcher.search(hay, needle, 0.6, ColorMode.GRAYSCALE)).isEmpty();
    }

    @Test
    void colorModeDistinguishesEqualLuminance() {
        int red = 0xFF0000;
        int gray = 0x4C4C4C;
        assertThat(PixelTemplateMatcher.luminance(red)).isEqualTo(PixelTemplateMatcher.luminance(gray));

        BufferedImage hay = filled(4, 4, gray);
        BufferedImage needle = filled(2, 2, red);

        assertThat(PixelTemplateMatcher.search(hay, needle, 0.99, ColorMode.GRAYSCALE)).isPresent();
        assertThat(PixelTemplateMatcher.search(hay, needle, 0.99, ColorMode.COLOR)).isEmpty();
    }

    @Test
    void templateLargerThanScreenIsNoMatch() {
        assertThat(PixelTemplateMatcher.search(filled(2, 2, 0), filled(3, 1, 0), 0.0, ColorMode.GRAYSCALE))
                .isEmpty();
    }

    @Test
    void missingAssetPropagates() {
        PixelTemplateMatcher matcher = new PixelTemplateMatcher(new MapAssetStore(), region -> filled(4, 4, 0));

        assertThatThrownBy(() -> matcher.match(MatchRequest.of("nope")))
                .isInstanceOf(AssetMissingException.class);
    }
}
