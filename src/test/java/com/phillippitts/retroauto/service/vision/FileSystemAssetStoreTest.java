package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.exception.AssetMissingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemAssetStoreTest {

    @TempDir
    Path dir;

    private Path writePng(String id, int width, int height) throws IOException {
        Path file = dir.resolve(id + ".png");
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", file.toFile());
        return file;
    }

    @Test
    void loadsPngWithMetadata() throws IOException {
        // Arrange
        writePng("ok_button", 12, 8);
        FileSystemAssetStore store = new FileSystemAssetStore(dir);

        // Act
        Asset asset = store.get("ok_button");

        // Assert
        assertThat(asset.id()).isEqualTo("ok_button");
        assertThat(asset.width()).isEqualTo(12);
        assertThat(asset.height()).isEqualTo(8);
        assertThat(asset.metadata()).containsEntry("size", "12x8");
        assertThat(store.contains("ok_button")).isTrue();
    }

    @Test
    void cachesUntilFileChanges() throws IOException {
        Path file = writePng("icon", 4, 4);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        FileSystemAssetStore store = new FileSystemAssetStore(dir);

        Asset first = store.get("icon");
        assertThat(store.get("icon")).isSameAs(first);

        writePng("icon", 6, 6);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-01-02T00:00:00Z")));

        Asset reloaded = store.get("icon");
        assertThat(reloaded).isNotSameAs(first);
        assertThat(reloaded.width()).isEqualTo(6);
    }

    @Test
    void deletedAssetIsMissing() throws IOException {
        Path file = writePng("gone", 4, 4);
        FileSystemAssetStore store = new FileSystemAssetStore(dir);
        store.get("gone");

        Files.delete(file);

        assertThat(store.contains("gone")).isFalse();
        assertThatThrownBy(() -> store.get("gone"))
                .isInstanceOf(AssetMissingException.class)
                .hasMessage("Asset not found: gone");
    }

    @Test
    void unreadableImageIsMissing() throws IOException {
        Files.writeString(dir.resolve("broken.png"), "not an image");
        FileSystemAssetStore store = new FileSystemAssetStore(dir);

        assertThatThrownBy(() -> store.get("broken"))
                .isInstanceOf(AssetMissingException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void rejectsPathTraversal() {
        FileSystemAssetStore store = new FileSystemAssetStore(dir);

        assertThatThrownBy(() -> store.get("../secret")).isInstanceOf(AssetMissingException.class);
        assertThatThrownBy(() -> store.get("a/b")).isInstanceOf(AssetMissingException.class);
    }
}
