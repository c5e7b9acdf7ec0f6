package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.config.properties.EngineProperties;
import com.phillippitts.retroauto.exception.AssetMissingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads {@code <assetsDir>/<id>.png} on demand.
 *
 * <p>Loaded images are cached against the file's modification time. The file is checked on
 * every lookup, so a template deleted mid-run surfaces as {@link AssetMissingException}.
 */
@Component
public class FileSystemAssetStore implements AssetStore {

    private static final Logger LOG = LogManager.getLogger(FileSystemAssetStore.class);
    static final String EXTENSION = ".png";

    private record Cached(Asset asset, FileTime modified) {
    }

    private final Path directory;
    private final Map<String, Cached> cache = new ConcurrentHashMap<>();

    @Autowired
    public FileSystemAssetStore(EngineProperties props) {
        this(Path.of(props.getAssetsDir()));
    }

    public FileSystemAssetStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Asset get(String templateId) {
        Path file = resolve(templateId);
        if (!Files.isRegularFile(file)) {
            cache.remove(templateId);
            throw new AssetMissingException(templateId);
        }
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            Cached cached = cache.get(templateId);
            if (cached != null && cached.modified().equals(modified)) {
                return cached.asset();
            }
            BufferedImage image = ImageIO.read(file.toFile());
            if (image == null) {
                throw new AssetMissingException(templateId,
                        new IOException("Unsupported image format: " + file.getFileName()));
            }
            Asset asset = new Asset(templateId, image, Map.of(
                    "path", file.toString(),
                    "size", image.getWidth() + "x" + image.getHeight()));
            cache.put(templateId, new Cached(asset, modified));
            LOG.debug("Loaded asset id={} size={}x{}", templateId, image.getWidth(), image.getHeight());
            return asset;
        } catch (IOException e) {
            cache.remove(templateId);
            throw new AssetMissingException(templateId, e);
        }
    }

    @Override
    public boolean contains(String templateId) {
        return Files.isRegularFile(resolve(templateId));
    }

    private Path resolve(String templateId) {
        if (templateId == null || templateId.isBlank() || templateId.contains("..")
                || templateId.contains("/") || templateId.contains("\\")) {
            throw new AssetMissingException(String.valueOf(templateId));
        }
        return directory.resolve(templateId + EXTENSION);
    }
}
