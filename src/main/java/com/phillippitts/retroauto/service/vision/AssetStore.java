package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.exception.AssetMissingException;

/**
 * Read access to template images by id.
 */
public interface AssetStore {

    /**
     * @throws AssetMissingException if no asset has that id
     */
    Asset get(String templateId);

    boolean contains(String templateId);
}
