package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.domain.Match;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.exception.AssetMissingException;

import java.util.Optional;

/**
 * Locates a template on screen. Used by the main executor (image conditions and waits)
 * and by the interrupt supervisor (rule triggers), possibly from different threads.
 *
 * <p>Implementations must be thread-safe and deterministic for a given screen snapshot.
 */
public interface VisionMatcher {

    /**
     * @return the best match scoring at least the request threshold, or empty
     * @throws AssetMissingException if the template is not (or no longer) in the asset store
     */
    Optional<Match> match(MatchRequest request);
}
