package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.domain.Match;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.exception.ImageNotFoundException;
import com.phillippitts.retroauto.service.vision.VisionMatcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Executor-side access to the vision matcher: one-shot queries, polling waits, and the
 * last successful match that {@code click()} without coordinates targets.
 *
 * <p>Executor thread only.
 */
final class VisionQueries {

    private final VisionMatcher matcher;
    private final ExecutionControl control;
    private final Clock clock;
    private Match lastMatch;

    VisionQueries(VisionMatcher matcher, ExecutionControl control, Clock clock) {
        this.matcher = matcher;
        this.control = control;
        this.clock = clock;
    }

    Optional<Match> find(MatchRequest request) {
        Optional<Match> match = matcher.match(request);
        match.ifPresent(m -> lastMatch = m);
        return match;
    }

    /**
     * Polls until the template appears.
     *
     * @return the match, or empty if stop was requested while waiting
     * @throws ImageNotFoundException when {@code timeout} elapses first
     */
    Optional<Match> waitFor(MatchRequest request, Duration timeout, Duration poll) {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            Optional<Match> match = find(request);
            if (match.isPresent()) {
                return match;
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new ImageNotFoundException(request.templateId(), timeout.toMillis());
            }
            if (!control.sleep(poll)) {
                return Optional.empty();
            }
        }
    }

    /**
     * Polls until the template is gone.
     *
     * @return {@code false} if stop was requested while waiting
     * @throws ImageNotFoundException when the template is still visible after {@code timeout}
     */
    boolean waitVanish(MatchRequest request, Duration timeout, Duration poll) {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            if (matcher.match(request).isEmpty()) {
                return true;
            }
            if (!clock.instant().isBefore(deadline)) {
                throw ImageNotFoundException.stillVisible(request.templateId(), timeout.toMillis());
            }
            if (!control.sleep(poll)) {
                return false;
            }
        }
    }

    Optional<Match> lastMatch() {
        return Optional.ofNullable(lastMatch);
    }
}
