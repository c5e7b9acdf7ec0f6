package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.domain.ColorMode;
import com.phillippitts.retroauto.domain.Match;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.domain.ResolvedArgs;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.exception.ActionFailedException;
import com.phillippitts.retroauto.service.input.ActionExecutor;
import com.phillippitts.retroauto.util.LogSanitizer;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Closed dispatch table from {@link ActionKind} to its handler.
 *
 * <p>Input actions go straight to the {@link ActionExecutor}; vision actions poll the matcher
 * first; built-ins (delays, log) run here. Blocking handlers return early when stop is requested.
 */
final class ActionDispatcher {

    /** Log stream of the {@code log(...)} action. */
    private static final Logger SCRIPT_LOG = LogManager.getLogger("com.phillippitts.retroauto.script");

    @FunctionalInterface
    interface Handler {
        void handle(ResolvedArgs args);
    }

    private final Map<ActionKind, Handler> handlers = new EnumMap<>(ActionKind.class);
    private final ActionExecutor input;
    private final VisionQueries vision;
    private final ExecutionControl control;
    private final ExecutionSettings settings;

    ActionDispatcher(ActionExecutor input, VisionQueries vision, ExecutionControl control, ExecutionSettings settings) {
        this.input = input;
        this.vision = vision;
        this.control = control;
        this.settings = settings;

        handlers.put(ActionKind.CLICK, this::click);
        handlers.put(ActionKind.CLICK_IMAGE, this::clickImage);
        handlers.put(ActionKind.MOVE, args -> input.perform(ActionKind.MOVE, args));
        handlers.put(ActionKind.DRAG, args -> input.perform(ActionKind.DRAG, args));
        handlers.put(ActionKind.SCROLL, args -> input.perform(ActionKind.SCROLL, args));
        handlers.put(ActionKind.TYPE, args -> input.perform(ActionKind.TYPE, args));
        handlers.put(ActionKind.HOTKEY, args -> input.perform(ActionKind.HOTKEY, args));
        handlers.put(ActionKind.DELAY, args -> control.sleep(args.at(0).asDuration()));
        handlers.put(ActionKind.DELAY_RANDOM, this::delayRandom);
        handlers.put(ActionKind.WAIT_IMAGE, this::waitImage);
        handlers.put(ActionKind.WAIT_VANISH, this::waitVanish);
        handlers.put(ActionKind.LOG, this::log);
    }

    void dispatch(ActionKind kind, ResolvedArgs args) {
        Handler handler = handlers.get(kind);
        if (handler == null) {
            throw new ActionFailedException(kind, "no handler registered");
        }
        handler.handle(args);
    }

    private void click(ResolvedArgs args) {
        if (args.size() == 2) {
            input.perform(ActionKind.CLICK, args);
            return;
        }
        if (args.size() == 1) {
            throw new ActionFailedException(ActionKind.CLICK, "needs both x and y, or none");
        }
        Match match = vision.lastMatch()
                .orElseThrow(() -> new ActionFailedException(ActionKind.CLICK, "no coordinates and no previous match"));
        input.perform(ActionKind.CLICK, at(match.centerX(), match.centerY(), args.named()));
    }

    private void clickImage(ResolvedArgs args) {
        Optional<Match> match = vision.waitFor(request(args), timeout(args), poll(args));
        if (match.isEmpty()) {
            return;
        }
        int x = match.get().centerX() + args.intOption("offset_x", 0);
        int y = match.get().centerY() + args.intOption("offset_y", 0);
        Map<String, Value> clickOptions = new HashMap<>();
        args.option("button").ifPresent(v -> clickOptions.put("button", v));
        args.option("clicks").ifPresent(v -> clickOptions.put("clicks", v));
        input.perform(ActionKind.CLICK, at(x, y, clickOptions));
    }

    private void waitImage(ResolvedArgs args) {
        vision.waitFor(request(args), timeout(args), poll(args));
    }

    private void waitVanish(ResolvedArgs args) {
        vision.waitVanish(request(args), timeout(args), poll(args));
    }

    private void delayRandom(ResolvedArgs args) {
        long min = args.at(0).asDuration().toMillis();
        long max = args.at(1).asDuration().toMillis();
        if (max < min) {
            throw new ActionFailedException(ActionKind.DELAY_RANDOM, "max " + max + "ms is below min " + min + "ms");
        }
        long ms = min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        control.sleep(Duration.ofMillis(ms));
    }

    private void log(ResolvedArgs args) {
        Level level = Level.toLevel(args.textOption("level", "info"), Level.INFO);
        SCRIPT_LOG.log(level, "{}", LogSanitizer.truncate(args.textAt(0), 500));
    }

    private static MatchRequest request(ResolvedArgs args) {
        double threshold = args.doubleOption("threshold", MatchRequest.DEFAULT_THRESHOLD);
        return new MatchRequest(args.textAt(0), args.regionOption("region").orElse(null), threshold, ColorMode.GRAYSCALE);
    }

    private Duration timeout(ResolvedArgs args) {
        return args.durationOption("timeout", settings.waitTimeout());
    }

    private Duration poll(ResolvedArgs args) {
        return args.durationOption("poll", settings.pollInterval());
    }

    private static ResolvedArgs at(int x, int y, Map<String, Value> named) {
        Map<String, Value> options = new HashMap<>(named);
        options.remove(ActionKind.ON_ERROR_OPTION);
        return new ResolvedArgs(List.of(Value.ofInt(x), Value.ofInt(y)), options);
    }
}
