package com.phillippitts.retroauto.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of primitive actions a script can call.
 *
 * <p>Each kind is resolved from its keyword at parse time, together with its arity and the
 * named options it accepts, so nothing is looked up by name while the script runs.
 */
public enum ActionKind {

    CLICK("click", Category.INPUT, 0, 2, Set.of("button", "clicks", "interval")),
    CLICK_IMAGE("click_image", Category.VISION, 1, 1,
            Set.of("timeout", "region", "threshold", "poll", "button", "clicks", "offset_x", "offset_y")),
    MOVE("move", Category.INPUT, 2, 2, Set.of()),
    DRAG("drag", Category.INPUT, 4, 4, Set.of("duration", "button")),
    SCROLL("scroll", Category.INPUT, 1, 3, Set.of()),
    TYPE("type", Category.INPUT, 1, 1, Set.of("enter", "paste")),
    HOTKEY("hotkey", Category.INPUT, 1, 6, Set.of()),
    DELAY("delay", Category.BUILTIN, 1, 1, Set.of()),
    DELAY_RANDOM("delay_random", Category.BUILTIN, 2, 2, Set.of()),
    WAIT_IMAGE("wait_image", Category.VISION, 1, 1, Set.of("timeout", "region", "threshold", "poll")),
    WAIT_VANISH("wait_vanish", Category.VISION, 1, 1, Set.of("timeout", "region", "threshold", "poll")),
    LOG("log", Category.BUILTIN, 1, 1, Set.of("level"));

    /** Option accepted by every action to override the script-wide error policy. */
    public static final String ON_ERROR_OPTION = "on_error";

    /** Which collaborator performs the action. */
    public enum Category { INPUT, VISION, BUILTIN }

    private static final Map<String, ActionKind> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ActionKind::keyword, Function.identity()));

    private final String keyword;
    private final Category category;
    private final int minArgs;
    private final int maxArgs;
    private final Set<String> options;

    ActionKind(String keyword, Category category, int minArgs, int maxArgs, Set<String> options) {
        this.keyword = keyword;
        this.category = category;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.options = options;
    }

    public static Optional<ActionKind> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEYWORD.get(keyword.toLowerCase(Locale.ROOT)));
    }

    public String keyword() {
        return keyword;
    }

    public Category category() {
        return category;
    }

    public int minArgs() {
        return minArgs;
    }

    public int maxArgs() {
        return maxArgs;
    }

    public boolean acceptsOption(String name) {
        return ON_ERROR_OPTION.equals(name) || options.contains(name);
    }
}
