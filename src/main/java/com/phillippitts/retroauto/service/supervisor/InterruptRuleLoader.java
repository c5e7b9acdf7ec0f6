package com.phillippitts.retroauto.service.supervisor;

import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.domain.Region;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads interrupt rules persisted beside a script as a JSON array:
 * <pre>
 * [{"id":"relogin","triggerAssetId":"login_screen","region":[0,0,800,600],
 *   "threshold":0.9,"targetFlow":"relogin","priority":10,"cooldownMs":30000}]
 * </pre>
 * {@code region}, {@code threshold}, {@code priority} and {@code cooldownMs} are optional.
 */
public final class InterruptRuleLoader {

    private static final Logger LOG = LogManager.getLogger(InterruptRuleLoader.class);

    private InterruptRuleLoader() {}

    public static List<InterruptRule> load(Path file) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            List<InterruptRule> rules = parse(json);
            LOG.info("Loaded {} interrupt rules from {}", rules.size(), file);
            return rules;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read interrupt rules from " + file, e);
        }
    }

    /**
     * @throws IllegalArgumentException on malformed JSON or an invalid rule
     */
    public static List<InterruptRule> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONArray array;
        try {
            array = new JSONArray(json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Interrupt rules must be a JSON array: " + e.getMessage(), e);
        }
        List<InterruptRule> rules = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject obj = array.optJSONObject(i);
            if (obj == null) {
                throw new IllegalArgumentException("Interrupt rule #" + i + " is not an object");
            }
            try {
                rules.add(rule(obj));
            } catch (JSONException | IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Invalid interrupt rule #" + i + ": " + e.getMessage(), e);
            }
        }
        return rules;
    }

    /**
     * Script rules first, then file rules; registration order is preserved for tie-breaks.
     *
     * @throws IllegalArgumentException on a duplicate id or a target flow that does not exist
     */
    public static List<InterruptRule> merge(List<InterruptRule> scriptRules,
                                            List<InterruptRule> fileRules,
                                            Set<String> flowNames) {
        List<InterruptRule> merged = new ArrayList<>(scriptRules);
        merged.addAll(fileRules);
        Set<String> ids = new HashSet<>();
        for (InterruptRule rule : merged) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate interrupt rule id: " + rule.id());
            }
            if (!flowNames.contains(rule.targetFlow())) {
                throw new IllegalArgumentException(
                        "Interrupt rule " + rule.id() + " targets unknown flow: " + rule.targetFlow());
            }
        }
        return List.copyOf(merged);
    }

    private static InterruptRule rule(JSONObject obj) {
        Region region = null;
        JSONArray r = obj.optJSONArray("region");
        if (r != null) {
            if (r.length() != 4) {
                throw new IllegalArgumentException("region needs 4 integers, got " + r.length());
            }
            region = new Region(exactInt(r.get(0), "region x"), exactInt(r.get(1), "region y"),
                    exactInt(r.get(2), "region width"), exactInt(r.get(3), "region height"));
        }
        return new InterruptRule(
                obj.getString("id"),
                obj.getString("triggerAssetId"),
                region,
                obj.optDouble("threshold", MatchRequest.DEFAULT_THRESHOLD),
                obj.getString("targetFlow"),
                obj.has("priority") ? exactInt(obj.get("priority"), "priority") : 0,
                obj.has("cooldownMs")
                        ? Duration.ofMillis(exactLong(obj.get("cooldownMs"), "cooldownMs"))
                        : InterruptRule.DEFAULT_COOLDOWN);
    }

    private static int exactInt(Object raw, String what) {
        try {
            return exact(raw, what).intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(what + " is not a 32-bit integer: " + raw);
        }
    }

    private static long exactLong(Object raw, String what) {
        try {
            return exact(raw, what).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(what + " is not a 64-bit integer: " + raw);
        }
    }

    private static BigDecimal exact(Object raw, String what) {
        if (!(raw instanceof Number)) {
            throw new IllegalArgumentException(what + " must be a number, got " + raw);
        }
        BigDecimal value = new BigDecimal(raw.toString());
        try {
            value.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(what + " must be a whole number, got " + raw);
        }
        return value;
    }
}
