package com.phillippitts.retroauto.service.supervisor;

import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.domain.Region;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterruptRuleLoaderTest {

    @Test
    void parsesFullAndMinimalRules() {
        // Arrange
        String json = """
                [
                  {"id":"relogin","triggerAssetId":"login_screen","region":[0,0,800,600],
                   "threshold":0.9,"targetFlow":"relogin","priority":10,"cooldownMs":30000},
                  {"id":"popup","triggerAssetId":"popup.png","targetFlow":"dismiss"}
                ]
                """;

        // Act
        List<InterruptRule> rules = InterruptRuleLoader.parse(json);

        // Assert
        assertThat(rules).containsExactly(
                new InterruptRule("relogin", "login_screen", new Region(0, 0, 800, 600), 0.9, "relogin",
                        10, Duration.ofSeconds(30)),
                new InterruptRule("popup", "popup.png", null, 0.8, "dismiss", 0, Duration.ofSeconds(2)));
    }

    @Test
    void blankInputMeansNoRules() {
        assertThat(InterruptRuleLoader.parse("  ")).isEmpty();
        assertThat(InterruptRuleLoader.parse(null)).isEmpty();
    }

    @Test
    void rejectsNonArray() {
        assertThatThrownBy(() -> InterruptRuleLoader.parse("{\"id\":\"x\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JSON array");
    }

    @Test
    void reportsIndexOfInvalidRule() {
        String json = "[{\"id\":\"a\",\"triggerAssetId\":\"a\",\"targetFlow\":\"f\"},"
                + "{\"id\":\"b\",\"targetFlow\":\"f\"}]";

        assertThatThrownBy(() -> InterruptRuleLoader.parse(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid interrupt rule #1");
    }

    @Test
    void rejectsOutOfRangeThresholdAndBadRegion() {
        assertThatThrownBy(() -> InterruptRuleLoader.parse(
                "[{\"id\":\"a\",\"triggerAssetId\":\"a\",\"targetFlow\":\"f\",\"threshold\":2}]"))
                .hasMessageContaining("threshold");
        assertThatThrownBy(() -> InterruptRuleLoader.parse(
                "[{\"id\":\"a\",\"triggerAssetId\":\"a\",\"targetFlow\":\"f\",\"region\":[1,2]}]"))
                .hasMessageContaining("region needs 4 integers");
    }

    @Test
    void rejectsPriorityThatIsNotA32BitInteger() {
        String base = "[{\"id\":\"a\",\"triggerAssetId\":\"a\",\"targetFlow\":\"f\",";

        assertThatThrownBy(() -> InterruptRuleLoader.parse(base + "\"priority\":4294967296}]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid interrupt rule #0")
                .hasMessageContaining("priority is not a 32-bit integer");
        assertThatThrownBy(() -> InterruptRuleLoader.parse(base + "\"priority\":1.5}]"))
                .hasMessageContaining("priority must be a whole number");
        assertThatThrownBy(() -> InterruptRuleLoader.parse(base + "\"priority\":\"high\"}]"))
                .hasMessageContaining("priority must be a number");
        assertThat(InterruptRuleLoader.parse(base + "\"priority\":-7}]"))
                .singleElement().extracting(InterruptRule::priority).isEqualTo(-7);
    }

    @Test
    void rejectsRegionValuesBeyondIntRange() {
        assertThatThrownBy(() -> InterruptRuleLoader.parse(
                "[{\"id\":\"a\",\"triggerAssetId\":\"a\",\"targetFlow\":\"f\","
                        + "\"region\":[0,0,10,4294967296]}]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("region height is not a 32-bit integer");
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rules.json");
        Files.writeString(file, "[{\"id\":\"a\",\"triggerAssetId\":\"a.png\",\"targetFlow\":\"f\"}]");

        assertThat(InterruptRuleLoader.load(file)).extracting(InterruptRule::id).containsExactly("a");
    }

    @Test
    void missingFileIsUnchecked(@TempDir Path dir) {
        assertThatThrownBy(() -> InterruptRuleLoader.load(dir.resolve("absent.json")))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void mergeKeepsScriptRulesFirst() {
        InterruptRule script = new InterruptRule("s", "a", null, 0.8, "main", 1, null);
        InterruptRule file = new InterruptRule("f", "b", null, 0.8, "main", 1, null);

        assertThat(InterruptRuleLoader.merge(List.of(script), List.of(file), Set.of("main")))
                .containsExactly(script, file);
    }

    @Test
    void mergeRejectsDuplicateIdsAndUnknownFlows() {
        InterruptRule a = new InterruptRule("a", "a", null, 0.8, "main", 1, null);
        InterruptRule stray = new InterruptRule("b", "b", null, 0.8, "nowhere", 1, null);

        assertThatThrownBy(() -> InterruptRuleLoader.merge(List.of(a), List.of(a), Set.of("main")))
                .hasMessageContaining("Duplicate interrupt rule id: a");
        assertThatThrownBy(() -> InterruptRuleLoader.merge(List.of(), List.of(stray), Set.of("main")))
                .hasMessageContaining("targets unknown flow: nowhere");
    }
}
