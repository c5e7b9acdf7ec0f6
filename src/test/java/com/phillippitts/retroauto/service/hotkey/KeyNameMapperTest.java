package com.phillippitts.retroauto.service.hotkey;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeyNameMapperTest {

    @Test
    void normalizesAliases() {
        assertThat(KeyNameMapper.normalizeKey("esc")).isEqualTo("ESCAPE");
        assertThat(KeyNameMapper.normalizeKey("Page Down")).isEqualTo("PAGE_DOWN");
        assertThat(KeyNameMapper.normalizeKey(null)).isEqualTo("UNKNOWN");
        assertThat(KeyNameMapper.normalizeModifier("ctrl")).isEqualTo("CONTROL");
        assertThat(KeyNameMapper.normalizeModifier("Right Command")).isEqualTo("META");
        assertThat(KeyNameMapper.normalizeModifier("option")).isEqualTo("ALT");
        assertThat(KeyNameMapper.normalizeModifiers(List.of("LEFT_SHIFT", "win")))
                .containsExactlyInAnyOrder("SHIFT", "META");
    }

    @Test
    void validatesKeysAndModifiers() {
        assertThat(KeyNameMapper.isValidKey("F24")).isTrue();
        assertThat(KeyNameMapper.isValidKey("scroll lock")).isTrue();
        assertThat(KeyNameMapper.isValidKey("F25")).isFalse();
        assertThat(KeyNameMapper.isValidModifier("LEFT_META")).isTrue();
        assertThat(KeyNameMapper.isValidModifier("HYPER")).isFalse();
    }

    @Test
    void matchesReservedCombos() {
        assertThat(KeyNameMapper.matchesReserved(Set.of("META"), "TAB", "META+TAB")).isTrue();
        assertThat(KeyNameMapper.matchesReserved(Set.of("CMD"), "l", "META+L")).isTrue();
        assertThat(KeyNameMapper.matchesReserved(Set.of("META", "SHIFT"), "TAB", "META+TAB")).isFalse();
        assertThat(KeyNameMapper.matchesReserved(Set.of(), "F6", null)).isFalse();
    }
}
