package com.cgi.medscrub.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClinicalWhitelistTest {

    @Test
    @DisplayName("acronyms match only as exact all-caps tokens")
    void acronyms_are_case_exact() {
        assertThat(ClinicalWhitelist.isTerm("DOE")).isTrue();
        assertThat(ClinicalWhitelist.isTerm("ED")).isTrue();
        assertThat(ClinicalWhitelist.isTerm("Doe")).isFalse();
        assertThat(ClinicalWhitelist.isTerm("Ed")).isFalse();
        assertThat(ClinicalWhitelist.isTerm("Pet")).isFalse();
        assertThat(ClinicalWhitelist.isAcronym("icu")).isFalse();
        assertThat(ClinicalWhitelist.isAcronym("ICU")).isTrue();
    }

    @Test
    @DisplayName("title-case vocabulary is matched regardless of case")
    void terms() {
        assertThat(ClinicalWhitelist.isTerm("Admission")).isTrue();
        assertThat(ClinicalWhitelist.isTerm("admission")).isTrue();
        assertThat(ClinicalWhitelist.isTerm("Smith")).isFalse();
    }

    @Test
    @DisplayName("a name is never entirely whitelisted")
    void phrases() {
        assertThat(ClinicalWhitelist.isEntirelyWhitelisted("Jane Doe")).isFalse();
        assertThat(ClinicalWhitelist.isEntirelyWhitelisted("Follow Up")).isTrue();
        assertThat(ClinicalWhitelist.containsWhitelisted("Ed Pet")).isFalse();
    }
}
