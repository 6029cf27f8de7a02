package com.cgi.medscrub.service;

import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.MergeOutcome;
import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.model.ScrubState;
import com.cgi.medscrub.model.enums.DetectionMethod;
import com.cgi.medscrub.model.enums.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionMergerTest {

    private final DetectionMerger merger = new DetectionMerger();

    private static Detection at(String document, String value, int from, EntityType type,
                                DetectionMethod method, double confidence) {
        int start = document.indexOf(value, from);
        return Detection.builder()
                .entityText(value).entityType(type)
                .startOffset(start).endOffset(start + value.length())
                .confidence(confidence).method(method).source("test")
                .build();
    }

    private static Detection at(String document, String value, EntityType type, DetectionMethod method) {
        return at(document, value, 0, type, method, 0.9);
    }

    @Nested
    @DisplayName("Canonical selection")
    class CanonicalSelection {

        @Test
        @DisplayName("a later pass overrides an earlier one for the same text")
        void later_pass_wins() {
            String doc = "Patient Name: John Smith";
            Detection regex = at(doc, "John Smith", EntityType.PERSON, DetectionMethod.REGEX);
            Detection context = at(doc, "John Smith", EntityType.PERSON, DetectionMethod.CONTEXT);

            MergeOutcome outcome = merger.merge(List.of(regex), List.of(context), List.of());

            assertThat(outcome.getCanonical()).containsOnlyKeys("John Smith");
            assertThat(outcome.getCanonical().get("John Smith").getMethod()).isEqualTo(DetectionMethod.CONTEXT);
            assertThat(outcome.getSpans()).hasSize(1);
        }

        @Test
        @DisplayName("within a pass the first detection of a text wins")
        void first_in_pass_wins() {
            String doc = "Boston, MA and Boston, MA";
            Detection first = at(doc, "Boston, MA", 0, EntityType.CITY_STATE, DetectionMethod.REGEX, 0.75);
            Detection second = at(doc, "Boston, MA", 5, EntityType.LOCATION, DetectionMethod.REGEX, 0.99);

            MergeOutcome outcome = merger.merge(List.of(first, second), List.of(), List.of());

            assertThat(outcome.getCanonical().get("Boston, MA").getEntityType()).isEqualTo(EntityType.CITY_STATE);
            assertThat(outcome.getSpans()).hasSize(2);
        }

        @Test
        @DisplayName("repeated mentions share one canonical entry")
        void repeated_mentions() {
            String doc = "John Smith called. John Smith left.";
            Detection one = at(doc, "John Smith", 0, EntityType.PERSON, DetectionMethod.CONTEXT, 0.9);
            Detection two = at(doc, "John Smith", 5, EntityType.PERSON, DetectionMethod.CONTEXT, 0.9);

            MergeOutcome outcome = merger.merge(List.of(), List.of(one, two), List.of());

            assertThat(outcome.getCanonical()).hasSize(1);
            assertThat(outcome.getSpans()).extracting(Detection::getStartOffset).containsExactly(19, 0);
        }
    }

    @Nested
    @DisplayName("Overlap arbitration")
    class OverlapArbitration {

        @Test
        @DisplayName("the longer span wins and the shorter text is dropped entirely")
        void longest_wins() {
            String doc = "Patient Name: John Smith";
            Detection full = at(doc, "John Smith", EntityType.PERSON, DetectionMethod.CONTEXT);
            Detection part = at(doc, "Smith", EntityType.PERSON, DetectionMethod.STATISTICAL);

            MergeOutcome outcome = merger.merge(List.of(), List.of(full), List.of(part));

            assertThat(outcome.getSpans()).containsExactly(full);
            assertThat(outcome.getCanonical()).containsOnlyKeys("John Smith");
        }

        @Test
        @DisplayName("equal spans are settled by method precedence")
        void method_precedence() {
            String doc = "moved to Boston, MA";
            Detection regex = at(doc, "Boston, MA", EntityType.CITY_STATE, DetectionMethod.REGEX);
            Detection statistical = at(doc, "Boston, MA", EntityType.LOCATION, DetectionMethod.STATISTICAL);

            MergeOutcome outcome = merger.merge(List.of(regex), List.of(), List.of(statistical));

            assertThat(outcome.getSpans()).containsExactly(statistical);
            assertThat(outcome.getCanonical().get("Boston, MA").getEntityType()).isEqualTo(EntityType.LOCATION);
        }

        @Test
        @DisplayName("accepted spans never overlap and come in descending start order")
        void no_overlap() {
            String doc = "Call 555-123-4567 or 62704 on 01/15/2024";
            Detection phone = at(doc, "555-123-4567", EntityType.PHONE, DetectionMethod.REGEX);
            Detection inner = at(doc, "123-4567", 0, EntityType.ZIP, DetectionMethod.REGEX, 0.96);
            Detection zip = at(doc, "62704", EntityType.ZIP, DetectionMethod.REGEX);
            Detection date = at(doc, "01/15/2024", EntityType.DATE, DetectionMethod.REGEX);

            MergeOutcome outcome = merger.merge(List.of(date, inner, zip, phone), List.of(), List.of());

            assertThat(outcome.getSpans()).containsExactly(date, zip, phone);
            for (int i = 1; i < outcome.getSpans().size(); i++) {
                assertThat(outcome.getSpans().get(i).getEndOffset())
                        .isLessThanOrEqualTo(outcome.getSpans().get(i - 1).getStartOffset());
            }
            assertThat(outcome.getCanonical()).containsOnlyKeys("555-123-4567", "62704", "01/15/2024");
        }
    }

    @Nested
    @DisplayName("Replacement")
    class Replacement {

        @Test
        @DisplayName("every occurrence is replaced by the token of its text")
        void replaces_all() {
            String doc = "John Smith called. John Smith left on 01/15/2024.";
            Detection one = at(doc, "John Smith", 0, EntityType.PERSON, DetectionMethod.CONTEXT, 0.9);
            Detection two = at(doc, "John Smith", 5, EntityType.PERSON, DetectionMethod.CONTEXT, 0.9);
            Detection date = at(doc, "01/15/2024", EntityType.DATE, DetectionMethod.REGEX);
            MergeOutcome outcome = merger.merge(List.of(date), List.of(one, two), List.of());

            PlaceholderToken name = new PlaceholderToken(EntityType.PERSON, "0123abcd");
            PlaceholderToken day = new PlaceholderToken(EntityType.DATE, "89abcdef");
            ScrubState state = merger.apply(ScrubState.initial(doc), outcome,
                    Map.of("John Smith", name, "01/15/2024", day));

            assertThat(state.getCurrentText())
                    .isEqualTo("[NAME_0123abcd] called. [NAME_0123abcd] left on [DATE_89abcdef].");
            assertThat(state.getPerTypeCounts())
                    .containsEntry(EntityType.PERSON, 1)
                    .containsEntry(EntityType.DATE, 1);
            assertThat(state.getReplacements()).hasSize(2);
        }

        @Test
        @DisplayName("an empty outcome leaves the text unchanged")
        void empty_outcome() {
            ScrubState state = merger.apply(ScrubState.initial("nothing"), MergeOutcome.empty(), Map.of());
            assertThat(state.getCurrentText()).isEqualTo("nothing");
            assertThat(state.getPerTypeCounts()).isEmpty();
        }

        @Test
        @DisplayName("a span without a token is an error")
        void missing_token() {
            String doc = "SSN 123-45-6789";
            Detection ssn = at(doc, "123-45-6789", EntityType.NATIONAL_ID, DetectionMethod.REGEX);
            MergeOutcome outcome = merger.merge(List.of(ssn), List.of(), List.of());

            assertThatThrownBy(() -> merger.apply(ScrubState.initial(doc), outcome, Map.of()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageNotContaining("123-45-6789");
        }
    }
}
