package com.cgi.medscrub.strategy;

import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.ErrorCollector;
import com.cgi.medscrub.model.ScrubConfig;
import com.cgi.medscrub.model.enums.DetectionMethod;
import com.cgi.medscrub.model.enums.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralPatternStrategyTest {

    private final StructuralPatternStrategy strategy = new StructuralPatternStrategy();
    private final ScrubConfig config = ScrubConfig.defaults();

    private List<Detection> detect(String text) {
        return strategy.detect(text, config, new ErrorCollector()).stream()
                .flatMap(run -> run.getDetections().stream())
                .collect(Collectors.toList());
    }

    private List<String> textsOf(String text, EntityType type) {
        return detect(text).stream()
                .filter(d -> d.getEntityType() == type)
                .map(Detection::getEntityText)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Pattern families")
    class PatternFamilies {

        @Test
        @DisplayName("email address")
        void email() {
            assertThat(textsOf("Contact jane.doe@example.com today", EntityType.EMAIL))
                    .containsExactly("jane.doe@example.com");
        }

        @Test
        @DisplayName("SSN with its confidence and offsets")
        void ssn() {
            String text = "SSN: 123-45-6789";
            Detection ssn = detect(text).stream()
                    .filter(d -> d.getEntityType() == EntityType.NATIONAL_ID)
                    .findFirst().orElseThrow();
            assertThat(ssn.getEntityText()).isEqualTo("123-45-6789");
            assertThat(ssn.getStartOffset()).isEqualTo(5);
            assertThat(ssn.getEndOffset()).isEqualTo(16);
            assertThat(ssn.getConfidence()).isEqualTo(0.99);
            assertThat(ssn.getMethod()).isEqualTo(DetectionMethod.REGEX);
            assertThat(ssn.getSource()).isEqualTo("SSN");
        }

        @Test
        @DisplayName("masked SSN keeps only the visible digits")
        void partial_ssn() {
            assertThat(textsOf("SSN on file xxx-xx-1234", EntityType.NATIONAL_ID)).containsExactly("1234");
        }

        @Test
        @DisplayName("credit card with consistent separators")
        void credit_card() {
            assertThat(textsOf("Card 4111 1111 1111 1111 on file", EntityType.CREDIT_CARD))
                    .containsExactly("4111 1111 1111 1111");
        }

        @Test
        @DisplayName("phone number with area code in parentheses")
        void phone() {
            assertThat(textsOf("Call (555) 123-4567 now", EntityType.PHONE)).containsExactly("(555) 123-4567");
        }

        @Test
        @DisplayName("five digit ZIP code")
        void zip() {
            assertThat(textsOf("Springfield 62704", EntityType.ZIP)).containsExactly("62704");
        }

        @Test
        @DisplayName("numeric, ISO, written and day-first dates")
        void dates() {
            assertThat(textsOf("seen on 01/15/2024", EntityType.DATE)).containsExactly("01/15/2024");
            assertThat(textsOf("seen on 2024-01-15", EntityType.DATE)).containsExactly("2024-01-15");
            assertThat(textsOf("seen on January 15, 2024 again", EntityType.DATE)).containsExactly("January 15, 2024");
            assertThat(textsOf("seen on 15th of March 2024", EntityType.DATE)).containsExactly("15th of March 2024");
        }

        @Test
        @DisplayName("street address and PO box")
        void addresses() {
            assertThat(textsOf("Lives at 123 Main Street.", EntityType.ADDRESS)).containsExactly("123 Main Street");
            assertThat(textsOf("Mail to P.O. Box 1234", EntityType.PO_BOX)).containsExactly("P.O. Box 1234");
        }

        @Test
        @DisplayName("city and state pair with a valid state code")
        void city_state() {
            assertThat(textsOf("moved to Boston, MA last year", EntityType.CITY_STATE)).containsExactly("Boston, MA");
            assertThat(textsOf("moved to Boston, QQ last year", EntityType.CITY_STATE)).isEmpty();
            assertThat(textsOf("Chronic, PA follow-up", EntityType.CITY_STATE)).isEmpty();
        }

        @Test
        @DisplayName("names written with a suffix or in capitals")
        void names() {
            assertThat(textsOf("seen with Robert Johnson Jr today", EntityType.PERSON))
                    .contains("Robert Johnson Jr");
            assertThat(textsOf("Patient JOHN SMITH admitted", EntityType.PERSON))
                    .contains("JOHN SMITH");
        }

        @Test
        @DisplayName("names with an apostrophe, a Mc or Mac prefix or a hyphen")
        void apostrophe_and_hyphen_names() {
            assertThat(textsOf("referred by O'Brien and McDonald", EntityType.PERSON))
                    .containsExactly("O'Brien", "McDonald");
            assertThat(textsOf("daughter Mary-Jane called", EntityType.PERSON)).containsExactly("Mary-Jane");
            assertThat(textsOf("seen by MacArthur-Smith", EntityType.PERSON)).containsExactly("MacArthur-Smith");
        }

        @Test
        @DisplayName("hyphenated clinical terms are not taken for names")
        void hyphenated_vocabulary() {
            assertThat(textsOf("Non-Hodgkin lymphoma, Post-Op day 2, Follow-Up booked", EntityType.PERSON))
                    .isEmpty();
        }
    }

    @Nested
    @DisplayName("Clinical vocabulary")
    class ClinicalVocabulary {

        @Test
        @DisplayName("clinical acronyms are not taken for names")
        void acronyms() {
            assertThat(textsOf("Admitted to ICU with COPD and CHF", EntityType.PERSON)).isEmpty();
        }

        @Test
        @DisplayName("capitalized section headers are not taken for names")
        void headers() {
            assertThat(textsOf("CHIEF COMPLAINT: chest pain. ASSESSMENT AND PLAN: rest.", EntityType.PERSON))
                    .isEmpty();
        }
    }

    @Test
    @DisplayName("existing placeholders are never matched again")
    void skips_placeholders() {
        assertThat(detect("[NAME_1a2b3c4d] called from [PHONE_0badf00d]")).isEmpty();
    }

    @Test
    @DisplayName("every pattern reports a run, matched or not")
    void one_run_per_pattern() {
        List<DetectorRun> runs = strategy.detect("nothing here", config, new ErrorCollector());
        assertThat(runs).extracting(DetectorRun::getPatternOrLabel)
                .containsExactlyElementsOf(strategy.getPatternNames());
        assertThat(runs).allSatisfy(run -> assertThat(run.getDetections()).isEmpty());
    }

    @Test
    @DisplayName("detection offsets always point at the detected text")
    void offsets_match_text() {
        String text = "Dr. visit 01/15/2024, call 555-123-4567, email a.b@c.org, 42 Elm Road, Boston, MA 02118.";
        assertThat(detect(text)).isNotEmpty().allSatisfy(d ->
                assertThat(text.substring(d.getStartOffset(), d.getEndOffset())).isEqualTo(d.getEntityText()));
    }

    @Nested
    @DisplayName("Backtracking safety")
    class BacktrackingSafety {

        private long bestOfThree(String text) {
            strategy.detect(text, config, new ErrorCollector());
            long best = Long.MAX_VALUE;
            for (int i = 0; i < 3; i++) {
                long start = System.nanoTime();
                strategy.detect(text, config, new ErrorCollector());
                best = Math.min(best, (System.nanoTime() - start) / 1_000_000);
            }
            return best;
        }

        @Test
        @DisplayName("10,000 character address-like input completes in under 100 ms")
        void address_like_input() {
            String text = ("1 " + "Main ".repeat(2000)).substring(0, 10_000);
            assertThat(bestOfThree(text)).isLessThan(100);
        }

        @Test
        @DisplayName("long runs of email and name characters complete in under 100 ms")
        void email_like_input() {
            String text = ("a.".repeat(2500) + "@" + "b-".repeat(2500)).substring(0, 10_000);
            assertThat(bestOfThree(text)).isLessThan(100);
            String caps = "ABC, ".repeat(2000);
            assertThat(bestOfThree(caps)).isLessThan(100);
        }
    }
}
