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

class ContextLabelStrategyTest {

    private final ContextLabelStrategy strategy = new ContextLabelStrategy();
    private final ScrubConfig config = ScrubConfig.defaults();

    private List<Detection> detect(String text) {
        return strategy.detect(text, config, new ErrorCollector()).stream()
                .flatMap(run -> run.getDetections().stream())
                .collect(Collectors.toList());
    }

    private List<String> names(String text) {
        return detect(text).stream()
                .filter(d -> d.getEntityType() == EntityType.PERSON)
                .map(Detection::getEntityText)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Labeled names")
    class LabeledNames {

        @Test
        @DisplayName("only the value after the label is captured")
        void value_only() {
            String text = "Patient Name: John Smith, SSN: 123-45-6789";
            Detection name = detect(text).get(0);
            assertThat(name.getEntityText()).isEqualTo("John Smith");
            assertThat(name.getStartOffset()).isEqualTo(14);
            assertThat(name.getEntityType()).isEqualTo(EntityType.PERSON);
            assertThat(name.getMethod()).isEqualTo(DetectionMethod.CONTEXT);
            assertThat(name.getConfidence()).isEqualTo(ContextLabelStrategy.NAME_CONFIDENCE);
        }

        @Test
        @DisplayName("courtesy title stays outside the captured name")
        void title_excluded() {
            assertThat(names("Attending: Dr. Sarah Connor")).containsExactly("Sarah Connor");
        }

        @Test
        @DisplayName("Last, First form after a label")
        void last_first() {
            assertThat(names("Patient: Smith, John")).containsExactly("Smith, John");
        }

        @Test
        @DisplayName("capitalized names after an upper-case label")
        void all_caps() {
            assertThat(names("PATIENT NAME: JOHN SMITH")).containsExactly("JOHN SMITH");
        }

        @Test
        @DisplayName("trailing clinical words are trimmed from the name")
        void trailing_vocabulary() {
            assertThat(names("Patient Name: John Smith Admission date pending")).containsExactly("John Smith");
        }

        @Test
        @DisplayName("surnames spelled like acronyms stay part of the name")
        void acronym_lookalikes() {
            assertThat(names("Patient Name: Jane Doe, seen today")).containsExactly("Jane Doe");
            assertThat(names("Patient Name: Ed Pet")).containsExactly("Ed Pet");
        }

        @Test
        @DisplayName("a surname spelled like a month is not trimmed")
        void month_surname() {
            assertThat(names("Attending: Dr. Al May")).containsExactly("Al May");
        }

        @Test
        @DisplayName("a label followed by ordinary prose yields nothing")
        void prose_after_label() {
            assertThat(detect("Patient was seen in the ICU for COPD")).isEmpty();
        }

        @Test
        @DisplayName("a label followed only by clinical vocabulary yields nothing")
        void vocabulary_after_label() {
            assertThat(names("Patient: Follow Up")).isEmpty();
        }

        @Test
        @DisplayName("an existing placeholder after a label is left alone")
        void placeholder_after_label() {
            assertThat(detect("Patient Name: [NAME_1a2b3c4d]")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Medical record numbers")
    class MedicalRecordNumbers {

        @Test
        @DisplayName("numeric MRN after its label")
        void numeric() {
            Detection mrn = detect("MRN: 12345678").get(0);
            assertThat(mrn.getEntityText()).isEqualTo("12345678");
            assertThat(mrn.getEntityType()).isEqualTo(EntityType.MEDICAL_RECORD_NUMBER);
            assertThat(mrn.getConfidence()).isEqualTo(ContextLabelStrategy.MRN_CONFIDENCE);
        }

        @Test
        @DisplayName("alphanumeric record number after a long label")
        void alphanumeric() {
            assertThat(detect("Medical Record Number: AB123456"))
                    .extracting(Detection::getEntityText)
                    .containsExactly("AB123456");
        }

        @Test
        @DisplayName("a value without any digit is not an identifier")
        void no_digit() {
            assertThat(detect("MRN: pending")).isEmpty();
        }
    }

    @Test
    @DisplayName("one run per label family")
    void runs() {
        List<DetectorRun> runs = strategy.detect("MRN: 12345678. Patient Name: John Smith", config,
                new ErrorCollector());
        assertThat(runs).extracting(DetectorRun::getPatternOrLabel).containsExactly("MRN_LABELS", "NAME_LABELS");
        assertThat(runs.get(0).getDetections()).hasSize(1);
        assertThat(runs.get(1).getDetections()).hasSize(1);
    }

    @Test
    @DisplayName("disabled by configuration")
    void applicability() {
        assertThat(strategy.isApplicable(config)).isTrue();
        assertThat(strategy.isApplicable(config.toBuilder().enableContextDetector(false).build())).isFalse();
    }
}
