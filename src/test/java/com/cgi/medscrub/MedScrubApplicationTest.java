package com.cgi.medscrub;

import com.cgi.medscrub.api.NamedEntityRecognizer;
import com.cgi.medscrub.api.ScrubService;
import com.cgi.medscrub.model.ScrubResult;
import com.cgi.medscrub.model.enums.WarningType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MedScrubApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ScrubService scrubService;

    @Test
    @DisplayName("context starts without an entity-recognition service")
    void contextLoads() {
        assertThat(context.getBeanNamesForType(NamedEntityRecognizer.class)).isEmpty();
        assertThat(context.containsBean("nerExecutor")).isTrue();
        assertThat(context.containsBean("scrubExecutor")).isTrue();
    }

    @Test
    @DisplayName("the wired engine scrubs and reports the missing model")
    void wired_engine() {
        ScrubResult result = scrubService.scrub("Patient Name: John Smith, SSN: 123-45-6789");

        assertThat(result.getCount()).isEqualTo(2);
        assertThat(result.getText()).doesNotContain("John Smith").doesNotContain("123-45-6789");
        assertThat(result.getWarnings()).anySatisfy(w ->
                assertThat(w.getType()).isEqualTo(WarningType.STATISTICAL_MODEL_ERROR));
    }
}
