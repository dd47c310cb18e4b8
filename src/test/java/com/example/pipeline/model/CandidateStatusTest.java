package com.example.pipeline.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CandidateStatus and StatusChangeSource parsing")
class CandidateStatusTest {

    @Test
    @DisplayName("Should parse display labels and constant names ignoring case")
    void shouldParseLabelsAndNames() {
        assertThat(CandidateStatus.parse("Reference Check")).contains(CandidateStatus.REFERENCE_CHECK);
        assertThat(CandidateStatus.parse("reference_check")).contains(CandidateStatus.REFERENCE_CHECK);
        assertThat(CandidateStatus.parse(" hired ")).contains(CandidateStatus.HIRED);
    }

    @Test
    @DisplayName("Should return empty for unknown or blank values")
    void shouldRejectUnknown() {
        assertThat(CandidateStatus.parse("Interviewing")).isEmpty();
        assertThat(CandidateStatus.parse("")).isEmpty();
        assertThat(CandidateStatus.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Should flag hired, rejected and withdrawn as terminal")
    void shouldFlagTerminalStatuses() {
        assertThat(CandidateStatus.HIRED.isTerminal()).isTrue();
        assertThat(CandidateStatus.REJECTED.isTerminal()).isTrue();
        assertThat(CandidateStatus.WITHDRAWN.isTerminal()).isTrue();
        assertThat(CandidateStatus.OFFER.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Should parse change sources by wire value")
    void shouldParseSources() {
        assertThat(StatusChangeSource.parse("bulk_action")).contains(StatusChangeSource.BULK_ACTION);
        assertThat(StatusChangeSource.parse("API")).contains(StatusChangeSource.API);
        assertThat(StatusChangeSource.parse("cron")).isEmpty();
    }
}
