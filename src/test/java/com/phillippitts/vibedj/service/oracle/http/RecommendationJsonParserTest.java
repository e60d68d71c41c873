package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.exception.OracleException;
import com.phillippitts.vibedj.service.oracle.OracleCandidate;
import com.phillippitts.vibedj.service.oracle.RecommendationResponse;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationJsonParserTest {

    @Test
    void shouldParseCandidatesAndSkipNonObjects() {
        String json = """
                {"candidates": [
                  {"title": " So What ", "artist": "Miles Davis", "reasoning": "modal calm"},
                  "garbage",
                  {"search_query": "Naima by John Coltrane"}
                ]}
                """;

        RecommendationResponse r = RecommendationJsonParser.parse(json, "recommender");

        assertThat(r.skipMusic()).isFalse();
        assertThat(r.candidates()).hasSize(2);
        OracleCandidate first = r.candidates().get(0);
        assertThat(first.title()).isEqualTo("So What");
        assertThat(first.rationale()).isEqualTo("modal calm");
        assertThat(r.candidates().get(1).searchQuery()).isEqualTo("Naima by John Coltrane");
    }

    @Test
    void shouldHonorSkipRequest() {
        RecommendationResponse r = RecommendationJsonParser.parse(
                "{\"skip_music\": true, \"skip_reason\": \"meeting\", \"candidates\": [{\"title\": \"x\"}]}",
                "recommender");

        assertThat(r.skipMusic()).isTrue();
        assertThat(r.skipReason()).isEqualTo("meeting");
        assertThat(r.candidates()).isEmpty();
    }

    @Test
    void shouldDefaultSkipReason() {
        assertThat(RecommendationJsonParser.parse("{\"skip_music\": true}", "recommender").skipReason())
                .isEqualTo("skip");
    }

    @Test
    void shouldReturnNoCandidatesWhenKeyMissing() {
        assertThat(RecommendationJsonParser.parse("{}", "recommender").candidates()).isEmpty();
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> RecommendationJsonParser.parse("{candidates:", "recommender"))
                .isInstanceOf(OracleException.class);
    }
}
