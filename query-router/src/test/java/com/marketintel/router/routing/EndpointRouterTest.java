package com.marketintel.router.routing;

import com.marketintel.router.model.EndpointScore;
import com.marketintel.router.model.RouteDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EndpointRouterTest {

    @Mock
    private EndpointScorer scorer;

    @Mock
    private MultiEndpointDetector detector;

    private EndpointRouter router;

    private final List<EndpointScore> scores = List.of(
            new EndpointScore("/risk-analysis", 5.4, List.of("Primary keywords: risk, volatility")));

    @BeforeEach
    void setUp() {
        router = new EndpointRouter(scorer, detector);
    }

    @Test
    void explicitEndpointBypassesScoring() {
        RouteDecision decision = router.route("anything at all", "  /competitive-analysis ");

        assertThat(decision.outcome()).isEqualTo(RouteDecision.Outcome.EXPLICIT_OVERRIDE);
        assertThat(decision.endpoint()).isEqualTo("/competitive-analysis");
        verifyNoInteractions(scorer, detector);
    }

    @Test
    void multiEndpointQueriesCarryScoresButNoEndpoint() {
        when(scorer.score("risk and opportunity")).thenReturn(scores);
        when(detector.isMultiEndpoint("risk and opportunity")).thenReturn(true);

        RouteDecision decision = router.route("risk and opportunity");

        assertThat(decision.isMultiEndpoint()).isTrue();
        assertThat(decision.endpoint()).isNull();
        assertThat(decision.scores()).isEqualTo(scores);
        verify(scorer, never()).bestOf(any());
    }

    @Test
    void singleEndpointUsesBestScore() {
        when(scorer.score("risky areas")).thenReturn(scores);
        when(detector.isMultiEndpoint("risky areas")).thenReturn(false);
        when(scorer.bestOf(scores)).thenReturn("/risk-analysis");

        RouteDecision decision = router.route("risky areas", " ");

        assertThat(decision.outcome()).isEqualTo(RouteDecision.Outcome.SINGLE_ENDPOINT);
        assertThat(decision.endpoint()).isEqualTo("/risk-analysis");
    }
}
