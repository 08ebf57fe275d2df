package com.cricket.live.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cricket.live.model.Ball;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BallFeedResolverTest {
  private static final String LAST =
      "{\"strikerParticipantId\":\"S\",\"strikerShortName\":\"S Smith\","
          + "\"nonStrikerParticipantId\":\"N\",\"nonStriker\":\"N Jones\","
          + "\"bowlerParticipantId\":\"W\",\"bowlerShortName\":\"W Khan\","
          + "\"ballTime\":\"2024-11-02T03:10:00Z\"}";
  private static final String EARLIER = "{\"strikerParticipantId\":\"X\"}";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GrassrootsEndpoints endpoints =
      new GrassrootsEndpoints("https://api.test/scores", "eccn:true");
  private GrassrootsApiClient apiClient;
  private BallFeedResolver resolver;

  @BeforeEach
  void setUp() {
    apiClient = mock(GrassrootsApiClient.class);
    resolver = new BallFeedResolver(apiClient, endpoints);
  }

  private JsonNode json(String value) throws Exception {
    return objectMapper.readTree(value);
  }

  @Test
  void classifiesEveryKnownShape() throws Exception {
    assertThat(BallFeedShape.classify(json("[{\"balls\":[]}]"))).isEqualTo(BallFeedShape.INNINGS_LIST);
    assertThat(BallFeedShape.classify(json("[" + LAST + "]"))).isEqualTo(BallFeedShape.FLAT_BALL_LIST);
    assertThat(BallFeedShape.classify(json("[]"))).isEqualTo(BallFeedShape.FLAT_BALL_LIST);
    assertThat(BallFeedShape.classify(json("{\"innings\":[]}")))
        .isEqualTo(BallFeedShape.WRAPPED_INNINGS);
    assertThat(BallFeedShape.classify(json("{\"balls\":[]}"))).isEqualTo(BallFeedShape.WRAPPED_BALLS);
    assertThat(BallFeedShape.classify(json("{\"status\":\"ok\"}")))
        .isEqualTo(BallFeedShape.UNRECOGNISED);
  }

  @Test
  void flatListAndInningsListYieldSameLastBall() throws Exception {
    Optional<Ball> flat = BallFeedResolver.lastBallIn(json("[" + EARLIER + "," + LAST + "]"));
    Optional<Ball> nested =
        BallFeedResolver.lastBallIn(
            json("[{\"balls\":[" + EARLIER + "]},{\"balls\":[" + EARLIER + "," + LAST + "]}]"));

    assertThat(flat).isPresent();
    assertThat(nested).isPresent();
    assertThat(flat.get().getRaw()).isEqualTo(nested.get().getRaw());
    assertThat(nested.get().getStrikerId()).isEqualTo("S");
  }

  @Test
  void wrappedShapesAreNormalisedToo() throws Exception {
    assertThat(BallFeedResolver.lastBallIn(json("{\"innings\":[{\"balls\":[" + LAST + "]}]}")))
        .map(Ball::getBowlerId)
        .contains("W");
    assertThat(BallFeedResolver.lastBallIn(json("{\"balls\":[" + EARLIER + "," + LAST + "]}")))
        .map(Ball::getBowlerId)
        .contains("W");
  }

  @Test
  void onlyTheLastInningsIsConsulted() throws Exception {
    Optional<Ball> ball =
        BallFeedResolver.lastBallIn(json("[{\"balls\":[" + LAST + "]},{\"balls\":[]}]"));

    assertThat(ball).isEmpty();
  }

  @Test
  void feedOrderIsTrustedOverTimestamps() throws Exception {
    String later = "{\"strikerParticipantId\":\"LATER\",\"ballTime\":\"2024-11-02T05:00:00Z\"}";
    String earlier = "{\"strikerParticipantId\":\"EARLIER\",\"ballTime\":\"2024-11-02T01:00:00Z\"}";

    Optional<Ball> ball = BallFeedResolver.lastBallIn(json("[" + later + "," + earlier + "]"));

    assertThat(ball).map(Ball::getStrikerId).contains("EARLIER");
  }

  @Test
  void readsLegacyNamesWhenShortNamesAreMissing() throws Exception {
    Ball ball = BallFeedResolver.toBall(json(LAST));

    assertThat(ball.getStrikerName()).isEqualTo("S Smith");
    assertThat(ball.getNonStrikerName()).isEqualTo("N Jones");
    assertThat(ball.getBowlerName()).isEqualTo("W Khan");
    assertThat(ball.getBallTime()).isEqualTo("2024-11-02T03:10:00Z");
  }

  @Test
  void primaryHitSkipsFallback() throws Exception {
    when(apiClient.fetchJson(endpoints.balls("M1"))).thenReturn(json("[" + LAST + "]"));

    assertThat(resolver.fetchLastBall("M1")).map(Ball::getStrikerId).contains("S");
    verify(apiClient, never()).fetchJson(endpoints.ballsFallback("M1"));
  }

  @Test
  void emptyPrimaryTriesFallbackOnce() throws Exception {
    when(apiClient.fetchJson(endpoints.balls("M1"))).thenReturn(json("{\"balls\":[]}"));
    when(apiClient.fetchJson(endpoints.ballsFallback("M1")))
        .thenReturn(json("{\"innings\":[{\"balls\":[" + LAST + "]}]}"));

    assertThat(resolver.fetchLastBall("M1")).map(Ball::getBowlerId).contains("W");
    verify(apiClient, times(1)).fetchJson(endpoints.ballsFallback("M1"));
  }

  @Test
  void bothFeedsEmptyMeansNoBall() throws Exception {
    when(apiClient.fetchJson(endpoints.balls("M1"))).thenReturn(json("[]"));
    when(apiClient.fetchJson(endpoints.ballsFallback("M1"))).thenReturn(json("[]"));

    assertThat(resolver.fetchLastBall("M1")).isEmpty();
    verify(apiClient, times(1)).fetchJson(endpoints.ballsFallback("M1"));
  }

  @Test
  void failuresAreNotPropagated() throws Exception {
    when(apiClient.fetchJson(endpoints.balls("M1"))).thenReturn(json("[]"));
    when(apiClient.fetchJson(endpoints.ballsFallback("M1")))
        .thenThrow(new UpstreamParseException("Could not parse response as JSON or extract window.Dto"));

    assertThat(resolver.fetchLastBall("M1")).isEmpty();
  }

  @Test
  void primaryFailureEndsResolution() {
    when(apiClient.fetchJson(endpoints.balls("M1")))
        .thenThrow(new UpstreamUnavailableException("down", new RuntimeException("down")));

    assertThat(resolver.fetchLastBall("M1")).isEmpty();
    verify(apiClient, never()).fetchJson(endpoints.ballsFallback("M1"));
  }
}
