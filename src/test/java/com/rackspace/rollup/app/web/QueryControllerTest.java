package com.rackspace.rollup.app.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.rollup.app.MutableClock;
import com.rackspace.rollup.app.exception.MissingContextException;
import com.rackspace.rollup.app.exception.NoMatchingRollupException;
import com.rackspace.rollup.app.exception.UnknownDefinitionException;
import com.rackspace.rollup.app.model.Granularity;
import com.rackspace.rollup.app.model.QueryPlan;
import com.rackspace.rollup.app.model.QueryResult;
import com.rackspace.rollup.app.model.RequestSecurityContext;
import com.rackspace.rollup.app.model.ResultRow;
import com.rackspace.rollup.app.model.RollupQuery;
import com.rackspace.rollup.app.model.TimeRange;
import com.rackspace.rollup.app.services.QueryService;
import com.rackspace.rollup.app.services.TenantContextResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles("test")
@SpringBootTest(classes = {QueryController.class,
    RestExceptionHandler.class, RestWebExceptionHandler.class,
    QueryControllerTest.ClockConfig.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
@DirtiesContext(classMode = ClassMode.BEFORE_EACH_TEST_METHOD)
public class QueryControllerTest {

  static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

  @TestConfiguration
  static class ClockConfig {
    @Bean
    Clock clock() {
      return new MutableClock(NOW);
    }
  }

  @MockBean
  QueryService queryService;

  @MockBean
  TenantContextResolver tenantContextResolver;

  @Autowired
  private WebTestClient webTestClient;

  final RequestSecurityContext context = new RequestSecurityContext().setAppId("acme");

  @BeforeEach
  void setUp() {
    when(tenantContextResolver.fromHeaders(any())).thenReturn(context);
  }

  @Test
  public void testQuery() {
    final QueryPlan plan = QueryPlan.passthrough(TimeRange.of(
        Instant.parse("2024-03-01T00:00:00Z"), NOW));
    when(queryService.query(any(), any())).thenReturn(Mono.just(new QueryResult()
        .setPlan(plan)
        .setRows(List.of(new ResultRow()
            .setTimestamp(Instant.parse("2024-03-01T00:00:00Z"))
            .setDimensions(Map.of("status", "open"))
            .setMeasures(Map.of("count", 2.0))))));

    webTestClient.post()
        .uri("/api/query")
        .header("X-App-Id", "acme")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of(
            "cube", "orders",
            "measures", List.of("count"),
            "dimensions", List.of("status"),
            "granularity", "DAY",
            "start", "2024-03-01T00:00:00Z",
            "filters", Map.of("region", List.of("east"))))
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.plan.type").isEqualTo("PASSTHROUGH")
        .jsonPath("$.rows[0].dimensions.status").isEqualTo("open")
        .jsonPath("$.rows[0].measures.count").isEqualTo(2.0);

    final ArgumentCaptor<RollupQuery> query = ArgumentCaptor.forClass(RollupQuery.class);
    verify(queryService).query(query.capture(), any());
    assertThat(query.getValue().getCube()).isEqualTo("orders");
    assertThat(query.getValue().getGranularity()).isEqualTo(Granularity.DAY);
    assertThat(query.getValue().getStart()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    // end defaults to now
    assertThat(query.getValue().getEnd()).isEqualTo(NOW);
    assertThat(query.getValue().getFilters()).containsEntry("region", List.of("east"));

    final ArgumentCaptor<HttpHeaders> headers = ArgumentCaptor.forClass(HttpHeaders.class);
    verify(tenantContextResolver).fromHeaders(headers.capture());
    assertThat(headers.getValue().getFirst("X-App-Id")).isEqualTo("acme");
  }

  @Test
  public void testQueryWithRelativeTimes() {
    when(queryService.query(any(), any())).thenReturn(Mono.just(new QueryResult()
        .setPlan(QueryPlan.passthrough(TimeRange.of(NOW.minusSeconds(1), NOW)))
        .setRows(List.of())));

    webTestClient.post()
        .uri("/api/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of(
            "cube", "orders",
            "measures", List.of("count"),
            "start", "2d-ago",
            "end", "1h-ago"))
        .exchange()
        .expectStatus().isOk();

    final ArgumentCaptor<RollupQuery> query = ArgumentCaptor.forClass(RollupQuery.class);
    verify(queryService).query(query.capture(), any());
    assertThat(query.getValue().getStart()).isEqualTo(Instant.parse("2024-03-08T12:00:00Z"));
    assertThat(query.getValue().getEnd()).isEqualTo(Instant.parse("2024-03-10T11:00:00Z"));
    assertThat(query.getValue().getDimensions()).isEmpty();
  }

  @Test
  public void testQueryMissingMeasures() {
    webTestClient.post()
        .uri("/api/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("cube", "orders", "start", "1d-ago"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.error").isEqualTo("BAD_REQUEST")
        .jsonPath("$.message").value(message -> assertThat((String) message).contains("measures"));

    verifyNoInteractions(queryService);
  }

  @Test
  public void testQueryInvalidTime() {
    webTestClient.post()
        .uri("/api/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("cube", "orders", "measures", List.of("count"), "start", "yesterday"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.message").isEqualTo("Invalid relative time format");
  }

  @Test
  public void testQueryRejected() {
    when(queryService.query(any(), any())).thenReturn(Mono.error(new NoMatchingRollupException(
        QueryPlan.rejected("No pre-aggregation of cube orders provides measures [count]"))));

    webTestClient.post()
        .uri("/api/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("cube", "orders", "measures", List.of("count"), "start", "1d-ago"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.status").isEqualTo(400)
        .jsonPath("$.error").isEqualTo("NO_MATCHING_PRE_AGGREGATION")
        .jsonPath("$.message").isEqualTo("No pre-aggregation of cube orders provides measures [count]");
  }

  @Test
  public void testQueryUnknownCube() {
    when(queryService.query(any(), any()))
        .thenReturn(Mono.error(new UnknownDefinitionException("cube", "bogus")));

    webTestClient.post()
        .uri("/api/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("cube", "bogus", "measures", List.of("count"), "start", "1d-ago"))
        .exchange()
        .expectStatus().isNotFound()
        .expectBody()
        .jsonPath("$.error").isEqualTo("UNKNOWN_DEFINITION");
  }

  @Test
  public void testQueryMissingContext() {
    when(queryService.query(any(), any()))
        .thenReturn(Mono.error(new MissingContextException(List.of("appId"))));

    webTestClient.post()
        .uri("/api/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("cube", "orders", "measures", List.of("count"), "start", "1d-ago"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.error").isEqualTo("MISSING_CONTEXT");
  }

  @Test
  public void testPlan() {
    when(queryService.plan(any(), any())).thenReturn(Mono.just(
        QueryPlan.rejected("nothing built")));

    webTestClient.post()
        .uri("/api/query/plan")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(Map.of("cube", "orders", "measures", List.of("count"), "start", "1d-ago"))
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.type").isEqualTo("REJECTED")
        .jsonPath("$.diagnostic").isEqualTo("nothing built");
  }
}
