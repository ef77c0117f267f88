package org.atmoswing.forecast.api;

import org.atmoswing.forecast.api.dto.EntitiesValuesPercentileResponse;
import org.atmoswing.forecast.api.dto.MethodSynthesis;
import org.atmoswing.forecast.api.dto.Parameters;
import org.atmoswing.forecast.api.dto.SeriesSynthesisPerMethodResponse;
import org.atmoswing.forecast.api.dto.SeriesSynthesisTotalResponse;
import org.atmoswing.forecast.api.dto.TimeStepSynthesis;
import org.atmoswing.forecast.application.aggregation.AggregationService;
import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
public class AggregationResourceTest {

    private static final LocalDateTime D = LocalDateTime.of(2024, 10, 5, 0, 0);

    @InjectMock
    AggregationService aggregationService;

    @Test
    public void testEntitiesValuesPercentile() {
        Mockito.when(aggregationService.entitiesAnalogValuesPercentile("alpes", "latest", "4Zo", "24", 90, 10))
                .thenReturn(new EntitiesValuesPercentileResponse(
                        Parameters.of("alpes", D).withMethod("4Zo").withLeadTime("24").withPercentile(90)
                                .withNormalize(10),
                        List.of(1, 2, 3), Arrays.asList(0.5, null, 1.25)));

        given()
                .queryParam("normalize", 10)
                .when().get("/aggregations/alpes/latest/4Zo/24/entities-values-percentile/90")
                .then()
                .statusCode(200)
                .body("entity_ids", contains(1, 2, 3))
                .body("values[0]", equalTo(0.5f))
                .body("values[1]", nullValue())
                .body("parameters.method", equalTo("4Zo"))
                .body("parameters.lead_time", equalTo("24"))
                .body("parameters.normalize", equalTo(10));
    }

    @Test
    public void testNormalizeIsOptional() {
        Mockito.when(aggregationService.seriesSynthesisTotal("alpes", "2024-10-05T00", 90, null))
                .thenReturn(new SeriesSynthesisTotalResponse(Parameters.of("alpes", D).withPercentile(90),
                        List.of(new TimeStepSynthesis(24, List.of(D, D.plusDays(1)), List.of(3.0, 5.0)))));

        given()
                .when().get("/aggregations/alpes/2024-10-05T00/series-synthesis-total/90")
                .then()
                .statusCode(200)
                .body("series_percentiles[0].time_step", equalTo(24))
                .body("series_percentiles[0].values", contains(3.0f, 5.0f))
                .body("series_percentiles[0].target_dates", hasSize(2))
                .body("parameters", not(hasKey("normalize")));
    }

    @Test
    public void testSeriesSynthesisPerMethod() {
        Mockito.when(aggregationService.seriesSynthesisPerMethod("alpes", "2024-10-05T00", 60, 2))
                .thenReturn(new SeriesSynthesisPerMethodResponse(Parameters.of("alpes", D),
                        List.of(new MethodSynthesis("4Zo", List.of(D), List.of(12.5)))));

        given()
                .queryParam("normalize", 2)
                .when().get("/aggregations/alpes/2024-10-05T00/series-synthesis-per-method/60")
                .then()
                .statusCode(200)
                .body("series_percentiles[0].method_id", equalTo("4Zo"))
                .body("series_percentiles[0].values[0]", equalTo(12.5f));
    }

    @Test
    public void testNotFound() {
        Mockito.when(aggregationService.seriesSynthesisTotal("jura", "latest", 90, null))
                .thenThrow(new ForecastNotFoundException("Region directory not found: jura"));

        given()
                .when().get("/aggregations/jura/latest/series-synthesis-total/90")
                .then()
                .statusCode(404)
                .body("detail", equalTo("Region or forecast not found"));
    }

    @Test
    public void testInvalidPercentileIsInternalError() {
        Mockito.when(aggregationService.seriesSynthesisTotal("alpes", "latest", 120, null))
                .thenThrow(new IllegalArgumentException("Percentile must be between 0 and 100, got: 120"));

        given()
                .when().get("/aggregations/alpes/latest/series-synthesis-total/120")
                .then()
                .statusCode(500)
                .body("detail", equalTo("Internal Server Error"));
    }
}
