package org.atmoswing.forecast.api;

import org.atmoswing.forecast.api.dto.AnalogCriteriaResponse;
import org.atmoswing.forecast.api.dto.AnalogDatesResponse;
import org.atmoswing.forecast.api.dto.AnalogValuesPercentilesResponse;
import org.atmoswing.forecast.api.dto.AnalogValuesResponse;
import org.atmoswing.forecast.api.dto.AnalogsResponse;
import org.atmoswing.forecast.api.dto.ReferenceValuesResponse;
import org.atmoswing.forecast.api.dto.SeriesBestAnalogsResponse;
import org.atmoswing.forecast.api.dto.SeriesPercentilesResponse;
import org.atmoswing.forecast.application.forecast.ForecastService;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * Data of one forecast file ({@code method} + {@code configuration}).
 */
@ApplicationScoped
@Path("/forecasts/{region}/{forecast_date}/{method}/{configuration}")
@Produces(MediaType.APPLICATION_JSON)
public class ForecastResource {

    @Inject
    ForecastService forecastService;

    @GET
    @Path("/{target_date}/analog-dates")
    @Blocking
    public AnalogDatesResponse analogDates(@PathParam("region") String region,
                                           @PathParam("forecast_date") String forecastDate,
                                           @PathParam("method") String method,
                                           @PathParam("configuration") String configuration,
                                           @PathParam("target_date") String targetDate) {
        return forecastService.analogDates(region, forecastDate, method, configuration, targetDate);
    }

    @GET
    @Path("/{target_date}/analogy-criteria")
    @Blocking
    public AnalogCriteriaResponse analogyCriteria(@PathParam("region") String region,
                                                  @PathParam("forecast_date") String forecastDate,
                                                  @PathParam("method") String method,
                                                  @PathParam("configuration") String configuration,
                                                  @PathParam("target_date") String targetDate) {
        return forecastService.analogCriteria(region, forecastDate, method, configuration, targetDate);
    }

    @GET
    @Path("/{entity}/reference-values")
    @Blocking
    public ReferenceValuesResponse referenceValues(@PathParam("region") String region,
                                                   @PathParam("forecast_date") String forecastDate,
                                                   @PathParam("method") String method,
                                                   @PathParam("configuration") String configuration,
                                                   @PathParam("entity") int entity) {
        return forecastService.referenceValues(region, forecastDate, method, configuration, entity);
    }

    @GET
    @Path("/{entity}/series-values-best-analogs")
    @Blocking
    public SeriesBestAnalogsResponse seriesBestAnalogs(@PathParam("region") String region,
                                                       @PathParam("forecast_date") String forecastDate,
                                                       @PathParam("method") String method,
                                                       @PathParam("configuration") String configuration,
                                                       @PathParam("entity") int entity,
                                                       @QueryParam("number") @DefaultValue("10") int number) {
        return forecastService.seriesBestAnalogs(region, forecastDate, method, configuration, entity, number);
    }

    @GET
    @Path("/{entity}/series-values-percentiles")
    @Blocking
    public SeriesPercentilesResponse seriesPercentiles(@PathParam("region") String region,
                                                       @PathParam("forecast_date") String forecastDate,
                                                       @PathParam("method") String method,
                                                       @PathParam("configuration") String configuration,
                                                       @PathParam("entity") int entity,
                                                       @QueryParam("percentiles") List<Integer> percentiles) {
        return forecastService.seriesPercentiles(region, forecastDate, method, configuration, entity, percentiles);
    }

    @GET
    @Path("/{entity}/{target_date}/analogs")
    @Blocking
    public AnalogsResponse analogs(@PathParam("region") String region,
                                   @PathParam("forecast_date") String forecastDate,
                                   @PathParam("method") String method,
                                   @PathParam("configuration") String configuration,
                                   @PathParam("entity") int entity,
                                   @PathParam("target_date") String targetDate) {
        return forecastService.analogs(region, forecastDate, method, configuration, entity, targetDate);
    }

    @GET
    @Path("/{entity}/{target_date}/analog-values")
    @Blocking
    public AnalogValuesResponse analogValues(@PathParam("region") String region,
                                             @PathParam("forecast_date") String forecastDate,
                                             @PathParam("method") String method,
                                             @PathParam("configuration") String configuration,
                                             @PathParam("entity") int entity,
                                             @PathParam("target_date") String targetDate) {
        return forecastService.analogValues(region, forecastDate, method, configuration, entity, targetDate);
    }

    @GET
    @Path("/{entity}/{target_date}/analog-values-percentiles")
    @Blocking
    public AnalogValuesPercentilesResponse analogValuesPercentiles(@PathParam("region") String region,
                                                                   @PathParam("forecast_date") String forecastDate,
                                                                   @PathParam("method") String method,
                                                                   @PathParam("configuration") String configuration,
                                                                   @PathParam("entity") int entity,
                                                                   @PathParam("target_date") String targetDate,
                                                                   @QueryParam("percentiles") List<Integer> percentiles) {
        return forecastService.analogValuesPercentiles(region, forecastDate, method, configuration, entity,
                targetDate, percentiles);
    }

    @GET
    @Path("/{entity}/{target_date}/analog-values-best")
    @Blocking
    public AnalogValuesResponse analogValuesBest(@PathParam("region") String region,
                                                 @PathParam("forecast_date") String forecastDate,
                                                 @PathParam("method") String method,
                                                 @PathParam("configuration") String configuration,
                                                 @PathParam("entity") int entity,
                                                 @PathParam("target_date") String targetDate,
                                                 @QueryParam("number") @DefaultValue("10") int number) {
        return forecastService.analogValuesBest(region, forecastDate, method, configuration, entity, targetDate,
                number);
    }
}
