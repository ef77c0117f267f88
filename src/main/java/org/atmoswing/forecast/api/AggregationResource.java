package org.atmoswing.forecast.api;

import org.atmoswing.forecast.api.dto.EntitiesValuesPercentileResponse;
import org.atmoswing.forecast.api.dto.SeriesSynthesisPerMethodResponse;
import org.atmoswing.forecast.api.dto.SeriesSynthesisTotalResponse;
import org.atmoswing.forecast.application.aggregation.AggregationService;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregations across the methods and configurations of a forecast.
 * {@code normalize} is an optional return period the values are divided by.
 */
@ApplicationScoped
@Path("/aggregations/{region}/{forecast_date}")
@Produces(MediaType.APPLICATION_JSON)
public class AggregationResource {

    private static final Logger log = LoggerFactory.getLogger(AggregationResource.class);

    @Inject
    AggregationService aggregationService;

    /**
     * {@code lead_time} is a number of hours after the forecast date or a target date.
     */
    @GET
    @Path("/{method}/{lead_time}/entities-values-percentile/{percentile}")
    @Blocking
    public EntitiesValuesPercentileResponse entitiesValuesPercentile(@PathParam("region") String region,
                                                                     @PathParam("forecast_date") String forecastDate,
                                                                     @PathParam("method") String method,
                                                                     @PathParam("lead_time") String leadTime,
                                                                     @PathParam("percentile") int percentile,
                                                                     @QueryParam("normalize") Integer normalize) {
        log.debug("entities-values-percentile {} {} {} {} p{}", region, forecastDate, method, leadTime, percentile);
        return aggregationService.entitiesAnalogValuesPercentile(region, forecastDate, method, leadTime,
                percentile, normalize);
    }

    @GET
    @Path("/series-synthesis-per-method/{percentile}")
    @Blocking
    public SeriesSynthesisPerMethodResponse seriesSynthesisPerMethod(@PathParam("region") String region,
                                                                     @PathParam("forecast_date") String forecastDate,
                                                                     @PathParam("percentile") int percentile,
                                                                     @QueryParam("normalize") Integer normalize) {
        return aggregationService.seriesSynthesisPerMethod(region, forecastDate, percentile, normalize);
    }

    @GET
    @Path("/series-synthesis-total/{percentile}")
    @Blocking
    public SeriesSynthesisTotalResponse seriesSynthesisTotal(@PathParam("region") String region,
                                                             @PathParam("forecast_date") String forecastDate,
                                                             @PathParam("percentile") int percentile,
                                                             @QueryParam("normalize") Integer normalize) {
        return aggregationService.seriesSynthesisTotal(region, forecastDate, percentile, normalize);
    }
}
