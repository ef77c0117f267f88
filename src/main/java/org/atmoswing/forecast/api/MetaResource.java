package org.atmoswing.forecast.api;

import org.atmoswing.forecast.api.dto.LastForecastDateResponse;
import org.atmoswing.forecast.api.dto.MethodConfigsListResponse;
import org.atmoswing.forecast.api.dto.MethodsListResponse;
import org.atmoswing.forecast.application.meta.MetaService;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Region metadata. {@code forecast_date} accepts {@code latest}.
 */
@ApplicationScoped
@Path("/meta/{region}")
@Produces(MediaType.APPLICATION_JSON)
public class MetaResource {

    @Inject
    MetaService metaService;

    @GET
    @Path("/last-forecast-date")
    @Blocking
    public LastForecastDateResponse lastForecastDate(@PathParam("region") String region) {
        return metaService.lastForecastDate(region);
    }

    @GET
    @Path("/{forecast_date}/methods")
    @Blocking
    public MethodsListResponse methods(@PathParam("region") String region,
                                       @PathParam("forecast_date") String forecastDate) {
        return metaService.listMethods(region, forecastDate);
    }

    @GET
    @Path("/{forecast_date}/methods-and-configs")
    @Blocking
    public MethodConfigsListResponse methodsAndConfigs(@PathParam("region") String region,
                                                       @PathParam("forecast_date") String forecastDate) {
        return metaService.listMethodsAndConfigs(region, forecastDate);
    }
}
