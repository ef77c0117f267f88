package org.atmoswing.forecast.api.error;

import org.atmoswing.forecast.api.dto.ErrorResponse;
import org.atmoswing.forecast.core.exception.ForecastNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Missing region, forecast, file, entity or target date: 404.
 */
@Provider
public class ForecastNotFoundMapper implements ExceptionMapper<ForecastNotFoundException> {

    private static final Logger log = LoggerFactory.getLogger(ForecastNotFoundMapper.class);

    static final String DETAIL = "Region or forecast not found";

    @Override
    public Response toResponse(ForecastNotFoundException e) {
        log.info("Not found: {}", e.getMessage());
        return Response.status(Response.Status.NOT_FOUND)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(DETAIL))
                .build();
    }
}
