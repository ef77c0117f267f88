package org.atmoswing.forecast.api.error;

import org.atmoswing.forecast.api.dto.ErrorResponse;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything else, inconsistent data included: 500 with a generic message, details in the log.
 * Framework errors (unknown route, bad parameter type) keep their own status.
 */
@Provider
public class UnexpectedErrorMapper implements ExceptionMapper<Exception> {

    private static final Logger log = LoggerFactory.getLogger(UnexpectedErrorMapper.class);

    static final String DETAIL = "Internal Server Error";

    @Override
    public Response toResponse(Exception e) {
        if (e instanceof WebApplicationException) {
            return ((WebApplicationException) e).getResponse();
        }
        log.error("Request failed: {}", e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(DETAIL))
                .build();
    }
}
