package io.github.healprint.chat.api;

import io.github.healprint.chat.api.dto.ErrorResponse;
import io.github.healprint.chat.store.StoreUnavailableException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/** Logs unhandled exceptions with their stack traces and answers with a JSON error body. */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleStoreUnavailable(StoreUnavailableException e) {
        LOG.errorf(e, "Conversation store unavailable during %s", e.getOperation());
        ErrorResponse error =
                ErrorResponse.withDetail(
                        "Service unavailable", "store_unavailable", "operation", e.getOperation());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        ErrorResponse error =
                ErrorResponse.withDetail(
                        "Internal server error",
                        "internal_error",
                        "message",
                        e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }
}
