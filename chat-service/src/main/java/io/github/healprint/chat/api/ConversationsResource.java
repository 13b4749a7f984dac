package io.github.healprint.chat.api;

import io.github.healprint.chat.api.dto.ConversationDto;
import io.github.healprint.chat.api.dto.CreateConversationRequest;
import io.github.healprint.chat.api.dto.ErrorResponse;
import io.github.healprint.chat.api.dto.TurnRequest;
import io.github.healprint.chat.service.ConversationSessionEngine;
import io.github.healprint.chat.service.SessionResult;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

@Path("/v1")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConversationsResource {

    private static final Logger LOG = Logger.getLogger(ConversationsResource.class);

    @Inject ConversationSessionEngine engine;

    @POST
    @Path("/conversations")
    public Response createConversation(CreateConversationRequest request) {
        if (request == null) {
            return badRequest("request body is required");
        }
        SessionResult<ConversationDto> result =
                engine.createConversation(request.getUserId(), request.getTitle());
        if (result.isOk()) {
            return Response.status(Response.Status.CREATED).entity(result.value()).build();
        }
        return toResponse(result);
    }

    @GET
    @Path("/conversations/{conversationId}")
    public Response getConversation(@PathParam("conversationId") String conversationId) {
        return toResponse(engine.getConversation(conversationId));
    }

    @DELETE
    @Path("/conversations/{conversationId}")
    public Response deleteConversation(@PathParam("conversationId") String conversationId) {
        SessionResult<Boolean> result = engine.deleteConversation(conversationId);
        if (result.isOk()) {
            return Response.noContent().build();
        }
        return toResponse(result);
    }

    @GET
    @Path("/users/{userId}/conversations")
    public Response listUserConversations(@PathParam("userId") String userId) {
        return toResponse(engine.getUserConversations(userId));
    }

    @POST
    @Path("/conversations/{conversationId}/turns")
    public Response appendTurn(
            @PathParam("conversationId") String conversationId, TurnRequest request) {
        if (request == null) {
            return badRequest("request body is required");
        }
        return toResponse(engine.appendTurn(conversationId, request.getMessage()));
    }

    @POST
    @Path("/conversations/{conversationId}/analysis")
    public Response analyzeConversation(@PathParam("conversationId") String conversationId) {
        return toResponse(engine.analyzeConversation(conversationId));
    }

    @GET
    @Path("/conversations/{conversationId}/summary")
    public Response summarizeConversation(@PathParam("conversationId") String conversationId) {
        return toResponse(engine.summarizeConversation(conversationId));
    }

    private Response toResponse(SessionResult<?> result) {
        return switch (result.status()) {
            case OK -> Response.ok(result.value()).build();
            case NOT_FOUND -> error(Response.Status.NOT_FOUND, "Not found", "not_found", result);
            case CLOSED ->
                    error(Response.Status.CONFLICT, "Conversation closed", "conversation_closed", result);
            case INVALID -> badRequest(result.message());
            case UNAVAILABLE -> {
                LOG.warnf("Answering 503: %s", result.message());
                yield error(
                        Response.Status.SERVICE_UNAVAILABLE,
                        "Service unavailable",
                        "store_unavailable",
                        result);
            }
            case ERROR ->
                    error(
                            Response.Status.INTERNAL_SERVER_ERROR,
                            "Internal server error",
                            "internal_error",
                            result);
        };
    }

    private Response error(
            Response.Status status, String error, String code, SessionResult<?> result) {
        ErrorResponse body =
                ErrorResponse.withDetail(
                        error,
                        code,
                        "message",
                        result.message() != null ? result.message() : error);
        return Response.status(status).entity(body).build();
    }

    private Response badRequest(String message) {
        ErrorResponse error =
                ErrorResponse.withDetail("Bad request", "bad_request", "message", message);
        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
