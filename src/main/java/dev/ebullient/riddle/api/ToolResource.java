package dev.ebullient.riddle.api;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.RestPath;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.riddle.chat.ToolExecutor;
import dev.ebullient.riddle.chat.ToolResult;
import io.quarkus.logging.Log;

/**
 * Runs a game-state tool by name. The body is the tool's JSON argument object;
 * a failed tool call still answers 200 with a typed failure result, except for
 * missing campaigns and storage errors.
 */
@ApplicationScoped
@Path("/api/campaigns/{campaignId}/tools")
public class ToolResource {

    @Inject
    ToolExecutor executor;

    @POST
    @Path("/{toolName}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response invoke(@RestPath String campaignId, @RestPath String toolName, JsonNode args) {
        Log.debugf("%s: REST tool call %s", campaignId, toolName);
        ToolResult result = executor.execute(campaignId, toolName, args);
        return Response.status(statusFor(result)).entity(result).build();
    }

    static Response.Status statusFor(ToolResult result) {
        if (result.success()) {
            return Response.Status.OK;
        }
        return switch (result.errorType()) {
            case "NOT_FOUND" -> Response.Status.NOT_FOUND;
            case "PERSISTENCE" -> Response.Status.INTERNAL_SERVER_ERROR;
            default -> Response.Status.OK;
        };
    }
}
