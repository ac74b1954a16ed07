package dev.ebullient.riddle.api;

import java.util.Map;

import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import dev.ebullient.riddle.GameStateException;
import io.quarkus.logging.Log;

public class GameStateExceptionMapper {

    @ServerExceptionMapper
    public Response mapGameStateException(GameStateException e) {
        Response.Status status = statusFor(e.kind());
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            Log.errorf(e, "Request failed: %s", e.getMessage());
        }
        return Response.status(status)
                .entity(Map.of("errorType", e.kind().name(), "error", e.getMessage()))
                .build();
    }

    static Response.Status statusFor(GameStateException.ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> Response.Status.NOT_FOUND;
            case INVALID_STATE -> Response.Status.CONFLICT;
            case VALIDATION -> Response.Status.BAD_REQUEST;
            case PERSISTENCE -> Response.Status.INTERNAL_SERVER_ERROR;
        };
    }
}
