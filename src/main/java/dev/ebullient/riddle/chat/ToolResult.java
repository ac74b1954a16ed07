package dev.ebullient.riddle.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a tool call returns to its caller: success with the routed events,
 * or a typed failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        boolean success,
        String errorType,
        String error,
        Object data,
        List<RoutedEvent> events) {

    public record RoutedEvent(String type, List<String> audiences, Object payload) {
    }

    public static ToolResult ok(Object data, List<RoutedEvent> events) {
        return new ToolResult(true, null, null, data, events == null ? List.of() : List.copyOf(events));
    }

    public static ToolResult failure(String errorType, String error) {
        return new ToolResult(false, errorType, error, null, null);
    }
}
