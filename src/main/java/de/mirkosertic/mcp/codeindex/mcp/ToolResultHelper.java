package de.mirkosertic.mcp.codeindex.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.mcp.codeindex.error.CodeIndexException;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns response records into MCP tool results.
 * <p>
 * Responses are serialized to JSON. A response whose {@code success} component is {@code false}
 * is flagged as an error result.
 */
public final class ToolResultHelper {

    static final String INTERNAL_ERROR = "internal_error";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    /**
     * JSON error payload of a typed failure: {@code type}, {@code message}, {@code hint}, {@code try}.
     */
    public static Map<String, Object> errorPayload(final CodeIndexException e) {
        return e.toMap();
    }

    /**
     * JSON error payload for failures without a type, such as I/O errors.
     */
    public static Map<String, Object> errorPayload(final String message) {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", INTERNAL_ERROR);
        payload.put("message", message);
        return payload;
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return "{\"success\":false,\"error\":{\"type\":\"" + INTERNAL_ERROR
                    + "\",\"message\":\"JSON serialization error\"}}";
        }
    }

    static boolean isErrorResponse(final Object response) {
        if (response instanceof Record record) {
            for (final var component : record.getClass().getRecordComponents()) {
                if (!"success".equals(component.getName())) {
                    continue;
                }
                try {
                    final Object value = component.getAccessor().invoke(record);
                    return value instanceof Boolean success && !success;
                } catch (final ReflectiveOperationException e) {
                    return false;
                }
            }
        }
        return false;
    }
}
