package io.edgesim.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.edgesim.core.error.EdgeException;
import io.edgesim.core.model.EventBody;
import io.edgesim.core.model.HttpHeaders;
import io.edgesim.core.model.ResponseArtifact;
import java.util.Map;

/**
 * Builds the client-facing response for a failed request:
 *
 * <pre>{@code
 * 502 Bad Gateway
 * content-type: application/json
 *
 * {"code": 502, "message": "No origin configured for behavior '*' ..."}
 * }</pre>
 *
 * <p>
 * The status comes from {@link EdgeException#httpStatus()}; any other
 * throwable maps to 500. Thread-safe and stateless.
 */
public final class ErrorResponseBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 500;

    private static final Map<Integer, String> REASONS = Map.of(
            200, "OK",
            400, "Bad Request",
            404, "Not Found",
            405, "Method Not Allowed",
            500, "Internal Server Error",
            502, "Bad Gateway",
            503, "Service Unavailable",
            504, "Gateway Timeout");

    /**
     * Builds the error response for {@code failure}.
     *
     * @param failure the error that aborted the request
     * @return a JSON response carrying the error's status
     */
    public ResponseArtifact build(Throwable failure) {
        int status = statusFor(failure);
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        return build(status, message);
    }

    /** Builds a {@code {code, message}} response with an explicit status. */
    public ResponseArtifact build(int status, String message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", status);
        node.put("message", message);
        return new ResponseArtifact(
                status,
                reasonPhrase(status),
                HttpHeaders.of(Map.of("content-type", "application/json")),
                EventBody.of(node.toString()));
    }

    /** The status a failure maps to. */
    public static int statusFor(Throwable failure) {
        return failure instanceof EdgeException edge ? edge.httpStatus() : DEFAULT_STATUS;
    }

    /** Standard reason phrase for the statuses this simulator emits; empty otherwise. */
    public static String reasonPhrase(int status) {
        return REASONS.getOrDefault(status, "");
    }
}
