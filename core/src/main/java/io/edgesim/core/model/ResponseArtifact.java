package io.edgesim.core.model;

/**
 * A response, produced either by a short-circuiting handler or by the origin
 * fetch, and rewritable by the response-phase stages.
 *
 * @param status            HTTP status code
 * @param statusDescription reason phrase, may be empty
 * @param headers           response headers
 * @param body              response body
 */
public record ResponseArtifact(int status, String statusDescription, HttpHeaders headers, EventBody body)
        implements HandlerResult {

    public ResponseArtifact {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("Invalid HTTP status: " + status);
        }
        statusDescription = statusDescription != null ? statusDescription : "";
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : EventBody.empty();
    }

    /** A response with a UTF-8 text body and no headers. */
    public static ResponseArtifact of(int status, String body) {
        return new ResponseArtifact(status, "", HttpHeaders.empty(), EventBody.of(body));
    }

    public ResponseArtifact withStatus(int newStatus, String newDescription) {
        return new ResponseArtifact(newStatus, newDescription, headers, body);
    }

    public ResponseArtifact withHeaders(HttpHeaders newHeaders) {
        return new ResponseArtifact(status, statusDescription, newHeaders, body);
    }

    /** Returns a copy with {@code name} set to the single {@code value}. */
    public ResponseArtifact withHeader(String name, String value) {
        return withHeaders(headers.with(name, value));
    }

    public ResponseArtifact withBody(EventBody newBody) {
        return new ResponseArtifact(status, statusDescription, headers, newBody);
    }
}
