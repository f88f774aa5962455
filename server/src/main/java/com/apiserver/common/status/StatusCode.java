package com.apiserver.common.status;

/**
 * Status codes understood by the dispatch layer, each bound to the HTTP status and reason phrase
 * it is rendered with.
 */
public enum StatusCode {
    OK(200, "OK"),
    CREATED(201, "Created"),
    NO_CONTENT(204, "No Content"),
    BAD_REQUEST(400, "Bad Request"),
    NOT_FOUND(404, "Not Found"),
    METHOD_NOT_ALLOWED(405, "Method Not Allowed"),
    UNPROCESSABLE_ENTITY(422, "Unprocessable Entity"),
    INTERNAL(500, "Internal Server Error");

    private final int httpCode;
    private final String reasonPhrase;

    StatusCode(int httpCode, String reasonPhrase) {
        this.httpCode = httpCode;
        this.reasonPhrase = reasonPhrase;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns the HTTP reason phrase, used as the title of problem payloads.
     */
    public String getReasonPhrase() {
        return reasonPhrase;
    }

    /**
     * Maps an HTTP status code to the closest matching StatusCode.
     *
     * @param httpStatusCode the HTTP status code to convert
     * @return the corresponding StatusCode
     */
    public static StatusCode fromHttpStatus(int httpStatusCode) {
        for (StatusCode code : values()) {
            if (code.httpCode == httpStatusCode) {
                return code;
            }
        }
        // Map based on range
        if (httpStatusCode >= 400 && httpStatusCode < 500) {
            return BAD_REQUEST;
        } else if (httpStatusCode >= 500) {
            return INTERNAL;
        } else {
            return OK;
        }
    }
}
