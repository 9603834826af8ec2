package turnstile.adapter.in.dto;

/**
 * JSON error body shared by the gate and the REST endpoints.
 */
public record ErrorResponse(String error, String code) {}
