package com.optiontracker.exception;

import java.util.Map;

/**
 * A failed call to the remote pricing service, classified by HTTP status.
 *
 * <ul>
 *   <li>404 / 501: the service does not implement the capability. P&L metrics fall back
 *       to the local approximation.</li>
 *   <li>{@link #NETWORK_UNREACHABLE} (0): no HTTP status at all (connection refused, DNS,
 *       read timeout). Treated exactly like "not implemented".</li>
 *   <li>{@link #MALFORMED_RESPONSE} (-1): a 2xx response the client could not read.</li>
 *   <li>anything else: transient, retried by the orchestrator.</li>
 * </ul>
 *
 * <p>Statuses 0 and -1 carry {@link ErrorCode#PRICING_SERVICE_UNAVAILABLE} (503); every
 * other status carries {@link ErrorCode#PRICING_SERVICE_ERROR} (502).
 */
public class PricingServiceException extends BaseException {

    public static final int NETWORK_UNREACHABLE = 0;
    public static final int MALFORMED_RESPONSE = -1;

    private final String operation;
    private final int statusCode;

    public PricingServiceException(String operation, int statusCode, String message) {
        this(operation, statusCode, message, null);
    }

    public PricingServiceException(String operation, int statusCode, String message, Throwable cause) {
        super(
                statusCode == NETWORK_UNREACHABLE || statusCode == MALFORMED_RESPONSE
                        ? ErrorCode.PRICING_SERVICE_UNAVAILABLE
                        : ErrorCode.PRICING_SERVICE_ERROR,
                message,
                Map.of("operation", operation, "statusCode", statusCode),
                cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public static PricingServiceException unreachable(String operation, Throwable cause) {
        return new PricingServiceException(
                operation,
                NETWORK_UNREACHABLE,
                "Pricing service unreachable during " + operation + ": " + cause.getMessage(),
                cause);
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /** The service answered 404 or 501 for this capability. */
    public boolean isNotImplemented() {
        return statusCode == 404 || statusCode == 501;
    }

    /** No HTTP status was received. */
    public boolean isUnreachable() {
        return statusCode == NETWORK_UNREACHABLE;
    }

    /** A 2xx answer whose body could not be read. */
    public boolean isMalformedResponse() {
        return statusCode == MALFORMED_RESPONSE;
    }

    /** No usable answer came back: unreachable or unreadable. */
    public boolean isUnavailable() {
        return isUnreachable() || isMalformedResponse();
    }

    /** P&L metrics may be approximated locally after this failure. */
    public boolean isFallbackEligible() {
        return isNotImplemented() || isUnreachable();
    }
}
