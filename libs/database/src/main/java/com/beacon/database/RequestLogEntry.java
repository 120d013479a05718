package com.beacon.database;

/**
 * One served request, as written to the {@code requests} table.
 *
 * @param endpoint  request path
 * @param ipAddress remote address of the caller
 * @param userAgent {@code User-Agent} header, {@code Unknown} when absent
 */
public record RequestLogEntry(String endpoint, String ipAddress, String userAgent) {

    public RequestLogEntry {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be null or blank");
        }
        if (ipAddress == null || ipAddress.isBlank()) {
            ipAddress = "127.0.0.1";
        }
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = "Unknown";
        }
        if (ipAddress.length() > 45) {
            ipAddress = ipAddress.substring(0, 45);
        }
    }
}
