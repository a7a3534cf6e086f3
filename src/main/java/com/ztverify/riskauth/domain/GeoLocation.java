package com.ztverify.riskauth.domain;

/**
 * Result of an IP geolocation lookup. Either part may be null when the provider omits it.
 */
public record GeoLocation(String city, String countryCode) {

    public String displayName() {
        if (city == null || city.isBlank()) {
            return countryCode;
        }
        return countryCode == null ? city : city + ", " + countryCode;
    }
}
