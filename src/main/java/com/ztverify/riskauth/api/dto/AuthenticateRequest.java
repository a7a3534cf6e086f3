package com.ztverify.riskauth.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

/**
 * Login request. Network fields are optional: the source IP falls back to the connection address,
 * and country/location are resolved by geolocation when absent.
 */
public record AuthenticateRequest(
        @NotBlank @Size(max = 150) String username,
        @NotBlank @JsonAlias("password") String secret,
        OffsetDateTime timestamp,
        @JsonAlias("ip_address") @Size(max = 64) String sourceIp,
        @JsonAlias("user_agent") @Size(max = 1024) String userAgent,
        @JsonAlias("device_fingerprint") @Size(max = 512) String deviceFingerprint,
        @PositiveOrZero Integer asn,
        @JsonAlias("country_code") @Pattern(regexp = "^[A-Za-z]{2}$") String countryCode,
        @Size(max = 150) String location,
        @JsonAlias("device_type") @Schema(example = "desktop") String deviceType) {
}
