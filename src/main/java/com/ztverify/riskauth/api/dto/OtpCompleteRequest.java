package com.ztverify.riskauth.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OtpCompleteRequest(
        @NotBlank String username,
        @NotBlank String code,
        @JsonAlias("device_fingerprint") @Size(max = 512) String deviceFingerprint,
        @JsonAlias("trust_device") boolean trustDevice) {
}
