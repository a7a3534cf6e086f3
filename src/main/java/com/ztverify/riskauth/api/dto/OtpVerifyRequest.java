package com.ztverify.riskauth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record OtpVerifyRequest(@NotBlank String username, @NotBlank String code) {
}
