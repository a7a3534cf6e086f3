package com.ztverify.riskauth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record OtpRequest(@NotBlank String username) {
}
