package com.ztverify.riskauth.domain.otp;

import java.security.SecureRandom;

public class OtpCodeGenerator {

    private final SecureRandom random;

    public OtpCodeGenerator(SecureRandom random) {
        this.random = random;
    }

    /** Uniformly random decimal code, zero padded to {@code length} digits. */
    public String generate(int length) {
        if (length < 4 || length > 9) {
            throw new IllegalArgumentException("OTP length must be between 4 and 9 digits");
        }
        int bound = (int) Math.pow(10, length);
        return String.format("%0" + length + "d", random.nextInt(bound));
    }
}
