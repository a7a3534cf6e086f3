package com.ztverify.riskauth.domain.ports;

public interface OtpNotifierPort {

    /**
     * Delivers a one-time code.
     *
     * @return false when delivery failed; implementations log the cause
     */
    boolean send(String destination, String code, String username);
}
