package com.ztverify.riskauth.application;

public class CompleteChallengeCommand {
    public final String username;
    public final String code;
    public final String deviceFingerprint;
    public final String sourceIp;
    public final boolean registerDevice;

    public CompleteChallengeCommand(String username, String code, String deviceFingerprint,
                                    String sourceIp, boolean registerDevice) {
        this.username = username;
        this.code = code;
        this.deviceFingerprint = deviceFingerprint;
        this.sourceIp = sourceIp;
        this.registerDevice = registerDevice;
    }
}
