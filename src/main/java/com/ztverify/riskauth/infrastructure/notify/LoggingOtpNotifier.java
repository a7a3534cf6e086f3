package com.ztverify.riskauth.infrastructure.notify;

import com.ztverify.riskauth.domain.ports.OtpNotifierPort;
import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Development delivery channel: writes the code to the application log.
 */
@Component
@ConditionalOnProperty(name = "app.otp.delivery", havingValue = "log", matchIfMissing = true)
public class LoggingOtpNotifier implements OtpNotifierPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingOtpNotifier.class);
  @Override public boolean send(String destination, String code, String username) {
    log.warn("OTP for {} (destination {}): {}", username, destination, code);
    return true;
  }
}
