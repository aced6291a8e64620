package com.gatekeeper.authgovernor.infrastructure.notify;

import com.gatekeeper.authgovernor.domain.BlockInfo;
import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.ports.NotifierPort;
import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stands in for an SMS gateway. Reset codes are never written to the log.
 */
@Component
public class LoggingNotifier implements NotifierPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override public void blockCreated(String phoneNumber, BlockInfo blockInfo) {
    log.warn("Number {} BLOCKED: type={} level={} until={} notice=\"{}\"", PhoneNumbers.mask(phoneNumber),
            blockInfo.blockType(), blockInfo.blockLevel(), blockInfo.blockedUntil(), blockInfo.messageEn());
  }

  @Override public void passwordResetCodeIssued(String phoneNumber, String code) {
    log.info("Password reset code ready for delivery to {} ({} digits)", PhoneNumbers.mask(phoneNumber), code.length());
  }
}
