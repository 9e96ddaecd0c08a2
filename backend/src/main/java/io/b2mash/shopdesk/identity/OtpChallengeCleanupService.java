package io.b2mash.shopdesk.identity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Scheduled cleanup of expired one-time code challenges. Runs hourly and removes challenges that
 * expired more than 24 hours ago; the rate limit only looks at the last few minutes, so nothing
 * older is needed.
 */
@Component
public class OtpChallengeCleanupService {

  private static final Logger log = LoggerFactory.getLogger(OtpChallengeCleanupService.class);
  private static final Duration RETENTION = Duration.ofDays(1);

  private final OtpChallengeRepository challengeRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public OtpChallengeCleanupService(
      OtpChallengeRepository challengeRepository,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.challengeRepository = challengeRepository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(fixedRateString = "${shopdesk.otp.cleanup-interval:PT1H}")
  public void cleanupExpiredChallenges() {
    Instant cutoff = clock.instant().minus(RETENTION);
    try {
      Integer deleted =
          transactionTemplate.execute(
              status -> challengeRepository.deleteByExpiresAtBefore(cutoff));
      if (deleted != null && deleted > 0) {
        log.info("Cleaned up {} expired OTP challenges", deleted);
      }
    } catch (RuntimeException e) {
      log.warn("Failed to clean up expired OTP challenges: {}", e.getMessage());
    }
  }
}
