package io.b2mash.shopdesk.identity;

import static io.b2mash.shopdesk.TestSessions.NOW;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.shopdesk.TestSessions;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class OtpChallengeCleanupServiceTest {

  @Mock private OtpChallengeRepository challengeRepository;
  @Mock private TransactionTemplate transactionTemplate;

  private OtpChallengeCleanupService service() {
    when(transactionTemplate.execute(any()))
        .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
    return new OtpChallengeCleanupService(
        challengeRepository, transactionTemplate, TestSessions.clockAt(NOW));
  }

  @Test
  void cleanup_deletesChallengesExpiredMoreThanADayAgo() {
    var service = service();
    when(challengeRepository.deleteByExpiresAtBefore(NOW.minus(Duration.ofDays(1)))).thenReturn(4);

    service.cleanupExpiredChallenges();

    verify(challengeRepository).deleteByExpiresAtBefore(NOW.minus(Duration.ofDays(1)));
  }

  @Test
  void cleanup_databaseFailure_doesNotPropagate() {
    var service = service();
    when(challengeRepository.deleteByExpiresAtBefore(any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatCode(service::cleanupExpiredChallenges).doesNotThrowAnyException();
  }
}
