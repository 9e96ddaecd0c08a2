package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OtpChallengeRepository extends JpaRepository<OtpChallenge, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT c FROM OtpChallenge c
      WHERE c.accountId = :accountId AND c.channel = :channel
        AND c.consumedAt IS NULL AND c.invalidatedAt IS NULL
      ORDER BY c.issuedAt DESC
      """)
  List<OtpChallenge> findOpenForUpdate(
      @Param("accountId") UUID accountId, @Param("channel") Channel channel);

  @Modifying
  @Query(
      """
      UPDATE OtpChallenge c SET c.invalidatedAt = :now
      WHERE c.accountId = :accountId AND c.channel = :channel
        AND c.consumedAt IS NULL AND c.invalidatedAt IS NULL
      """)
  int invalidateOpen(
      @Param("accountId") UUID accountId,
      @Param("channel") Channel channel,
      @Param("now") Instant now);

  long countByAccountIdAndChannelAndIssuedAtAfter(UUID accountId, Channel channel, Instant after);

  int deleteByExpiresAtBefore(Instant before);
}
