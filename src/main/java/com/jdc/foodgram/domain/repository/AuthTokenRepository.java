package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.AuthToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

public interface AuthTokenRepository extends JpaRepository<AuthToken, Long> {

    boolean existsByTokenIdAndExpiredAtAfter(String tokenId, LocalDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AuthToken t WHERE t.tokenId = :tokenId")
    int deleteByTokenId(@Param("tokenId") String tokenId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM AuthToken t WHERE t.user.id = :userId")
    void deleteByUserId(@Param("userId") Long userId);
}
