package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.Subscription;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByFollowerIdAndAuthorId(Long followerId, Long authorId);

    boolean existsByFollowerIdAndAuthorId(Long followerId, Long authorId);

    @Query(value = """
                SELECT s FROM Subscription s
                JOIN FETCH s.author
                WHERE s.follower.id = :followerId
                ORDER BY s.author.username ASC
            """,
            countQuery = "SELECT COUNT(s) FROM Subscription s WHERE s.follower.id = :followerId")
    Page<Subscription> findWithAuthorByFollowerId(@Param("followerId") Long followerId, Pageable pageable);

    @Query("SELECT s.author.id FROM Subscription s WHERE s.follower.id = :followerId AND s.author.id IN :authorIds")
    Set<Long> findAuthorIdsByFollowerIdAndAuthorIdIn(@Param("followerId") Long followerId,
                                                     @Param("authorIds") Collection<Long> authorIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Subscription s WHERE s.follower.id = :userId OR s.author.id = :userId")
    void deleteAllInvolvingUser(@Param("userId") Long userId);
}
