package com.jdc.foodgram.domain.entity;

import com.jdc.foodgram.domain.entity.common.BaseCreateTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "auth_tokens",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_auth_tokens_token_id", columnNames = {"token_id"})
        },
        indexes = {
                @Index(name = "idx_auth_tokens_user", columnList = "user_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AuthToken extends BaseCreateTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token_id", nullable = false, length = 64)
    private String tokenId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(name = "expired_at", nullable = false)
    private LocalDateTime expiredAt;
}
