package com.example.autolist.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 게시 원장 엔티티 (멱등성 + 감사 기록)
 * <p>
 * idempotency_key 유니크 제약이 중복 게시를 막는 유일한 상호 배제 수단입니다.
 * 키당 한 번 RESERVED로 생성되고, 외부 호출이 끝난 뒤 OK 또는 FAILED로 단 한 번 갱신됩니다.
 */
@Entity
@Table(name = "publish_ledger", uniqueConstraints = {
        @UniqueConstraint(name = "uk_publish_ledger_idempotency_key", columnNames = "idempotency_key")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublishLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", nullable = false, length = 255)
    private String idempotencyKey;

    @Column(name = "confirm_token", nullable = false, length = 16000)
    private String confirmToken;

    @Column(length = 36)
    private String draftId;

    private boolean dryRun;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LedgerStatus status;

    private boolean needsManual; // 캡차 등으로 수동 처리가 필요한 경우

    @Column(length = 200)
    private String listingId;

    @Column(length = 1000)
    private String listingUrl;

    @Column(length = 2000)
    private String errorMessage;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    public enum LedgerStatus {
        RESERVED,
        OK,
        FAILED
    }
}
