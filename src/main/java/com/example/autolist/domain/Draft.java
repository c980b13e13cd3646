package com.example.autolist.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 리스팅 초안 엔티티
 * <p>
 * 벌크 파이프라인 또는 직접 업로드로 생성되며, 중복 병합/사용자 편집/게시 상태 전이로만 변경됩니다.
 */
@Entity
@Table(name = "drafts", indexes = {
        @Index(name = "idx_drafts_merge_key", columnList = "owner_id, brand, category, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Draft {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 4000)
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(length = 100)
    private String category;

    @Column(name = "item_condition", length = 100)
    private String condition;

    @Column(length = 100)
    private String color;

    @Column(length = 100)
    private String brand;

    @Column(name = "item_size", length = 50)
    private String size;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "draft_photos", joinColumns = @JoinColumn(name = "draft_id"))
    @OrderColumn(name = "position")
    @Column(name = "photo_path", length = 1000)
    @Builder.Default
    private List<String> photos = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "draft_hashtags", joinColumns = @JoinColumn(name = "draft_id"))
    @OrderColumn(name = "position")
    @Column(name = "hashtag", length = 100)
    @Builder.Default
    private List<String> hashtags = new ArrayList<>();

    // 가격 제안 (min/target/max)
    @Column(precision = 12, scale = 2)
    private BigDecimal suggestedMinPrice;

    @Column(precision = 12, scale = 2)
    private BigDecimal suggestedTargetPrice;

    @Column(precision = 12, scale = 2)
    private BigDecimal suggestedMaxPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DraftStatus status;

    private double confidence;

    private boolean fallback; // 분류 실패로 기본값이 채워진 초안

    private boolean publishReady;

    private boolean contentValidated;

    private boolean photosValidated;

    @Column(length = 36)
    private String sourceJobId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    // 시각은 서비스에서 주입된 Clock으로 채우며, 비어 있을 때만 기본값을 사용
    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 중복 병합 대상이 될 수 있는 상태인지 여부
     */
    public boolean isMergeable() {
        return status == DraftStatus.PENDING || status == DraftStatus.READY;
    }

    public enum DraftStatus {
        PENDING("검토 대기"),
        READY("게시 가능"),
        PREPARED("게시 진행 중"),
        PUBLISHED("게시 완료"),
        ERROR("게시 실패");

        private final String description;

        DraftStatus(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
