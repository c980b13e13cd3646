package com.example.autolist.constants;

import java.math.BigDecimal;

/**
 * 파이프라인 공통 상수
 * 헤더 이름, 품질 게이트 기준, 초안 기본값 등을 관리합니다.
 */
public class PipelineConstants {

    /**
     * 게시 요청의 멱등성 키 헤더
     */
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    /**
     * 소유자 식별 헤더 (인증은 범위 밖이므로 헤더로 전달)
     */
    public static final String OWNER_HEADER = "X-Owner-Id";
    public static final String DEFAULT_OWNER = "local";

    /**
     * 업로드 요청 검증
     */
    public static final int MAX_PHOTOS_PER_UPLOAD = 500;
    public static final int MIN_PHOTOS_PER_ITEM = 1;
    public static final int MAX_PHOTOS_PER_ITEM = 10;
    public static final int DEFAULT_PHOTOS_PER_ITEM = 4;

    /**
     * 품질 게이트 기준
     */
    public static final int TITLE_MAX_LENGTH = 70;
    public static final int HASHTAG_MIN_COUNT = 3;
    public static final int HASHTAG_MAX_COUNT = 5;

    /**
     * 작업 진행률
     * 완료 전까지는 99%를 넘지 않으며, 100%는 완료 상태에서만 기록됩니다.
     */
    public static final double GROUPING_STARTED_PROGRESS = 5.0;
    public static final double GROUPING_DONE_PROGRESS = 10.0;
    public static final double MAX_RUNNING_PROGRESS = 99.0;
    public static final double COMPLETED_PROGRESS = 100.0;

    public static final String PHASE_QUEUED = "queued";
    public static final String PHASE_GROUPING = "grouping";
    public static final String PHASE_DRAFTING = "drafting";
    public static final String PHASE_COMPLETED = "completed";
    public static final String PHASE_FAILED = "failed";

    /**
     * 분류기 결과에 값이 없을 때 사용하는 초안 기본값
     */
    public static final String DEFAULT_TITLE = "확인 필요 상품";
    public static final String DEFAULT_DESCRIPTION = "실사 사진입니다. 상태 양호하며 빠르게 발송해 드립니다. 궁금한 점은 문의해 주세요.";
    public static final BigDecimal DEFAULT_PRICE = new BigDecimal("20.00");
    public static final String DEFAULT_CATEGORY = "기타";
    public static final String DEFAULT_CONDITION = "양호";
    public static final String UNSPECIFIED = "미지정";
    public static final double FALLBACK_CONFIDENCE = 0.3;

    /**
     * 해시태그가 부족할 때 채워 넣는 일반 해시태그
     */
    public static final String[] POPULAR_HASHTAGS = {"#중고", "#빈티지", "#패션", "#득템", "#세컨핸드"};

    /**
     * 가격 제안 범위 (제안가 대비 비율)
     */
    public static final BigDecimal SUGGESTED_MIN_RATIO = new BigDecimal("0.80");
    public static final BigDecimal SUGGESTED_MAX_RATIO = new BigDecimal("1.20");

    /**
     * 마켓플레이스 캡차/본인확인 감지 시 사유
     */
    public static final String NEEDS_MANUAL_REASON = "captcha_or_verification";

    private PipelineConstants() {
        // 상수 클래스이므로 인스턴스 생성 방지
    }
}
