package com.example.autolist.publish;

import com.example.autolist.client.ItemClassifier;
import com.example.autolist.client.MarketplaceClient;
import com.example.autolist.client.MarketplacePublishResult;
import com.example.autolist.config.PipelineProperties;
import com.example.autolist.domain.Draft;
import com.example.autolist.domain.PublishLedgerEntry;
import com.example.autolist.dto.DraftUpdateRequest;
import com.example.autolist.dto.PrepareRequest;
import com.example.autolist.dto.PrepareResult;
import com.example.autolist.dto.PriceSuggestion;
import com.example.autolist.dto.PublishResult;
import com.example.autolist.exception.ConflictException;
import com.example.autolist.exception.ExpiredTokenException;
import com.example.autolist.exception.ExternalServiceException;
import com.example.autolist.exception.InvalidTokenException;
import com.example.autolist.repository.DraftRepository;
import com.example.autolist.repository.PublishLedgerRepository;
import com.example.autolist.service.DraftService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
class PublishCoordinatorTest {

    private static final String OWNER = "owner-1";

    @Autowired
    private PublishCoordinator coordinator;

    @Autowired
    private PublishLedgerRepository ledgerRepository;

    @Autowired
    private DraftRepository draftRepository;

    @Autowired
    private DraftService draftService;

    @Autowired
    private PipelineProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private MarketplaceClient marketplaceClient;

    @MockBean
    private ItemClassifier itemClassifier;

    @BeforeEach
    void setup() {
        ledgerRepository.deleteAll();
        draftRepository.deleteAll();
        reset(marketplaceClient);
        when(marketplaceClient.publish(any())).thenReturn(MarketplacePublishResult.published("L-1", "https://market.example/items/L-1"));
    }

    @Test
    void prepareRejectsTooFewHashtagsWithoutIssuingToken() {
        PrepareResult result = coordinator.prepare(OWNER, validRequest().hashtags(List.of("#a", "#b")).build());

        assertThat(result.isOk()).isFalse();
        assertThat(result.getConfirmToken()).isNull();
        assertThat(result.getReasons()).anyMatch(reason -> reason.contains("hashtag"));
        assertThat(ledgerRepository.count()).isZero();
    }

    @Test
    void sameKeyPublishesAtMostOnce() {
        String token = coordinator.prepare(OWNER, validRequest().build()).getConfirmToken();

        PublishResult first = coordinator.publish(token, "key-1", false);

        assertThat(first.isOk()).isTrue();
        assertThat(first.getOutcome()).isEqualTo(PublishResult.PublishOutcome.PUBLISHED);
        assertThat(first.getListingId()).isEqualTo("L-1");
        assertThatThrownBy(() -> coordinator.publish(token, "key-1", false)).isInstanceOf(ConflictException.class);

        verify(marketplaceClient, times(1)).publish(any());
        assertThat(ledgerRepository.count()).isEqualTo(1);
        assertThat(ledgerRepository.findByIdempotencyKey("key-1").orElseThrow().getStatus())
                .isEqualTo(PublishLedgerEntry.LedgerStatus.OK);
    }

    @Test
    void differentKeysAreIndependentAttempts() {
        String token = coordinator.prepare(OWNER, validRequest().build()).getConfirmToken();

        coordinator.publish(token, "key-a", false);
        coordinator.publish(token, "key-b", false);

        verify(marketplaceClient, times(2)).publish(any());
        assertThat(ledgerRepository.count()).isEqualTo(2);
    }

    @Test
    void concurrentRequestsWithSameKeyCallMarketplaceOnce() throws Exception {
        String token = coordinator.prepare(OWNER, validRequest().build()).getConfirmToken();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        int succeeded = 0;
        int conflicts = 0;
        try {
            List<Future<PublishResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<PublishResult> task = () -> {
                    start.await();
                    return coordinator.publish(token, "shared-key", false);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<PublishResult> future : futures) {
                try {
                    future.get();
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConflictException.class);
                    conflicts++;
                }
            }
        } finally {
            pool.shutdown();
        }

        assertThat(succeeded).isEqualTo(1);
        assertThat(conflicts).isEqualTo(threads - 1);
        verify(marketplaceClient, times(1)).publish(any());
        assertThat(ledgerRepository.count()).isEqualTo(1);
    }

    @Test
    void expiredTokenMarksReservationFailed() {
        Clock past = Clock.fixed(Instant.now().minus(Duration.ofMinutes(31)), ZoneOffset.UTC);
        ConfirmTokenService oldIssuer = new ConfirmTokenService(properties, objectMapper, past);
        String token = oldIssuer.issue(coordinator.prepare(OWNER, validRequest().build()).getSnapshot(), false).getToken();

        assertThatThrownBy(() -> coordinator.publish(token, "key-expired", false)).isInstanceOf(ExpiredTokenException.class);

        PublishLedgerEntry entry = ledgerRepository.findByIdempotencyKey("key-expired").orElseThrow();
        assertThat(entry.getStatus()).isEqualTo(PublishLedgerEntry.LedgerStatus.FAILED);
        verify(marketplaceClient, never()).publish(any());
        // 같은 키로 재시도해도 새 시도로 취급하지 않음
        assertThatThrownBy(() -> coordinator.publish(token, "key-expired", false)).isInstanceOf(ConflictException.class);
    }

    @Test
    void tamperedTokenIsRejected() {
        assertThatThrownBy(() -> coordinator.publish("abc.def.ghi", "key-bad", false)).isInstanceOf(InvalidTokenException.class);

        assertThat(ledgerRepository.findByIdempotencyKey("key-bad").orElseThrow().getStatus())
                .isEqualTo(PublishLedgerEntry.LedgerStatus.FAILED);
    }

    @Test
    void missingKeyIsRejectedBeforeReservation() {
        assertThatThrownBy(() -> coordinator.publish("token", " ", false)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ledgerRepository.count()).isZero();
    }

    @Test
    void dryRunSkipsMarketplace() {
        PrepareResult prepared = coordinator.prepare(OWNER, validRequest().hashtags(List.of("#a")).dryRun(true).build());
        assertThat(prepared.isOk()).isTrue();
        assertThat(prepared.getReasons()).isNotEmpty();

        PublishResult result = coordinator.publish(prepared.getConfirmToken(), "key-dry", true);

        assertThat(result.getOutcome()).isEqualTo(PublishResult.PublishOutcome.DRY_RUN);
        verify(marketplaceClient, never()).publish(any());
        assertThat(ledgerRepository.findByIdempotencyKey("key-dry").orElseThrow().getStatus())
                .isEqualTo(PublishLedgerEntry.LedgerStatus.OK);

        assertThatThrownBy(() -> coordinator.publish(prepared.getConfirmToken(), "key-real", false))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void publishedDraftMovesToPublished() {
        Draft draft = draftRepository.save(readyDraft());
        String token = coordinator.prepare(OWNER, PrepareRequest.builder().draftId(draft.getId()).build()).getConfirmToken();

        coordinator.publish(token, "key-draft", false);

        assertThat(draftRepository.findById(draft.getId()).orElseThrow().getStatus()).isEqualTo(Draft.DraftStatus.PUBLISHED);
        assertThat(ledgerRepository.findByIdempotencyKey("key-draft").orElseThrow().getDraftId()).isEqualTo(draft.getId());
    }

    @Test
    void dryRunLeavesDraftEditable() {
        Draft draft = draftRepository.save(readyDraft());
        String token = coordinator.prepare(OWNER, PrepareRequest.builder().draftId(draft.getId()).dryRun(true).build())
                .getConfirmToken();

        PublishResult result = coordinator.publish(token, "key-dry-draft", true);

        assertThat(result.getOutcome()).isEqualTo(PublishResult.PublishOutcome.DRY_RUN);
        assertThat(draftRepository.findById(draft.getId()).orElseThrow().getStatus()).isEqualTo(Draft.DraftStatus.READY);
        assertThat(ledgerRepository.findByIdempotencyKey("key-dry-draft").orElseThrow().getDraftId()).isEqualTo(draft.getId());

        Draft edited = draftService.update(OWNER, draft.getId(), DraftUpdateRequest.builder().title("Patagonia Better Sweater").build());
        assertThat(edited.getTitle()).isEqualTo("Patagonia Better Sweater");
        assertThat(edited.getStatus()).isEqualTo(Draft.DraftStatus.READY);
    }

    @Test
    void needsManualReturnsDraftToReady() {
        when(marketplaceClient.publish(any())).thenReturn(MarketplacePublishResult.needsManual("captcha_or_verification"));
        Draft draft = draftRepository.save(readyDraft());
        String token = coordinator.prepare(OWNER, PrepareRequest.builder().draftId(draft.getId()).build()).getConfirmToken();

        PublishResult result = coordinator.publish(token, "key-manual", false);

        assertThat(result.isOk()).isFalse();
        assertThat(result.isNeedsManual()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(PublishResult.PublishOutcome.NEEDS_MANUAL);
        PublishLedgerEntry entry = ledgerRepository.findByIdempotencyKey("key-manual").orElseThrow();
        assertThat(entry.getStatus()).isEqualTo(PublishLedgerEntry.LedgerStatus.FAILED);
        assertThat(entry.isNeedsManual()).isTrue();
        assertThat(draftRepository.findById(draft.getId()).orElseThrow().getStatus()).isEqualTo(Draft.DraftStatus.READY);

        // 수동 처리 후 다시 수정하고 새 키로 재게시할 수 있어야 함
        Draft edited = draftService.update(OWNER, draft.getId(), DraftUpdateRequest.builder().price(new BigDecimal("65.00")).build());
        assertThat(edited.getPrice()).isEqualByComparingTo("65.00");

        when(marketplaceClient.publish(any())).thenReturn(MarketplacePublishResult.published("L-2", "https://market.example/items/L-2"));
        String retryToken = coordinator.prepare(OWNER, PrepareRequest.builder().draftId(draft.getId()).build()).getConfirmToken();
        assertThat(coordinator.publish(retryToken, "key-manual-retry", false).getOutcome())
                .isEqualTo(PublishResult.PublishOutcome.PUBLISHED);
        assertThat(draftRepository.findById(draft.getId()).orElseThrow().getStatus()).isEqualTo(Draft.DraftStatus.PUBLISHED);
    }

    @Test
    void rejectedListingMovesDraftToError() {
        when(marketplaceClient.publish(any())).thenReturn(MarketplacePublishResult.failed("category not allowed"));
        Draft draft = draftRepository.save(readyDraft());
        String token = coordinator.prepare(OWNER, PrepareRequest.builder().draftId(draft.getId()).build()).getConfirmToken();

        PublishResult result = coordinator.publish(token, "key-rejected", false);

        assertThat(result.getOutcome()).isEqualTo(PublishResult.PublishOutcome.FAILED);
        assertThat(result.getReason()).isEqualTo("category not allowed");
        assertThat(draftRepository.findById(draft.getId()).orElseThrow().getStatus()).isEqualTo(Draft.DraftStatus.ERROR);
    }

    @Test
    void marketplaceOutageIsRecordedAndSurfaced() {
        when(marketplaceClient.publish(any())).thenThrow(new ExternalServiceException("connection reset"));
        String token = coordinator.prepare(OWNER, validRequest().build()).getConfirmToken();

        assertThatThrownBy(() -> coordinator.publish(token, "key-outage", false)).isInstanceOf(ExternalServiceException.class);

        PublishLedgerEntry entry = ledgerRepository.findByIdempotencyKey("key-outage").orElseThrow();
        assertThat(entry.getStatus()).isEqualTo(PublishLedgerEntry.LedgerStatus.FAILED);
        assertThat(entry.getErrorMessage()).contains("connection reset");
    }

    private static PrepareRequest.PrepareRequestBuilder validRequest() {
        return PrepareRequest.builder()
                .title("Nike Air Max 90")
                .description("Lightly worn, box included")
                .price(new BigDecimal("50.00"))
                .brand("Nike")
                .category("Shoes")
                .hashtags(List.of("#nike", "#sneakers", "#airmax"))
                .photos(List.of("/p/1.jpg"))
                .priceSuggestion(new PriceSuggestion(new BigDecimal("40.00"), new BigDecimal("50.00"), new BigDecimal("60.00")))
                .publishReady(true);
    }

    private static Draft readyDraft() {
        return Draft.builder()
                .ownerId(OWNER)
                .title("Patagonia Fleece Jacket")
                .description("Size M")
                .price(new BigDecimal("70.00"))
                .brand("Patagonia")
                .category("Outer")
                .photos(new ArrayList<>(List.of("/p/jacket.jpg")))
                .hashtags(new ArrayList<>(List.of("#patagonia", "#fleece", "#outdoor")))
                .suggestedMinPrice(new BigDecimal("56.00"))
                .suggestedTargetPrice(new BigDecimal("70.00"))
                .suggestedMaxPrice(new BigDecimal("84.00"))
                .status(Draft.DraftStatus.READY)
                .publishReady(true)
                .build();
    }
}
