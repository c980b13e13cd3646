package com.example.autolist.publish;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.exception.ExpiredTokenException;
import com.example.autolist.exception.InvalidTokenException;
import com.example.autolist.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfirmTokenServiceTest {

    private static final Instant ISSUED = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private ConfirmTokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(ISSUED);
        tokenService = new ConfirmTokenService(properties("unit-test-confirm-token-secret-0123456789"), new ObjectMapper(), clock);
    }

    @Test
    void tokenCarriesSnapshotAndIsValidBeforeTtl() {
        ConfirmTokenService.IssuedToken issued = tokenService.issue(snapshot(), false);
        assertThat(issued.getExpiresAt()).isEqualTo(ISSUED.plus(Duration.ofMinutes(30)));

        clock.advance(Duration.ofMinutes(29));
        ConfirmTokenService.VerifiedToken verified = tokenService.verify(issued.getToken());

        assertThat(verified.getSnapshot().getTitle()).isEqualTo("Nike Air Max 90");
        assertThat(verified.getSnapshot().getDraftId()).isEqualTo("draft-1");
        assertThat(verified.getSnapshot().getPrice()).isEqualByComparingTo("50.00");
        assertThat(verified.getIssuedAt()).isEqualTo(ISSUED);
        assertThat(verified.isDryRun()).isFalse();
    }

    @Test
    void tokenExpiresAfterTtl() {
        String token = tokenService.issue(snapshot(), false).getToken();

        clock.advance(Duration.ofMinutes(31));

        assertThatThrownBy(() -> tokenService.verify(token)).isInstanceOf(ExpiredTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsInvalid() {
        ConfirmTokenService other = new ConfirmTokenService(
                properties("another-confirm-token-secret-abcdefghijklmnop"), new ObjectMapper(), clock);
        String forged = other.issue(snapshot(), false).getToken();

        assertThatThrownBy(() -> tokenService.verify(forged)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokenService.verify("not-a-token")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokenService.verify(" ")).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void dryRunFlagIsSigned() {
        String token = tokenService.issue(snapshot(), true).getToken();

        assertThat(tokenService.verify(token).isDryRun()).isTrue();
    }

    @Test
    void missingOrShortSecretIsRejectedAtStartup() {
        assertThatThrownBy(() -> new ConfirmTokenService(properties(""), new ObjectMapper(), clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ConfirmTokenService(properties("too-short"), new ObjectMapper(), clock))
                .isInstanceOf(IllegalStateException.class);
    }

    private static PipelineProperties properties(String secret) {
        PipelineProperties properties = new PipelineProperties();
        properties.getPublish().setTokenSecret(secret);
        return properties;
    }

    private static ListingSnapshot snapshot() {
        return ListingSnapshot.builder()
                .draftId("draft-1")
                .title("Nike Air Max 90")
                .price(new BigDecimal("50.00"))
                .hashtags(List.of("#nike", "#sneakers", "#airmax"))
                .photos(List.of("/p/1.jpg"))
                .publishReady(true)
                .build();
    }
}
