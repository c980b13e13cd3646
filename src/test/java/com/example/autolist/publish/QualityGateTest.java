package com.example.autolist.publish;

import com.example.autolist.dto.ListingSnapshot;
import com.example.autolist.dto.PriceSuggestion;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityGateTest {

    private final QualityGate gate = new QualityGate();

    @Test
    void validListingPasses() {
        assertThat(gate.evaluate(valid().build())).isEmpty();
    }

    @Test
    void twoHashtagsAreRejectedWithCount() {
        List<String> reasons = gate.evaluate(valid().hashtags(List.of("#a", "#b")).build());

        assertThat(reasons).hasSize(1);
        assertThat(reasons.get(0)).contains("hashtag").contains("2");
    }

    @Test
    void titleLengthAndPriceRules() {
        List<String> reasons = gate.evaluate(valid()
                .title("x".repeat(71))
                .price(BigDecimal.ZERO)
                .build());

        assertThat(reasons).hasSize(2);
        assertThat(reasons).anyMatch(reason -> reason.startsWith("title"));
        assertThat(reasons).anyMatch(reason -> reason.startsWith("price"));
    }

    @Test
    void priceSuggestionMustBeOrdered() {
        PriceSuggestion unordered = new PriceSuggestion(new BigDecimal("30"), new BigDecimal("20"), new BigDecimal("40"));

        assertThat(gate.evaluate(valid().priceSuggestion(unordered).build()))
                .singleElement().asString().contains("priceSuggestion");
        assertThat(gate.evaluate(valid().priceSuggestion(null).build()))
                .singleElement().asString().contains("priceSuggestion");
    }

    @Test
    void publishReadyFlagOnlyCheckedByFullEvaluation() {
        ListingSnapshot notReady = valid().publishReady(false).build();

        assertThat(gate.contentIssues(notReady)).isEmpty();
        assertThat(gate.evaluate(notReady)).singleElement().asString().contains("publishReady");
    }

    private static ListingSnapshot.ListingSnapshotBuilder valid() {
        return ListingSnapshot.builder()
                .title("Nike Air Max 90")
                .description("Lightly worn")
                .price(new BigDecimal("50.00"))
                .hashtags(List.of("#nike", "#sneakers", "#airmax"))
                .photos(List.of("/p/1.jpg"))
                .priceSuggestion(new PriceSuggestion(new BigDecimal("40.00"), new BigDecimal("50.00"), new BigDecimal("60.00")))
                .publishReady(true);
    }
}
