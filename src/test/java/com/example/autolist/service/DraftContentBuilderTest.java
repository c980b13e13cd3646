package com.example.autolist.service;

import com.example.autolist.domain.Draft;
import com.example.autolist.dto.ItemDescriptor;
import com.example.autolist.publish.QualityGate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DraftContentBuilderTest {

    private final DraftContentBuilder builder = new DraftContentBuilder(new QualityGate());

    @Test
    void buildsReadyDraftWithGeneratedHashtagsAndPriceRange() {
        ItemDescriptor item = ItemDescriptor.builder()
                .title("Nike Air Max 90")
                .price(new BigDecimal("50"))
                .brand("Nike")
                .category("신발")
                .color("검정")
                .confidence(0.92)
                .photos(List.of("/p/1.jpg", "/p/2.jpg"))
                .build();

        Draft draft = builder.build(item, "owner-1", "job-1");

        assertThat(draft.getOwnerId()).isEqualTo("owner-1");
        assertThat(draft.getSourceJobId()).isEqualTo("job-1");
        assertThat(draft.getSize()).isEqualTo("미지정");
        assertThat(draft.getHashtags()).containsExactly("#nike", "#신발", "#검정", "#중고", "#빈티지");
        assertThat(draft.getSuggestedMinPrice()).isEqualByComparingTo("40.00");
        assertThat(draft.getSuggestedTargetPrice()).isEqualByComparingTo("50.00");
        assertThat(draft.getSuggestedMaxPrice()).isEqualByComparingTo("60.00");
        assertThat(draft.isContentValidated()).isTrue();
        assertThat(draft.isPhotosValidated()).isTrue();
        assertThat(draft.isPublishReady()).isTrue();
        assertThat(draft.getStatus()).isEqualTo(Draft.DraftStatus.READY);
    }

    @Test
    void fallbackItemStaysPendingWithDefaults() {
        ItemDescriptor item = ItemDescriptor.builder()
                .photos(List.of("/p/1.jpg"))
                .fallback(true)
                .build();

        Draft draft = builder.build(item, "owner-1", "job-1");

        assertThat(draft.getTitle()).isEqualTo("확인 필요 상품");
        assertThat(draft.getPrice()).isEqualByComparingTo("20.00");
        assertThat(draft.getCategory()).isEqualTo("기타");
        assertThat(draft.getConfidence()).isEqualTo(0.3);
        assertThat(draft.isPublishReady()).isFalse();
        assertThat(draft.getStatus()).isEqualTo(Draft.DraftStatus.PENDING);
        assertThat(draft.getHashtags()).hasSizeBetween(3, 5);
    }

    @Test
    void providedHashtagsAreKeptWhenCountIsValid() {
        ItemDescriptor item = ItemDescriptor.builder()
                .title("Wool coat")
                .price(new BigDecimal("80"))
                .hashtags(List.of("#coat", "#wool", "#winter"))
                .photos(List.of("/p/1.jpg"))
                .build();

        assertThat(builder.build(item, "o", "j").getHashtags()).containsExactly("#coat", "#wool", "#winter");
    }

    @Test
    void itemWithoutPhotosIsRejected() {
        ItemDescriptor item = ItemDescriptor.builder().title("Empty").build();

        assertThatThrownBy(() -> builder.build(item, "o", "j")).isInstanceOf(IllegalArgumentException.class);
    }
}
