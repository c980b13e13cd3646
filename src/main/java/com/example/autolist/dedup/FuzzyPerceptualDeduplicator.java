package com.example.autolist.dedup;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.util.PerceptualHash;
import com.example.autolist.util.TitleSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 제목 퍼지 매칭 + 사진 perceptual hash 기반 중복 판정
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FuzzyPerceptualDeduplicator implements Deduplicator {

    private final PipelineProperties properties;

    @Override
    public double titleSimilarity(String first, String second) {
        return TitleSimilarity.ratio(first, second);
    }

    @Override
    public Optional<Integer> findDuplicate(String title, List<String> candidateTitles) {
        double threshold = properties.getDedup().getTitleThreshold();
        int bestIndex = -1;
        double bestScore = -1.0;

        for (int i = 0; i < candidateTitles.size(); i++) {
            double score;
            try {
                score = titleSimilarity(title, candidateTitles.get(i));
            } catch (RuntimeException e) {
                // 유사도 계산 실패는 불일치로 처리
                log.warn("제목 유사도 계산 실패: title={}, candidate={}", title, candidateTitles.get(i), e);
                continue;
            }
            if (score >= threshold && score > bestScore) {
                bestScore = score;
                bestIndex = i;
            }
        }

        if (bestIndex < 0) {
            return Optional.empty();
        }
        log.debug("중복 후보 발견: title={}, score={}", title, bestScore);
        return Optional.of(bestIndex);
    }

    @Override
    public List<String> mergePhotos(List<String> existing, List<String> incoming) {
        // 경로 기준으로 먼저 합치고, 이후 해시가 같은 사진을 제거
        Set<String> union = new LinkedHashSet<>(existing);
        union.addAll(incoming);

        int maxDistance = properties.getDedup().getHashDistance();
        List<String> result = new ArrayList<>();
        List<Long> keptHashes = new ArrayList<>();

        for (String photo : union) {
            Long hash = hashOrNull(photo);
            if (hash == null) {
                // 읽을 수 없는 사진은 비교 없이 유지
                result.add(photo);
                continue;
            }
            boolean duplicate = keptHashes.stream()
                    .anyMatch(kept -> PerceptualHash.distance(kept, hash) <= maxDistance);
            if (duplicate) {
                log.debug("같은 사진으로 판정되어 제외: {} (hash={})", photo, PerceptualHash.toHex(hash));
                continue;
            }
            keptHashes.add(hash);
            result.add(photo);
        }
        return result;
    }

    private Long hashOrNull(String photo) {
        try {
            Path path = Paths.get(photo);
            return PerceptualHash.compute(path);
        } catch (IOException | RuntimeException e) {
            log.warn("사진 해시 계산 실패, 중복 비교에서 제외: {} ({})", photo, e.getMessage());
            return null;
        }
    }
}
