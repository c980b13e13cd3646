package com.example.autolist.service;

import com.example.autolist.client.ItemClassifier;
import com.example.autolist.config.PipelineProperties;
import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.dto.GroupingResult;
import com.example.autolist.dto.ItemDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * 사진 그룹핑 + 분류
 * <p>
 * 스마트 모드: 분류기 1회 호출 한도(batchLimit) 단위로 사진을 나눠 순서대로 분류하고 결과를 이어 붙입니다.
 * 청크 분류가 실패하면 해당 청크만 고정 크기 그룹으로 나눠 그룹마다 다시 분류합니다.
 * 고정 모드: 요청한 장수 단위로 나눠 그룹마다 분류합니다.
 * 어떤 경우에도 사진은 버려지지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PhotoGroupingAdapter {

    private final ItemClassifier classifier;
    private final PipelineProperties properties;

    public GroupingResult groupAndClassify(List<String> photoPaths, String style, boolean autoGroup, int photosPerItem) {
        String styleHint = style == null || style.isBlank() ? properties.getGrouping().getDefaultStyle() : style;
        List<ItemDescriptor> descriptors = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (!autoGroup) {
            log.info("고정 그룹핑: photos={}, photosPerItem={}", photoPaths.size(), photosPerItem);
            descriptors.addAll(classifyFixedGroups(photoPaths, photosPerItem, styleHint, errors));
            return new GroupingResult(descriptors, errors);
        }

        int batchLimit = properties.getGrouping().getBatchLimit();
        List<List<String>> chunks = partition(photoPaths, batchLimit);
        log.info("스마트 그룹핑: photos={}, chunks={}, batchLimit={}", photoPaths.size(), chunks.size(), batchLimit);

        for (int i = 0; i < chunks.size(); i++) {
            List<String> chunk = chunks.get(i);
            try {
                List<ItemDescriptor> classified = classifier.classify(chunk, styleHint);
                if (classified == null || classified.isEmpty()) {
                    throw new IllegalStateException("분류 결과가 비어 있습니다.");
                }
                List<ItemDescriptor> normalized = normalizeChunk(chunk, classified);
                mergeSmallGroups(normalized);
                descriptors.addAll(normalized);
                log.debug("청크 {}/{} 분류 완료: photos={}, items={}", i + 1, chunks.size(), chunk.size(), normalized.size());
            } catch (RuntimeException e) {
                log.warn("청크 {}/{} 분류 실패, 고정 크기 그룹으로 대체합니다: {}", i + 1, chunks.size(), e.getMessage());
                descriptors.addAll(classifyFixedGroups(chunk, properties.getGrouping().getFallbackGroupSize(), styleHint, errors));
            }
        }
        return new GroupingResult(descriptors, errors);
    }

    /**
     * 고정 크기 그룹마다 분류기를 호출해 그룹 하나를 상품 하나로 만듭니다.
     * 분류에 실패한 그룹은 기본값 상품으로 남기고 오류를 기록합니다.
     */
    private List<ItemDescriptor> classifyFixedGroups(List<String> photos, int groupSize, String style, List<String> errors) {
        List<ItemDescriptor> result = new ArrayList<>();
        for (List<String> group : partition(photos, groupSize)) {
            try {
                List<ItemDescriptor> classified = classifier.classify(group, style);
                if (classified == null || classified.isEmpty()) {
                    throw new IllegalStateException("분류 결과가 비어 있습니다.");
                }
                // 그룹 전체를 하나의 상품으로 취급하므로 첫 결과의 정보만 사용
                result.add(classified.get(0).toBuilder()
                        .photos(new ArrayList<>(group))
                        .build());
            } catch (RuntimeException e) {
                String error = "사진 " + group.size() + "장 분류 실패, 기본값으로 초안 생성: " + group + " (" + e.getMessage() + ")";
                log.warn(error);
                errors.add(error);
                result.add(placeholder(group));
            }
        }
        return result;
    }

    /**
     * 청크 내 결과 정리: 중복 배정 제거, 빈 그룹 제거, 누락된 사진은 가장 큰 그룹에 추가
     */
    private List<ItemDescriptor> normalizeChunk(List<String> chunk, List<ItemDescriptor> classified) {
        Set<String> chunkPhotos = new HashSet<>(chunk);
        Set<String> assigned = new HashSet<>();
        List<ItemDescriptor> groups = new ArrayList<>();

        for (ItemDescriptor descriptor : classified) {
            List<String> photos = new ArrayList<>();
            if (descriptor.getPhotos() != null) {
                for (String photo : descriptor.getPhotos()) {
                    if (chunkPhotos.contains(photo) && assigned.add(photo)) {
                        photos.add(photo);
                    }
                }
            }
            if (!photos.isEmpty()) {
                groups.add(descriptor.toBuilder().photos(photos).build());
            }
        }
        if (groups.isEmpty()) {
            throw new IllegalStateException("분류 결과에 유효한 사진 그룹이 없습니다.");
        }

        List<String> missing = new ArrayList<>();
        for (String photo : chunk) {
            if (!assigned.contains(photo)) {
                missing.add(photo);
            }
        }
        if (!missing.isEmpty()) {
            ItemDescriptor largest = largest(groups);
            largest.getPhotos().addAll(missing);
            log.warn("분류기가 배정하지 않은 사진 {}장을 가장 큰 그룹에 추가", missing.size());
        }
        return groups;
    }

    /**
     * 사진 수가 임계값 이하인 그룹을 가장 큰 그룹에 병합
     * 가장 큰 그룹도 임계값 이하이면 병합하지 않습니다.
     */
    private void mergeSmallGroups(List<ItemDescriptor> groups) {
        int threshold = properties.getGrouping().getSmallGroupMergeThreshold();
        if (threshold <= 0 || groups.size() < 2) {
            return;
        }
        ItemDescriptor largest = largest(groups);
        if (largest.getPhotos().size() <= threshold) {
            return;
        }

        int merged = 0;
        Iterator<ItemDescriptor> iterator = groups.iterator();
        while (iterator.hasNext()) {
            ItemDescriptor group = iterator.next();
            if (group != largest && group.getPhotos().size() <= threshold) {
                largest.getPhotos().addAll(group.getPhotos());
                iterator.remove();
                merged++;
            }
        }
        if (merged > 0) {
            log.info("소규모 그룹 {}개를 가장 큰 그룹에 병합 (threshold={})", merged, threshold);
        }
    }

    private static ItemDescriptor largest(List<ItemDescriptor> groups) {
        return groups.stream()
                .max(Comparator.comparingInt(group -> group.getPhotos().size()))
                .orElseThrow();
    }

    private static ItemDescriptor placeholder(List<String> photos) {
        return ItemDescriptor.builder()
                .title(PipelineConstants.DEFAULT_TITLE)
                .description(PipelineConstants.DEFAULT_DESCRIPTION)
                .price(PipelineConstants.DEFAULT_PRICE)
                .category(PipelineConstants.DEFAULT_CATEGORY)
                .condition(PipelineConstants.DEFAULT_CONDITION)
                .confidence(PipelineConstants.FALLBACK_CONFIDENCE)
                .photos(new ArrayList<>(photos))
                .fallback(true)
                .build();
    }

    static List<List<String>> partition(List<String> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("그룹 크기는 1 이상이어야 합니다: " + size);
        }
        List<List<String>> parts = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            parts.add(new ArrayList<>(items.subList(start, Math.min(start + size, items.size()))));
        }
        return parts;
    }
}
