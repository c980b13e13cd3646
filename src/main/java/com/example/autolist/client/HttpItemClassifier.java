package com.example.autolist.client;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.dto.ItemDescriptor;
import com.example.autolist.exception.ExternalServiceException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP 분류기 클라이언트
 * <p>
 * 요청: POST /v1/classify {style, photos:[{index, path}]}
 * 응답: {groups:[{photo_indices:[...], title, description, price, ...}]}
 */
@Slf4j
@Component
public class HttpItemClassifier implements ItemClassifier {

    private static final String CLASSIFY_PATH = "/v1/classify";

    private final WebClient webClient;
    private final PipelineProperties properties;

    public HttpItemClassifier(@Qualifier("classifierWebClient") WebClient webClient,
                              PipelineProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public List<ItemDescriptor> classify(List<String> photoPaths, String style) {
        if (photoPaths.isEmpty()) {
            return List.of();
        }

        List<Map<String, Object>> photos = new ArrayList<>();
        for (int i = 0; i < photoPaths.size(); i++) {
            Map<String, Object> photo = new LinkedHashMap<>();
            photo.put("index", i);
            photo.put("path", photoPaths.get(i));
            photos.add(photo);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("style", style);
        body.put("photos", photos);

        log.debug("분류 요청: photos={}, style={}", photoPaths.size(), style);

        ClassifyResponse response;
        try {
            response = webClient.post()
                    .uri(CLASSIFY_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ClassifyResponse.class)
                    .block(properties.getClassifier().getTimeout());
        } catch (WebClientResponseException e) {
            log.error("분류기 호출 실패: status={}, body={}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ExternalServiceException("분류기 호출 실패: " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            log.error("분류기 호출 실패: {}", e.getMessage());
            throw new ExternalServiceException("분류기 호출 실패: " + e.getMessage(), e);
        }

        if (response == null || response.getGroups() == null) {
            throw new ExternalServiceException("분류기 응답이 비어 있습니다.");
        }
        return toDescriptors(response.getGroups(), photoPaths);
    }

    private List<ItemDescriptor> toDescriptors(List<ClassifiedGroup> groups, List<String> photoPaths) {
        List<ItemDescriptor> descriptors = new ArrayList<>();
        for (ClassifiedGroup group : groups) {
            List<String> photos = new ArrayList<>();
            if (group.getPhotoIndices() != null) {
                for (Integer index : group.getPhotoIndices()) {
                    // 범위 밖 인덱스는 무시 (누락된 사진은 그룹핑 단계에서 다시 배정)
                    if (index != null && index >= 0 && index < photoPaths.size()) {
                        String path = photoPaths.get(index);
                        if (!photos.contains(path)) {
                            photos.add(path);
                        }
                    } else {
                        log.warn("분류기 응답의 사진 인덱스가 범위를 벗어남: {}", index);
                    }
                }
            }
            if (photos.isEmpty()) {
                continue;
            }
            descriptors.add(ItemDescriptor.builder()
                    .title(group.getTitle())
                    .description(group.getDescription())
                    .price(group.getPrice())
                    .category(group.getCategory())
                    .condition(group.getCondition())
                    .color(group.getColor())
                    .brand(group.getBrand())
                    .size(group.getSize())
                    .confidence(group.getConfidence() != null ? group.getConfidence() : 0.0)
                    .hashtags(group.getHashtags() != null ? new ArrayList<>(group.getHashtags()) : new ArrayList<>())
                    .photos(photos)
                    .build());
        }
        return descriptors;
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ClassifyResponse {
        private List<ClassifiedGroup> groups;
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ClassifiedGroup {
        @JsonProperty("photo_indices")
        private List<Integer> photoIndices;
        private String title;
        private String description;
        private BigDecimal price;
        private String category;
        private String condition;
        private String color;
        private String brand;
        private String size;
        private Double confidence;
        private List<String> hashtags;
    }
}
