package com.example.autolist.controller;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.dto.DraftListResponse;
import com.example.autolist.dto.DraftResponse;
import com.example.autolist.dto.DraftUpdateRequest;
import com.example.autolist.service.DraftService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "초안 관리", description = "생성된 리스팅 초안 조회/수정/삭제 API")
@RestController
@RequestMapping("/api/drafts")
@RequiredArgsConstructor
public class DraftController {

    private final DraftService draftService;

    @Operation(summary = "초안 목록 조회")
    @GetMapping
    public ResponseEntity<DraftListResponse> list(
            @RequestHeader(value = PipelineConstants.OWNER_HEADER, required = false, defaultValue = PipelineConstants.DEFAULT_OWNER) String ownerId,
            @Parameter(description = "상태 필터 (pending, ready, prepared, published, error)")
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int pageSize) {
        return ResponseEntity.ok(draftService.list(ownerId, status, page, pageSize));
    }

    @Operation(summary = "초안 상세 조회")
    @GetMapping("/{draftId}")
    public ResponseEntity<DraftResponse> get(
            @RequestHeader(value = PipelineConstants.OWNER_HEADER, required = false, defaultValue = PipelineConstants.DEFAULT_OWNER) String ownerId,
            @PathVariable String draftId) {
        return ResponseEntity.ok(DraftResponse.from(draftService.get(ownerId, draftId)));
    }

    @Operation(summary = "초안 수정", description = "전달된 필드만 수정하고 게시 준비 여부를 다시 계산합니다.")
    @PatchMapping("/{draftId}")
    public ResponseEntity<DraftResponse> update(
            @RequestHeader(value = PipelineConstants.OWNER_HEADER, required = false, defaultValue = PipelineConstants.DEFAULT_OWNER) String ownerId,
            @PathVariable String draftId,
            @RequestBody DraftUpdateRequest request) {
        return ResponseEntity.ok(DraftResponse.from(draftService.update(ownerId, draftId, request)));
    }

    @Operation(summary = "초안 삭제")
    @DeleteMapping("/{draftId}")
    public ResponseEntity<Map<String, Object>> delete(
            @RequestHeader(value = PipelineConstants.OWNER_HEADER, required = false, defaultValue = PipelineConstants.DEFAULT_OWNER) String ownerId,
            @PathVariable String draftId) {
        draftService.delete(ownerId, draftId);
        return ResponseEntity.ok(Map.of("ok", true, "draftId", draftId));
    }
}
