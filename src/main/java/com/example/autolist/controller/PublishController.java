package com.example.autolist.controller;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.dto.LedgerEntryResponse;
import com.example.autolist.dto.PrepareRequest;
import com.example.autolist.dto.PrepareResult;
import com.example.autolist.dto.PublishRequest;
import com.example.autolist.dto.PublishResult;
import com.example.autolist.exception.ResourceNotFoundException;
import com.example.autolist.publish.PublishCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 리스팅 게시 API (prepare → publish 2단계)
 */
@Tag(name = "리스팅 게시", description = "품질 점검 후 확인 토큰과 멱등성 키로 게시하는 API")
@Slf4j
@RestController
@RequestMapping("/api/listings")
@RequiredArgsConstructor
public class PublishController {

    private final PublishCoordinator publishCoordinator;

    @Operation(summary = "게시 준비", description = "품질 점검을 통과하면 30분간 유효한 확인 토큰을 발급합니다. 상태는 변경되지 않습니다.")
    @PostMapping("/prepare")
    public ResponseEntity<PrepareResult> prepare(
            @RequestHeader(value = PipelineConstants.OWNER_HEADER, required = false, defaultValue = PipelineConstants.DEFAULT_OWNER) String ownerId,
            @RequestBody PrepareRequest request) {
        return ResponseEntity.ok(publishCoordinator.prepare(ownerId, request));
    }

    @Operation(summary = "게시", description = "같은 Idempotency-Key로는 한 번만 게시됩니다. 재시도에는 새 키가 필요합니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "게시 결과 (수동 처리 필요 포함)"),
            @ApiResponse(responseCode = "400", description = "토큰 오류 또는 키 누락"),
            @ApiResponse(responseCode = "409", description = "이미 사용된 Idempotency-Key"),
            @ApiResponse(responseCode = "410", description = "토큰 만료"),
            @ApiResponse(responseCode = "502", description = "마켓플레이스 오류")
    })
    @PostMapping("/publish")
    public ResponseEntity<PublishResult> publish(
            @Parameter(description = "멱등성 키 (요청마다 고유)", required = true)
            @RequestHeader(PipelineConstants.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody PublishRequest request) {
        log.info("게시 요청: idempotencyKey={}, dryRun={}", idempotencyKey, request.isDryRun());
        return ResponseEntity.ok(publishCoordinator.publish(request.getConfirmToken(), idempotencyKey, request.isDryRun()));
    }

    @Operation(summary = "게시 원장 조회")
    @GetMapping("/publish-log/{idempotencyKey}")
    public ResponseEntity<LedgerEntryResponse> getPublishLog(@PathVariable String idempotencyKey) {
        return publishCoordinator.findLedgerEntry(idempotencyKey)
                .map(LedgerEntryResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("게시 기록을 찾을 수 없습니다: " + idempotencyKey));
    }
}
