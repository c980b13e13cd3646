package com.example.autolist.controller;

import com.example.autolist.constants.PipelineConstants;
import com.example.autolist.dto.BulkUploadResponse;
import com.example.autolist.dto.JobStatusResponse;
import com.example.autolist.job.BulkJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * 벌크 사진 분석 API
 */
@Tag(name = "벌크 분석", description = "사진 일괄 업로드 및 분석 작업 상태 API")
@Slf4j
@RestController
@RequestMapping("/api/bulk")
@RequiredArgsConstructor
public class BulkController {

    private final BulkJobService bulkJobService;

    /**
     * 사진 일괄 업로드 (1~500장)
     * 분석은 백그라운드에서 진행되며, 응답의 jobId로 진행 상태를 조회합니다.
     */
    @Operation(summary = "사진 일괄 분석", description = "사진을 업로드하고 상품별 초안 생성 작업을 시작합니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "작업 접수"),
            @ApiResponse(responseCode = "400", description = "잘못된 요청"),
            @ApiResponse(responseCode = "429", description = "한도 초과")
    })
    @PostMapping(value = "/photos/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BulkUploadResponse> analyze(
            @RequestHeader(value = PipelineConstants.OWNER_HEADER, required = false, defaultValue = PipelineConstants.DEFAULT_OWNER) String ownerId,
            @RequestPart("files") List<MultipartFile> files,
            @Parameter(description = "상품당 사진 수 (autoGroup=false일 때 사용)", example = "4")
            @RequestParam(defaultValue = "4") int photosPerItem,
            @Parameter(description = "분류기 기반 자동 그룹핑 여부", example = "true")
            @RequestParam(defaultValue = "true") boolean autoGroup,
            @RequestParam(required = false) String style) {
        log.info("벌크 분석 요청: ownerId={}, files={}, autoGroup={}", ownerId, files.size(), autoGroup);
        return ResponseEntity.ok(bulkJobService.submit(ownerId, files, photosPerItem, autoGroup, style));
    }

    @Operation(summary = "작업 상태 조회", description = "벌크 분석 작업의 진행률과 생성된 초안을 조회합니다.")
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(bulkJobService.getStatus(jobId));
    }
}
