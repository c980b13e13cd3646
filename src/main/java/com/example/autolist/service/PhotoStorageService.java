package com.example.autolist.service;

import com.example.autolist.config.PipelineProperties;
import com.example.autolist.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 업로드 사진 로컬 저장
 * <p>
 * 저장 경로: {uploadDir}/{jobId}/photo_000.jpg 형식 (업로드 순서 유지)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PhotoStorageService {

    private static final String DEFAULT_EXTENSION = "jpg";

    private final PipelineProperties properties;

    public List<String> store(String jobId, List<MultipartFile> files) {
        Path jobDir = Paths.get(properties.getStorage().getUploadDir(), jobId);
        try {
            Files.createDirectories(jobDir);
        } catch (IOException e) {
            throw new StorageException("업로드 디렉터리를 만들 수 없습니다: " + jobDir, e);
        }

        List<String> paths = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            Path target = jobDir.resolve(String.format("photo_%03d.%s", i, extensionOf(file.getOriginalFilename())));
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new StorageException("사진 저장 실패: " + file.getOriginalFilename(), e);
            }
            paths.add(target.toString());
        }
        log.info("사진 저장 완료: jobId={}, count={}, dir={}", jobId, paths.size(), jobDir);
        return paths;
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        // 경로 조작 방지: 영숫자 확장자만 허용
        return extension.matches("[a-z0-9]{1,5}") ? extension : DEFAULT_EXTENSION;
    }
}
