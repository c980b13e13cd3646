package com.example.autolist.util;

import org.springframework.security.crypto.bcrypt.BCrypt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * 마켓플레이스 API 요청 서명 유틸
 *
 * 규칙:
 *   password = clientId + "_" + timestamp
 *   hashed   = bcrypt.hashpw(password, clientSecret)
 *   sign     = Base64.encode(hashed)
 */
public class SignatureUtil {

    /**
     * 게시 요청 헤더에 실릴 서명 생성
     *
     * @param clientId     마켓플레이스 client_id
     * @param timestamp    밀리초 timestamp
     * @param clientSecret 마켓플레이스 client_secret (bcrypt salt 문자열)
     * @return Base64 인코딩된 bcrypt 결과
     * @throws IllegalArgumentException clientSecret이 올바른 bcrypt salt가 아닌 경우
     */
    public static String generateSignature(String clientId,
                                           long timestamp,
                                           String clientSecret) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("marketplace.client-id가 설정되지 않았습니다.");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("marketplace.client-secret이 설정되지 않았습니다.");
        }

        String password = clientId + "_" + timestamp;
        String bcryptHash = BCrypt.hashpw(password, clientSecret);

        return Base64.getEncoder()
                .encodeToString(bcryptHash.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 서명 검증 (수신 측 또는 테스트용)
     */
    public static boolean verifySignature(String clientId, long timestamp, String signature) {
        String decoded = new String(Base64.getDecoder().decode(signature), StandardCharsets.UTF_8);
        return BCrypt.checkpw(clientId + "_" + timestamp, decoded);
    }

    private SignatureUtil() {
        // 유틸 클래스이므로 인스턴스 생성 방지
    }
}
