package com.teamA.cra.api.auth;

import com.teamA.cra.common.notification.recipient.DirectoryUser;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * 디렉터리의 활성 사용자만 토큰 발급 (userId 또는 email)
 *
 * ❗ 비밀번호 검증 없음 (사내 SSO 앞단 전제)
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthController {

    private final JwtProvider jwtProvider;
    private final RecipientDirectory recipientDirectory;

    @PostMapping("/login")
    public ResponseEntity<?> login(@Validated @RequestBody LoginRequest req) {
        String login = req.getLogin().trim();
        Optional<DirectoryUser> found = login.contains("@")
                ? recipientDirectory.findByEmail(login)
                : recipientDirectory.findById(login);

        if (found.isEmpty() || !found.get().active() || found.get().role() == null) {
            log.info("[AUTH] login rejected login={}", login);
            return ResponseEntity.status(401).body(Map.of("error", "unauthorized", "message", "invalid user"));
        }

        DirectoryUser user = found.get();
        String token = jwtProvider.issue(user.userId(), user.role().code(), user.name());
        return ResponseEntity.ok(Map.of(
                "accessToken", token,
                "tokenType", "Bearer",
                "userId", user.userId(),
                "role", user.role().code()
        ));
    }

    @Data
    public static class LoginRequest {
        @NotBlank
        private String login;
    }
}
