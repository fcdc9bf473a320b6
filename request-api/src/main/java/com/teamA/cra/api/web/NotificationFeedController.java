package com.teamA.cra.api.web;

import com.teamA.cra.api.auth.UserResolver;
import com.teamA.cra.common.notification.inapp.InAppNotification;
import com.teamA.cra.common.notification.inapp.InAppNotificationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 로그인 사용자 본인의 in-app 피드
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/me/notifications")
public class NotificationFeedController {

    private final InAppNotificationStore inAppNotificationStore;
    private final UserResolver userResolver;

    @GetMapping
    public ResponseEntity<List<InAppNotification>> list(
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(required = false) Integer limit
    ) {
        int lim = limit == null ? InAppNotificationStore.DEFAULT_LIMIT : InAppNotificationStore.clampLimit(limit);
        return ResponseEntity.ok(inAppNotificationStore.list(userResolver.currentUserId(), unreadOnly, lim));
    }

    @PostMapping("/{notificationId}/read")
    public ResponseEntity<Map<String, Object>> markRead(@PathVariable String notificationId) {
        boolean updated = inAppNotificationStore.markRead(userResolver.currentUserId(), notificationId);
        return ResponseEntity.ok(Map.of("id", notificationId, "updated", updated));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Object>> markAllRead() {
        int updated = inAppNotificationStore.markAllRead(userResolver.currentUserId());
        return ResponseEntity.ok(Map.of("updated", updated));
    }
}
