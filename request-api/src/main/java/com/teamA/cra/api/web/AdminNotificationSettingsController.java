package com.teamA.cra.api.web;

import com.teamA.cra.api.web.dto.NotificationSettingsBody;
import com.teamA.cra.common.notification.settings.NotificationSettingsStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/notification-settings")
public class AdminNotificationSettingsController {

    private final NotificationSettingsStore notificationSettingsStore;

    @GetMapping
    public ResponseEntity<NotificationSettingsBody> get() {
        return ResponseEntity.ok(NotificationSettingsBody.from(notificationSettingsStore.load()));
    }

    @PutMapping
    public ResponseEntity<NotificationSettingsBody> put(@RequestBody NotificationSettingsBody body) {
        notificationSettingsStore.save(body.toSettings());
        return ResponseEntity.ok(NotificationSettingsBody.from(notificationSettingsStore.load()));
    }
}
