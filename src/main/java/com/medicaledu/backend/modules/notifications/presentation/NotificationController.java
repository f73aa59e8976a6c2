package com.medicaledu.backend.modules.notifications.presentation;

import java.util.UUID;

import com.medicaledu.backend.global.error.ResultProblems;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.SecurityUtils;
import com.medicaledu.backend.global.web.PageRequests;
import com.medicaledu.backend.modules.notifications.application.GetNotificationsQuery;
import com.medicaledu.backend.modules.notifications.application.MarkAllNotificationsReadCommand;
import com.medicaledu.backend.modules.notifications.application.MarkNotificationReadCommand;
import com.medicaledu.backend.modules.notifications.presentation.dto.NotificationListResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final Mediator mediator;

    public NotificationController(Mediator mediator) {
        this.mediator = mediator;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "unreadOnly", defaultValue = "false") boolean unreadOnly,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(ResultProblems.orThrow(mediator.send(
                new GetNotificationsQuery(userId, unreadOnly, PageRequests.page(page), PageRequests.size(size)))));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable("notificationId") UUID notificationId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        ResultProblems.orThrow(mediator.send(new MarkNotificationReadCommand(userId, notificationId)));
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/read-all")
    public ResponseEntity<Void> markAllRead() {
        UUID userId = SecurityUtils.getCurrentUserId();
        ResultProblems.orThrow(mediator.send(new MarkAllNotificationsReadCommand(userId)));
        return ResponseEntity.noContent().build();
    }
}
