package com.soundforge.prometheus.api.v1;

import com.soundforge.prometheus.api.dto.MessageResponse;
import com.soundforge.prometheus.api.dto.NotificationListResponse;
import com.soundforge.prometheus.domain.ResourceNotFoundException;
import com.soundforge.prometheus.domain.model.Notification;
import com.soundforge.prometheus.domain.model.NotificationSeverity;
import com.soundforge.prometheus.notification.NotificationHub;
import com.soundforge.prometheus.notification.NotificationQuery;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for the operator notification log.
 */
@RestController
@RequestMapping("/api/v1/prometheus/notifications")
@Tag(name = "Notifications", description = "Operator notification log")
public class NotificationController {

    private final NotificationHub notificationHub;

    public NotificationController(NotificationHub notificationHub) {
        this.notificationHub = notificationHub;
    }

    @GetMapping
    @Operation(summary = "List notifications", description = "Newest first, optionally filtered")
    public Mono<ResponseEntity<NotificationListResponse>> getNotifications(
            @Parameter(description = "Minimum severity: critical, warning or info")
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(required = false) Integer limit) {

        NotificationSeverity minimum;
        try {
            minimum = severity != null ? NotificationSeverity.fromLabel(severity) : null;
        } catch (IllegalArgumentException e) {
            return Mono.error(ApiException.badRequest(e.getMessage()));
        }

        NotificationQuery query = NotificationQuery.builder()
                .severity(minimum)
                .unreadOnly(unreadOnly)
                .limit(limit)
                .build();

        return ApiResponses.ok(Mono.fromCallable(() -> {
            List<Notification> notifications = notificationHub.getNotifications(query);
            return NotificationListResponse.builder()
                    .notifications(notifications)
                    .total(notifications.size())
                    .unreadCount(notificationHub.getUnreadCount())
                    .build();
        }), "Failed to fetch notifications");
    }

    @PostMapping("/{id}/read")
    @Operation(summary = "Mark notification read")
    public Mono<ResponseEntity<MessageResponse>> markAsRead(
            @Parameter(description = "Notification ID") @PathVariable String id) {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            if (!notificationHub.markAsRead(id)) {
                throw new ResourceNotFoundException("Notification", id);
            }
            return new MessageResponse("Notification marked as read");
        }), "Failed to mark notification as read");
    }

    @PostMapping("/read-all")
    @Operation(summary = "Mark all notifications read")
    public Mono<ResponseEntity<MessageResponse>> markAllAsRead() {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            notificationHub.markAllAsRead();
            return new MessageResponse("All notifications marked as read");
        }), "Failed to mark notifications as read");
    }

    @DeleteMapping
    @Operation(summary = "Clear notifications")
    public Mono<ResponseEntity<MessageResponse>> clearNotifications() {
        return ApiResponses.ok(Mono.fromCallable(() -> {
            notificationHub.clearNotifications();
            return new MessageResponse("Notifications cleared");
        }), "Failed to clear notifications");
    }
}
