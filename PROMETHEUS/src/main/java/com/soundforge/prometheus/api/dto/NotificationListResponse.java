package com.soundforge.prometheus.api.dto;

import com.soundforge.prometheus.domain.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for the notification log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationListResponse {
    private List<Notification> notifications;
    private int total;
    private long unreadCount;
}
