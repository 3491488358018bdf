package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.notification.dto.NotificationDto;
import com.tutorflow.tutorbackend.shared.PaginatedResponse;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService service;
    private final SseNotificationChannel sseChannel;
    private final CurrentUserService currentUserService;

    /**
     * Fetch unread notifications with pagination.
     * Defaults: page=0, size=20
     */
    @GetMapping("/unread")
    public PaginatedResponse<NotificationDto> getUnread(@RequestParam(defaultValue = "0") int page,
                                                        @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(service.getUnread(currentUserService.getCurrentUserOrThrow(), page, size));
    }

    @GetMapping("/all")
    public PaginatedResponse<NotificationDto> getAll(@RequestParam(defaultValue = "0") int page,
                                                     @RequestParam(defaultValue = "20") int size) {
        return PaginatedResponse.of(service.getAll(currentUserService.getCurrentUserOrThrow(), page, size));
    }

    @GetMapping("/unread/count")
    public Map<String, Long> unreadCount() {
        return Map.of("count", service.countUnread(currentUserService.getCurrentUserOrThrow()));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return sseChannel.subscribe(currentUserService.getCurrentUserOrThrow().getId());
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<Void> markAsRead(@PathVariable Long id) {
        service.markAsRead(id, currentUserService.getCurrentUserOrThrow());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/read-all")
    public Map<String, Integer> markAllAsRead() {
        return Map.of("updated", service.markAllAsRead(currentUserService.getCurrentUserOrThrow()));
    }
}
