package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.notification.dto.NotificationDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes notifications to the recipient's open event streams. One dead emitter is completed and
 * dropped without affecting the user's other tabs.
 */
@Slf4j
@Component
public class SseNotificationChannel implements NotificationChannel {

    private static final long TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    // userId -> emitters (several tabs/devices)
    private final Map<Long, CopyOnWriteArrayList<SseEmitter>> emitters = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "sse";
    }

    public SseEmitter subscribe(Long userId) {
        SseEmitter emitter = new SseEmitter(TIMEOUT_MS);
        emitters.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> remove(userId, emitter));
        emitter.onTimeout(() -> remove(userId, emitter));
        emitter.onError(e -> remove(userId, emitter));

        try {
            emitter.send(SseEmitter.event().name("init").data("{\"ok\":true}"));
        } catch (IOException e) {
            log.debug("Stream for user {} closed before init: {}", userId, e.getMessage());
            remove(userId, emitter);
            emitter.completeWithError(e);
        }
        return emitter;
    }

    @Override
    public void deliver(Long recipientId, NotificationDto notification) {
        List<SseEmitter> list = emitters.get(recipientId);
        if (list == null || list.isEmpty()) return;

        for (SseEmitter em : list) {
            try {
                em.send(SseEmitter.event().name("notification").data(notification));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping stream for user {}: {}", recipientId, e.getMessage());
                em.complete();
                remove(recipientId, em);
            }
        }
    }

    public int openStreams(Long userId) {
        List<SseEmitter> list = emitters.get(userId);
        return list == null ? 0 : list.size();
    }

    private void remove(Long userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (id, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
