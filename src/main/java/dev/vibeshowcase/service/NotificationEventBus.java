package dev.vibeshowcase.service;

import dev.vibeshowcase.dto.NotificationResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live delivery of notifications to connected clients.
 * Each user with an open stream owns a multicast sink; the sink is dropped once the last
 * subscriber of that user disconnects. Nothing is replayed: notifications created while a
 * user is offline are only available through the stored list.
 */
@Service
@Slf4j
public class NotificationEventBus {

    private final Map<Long, Channel> channels = new ConcurrentHashMap<>();
    private final int bufferSize;

    public NotificationEventBus(@Value("${app.notifications.buffer-size:64}") int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public Flux<NotificationResponse> subscribe(long userId) {
        return Flux.defer(() -> {
            Channel channel = channels.compute(userId, (id, existing) -> {
                Channel target = existing != null ? existing : new Channel(bufferSize);
                target.subscribers++;
                return target;
            });
            log.debug("User {} opened a notification stream", userId);
            return channel.sink.asFlux().doFinally(signal -> release(userId, channel));
        });
    }

    /**
     * @return true if the user had an open stream and the event was accepted
     */
    public boolean publish(long userId, NotificationResponse notification) {
        Channel channel = channels.get(userId);
        if (channel == null) {
            return false;
        }
        Sinks.EmitResult result = channel.sink.tryEmitNext(notification);
        if (result.isFailure()) {
            log.warn("Failed to push notification {} to user {}: {}", notification.getId(), userId, result);
            return false;
        }
        log.debug("Notification {} pushed to user {}", notification.getId(), userId);
        return true;
    }

    public int activeUsers() {
        return channels.size();
    }

    public boolean isConnected(long userId) {
        return channels.containsKey(userId);
    }

    private void release(long userId, Channel channel) {
        channels.computeIfPresent(userId, (id, current) -> {
            if (current != channel) {
                return current;
            }
            current.subscribers--;
            return current.subscribers > 0 ? current : null;
        });
        log.debug("User {} closed a notification stream", userId);
    }

    // mutated only inside ConcurrentHashMap.compute* for its key
    private static final class Channel {
        private final Sinks.Many<NotificationResponse> sink;
        private int subscribers;

        private Channel(int bufferSize) {
            this.sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
        }
    }
}
