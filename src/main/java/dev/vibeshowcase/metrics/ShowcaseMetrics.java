package dev.vibeshowcase.metrics;

import dev.vibeshowcase.entity.LikeTarget;
import dev.vibeshowcase.repository.CommentRepository;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.service.NotificationEventBus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class ShowcaseMetrics {

    private final MeterRegistry meterRegistry;
    private final ProjectRepository projectRepository;
    private final UserRepository userRepository;
    private final CommentRepository commentRepository;
    private final NotificationEventBus notificationEventBus;

    private final AtomicLong totalProjects = new AtomicLong(0);
    private final AtomicLong totalUsers = new AtomicLong(0);
    private final AtomicLong totalComments = new AtomicLong(0);

    private Counter projectCreatedCounter;
    private Counter projectViewCounter;
    private Counter commentCreatedCounter;
    private Counter notificationStoredCounter;
    private Counter notificationPushedCounter;
    private Counter shareCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("showcase.projects.total", totalProjects, AtomicLong::get)
                .description("Total number of projects")
                .register(meterRegistry);

        Gauge.builder("showcase.users.total", totalUsers, AtomicLong::get)
                .description("Total number of registered users")
                .register(meterRegistry);

        Gauge.builder("showcase.comments.total", totalComments, AtomicLong::get)
                .description("Total number of comments")
                .register(meterRegistry);

        Gauge.builder("showcase.notifications.streams", notificationEventBus, NotificationEventBus::activeUsers)
                .description("Users with an open notification stream")
                .register(meterRegistry);

        projectCreatedCounter = meterRegistry.counter("showcase.projects.created");
        projectViewCounter = meterRegistry.counter("showcase.projects.views");
        commentCreatedCounter = meterRegistry.counter("showcase.comments.created");
        notificationStoredCounter = meterRegistry.counter("showcase.notifications.stored");
        notificationPushedCounter = meterRegistry.counter("showcase.notifications.pushed");
        shareCounter = meterRegistry.counter("showcase.shares");
    }

    @Scheduled(fixedRateString = "${app.metrics.refresh-ms:60000}", initialDelayString = "${app.metrics.initial-delay-ms:30000}")
    public void refreshTotals() {
        Mono.zip(projectRepository.count(), userRepository.count(), commentRepository.count())
                .subscribe(
                        totals -> {
                            totalProjects.set(totals.getT1());
                            totalUsers.set(totals.getT2());
                            totalComments.set(totals.getT3());
                        },
                        error -> log.warn("Failed to refresh metrics: {}", error.getMessage()));
    }

    public void projectCreated() {
        projectCreatedCounter.increment();
    }

    public void projectViewed() {
        projectViewCounter.increment();
    }

    public void commentCreated() {
        commentCreatedCounter.increment();
    }

    public void liked(LikeTarget.Type type) {
        meterRegistry.counter("showcase.likes", "target", type.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void shared() {
        shareCounter.increment();
    }

    public void notificationStored() {
        notificationStoredCounter.increment();
    }

    public void notificationPushed() {
        notificationPushedCounter.increment();
    }
}
