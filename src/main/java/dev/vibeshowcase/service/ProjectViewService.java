package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.metrics.ShowcaseMetrics;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.ProjectViewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * Counts project views: the lifetime counter on the project and the monthly aggregate that
 * feeds trending. Both change together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectViewService {

    private final ProjectRepository projectRepository;
    private final ProjectViewRepository projectViewRepository;
    private final TrendingScorer trendingScorer;
    private final IdService idService;
    private final ShowcaseMetrics metrics;
    private final ResilienceConfig resilience;
    private final Clock clock;

    /**
     * @return true if the project exists and the view was counted
     */
    @Transactional
    public Mono<Boolean> recordView(long projectId) {
        YearMonth month = trendingScorer.currentMonth();
        return projectRepository.incrementViews(projectId)
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.just(false);
                    }
                    return projectViewRepository.incrementMonthly(idService.nextId(), projectId,
                                    month.getMonthValue(), month.getYear(), LocalDateTime.now(clock))
                            .thenReturn(true);
                })
                .doOnNext(counted -> {
                    if (counted) {
                        metrics.projectViewed();
                        log.debug("View recorded for project {} ({})", projectId, month);
                    }
                })
                .timeout(resilience.getDatabaseTimeout());
    }
}
