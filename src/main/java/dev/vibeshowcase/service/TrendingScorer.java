package dev.vibeshowcase.service;

import dev.vibeshowcase.repository.TrendingCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks projects for the default listing order.
 *
 * <p>{@code score = monthlyViews * 0.7 + recencyBonus}, where
 * {@code recencyBonus = ((createdAt - now + 30 days) / 1 day) * 3}. The bonus falls linearly
 * to zero for a 30-day-old project and turns negative after that, so a fresh project with no
 * views can outrank an older one with a few.</p>
 */
@Component
@RequiredArgsConstructor
public class TrendingScorer {

    static final double VIEW_WEIGHT = 0.7;
    static final double RECENCY_WEIGHT = 3.0;
    static final Duration RECENCY_WINDOW = Duration.ofDays(30);

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;

    public double score(LocalDateTime createdAt, long monthlyViews) {
        return score(createdAt, monthlyViews, clock.instant());
    }

    /**
     * Sorts by descending score. The sort is stable: equal scores keep their input order.
     */
    public List<TrendingCandidate> rank(List<TrendingCandidate> candidates) {
        Instant now = clock.instant();
        Map<Long, Double> scores = new HashMap<>(candidates.size() * 2);
        for (TrendingCandidate candidate : candidates) {
            scores.put(candidate.projectId(), score(candidate.createdAt(), candidate.monthlyViews(), now));
        }
        List<TrendingCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingDouble((TrendingCandidate c) -> scores.get(c.projectId())).reversed());
        return ranked;
    }

    /**
     * The calendar month (UTC) whose view counts feed the score.
     */
    public YearMonth currentMonth() {
        return YearMonth.now(clock.withZone(ZoneOffset.UTC));
    }

    private double score(LocalDateTime createdAt, long monthlyViews, Instant now) {
        long createdMillis = createdAt.toInstant(ZoneOffset.UTC).toEpochMilli();
        double recencyDays = (createdMillis - now.toEpochMilli() + RECENCY_WINDOW.toMillis()) / MILLIS_PER_DAY;
        return monthlyViews * VIEW_WEIGHT + recencyDays * RECENCY_WEIGHT;
    }
}
