package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.SkillRequest;
import dev.vibeshowcase.dto.SkillResponse;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.repository.UserSkillRepository;
import dev.vibeshowcase.security.Viewer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Skills listed on member profiles. Adding a skill the member already lists (ignoring case)
 * returns the existing entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserSkillService {

    private final UserSkillRepository skillRepository;
    private final IdService idService;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<List<SkillResponse>> getSkills(long userId) {
        return skillRepository.findByUserId(userId)
                .map(SkillResponse::fromEntity)
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<SkillResponse> addSkill(SkillRequest request, Viewer viewer) {
        String category = request.category().trim();
        String skill = request.skill().trim();
        return skillRepository.findExisting(viewer.id(), category, skill)
                .switchIfEmpty(Mono.defer(() -> skillRepository.insertIfAbsent(idService.nextId(), viewer.id(),
                                category, skill, LocalDateTime.now(clock))
                        .doOnNext(inserted -> {
                            if (inserted > 0) {
                                log.info("User {} added skill '{}' in '{}'", viewer.id(), skill, category);
                            }
                        })
                        .then(skillRepository.findExisting(viewer.id(), category, skill))))
                .map(SkillResponse::fromEntity)
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<Void> removeSkill(long skillId, Viewer viewer) {
        return skillRepository.deleteByIdAndUserId(skillId, viewer.id())
                .flatMap(deleted -> deleted > 0
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("error.skill_not_found")))
                .doOnSuccess(v -> log.info("User {} removed skill {}", viewer.id(), skillId))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<List<String>> getCategories(long userId) {
        return skillRepository.findCategoriesByUserId(userId)
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }
}
