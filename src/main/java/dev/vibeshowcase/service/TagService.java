package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.CodingToolResponse;
import dev.vibeshowcase.dto.PopularTagResponse;
import dev.vibeshowcase.entity.Tag;
import dev.vibeshowcase.repository.CodingToolRepository;
import dev.vibeshowcase.repository.ProjectTagRepository;
import dev.vibeshowcase.repository.TagRepository;
import dev.vibeshowcase.util.TagNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    private final TagRepository tagRepository;
    private final ProjectTagRepository projectTagRepository;
    private final CodingToolRepository codingToolRepository;
    private final IdService idService;
    private final ResilienceConfig resilience;

    /**
     * Every tag name in canonical casing, alphabetical. Names differing only in case are
     * reported once.
     */
    public Mono<List<String>> getAllTags() {
        return tagRepository.findAllOrderByName()
                .map(tag -> TagNames.canonical(tag.getName()))
                .collect(() -> new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER),
                        (Map<String, String> names, String name) -> names.putIfAbsent(name, name))
                .map(names -> List.copyOf(names.values()))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<List<PopularTagResponse>> getPopularTags(int limit) {
        return projectTagRepository.findPopular(limit)
                .map(tag -> new PopularTagResponse(TagNames.canonical(tag.name()), tag.count()))
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }

    /**
     * Links the project to the given tags, creating tags that do not exist yet. Input is
     * trimmed, deduplicated case-insensitively and canonically cased first.
     * Existing links are kept; call inside the caller's transaction.
     */
    public Mono<Void> attachTags(long projectId, Collection<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(TagNames.normalize(rawTags))
                .concatMap(this::findOrCreate)
                .concatMap(tag -> projectTagRepository.insert(idService.nextId(), projectId, tag.getId()))
                .then()
                .doOnSuccess(v -> log.debug("Tags attached to project {}", projectId));
    }

    public Mono<Void> replaceTags(long projectId, Collection<String> rawTags) {
        return projectTagRepository.deleteByProjectId(projectId)
                .then(attachTags(projectId, rawTags));
    }

    public Mono<List<CodingToolResponse>> getCodingTools() {
        return codingToolRepository.findAllOrderByName()
                .map(CodingToolResponse::fromEntity)
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<List<CodingToolResponse>> getPopularCodingTools(int limit) {
        return codingToolRepository.findPopular(limit)
                .map(CodingToolResponse::fromEntity)
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }

    private Mono<Tag> findOrCreate(String name) {
        return tagRepository.findByNameIgnoreCase(name)
                .switchIfEmpty(Mono.defer(() -> tagRepository.insertIfAbsent(idService.nextId(), name)
                        .doOnNext(inserted -> {
                            if (inserted > 0) {
                                log.info("Created tag '{}'", name);
                            }
                        })
                        .then(tagRepository.findByNameIgnoreCase(name))));
    }
}
