package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.ProjectResponse;
import dev.vibeshowcase.entity.LikeTarget;
import dev.vibeshowcase.entity.Project;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.repository.IdCount;
import dev.vibeshowcase.repository.LikeRepository;
import dev.vibeshowcase.repository.ProjectEngagementRepository;
import dev.vibeshowcase.repository.ProjectTagRepository;
import dev.vibeshowcase.repository.TagLink;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.security.Viewer;
import dev.vibeshowcase.util.DateTimes;
import dev.vibeshowcase.util.TagNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Decorates a page of projects with what the viewer sees next to each card: tags,
 * like and comment counts, the viewer's like and bookmark flags, and the author.
 *
 * <p>Each attribute is a single batched query over the page ids, and the six queries run
 * concurrently. The result keeps the input order.</p>
 */
@Service
@RequiredArgsConstructor
public class ProjectEnrichmentService {

    private final ProjectTagRepository projectTagRepository;
    private final LikeRepository likeRepository;
    private final ProjectEngagementRepository engagementRepository;
    private final UserRepository userRepository;
    private final ResilienceConfig resilience;

    public Mono<List<ProjectResponse>> enrich(List<Project> projects, long viewerId) {
        if (projects.isEmpty()) {
            return Mono.just(List.of());
        }

        Long[] ids = projects.stream().map(Project::getId).toArray(Long[]::new);
        Set<Long> authorIds = projects.stream()
                .map(Project::getAuthorId)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());

        return Mono.zip(
                batchFetchTags(ids),
                toCountMap(likeRepository.countByTargets(LikeTarget.Type.PROJECT, ids)),
                toCountMap(engagementRepository.countComments(ids)),
                viewerSet(viewerId, () -> likeRepository.findLikedTargetIds(viewerId, LikeTarget.Type.PROJECT, ids)),
                viewerSet(viewerId, () -> engagementRepository.findBookmarkedProjectIds(viewerId, ids)),
                batchFetchAuthors(authorIds)
        ).map(tuple -> {
            Map<Long, List<String>> tags = tuple.getT1();
            Map<Long, Long> likes = tuple.getT2();
            Map<Long, Long> comments = tuple.getT3();
            Set<Long> liked = tuple.getT4();
            Set<Long> bookmarked = tuple.getT5();
            Map<Long, User> authors = tuple.getT6();

            List<ProjectResponse> responses = new ArrayList<>(projects.size());
            for (Project project : projects) {
                User author = project.getAuthorId() != null ? authors.get(project.getAuthorId()) : null;
                ProjectResponse response = mapToResponse(project, author);
                response.setTags(tags.getOrDefault(project.getId(), List.of()));
                response.setLikesCount(likes.getOrDefault(project.getId(), 0L));
                response.setCommentsCount(comments.getOrDefault(project.getId(), 0L));
                response.setIsLiked(liked.contains(project.getId()));
                response.setIsBookmarked(bookmarked.contains(project.getId()));
                responses.add(response);
            }
            return responses;
        }).timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ProjectResponse> enrichOne(Project project, long viewerId) {
        return enrich(List.of(project), viewerId).map(responses -> responses.get(0));
    }

    public static ProjectResponse.AuthorInfo authorInfo(User user) {
        if (user == null) {
            return null;
        }
        return ProjectResponse.AuthorInfo.builder()
                .id(user.getId())
                .username(user.getUsername())
                .avatarUrl(user.getAvatarUrl())
                .build();
    }

    private ProjectResponse mapToResponse(Project project, User author) {
        return ProjectResponse.builder()
                .id(project.getId())
                .title(project.getTitle())
                .description(project.getDescription())
                .longDescription(project.getLongDescription())
                .projectUrl(project.getProjectUrl())
                .imageUrl(project.getImageUrl())
                .vibeCodingTool(project.getVibeCodingTool())
                .author(authorInfo(author))
                .viewsCount(project.getViewsCount())
                .sharesCount(project.getSharesCount())
                .featured(project.getFeatured())
                .isPrivate(project.getIsPrivate())
                .createdAt(DateTimes.toInstant(project.getCreatedAt()))
                .updatedAt(DateTimes.toInstant(project.getUpdatedAt()))
                .build();
    }

    private Mono<Map<Long, List<String>>> batchFetchTags(Long[] ids) {
        return projectTagRepository.findTagNames(ids)
                .collect(HashMap::new, (Map<Long, List<String>> map, TagLink link) ->
                        map.computeIfAbsent(link.projectId(), k -> new ArrayList<>())
                                .add(TagNames.canonical(link.tagName())));
    }

    private Mono<Map<Long, User>> batchFetchAuthors(Set<Long> authorIds) {
        if (authorIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        return userRepository.findAllById(authorIds).collectMap(User::getId);
    }

    private static Mono<Map<Long, Long>> toCountMap(Flux<IdCount> counts) {
        return counts.collectMap(IdCount::id, IdCount::count);
    }

    // anonymous viewers have liked and bookmarked nothing
    private static Mono<Set<Long>> viewerSet(long viewerId, Supplier<Flux<Long>> ids) {
        if (viewerId == Viewer.ANONYMOUS_ID) {
            return Mono.just(Set.of());
        }
        return ids.get().collect(Collectors.toCollection(HashSet::new));
    }
}
