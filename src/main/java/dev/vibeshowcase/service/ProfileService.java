package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.ActivityResponse;
import dev.vibeshowcase.dto.ProfileResponse;
import dev.vibeshowcase.dto.ProfileSummary;
import dev.vibeshowcase.dto.ProfileUpdateRequest;
import dev.vibeshowcase.dto.ProjectListResponse;
import dev.vibeshowcase.dto.ProjectResponse;
import dev.vibeshowcase.dto.SkillRequest;
import dev.vibeshowcase.dto.SkillResponse;
import dev.vibeshowcase.dto.UserResponse;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.exception.DuplicateResourceException;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.repository.ProjectRepository;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.security.Viewer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileService {

    static final int PROFILE_PROJECT_LIMIT = 100;

    static final int PROFILE_ACTIVITY_LIMIT = 10;

    static final List<String> USER_ROLES = List.of("Bolt", "Magic Patterns", "Replit AI");

    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final ProjectFilterResolver filterResolver;
    private final ProjectEnrichmentService enrichmentService;
    private final UserSkillService skillService;
    private final ActivityService activityService;
    private final ResilienceConfig resilience;

    /**
     * The member directory, ordered by username. Tag and role (coding tool) narrow the
     * list to authors of matching public projects.
     */
    public Mono<List<ProfileSummary>> listProfiles(String tag, String role) {
        return filterResolver.resolveAuthorScope(tag, role)
                .flatMapMany(scope -> {
                    if (!scope.restricted()) {
                        return userRepository.findAllOrderByUsername();
                    }
                    if (scope.isEmpty()) {
                        return Flux.<User>empty();
                    }
                    return userRepository.findAllByIdsOrderByUsername(scope.authorIds().toArray(new Long[0]));
                })
                .map(ProfileSummary::fromEntity)
                .collectList()
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ProfileResponse> getProfile(String username, Viewer viewer) {
        return userRepository.findByUsernameIgnoreCase(username.trim())
                .switchIfEmpty(Mono.error(ResourceNotFoundException::user))
                .flatMap(user -> toProfile(user, viewer))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ProfileResponse> getOwnProfile(Viewer viewer) {
        return requireUser(viewer)
                .flatMap(user -> toProfile(user, viewer))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<UserResponse> updateProfile(ProfileUpdateRequest request, Viewer viewer) {
        return requireUser(viewer)
                .flatMap(user -> {
                    if (request.bio() != null) {
                        user.setBio(request.bio().trim());
                    }
                    if (!StringUtils.hasText(request.email())) {
                        return userRepository.save(user);
                    }
                    String email = request.email().trim().toLowerCase(Locale.ROOT);
                    return userRepository.findByEmailIgnoreCase(email)
                            .filter(other -> !other.getId().equals(user.getId()))
                            .flatMap(other -> Mono.<User>error(new DuplicateResourceException("error.email_taken")))
                            .switchIfEmpty(Mono.defer(() -> {
                                user.setEmail(email);
                                return userRepository.save(user);
                            }));
                })
                .map(UserResponse::fromEntity)
                .doOnSuccess(updated -> log.info("Profile updated for user {}", viewer.id()))
                .timeout(resilience.getDatabaseTimeout());
    }

    public Mono<ProjectListResponse> getLikedProjects(Viewer viewer) {
        return projectRepository.findLikedBy(viewer.id())
                .collectList()
                .flatMap(projects -> enrichmentService.enrich(projects, viewer.id()))
                .map(ProjectListResponse::new)
                .timeout(resilience.getDatabaseTimeout());
    }

    // ==================== SKILLS AND ACTIVITY ====================

    public Mono<List<SkillResponse>> getOwnSkills(Viewer viewer) {
        return viewer.isAnonymous() ? Mono.just(List.of()) : skillService.getSkills(viewer.id());
    }

    public Mono<SkillResponse> addSkill(SkillRequest request, Viewer viewer) {
        return skillService.addSkill(request, viewer);
    }

    public Mono<Void> removeSkill(long skillId, Viewer viewer) {
        return skillService.removeSkill(skillId, viewer);
    }

    public Mono<List<String>> getSkillCategories(Viewer viewer) {
        return skillService.getCategories(viewer.id());
    }

    public Mono<List<ActivityResponse>> getOwnActivities(int limit, Viewer viewer) {
        return viewer.isAnonymous() ? Mono.just(List.of()) : activityService.getActivities(viewer.id(), limit, viewer);
    }

    public List<String> getUserRoles() {
        return USER_ROLES;
    }

    private Mono<User> requireUser(Viewer viewer) {
        return userRepository.findById(viewer.id())
                .switchIfEmpty(Mono.error(ResourceNotFoundException::user));
    }

    // email is shown to the user themselves and to admins only
    private Mono<ProfileResponse> toProfile(User user, Viewer viewer) {
        UserResponse userResponse = viewer.admin() || user.getId() == viewer.id()
                ? UserResponse.fromEntity(user)
                : UserResponse.publicView(user);
        Mono<List<ProjectResponse>> projects = projectRepository
                .findByAuthorVisibleTo(user.getId(), viewer.id(), PROFILE_PROJECT_LIMIT)
                .collectList()
                .flatMap(rows -> enrichmentService.enrich(rows, viewer.id()));
        return Mono.zip(projects,
                        skillService.getSkills(user.getId()),
                        activityService.getActivities(user.getId(), PROFILE_ACTIVITY_LIMIT, viewer))
                .map(tuple -> new ProfileResponse(userResponse, tuple.getT1(), tuple.getT2(), tuple.getT3()));
    }
}
