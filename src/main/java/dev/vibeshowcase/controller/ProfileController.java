package dev.vibeshowcase.controller;

import dev.vibeshowcase.dto.ActivitiesResponse;
import dev.vibeshowcase.dto.MessageResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.ProfileResponse;
import dev.vibeshowcase.dto.ProfileUpdateRequest;
import dev.vibeshowcase.dto.ProfilesResponse;
import dev.vibeshowcase.dto.ProjectListResponse;
import dev.vibeshowcase.dto.SkillCategoriesResponse;
import dev.vibeshowcase.dto.SkillEnvelope;
import dev.vibeshowcase.dto.SkillRequest;
import dev.vibeshowcase.dto.SkillsResponse;
import dev.vibeshowcase.dto.UserResponse;
import dev.vibeshowcase.security.CurrentViewer;
import dev.vibeshowcase.service.ProfileService;
import dev.vibeshowcase.util.PathIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
@Tag(name = "Profiles", description = "Member directory and profiles")
@Slf4j
public class ProfileController {

    static final int DEFAULT_ACTIVITY_LIMIT = 10;

    private final ProfileService profileService;
    private final CurrentViewer currentViewer;

    @GetMapping("/profiles")
    @Operation(summary = "Member directory", description = "Optionally narrowed by tag and coding tool")
    public Mono<ProfilesResponse> listProfiles(
            @RequestParam(required = false) String tag,
            @Parameter(description = "Coding tool") @RequestParam(required = false) String role) {
        return profileService.listProfiles(tag, role).map(ProfilesResponse::new);
    }

    @GetMapping({"/profile/{username}", "/profiles/{username}"})
    @Operation(summary = "Public profile", description = "User, visible projects, skills and recent activity")
    public Mono<ProfileResponse> getProfile(@PathVariable @Size(min = 1, max = 50) String username) {
        return currentViewer.get().flatMap(viewer -> profileService.getProfile(username, viewer));
    }

    @GetMapping("/profile")
    @Operation(summary = "Own profile")
    public Mono<ProfileResponse> getOwnProfile() {
        return currentViewer.require().flatMap(profileService::getOwnProfile);
    }

    @PatchMapping("/profile")
    @Operation(summary = "Update own profile")
    public Mono<UserResponse> updateProfile(@Valid @RequestBody ProfileUpdateRequest request) {
        return currentViewer.require().flatMap(viewer -> profileService.updateProfile(request, viewer));
    }

    @GetMapping("/profile/liked")
    @Operation(summary = "Projects liked by the current user")
    public Mono<ProjectListResponse> getLikedProjects() {
        return currentViewer.require().flatMap(profileService::getLikedProjects);
    }

    @GetMapping("/profile/skills")
    @Operation(summary = "Own skills", description = "Empty for anonymous callers")
    public Mono<SkillsResponse> getSkills() {
        return currentViewer.get().flatMap(profileService::getOwnSkills).map(SkillsResponse::new);
    }

    @PostMapping("/profile/skills")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Add a skill", description = "Returns the existing entry when the skill is already listed")
    public Mono<SkillEnvelope> addSkill(@Valid @RequestBody SkillRequest request) {
        return currentViewer.require()
                .flatMap(viewer -> profileService.addSkill(request, viewer))
                .map(SkillEnvelope::new);
    }

    @DeleteMapping("/profile/skills/{id}")
    @Operation(summary = "Remove a skill", description = "404 unless the skill belongs to the caller")
    public Mono<MessageResponse> removeSkill(@PathVariable String id) {
        long skillId = PathIds.parse(id);
        return currentViewer.require()
                .flatMap(viewer -> profileService.removeSkill(skillId, viewer))
                .thenReturn(MessageResponse.of("Skill removed successfully"));
    }

    @GetMapping("/profile/skill-categories")
    @Operation(summary = "Categories of the caller's skills")
    public Mono<SkillCategoriesResponse> getSkillCategories() {
        return currentViewer.require()
                .flatMap(profileService::getSkillCategories)
                .map(SkillCategoriesResponse::new);
    }

    @GetMapping("/profile/activity")
    @Operation(summary = "Own recent activity", description = "Empty for anonymous callers")
    public Mono<ActivitiesResponse> getActivity(@RequestParam(required = false) String limit) {
        int size = PageParams.parse(null, limit, DEFAULT_ACTIVITY_LIMIT).limit();
        return currentViewer.get()
                .flatMap(viewer -> profileService.getOwnActivities(size, viewer))
                .map(ActivitiesResponse::new);
    }

    @GetMapping("/user-roles")
    @Operation(summary = "Coding tools offered as member roles")
    public List<String> getUserRoles() {
        return profileService.getUserRoles();
    }
}
