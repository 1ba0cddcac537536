package dev.vibeshowcase.dto;

import java.util.List;

public record ProfileResponse(UserResponse user, List<ProjectResponse> projects, List<SkillResponse> skills,
                              List<ActivityResponse> activities) {
}
