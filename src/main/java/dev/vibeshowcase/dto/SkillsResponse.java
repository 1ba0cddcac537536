package dev.vibeshowcase.dto;

import java.util.List;

public record SkillsResponse(List<SkillResponse> skills) {
}
