package dev.vibeshowcase.dto;

import java.util.List;

public record SkillCategoriesResponse(List<String> categories) {
}
