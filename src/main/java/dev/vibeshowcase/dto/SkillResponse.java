package dev.vibeshowcase.dto;

import dev.vibeshowcase.entity.UserSkill;
import dev.vibeshowcase.util.DateTimes;

import java.time.Instant;

public record SkillResponse(Long id, String category, String skill, Instant createdAt) {

    public static SkillResponse fromEntity(UserSkill skill) {
        return new SkillResponse(skill.getId(), skill.getCategory(), skill.getSkill(),
                DateTimes.toInstant(skill.getCreatedAt()));
    }
}
