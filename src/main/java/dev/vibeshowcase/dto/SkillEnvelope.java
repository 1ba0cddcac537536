package dev.vibeshowcase.dto;

public record SkillEnvelope(SkillResponse skill) {
}
