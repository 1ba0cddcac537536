package dev.vibeshowcase.dto;

import java.util.List;

public record ProjectListResponse(List<ProjectResponse> projects) {
}
