package dev.vibeshowcase.dto;

import java.util.List;

public record TagsResponse<T>(List<T> tags) {
}
