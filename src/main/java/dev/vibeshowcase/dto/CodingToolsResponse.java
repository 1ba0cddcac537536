package dev.vibeshowcase.dto;

import java.util.List;

public record CodingToolsResponse(List<CodingToolResponse> tools) {
}
