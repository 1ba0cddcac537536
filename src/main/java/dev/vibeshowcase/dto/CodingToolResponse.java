package dev.vibeshowcase.dto;

import dev.vibeshowcase.entity.CodingTool;

public record CodingToolResponse(Long id, String name, String category, boolean isPopular) {

    public static CodingToolResponse fromEntity(CodingTool tool) {
        return new CodingToolResponse(tool.getId(), tool.getName(), tool.getCategory(),
                Boolean.TRUE.equals(tool.getPopular()));
    }
}
