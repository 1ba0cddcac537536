package dev.vibeshowcase.dto;

import java.util.List;

public record ActivitiesResponse(List<ActivityResponse> activities) {
}
