package dev.vibeshowcase.dto;

import java.util.List;

public record ProfilesResponse(List<ProfileSummary> profiles) {
}
