package dev.vibeshowcase.dto;

public record CountResponse(long count) {
}
