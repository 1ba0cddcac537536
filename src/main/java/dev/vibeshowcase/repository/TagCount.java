package dev.vibeshowcase.repository;

public record TagCount(String name, long count) {
}
