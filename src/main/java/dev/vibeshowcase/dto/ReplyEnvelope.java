package dev.vibeshowcase.dto;

public record ReplyEnvelope(ReplyResponse reply) {
}
