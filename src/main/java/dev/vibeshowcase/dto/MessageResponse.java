package dev.vibeshowcase.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of an operation without a body of its own")
public class MessageResponse {

    @Schema(description = "Response message", example = "Notification marked as read")
    private String message;

    @Schema(description = "Whether the operation was successful", example = "true")
    @Builder.Default
    private boolean success = true;

    public static MessageResponse of(String message) {
        return MessageResponse.builder().message(message).build();
    }
}
