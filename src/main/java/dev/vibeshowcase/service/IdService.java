package dev.vibeshowcase.service;

import dev.vibeshowcase.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Hands out ids for new rows.
 *
 * <pre>
 * Project project = Project.builder()
 *     .id(idService.nextId())
 *     .title("Prompt Studio")
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }
}
