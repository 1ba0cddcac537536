package dev.vibeshowcase.controller;

import dev.vibeshowcase.dto.CodingToolsResponse;
import dev.vibeshowcase.dto.PageParams;
import dev.vibeshowcase.dto.PopularTagResponse;
import dev.vibeshowcase.dto.TagsResponse;
import dev.vibeshowcase.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Tags", description = "Tags and coding tools")
public class TagController {

    static final int DEFAULT_POPULAR_TAGS = 5;
    static final int DEFAULT_POPULAR_TOOLS = 10;

    private final TagService tagService;

    @GetMapping("/tags")
    @Operation(summary = "All tags", description = "Canonically cased, alphabetical")
    public Mono<TagsResponse<String>> getTags() {
        return tagService.getAllTags().map(TagsResponse::new);
    }

    @GetMapping("/tags/popular")
    @Operation(summary = "Popular tags", description = "Tags by number of projects")
    public Mono<TagsResponse<PopularTagResponse>> getPopularTags(@RequestParam(required = false) String limit) {
        int size = PageParams.parse(null, limit, DEFAULT_POPULAR_TAGS).limit();
        return tagService.getPopularTags(size).map(TagsResponse::new);
    }

    @GetMapping("/coding-tools")
    @Operation(summary = "Coding tools")
    public Mono<CodingToolsResponse> getCodingTools() {
        return tagService.getCodingTools().map(CodingToolsResponse::new);
    }

    @GetMapping("/coding-tools/popular")
    @Operation(summary = "Popular coding tools")
    public Mono<CodingToolsResponse> getPopularCodingTools(@RequestParam(required = false) String limit) {
        int size = PageParams.parse(null, limit, DEFAULT_POPULAR_TOOLS).limit();
        return tagService.getPopularCodingTools(size).map(CodingToolsResponse::new);
    }
}
