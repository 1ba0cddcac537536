package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.entity.Tag;
import dev.vibeshowcase.repository.CodingToolRepository;
import dev.vibeshowcase.repository.ProjectTagRepository;
import dev.vibeshowcase.repository.TagCount;
import dev.vibeshowcase.repository.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TagServiceTest {

    @Mock
    private TagRepository tagRepository;

    @Mock
    private ProjectTagRepository projectTagRepository;

    @Mock
    private CodingToolRepository codingToolRepository;

    @Mock
    private IdService idService;

    private TagService tagService;

    @BeforeEach
    void setUp() {
        tagService = new TagService(tagRepository, projectTagRepository, codingToolRepository, idService,
                new ResilienceConfig(10, 30));
    }

    private static Tag tag(long id, String name) {
        return Tag.builder().id(id).name(name).newRecord(false).build();
    }

    @Test
    @DisplayName("Should list canonical tag names once each")
    void shouldListCanonicalNames() {
        when(tagRepository.findAllOrderByName()).thenReturn(Flux.just(
                tag(1L, "ai tools"), tag(2L, "AI Tools"), tag(3L, "art"), tag(4L, "zeta")));

        StepVerifier.create(tagService.getAllTags())
                .assertNext(names -> assertThat(names).containsExactly("AI Tools", "Art", "zeta"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report popular tags in canonical casing")
    void shouldReportPopularTags() {
        when(projectTagRepository.findPopular(2)).thenReturn(Flux.just(
                new TagCount("productivity", 9L), new TagCount("My Tag", 4L)));

        StepVerifier.create(tagService.getPopularTags(2))
                .assertNext(tags -> {
                    assertThat(tags).extracting(t -> t.name()).containsExactly("Productivity", "My Tag");
                    assertThat(tags.get(0).count()).isEqualTo(9L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should reuse existing tags and create missing ones")
    void shouldAttachTags() {
        when(tagRepository.findByNameIgnoreCase("Art")).thenReturn(Mono.just(tag(3L, "art")));
        when(tagRepository.findByNameIgnoreCase("shiny"))
                .thenReturn(Mono.empty())
                .thenReturn(Mono.just(tag(50L, "shiny")));
        when(idService.nextId()).thenReturn(900L, 901L, 902L);
        when(tagRepository.insertIfAbsent(anyLong(), eq("shiny"))).thenReturn(Mono.just(1));
        when(projectTagRepository.insert(anyLong(), eq(7L), anyLong())).thenReturn(Mono.empty());

        StepVerifier.create(tagService.attachTags(7L, List.of(" art", "shiny", "ART"))).verifyComplete();

        verify(tagRepository, times(1)).insertIfAbsent(anyLong(), eq("shiny"));
        verify(tagRepository, never()).insertIfAbsent(anyLong(), eq("Art"));
        verify(projectTagRepository).insert(anyLong(), eq(7L), eq(3L));
        verify(projectTagRepository).insert(anyLong(), eq(7L), eq(50L));
    }

    @Test
    @DisplayName("Should do nothing for an empty tag list")
    void shouldSkipEmptyTags() {
        StepVerifier.create(tagService.attachTags(7L, List.of())).verifyComplete();

        verifyNoInteractions(tagRepository, projectTagRepository);
    }

    @Test
    @DisplayName("Replacing tags should drop the old links first")
    void shouldReplaceTags() {
        when(projectTagRepository.deleteByProjectId(7L)).thenReturn(Mono.empty());

        StepVerifier.create(tagService.replaceTags(7L, null)).verifyComplete();

        verify(projectTagRepository).deleteByProjectId(7L);
        verify(tagRepository, never()).findByNameIgnoreCase(anyString());
    }
}
