package uk.gegc.learnpath.features.content.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.learnpath.features.content.api.dto.ContentListQuery;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeDto;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeRequest;
import uk.gegc.learnpath.features.content.application.ContentService;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.shared.exception.ConflictException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ContentController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ContentController")
class ContentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ContentService contentService;

    @Test
    @DisplayName("POST /api/v1/content/courses creates a draft and returns 201")
    void create_returnsCreated() throws Exception {
        UUID pathId = UUID.randomUUID();
        when(contentService.create(eq(ContentKind.COURSE), any(ContentNodeRequest.class)))
                .thenReturn(dto(ContentKind.COURSE, pathId, "Intro", ContentStatus.DRAFT));

        mockMvc.perform(post("/api/v1/content/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"parentId": "%s", "title": "Intro", "difficulty": "BEGINNER"}
                                """.formatted(pathId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.kind").value("COURSE"))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.content").doesNotExist());
    }

    @Test
    @DisplayName("GET list binds filters into the query")
    void list_bindsQuery() throws Exception {
        UUID moduleId = UUID.randomUUID();
        when(contentService.list(eq(ContentKind.LESSON), any(ContentListQuery.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/content/lessons")
                        .param("parentId", moduleId.toString())
                        .param("status", "PUBLISHED")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(contentService).list(eq(ContentKind.LESSON), argThat(query ->
                moduleId.equals(query.parentId())
                        && query.statuses().equals(List.of(ContentStatus.PUBLISHED))
                        && query.limit() == 5));
    }

    @Test
    @DisplayName("unknown kind segment is a 400")
    void unknownKind() throws Exception {
        mockMvc.perform(get("/api/v1/content/widgets/" + UUID.randomUUID()))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(contentService);
    }

    @Test
    @DisplayName("missing node maps to 404 problem detail")
    void get_notFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(contentService.get(ContentKind.PATH, id)).thenThrow(new ResourceNotFoundException("Path", id));

        mockMvc.perform(get("/api/v1/content/paths/" + id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("publishing under a draft parent maps to 409")
    void update_conflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(contentService.update(eq(ContentKind.MODULE), eq(id), any(ContentNodeRequest.class)))
                .thenThrow(new ConflictException("parent is DRAFT"));

        mockMvc.perform(patch("/api/v1/content/modules/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"PUBLISHED\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("negative max attempts is rejected before reaching the service")
    void create_invalidBody() throws Exception {
        mockMvc.perform(post("/api/v1/content/challenges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"x\", \"maxAttempts\": -1}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(contentService);
    }

    private static ContentNodeDto dto(ContentKind kind, UUID parentId, String title, ContentStatus status) {
        ContentNodeDto dto = new ContentNodeDto(kind, UUID.randomUUID(), parentId, title, "intro", status, 0,
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
                UUID.randomUUID(), null, null, null, null, null);
        assertThat(dto.kind()).isEqualTo(kind);
        return dto;
    }
}
