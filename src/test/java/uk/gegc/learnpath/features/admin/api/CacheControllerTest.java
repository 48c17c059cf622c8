package uk.gegc.learnpath.features.admin.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.learnpath.shared.cache.CacheStats;
import uk.gegc.learnpath.shared.cache.TtlCache;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CacheController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("CacheController")
class CacheControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TtlCache cache;

    @Test
    @DisplayName("GET returns size and keys")
    void stats() throws Exception {
        when(cache.stats()).thenReturn(new CacheStats(2, List.of("course_1", "stats")));

        mockMvc.perform(get("/api/v1/admin/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(2))
                .andExpect(jsonPath("$.keys[1]").value("stats"));
    }

    @Test
    @DisplayName("DELETE with a pattern removes matching keys only")
    void invalidatePattern() throws Exception {
        when(cache.invalidate("course_")).thenReturn(3);

        mockMvc.perform(delete("/api/v1/admin/cache").param("pattern", "course_"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(3));

        verify(cache, never()).invalidate();
    }

    @Test
    @DisplayName("DELETE without a pattern clears everything")
    void invalidateAll() throws Exception {
        when(cache.invalidate()).thenReturn(9);

        mockMvc.perform(delete("/api/v1/admin/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(9));
    }
}
