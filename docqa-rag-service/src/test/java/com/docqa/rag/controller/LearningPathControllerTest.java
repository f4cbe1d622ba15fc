package com.docqa.rag.controller;

import com.docqa.rag.config.DocQaProperties;
import com.docqa.rag.learning.LearningGoal;
import com.docqa.rag.learning.LearningPath;
import com.docqa.rag.learning.LearningPathOrchestrator;
import com.docqa.rag.learning.LearningStep;
import com.docqa.rag.learning.ProficiencyLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LearningPathController.class)
class LearningPathControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LearningPathOrchestrator orchestrator;

    @MockBean
    private DocQaProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.getLearningPath()).thenReturn(new DocQaProperties.LearningPathConfig());
    }

    private static LearningPath path(int weeks) {
        return new LearningPath("Python from scratch", weeks,
                List.of(new LearningStep(1, "Basics", "Variables and types", List.of("Run a script"), List.of())),
                List.of("A computer"), "ollama", true);
    }

    @Test
    @DisplayName("Should generate a learning path with snake_case fields")
    void shouldGenerateLearningPath() throws Exception {
        when(orchestrator.generate(anyList(), any(), anyInt(), anyList())).thenReturn(path(8));

        mockMvc.perform(post("/api/v1/learning-path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {
                                "goals": [
                                    {
                                        "topic": "Python Programming",
                                        "proficiency_level": "beginner",
                                        "time_commitment": "5 hours/week"
                                    }
                                ],
                                "background": "Complete beginner with no programming experience",
                                "duration_weeks": 8,
                                "provider": "ollama"
                            }
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path_title").value("Python from scratch"))
                .andExpect(jsonPath("$.total_duration_weeks").value(8))
                .andExpect(jsonPath("$.steps[0].week").value(1))
                .andExpect(jsonPath("$.steps[0].objectives[0]").value("Run a script"))
                .andExpect(jsonPath("$.prerequisites[0]").value("A computer"))
                .andExpect(jsonPath("$.provider_used").value("ollama"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LearningGoal>> goals = ArgumentCaptor.forClass(List.class);
        verify(orchestrator).generate(goals.capture(), eq("Complete beginner with no programming experience"),
                eq(8), eq(List.of("ollama")));
        assertThat(goals.getValue()).containsExactly(
                new LearningGoal("Python Programming", ProficiencyLevel.BEGINNER, "5 hours/week"));
    }

    @Test
    @DisplayName("Should use the configured default duration and no provider preference")
    void shouldApplyDefaults() throws Exception {
        when(orchestrator.generate(anyList(), any(), anyInt(), anyList())).thenReturn(path(4));

        mockMvc.perform(post("/api/v1/learning-path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"goals": [{"topic": "SQL"}]}
                            """))
                .andExpect(status().isOk());

        verify(orchestrator).generate(anyList(), isNull(), eq(4), eq(List.of()));
    }

    @Test
    @DisplayName("Should reject a request without goals")
    void shouldRejectMissingGoals() throws Exception {
        mockMvc.perform(post("/api/v1/learning-path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"goals": [], "duration_weeks": 4}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Should reject an unknown proficiency level")
    void shouldRejectUnknownLevel() throws Exception {
        mockMvc.perform(post("/api/v1/learning-path")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"goals": [{"topic": "SQL", "proficiency_level": "guru"}]}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }
}
