package com.docqa.rag.controller;

import com.docqa.rag.config.DocQaProperties;
import com.docqa.rag.dto.LearningGoalRequest;
import com.docqa.rag.dto.LearningPathRequest;
import com.docqa.rag.dto.LearningPathResponse;
import com.docqa.rag.learning.LearningPath;
import com.docqa.rag.learning.LearningPathOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Learning paths", description = "Generate week-by-week study plans")
@CrossOrigin(origins = "*")
public class LearningPathController {

    private final LearningPathOrchestrator orchestrator;
    private final DocQaProperties properties;

    @PostMapping("/learning-path")
    @Operation(summary = "Generate a week-by-week learning path for one or more goals")
    public LearningPathResponse learningPath(@Valid @RequestBody LearningPathRequest request) {
        int weeks = request.durationWeeks() != null
                ? request.durationWeeks()
                : properties.getLearningPath().getDefaultDurationWeeks();
        List<String> preference = request.provider() == null || request.provider().isBlank()
                ? List.of()
                : List.of(request.provider());
        log.debug("Learning path requested: {} goal(s), {} weeks", request.goals().size(), weeks);

        LearningPath path = orchestrator.generate(
                request.goals().stream().map(LearningGoalRequest::toGoal).toList(),
                request.background(), weeks, preference);
        return LearningPathResponse.from(path);
    }
}
