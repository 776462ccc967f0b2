package com.purchasingpower.contextgraph.source.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import com.purchasingpower.contextgraph.model.artifact.Question;
import com.purchasingpower.contextgraph.source.QuestionStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code {"questions": [...]}} files.
 */
@Slf4j
@Component
public class JsonQuestionStore extends AbstractFileSource implements QuestionStore {

    private final Path questionsFile;

    @Autowired
    public JsonQuestionStore(ObjectMapper objectMapper, ContextGraphProperties properties) {
        this(objectMapper, Paths.get(properties.getSources().getQuestionsFile()));
    }

    public JsonQuestionStore(ObjectMapper objectMapper, Path questionsFile) {
        super(objectMapper);
        this.questionsFile = questionsFile;
    }

    @Override
    public List<Question> loadQuestions() {
        return readTree(questionsFile, "questions")
            .map(root -> toList(root.get("questions"), Question.class, "questions"))
            .orElse(List.of());
    }

    @Override
    public Optional<Instant> lastModified() {
        return lastModified(questionsFile);
    }

    @Override
    protected Logger logger() {
        return log;
    }
}
