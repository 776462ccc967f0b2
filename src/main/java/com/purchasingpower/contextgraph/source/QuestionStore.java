package com.purchasingpower.contextgraph.source;

import com.purchasingpower.contextgraph.model.artifact.Question;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface QuestionStore {

    List<Question> loadQuestions();

    default Optional<Instant> lastModified() {
        return Optional.empty();
    }
}
