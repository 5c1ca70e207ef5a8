package com.syntaxis.generator.core;

import java.util.List;

import com.syntaxis.generator.model.TemplateAst;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a command-line generation run.
 */
@Data
@Builder
public class GenerationJobResult {
    private JobStatus status;
    private String errorMessage;

    private TemplateAst ast;

    @Builder.Default
    private List<GenerationResult> results = List.of();

    private int wordsLoaded;
    private int lexiconErrors;
    private int lexiconWarnings;

    public boolean isSuccess() {
        return status == JobStatus.SUCCESS;
    }

    public static GenerationJobResult failure(JobStatus status, String errorMessage) {
        return GenerationJobResult.builder()
                .status(status)
                .errorMessage(errorMessage)
                .build();
    }
}
