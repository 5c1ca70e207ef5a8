package com.syntaxis.generator.core;

import lombok.Getter;

/**
 * How a generation run ended, with the process exit code reported for it.
 */
@Getter
public enum JobStatus {
    SUCCESS(0),
    INVALID_INPUT(1),
    PARSE_ERROR(2),
    GENERATION_ERROR(3);

    private final int exitCode;

    JobStatus(int exitCode) {
        this.exitCode = exitCode;
    }
}
