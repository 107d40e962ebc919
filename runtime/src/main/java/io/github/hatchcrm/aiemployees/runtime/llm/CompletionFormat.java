package io.github.hatchcrm.aiemployees.runtime.llm;

public enum CompletionFormat {
    TEXT,
    JSON_OBJECT
}
