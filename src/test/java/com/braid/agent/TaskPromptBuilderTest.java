package com.braid.agent;

import com.braid.core.model.Task;
import com.braid.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskPromptBuilderTest {

    private static Task task(String description, String category, String criteria) {
        return new Task("T-42", "Add retry to uploader", description, TaskStatus.OPEN, "P", 1, "task",
                category, criteria, Instant.EPOCH, null, null, null);
    }

    @Test
    @DisplayName("Prompt contains title, id, sections and commit instruction")
    void fullPrompt() {
        String prompt = TaskPromptBuilder.build(task("Retry 3 times with backoff", "code", "Unit tests pass"));

        assertTrue(prompt.startsWith("# Task: Add retry to uploader\nTask ID: T-42\n"));
        assertTrue(prompt.contains("## Description\nRetry 3 times with backoff\n"));
        assertTrue(prompt.contains("## Category\ncode\n"));
        assertTrue(prompt.contains("## Validation Criteria\nUnit tests pass\n"));
        assertTrue(prompt.contains("## Instructions"));
        assertTrue(prompt.contains("Commit your changes with the task ID in the message: [T-42]"));
    }

    @Test
    @DisplayName("Empty optional sections are omitted")
    void minimalPrompt() {
        String prompt = TaskPromptBuilder.build(task(null, " ", null));

        assertFalse(prompt.contains("## Description"));
        assertFalse(prompt.contains("## Category"));
        assertFalse(prompt.contains("## Validation Criteria"));
        assertTrue(prompt.contains("## Instructions"));
    }
}
