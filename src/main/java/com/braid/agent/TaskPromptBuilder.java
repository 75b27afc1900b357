package com.braid.agent;

import com.braid.core.model.Task;

/**
 * Converts a Task into the initial prompt of the agent working on it.
 * Pure function with no Spring dependencies.
 */
public final class TaskPromptBuilder {

    private TaskPromptBuilder() {}

    public static String build(Task task) {
        var sb = new StringBuilder();

        sb.append("# Task: ").append(task.title()).append("\n");
        sb.append("Task ID: ").append(task.id()).append("\n");

        appendSection(sb, "Description", task.description());
        appendSection(sb, "Category", task.category());
        appendSection(sb, "Validation Criteria", task.validationCriteria());

        sb.append("\n## Instructions\n");
        sb.append("1. Implement the task as described\n");
        sb.append("2. Write tests if applicable\n");
        sb.append("3. Commit your changes with the task ID in the message: [").append(task.id()).append("]\n");
        sb.append("4. Close the task when complete, recording the commit sha");

        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String heading, String body) {
        if (body != null && !body.isBlank()) {
            sb.append("\n## ").append(heading).append("\n").append(body).append("\n");
        }
    }
}
