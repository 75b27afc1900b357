package com.braid.workspace;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Prepares a fresh worktree so an agent session started inside it resolves to the
 * same project as the main checkout.
 *
 * <ul>
 *   <li>copies the project configuration file, adding {@code parent_project_path}</li>
 *   <li>registers Braid in the provider's settings file ({@code .<provider>/settings.json})</li>
 * </ul>
 * Any I/O failure is thrown so the caller can roll the worktree back.
 */
public class WorkspaceInitializer {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceInitializer.class);

    /** Providers that read project-level settings files; codex is configured through its environment. */
    static final Set<String> HOOK_PROVIDERS = Set.of("claude", "gemini", "antigravity");

    private final Path repoPath;
    private final String projectConfigFile;
    private final ObjectMapper objectMapper;

    public WorkspaceInitializer(Path repoPath, String projectConfigFile, ObjectMapper objectMapper) {
        this.repoPath = repoPath;
        this.projectConfigFile = projectConfigFile;
        this.objectMapper = objectMapper;
    }

    public void initialize(Path worktreePath, String provider) throws IOException {
        copyProjectConfig(worktreePath);
        installProviderHooks(worktreePath, provider);
    }

    void copyProjectConfig(Path worktreePath) throws IOException {
        Path source = repoPath.resolve(projectConfigFile);
        if (!Files.isRegularFile(source)) {
            log.debug("No project config at {}; nothing to copy", source);
            return;
        }
        Path target = worktreePath.resolve(projectConfigFile);
        if (Files.exists(target)) {
            return;
        }

        var tree = objectMapper.readTree(source.toFile());
        ObjectNode config = tree instanceof ObjectNode node ? node : objectMapper.createObjectNode();
        config.put("parent_project_path", repoPath.toAbsolutePath().normalize().toString());

        Files.createDirectories(target.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), config);
        log.info("Created {} in worktree with parent reference", projectConfigFile);
    }

    /**
     * @return true when a settings file was written
     */
    boolean installProviderHooks(Path worktreePath, String provider) throws IOException {
        if (provider == null || !HOOK_PROVIDERS.contains(provider.toLowerCase(Locale.ROOT))) {
            return false;
        }
        Path settings = worktreePath.resolve("." + provider.toLowerCase(Locale.ROOT)).resolve("settings.json");

        ObjectNode root = Files.isRegularFile(settings) && objectMapper.readTree(settings.toFile()) instanceof ObjectNode existing
                ? existing
                : objectMapper.createObjectNode();
        ObjectNode braid = root.putObject("braid");
        braid.put("parent_project_path", repoPath.toAbsolutePath().normalize().toString());
        braid.put("installed_at", Instant.now().toString());

        Files.createDirectories(settings.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(settings.toFile(), root);
        log.info("Installed {} hooks in worktree {}", provider, worktreePath);
        return true;
    }
}
