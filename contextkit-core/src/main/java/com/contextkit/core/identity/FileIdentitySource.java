package com.contextkit.core.identity;

import com.contextkit.core.source.IdentitySource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity layer backed by {@code identity.json} and {@code system_prompt.txt}
 * in a config directory.
 *
 * <p>{@link #reload()} swaps the whole identity at once; readers never see a
 * half-loaded state. File modification times are recorded on each successful
 * load so {@link #hasChanged()} can drive hot reload.
 */
@Slf4j
public class FileIdentitySource implements IdentitySource {

    public static final String IDENTITY_FILE = "identity.json";
    public static final String SYSTEM_PROMPT_FILE = "system_prompt.txt";

    static final String HEADER = "{Layer 1: Identity}";
    static final String NOT_INITIALIZED = HEADER + "\n[Not initialized]";

    private final Path configDir;
    private final ObjectMapper objectMapper;

    private volatile LoadedIdentity current;

    public FileIdentitySource(Path configDir, ObjectMapper objectMapper) {
        this.configDir = configDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getContext() {
        LoadedIdentity identity = current;
        return identity == null ? NOT_INITIALIZED : identity.context();
    }

    public boolean isLoaded() {
        return current != null;
    }

    /**
     * Whether the loaded identity.json asks for hot reload. False until loaded.
     */
    public boolean isHotReloadEnabled() {
        LoadedIdentity identity = current;
        return identity != null && identity.hotReload();
    }

    public UserProfile getUserProfile() {
        LoadedIdentity identity = current;
        return identity == null ? null : identity.userProfile();
    }

    /**
     * Read both files and replace the active identity.
     *
     * @throws IdentityLoadException if a file is missing or malformed
     */
    public void reload() {
        Path identityFile = configDir.resolve(IDENTITY_FILE);
        Path promptFile = configDir.resolve(SYSTEM_PROMPT_FILE);

        if (!Files.isRegularFile(identityFile)) {
            throw new IdentityLoadException("Identity file not found: " + identityFile);
        }
        if (!Files.isRegularFile(promptFile)) {
            throw new IdentityLoadException("System prompt file not found: " + promptFile);
        }

        try {
            FileTime identityModified = Files.getLastModifiedTime(identityFile);
            FileTime promptModified = Files.getLastModifiedTime(promptFile);

            JsonNode root = objectMapper.readTree(identityFile.toFile());
            if (root == null || !root.isObject()) {
                throw new IdentityLoadException("Identity file is not a JSON object: " + identityFile);
            }
            String systemPrompt = Files.readString(promptFile, StandardCharsets.UTF_8).strip();

            UserProfile profile = parseUserProfile(root.path("user_profile"));
            String petName = root.path("pet_identity").path("name").asText("");
            boolean hotReload = root.path("hot_reload").path("enabled").asBoolean(true);

            current = new LoadedIdentity(
                render(petName, systemPrompt, profile),
                profile,
                hotReload,
                identityModified,
                promptModified);

            log.info("[IDENTITY] Identity loaded | configDir={} | character={} | nickname={} | hotReload={}",
                configDir, petName, profile.getNickname(), hotReload);
        } catch (IOException e) {
            throw new IdentityLoadException("Failed to read identity files in " + configDir, e);
        }
    }

    /**
     * True when either file's modification time differs from the last successful load.
     * A file that disappears counts as a change; the next reload reports it.
     */
    public boolean hasChanged() {
        LoadedIdentity identity = current;
        if (identity == null) {
            return true;
        }
        return !identity.identityModified().equals(modifiedTime(configDir.resolve(IDENTITY_FILE)))
            || !identity.promptModified().equals(modifiedTime(configDir.resolve(SYSTEM_PROMPT_FILE)));
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(-1);
        }
    }

    private static UserProfile parseUserProfile(JsonNode node) {
        List<String> facts = new ArrayList<>();
        for (JsonNode fact : node.path("custom_facts")) {
            String text = fact.asText("").strip();
            if (!text.isEmpty()) {
                facts.add(text);
            }
        }

        return UserProfile.builder()
            .nickname(node.path("nickname").asText("Master"))
            .birthday(textOrNull(node.path("birthday")))
            .relationship(node.path("relationship").asText("friend"))
            .timezone(node.path("timezone").asText("UTC"))
            .preferredLanguage(node.path("preferred_language").asText("en"))
            .customFacts(List.copyOf(facts))
            .build();
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText("").strip();
        return text.isEmpty() ? null : text;
    }

    static String render(String petName, String systemPrompt, UserProfile profile) {
        List<String> parts = new ArrayList<>();
        parts.add(HEADER);

        StringBuilder character = new StringBuilder("[Character]\n");
        if (!petName.isBlank()) {
            character.append("Name: ").append(petName).append("\n");
        }
        character.append(systemPrompt).append("\n");
        parts.add(character.toString());

        StringBuilder user = new StringBuilder("[User] Nickname: ")
            .append(profile.getNickname())
            .append(", Relationship: ")
            .append(profile.getRelationship());
        if (profile.getBirthday() != null) {
            user.append(", Birthday: ").append(profile.getBirthday());
        }
        parts.add(user.toString());

        if (!profile.getCustomFacts().isEmpty()) {
            parts.add("[Important Facts] " + String.join("; ", profile.getCustomFacts()));
        }

        return String.join("\n", parts);
    }

    private record LoadedIdentity(
            String context,
            UserProfile userProfile,
            boolean hotReload,
            FileTime identityModified,
            FileTime promptModified) {}
}
