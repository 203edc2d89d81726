package com.agentmux.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Launch options for a new agent session. Every field is optional; collections are never null.
 *
 * @param maxTurns           turn budget, defaulted by the registry when null
 * @param allowedTools       tools the agent may use without asking; empty means no restriction
 * @param disallowedTools    tools the agent may never use
 * @param workingDirectory   directory the agent starts in
 * @param env                environment overrides, checked against the environment policy
 * @param permissionMode     permission handling mode
 * @param model              model override
 * @param systemPrompt       replaces the agent's system prompt
 * @param appendSystemPrompt appended to the agent's system prompt
 * @param addDirs            extra directories the agent may access
 * @param extraArgs          additional CLI flags (name without dashes to value), checked against the allowlist
 * @param label              display label; sessions are named {@code label-N}
 * @param workerCount        number of identical sessions to spawn
 */
public record SpawnOptions(
        @JsonProperty("max_turns") Integer maxTurns,
        @JsonProperty("allowed_tools") List<String> allowedTools,
        @JsonProperty("disallowed_tools") List<String> disallowedTools,
        @JsonProperty("working_directory") String workingDirectory,
        Map<String, String> env,
        @JsonProperty("permission_mode") PermissionMode permissionMode,
        String model,
        @JsonProperty("system_prompt") String systemPrompt,
        @JsonProperty("append_system_prompt") String appendSystemPrompt,
        @JsonProperty("add_dirs") List<String> addDirs,
        @JsonProperty("extra_args") Map<String, String> extraArgs,
        String label,
        @JsonProperty("worker_count") Integer workerCount
) {

    public SpawnOptions {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
        env = env == null ? Map.of() : Map.copyOf(env);
        addDirs = addDirs == null ? List.of() : List.copyOf(addDirs);
        // Null values allowed: a flag passed alone
        extraArgs = extraArgs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraArgs));
    }

    public static SpawnOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer maxTurns;
        private final List<String> allowedTools = new ArrayList<>();
        private final List<String> disallowedTools = new ArrayList<>();
        private String workingDirectory;
        private final Map<String, String> env = new LinkedHashMap<>();
        private PermissionMode permissionMode;
        private String model;
        private String systemPrompt;
        private String appendSystemPrompt;
        private final List<String> addDirs = new ArrayList<>();
        private final Map<String, String> extraArgs = new LinkedHashMap<>();
        private String label;
        private Integer workerCount;

        private Builder() {}

        public Builder maxTurns(int maxTurns) { this.maxTurns = maxTurns; return this; }
        public Builder allowedTools(String... tools) { this.allowedTools.addAll(List.of(tools)); return this; }
        public Builder disallowedTools(String... tools) { this.disallowedTools.addAll(List.of(tools)); return this; }
        public Builder workingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; return this; }
        public Builder env(String name, String value) { this.env.put(name, value); return this; }
        public Builder permissionMode(PermissionMode permissionMode) { this.permissionMode = permissionMode; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder systemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; return this; }
        public Builder appendSystemPrompt(String appendSystemPrompt) { this.appendSystemPrompt = appendSystemPrompt; return this; }
        public Builder addDir(String dir) { this.addDirs.add(dir); return this; }
        public Builder extraArg(String flag, String value) { this.extraArgs.put(flag, value); return this; }
        public Builder label(String label) { this.label = label; return this; }
        public Builder workerCount(int workerCount) { this.workerCount = workerCount; return this; }

        public SpawnOptions build() {
            return new SpawnOptions(maxTurns, allowedTools, disallowedTools, workingDirectory, env,
                    permissionMode, model, systemPrompt, appendSystemPrompt, addDirs, extraArgs,
                    label, workerCount);
        }
    }
}
