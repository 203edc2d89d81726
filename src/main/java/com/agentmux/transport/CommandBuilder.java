package com.agentmux.transport;

import com.agentmux.core.model.SpawnOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the argument vector for a streaming agent CLI session.
 */
@Component
public class CommandBuilder {

    /**
     * @param executable agent executable
     * @param options    spawn options
     * @param maxTurns   resolved turn budget
     * @param extraArgs  already validated extra arguments, appended last
     */
    public List<String> build(String executable, SpawnOptions options, int maxTurns, List<String> extraArgs) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--print");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--input-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--permission-prompt-tool");
        command.add("stdio");

        if (options.systemPrompt() != null) {
            command.add("--system-prompt");
            command.add(options.systemPrompt());
        }
        if (options.appendSystemPrompt() != null) {
            command.add("--append-system-prompt");
            command.add(options.appendSystemPrompt());
        }
        if (!options.allowedTools().isEmpty()) {
            command.add("--allowedTools");
            command.add(String.join(",", options.allowedTools()));
        }
        if (!options.disallowedTools().isEmpty()) {
            command.add("--disallowedTools");
            command.add(String.join(",", options.disallowedTools()));
        }
        command.add("--max-turns");
        command.add(String.valueOf(maxTurns));
        if (options.model() != null) {
            command.add("--model");
            command.add(options.model());
        }
        if (options.permissionMode() != null) {
            command.add("--permission-mode");
            command.add(options.permissionMode().cliValue());
        }
        for (String dir : options.addDirs()) {
            command.add("--add-dir");
            command.add(dir);
        }
        // Isolate the session from user and project settings files
        command.add("--setting-sources");
        command.add("");

        command.addAll(extraArgs);
        return command;
    }
}
