package com.docloom.git;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Records git invocations and answers them from canned results keyed by sub-command.
 */
class RecordingRunner extends GitCommandRunner {
    final List<String> commands = new ArrayList<>();
    private final Map<String, GitCommandResult> results = new HashMap<>();
    private final Map<String, Consumer<String[]>> effects = new HashMap<>();

    RecordingRunner() {
        super(Duration.ofSeconds(1), arguments -> {
            throw new UnsupportedOperationException("process starter unused in test");
        });
    }

    RecordingRunner answer(String subCommand, GitCommandResult result) {
        results.put(subCommand, result);
        return this;
    }

    RecordingRunner onRun(String subCommand, Consumer<String[]> effect) {
        effects.put(subCommand, effect);
        return this;
    }

    static GitCommandResult ok(String stdout) {
        return GitCommandResult.exited(List.of(), 0, stdout, "");
    }

    static GitCommandResult failed(int exitCode, String stderr) {
        return GitCommandResult.exited(List.of(), exitCode, "", stderr);
    }

    @Override
    public GitCommandResult run(String... arguments) {
        commands.add("git " + String.join(" ", arguments));
        String subCommand = subCommand(arguments);
        Consumer<String[]> effect = effects.get(subCommand);
        if (effect != null) {
            effect.accept(arguments);
        }
        GitCommandResult canned = results.getOrDefault(subCommand, ok(""));
        return new GitCommandResult(List.of(arguments), canned.status(), canned.exitCode(), canned.stdout(), canned.stderr());
    }

    private static String subCommand(String[] arguments) {
        int index = arguments.length > 1 && arguments[0].equals("-C") ? 2 : 0;
        return index < arguments.length ? arguments[index] : "";
    }
}
