package com.docloom.git;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code git} with terminal prompts disabled and a per-command timeout. Never throws; the
 * returned {@link GitCommandResult} says how the process ended.
 */
public class GitCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final Duration timeout;
    private final ProcessStarter processStarter;

    public GitCommandRunner(Duration timeout) {
        this(timeout, GitCommandRunner::startGit);
    }

    GitCommandRunner(Duration timeout, ProcessStarter processStarter) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("git timeout must be positive");
        }
        this.timeout = timeout;
        this.processStarter = processStarter;
    }

    public GitCommandResult run(String... arguments) {
        List<String> args = List.of(arguments);
        Process process;
        try {
            process = processStarter.start(args);
        } catch (IOException e) {
            return GitCommandResult.notStarted(args, String.valueOf(e.getMessage()));
        }

        OutputCollector stdout = OutputCollector.collect(process.getInputStream(), "git-stdout");
        OutputCollector stderr = OutputCollector.collect(process.getErrorStream(), "git-stderr");
        try {
            if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return GitCommandResult.exited(args, process.exitValue(), stdout.text(), stderr.text());
            }
            process.destroyForcibly();
            log.warn("git {} did not finish within {} ms", args.isEmpty() ? "" : args.get(0), timeout.toMillis());
            return GitCommandResult.timedOut(args, stderr.text());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return GitCommandResult.interrupted(args);
        }
    }

    private static Process startGit(List<String> arguments) throws IOException {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add("git");
        command.addAll(arguments);
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");
        return builder.start();
    }

    @FunctionalInterface
    interface ProcessStarter {
        Process start(List<String> arguments) throws IOException;
    }

    private static final class OutputCollector extends Thread {
        private final InputStream source;
        private final ByteArrayOutputStream sink = new ByteArrayOutputStream();
        private IOException failure;

        private OutputCollector(InputStream source, String name) {
            super(name);
            this.source = source;
            setDaemon(true);
        }

        static OutputCollector collect(InputStream source, String name) {
            OutputCollector collector = new OutputCollector(source, name);
            collector.start();
            return collector;
        }

        @Override
        public void run() {
            try (InputStream in = source) {
                in.transferTo(sink);
            } catch (IOException e) {
                failure = e;
            }
        }

        String text() throws InterruptedException {
            join();
            if (failure != null) {
                log.warn("Could not read {}: {}", getName(), failure.getMessage());
            }
            return sink.toString(StandardCharsets.UTF_8).strip();
        }
    }
}
