package com.example.quorum.orchestrator;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Finds the reasoning binary when no path is configured: environment
 * variable, common install locations, nvm-managed node versions (newest
 * first), then PATH.
 */
@Slf4j
public class ReasoningBinaryDiscovery {

    public static final String BINARY_NAME = "openclaw";
    public static final List<String> ENV_VARIABLES = List.of("QUORUM_REASONING_BINARY", "OPENCLAW_PATH");
    static final List<String> COMMON_LOCATIONS = List.of(
            "/usr/bin/openclaw",
            "/usr/local/bin/openclaw",
            "/opt/homebrew/bin/openclaw");

    private final Map<String, String> env;

    public ReasoningBinaryDiscovery(Map<String, String> env) {
        this.env = env;
    }

    public static ReasoningBinaryDiscovery fromSystem() {
        return new ReasoningBinaryDiscovery(System.getenv());
    }

    public Optional<Path> discover() {
        for (String variable : ENV_VARIABLES) {
            String value = env.get(variable);
            if (value != null && !value.isBlank()) {
                log.info("Reasoning binary from ${}: {}", variable, value);
                return Optional.of(Path.of(value));
            }
        }
        for (String location : COMMON_LOCATIONS) {
            Path candidate = Path.of(location);
            if (Files.isExecutable(candidate)) return Optional.of(candidate);
        }
        Optional<Path> nvm = findInNvm();
        if (nvm.isPresent()) return nvm;
        return findOnPath();
    }

    Optional<Path> findInNvm() {
        String home = env.getOrDefault("HOME", System.getProperty("user.home"));
        if (home == null) return Optional.empty();
        Path versions = Path.of(home, ".nvm", "versions", "node");
        if (!Files.isDirectory(versions)) return Optional.empty();
        try (Stream<Path> dirs = Files.list(versions)) {
            return dirs.sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .map(dir -> dir.resolve("bin").resolve(BINARY_NAME))
                    .filter(Files::isExecutable)
                    .findFirst();
        } catch (IOException e) {
            log.debug("Could not list nvm versions under {}: {}", versions, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<Path> findOnPath() {
        String path = env.get("PATH");
        if (path == null || path.isBlank()) return Optional.empty();
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, BINARY_NAME);
            if (Files.isExecutable(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
