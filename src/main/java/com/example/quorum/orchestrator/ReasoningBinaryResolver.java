package com.example.quorum.orchestrator;

import com.example.quorum.config.QuorumConfigurationException;
import com.example.quorum.config.QuorumProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves the reasoning binary once, at startup. A configured path wins;
 * a blank one triggers {@link ReasoningBinaryDiscovery}. With fail-fast on, an
 * unresolvable binary stops the application.
 */
@Slf4j
@Component
public class ReasoningBinaryResolver {

    private final Optional<String> binary;

    @Autowired
    public ReasoningBinaryResolver(QuorumProperties properties) {
        this(properties.getReasoning(), ReasoningBinaryDiscovery.fromSystem());
    }

    ReasoningBinaryResolver(QuorumProperties.ReasoningConfig cfg, ReasoningBinaryDiscovery discovery) {
        Optional<Path> resolved;
        if (cfg.getBinaryPath() != null && !cfg.getBinaryPath().isBlank()) {
            resolved = Optional.of(Path.of(cfg.getBinaryPath().trim()));
        } else {
            resolved = discovery.discover();
        }

        boolean usable = resolved.isPresent() && Files.isExecutable(resolved.get());
        if (!usable) {
            String detail = resolved.map(p -> p + " is not executable")
                    .orElse("no binary found (set quorum.reasoning.binary-path)");
            if (cfg.isFailFast()) {
                throw new QuorumConfigurationException("Reasoning binary unavailable: " + detail);
            }
            log.warn("Reasoning binary unavailable ({}); chat requests will return a fallback message", detail);
        } else {
            log.info("Reasoning binary: {}", resolved.get());
        }
        this.binary = usable ? resolved.map(Path::toString) : Optional.empty();
    }

    public Optional<String> binary() {
        return binary;
    }

    public boolean isAvailable() {
        return binary.isPresent();
    }
}
