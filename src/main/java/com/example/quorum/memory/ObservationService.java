package com.example.quorum.memory;

import com.example.quorum.domain.*;
import com.example.quorum.embedding.Fingerprints;
import com.example.quorum.repository.ObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Critique and observation store. Creation is an upsert keyed by the
 * fingerprint of (category, source agent, content): a resubmitted judgment
 * refreshes the existing row instead of adding a duplicate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationService {

    private final ObservationRepository observationRepository;
    private final MetadataJson metadataJson;

    public UpsertResult create(MemoryContext ctx, NewObservation request) {
        if (request.category() == null) {
            throw new IllegalArgumentException("Observation category is required");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("Observation content is required");
        }
        if ((request.refId() == null) != (request.refType() == null)) {
            throw new IllegalArgumentException("refId and refType must be given together");
        }
        String sourceAgent = request.sourceAgent() != null && !request.sourceAgent().isBlank()
                ? request.sourceAgent().trim() : ctx.actor();
        String fingerprint = fingerprint(request.category(), sourceAgent, request.content());
        String metadata = metadataJson.write(request.metadata());

        Optional<Observation> existing = observationRepository.findByFingerprint(fingerprint);
        if (existing.isPresent()) {
            return new UpsertResult(refresh(existing.get(), request.content(), metadata), false);
        }

        Observation observation = Observation.builder()
                .category(request.category())
                .severity(request.severity() != null ? request.severity() : ObservationSeverity.INFO)
                .status(request.status() != null ? request.status() : ObservationStatus.OPEN)
                .content(request.content())
                .sourceAgent(sourceAgent)
                .refId(request.refId())
                .refType(request.refType())
                .metadata(metadata)
                .fingerprint(fingerprint)
                .build();
        try {
            Observation saved = observationRepository.saveAndFlush(observation);
            log.info("Observation {} ({}/{}) recorded by {}", saved.getId(), saved.getCategory().value(),
                    saved.getSeverity().value(), sourceAgent);
            return new UpsertResult(saved, true);
        } catch (DataIntegrityViolationException e) {
            // another writer inserted the same fingerprint between our read and insert
            Observation winner = observationRepository.findByFingerprint(fingerprint)
                    .orElseThrow(() -> e);
            log.debug("Observation fingerprint {} inserted concurrently, updating instead", fingerprint);
            return new UpsertResult(refresh(winner, request.content(), metadata), false);
        }
    }

    public Observation get(String id) {
        return observationRepository.findById(id).orElseThrow(() -> NotFound.of("Observation", id));
    }

    public Page<Observation> list(ObservationFilter filter, int page, int size) {
        return observationRepository.findFiltered(filter.category(), filter.severity(), filter.status(),
                DocumentService.blankToNull(filter.sourceAgent()), filter.refType(),
                DocumentService.blankToNull(filter.refId()),
                PageRequest.of(Math.max(page, 0), size <= 0 ? 20 : Math.min(size, 200)));
    }

    public Observation updateStatus(MemoryContext ctx, String id, ObservationStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Observation status is required");
        }
        Observation observation = get(id);
        ObservationStatus previous = observation.getStatus();
        observation.setStatus(status);
        Observation saved = observationRepository.save(observation);
        log.info("Observation {} status {} -> {} by {}", id, previous.value(), status.value(), ctx.actor());
        return saved;
    }

    public void delete(MemoryContext ctx, String id) {
        observationRepository.delete(get(id));
        log.info("Observation {} deleted by {}", id, ctx.actor());
    }

    public static String fingerprint(ObservationCategory category, String sourceAgent, String content) {
        return Fingerprints.fingerprint(category.value(), sourceAgent, content);
    }

    private Observation refresh(Observation observation, String content, String metadata) {
        observation.setContent(content);
        observation.setMetadata(metadata);
        observation.setUpdatedAt(Instant.now());
        return observationRepository.save(observation);
    }

    public record NewObservation(ObservationCategory category, ObservationSeverity severity,
                                 ObservationStatus status, String content, String sourceAgent,
                                 String refId, ObservationRefType refType, Map<String, Object> metadata) {
    }

    public record ObservationFilter(ObservationCategory category, ObservationSeverity severity,
                                    ObservationStatus status, String sourceAgent,
                                    ObservationRefType refType, String refId) {

        public static ObservationFilter none() {
            return new ObservationFilter(null, null, null, null, null, null);
        }
    }

    /**
     * @param created false when an existing observation with the same fingerprint was refreshed
     */
    public record UpsertResult(Observation observation, boolean created) {
    }
}
