package com.astvisualizer.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Registry of the {@link GraphBackend}s available on the classpath.
 */
public class GraphBackends {

    private static final Logger log = LoggerFactory.getLogger(GraphBackends.class);

    private final List<GraphBackend> backends;

    public GraphBackends(List<GraphBackend> backends) {
        this.backends = List.copyOf(Objects.requireNonNull(backends, "backends must not be null"));
    }

    /**
     * Discovers all backends via SPI.
     *
     * @return registry of discovered backends, in discovery order
     */
    public static GraphBackends discover() {
        List<GraphBackend> found = new ArrayList<>();
        ServiceLoader.load(GraphBackend.class).forEach(found::add);
        log.debug("Discovered {} graph backends: {}", found.size(),
            found.stream().map(GraphBackend::getId).collect(Collectors.joining(", ")));
        return new GraphBackends(found);
    }

    public List<GraphBackend> all() {
        return backends;
    }

    public Optional<GraphBackend> findById(String id) {
        return backends.stream()
            .filter(b -> b.getId().equalsIgnoreCase(id))
            .findFirst();
    }

    /**
     * Selects the backend for a format.
     *
     * <p>The preferred backend is used when it supports the format; otherwise the first
     * discovered backend that does.
     *
     * @param preferredId preferred backend id, may be null
     * @param format requested output format
     * @return selected backend
     * @throws IllegalArgumentException if no backend supports the format
     */
    public GraphBackend select(String preferredId, OutputFormat format) {
        Objects.requireNonNull(format, "format must not be null");

        if (preferredId != null) {
            Optional<GraphBackend> preferred = findById(preferredId);
            if (preferred.isEmpty()) {
                log.warn("Unknown graph backend '{}', falling back to discovery order", preferredId);
            } else if (preferred.get().supports(format)) {
                return preferred.get();
            }
        }

        return backends.stream()
            .filter(b -> b.supports(format))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "No graph backend supports format: " + format.token()));
    }
}
