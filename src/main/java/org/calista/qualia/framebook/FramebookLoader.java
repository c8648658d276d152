package org.calista.qualia.framebook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a framebook (plus optional overlay) from JSON.
 *
 * <p>Absent or unparsable sources are fatal ({@link FramebookException} naming the source).
 * Everything else is reported into {@link Diagnostics} by {@link Framebook#validate(Diagnostics)}.</p>
 */
public final class FramebookLoader {

    private static final Logger log = LoggerFactory.getLogger(FramebookLoader.class);

    /** Classpath location of the bundled framebook. */
    public static final String DEFAULT_RESOURCE = "framebook/framebook.json";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Diagnostics diagnostics;

    public FramebookLoader(FileIO io, Diagnostics diagnostics) {
        this(io, defaultMapper(), diagnostics);
    }

    public FramebookLoader(FileIO io, ObjectMapper mapper, Diagnostics diagnostics) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Framebook load(Path file) {
        return load(file, null);
    }

    /**
     * @param file    base framebook
     * @param overlay optional overlay, may be null
     */
    public Framebook load(Path file, Path overlay) {
        Objects.requireNonNull(file, "file");
        Framebook fb = parse(read(file), file.toString());
        if (overlay != null) {
            Framebook extra = parse(read(overlay), overlay.toString());
            fb.merge(extra);
            log.info("Framebook overlay merged: {}", overlay);
        }
        fb.validate(diagnostics);
        logLoaded(fb, file.toString());
        return fb;
    }

    public Framebook loadResource(String resource) {
        return loadResource(resource, null);
    }

    /**
     * Classpath framebook with an optional overlay file on top.
     */
    public Framebook loadResource(String resource, Path overlay) {
        Objects.requireNonNull(resource, "resource");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = FramebookLoader.class.getClassLoader();

        Framebook fb;
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new FramebookException("Framebook resource not found: " + resource);
            fb = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
        } catch (IOException e) {
            throw new FramebookException("Framebook resource unreadable: " + resource, e);
        }
        if (overlay != null) {
            fb.merge(parse(read(overlay), overlay.toString()));
            log.info("Framebook overlay merged: {}", overlay);
        }
        fb.validate(diagnostics);
        logLoaded(fb, resource);
        return fb;
    }

    /** Parses without validating; used for base files and overlays alike. */
    public Framebook parse(String json, String source) {
        if (json == null || json.isBlank()) {
            throw new FramebookException("Framebook is empty: " + source);
        }
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new FramebookException("Framebook root must be a JSON object: " + source);
            }
            Framebook fb = mapper.treeToValue(root, Framebook.class);
            return fb == null ? new Framebook() : fb;
        } catch (JsonProcessingException e) {
            throw new FramebookException("Framebook is not valid JSON: " + source, e);
        }
    }

    private String read(Path file) {
        try {
            return io.readString(file);
        } catch (NoSuchFileException e) {
            throw new FramebookException("Framebook not found: " + file, e);
        } catch (IOException e) {
            throw new FramebookException("Framebook unreadable: " + file, e);
        }
    }

    private static void logLoaded(Framebook fb, String source) {
        if (!log.isInfoEnabled()) return;
        log.info("Framebook loaded from {} (version={}, textTypes={}, processStructures={}, frames={}, topoi={}, affectDimensions={})",
                source, fb.version, fb.textTypes.size(), fb.processStructures.size(),
                fb.frames.size(), fb.topoi.size(), fb.affectDimensions.size());
    }
}
