package com.brush.matching.catalog;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads catalog and override files with Jackson's YAML support.
 * Missing, unreadable or malformed files raise {@link CatalogException}.
 */
public class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ObjectMapper yamlMapper;
    private final CatalogCompiler compiler;

    public CatalogLoader() {
        this(new ObjectMapper(new YAMLFactory()), new CatalogCompiler());
    }

    public CatalogLoader(ObjectMapper yamlMapper, CatalogCompiler compiler) {
        this.yamlMapper = yamlMapper;
        this.compiler = compiler;
    }

    /**
     * Loads and compiles the brush, knot and handle catalogs.
     */
    public BrushCatalog loadCatalog(CatalogPaths paths) {
        long start = System.nanoTime();
        BrushCatalog catalog = compiler.compile(
                readMapping(paths.brushes()),
                readMapping(paths.knots()),
                readMapping(paths.handles()));
        log.info("catalog.loaded brushes={} knots={} handles={} durationMs={}",
                paths.brushes(), paths.knots(), paths.handles(),
                (System.nanoTime() - start) / 1_000_000);
        return catalog;
    }

    /**
     * Reads an optional file; a {@code null} path yields an empty mapping.
     */
    public Map<String, Object> readOptionalMapping(Path path) {
        return path == null ? Map.of() : readMapping(path);
    }

    /**
     * Reads a YAML file whose top level is a mapping. An empty file yields an
     * empty mapping.
     */
    public Map<String, Object> readMapping(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CatalogException("catalog file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode tree = yamlMapper.readTree(in);
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                return Map.of();
            }
            return YamlMaps.asMapping(yamlMapper.convertValue(tree, Object.class), path.toString());
        } catch (JacksonException e) {
            throw new CatalogException("malformed YAML in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogException("cannot read " + path + ": " + e.getMessage(), e);
        }
    }
}
