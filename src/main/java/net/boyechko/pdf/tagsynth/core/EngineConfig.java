/*
 * PDF-TagSynth - Accessibility Structure-Tree Synthesis
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.tagsynth.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.structure.RoleMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Tunables of a synthesis session, loaded from YAML. Keys left out of a file keep the defaults
 * below, which match {@code /tagsynth-defaults.yaml}.
 */
public final class EngineConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/tagsynth-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public int actual_text_limit = 100;
    public int fuzzy_prefix_length = 10;
    public int fuzzy_min_length = 3;
    public String default_role = "P";
    public List<Number> default_bbox = List.of(0, 0, 100, 20);
    public double line_merge_tolerance = 2.0;
    public double block_gap_ratio = 1.5;
    public boolean include_raw_runs = false;
    public boolean skip_blank_text = true;
    public boolean wrap_in_document = false;
    public String default_language = "en-US";

    /** Built-in defaults, without touching the classpath. */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Load an EngineConfig from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static EngineConfig fromResource(String resourcePath) {
        try (var inputStream = EngineConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (IOException e) {
            logger.error(
                    "Failed to load config from resource {}: {}", resourcePath, e.getMessage());
            throw new IllegalStateException(
                    "Failed to load config from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load default config from standard location */
    public static EngineConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public static EngineConfig fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    private static EngineConfig load(InputStream in, String source) {
        var yaml = new Yaml(new Constructor(EngineConfig.class, new LoaderOptions()));
        EngineConfig config;
        try {
            config = yaml.load(in);
        } catch (YAMLException e) {
            logger.error("Invalid config in {}: {}", source, e.getMessage());
            throw new IllegalArgumentException(
                    "Invalid config in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new EngineConfig();
        }

        var warnings = config.validate();
        if (!warnings.isEmpty()) {
            logger.warn("Config loaded from {} has {} problem(s):", source, warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
        logger.debug("Loaded config from {}", source);
        return config;
    }

    /**
     * Checks every value and replaces unusable ones with the defaults.
     *
     * @return one message per replaced value (empty if the config is usable as is)
     */
    public List<String> validate() {
        List<String> warnings = new ArrayList<>();
        EngineConfig defaults = new EngineConfig();

        if (actual_text_limit < 1) {
            warnings.add("actual_text_limit must be positive, was " + actual_text_limit);
            actual_text_limit = defaults.actual_text_limit;
        }
        if (fuzzy_prefix_length < 1) {
            warnings.add("fuzzy_prefix_length must be positive, was " + fuzzy_prefix_length);
            fuzzy_prefix_length = defaults.fuzzy_prefix_length;
        }
        if (fuzzy_min_length < 0) {
            warnings.add("fuzzy_min_length must not be negative, was " + fuzzy_min_length);
            fuzzy_min_length = defaults.fuzzy_min_length;
        }
        if (fuzzy_min_length >= fuzzy_prefix_length) {
            warnings.add(
                    "fuzzy_min_length ("
                            + fuzzy_min_length
                            + ") is not below fuzzy_prefix_length ("
                            + fuzzy_prefix_length
                            + "); prefix matching will rarely apply");
        }
        if (!RoleMap.isStandard(default_role)) {
            warnings.add("default_role '" + default_role + "' is not a standard role");
            default_role = defaults.default_role;
        }
        if (BoundingBox.fromList(default_bbox) == null) {
            warnings.add("default_bbox must hold four numbers, was " + default_bbox);
            default_bbox = defaults.default_bbox;
        }
        if (line_merge_tolerance < 0) {
            warnings.add("line_merge_tolerance must not be negative, was " + line_merge_tolerance);
            line_merge_tolerance = defaults.line_merge_tolerance;
        }
        if (block_gap_ratio <= 0) {
            warnings.add("block_gap_ratio must be positive, was " + block_gap_ratio);
            block_gap_ratio = defaults.block_gap_ratio;
        }
        if (default_language == null || default_language.isBlank()) {
            warnings.add("default_language is empty");
            default_language = defaults.default_language;
        }
        return warnings;
    }

    public BoundingBox defaultBbox() {
        BoundingBox bbox = BoundingBox.fromList(default_bbox);
        return bbox != null ? bbox : BoundingBox.PLACEHOLDER;
    }
}
