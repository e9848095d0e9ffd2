/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.qirt.notation;

import io.github.qirt.exceptions.InvalidNotationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Ket notation loaded from a YAML file with a single {@code ket} section:
 * <pre>
 * ket:
 *   z0: "0"
 *   z1: "1"
 *   x0: "+"
 *   x1: "-"
 *   y0: "i"
 *   y1: "j"
 * </pre>
 * All six keys are required and each value must be a single character; quote the values, since
 * YAML reads a bare {@code -} as a sequence entry.
 */
public class NotationConfig {
    private static final Logger logger = LoggerFactory.getLogger(NotationConfig.class);

    /** Name of the section holding the six symbols. */
    public static final String SECTION = "ket";

    private NotationConfig() {
    }

    /**
     * Loads a notation file.
     *
     * @param file the YAML file
     * @return the table described by the file
     * @throws IOException if the file cannot be read
     * @throws InvalidNotationException if the file is not a valid notation file
     */
    public static BasisTable load(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return load(inputStream, file.toString());
        }
    }

    /**
     * Loads notation from a YAML stream.
     *
     * @param inputStream the YAML content
     * @param source a description of the source, used in error messages
     * @return the table described by the stream
     * @throws InvalidNotationException if the content is not a valid notation file
     */
    public static BasisTable load(InputStream inputStream, String source) {
        Object root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new InvalidNotationException(source + ": not valid YAML", e);
        }
        if (!(root instanceof Map)) {
            throw new InvalidNotationException(source + ": expected a '" + SECTION + "' section");
        }
        Object section = ((Map<?, ?>) root).get(SECTION);
        if (!(section instanceof Map)) {
            throw new InvalidNotationException(source + ": missing '" + SECTION + "' section");
        }
        return fromSection((Map<?, ?>) section, source);
    }

    /**
     * Builds a table from the key-value pairs of a {@code ket} section.
     *
     * @param section keys z0, z1, x0, x1, y0, y1 mapped to single characters
     * @param source a description of the source, used in error messages
     * @return the table
     * @throws InvalidNotationException on a missing or unknown key, a value that is not one
     * character, or a duplicate symbol
     */
    public static BasisTable fromSection(Map<?, ?> section, String source) {
        for (Object key : section.keySet()) {
            if (!isKnownKey(String.valueOf(key))) {
                throw new InvalidNotationException(String.format("%s: unknown key '%s', expected z0, z1, x0, x1, y0, y1", source, key));
            }
        }
        char[] symbols = new char[6];
        int n = 0;
        for (Basis basis : Basis.values()) {
            for (int bit = 0; bit < 2; bit++) {
                String key = basis.key(bit);
                Object value = section.get(key);
                if (value == null) {
                    throw new InvalidNotationException(source + ": missing key '" + key + "'");
                }
                String text = String.valueOf(value);
                if (text.length() != 1) {
                    throw new InvalidNotationException(String.format("%s: '%s' must be a single character but '%s' is given", source, key, text));
                }
                symbols[n++] = text.charAt(0);
            }
        }
        try {
            return BasisTable.of(symbols[0], symbols[1], symbols[2], symbols[3], symbols[4], symbols[5]);
        } catch (InvalidNotationException e) {
            throw new InvalidNotationException(source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a notation file, falling back to {@link BasisTable#defaults()} if it is missing,
     * unreadable or malformed.
     *
     * @param file the YAML file
     * @return the loaded table, or the defaults
     */
    public static BasisTable loadOrDefaults(Path file) {
        if (!Files.exists(file)) {
            logger.debug("No notation file at {}, using default notation", file);
            return BasisTable.defaults();
        }
        try {
            return load(file);
        } catch (IOException | InvalidNotationException e) {
            logger.warn("Ignoring notation file {}, using default notation: {}", file, e.getMessage());
            return BasisTable.defaults();
        }
    }

    /**
     * Loads a notation file (with fallback) and installs it as the process-wide table.
     *
     * @param file the YAML file
     * @return the installed table
     */
    public static BasisTable installFrom(Path file) {
        BasisTable table = loadOrDefaults(file);
        BasisTable.install(table);
        logger.debug("Installed notation {}", table);
        return table;
    }

    private static boolean isKnownKey(String key) {
        for (Basis basis : Basis.values()) {
            if (key.equals(basis.key(0)) || key.equals(basis.key(1))) {
                return true;
            }
        }
        return false;
    }
}
