/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.syntax;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Application specific tags, like {@code !Ref}, that the parser accepts.
 *
 * <p>Tags are declared as strings of a tag and an optional kind, separated
 * by a space: {@code "!Ref scalar"}, {@code "!GetAtt sequence"} or
 * {@code "!Sub mapping"}. The kind defaults to {@code scalar}. A tagged
 * scalar is always a string.
 *
 * @param kinds The kind of node each tag applies to, by tag
 */
public record CustomTags(Map<String, Kind> kinds) {
    public static final CustomTags NONE = new CustomTags(Map.of());

    private static final Logger LOGGER = Logger.getLogger(CustomTags.class.getName());

    public CustomTags {
        kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
    }

    /**
     * The kind of node a tag applies to.
     */
    public enum Kind {
        SCALAR,
        SEQUENCE,
        MAPPING
    }

    /**
     * @param declarations Tag declarations, like {@code "!Ref scalar"}.
     *  Declarations that don't parse are skipped.
     * @return The declared tags
     */
    public static CustomTags of(List<String> declarations) {
        Map<String, Kind> kinds = new LinkedHashMap<>();
        for (String declaration : declarations) {
            String[] parts = declaration.strip().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty() || parts.length > 2) {
                LOGGER.warning(() -> "Ignoring invalid custom tag '" + declaration + "'");
                continue;
            }
            Kind kind = parts.length == 1 ? Kind.SCALAR : parseKind(parts[1]);
            if (kind == null) {
                LOGGER.warning(() -> "Ignoring custom tag with unknown kind '" + declaration + "'");
                continue;
            }
            kinds.put(parts[0], kind);
        }
        return kinds.isEmpty() ? NONE : new CustomTags(kinds);
    }

    /**
     * @param tag A tag
     * @return The kind {@code tag} was declared with, or {@code null} if it
     *  wasn't declared
     */
    public Kind kindOf(String tag) {
        return kinds.get(tag);
    }

    private static Kind parseKind(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "scalar" -> Kind.SCALAR;
            case "sequence" -> Kind.SEQUENCE;
            case "mapping" -> Kind.MAPPING;
            default -> null;
        };
    }
}
