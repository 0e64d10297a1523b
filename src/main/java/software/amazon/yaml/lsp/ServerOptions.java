/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.lsp4j.InitializeParams;
import software.amazon.yaml.lsp.language.YamlLanguageService;
import software.amazon.yaml.lsp.schema.SchemaAssociation;
import software.amazon.yaml.lsp.syntax.CustomTags;

/**
 * Settings of the server, read from the client's initialization options and
 * from {@code workspace/didChangeConfiguration}.
 *
 * <p>Settings are read either from flat keys, like {@code "yaml.validate"},
 * or from a {@code "yaml"} object holding the keys without their prefix,
 * like {@code {"yaml": {"validate": true}}}.
 */
public final class ServerOptions {
    /**
     * The {@code yaml.schemas} key that stands for the Kubernetes schema.
     */
    public static final String KUBERNETES = "kubernetes";
    public static final String DEFAULT_KUBERNETES_SCHEMA_URL = "https://raw.githubusercontent.com/garethr/"
            + "kubernetes-json-schema/master/v1.14.0-standalone-strict/all.json";
    public static final long DEFAULT_DEBOUNCE_MILLIS = 200;

    private static final String PREFIX = "yaml.";

    private final boolean validate;
    private final boolean hover;
    private final boolean completion;
    private final String indentation;
    private final boolean alphabetical;
    private final long debounceMillis;
    private final Map<String, List<String>> schemas;
    private final Map<String, List<String>> schemaStore;
    private final String kubernetesSchemaUrl;
    private final List<String> customTags;

    private ServerOptions(Builder builder) {
        this.validate = builder.validate;
        this.hover = builder.hover;
        this.completion = builder.completion;
        this.indentation = builder.indentation;
        this.alphabetical = builder.alphabetical;
        this.debounceMillis = builder.debounceMillis;
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(builder.schemas));
        this.schemaStore = Collections.unmodifiableMap(new LinkedHashMap<>(builder.schemaStore));
        this.kubernetesSchemaUrl = builder.kubernetesSchemaUrl;
        this.customTags = List.copyOf(builder.customTags);
    }

    public boolean getValidate() {
        return validate;
    }

    public boolean getHover() {
        return hover;
    }

    public boolean getCompletion() {
        return completion;
    }

    public String getIndentation() {
        return indentation;
    }

    public boolean getAlphabetical() {
        return alphabetical;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    /**
     * @return Globs of resources, by the URI of the schema they're associated
     *  with, as configured
     */
    public Map<String, List<String>> getSchemas() {
        return schemas;
    }

    /**
     * @return Globs of resources, by the URI of the schema they're associated
     *  with, from a schema catalog
     */
    public Map<String, List<String>> getSchemaStore() {
        return schemaStore;
    }

    public String getKubernetesSchemaUrl() {
        return kubernetesSchemaUrl;
    }

    /**
     * @return Declarations of application specific tags, like {@code "!Ref scalar"}
     */
    public List<String> getCustomTags() {
        return customTags;
    }

    /**
     * @param schemaUri The URI of a schema, as configured
     * @return The URI the schema is fetched from
     */
    public String resolveSchemaUri(String schemaUri) {
        if (schemaUri.trim().equalsIgnoreCase(KUBERNETES)) {
            return kubernetesSchemaUrl;
        }
        return schemaUri;
    }

    /**
     * @param resourceUri The URI of a document
     * @return Whether the document is associated with the Kubernetes schema
     */
    public boolean isKubernetes(String resourceUri) {
        for (Map.Entry<String, List<String>> entry : schemas.entrySet()) {
            if (!resolveSchemaUri(entry.getKey()).equals(kubernetesSchemaUrl)) {
                continue;
            }
            for (String glob : entry.getValue()) {
                if (SchemaAssociation.globMatches(glob, resourceUri)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return The settings of language features
     */
    public YamlLanguageService.Settings toSettings() {
        return new YamlLanguageService.Settings(validate, hover, completion, indentation, alphabetical,
                CustomTags.of(customTags));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a ServerOptions instance from the initialization options provided by the client.
     *
     * @param params The params passed directly from the client
     * @param client The language client used for reporting invalid settings
     * @return A new {@code ServerOptions} instance with parsed configuration values
     */
    public static ServerOptions fromInitializeParams(InitializeParams params, YamlLanguageClient client) {
        Object initializationOptions = params.getInitializationOptions();
        if (initializationOptions instanceof JsonObject jsonObject) {
            return fromJson(jsonObject, client);
        }
        return builder().build();
    }

    /**
     * Reads settings from a JSON object. Invalid values are reported to the
     * client, and the default is used in their place.
     *
     * @param settings The settings object
     * @param client The language client used for reporting invalid settings
     * @return A new {@code ServerOptions} instance with parsed configuration values
     */
    public static ServerOptions fromJson(JsonObject settings, YamlLanguageClient client) {
        Builder builder = builder();
        Settings reader = new Settings(settings, client);
        reader.bool("validate").ifPresent(builder::setValidate);
        reader.bool("hover").ifPresent(builder::setHover);
        reader.bool("completion").ifPresent(builder::setCompletion);
        reader.bool("completion.alphabetical").ifPresent(builder::setAlphabetical);
        reader.string("indentation").ifPresent(indentation -> {
            if (indentation.isEmpty() || !indentation.isBlank()) {
                client.error("Invalid value for 'yaml.indentation': '" + indentation
                        + "'. Must be a non-empty string of whitespace.");
            } else {
                builder.setIndentation(indentation);
            }
        });
        reader.number("validation.debounce").ifPresent(debounce -> {
            if (debounce < 0) {
                client.error("Invalid value for 'yaml.validation.debounce': " + debounce + ". Must not be negative.");
            } else {
                builder.setDebounceMillis(debounce);
            }
        });
        reader.string("kubernetesSchemaUrl").ifPresent(builder::setKubernetesSchemaUrl);
        reader.globs("schemas").ifPresent(builder::setSchemas);
        reader.globs("schemaStore").ifPresent(builder::setSchemaStore);
        reader.strings("customTags").ifPresent(builder::setCustomTags);
        return builder.build();
    }

    private record Settings(JsonObject root, YamlLanguageClient client) {
        JsonElement get(String key) {
            if (root.has(PREFIX + key)) {
                return root.get(PREFIX + key);
            }
            JsonElement yaml = root.get("yaml");
            if (yaml != null && yaml.isJsonObject() && yaml.getAsJsonObject().has(key)) {
                return yaml.getAsJsonObject().get(key);
            }
            return null;
        }

        Optional<Boolean> bool(String key) {
            JsonElement element = get(key);
            if (element == null || element.isJsonNull()) {
                return Optional.empty();
            }
            if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean()) {
                return Optional.of(element.getAsBoolean());
            }
            invalid(key, element, "a boolean");
            return Optional.empty();
        }

        Optional<String> string(String key) {
            JsonElement element = get(key);
            if (element == null || element.isJsonNull()) {
                return Optional.empty();
            }
            if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
                return Optional.of(element.getAsString());
            }
            invalid(key, element, "a string");
            return Optional.empty();
        }

        Optional<Long> number(String key) {
            JsonElement element = get(key);
            if (element == null || element.isJsonNull()) {
                return Optional.empty();
            }
            if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
                return Optional.of(element.getAsLong());
            }
            invalid(key, element, "a number");
            return Optional.empty();
        }

        Optional<List<String>> strings(String key) {
            JsonElement element = get(key);
            if (element == null || element.isJsonNull()) {
                return Optional.empty();
            }
            if (!element.isJsonArray()) {
                invalid(key, element, "an array of strings");
                return Optional.empty();
            }
            List<String> result = new ArrayList<>();
            for (JsonElement value : element.getAsJsonArray()) {
                if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                    result.add(value.getAsString());
                } else {
                    invalid(key, value, "a string");
                }
            }
            return Optional.of(result);
        }

        // A glob, or an array of globs, by schema URI
        Optional<Map<String, List<String>>> globs(String key) {
            JsonElement element = get(key);
            if (element == null || element.isJsonNull()) {
                return Optional.empty();
            }
            if (!element.isJsonObject()) {
                invalid(key, element, "an object of schema URIs to globs");
                return Optional.empty();
            }
            Map<String, List<String>> result = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                JsonElement value = entry.getValue();
                List<String> globs = new ArrayList<>();
                if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                    globs.add(value.getAsString());
                } else if (value.isJsonArray()) {
                    for (JsonElement glob : value.getAsJsonArray()) {
                        if (glob.isJsonPrimitive() && glob.getAsJsonPrimitive().isString()) {
                            globs.add(glob.getAsString());
                        }
                    }
                } else {
                    invalid(key + "." + entry.getKey(), value, "a glob or an array of globs");
                    continue;
                }
                result.put(entry.getKey(), globs);
            }
            return Optional.of(result);
        }

        private void invalid(String key, JsonElement value, String expected) {
            client.error(String.format("""
                    Invalid value for '%s%s': %s.
                    Must be %s.""", PREFIX, key, value, expected));
        }
    }

    public static final class Builder {
        private boolean validate = true;
        private boolean hover = true;
        private boolean completion = true;
        private String indentation = "  ";
        private boolean alphabetical = false;
        private long debounceMillis = DEFAULT_DEBOUNCE_MILLIS;
        private Map<String, List<String>> schemas = new LinkedHashMap<>();
        private Map<String, List<String>> schemaStore = new LinkedHashMap<>();
        private String kubernetesSchemaUrl = DEFAULT_KUBERNETES_SCHEMA_URL;
        private List<String> customTags = new ArrayList<>();

        private Builder() {
        }

        public Builder setValidate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder setHover(boolean hover) {
            this.hover = hover;
            return this;
        }

        public Builder setCompletion(boolean completion) {
            this.completion = completion;
            return this;
        }

        public Builder setIndentation(String indentation) {
            this.indentation = indentation;
            return this;
        }

        public Builder setAlphabetical(boolean alphabetical) {
            this.alphabetical = alphabetical;
            return this;
        }

        public Builder setDebounceMillis(long debounceMillis) {
            this.debounceMillis = debounceMillis;
            return this;
        }

        public Builder setSchemas(Map<String, List<String>> schemas) {
            this.schemas = new LinkedHashMap<>(schemas);
            return this;
        }

        public Builder setSchemaStore(Map<String, List<String>> schemaStore) {
            this.schemaStore = new LinkedHashMap<>(schemaStore);
            return this;
        }

        public Builder setKubernetesSchemaUrl(String kubernetesSchemaUrl) {
            this.kubernetesSchemaUrl = kubernetesSchemaUrl;
            return this;
        }

        public Builder setCustomTags(List<String> customTags) {
            this.customTags = new ArrayList<>(customTags);
            return this;
        }

        public ServerOptions build() {
            return new ServerOptions(this);
        }
    }
}
