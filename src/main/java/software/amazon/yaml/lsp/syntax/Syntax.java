/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import software.amazon.yaml.lsp.document.LineIndex;

/**
 * Provides classes that represent the syntactic structure of a YAML file, and
 * a means to parse YAML text into those classes.
 *
 * <p>The result of a parse, {@link ParsedDocument}, holds one
 * {@link SingleDocument} per {@code ---} separated document in the text. Each
 * document has a tree of {@link Node}, which is a closed hierarchy over the
 * JSON data model: {@link Node.Obj}, {@link Node.Prop}, {@link Node.Arr},
 * {@link Node.Str}, {@link Node.Num}, {@link Node.Bool} and {@link Node.Null}.
 *
 * <p>The parser is as lenient as possible. A syntax error never aborts the
 * parse: whatever could be built before the error is kept, so consumers will
 * always have <em>something</em> to analyze while the text is being edited.
 * Trees are never mutated after they are built, and are simply discarded when
 * the text changes.
 */
public final class Syntax {
    private Syntax() {
    }

    /**
     * @param text The text to parse
     * @return The parse result
     */
    public static ParsedDocument parse(String text) {
        return parse(text, false);
    }

    /**
     * @param text The text to parse
     * @param kubernetes Whether the documents are associated with a Kubernetes schema
     * @return The parse result
     */
    public static ParsedDocument parse(String text, boolean kubernetes) {
        return parse(text, kubernetes, CustomTags.NONE);
    }

    /**
     * @param text The text to parse
     * @param kubernetes Whether the documents are associated with a Kubernetes schema
     * @param customTags The application specific tags to accept
     * @return The parse result
     */
    public static ParsedDocument parse(String text, boolean kubernetes, CustomTags customTags) {
        return YamlParser.parse(text, kubernetes, customTags);
    }

    /**
     * @param value A string
     * @return Whether {@code value} written as a plain scalar would be read
     *  back as the same string, rather than as a null, boolean or number
     */
    public static boolean isPlainString(String value) {
        return Scalars.scalar(value, true, 0, 0) instanceof Node.Str;
    }

    /**
     * A syntax error or warning.
     *
     * @param message The message of the error
     * @param start The start offset of the error
     * @param end The end offset of the error, which is never past the end of the text
     */
    public record Err(String message, int start, int end) {}

    /**
     * The result of parsing some text, which may contain multiple documents.
     *
     * @param text The text that was parsed
     * @param lineIndex The line index of {@code text}
     * @param documents The documents, in order of appearance
     */
    public record ParsedDocument(String text, LineIndex lineIndex, List<SingleDocument> documents) {
        /**
         * @param offset The offset to find the document of
         * @return The document that contains {@code offset}, or {@code null}
         *  if there isn't one
         */
        public SingleDocument documentAt(int offset) {
            for (SingleDocument document : documents) {
                if (document.start() <= offset && document.end() >= offset) {
                    return document;
                }
            }
            if (documents.size() == 1) {
                return documents.get(0);
            }
            return null;
        }

        /**
         * @param document A document of this parse
         * @return The text of {@code document}
         */
        public String textOf(SingleDocument document) {
            return text.substring(document.start(), document.end());
        }

        /**
         * @return All the syntax errors of all documents
         */
        public List<Err> errors() {
            List<Err> errors = new ArrayList<>();
            for (SingleDocument document : documents) {
                errors.addAll(document.errors());
            }
            return errors;
        }
    }

    /**
     * A single YAML document.
     *
     * @param root The root node, which is {@code null} when the document is
     *             empty or nothing could be built
     * @param errors Syntax errors, in order of appearance
     * @param warnings Syntax warnings, such as duplicate keys
     * @param isKubernetes Whether the document is associated with a Kubernetes schema
     * @param index The index of the document among its siblings
     * @param start The start offset of the document's text
     * @param end The end offset of the document's text
     */
    public record SingleDocument(
            Node root,
            List<Err> errors,
            List<Err> warnings,
            boolean isKubernetes,
            int index,
            int start,
            int end
    ) {
        /**
         * Finds the innermost node at the given offset.
         *
         * @param offset The offset to find the node at
         * @param includeRightBound Whether a node ending exactly at {@code offset}
         *                          contains it
         * @return The innermost node, or {@code null} if there isn't one
         */
        public Node nodeAt(int offset, boolean includeRightBound) {
            if (root == null) {
                return null;
            }
            return root.findAt(offset, includeRightBound);
        }
    }

    /**
     * Common type of all YAML node syntax productions.
     */
    public abstract static sealed class Node {
        int start;
        int end;
        Node parent;

        Node(int start, int end) {
            this.start = start;
            this.end = end;
        }

        public final int start() {
            return start;
        }

        public final int end() {
            return end;
        }

        public final int length() {
            return end - start;
        }

        /**
         * @return The parent of this node, or {@code null} for a root node
         */
        public final Node parent() {
            return parent;
        }

        /**
         * @return The type of the node.
         */
        public abstract Type type();

        /**
         * @return The direct children of this node, in order
         */
        public List<Node> children() {
            return Collections.emptyList();
        }

        /**
         * Applies this node to {@code consumer}, and traverses this node in
         * depth-first order.
         *
         * @param consumer Consumer to do something with each node.
         */
        public final void consume(Consumer<Node> consumer) {
            consumer.accept(this);
            for (Node child : children()) {
                child.consume(consumer);
            }
        }

        /**
         * @param offset The offset to find the node at
         * @param includeRightBound Whether a node ending exactly at {@code offset}
         *                          contains it
         * @return The innermost node within this one containing {@code offset},
         *  or {@code null} if this node doesn't contain it
         */
        public final Node findAt(int offset, boolean includeRightBound) {
            if (offset >= start && (offset < end || (includeRightBound && offset == end))) {
                for (Node child : children()) {
                    if (child.start > offset) {
                        break;
                    }
                    Node found = child.findAt(offset, includeRightBound);
                    if (found != null) {
                        return found;
                    }
                }
                return this;
            }
            return null;
        }

        /**
         * @return The path of property names and item indices from the root to
         *  this node
         */
        public final List<Object> path() {
            List<Object> path = new ArrayList<>();
            Node current = this;
            while (current.parent != null) {
                Node parentNode = current.parent;
                if (parentNode instanceof Prop prop) {
                    if (prop.value == current) {
                        path.add(prop.key.value);
                    }
                } else if (parentNode instanceof Arr arr) {
                    path.add(arr.items.indexOf(current));
                }
                current = parentNode;
            }
            Collections.reverse(path);
            return path;
        }

        public enum Type {
            Obj("object"),
            Prop("property"),
            Arr("array"),
            Str("string"),
            Num("number"),
            Bool("boolean"),
            Null("null");

            private final String jsonType;

            Type(String jsonType) {
                this.jsonType = jsonType;
            }

            /**
             * @return The JSON Schema type name of this node type
             */
            public String jsonType() {
                return jsonType;
            }
        }

        /**
         * A mapping. Properties are kept in order of appearance, including
         * duplicates.
         */
        public static final class Obj extends Node {
            final List<Prop> properties = new ArrayList<>();

            Obj(int start, int end) {
                super(start, end);
            }

            @Override
            public Type type() {
                return Type.Obj;
            }

            @Override
            public List<Node> children() {
                return Collections.unmodifiableList(properties);
            }

            public List<Prop> properties() {
                return Collections.unmodifiableList(properties);
            }

            /**
             * @param key The key of the property to find
             * @return The last property with the given key, or {@code null} if
             *  there isn't one
             */
            public Prop getProperty(String key) {
                for (int i = properties.size() - 1; i >= 0; i--) {
                    if (properties.get(i).key.value.equals(key)) {
                        return properties.get(i);
                    }
                }
                return null;
            }
        }

        /**
         * A single mapping entry. {@link #key} will definitely be present.
         * {@link #value} is a synthetic {@link Null} when the value was omitted,
         * and is only {@code null} when the value was an unsupported construct.
         */
        public static final class Prop extends Node {
            final Str key;
            Node value;

            Prop(Str key) {
                super(key.start, key.end);
                this.key = key;
            }

            @Override
            public Type type() {
                return Type.Prop;
            }

            @Override
            public List<Node> children() {
                if (value == null) {
                    return List.of(key);
                }
                return List.of(key, value);
            }

            public Str key() {
                return key;
            }

            public Node value() {
                return value;
            }
        }

        /**
         * A sequence.
         */
        public static final class Arr extends Node {
            final List<Node> items = new ArrayList<>();

            Arr(int start, int end) {
                super(start, end);
            }

            @Override
            public Type type() {
                return Type.Arr;
            }

            @Override
            public List<Node> children() {
                return Collections.unmodifiableList(items);
            }

            public List<Node> items() {
                return Collections.unmodifiableList(items);
            }
        }

        /**
         * A string value. Property keys are always strings, regardless of what
         * they looked like in the text.
         */
        public static final class Str extends Node {
            final String value;
            final boolean quoted;

            Str(int start, int end, String value, boolean quoted) {
                super(start, end);
                this.value = value;
                this.quoted = quoted;
            }

            @Override
            public Type type() {
                return Type.Str;
            }

            public String value() {
                return value;
            }

            /**
             * @return Whether the string was written as a quoted or block scalar
             */
            public boolean isQuoted() {
                return quoted;
            }
        }

        /**
         * A numeric value.
         */
        public static final class Num extends Node {
            final Number value;
            final boolean integral;

            Num(int start, int end, Number value, boolean integral) {
                super(start, end);
                this.value = value;
                this.integral = integral;
            }

            @Override
            public Type type() {
                return Type.Num;
            }

            public Number value() {
                return value;
            }

            /**
             * @return Whether the number was written without a fractional or
             *  exponent part
             */
            public boolean isIntegral() {
                return integral;
            }
        }

        /**
         * A boolean value.
         */
        public static final class Bool extends Node {
            final boolean value;

            Bool(int start, int end, boolean value) {
                super(start, end);
                this.value = value;
            }

            @Override
            public Type type() {
                return Type.Bool;
            }

            public boolean value() {
                return value;
            }
        }

        /**
         * A null value, either written in the text or substituted by the parser
         * for something that was missing.
         */
        public static final class Null extends Node {
            final boolean synthetic;

            Null(int start, int end, boolean synthetic) {
                super(start, end);
                this.synthetic = synthetic;
            }

            @Override
            public Type type() {
                return Type.Null;
            }

            /**
             * @return Whether this null was created by the parser rather than
             *  written in the text
             */
            public boolean isSynthetic() {
                return synthetic;
            }
        }
    }
}
