/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.syntax;

import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.CollectionStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;
import software.amazon.yaml.lsp.document.LineIndex;

/**
 * Builds {@link Syntax} trees from the snakeyaml event stream.
 *
 * <p>The text is first split into units at each {@code ---} line, and each
 * unit is parsed independently, so an error in one document can't take down
 * its siblings. Within a unit, nodes are attached to their parent as soon as
 * they start, which means everything built before a syntax error survives it.
 */
final class YamlParser {
    static final String EXPECTED_ROOT = "Expected a YAML object, array or literal";
    static final String DUPLICATE_KEY = "Map keys must be unique";
    static final String UNRESOLVED_TAG = "Unresolved tag: ";

    private static final Logger LOGGER = Logger.getLogger(YamlParser.class.getName());
    private static final String INCLUDE_TAG = "!include";
    private static final String CORE_TAG_PREFIX = "tag:yaml.org,2002:";

    private YamlParser() {
    }

    static Syntax.ParsedDocument parse(String text, boolean kubernetes, CustomTags customTags) {
        LineIndex lineIndex = LineIndex.of(text);
        List<Syntax.SingleDocument> documents = new ArrayList<>();
        List<int[]> units = splitUnits(text, lineIndex);
        for (int i = 0; i < units.size(); i++) {
            int[] unit = units.get(i);
            documents.add(new UnitBuilder(text, unit[0], unit[1], customTags).build(kubernetes, i));
        }
        return new Syntax.ParsedDocument(text, lineIndex, documents);
    }

    private static List<int[]> splitUnits(String text, LineIndex lineIndex) {
        List<int[]> units = new ArrayList<>();
        int unitStart = 0;
        boolean unitHasContent = false;
        for (int line = 0; line < lineIndex.lineCount(); line++) {
            int start = lineIndex.lineStart(line);
            int end = lineIndex.lineContentEnd(line);
            String content = text.substring(start, end);
            if (isSeparator(content)) {
                // A prefix of blank lines, comments and directives belongs to the next document
                if (unitHasContent) {
                    units.add(new int[]{unitStart, start});
                    unitStart = start;
                }
                unitHasContent = hasContent(content.substring(3));
            } else if (!unitHasContent) {
                unitHasContent = hasContent(content);
            }
        }
        units.add(new int[]{unitStart, text.length()});
        return units;
    }

    private static boolean isSeparator(String line) {
        return line.startsWith("---") && (line.length() == 3 || Character.isWhitespace(line.charAt(3)));
    }

    private static boolean hasContent(String line) {
        String trimmed = line.strip();
        return !trimmed.isEmpty()
                && !trimmed.startsWith("#")
                && !trimmed.startsWith("%")
                && !trimmed.equals("---")
                && !trimmed.equals("...");
    }

    private static final class Frame {
        final Syntax.Node node;
        final String anchor;
        final boolean flow;
        final Set<String> keys = new HashSet<>();
        Syntax.Node.Prop pending;

        Frame(Syntax.Node node, String anchor, boolean flow) {
            this.node = node;
            this.anchor = anchor;
            this.flow = flow;
        }
    }

    private static final class UnitBuilder {
        private final String text;
        private final CustomTags customTags;
        private final int base;
        private final int unitEnd;
        private final String unitText;
        private final LineIndex unitIndex;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Map<String, Syntax.Node> anchors = new HashMap<>();
        private final List<Syntax.Err> errors = new ArrayList<>();
        private final List<Syntax.Err> warnings = new ArrayList<>();
        private Syntax.Node root;
        private int keyCaptureDepth;
        private int keyCaptureStart;

        UnitBuilder(String text, int base, int unitEnd, CustomTags customTags) {
            this.text = text;
            this.customTags = customTags;
            this.base = base;
            this.unitEnd = unitEnd;
            this.unitText = text.substring(base, unitEnd);
            this.unitIndex = LineIndex.of(unitText);
        }

        Syntax.SingleDocument build(boolean kubernetes, int index) {
            LoaderOptions options = new LoaderOptions();
            options.setProcessComments(false);
            Yaml yaml = new Yaml(options);
            try {
                for (Event event : yaml.parse(new StringReader(unitText))) {
                    handle(event);
                }
            } catch (MarkedYAMLException e) {
                addError(e.getProblem() != null ? e.getProblem() : e.getMessage(), e.getProblemMark());
                closeAll();
            } catch (YAMLException e) {
                addError(e.getMessage(), null);
                closeAll();
            }

            if (root instanceof Syntax.Node.Null nullRoot && nullRoot.synthetic) {
                root = null;
            }
            if (root == null && hasContent()) {
                int start = firstContentOffset();
                int line = unitIndex.lineOf(start - base);
                int end = base + unitIndex.lineContentEnd(line);
                errors.add(new Syntax.Err(EXPECTED_ROOT, start, Math.max(start, end)));
            }
            return new Syntax.SingleDocument(root, errors, warnings, kubernetes, index, base, unitEnd);
        }

        private boolean hasContent() {
            return firstContentOffset() >= 0;
        }

        private int firstContentOffset() {
            for (int line = 0; line < unitIndex.lineCount(); line++) {
                int start = unitIndex.lineStart(line);
                String content = unitText.substring(start, unitIndex.lineContentEnd(line));
                if (YamlParser.hasContent(content) || (isSeparator(content) && YamlParser.hasContent(content.substring(3)))) {
                    int leading = content.length() - content.stripLeading().length();
                    return base + start + leading;
                }
            }
            return -1;
        }

        private void handle(Event event) {
            if (keyCaptureDepth > 0) {
                captureKey(event);
                return;
            }

            if (event instanceof ScalarEvent scalar) {
                handleScalar(scalar);
            } else if (event instanceof AliasEvent alias) {
                handleAlias(alias);
            } else if (event instanceof MappingStartEvent || event instanceof SequenceStartEvent) {
                CollectionStartEvent start = (CollectionStartEvent) event;
                if (isKeyPosition()) {
                    keyCaptureDepth = 1;
                    keyCaptureStart = offset(start.getStartMark());
                    return;
                }
                int startOffset = offset(start.getStartMark());
                checkTag(start.getTag(), startOffset, event instanceof MappingStartEvent
                        ? CustomTags.Kind.MAPPING
                        : CustomTags.Kind.SEQUENCE);
                Syntax.Node node = event instanceof MappingStartEvent
                        ? new Syntax.Node.Obj(startOffset, startOffset)
                        : new Syntax.Node.Arr(startOffset, startOffset);
                attach(node);
                stack.push(new Frame(node, start.getAnchor(), start.isFlow()));
            } else if (event instanceof MappingEndEvent || event instanceof SequenceEndEvent) {
                if (!stack.isEmpty()) {
                    finish(stack.pop(), offset(event.getEndMark()));
                }
            }
        }

        private void handleScalar(ScalarEvent scalar) {
            int start = offset(scalar.getStartMark());
            int end = offset(scalar.getEndMark());
            if (INCLUDE_TAG.equals(scalar.getTag())) {
                LOGGER.fine(() -> "Skipping unsupported include at offset " + start);
                skip();
                return;
            }

            Syntax.Node node;
            if (isKeyPosition()) {
                node = new Syntax.Node.Str(start, end, scalar.getValue(), !scalar.isPlain());
            } else if (checkTag(scalar.getTag(), start, CustomTags.Kind.SCALAR)) {
                node = new Syntax.Node.Str(start, end, scalar.getValue(), !scalar.isPlain());
            } else if (scalar.isPlain() && scalar.getValue().isEmpty()) {
                Frame top = stack.peek();
                int at = top != null && top.pending != null ? top.pending.key.end : start;
                node = new Syntax.Node.Null(at, at, true);
            } else {
                node = Scalars.scalar(scalar.getValue(), scalar.isPlain(), start, end);
            }
            attach(node);
            if (scalar.getAnchor() != null) {
                anchors.put(scalar.getAnchor(), node);
            }
        }

        // Returns whether the tag is a custom tag declared for this kind of node
        private boolean checkTag(String tag, int start, CustomTags.Kind kind) {
            if (tag == null || tag.equals("!") || tag.startsWith(CORE_TAG_PREFIX)) {
                return false;
            }
            CustomTags.Kind declared = customTags.kindOf(tag);
            if (declared == kind) {
                return true;
            }
            int at = text.indexOf(tag, start);
            int line = unitIndex.lineOf(start - base);
            int lineEnd = line < 0 ? unitEnd : base + unitIndex.lineContentEnd(line);
            int end = at >= 0 && at + tag.length() <= lineEnd ? at + tag.length() : lineEnd;
            warnings.add(new Syntax.Err(UNRESOLVED_TAG + tag, at >= 0 && at < end ? at : start, end));
            return false;
        }

        private void handleAlias(AliasEvent alias) {
            int start = offset(alias.getStartMark());
            int end = offset(alias.getEndMark());
            if (isKeyPosition()) {
                attach(new Syntax.Node.Str(start, end, text.substring(start, end), false));
                return;
            }
            Syntax.Node target = anchors.get(alias.getAnchor());
            if (target == null) {
                attach(new Syntax.Node.Null(start, end, true));
            } else {
                attach(copy(target, start, end));
            }
        }

        private void captureKey(Event event) {
            if (event instanceof CollectionStartEvent) {
                keyCaptureDepth++;
            } else if (event instanceof MappingEndEvent || event instanceof SequenceEndEvent) {
                keyCaptureDepth--;
                if (keyCaptureDepth == 0) {
                    int end = offset(event.getEndMark());
                    attach(new Syntax.Node.Str(keyCaptureStart, end, text.substring(keyCaptureStart, end), false));
                }
            }
        }

        private boolean isKeyPosition() {
            Frame top = stack.peek();
            return top != null && top.node instanceof Syntax.Node.Obj && top.pending == null;
        }

        private void skip() {
            Frame top = stack.peek();
            if (top != null && top.pending != null) {
                top.pending = null;
            }
        }

        private void attach(Syntax.Node node) {
            Frame top = stack.peek();
            if (top == null) {
                if (root == null) {
                    root = node;
                }
                return;
            }

            if (top.node instanceof Syntax.Node.Obj obj) {
                if (top.pending == null) {
                    Syntax.Node.Str key = node instanceof Syntax.Node.Str str
                            ? str
                            : new Syntax.Node.Str(node.start, node.end, text.substring(node.start, node.end), false);
                    Syntax.Node.Prop prop = new Syntax.Node.Prop(key);
                    key.parent = prop;
                    prop.parent = obj;
                    obj.properties.add(prop);
                    if (!top.keys.add(key.value)) {
                        warnings.add(new Syntax.Err(DUPLICATE_KEY, key.start, key.end));
                    }
                    top.pending = prop;
                } else {
                    Syntax.Node.Prop prop = top.pending;
                    prop.value = node;
                    node.parent = prop;
                    prop.end = Math.max(prop.end, node.end);
                    top.pending = null;
                }
            } else if (top.node instanceof Syntax.Node.Arr arr) {
                node.parent = arr;
                arr.items.add(node);
            }
        }

        private void finish(Frame frame, int endOffset) {
            Syntax.Node node = frame.node;
            if (frame.pending != null) {
                int at = frame.pending.key.end;
                Syntax.Node.Null value = new Syntax.Node.Null(at, at, true);
                value.parent = frame.pending;
                frame.pending.value = value;
                frame.pending = null;
            }
            if (node instanceof Syntax.Node.Arr arr && !arr.items.isEmpty()) {
                Syntax.Node last = arr.items.get(arr.items.size() - 1);
                if (last instanceof Syntax.Node.Null nullNode && nullNode.synthetic) {
                    arr.items.remove(arr.items.size() - 1);
                }
            }

            int end = node.start;
            for (Syntax.Node child : node.children()) {
                end = Math.max(end, child.end);
            }
            if (frame.flow && endOffset >= 0) {
                end = Math.max(end, endOffset);
            }
            node.end = Math.min(end, unitEnd);

            if (node.parent instanceof Syntax.Node.Prop prop) {
                prop.end = Math.max(prop.end, node.end);
            }
            if (frame.anchor != null) {
                anchors.put(frame.anchor, node);
            }
        }

        private void closeAll() {
            keyCaptureDepth = 0;
            while (!stack.isEmpty()) {
                finish(stack.pop(), -1);
            }
        }

        private int offset(Mark mark) {
            if (mark == null) {
                return base;
            }
            int offset = unitIndex.offsetOfCodePoint(unitText, mark.getLine(), mark.getColumn());
            if (offset < 0) {
                return unitEnd;
            }
            return base + offset;
        }

        private void addError(String message, Mark mark) {
            if (mark == null) {
                errors.add(new Syntax.Err(message, base, unitEnd));
                return;
            }
            int start = Math.min(offset(mark), text.length());
            int line = unitIndex.lineOf(start - base);
            int end = line < 0 ? unitEnd : base + unitIndex.lineContentEnd(line);
            end = Math.min(Math.max(start, end), text.length());
            errors.add(new Syntax.Err(message.strip(), start, end));
        }

        // Aliases get a fresh copy of their target, relocated onto the alias
        // itself so it stays within its parent's range.
        private static Syntax.Node copy(Syntax.Node node, int start, int end) {
            if (node instanceof Syntax.Node.Obj obj) {
                Syntax.Node.Obj result = new Syntax.Node.Obj(start, end);
                for (Syntax.Node.Prop prop : obj.properties) {
                    Syntax.Node.Str key = new Syntax.Node.Str(start, end, prop.key.value, prop.key.quoted);
                    Syntax.Node.Prop copied = new Syntax.Node.Prop(key);
                    key.parent = copied;
                    copied.end = end;
                    if (prop.value != null) {
                        copied.value = copy(prop.value, start, end);
                        copied.value.parent = copied;
                    }
                    copied.parent = result;
                    result.properties.add(copied);
                }
                return result;
            } else if (node instanceof Syntax.Node.Arr arr) {
                Syntax.Node.Arr result = new Syntax.Node.Arr(start, end);
                for (Syntax.Node item : arr.items) {
                    Syntax.Node copied = copy(item, start, end);
                    copied.parent = result;
                    result.items.add(copied);
                }
                return result;
            } else if (node instanceof Syntax.Node.Str str) {
                return new Syntax.Node.Str(start, end, str.value, str.quoted);
            } else if (node instanceof Syntax.Node.Num num) {
                return new Syntax.Node.Num(start, end, num.value, num.integral);
            } else if (node instanceof Syntax.Node.Bool bool) {
                return new Syntax.Node.Bool(start, end, bool.value);
            } else if (node instanceof Syntax.Node.Null nullNode) {
                return new Syntax.Node.Null(start, end, nullNode.synthetic);
            }
            return new Syntax.Node.Null(start, end, true);
        }
    }
}
