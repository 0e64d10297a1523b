/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.language;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.yaml.lsp.protocol.LspAdapter;
import software.amazon.yaml.lsp.syntax.Syntax;

public record DocumentSymbolHandler(Syntax.ParsedDocument parsed) {
    /**
     * @return A list of DocumentSymbol
     */
    public List<Either<SymbolInformation, DocumentSymbol>> handle() {
        List<Either<SymbolInformation, DocumentSymbol>> result = new ArrayList<>();
        for (Syntax.SingleDocument document : parsed.documents()) {
            addChildSymbols(document.root(), symbol -> result.add(Either.forRight(symbol)));
        }
        return result;
    }

    private void addChildSymbols(Syntax.Node node, Consumer<DocumentSymbol> consumer) {
        if (node instanceof Syntax.Node.Obj obj) {
            for (Syntax.Node.Prop prop : obj.properties()) {
                consumer.accept(propertySymbol(prop));
            }
        } else if (node instanceof Syntax.Node.Arr arr) {
            for (int i = 0; i < arr.items().size(); i++) {
                consumer.accept(itemSymbol(i, arr.items().get(i)));
            }
        }
    }

    private DocumentSymbol propertySymbol(Syntax.Node.Prop prop) {
        var symbol = new DocumentSymbol(
                prop.key().value(),
                symbolKind(prop.value()),
                rangeOf(prop),
                rangeOf(prop.key())
        );
        addChildren(symbol, prop.value());
        return symbol;
    }

    private DocumentSymbol itemSymbol(int index, Syntax.Node item) {
        var range = rangeOf(item);
        var symbol = new DocumentSymbol(String.valueOf(index), symbolKind(item), range, range);
        addChildren(symbol, item);
        return symbol;
    }

    private void addChildren(DocumentSymbol symbol, Syntax.Node value) {
        List<DocumentSymbol> children = new ArrayList<>();
        addChildSymbols(value, children::add);
        if (!children.isEmpty()) {
            symbol.setChildren(children);
        }
    }

    private Range rangeOf(Syntax.Node node) {
        return LspAdapter.toRange(parsed.lineIndex(), node.start(), node.end());
    }

    private static SymbolKind symbolKind(Syntax.Node value) {
        if (value == null) {
            return SymbolKind.Null;
        }
        return switch (value.type()) {
            case Obj -> SymbolKind.Module;
            case Arr -> SymbolKind.Array;
            case Str -> SymbolKind.String;
            case Num -> SymbolKind.Number;
            case Bool -> SymbolKind.Boolean;
            case Null, Prop -> SymbolKind.Null;
        };
    }
}
