/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.visitor;

import org.cadixdev.vulcan.MappingException;
import org.cadixdev.vulcan.ParsedModule;
import org.cadixdev.vulcan.UnexpectedTokenException;
import org.cadixdev.vulcan.ast.BodyStatement;
import org.cadixdev.vulcan.ast.ClassDeclaration;
import org.cadixdev.vulcan.ast.Constructor;
import org.cadixdev.vulcan.ast.FunctionBody;
import org.cadixdev.vulcan.ast.FunctionDeclaration;
import org.cadixdev.vulcan.ast.Node;
import org.cadixdev.vulcan.ast.Parameter;
import org.cadixdev.vulcan.ast.Parameters;
import org.cadixdev.vulcan.ast.StaticConstructor;
import org.cadixdev.vulcan.ast.StaticDestructor;
import org.cadixdev.vulcan.ast.StructBody;
import org.cadixdev.vulcan.ast.StructDeclaration;
import org.cadixdev.vulcan.ast.Symbol;
import org.cadixdev.vulcan.ast.Type;
import org.cadixdev.vulcan.ast.Type2;
import org.cadixdev.vulcan.ast.UnionDeclaration;
import org.cadixdev.vulcan.lexer.Token;
import org.cadixdev.vulcan.lexer.TokenTypes;
import org.cadixdev.vulcan.resolver.SymbolResolver;
import org.cadixdev.vulcan.util.OrderedIntervals;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Walks a parsed module once and collects the mappings between the
 * constructs that need converting and the global indices of their tokens.
 *
 * <p>Several unrelated mappings are gathered in the same walk so the AST is
 * only visited once. A visitor is good for a single walk; create a new one
 * per file.</p>
 */
public final class TokenMappingVisitor {

    private final List<Token> tokens;
    private final String fileName;
    private final SymbolResolver resolver;

    private final OrderedIntervals scopeDelegates = new OrderedIntervals();
    private final OrderedIntervals valueAggregates = new OrderedIntervals();
    private boolean visited;

    public TokenMappingVisitor(List<Token> tokens, String fileName, SymbolResolver resolver) {
        this.tokens = List.copyOf(tokens);
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public static TokenMappings map(ParsedModule module, SymbolResolver resolver) {
        TokenMappingVisitor visitor = new TokenMappingVisitor(module.tokens(), module.fileName(), resolver);
        visitor.visit(module.compilationUnit());
        return visitor.foundTokenMappings();
    }

    public void visit(Node root) {
        if (this.visited) {
            throw new IllegalStateException("TokenMappingVisitor for " + this.fileName + " was already used");
        }
        this.visited = true;
        this.visitNode(root);
    }

    public TokenMappings foundTokenMappings() {
        if (!this.visited) {
            throw new IllegalStateException("No module has been visited yet");
        }
        return new TokenMappings(this.scopeDelegates, this.valueAggregates);
    }

    private void visitNode(Node node) {
        if (node instanceof StructDeclaration struct) {
            this.addValueAggregate(struct.structBody());
            this.visitChildren(node);
        } else if (node instanceof UnionDeclaration union) {
            this.addValueAggregate(union.structBody());
            this.visitChildren(node);
        } else if (node instanceof ClassDeclaration clazz) {
            // classes are reference types even when nested in a struct
            StructBody body = clazz.structBody();
            if (body != null) {
                this.valueAggregates.remove(body.startLocation(), body.endLocation());
            }
            this.visitChildren(node);
        } else if (node instanceof StaticConstructor ctor) {
            // applies to both the body and the header-only declaration
            this.valueAggregates.remove(ctor.location(), this.ctorEndLocation(ctor.location(), ctor.functionBody()));
        } else if (node instanceof StaticDestructor dtor) {
            this.valueAggregates.remove(dtor.location(), this.ctorEndLocation(dtor.location(), dtor.functionBody()));
        } else if (node instanceof FunctionDeclaration function) {
            this.visitFunction(function.parameters(), node);
        } else if (node instanceof Constructor constructor) {
            this.visitFunction(constructor.parameters(), node);
        } else {
            this.visitChildren(node);
        }
    }

    private void visitChildren(Node node) {
        for (Node child : node.children()) {
            this.visitNode(child);
        }
    }

    private void addValueAggregate(@Nullable StructBody body) {
        if (body != null) {
            this.valueAggregates.add(body.startLocation(), body.endLocation());
        }
    }

    private void visitFunction(@Nullable Parameters parameters, Node node) {
        // Delegates can only be reached through the parameter lists of the
        // declarations that own them
        if (parameters == null) {
            return;
        }

        for (Parameter parameter : parameters.parameters()) {
            if (parameter.type() != null) {
                this.checkDelegate(parameter.type());
            }
        }
        this.visitChildren(node);
    }

    private int ctorEndLocation(int location, @Nullable FunctionBody body) {
        if (body == null) {
            int idx = this.getTokIndex(location);
            if (idx + 2 >= this.tokens.size()) {
                throw MappingException.at("Truncated static constructor declaration", this.fileName, this.tokens.get(idx));
            }
            return this.tokens.get(idx + 2).index();
        }
        if (body.blockStatement() != null) {
            return body.blockStatement().endLocation();
        }

        BodyStatement bodyStatement = body.bodyStatement();
        if (bodyStatement == null || bodyStatement.blockStatement() == null) {
            throw MappingException.at("Expected a block inside the body statement", this.fileName,
                    this.tokens.get(this.getTokIndex(location)));
        }
        return bodyStatement.blockStatement().endLocation();
    }

    /**
     * Records the insertion point for {@code scope} if the parameter type is
     * a delegate, either spelled out or through an alias.
     *
     * @param type the parameter type
     */
    private void checkDelegate(Type type) {
        // The return type is in type2 and the delegate in the first suffix.
        // D1 has no const/immutable/shared/inout to look through.
        if (!type.typeSuffixes().isEmpty() && type.typeSuffixes().get(0).isDelegate()) {
            this.calculateIndex(type).ifPresent(index -> this.scopeDelegates.add(index));
            return;
        }

        // Global lookup of the unqualified name among the known aliases.
        // This gives false positives unless delegate aliases have unique names.
        Symbol symbol = type.type2().symbol();
        if (type.typeSuffixes().isEmpty() && symbol != null && !symbol.identifiersOrTemplateInstances().isEmpty()) {
            String name = symbol.last().nameToken().text();
            if (this.resolver.resolve(name).isDelegate()) {
                this.calculateIndex(type).ifPresent(index -> this.scopeDelegates.add(index));
            }
        }
    }

    /**
     * @param type parameter type to inject {@code scope} before
     * @return global index before which {@code scope} goes, or nothing if the
     *         type has neither a builtin nor a symbol base
     */
    private OptionalInt calculateIndex(Type type) {
        Type2 t2 = type.type2();

        if (t2.builtinType() != null && !type.typeSuffixes().isEmpty()) {
            Token delegate = type.typeSuffixes().get(0).delegateOrFunction();
            if (delegate == null) {
                return OptionalInt.empty();
            }
            int idx = this.getTokIndex(delegate);
            if (idx == 0) {
                throw MappingException.at("Delegate without a return type", this.fileName, delegate);
            }
            Token previous = this.tokens.get(idx - 1);
            if (!TokenTypes.isBasicType(previous.type())) {
                throw new UnexpectedTokenException("a builtin type", previous, this.fileName);
            }
            return OptionalInt.of(previous.index());
        }

        Symbol symbol = t2.symbol();
        if (symbol != null && !symbol.identifiersOrTemplateInstances().isEmpty()) {
            Token first = symbol.first().nameToken();
            if (!symbol.dot()) {
                return OptionalInt.of(first.index());
            }

            // Put scope in front of the module scope dot, not between it and the name
            int idx = this.getTokIndex(first);
            if (idx == 0) {
                throw MappingException.at("Missing leading dot", this.fileName, first);
            }
            Token dot = this.tokens.get(idx - 1);
            if (!dot.is(TokenTypes.DOT)) {
                throw new UnexpectedTokenException("'.'", dot, this.fileName);
            }
            return OptionalInt.of(dot.index());
        }

        return OptionalInt.empty();
    }

    /**
     * @param globalIndex index in the parsed file
     * @return position in the token array of the token with that index
     */
    private int getTokIndex(int globalIndex) {
        int nearest = -1;
        for (int idx = 0; idx < this.tokens.size(); idx++) {
            Token token = this.tokens.get(idx);
            if (token.index() == globalIndex) {
                return idx;
            }
            if (token.index() < globalIndex) {
                nearest = idx;
            }
        }

        String message = "No token at index " + globalIndex;
        if (nearest != -1) {
            throw MappingException.at(message, this.fileName, this.tokens.get(nearest));
        }
        if (!this.tokens.isEmpty()) {
            throw MappingException.at(message, this.fileName, this.tokens.get(0));
        }
        throw new MappingException(message, this.fileName, 0, 0);
    }

    private int getTokIndex(Token token) {
        for (int idx = 0; idx < this.tokens.size(); idx++) {
            if (this.tokens.get(idx).index() == token.index()) {
                return idx;
            }
        }
        throw MappingException.at("No token at index " + token.index(), this.fileName, token);
    }
}
