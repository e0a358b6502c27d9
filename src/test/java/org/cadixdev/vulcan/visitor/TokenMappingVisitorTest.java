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
import org.cadixdev.vulcan.UnexpectedTokenException;
import org.cadixdev.vulcan.ast.BlockStatement;
import org.cadixdev.vulcan.ast.BodyStatement;
import org.cadixdev.vulcan.ast.ClassDeclaration;
import org.cadixdev.vulcan.ast.CompilationUnit;
import org.cadixdev.vulcan.ast.Constructor;
import org.cadixdev.vulcan.ast.FunctionBody;
import org.cadixdev.vulcan.ast.FunctionDeclaration;
import org.cadixdev.vulcan.ast.IdentifierOrTemplateInstance;
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
import org.cadixdev.vulcan.ast.TypeSuffix;
import org.cadixdev.vulcan.ast.UnionDeclaration;
import org.cadixdev.vulcan.ast.VariableDeclaration;
import org.cadixdev.vulcan.resolver.AliasResolution;
import org.cadixdev.vulcan.resolver.AliasTable;
import org.cadixdev.vulcan.resolver.SymbolResolver;
import org.cadixdev.vulcan.util.Interval;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenMappingVisitorTest {

    private static TokenMappings map(TestSource src, SymbolResolver resolver, Node... declarations) {
        TokenMappingVisitor visitor = new TokenMappingVisitor(src.tokens, src.fileName, resolver);
        visitor.visit(new CompilationUnit(List.of(declarations)));
        return visitor.foundTokenMappings();
    }

    private static TokenMappings map(TestSource src, Node... declarations) {
        return map(src, SymbolResolver.NONE, declarations);
    }

    private static StructBody body(TestSource src, int open, int close, Node... declarations) {
        return new StructBody(src.at("{", open), src.at("}", close), List.of(declarations));
    }

    private static FunctionBody block(TestSource src, int open, int close, Node... statements) {
        return FunctionBody.of(new BlockStatement(src.at("{", open), src.at("}", close), List.of(statements)));
    }

    private static Type delegateReturning(TestSource src, Type2 returnType, int nth) {
        return new Type(returnType, List.of(TypeSuffix.callable(src.find("delegate", nth), Parameters.empty())));
    }

    private static Type named(String name, TestSource src) {
        return new Type(Type2.symbol(new Symbol(false, List.of(IdentifierOrTemplateInstance.identifier(src.find(name))))));
    }

    private static FunctionDeclaration function(TestSource src, String name, FunctionBody body, Type... parameterTypes) {
        Parameter[] parameters = new Parameter[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            parameters[i] = new Parameter(null, parameterTypes[i]);
        }
        return new FunctionDeclaration(src.find(name), null, new Parameters(List.of(parameters)), body);
    }

    private static List<Interval> ranges(int... bounds) {
        Interval[] result = new Interval[bounds.length / 2];
        for (int i = 0; i < result.length; i++) {
            result[i] = new Interval(bounds[2 * i], bounds[2 * i + 1]);
        }
        return List.of(result);
    }

    @Test
    void structBodyIsValueAggregate() {
        TestSource src = new TestSource("struct S { int x; }");
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), body(src, 0, 0)));

        assertEquals(ranges(src.at("{"), src.at("}")), mappings.valueAggregates().toList());
        assertTrue(mappings.scopeDelegates().isEmpty());
    }

    @Test
    void unionBodyIsValueAggregate() {
        TestSource src = new TestSource("union U { int x; }");
        TokenMappings mappings = map(src, new UnionDeclaration(src.find("U"), body(src, 0, 0)));

        assertEquals(ranges(src.at("{"), src.at("}")), mappings.valueAggregates().toList());
    }

    @Test
    void forwardDeclaredStructIsIgnored() {
        TestSource src = new TestSource("struct S;");
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), null));

        assertTrue(mappings.valueAggregates().isEmpty());
    }

    @Test
    void nestedClassBodyIsPunchedOut() {
        TestSource src = new TestSource("struct S { class C { } int x; }");
        ClassDeclaration clazz = new ClassDeclaration(src.find("C"), body(src, 1, 0));
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), body(src, 0, 1, clazz)));

        assertEquals(ranges(src.at("{", 0), src.at("{", 1), src.at("}", 0), src.at("}", 1)),
                mappings.valueAggregates().toList());
    }

    @Test
    void structNestedInClassInStructIsMarkedAgain() {
        TestSource src = new TestSource("struct A { class C { struct B { } } }");
        StructDeclaration inner = new StructDeclaration(src.find("B"), body(src, 2, 0));
        ClassDeclaration clazz = new ClassDeclaration(src.find("C"), body(src, 1, 1, inner));
        TokenMappings mappings = map(src, new StructDeclaration(src.find("A"), body(src, 0, 2, clazz)));

        assertEquals(ranges(
                src.at("{", 0), src.at("{", 1),
                src.at("{", 2), src.at("}", 0),
                src.at("}", 1), src.at("}", 2)
        ), mappings.valueAggregates().toList());
    }

    @Test
    void staticConstructorBodyIsExcluded() {
        TestSource src = new TestSource("struct S { static this() { } int x; }");
        StaticConstructor ctor = new StaticConstructor(src.at("static"), block(src, 1, 0));
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), body(src, 0, 1, ctor)));

        assertEquals(ranges(src.at("{", 0), src.at("static"), src.at("}", 0), src.at("}", 1)),
                mappings.valueAggregates().toList());
    }

    @Test
    void headerOnlyStaticConstructorExcludesTwoTokens() {
        TestSource src = new TestSource("struct S { static this(); int x; }");
        StaticConstructor ctor = new StaticConstructor(src.at("static"), null);
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), body(src, 0, 0, ctor)));

        assertEquals(ranges(src.at("{"), src.at("static"), src.at("("), src.at("}")),
                mappings.valueAggregates().toList());
    }

    @Test
    void staticDestructorBodyIsExcluded() {
        TestSource src = new TestSource("union U { static ~this() { } }");
        StaticDestructor dtor = new StaticDestructor(src.at("static"), block(src, 1, 0));
        TokenMappings mappings = map(src, new UnionDeclaration(src.find("U"), body(src, 0, 1, dtor)));

        assertEquals(ranges(src.at("{", 0), src.at("static"), src.at("}", 0), src.at("}", 1)),
                mappings.valueAggregates().toList());
    }

    @Test
    void contractWrappedBodyEndsAtInnerBlock() {
        TestSource src = new TestSource("struct S { static this() in { } body { } int x; }");
        BlockStatement in = new BlockStatement(src.at("{", 1), src.at("}", 0), List.of());
        BlockStatement inner = new BlockStatement(src.at("{", 2), src.at("}", 1), List.of());
        StaticConstructor ctor = new StaticConstructor(src.at("static"),
                FunctionBody.contract(in, null, new BodyStatement(inner)));
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), body(src, 0, 2, ctor)));

        assertEquals(ranges(src.at("{", 0), src.at("static"), src.at("}", 1), src.at("}", 2)),
                mappings.valueAggregates().toList());
    }

    @Test
    void contractWithoutInnerBlockFails() {
        TestSource src = new TestSource("struct S { static this() in { } body }");
        StaticConstructor ctor = new StaticConstructor(src.at("static"),
                new FunctionBody(null, new BlockStatement(src.at("{", 1), src.at("}", 0), List.of()), null,
                        new BodyStatement(null)));
        StructDeclaration struct = new StructDeclaration(src.find("S"), body(src, 0, 1, ctor));

        MappingException e = assertThrows(MappingException.class, () -> map(src, struct));
        assertEquals("test.d", e.getFileName());
        assertEquals(1, e.getLine());
        assertEquals(src.find("static").column(), e.getColumn());
    }

    @Test
    void locationWithoutTokenFails() {
        TestSource src = new TestSource("struct S { static this(); }");
        StaticConstructor ctor = new StaticConstructor(src.at("static") + 1, null);
        StructDeclaration struct = new StructDeclaration(src.find("S"), body(src, 0, 0, ctor));

        MappingException e = assertThrows(MappingException.class, () -> map(src, struct));
        assertEquals(1, e.getLine());
        assertEquals(src.find("static").column(), e.getColumn());
        assertTrue(e.getMessage().endsWith("(test.d:1," + src.find("static").column() + ")"), e.getMessage());
    }

    @Test
    void delegateTokenOutsideTokenArrayReportsItsPosition() {
        TestSource src = new TestSource("void f(int dg) { }");
        TestSource elsewhere = new TestSource("\n\n    int delegate() dg");
        Type dg = delegateReturning(elsewhere, Type2.builtin(elsewhere.find("int")), 0);
        FunctionDeclaration f = function(src, "f", block(src, 0, 0), dg);

        MappingException e = assertThrows(MappingException.class, () -> map(src, f));
        assertEquals("test.d", e.getFileName());
        assertEquals(3, e.getLine());
        assertEquals(elsewhere.find("delegate").column(), e.getColumn());
    }

    @Test
    void builtinDelegateGetsScopeBeforeReturnType() {
        TestSource src = new TestSource("void f(int delegate() dg) { }");
        Type dg = delegateReturning(src, Type2.builtin(src.find("int")), 0);
        TokenMappings mappings = map(src, function(src, "f", block(src, 0, 0), dg));

        assertEquals(List.of(src.at("int")), mappings.scopeInsertionPoints());
        assertTrue(mappings.isScopeInsertionPoint(src.at("int")));
    }

    @Test
    void builtinDelegateChecksPrecedingToken() {
        TestSource src = new TestSource("void f(Foo delegate() dg) { }");
        // AST and tokens disagree: the token before delegate is not a builtin type
        Type dg = delegateReturning(src, Type2.builtin(src.find("void")), 0);
        FunctionDeclaration f = function(src, "f", block(src, 0, 0), dg);

        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> map(src, f));
        assertEquals("Foo", e.getActual().text());
        assertTrue(e.getMessage().endsWith("(test.d:1,8)"), e.getMessage());
    }

    @Test
    void symbolDelegateGetsScopeBeforeSymbol() {
        TestSource src = new TestSource("void f(Foo delegate() dg) { }");
        Type foo = named("Foo", src);
        Type dg = new Type(foo.type2(), List.of(TypeSuffix.callable(src.find("delegate"), Parameters.empty())));
        TokenMappings mappings = map(src, function(src, "f", block(src, 0, 0), dg));

        assertEquals(List.of(src.at("Foo")), mappings.scopeInsertionPoints());
    }

    @Test
    void leadingDotMovesInsertionBeforeDot() {
        TestSource src = new TestSource("void f(.Foo delegate() dg) { }");
        Symbol symbol = new Symbol(true, List.of(IdentifierOrTemplateInstance.identifier(src.find("Foo"))));
        Type dg = new Type(Type2.symbol(symbol), List.of(TypeSuffix.callable(src.find("delegate"), Parameters.empty())));
        TokenMappings mappings = map(src, function(src, "f", block(src, 0, 0), dg));

        assertEquals(List.of(src.at(".")), mappings.scopeInsertionPoints());
    }

    @Test
    void functionPointerIsLeftAlone() {
        TestSource src = new TestSource("void f(void function() fp) { }");
        Type fp = new Type(Type2.builtin(src.find("void", 1)),
                List.of(TypeSuffix.callable(src.find("function"), Parameters.empty())));
        TokenMappings mappings = map(src, function(src, "f", block(src, 0, 0), fp));

        assertTrue(mappings.scopeDelegates().isEmpty());
    }

    @Test
    void delegateWithoutBuiltinOrSymbolBaseIsLeftAlone() {
        TestSource src = new TestSource("void f(typeof(x) delegate() dg) { }");
        Type dg = new Type(new Type2(null, null), List.of(TypeSuffix.callable(src.find("delegate"), Parameters.empty())));
        TokenMappings mappings = map(src, function(src, "f", block(src, 0, 0), dg));

        assertTrue(mappings.scopeDelegates().isEmpty());
    }

    @ParameterizedTest
    @EnumSource(AliasResolution.class)
    void aliasedDelegateFollowsResolver(AliasResolution resolution) {
        TestSource src = new TestSource("void f(Handler h) { }");
        TokenMappings mappings = map(src, name -> name.equals("Handler") ? resolution : AliasResolution.UNKNOWN,
                function(src, "f", block(src, 0, 0), named("Handler", src)));

        if (resolution == AliasResolution.DELEGATE_ALIAS) {
            assertEquals(List.of(src.at("Handler")), mappings.scopeInsertionPoints());
        } else {
            assertTrue(mappings.scopeDelegates().isEmpty());
        }
    }

    @Test
    void qualifiedAliasIsLookedUpByLastSegment() {
        TestSource src = new TestSource("void f(.app.Handler h) { }");
        Symbol symbol = new Symbol(true, List.of(
                IdentifierOrTemplateInstance.identifier(src.find("app")),
                IdentifierOrTemplateInstance.identifier(src.find("Handler"))
        ));
        AliasTable aliases = AliasTable.builder().delegateAlias("Handler").otherAlias("app").build();
        TokenMappings mappings = map(src, aliases,
                function(src, "f", block(src, 0, 0), new Type(Type2.symbol(symbol))));

        assertEquals(List.of(src.at(".", 0)), mappings.scopeInsertionPoints());
    }

    @Test
    void templateInstanceAliasUsesTemplateName() {
        TestSource src = new TestSource("void f(Callback!(int) cb) { }");
        Symbol symbol = new Symbol(false, List.of(IdentifierOrTemplateInstance.template(src.find("Callback"))));
        AliasTable aliases = AliasTable.builder().delegateAlias("Callback").build();
        TokenMappings mappings = map(src, aliases,
                function(src, "f", block(src, 0, 0), new Type(Type2.symbol(symbol))));

        assertEquals(List.of(src.at("Callback")), mappings.scopeInsertionPoints());
    }

    @Test
    void aliasWithSuffixIsNotBare() {
        TestSource src = new TestSource("void f(Handler[] hs) { }");
        Type handlers = new Type(named("Handler", src).type2(), List.of(TypeSuffix.array()));
        AliasTable aliases = AliasTable.builder().delegateAlias("Handler").build();
        TokenMappings mappings = map(src, aliases, function(src, "f", block(src, 0, 0), handlers));

        assertTrue(mappings.scopeDelegates().isEmpty());
    }

    @Test
    void constructorParametersAreChecked() {
        TestSource src = new TestSource("class C { this(void delegate() dg) { } }");
        Type dg = delegateReturning(src, Type2.builtin(src.find("void")), 0);
        Constructor ctor = new Constructor(src.at("this"), new Parameters(List.of(new Parameter(src.find("dg"), dg))),
                block(src, 1, 0));
        TokenMappings mappings = map(src, new ClassDeclaration(src.find("C"), body(src, 0, 1, ctor)));

        assertEquals(List.of(src.at("void")), mappings.scopeInsertionPoints());
        assertTrue(mappings.valueAggregates().isEmpty());
    }

    @Test
    void functionBodiesAreWalked() {
        TestSource src = new TestSource("void f() { struct L { } }");
        StructDeclaration local = new StructDeclaration(src.find("L"), body(src, 1, 0));
        FunctionDeclaration f = new FunctionDeclaration(src.find("f"), null, Parameters.empty(), block(src, 0, 1, local));
        TokenMappings mappings = map(src, f);

        assertEquals(ranges(src.at("{", 1), src.at("}", 0)), mappings.valueAggregates().toList());
    }

    @Test
    void functionWithoutParameterListIsNotWalked() {
        TestSource src = new TestSource("void f() { struct L { } }");
        StructDeclaration local = new StructDeclaration(src.find("L"), body(src, 1, 0));
        FunctionDeclaration f = new FunctionDeclaration(src.find("f"), null, null, block(src, 0, 1, local));
        TokenMappings mappings = map(src, f);

        assertTrue(mappings.valueAggregates().isEmpty());
    }

    @Test
    void untypedParametersAreSkipped() {
        TestSource src = new TestSource("void f(...) { }");
        FunctionDeclaration f = new FunctionDeclaration(src.find("f"), null,
                new Parameters(List.of(new Parameter(null, null))), block(src, 0, 0));

        assertTrue(map(src, f).scopeDelegates().isEmpty());
    }

    @Test
    void structWithStaticConstructorAndDelegateParameter() {
        TestSource src = new TestSource("struct S { static this() {} void f(void delegate() d) {} }");
        StaticConstructor ctor = new StaticConstructor(src.at("static"), block(src, 1, 0));
        Type dg = delegateReturning(src, Type2.builtin(src.find("void", 1)), 0);
        FunctionDeclaration f = new FunctionDeclaration(src.find("f"), new Type(Type2.builtin(src.find("void", 0))),
                new Parameters(List.of(new Parameter(src.find("d"), dg))), block(src, 2, 1));
        StructDeclaration struct = new StructDeclaration(src.find("S"), body(src, 0, 2, ctor, f));

        TokenMappings mappings = map(src, struct);

        assertEquals(ranges(src.at("{", 0), src.at("static"), src.at("}", 0), src.at("}", 2)),
                mappings.valueAggregates().toList());
        assertEquals(List.of(src.at("void", 1)), mappings.scopeInsertionPoints());
        assertTrue(mappings.isInValueAggregate(src.at("f")));
        assertFalse(mappings.isInValueAggregate(src.at("this")));
    }

    @Test
    void mappingIsRepeatable() {
        TestSource src = new TestSource("struct S { static this(); class C { } void f(int delegate() d, Handler h) { } }");
        StaticConstructor ctor = new StaticConstructor(src.at("static"), null);
        ClassDeclaration clazz = new ClassDeclaration(src.find("C"), body(src, 1, 0));
        FunctionDeclaration f = function(src, "f", block(src, 2, 1),
                delegateReturning(src, Type2.builtin(src.find("int")), 0), named("Handler", src));
        CompilationUnit unit = new CompilationUnit(List.of(
                new StructDeclaration(src.find("S"), body(src, 0, 2, ctor, clazz, f)),
                new VariableDeclaration(new Type(Type2.builtin(src.find("int"))), List.of())
        ));
        AliasTable aliases = AliasTable.builder().delegateAlias("Handler").build();

        TokenMappingVisitor first = new TokenMappingVisitor(src.tokens, src.fileName, aliases);
        first.visit(unit);
        TokenMappingVisitor second = new TokenMappingVisitor(src.tokens, src.fileName, aliases);
        second.visit(unit);

        assertEquals(first.foundTokenMappings(), second.foundTokenMappings());
        assertEquals(2, first.foundTokenMappings().scopeDelegates().size());
    }

    @Test
    void visitorIsSingleUse() {
        TestSource src = new TestSource("struct S { }");
        TokenMappingVisitor visitor = new TokenMappingVisitor(src.tokens, src.fileName, SymbolResolver.NONE);

        assertThrows(IllegalStateException.class, visitor::foundTokenMappings);
        visitor.visit(new CompilationUnit(List.of()));
        assertThrows(IllegalStateException.class, () -> visitor.visit(new CompilationUnit(List.of())));
    }

    @Test
    void foundMappingsAreReadOnly() {
        TestSource src = new TestSource("struct S { }");
        TokenMappings mappings = map(src, new StructDeclaration(src.find("S"), body(src, 0, 0)));

        assertThrows(IllegalStateException.class, () -> mappings.valueAggregates().add(0, 1));
        assertThrows(IllegalStateException.class, () -> mappings.scopeDelegates().add(0));
    }
}
