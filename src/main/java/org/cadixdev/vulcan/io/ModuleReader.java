/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.cadixdev.vulcan.MappingException;
import org.cadixdev.vulcan.ParsedModule;
import org.cadixdev.vulcan.ast.AliasDeclaration;
import org.cadixdev.vulcan.ast.BlockStatement;
import org.cadixdev.vulcan.ast.BodyStatement;
import org.cadixdev.vulcan.ast.ClassDeclaration;
import org.cadixdev.vulcan.ast.CompilationUnit;
import org.cadixdev.vulcan.ast.Constructor;
import org.cadixdev.vulcan.ast.DeclarationBlock;
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
import org.cadixdev.vulcan.lexer.Token;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a module serialized by the parser front end: the token array plus
 * the AST, whose token references are global token indices.
 *
 * <pre>
 * { "file": "app/main.d",
 *   "tokens": [ { "type": "struct", "text": "struct", "index": 0, "line": 1, "column": 1 }, ... ],
 *   "root": { "declarations": [ { "kind": "struct", "name": 7, "body": { ... } } ] } }
 * </pre>
 */
public final class ModuleReader {

    private final String fileName;
    private final Map<Integer, Token> tokensByIndex = new HashMap<>();

    private ModuleReader(String fileName) {
        this.fileName = fileName;
    }

    public static ParsedModule read(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(JsonParser.parseReader(reader), path.getFileName().toString());
        } catch (JsonParseException | IllegalStateException | ClassCastException
                 | UnsupportedOperationException | NumberFormatException e) {
            throw new MappingException("Not a valid module json: " + e.getMessage(), path.toString(), 0, 0, e);
        }
    }

    public static ParsedModule fromJson(JsonElement node, String fallbackFileName) {
        if (!node.isJsonObject()) throw new MappingException("Not a valid module json", fallbackFileName, 0, 0);
        JsonObject obj = node.getAsJsonObject();
        String fileName = obj.has("file") ? obj.get("file").getAsString() : fallbackFileName;

        ModuleReader reader = new ModuleReader(fileName);
        List<Token> tokens = reader.parseTokens(reader.array(obj, "tokens"));
        CompilationUnit root = new CompilationUnit(reader.parseNodes(reader.object(obj, "root"), "declarations"));
        return new ParsedModule(fileName, tokens, root);
    }

    private List<Token> parseTokens(JsonArray array) {
        List<Token> tokens = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            JsonObject obj = element.getAsJsonObject();
            String type = this.member(obj, "type").getAsString();
            Token token = new Token(
                    type,
                    obj.has("text") ? obj.get("text").getAsString() : type,
                    this.member(obj, "index").getAsInt(),
                    obj.has("line") ? obj.get("line").getAsInt() : 0,
                    obj.has("column") ? obj.get("column").getAsInt() : 0
            );
            if (this.tokensByIndex.put(token.index(), token) != null) {
                throw new MappingException("Duplicate token index " + token.index(), this.fileName, token.line(), token.column());
            }
            tokens.add(token);
        }
        return tokens;
    }

    private List<Node> parseNodes(JsonObject parent, String member) {
        if (!parent.has(member)) {
            return List.of();
        }
        List<Node> nodes = new ArrayList<>();
        for (JsonElement element : parent.getAsJsonArray(member)) {
            nodes.add(this.parseNode(element.getAsJsonObject()));
        }
        return nodes;
    }

    private Node parseNode(JsonObject obj) {
        String kind = this.member(obj, "kind").getAsString();
        switch (kind) {
            case "block":
                return new DeclarationBlock(this.parseNodes(obj, "declarations"));
            case "struct":
                return new StructDeclaration(this.optionalToken(obj, "name"), this.parseStructBody(obj));
            case "union":
                return new UnionDeclaration(this.optionalToken(obj, "name"), this.parseStructBody(obj));
            case "class":
                return new ClassDeclaration(this.optionalToken(obj, "name"), this.parseStructBody(obj));
            case "staticConstructor":
                return new StaticConstructor(this.member(obj, "location").getAsInt(), this.parseFunctionBody(obj));
            case "staticDestructor":
                return new StaticDestructor(this.member(obj, "location").getAsInt(), this.parseFunctionBody(obj));
            case "function":
                return new FunctionDeclaration(
                        this.token(obj, "name"),
                        obj.has("returnType") ? this.parseType(obj.getAsJsonObject("returnType")) : null,
                        this.parseParameters(obj),
                        this.parseFunctionBody(obj)
                );
            case "constructor":
                return new Constructor(this.member(obj, "location").getAsInt(), this.parseParameters(obj),
                        this.parseFunctionBody(obj));
            case "blockStatement":
                return this.parseBlock(obj);
            case "variable":
                List<Token> names = new ArrayList<>();
                for (JsonElement name : this.array(obj, "names")) {
                    names.add(this.tokenAt(name.getAsInt()));
                }
                return new VariableDeclaration(this.parseType(this.object(obj, "type")), names);
            case "alias":
                return new AliasDeclaration(this.token(obj, "name"), this.parseType(this.object(obj, "type")));
            default:
                throw new MappingException("Unknown node kind '" + kind + "'", this.fileName, 0, 0);
        }
    }

    @Nullable
    private StructBody parseStructBody(JsonObject parent) {
        if (!parent.has("body")) {
            return null;
        }
        JsonObject body = parent.getAsJsonObject("body");
        return new StructBody(this.member(body, "start").getAsInt(), this.member(body, "end").getAsInt(),
                this.parseNodes(body, "declarations"));
    }

    @Nullable
    private FunctionBody parseFunctionBody(JsonObject parent) {
        if (!parent.has("body")) {
            return null;
        }
        JsonObject body = parent.getAsJsonObject("body");
        if (body.has("block")) {
            return FunctionBody.of(this.parseBlock(body.getAsJsonObject("block")));
        }
        return new FunctionBody(
                null,
                body.has("in") ? this.parseBlock(body.getAsJsonObject("in")) : null,
                body.has("out") ? this.parseBlock(body.getAsJsonObject("out")) : null,
                body.has("body") ? this.parseBodyStatement(body.getAsJsonObject("body")) : null
        );
    }

    private BodyStatement parseBodyStatement(JsonObject obj) {
        return new BodyStatement(obj.has("block") ? this.parseBlock(obj.getAsJsonObject("block")) : null);
    }

    private BlockStatement parseBlock(JsonObject obj) {
        return new BlockStatement(this.member(obj, "start").getAsInt(), this.member(obj, "end").getAsInt(),
                this.parseNodes(obj, "statements"));
    }

    @Nullable
    private Parameters parseParameters(JsonObject parent) {
        if (!parent.has("parameters")) {
            return null;
        }
        List<Parameter> parameters = new ArrayList<>();
        for (JsonElement element : parent.getAsJsonArray("parameters")) {
            JsonObject obj = element.getAsJsonObject();
            parameters.add(new Parameter(
                    this.optionalToken(obj, "name"),
                    obj.has("type") ? this.parseType(obj.getAsJsonObject("type")) : null
            ));
        }
        return new Parameters(parameters);
    }

    private Type parseType(JsonObject obj) {
        Type2 type2;
        if (obj.has("builtin")) {
            type2 = Type2.builtin(this.token(obj, "builtin"));
        } else if (obj.has("symbol")) {
            type2 = Type2.symbol(this.parseSymbol(obj.getAsJsonObject("symbol")));
        } else {
            type2 = new Type2(null, null);
        }

        List<TypeSuffix> suffixes = new ArrayList<>();
        if (obj.has("suffixes")) {
            for (JsonElement element : obj.getAsJsonArray("suffixes")) {
                suffixes.add(this.parseSuffix(element.getAsJsonObject()));
            }
        }
        return new Type(type2, suffixes);
    }

    private Symbol parseSymbol(JsonObject obj) {
        List<IdentifierOrTemplateInstance> chain = new ArrayList<>();
        for (JsonElement element : this.array(obj, "chain")) {
            JsonObject segment = element.getAsJsonObject();
            if (segment.has("template")) {
                chain.add(IdentifierOrTemplateInstance.template(this.token(segment, "template")));
            } else {
                chain.add(IdentifierOrTemplateInstance.identifier(this.token(segment, "identifier")));
            }
        }
        return new Symbol(obj.has("dot") && obj.get("dot").getAsBoolean(), chain);
    }

    private TypeSuffix parseSuffix(JsonObject obj) {
        String kind = this.member(obj, "kind").getAsString();
        switch (kind) {
            case "pointer":
                return TypeSuffix.pointer();
            case "array":
                return TypeSuffix.array();
            case "delegate":
            case "function":
                Parameters parameters = this.parseParameters(obj);
                return TypeSuffix.callable(this.token(obj, "token"), parameters != null ? parameters : Parameters.empty());
            default:
                throw new MappingException("Unknown type suffix '" + kind + "'", this.fileName, 0, 0);
        }
    }

    private Token token(JsonObject obj, String member) {
        return this.tokenAt(this.member(obj, member).getAsInt());
    }

    @Nullable
    private Token optionalToken(JsonObject obj, String member) {
        return obj.has(member) ? this.tokenAt(obj.get(member).getAsInt()) : null;
    }

    private Token tokenAt(int index) {
        Token token = this.tokensByIndex.get(index);
        if (token == null) {
            throw new MappingException("AST refers to index " + index + " which has no token", this.fileName, 0, 0);
        }
        return token;
    }

    private JsonElement member(JsonObject obj, String member) {
        JsonElement element = obj.get(member);
        if (element == null) {
            throw new MappingException("Missing '" + member + "' in " + obj, this.fileName, 0, 0);
        }
        return element;
    }

    private JsonObject object(JsonObject obj, String member) {
        return this.member(obj, member).getAsJsonObject();
    }

    private JsonArray array(JsonObject obj, String member) {
        return this.member(obj, member).getAsJsonArray();
    }
}
