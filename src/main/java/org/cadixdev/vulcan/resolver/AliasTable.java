/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.resolver;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.cadixdev.vulcan.MappingException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The project-wide alias index, keyed by unqualified alias name.
 *
 * <p>The table is populated up front, either through a {@link Builder} or
 * from the JSON index written by the symbol scanner:</p>
 *
 * <pre>
 * { "aliases": [ { "name": "Handler", "delegate": true, "module": "app.events" } ] }
 * </pre>
 *
 * <p>When several aliases share a name, a delegate alias wins. This can
 * produce false positives for non-delegate aliases that happen to be named
 * like a delegate alias elsewhere in the project.</p>
 */
public final class AliasTable implements SymbolResolver {

    private final Map<String, AliasResolution> aliases;

    private AliasTable(Map<String, AliasResolution> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AliasTable loadFile(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(JsonParser.parseReader(reader));
        } catch (JsonParseException | IllegalStateException | ClassCastException
                 | UnsupportedOperationException | NumberFormatException e) {
            throw new MappingException("Not a valid alias json: " + e.getMessage(), path.toString(), 0, 0, e);
        }
    }

    public static AliasTable fromJson(JsonElement node) {
        if (!node.isJsonObject()) throw new MappingException("Not a valid alias json");
        JsonArray aliases = node.getAsJsonObject().getAsJsonArray("aliases");
        if (aliases == null) throw new MappingException("Not a valid alias json");

        Builder builder = builder();
        for (JsonElement element : aliases) {
            JsonObject obj = element.getAsJsonObject();
            if (!obj.has("name")) throw new MappingException("Alias entry without a name: " + obj);
            String name = obj.get("name").getAsString();
            if (obj.has("delegate") && obj.get("delegate").getAsBoolean()) {
                builder.delegateAlias(name);
            } else {
                builder.otherAlias(name);
            }
        }
        return builder.build();
    }

    @Override
    public AliasResolution resolve(String name) {
        return this.aliases.getOrDefault(name, AliasResolution.UNKNOWN);
    }

    public int size() {
        return this.aliases.size();
    }

    public static final class Builder {

        private final Map<String, AliasResolution> aliases = new HashMap<>();

        private Builder() {
        }

        public Builder delegateAlias(String name) {
            this.aliases.put(Objects.requireNonNull(name, "name"), AliasResolution.DELEGATE_ALIAS);
            return this;
        }

        public Builder otherAlias(String name) {
            this.aliases.putIfAbsent(Objects.requireNonNull(name, "name"), AliasResolution.OTHER_ALIAS);
            return this;
        }

        public AliasTable build() {
            return new AliasTable(this.aliases);
        }
    }
}
