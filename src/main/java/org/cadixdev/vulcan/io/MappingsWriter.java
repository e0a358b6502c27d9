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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.cadixdev.vulcan.util.Interval;
import org.cadixdev.vulcan.util.OrderedIntervals;
import org.cadixdev.vulcan.visitor.TokenMappings;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link TokenMappings} for the emitter, one JSON document per file.
 * Every interval is written as a {@code [start, end]} pair of global token
 * indices; scope insertion points have {@code start == end}.
 */
public final class MappingsWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private MappingsWriter() {
    }

    public static JsonObject toJson(String fileName, TokenMappings mappings) {
        JsonObject obj = new JsonObject();
        obj.addProperty("file", fileName);
        obj.add("scope_delegates", toJson(mappings.scopeDelegates()));
        obj.add("value_aggregates", toJson(mappings.valueAggregates()));
        return obj;
    }

    private static JsonArray toJson(OrderedIntervals intervals) {
        JsonArray array = new JsonArray();
        for (Interval interval : intervals) {
            JsonArray pair = new JsonArray();
            pair.add(interval.start());
            pair.add(interval.end());
            array.add(pair);
        }
        return array;
    }

    public static void write(Path path, String fileName, TokenMappings mappings) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(fileName, mappings), writer);
        }
    }
}
