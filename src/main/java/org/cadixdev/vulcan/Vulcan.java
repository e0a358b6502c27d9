/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan;

import org.cadixdev.vulcan.io.MappingsWriter;
import org.cadixdev.vulcan.io.ModuleReader;
import org.cadixdev.vulcan.resolver.SymbolResolver;
import org.cadixdev.vulcan.visitor.TokenMappingVisitor;
import org.cadixdev.vulcan.visitor.TokenMappings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Computes the D1 to D2 token mappings for parsed modules.
 *
 * <p>The resolver must be fully populated before mapping starts; it is only
 * read from afterwards.</p>
 */
public final class Vulcan {

    private static final String MODULE_EXTENSION = ".json";

    private SymbolResolver resolver = SymbolResolver.NONE;
    private boolean failFast = true;

    public SymbolResolver getResolver() {
        return this.resolver;
    }

    public void setResolver(SymbolResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public boolean isFailFast() {
        return this.failFast;
    }

    /**
     * Whether the first file that fails to map aborts a directory run. When
     * disabled, failing files are skipped and reported by
     * {@link #map(Path, Path)}.
     */
    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public TokenMappings map(ParsedModule module) {
        return TokenMappingVisitor.map(module, this.resolver);
    }

    /**
     * Maps every serialized module under {@code sourceDir} and writes one
     * mappings file per module to the same relative path under
     * {@code outputDir}.
     *
     * @return the failures of the files that were skipped, empty when every
     *         file mapped cleanly
     */
    public List<MappingException> map(Path sourceDir, Path outputDir) throws IOException {
        // Mappings written by an earlier run into a nested output dir are not modules
        final Path sourceRoot = sourceDir.toAbsolutePath().normalize();
        final Path outputRoot = outputDir.toAbsolutePath().normalize();
        final boolean nestedOutput = !outputRoot.equals(sourceRoot) && outputRoot.startsWith(sourceRoot);

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            sources = walk.filter(Files::isRegularFile)
                    .filter(path -> !nestedOutput || !path.toAbsolutePath().normalize().startsWith(outputRoot))
                    .filter(path -> path.getFileName().toString().endsWith(MODULE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<MappingException> failures = new ArrayList<>();
        for (Path source : sources) {
            try {
                ParsedModule module = ModuleReader.read(source);
                TokenMappings mappings = this.map(module);
                MappingsWriter.write(outputDir.resolve(sourceDir.relativize(source)), module.fileName(), mappings);
            } catch (MappingException e) {
                if (this.failFast) {
                    throw e;
                }
                failures.add(e);
            }
        }
        return failures;
    }
}
