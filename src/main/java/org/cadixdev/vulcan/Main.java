package org.cadixdev.vulcan;

import org.cadixdev.vulcan.resolver.AliasTable;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

public class Main {
    public static void main(String[] args) {
        final int ALIASES = 0;
        final int SOURCE_INPUT = 1;
        final int MAPPINGS_OUTPUT = 2;

        if (args.length != 3) {
            System.err.println("Usage: vulcan <aliases.json> <module-dir> <output-dir>");
            System.exit(2);
        }

        final Vulcan vulcan = new Vulcan();
        try {
            vulcan.setResolver(AliasTable.loadFile(Paths.get(args[ALIASES])));
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        vulcan.setFailFast(false);

        System.out.println("Mapping");
        final List<MappingException> failures;
        try {
            failures = vulcan.map(Paths.get(args[SOURCE_INPUT]), Paths.get(args[MAPPINGS_OUTPUT]));
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        for (MappingException failure : failures) {
            System.err.println("vulcan error: " + failure.getMessage());
        }
        System.out.println("Finished mapping");
        System.exit(failures.isEmpty() ? 0 : 1);
    }
}
