package com.codewatch;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Source fixtures under {@code src/test/resources/samples}.
 */
public final class Samples {

    private Samples() {}

    /** 22 lines with three security issues and five bugs. */
    public static String vulnerable() {
        return load("vulnerable.py");
    }

    public static String clean() {
        return load("clean.py");
    }

    private static String load(String name) {
        try (InputStream in = Samples.class.getResourceAsStream("/samples/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing sample " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
