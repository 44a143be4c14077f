package ai.eigloo.contactflow.graph;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads test fixtures from the classpath.
 */
public final class TestResourceUtils {

    private TestResourceUtils() {
    }

    public static String readResource(String path) {
        try (InputStream in = TestResourceUtils.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Test resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
