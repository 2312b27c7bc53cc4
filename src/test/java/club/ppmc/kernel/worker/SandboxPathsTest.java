/**
 * SandboxPathsTest.java
 */
package club.ppmc.kernel.worker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SandboxPathsTest {

    @TempDir
    Path temp;

    private Path root;
    private SandboxPaths paths;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(temp.resolve("sandbox"));
        paths = new SandboxPaths(root);
    }

    @Test
    void resolvesRelativePathsInsideTheSandbox() {
        assertEquals(root.toAbsolutePath().normalize().resolve("data/a.txt"), paths.resolve("data/a.txt"));
        assertEquals(paths.root(), paths.resolve("."));
        assertEquals(paths.root().resolve("b"), paths.resolve("x/../b"));
    }

    @Test
    void rejectsEscapes() {
        SecurityException error = assertThrows(SecurityException.class, () -> paths.resolve("../secret"));
        assertEquals("Access to path \"../secret\" is not allowed in this notebook runtime", error.getMessage());
        assertThrows(SecurityException.class, () -> paths.resolve("/etc/passwd"));
        assertThrows(SecurityException.class, () -> paths.check(temp.resolve("other")));
    }

    @Test
    void acceptsAbsolutePathsInsideTheSandbox() {
        Path inside = root.resolve("nested/file.js");

        assertEquals(inside.toAbsolutePath().normalize(), paths.check(inside));
    }

    @Test
    void rejectsSymlinksPointingOutside() throws IOException {
        Path outside = Files.createDirectories(temp.resolve("outside"));
        Path link = root.resolve("link");
        try {
            Files.createSymbolicLink(link, outside);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported here");
        }

        assertFalse(paths.isWithin(link.resolve("file.txt")));
        assertThrows(SecurityException.class, () -> paths.resolve("link/file.txt"));
    }
}
