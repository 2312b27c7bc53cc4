package club.ppmc.kernel.worker;

import club.ppmc.kernel.model.NotebookEnv;
import club.ppmc.kernel.util.SystemCommandExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class NotebookEnvironmentTest {

    @TempDir
    Path workspace;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SystemCommandExecutor executor = mock(SystemCommandExecutor.class);
    private final List<String> progress = new ArrayList<>();
    private NotebookEnvironment environment;
    private Path sandbox;

    @BeforeEach
    void setUp() throws Exception {
        environment = new NotebookEnvironment(workspace, "npm", executor, objectMapper);
        sandbox = environment.sandboxFor("nb-1");
    }

    private static NotebookEnv withPackages(Map<String, String> packages) {
        return new NotebookEnv("graaljs", null, packages, null);
    }

    @SuppressWarnings("unchecked")
    private void installSucceeds() {
        when(executor.executeCommand(anyList(), any(File.class), any())).thenAnswer(invocation -> {
            Consumer<String> output = invocation.getArgument(2);
            output.accept("added 1 package");
            return CompletableFuture.completedFuture(0);
        });
    }

    @Test
    void sanitizesNotebookIds() {
        assertEquals("analysis-1.v2_x", NotebookEnvironment.sanitize("analysis-1.v2_x"));
        assertEquals("a_.._b", NotebookEnvironment.sanitize("a/../b"));
        assertEquals("default", NotebookEnvironment.sanitize(".."));
        assertEquals("default", NotebookEnvironment.sanitize(""));
        assertEquals("default", NotebookEnvironment.sanitize(null));
    }

    @Test
    void packagesKeyIsSortedByName() {
        assertEquals("axios@^1.6.0,lodash@4.17.21",
                NotebookEnvironment.packagesKey(Map.of("lodash", "4.17.21", "axios", "^1.6.0")));
        assertEquals("", NotebookEnvironment.packagesKey(Map.of()));
    }

    @Test
    void sandboxLivesUnderWorkspace() {
        assertTrue(Files.isDirectory(sandbox));
        assertEquals(workspace.toAbsolutePath().normalize().resolve("nb-1"), sandbox);
    }

    @Test
    void emptyEnvironmentNeedsNoInstall() throws Exception {
        assertFalse(environment.prepare(sandbox, NotebookEnv.empty(), progress::add, new CancellationToken()));
        verifyNoInteractions(executor);
    }

    @Test
    void installsDeclaredPackagesOnce() throws Exception {
        installSucceeds();
        NotebookEnv env = withPackages(Map.of("left-pad", "1.3.0"));

        assertTrue(environment.prepare(sandbox, env, progress::add, new CancellationToken()));
        assertFalse(environment.prepare(sandbox, env, progress::add, new CancellationToken()));

        verify(executor, times(1))
                .executeCommand(eq(List.of("npm", "install", "--no-audit", "--no-fund")), eq(sandbox.toFile()), any());
        assertEquals(List.of("Installing left-pad@1.3.0", "added 1 package"), progress);
        JsonNode packageJson = objectMapper.readTree(sandbox.resolve("package.json").toFile());
        assertEquals("1.3.0", packageJson.get("dependencies").get("left-pad").asText());
        assertTrue(Files.exists(sandbox.resolve(NotebookEnvironment.STATE_FILE)));
    }

    @Test
    void changedPackagesTriggerReinstall() throws Exception {
        installSucceeds();

        environment.prepare(sandbox, withPackages(Map.of("a", "1")), progress::add, new CancellationToken());
        environment.prepare(sandbox, withPackages(Map.of("a", "2")), progress::add, new CancellationToken());

        verify(executor, times(2)).executeCommand(anyList(), any(File.class), any());
    }

    @Test
    void removingAllPackagesCleansSandbox() throws Exception {
        installSucceeds();
        environment.prepare(sandbox, withPackages(Map.of("a", "1")), progress::add, new CancellationToken());
        Files.createDirectories(sandbox.resolve("node_modules").resolve("a"));

        assertTrue(environment.prepare(sandbox, NotebookEnv.empty(), progress::add, new CancellationToken()));

        assertFalse(Files.exists(sandbox.resolve("node_modules")));
        assertFalse(Files.exists(sandbox.resolve("package.json")));
    }

    @Test
    void nonZeroExitCodeFailsInstall() {
        when(executor.executeCommand(anyList(), any(File.class), any()))
                .thenReturn(CompletableFuture.completedFuture(1));

        var e = assertThrows(DependencyInstallException.class, () -> environment.prepare(
                sandbox, withPackages(Map.of("a", "1")), progress::add, new CancellationToken()));

        assertEquals("npm install exited with code 1", e.getMessage());
        assertFalse(Files.exists(sandbox.resolve(NotebookEnvironment.STATE_FILE)));
    }

    @Test
    void missingNpmFailsInstall() {
        when(executor.executeCommand(anyList(), any(File.class), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("npm not found")));

        var e = assertThrows(DependencyInstallException.class, () -> environment.prepare(
                sandbox, withPackages(Map.of("a", "1")), progress::add, new CancellationToken()));

        assertEquals("npm not found", e.getMessage());
    }

    @Test
    void stoppedJobAbortsInstall() {
        var pending = new CompletableFuture<Integer>();
        when(executor.executeCommand(anyList(), any(File.class), any())).thenReturn(pending);
        var token = new CancellationToken();
        token.cancel();

        assertThrows(JobStoppedException.class, () -> environment.prepare(
                sandbox, withPackages(Map.of("a", "1")), progress::add, token));

        assertTrue(pending.isCancelled());
    }
}
