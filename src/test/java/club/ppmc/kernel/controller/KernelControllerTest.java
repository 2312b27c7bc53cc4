package club.ppmc.kernel.controller;

import club.ppmc.kernel.model.PoolStats;
import club.ppmc.kernel.model.WorkerSnapshot;
import club.ppmc.kernel.pool.WorkerPool;
import club.ppmc.kernel.service.KernelExecutionService;
import club.ppmc.kernel.session.KernelSessionRegistry;
import club.ppmc.kernel.session.KernelSessionRegistry.SessionInfo;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class KernelControllerTest {

    private final WorkerPool pool = mock(WorkerPool.class);
    private final KernelSessionRegistry registry = mock(KernelSessionRegistry.class);
    private final KernelExecutionService executionService = mock(KernelExecutionService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new KernelController(pool, registry, executionService)).build();
    }

    @Test
    void poolReportsStatsAndWorkers() throws Exception {
        when(pool.stats()).thenReturn(new PoolStats(2, 1, 1, 0, 1, 1, 3));
        when(pool.workers()).thenReturn(List.of(new WorkerSnapshot(1, 4242, false, true, false, "s1:c1:1")));
        when(pool.getPerJobTimeoutMs()).thenReturn(10_000L);

        mockMvc.perform(get("/api/kernel/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.queued").value(3))
                .andExpect(jsonPath("$.workers[0].pid").value(4242))
                .andExpect(jsonPath("$.workers[0].currentJobId").value("s1:c1:1"))
                .andExpect(jsonPath("$.perJobTimeoutMs").value(10_000));
    }

    @Test
    void sessionsAreListed() throws Exception {
        when(registry.sessions()).thenReturn(List.of(new SessionInfo("s1", "conn-1", null, Instant.EPOCH)));

        mockMvc.perform(get("/api/kernel/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sessionId").value("s1"))
                .andExpect(jsonPath("$[0].ownerId").value("conn-1"));
    }

    @Test
    void cancelUnknownSessionIsNotFound() throws Exception {
        when(executionService.cancel("s1")).thenReturn(true);

        mockMvc.perform(post("/api/kernel/sessions/s1/cancel")).andExpect(status().isOk());
        mockMvc.perform(post("/api/kernel/sessions/nope/cancel"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message", containsString("nope")));
    }

    @Test
    void closeSession() throws Exception {
        when(executionService.close("s1")).thenReturn(true);

        mockMvc.perform(delete("/api/kernel/sessions/s1")).andExpect(status().isOk());
        mockMvc.perform(delete("/api/kernel/sessions/s2")).andExpect(status().isNotFound());
        verify(executionService).close("s2");
    }
}
