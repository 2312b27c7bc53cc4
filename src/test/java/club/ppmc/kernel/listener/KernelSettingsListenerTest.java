package club.ppmc.kernel.listener;

import club.ppmc.kernel.event.KernelSettingsChangedEvent;
import club.ppmc.kernel.model.KernelSettings;
import club.ppmc.kernel.pool.WorkerPool;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class KernelSettingsListenerTest {

    private final WorkerPool pool = mock(WorkerPool.class);
    private final KernelSettingsListener listener = new KernelSettingsListener(pool);

    private static KernelSettings withTimeout(long timeoutMs) {
        var settings = new KernelSettings();
        settings.setPerJobTimeoutMs(timeoutMs);
        return settings;
    }

    @Test
    void appliesChangedTimeoutToPool() {
        when(pool.getPerJobTimeoutMs()).thenReturn(10_000L);

        listener.onSettingsChanged(new KernelSettingsChangedEvent(withTimeout(10_000), withTimeout(3_000)));

        verify(pool).setPerJobTimeoutMs(3_000);
    }

    @Test
    void unchangedTimeoutIsLeftAlone() {
        when(pool.getPerJobTimeoutMs()).thenReturn(10_000L);
        KernelSettings resized = withTimeout(10_000);
        resized.setPoolSize(4);

        listener.onSettingsChanged(new KernelSettingsChangedEvent(withTimeout(10_000), resized));

        verify(pool, never()).setPerJobTimeoutMs(anyLong());
    }
}
