package de.mirkosertic.vectorsync.state;

import de.mirkosertic.vectorsync.store.IndexStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("StatePersistenceScheduler Tests")
class StatePersistenceSchedulerTest {

    private static PersistedState stateWith(final String id) {
        return new PersistedState(List.of(new PersistedState.FolderState(id, "/data/" + id, List.of("text"),
                "rag_" + id, "WATCHING", 100, 1L)));
    }

    @Test
    @DisplayName("Should coalesce a burst of requests into one write")
    void coalesces() throws Exception {
        final WatcherStateRepository repository = mock(WatcherStateRepository.class);
        final StatePersistenceScheduler scheduler = new StatePersistenceScheduler(
                repository, () -> PersistedState.EMPTY, 200);

        scheduler.saveNow();
        for (int i = 0; i < 10; i++) {
            scheduler.requestSave();
        }

        verify(repository, timeout(2000).times(2)).save(PersistedState.EMPTY);
        verify(repository, after(400).times(2)).save(any());
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Should save the current state immediately on demand")
    void saveNow() throws Exception {
        final WatcherStateRepository repository = mock(WatcherStateRepository.class);
        final AtomicReference<PersistedState> current = new AtomicReference<>(stateWith("a"));
        final StatePersistenceScheduler scheduler = new StatePersistenceScheduler(repository, current::get, 10_000);

        scheduler.saveNow();
        current.set(stateWith("b"));
        scheduler.saveNow();

        verify(repository).save(stateWith("a"));
        verify(repository).save(stateWith("b"));
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Should write the final state on shutdown")
    void shutdownWrites() throws Exception {
        final WatcherStateRepository repository = mock(WatcherStateRepository.class);
        final StatePersistenceScheduler scheduler = new StatePersistenceScheduler(
                repository, () -> stateWith("final"), 10_000);

        scheduler.shutdown();
        scheduler.requestSave();

        verify(repository, after(200).times(1)).save(stateWith("final"));
    }

    @Test
    @DisplayName("Should survive a failing write")
    void failingWrite() throws Exception {
        final WatcherStateRepository repository = mock(WatcherStateRepository.class);
        doThrow(new IndexStoreException("down"))
                .doNothing()
                .when(repository).save(any());
        final StatePersistenceScheduler scheduler = new StatePersistenceScheduler(
                repository, () -> PersistedState.EMPTY, 10);

        scheduler.saveNow();
        scheduler.requestSave();

        verify(repository, timeout(2000).times(2)).save(PersistedState.EMPTY);
        scheduler.shutdown();
    }
}
