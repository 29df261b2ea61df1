package de.mirkosertic.vectorsync.state;

import de.mirkosertic.vectorsync.config.BuildInfo;
import de.mirkosertic.vectorsync.store.InMemoryVectorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WatcherStateRepository Tests")
class WatcherStateRepositoryTest {

    private InMemoryVectorStore store;
    private WatcherStateRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        repository = new WatcherStateRepository(store);
    }

    @Test
    @DisplayName("Should return the empty state when nothing was saved")
    void emptyWhenMissing() throws Exception {
        assertThat(repository.load()).isEqualTo(PersistedState.EMPTY);
    }

    @Test
    @DisplayName("Should load what was saved")
    void saveAndLoad() throws Exception {
        final PersistedState state = new PersistedState(List.of(
                new PersistedState.FolderState("id-1", "/data/docs", List.of("text", "pdf"),
                        "rag_data_docs", "WATCHING", 100, 1700000000000L),
                new PersistedState.FolderState("id-2", "/data/papers", List.of("document"),
                        "rag_data_papers", "SCANNING", 40, 1700000001000L)));

        repository.save(state);

        assertThat(repository.load()).isEqualTo(state);
        assertThat(store.getMetadata(WatcherStateRepository.STATE_RECORD_ID)).contains("rag_data_docs");
    }

    @Test
    @DisplayName("Should write a versioned YAML document")
    void yamlFormat() {
        final String yaml = repository.serialize(new PersistedState(List.of(
                new PersistedState.FolderState("id-1", "/data/docs", List.of("text"),
                        "rag_data_docs", "PAUSED", 7, 42L))));

        assertThat(yaml).contains("version: 1")
                .contains("path: /data/docs")
                .contains("collection: rag_data_docs")
                .contains("status: PAUSED");
    }

    @Test
    @DisplayName("Should fall back to defaults for missing optional keys")
    void defaults() {
        final PersistedState state = repository.parse("""
                version: 1
                folders:
                  - id: abc
                    path: /data/docs
                    collection: rag_data_docs
                """);

        assertThat(state.folders()).singleElement().satisfies(folder -> {
            assertThat(folder.categories()).isEmpty();
            assertThat(folder.status()).isEqualTo("INITIALIZING");
            assertThat(folder.progressPercent()).isZero();
            assertThat(folder.createdAt()).isZero();
        });
    }

    @Test
    @DisplayName("Should start empty when the stored state is corrupt")
    void corruptState() throws Exception {
        store.putMetadata(WatcherStateRepository.STATE_RECORD_ID, "folders: [ {id: 1, path: [unclosed");

        assertThat(repository.load()).isEqualTo(PersistedState.EMPTY);
    }

    @Test
    @DisplayName("Should treat a document without folders as empty")
    void noFolders() {
        assertThat(repository.parse("version: 1\n")).isEqualTo(PersistedState.EMPTY);
    }

    @Test
    @DisplayName("Should stamp the engine version and read state written by another version")
    void engineVersion() throws Exception {
        final PersistedState state = new PersistedState(List.of(
                new PersistedState.FolderState("id-1", "/data/docs", List.of("text"),
                        "rag_data_docs", "WATCHING", 100, 1L)));
        new WatcherStateRepository(store, new BuildInfo("2.0.0", "unknown")).save(state);

        assertThat(store.getMetadata(WatcherStateRepository.STATE_RECORD_ID)).contains("engine: 2.0.0");
        assertThat(new WatcherStateRepository(store, new BuildInfo("2.1.0", "unknown")).load()).isEqualTo(state);
    }
}
