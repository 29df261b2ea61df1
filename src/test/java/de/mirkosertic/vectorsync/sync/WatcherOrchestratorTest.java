package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.extract.ContentCategory;
import de.mirkosertic.vectorsync.state.PersistedState;
import de.mirkosertic.vectorsync.state.WatcherStateRepository;
import de.mirkosertic.vectorsync.store.InMemoryVectorStore;
import de.mirkosertic.vectorsync.store.Metric;
import de.mirkosertic.vectorsync.store.VectorPoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WatcherOrchestrator Tests")
class WatcherOrchestratorTest {

    private static final Set<ContentCategory> TEXT = EnumSet.of(ContentCategory.TEXT);

    @TempDir
    Path tempDir;

    private Path root;
    private final List<SyncTestFixture> fixtures = new ArrayList<>();
    private final List<WatcherOrchestrator> orchestrators = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectory(tempDir.toRealPath().resolve("docs"));
    }

    @AfterEach
    void tearDown() {
        orchestrators.forEach(WatcherOrchestrator::shutdown);
        fixtures.forEach(SyncTestFixture::close);
    }

    private WatcherOrchestrator orchestrator(final InMemoryVectorStore store) {
        final SyncTestFixture fixture = new SyncTestFixture(store);
        fixtures.add(fixture);
        final WatcherOrchestrator orchestrator = new WatcherOrchestrator(fixture.services,
                new WatcherStateRepository(store));
        orchestrator.init();
        orchestrators.add(orchestrator);
        return orchestrator;
    }

    private static void awaitScan(final WatcherOrchestrator orchestrator, final Path folder) throws Exception {
        assertThat(orchestrator.lookup(folder).awaitScan(20, TimeUnit.SECONDS)).isTrue();
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        private InMemoryVectorStore store;
        private WatcherOrchestrator orchestrator;

        @BeforeEach
        void createOrchestrator() {
            store = new InMemoryVectorStore();
            orchestrator = orchestrator(store);
        }

        @Test
        @DisplayName("Should watch a folder and report it as watching once scanned")
        void watch() throws Exception {
            Files.writeString(root.resolve("a.txt"), SyncTestFixture.words("a", 30));

            final WatchedFolder folder = orchestrator.watchFolder(root, TEXT);
            awaitScan(orchestrator, root);

            assertThat(folder.rootPath()).isEqualTo(root);
            assertThat(folder.collectionName()).isEqualTo(CollectionNames.forPath("rag", root));
            assertThat(orchestrator.getWatchedFolders()).singleElement().satisfies(snapshot -> {
                assertThat(snapshot.status()).isEqualTo(SyncStatus.WATCHING);
                assertThat(snapshot.progressPercent()).isEqualTo(100);
                assertThat(snapshot.path()).isEqualTo(root.toString());
                assertThat(snapshot.countType()).isEqualTo("files");
            });
            assertThat(store.count(folder.collectionName())).isEqualTo(2);
        }

        @Test
        @DisplayName("Should reject a folder that is already watched")
        void alreadyWatched() {
            orchestrator.watchFolder(root, TEXT);

            assertThatThrownBy(() -> orchestrator.watchFolder(root, TEXT))
                    .isInstanceOf(AlreadyWatchedException.class);
        }

        @Test
        @DisplayName("Should reject nested and enclosing folders")
        void conflicts() throws Exception {
            final Path nested = Files.createDirectory(root.resolve("nested"));
            orchestrator.watchFolder(root, TEXT);

            assertThatThrownBy(() -> orchestrator.watchFolder(nested, TEXT))
                    .isInstanceOf(PathConflictException.class);
            assertThatThrownBy(() -> orchestrator.watchFolder(root.getParent(), TEXT))
                    .isInstanceOf(PathConflictException.class);
        }

        @Test
        @DisplayName("Should reject paths that are not directories")
        void pathNotFound() throws Exception {
            final Path file = Files.writeString(root.resolve("file.txt"), "x");

            assertThatThrownBy(() -> orchestrator.watchFolder(root.resolve("missing"), TEXT))
                    .isInstanceOf(PathNotFoundException.class);
            assertThatThrownBy(() -> orchestrator.watchFolder(file, TEXT))
                    .isInstanceOf(PathNotFoundException.class);
        }

        @Test
        @DisplayName("Should require at least one category")
        void noCategories() {
            assertThatThrownBy(() -> orchestrator.watchFolder(root, Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject operations on folders that are not watched")
        void notWatched() {
            assertThatThrownBy(() -> orchestrator.unwatchFolder(root)).isInstanceOf(NotWatchedException.class);
            assertThatThrownBy(() -> orchestrator.pauseFolder(root)).isInstanceOf(NotWatchedException.class);
            assertThatThrownBy(() -> orchestrator.resumeFolder(root)).isInstanceOf(NotWatchedException.class);
        }

        @Test
        @DisplayName("Should pause and resume a folder")
        void pauseResume() throws Exception {
            orchestrator.watchFolder(root, TEXT);
            awaitScan(orchestrator, root);

            orchestrator.pauseFolder(root);
            assertThat(orchestrator.getWatchedFolders().get(0).status()).isEqualTo(SyncStatus.PAUSED);

            orchestrator.resumeFolder(root);
            assertThat(orchestrator.getWatchedFolders().get(0).status()).isEqualTo(SyncStatus.WATCHING);
        }

        @Test
        @DisplayName("Should drop the collection when a folder is unwatched")
        void unwatch() throws Exception {
            Files.writeString(root.resolve("a.txt"), SyncTestFixture.words("a", 30));
            final WatchedFolder folder = orchestrator.watchFolder(root, TEXT);
            awaitScan(orchestrator, root);

            orchestrator.unwatchFolder(root);

            assertThat(orchestrator.getWatchedFolders()).isEmpty();
            assertThat(store.collectionExists(folder.collectionName())).isFalse();
            SyncTestFixture.awaitCondition(() -> !store.getMetadata(WatcherStateRepository.STATE_RECORD_ID)
                    .contains(root.toString()), 5000);
        }

        @Test
        @DisplayName("Long sibling folders keep separate collections")
        void longSiblingFolders() throws Exception {
            final String common = "a-rather-long-directory-name-for-checking-collection-names-";
            final Path one = Files.createDirectory(root.resolve(common + "one"));
            final Path two = Files.createDirectory(root.resolve(common + "two"));
            Files.writeString(one.resolve("a.txt"), SyncTestFixture.words("a", 10));
            Files.writeString(two.resolve("b.txt"), SyncTestFixture.words("b", 10));

            final WatchedFolder first = orchestrator.watchFolder(one, TEXT);
            final WatchedFolder second = orchestrator.watchFolder(two, TEXT);
            awaitScan(orchestrator, one);
            awaitScan(orchestrator, two);

            assertThat(first.collectionName()).isNotEqualTo(second.collectionName());
            assertThat(store.count(first.collectionName())).isEqualTo(1);
            assertThat(store.count(second.collectionName())).isEqualTo(1);

            orchestrator.unwatchFolder(one);

            assertThat(store.collectionExists(first.collectionName())).isFalse();
            assertThat(store.collectionExists(second.collectionName())).isTrue();
            assertThat(store.count(second.collectionName())).isEqualTo(1);
        }

        @Test
        @DisplayName("Should persist the registry after the scan")
        void persistsState() throws Exception {
            orchestrator.watchFolder(root, EnumSet.of(ContentCategory.TEXT, ContentCategory.PDF));
            awaitScan(orchestrator, root);

            final PersistedState state = new WatcherStateRepository(store).load();

            assertThat(state.folders()).singleElement().satisfies(folder -> {
                assertThat(folder.path()).isEqualTo(root.toString());
                assertThat(folder.categories()).containsExactly("pdf", "text");
                assertThat(folder.status()).isEqualTo("WATCHING");
            });
        }
    }

    @Nested
    @DisplayName("Restore")
    class Restore {

        @Test
        @DisplayName("Should resume cleanly watched folders without rewriting fragments")
        void restoreAfterShutdown() throws Exception {
            Files.writeString(root.resolve("a.txt"), SyncTestFixture.words("a", 30));
            final InMemoryVectorStore store = new InMemoryVectorStore();
            final WatcherOrchestrator first = orchestrator(store);
            final WatchedFolder folder = first.watchFolder(root, TEXT);
            awaitScan(first, root);
            first.shutdown();
            store.resetCounters();

            final WatcherOrchestrator second = orchestrator(store);
            assertThat(second.restore()).isEqualTo(1);
            awaitScan(second, root);

            assertThat(second.getWatchedFolders()).singleElement().satisfies(snapshot -> {
                assertThat(snapshot.id()).isEqualTo(folder.id());
                assertThat(snapshot.status()).isEqualTo(SyncStatus.WATCHING);
            });
            assertThat(store.getUpsertCalls()).isZero();
        }

        @Test
        @DisplayName("A crash during the scan restores to the same index as a fresh scan")
        void crashDuringScan() throws Exception {
            final Path a = Files.writeString(root.resolve("a.txt"), SyncTestFixture.words("a", 45));
            Files.writeString(root.resolve("b.txt"), SyncTestFixture.words("b", 30));
            final String collection = CollectionNames.forPath("rag", root);

            // Reference: a fresh scan
            final InMemoryVectorStore reference = new InMemoryVectorStore();
            final WatcherOrchestrator fresh = orchestrator(reference);
            fresh.watchFolder(root, TEXT);
            awaitScan(fresh, root);
            fresh.shutdown();

            // Crashed: state says SCANNING, the index holds an outdated fragment and one of a vanished file
            final InMemoryVectorStore crashed = new InMemoryVectorStore();
            crashed.createCollection(collection, SyncTestFixture.DIMENSION, Metric.COSINE);
            final float[] vector = new float[SyncTestFixture.DIMENSION];
            vector[0] = 1f;
            crashed.upsert(collection, List.of(
                    new VectorPoint("outdated-0", vector,
                            Map.of("path", a.toString(), "fingerprint", "outdated", "chunk_index", 0)),
                    new VectorPoint("vanished-0", vector,
                            Map.of("path", root.resolve("gone.txt").toString(), "fingerprint", "x", "chunk_index", 0))));
            new WatcherStateRepository(crashed).save(new PersistedState(List.of(new PersistedState.FolderState(
                    "folder-1", root.toString(), List.of("text"), collection, "SCANNING", 30, 1L))));

            final WatcherOrchestrator restored = orchestrator(crashed);
            assertThat(restored.restore()).isEqualTo(1);
            awaitScan(restored, root);

            assertThat(crashed.points(collection).keySet()).isEqualTo(reference.points(collection).keySet());
            assertThat(restored.getWatchedFolders().get(0).status()).isEqualTo(SyncStatus.WATCHING);
        }

        @Test
        @DisplayName("Should keep folders whose directory is missing in the state")
        void missingDirectory() throws Exception {
            final InMemoryVectorStore store = new InMemoryVectorStore();
            final Path missing = tempDir.toRealPath().resolve("missing");
            new WatcherStateRepository(store).save(new PersistedState(List.of(new PersistedState.FolderState(
                    "folder-9", missing.toString(), List.of("text"), "rag_missing", "WATCHING", 100, 1L))));

            final WatcherOrchestrator orchestrator = orchestrator(store);

            assertThat(orchestrator.restore()).isZero();
            assertThat(orchestrator.getWatchedFolders()).isEmpty();
            assertThat(orchestrator.currentState().folders()).extracting(PersistedState.FolderState::id)
                    .containsExactly("folder-9");

            orchestrator.unwatchFolder(missing);
            assertThat(orchestrator.currentState().folders()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a folder whose collection belongs to a dormant folder")
        void collectionTakenByDormantFolder() throws Exception {
            final InMemoryVectorStore store = new InMemoryVectorStore();
            final Path missing = tempDir.toRealPath().resolve("missing");
            new WatcherStateRepository(store).save(new PersistedState(List.of(new PersistedState.FolderState(
                    "folder-9", missing.toString(), List.of("text"), CollectionNames.forPath("rag", root),
                    "WATCHING", 100, 1L))));
            final WatcherOrchestrator orchestrator = orchestrator(store);
            orchestrator.restore();

            assertThatThrownBy(() -> orchestrator.watchFolder(root, TEXT))
                    .isInstanceOf(PathConflictException.class);
            assertThat(orchestrator.getWatchedFolders()).isEmpty();
        }

        @Test
        @DisplayName("Should watch configured folders once")
        void configuredFolders() throws Exception {
            final WatcherOrchestrator orchestrator = orchestrator(new InMemoryVectorStore());

            orchestrator.watchConfiguredFolders(List.of(root.toString(), root.toString(),
                    tempDir.resolve("does-not-exist").toString()), TEXT);
            awaitScan(orchestrator, root);

            assertThat(orchestrator.getWatchedFolders()).hasSize(1);
        }
    }
}
