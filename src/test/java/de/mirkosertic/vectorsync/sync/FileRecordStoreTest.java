package de.mirkosertic.vectorsync.sync;

import de.mirkosertic.vectorsync.store.StoredPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FileRecordStore Tests")
class FileRecordStoreTest {

    private static StoredPoint point(final String id, final String path, final String fingerprint, final int ordinal) {
        return new StoredPoint(id, Map.of("path", path, "fingerprint", fingerprint, "chunk_index", ordinal));
    }

    @Test
    @DisplayName("Should rebuild ordered records from stored points")
    void rebuild() {
        final FileRecordStore store = new FileRecordStore();

        store.rebuildFrom(List.of(
                point("a2", "/docs/a.txt", "fa", 2),
                point("a0", "/docs/a.txt", "fa", 0),
                point("a1", "/docs/a.txt", "fa", 1),
                point("b0", "/docs/b.txt", "fb", 0)));

        assertThat(store.size()).isEqualTo(2);
        final FileRecord a = store.get(Path.of("/docs/a.txt"));
        assertThat(a).isNotNull();
        assertThat(a.fragmentIds()).containsExactly("a0", "a1", "a2");
        assertThat(a.lastSyncedFingerprint()).isEqualTo("fa");
        assertThat(a.isUpToDate("fa")).isTrue();
    }

    @Test
    @DisplayName("Should mark records with mixed fingerprints as not synced")
    void mixedFingerprints() {
        final FileRecordStore store = new FileRecordStore();

        store.rebuildFrom(List.of(
                point("old0", "/docs/a.txt", "old", 0),
                point("new0", "/docs/a.txt", "new", 0),
                point("new1", "/docs/a.txt", "new", 1)));

        final FileRecord record = store.get(Path.of("/docs/a.txt"));
        assertThat(record).isNotNull();
        assertThat(record.lastSyncedFingerprint()).isNull();
        assertThat(record.fragmentIds()).containsExactlyInAnyOrder("old0", "new0", "new1");
        assertThat(record.isUpToDate("new")).isFalse();
    }

    @Test
    @DisplayName("Should skip points without a path")
    void pointsWithoutPath() {
        final FileRecordStore store = new FileRecordStore();

        store.rebuildFrom(List.of(new StoredPoint("orphan", Map.of("chunk_index", 0))));

        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should find records below a directory")
    void recordsBelow() {
        final FileRecordStore store = new FileRecordStore();
        store.put(FileRecord.synced(Path.of("/docs/sub/a.txt"), "f", List.of("1")));
        store.put(FileRecord.synced(Path.of("/docs/sub/deeper/b.txt"), "f", List.of("2")));
        store.put(FileRecord.synced(Path.of("/docs/subway.txt"), "f", List.of("3")));

        assertThat(store.recordsAtOrBelow(Path.of("/docs/sub")))
                .extracting(FileRecord::path)
                .containsExactlyInAnyOrder(Path.of("/docs/sub/a.txt"), Path.of("/docs/sub/deeper/b.txt"));
    }

    @Test
    @DisplayName("Stale ids never overlap current ids")
    void staleIds() {
        final FileRecord record = FileRecord.synced(Path.of("/a"), "f", List.of("1", "2"))
                .withStale(Set.of("2", "3"));

        assertThat(record.staleFragmentIds()).containsExactly("3");
        assertThat(record.allIds()).containsExactlyInAnyOrder("1", "2", "3");
        assertThat(record.isUpToDate("f")).isFalse();
    }

    @Test
    @DisplayName("Ids claimed by another path are taken from their holder")
    void releaseForeignIds() {
        final FileRecordStore store = new FileRecordStore();
        final Path renamed = Path.of("/docs/b.txt");
        final Path recreated = Path.of("/docs/a.txt");
        store.put(FileRecord.synced(renamed, "f", List.of("1", "2", "3")));

        assertThat(store.releaseForeignIds(recreated, List.of("1", "2", "3"))).containsExactly(renamed);

        final FileRecord holder = store.get(renamed);
        assertThat(holder).isNotNull();
        assertThat(holder.fragmentIds()).isEmpty();
        assertThat(holder.isUpToDate("f")).isFalse();
        assertThat(store.ownerOf("1")).isNull();

        store.put(FileRecord.synced(recreated, "f", List.of("1", "2", "3")));
        assertThat(store.ownerOf("2")).isEqualTo(recreated);
        assertThat(store.releaseForeignIds(recreated, List.of("1", "2", "3"))).isEmpty();
    }

    @Test
    @DisplayName("Removing a record frees its ids")
    void removeReleasesOwnership() {
        final FileRecordStore store = new FileRecordStore();
        store.put(FileRecord.synced(Path.of("/docs/a.txt"), "f", List.of("1")).withStale(Set.of("9")));

        assertThat(store.ownerOf("9")).isEqualTo(Path.of("/docs/a.txt"));
        store.remove(Path.of("/docs/a.txt"));

        assertThat(store.ownerOf("1")).isNull();
        assertThat(store.ownerOf("9")).isNull();
    }
}
