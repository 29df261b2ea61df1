package de.mirkosertic.vectorsync.state;

import de.mirkosertic.vectorsync.config.BuildInfo;
import de.mirkosertic.vectorsync.store.IndexStoreException;
import de.mirkosertic.vectorsync.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and saves the {@link PersistedState} as a YAML document in the vector store's
 * metadata area, under a fixed record id. Each document names the engine version that
 * wrote it.
 */
public class WatcherStateRepository {

    private static final Logger logger = LoggerFactory.getLogger(WatcherStateRepository.class);

    public static final String STATE_RECORD_ID = "f0f0f0f0-0000-0000-0000-000000000001";
    static final int FORMAT_VERSION = 1;

    private final VectorStore vectorStore;
    private final BuildInfo buildInfo;
    private final Yaml yaml;

    public WatcherStateRepository(final VectorStore vectorStore) {
        this(vectorStore, BuildInfo.current());
    }

    public WatcherStateRepository(final VectorStore vectorStore, final BuildInfo buildInfo) {
        this.vectorStore = vectorStore;
        this.buildInfo = buildInfo;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * @return the stored state, or {@link PersistedState#EMPTY} if there is none or it cannot be parsed
     */
    public synchronized PersistedState load() throws IndexStoreException {
        final String blob = vectorStore.getMetadata(STATE_RECORD_ID);
        if (blob == null || blob.isBlank()) {
            logger.debug("No persisted watcher state found");
            return PersistedState.EMPTY;
        }
        try {
            final PersistedState state = parse(blob);
            logger.info("Loaded persisted state with {} folder(s)", state.folders().size());
            return state;
        } catch (final YAMLException | ClassCastException | NullPointerException e) {
            logger.error("Invalid persisted watcher state, starting with an empty registry", e);
            return PersistedState.EMPTY;
        }
    }

    public synchronized void save(final PersistedState state) throws IndexStoreException {
        vectorStore.putMetadata(STATE_RECORD_ID, serialize(state));
        logger.debug("Saved persisted state with {} folder(s)", state.folders().size());
    }

    String serialize(final PersistedState state) {
        final List<Map<String, Object>> folders = new ArrayList<>();
        for (final PersistedState.FolderState folder : state.folders()) {
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", folder.id());
            entry.put("path", folder.path());
            entry.put("categories", new ArrayList<>(folder.categories()));
            entry.put("collection", folder.collectionName());
            entry.put("status", folder.status());
            entry.put("progress", folder.progressPercent());
            entry.put("createdAt", folder.createdAt());
            folders.add(entry);
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", FORMAT_VERSION);
        root.put("engine", buildInfo.version());
        root.put("folders", folders);
        return yaml.dump(root);
    }

    @SuppressWarnings("unchecked")
    PersistedState parse(final String blob) {
        final Map<String, Object> root = yaml.load(blob);
        if (root == null) {
            return PersistedState.EMPTY;
        }
        final Object writer = root.get("engine");
        if (writer != null && !buildInfo.version().equals(String.valueOf(writer))) {
            logger.info("Persisted state was written by version {}, running {}", writer, buildInfo.version());
        }
        final Object foldersObj = root.get("folders");
        if (!(foldersObj instanceof List)) {
            return PersistedState.EMPTY;
        }

        final List<PersistedState.FolderState> folders = new ArrayList<>();
        for (final Map<String, Object> entry : (List<Map<String, Object>>) foldersObj) {
            folders.add(new PersistedState.FolderState(
                    (String) entry.get("id"),
                    (String) entry.get("path"),
                    (List<String>) entry.getOrDefault("categories", List.of()),
                    (String) entry.get("collection"),
                    (String) entry.getOrDefault("status", "INITIALIZING"),
                    ((Number) entry.getOrDefault("progress", 0)).intValue(),
                    ((Number) entry.getOrDefault("createdAt", 0L)).longValue()));
        }
        return new PersistedState(folders);
    }
}
