package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.util.AtomicFiles;
import org.netpreserve.docketcrawl.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Crash-safe checkpoint of each case's progress, kept in {@code _progress.json} of the case directory. Every change
 * is committed immediately by writing a temporary file and renaming it over the checkpoint. All methods are
 * synchronized so there is a single writer.
 */
public class ProgressStore {
    private static final Logger log = LoggerFactory.getLogger(ProgressStore.class);
    public static final String FILENAME = "_progress.json";
    private final Path outputRoot;
    private final Clock clock;
    private final Map<String, ProgressState> states = new HashMap<>();

    public ProgressStore(Path outputRoot, Clock clock) {
        this.outputRoot = outputRoot;
        this.clock = clock;
    }

    /**
     * Directory holding everything written for the case.
     */
    public Path caseDirectory(String caseIdentifier) {
        try {
            return outputRoot.resolve(directoryName(caseIdentifier, true));
        } catch (InvalidPathException e) {
            // non-ASCII file names can't be encoded, e.g. when the JVM runs under the C locale
            log.atDebug().addKeyValue("case", caseIdentifier).log("Using ASCII case directory: {}", e.getMessage());
            return outputRoot.resolve(directoryName(caseIdentifier, false));
        }
    }

    static String directoryName(String caseIdentifier, boolean unicode) {
        var caseNumber = new CaseNumber(caseIdentifier);
        return "case_" + (unicode ? caseNumber.safeName() : caseNumber.asciiName());
    }

    private Path file(String caseIdentifier) {
        return caseDirectory(caseIdentifier).resolve(FILENAME);
    }

    public synchronized Optional<ProgressState> load(String caseIdentifier) throws IOException {
        Path file = file(caseIdentifier);
        if (!Files.exists(file)) return Optional.empty();
        ProgressState state = Json.MAPPER.readValue(file.toFile(), ProgressState.class);
        states.put(caseIdentifier, state);
        log.atInfo().addKeyValue("case", caseIdentifier).addKeyValue("completed", state.completed().size())
                .addKeyValue("skipped", state.skipped().size()).log("Loaded progress");
        return Optional.of(state);
    }

    public synchronized void commit(String caseIdentifier, ProgressState state) throws IOException {
        AtomicFiles.write(file(caseIdentifier), Json.MAPPER.writeValueAsBytes(state));
        states.put(caseIdentifier, state);
    }

    /**
     * Latest committed (or loaded) state, an empty one if there is none.
     */
    public synchronized ProgressState current(String caseIdentifier) {
        return states.getOrDefault(caseIdentifier, ProgressState.empty(caseIdentifier, clock.instant()));
    }

    public synchronized ProgressState markDone(String caseIdentifier, DocumentIdentity identity) {
        return update(caseIdentifier, current(caseIdentifier).withDone(identity.key(), clock.instant()));
    }

    public synchronized ProgressState markPermanentlySkipped(String caseIdentifier, DocumentIdentity identity,
                                                             String reason) {
        return update(caseIdentifier, current(caseIdentifier).withSkipped(identity.key(), reason, clock.instant()));
    }

    public synchronized ProgressState markPaused(String caseIdentifier, String reason) {
        return update(caseIdentifier, current(caseIdentifier).withPaused(reason, clock.instant()));
    }

    public synchronized ProgressState markStarted(String caseIdentifier) {
        return update(caseIdentifier, current(caseIdentifier).started(clock.instant()));
    }

    public synchronized ProgressState markOutcome(String caseIdentifier, CrawlOutcome outcome) {
        return update(caseIdentifier, current(caseIdentifier).withOutcome(outcome, clock.instant()));
    }

    /**
     * Moves an existing checkpoint aside so the next run starts from scratch. The document records go with it,
     * under the same timestamp, so every record left in the case directory has an entry in the checkpoint.
     *
     * @return where the old checkpoint went, empty if there was none
     */
    public synchronized Optional<Path> archive(String caseIdentifier) throws IOException {
        states.remove(caseIdentifier);
        long timestamp = clock.millis();
        Path documents = caseDirectory(caseIdentifier).resolve(CaseOutput.DOCUMENTS);
        if (Files.isDirectory(documents)) {
            Path target = documents.resolveSibling(CaseOutput.DOCUMENTS + "." + timestamp);
            Files.move(documents, target);
            log.atInfo().addKeyValue("case", caseIdentifier).addKeyValue("directory", target)
                    .log("Archived old documents");
        }
        Path file = file(caseIdentifier);
        if (!Files.exists(file)) return Optional.empty();
        Path target = file.resolveSibling("_progress." + timestamp + ".json");
        Files.move(file, target);
        log.atInfo().addKeyValue("case", caseIdentifier).addKeyValue("file", target).log("Archived old progress");
        return Optional.of(target);
    }

    private ProgressState update(String caseIdentifier, ProgressState state) {
        try {
            commit(caseIdentifier, state);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to commit progress for " + caseIdentifier, e);
        }
        return state;
    }
}
