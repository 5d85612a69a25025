package pl.marcinmilkowski.initial_combos.lexicon;

import org.apache.lucene.index.CorruptIndexException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.initial_combos.initials.UnitKind;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static pl.marcinmilkowski.initial_combos.lexicon.TestLexicon.entry;

/**
 * Unit tests for the checksummed lexicon snapshot.
 */
class LexiconSnapshotTest {

    @TempDir
    Path tempDir;

    private EntryStore sampleStore() {
        return EntryStore.of(List.of(
            entry("결근", 2.0, "표준국어대사전"),
            entry("결근", 1.0, "우리말샘"),
            entry("신상", 3.0, "한국어기초사전"),
            entry("결과", 0.25, "우리말샘")), ReconciliationPolicy.MAX_SCORE);
    }

    @Test
    @DisplayName("Snapshot preserves entries, scores, unit kind and sources")
    void testWriteRead() throws IOException {
        Path path = tempDir.resolve("sub/lexicon.lexsnap");
        EntryStore store = sampleStore();

        LexiconSnapshotWriter.write(store, UnitKind.SYLLABLE, path);
        LexiconSnapshotReader.Snapshot snapshot = LexiconSnapshotReader.read(path);

        assertEquals(UnitKind.SYLLABLE, snapshot.unitKind());
        assertEquals(store.entries(), snapshot.store().entries());
        assertEquals(List.of("우리말샘", "표준국어대사전"), List.copyOf(snapshot.store().sourcesOf("결근")));

        LexiconIndex index = snapshot.toIndex();
        assertEquals(List.of("결근"), index.lookupExact(List.of("결", "근")).stream().map(LexiconEntry::word).toList());
    }

    @Test
    @DisplayName("Writing twice replaces the previous snapshot")
    void testOverwrite() throws IOException {
        Path path = tempDir.resolve("lexicon.lexsnap");
        LexiconSnapshotWriter.write(sampleStore(), UnitKind.SYLLABLE, path);
        LexiconSnapshotWriter.write(EntryStore.of(List.of(entry("가", 1.0)), ReconciliationPolicy.MAX_SCORE),
            UnitKind.SYLLABLE, path);

        assertEquals(1, LexiconSnapshotReader.readIndex(path).size());
    }

    @Test
    @DisplayName("Altered checksum is detected")
    void testChecksumMismatch() throws IOException {
        Path path = tempDir.resolve("lexicon.lexsnap");
        LexiconSnapshotWriter.write(sampleStore(), UnitKind.SYLLABLE, path);

        byte[] bytes = Files.readAllBytes(path);
        bytes[bytes.length - 1] ^= 0x5A;
        Files.write(path, bytes);

        assertThrows(CorruptIndexException.class, () -> LexiconSnapshotReader.read(path));
    }

    @Test
    @DisplayName("Foreign and truncated files are rejected")
    void testInvalidFiles() throws IOException {
        Path foreign = tempDir.resolve("foreign.lexsnap");
        Files.writeString(foreign, "{\"w\": \"결근\"}\n{\"w\": \"신상\"}\n{\"w\": \"결과\"}\n");
        assertThrows(CorruptIndexException.class, () -> LexiconSnapshotReader.read(foreign));

        Path path = tempDir.resolve("lexicon.lexsnap");
        LexiconSnapshotWriter.write(sampleStore(), UnitKind.SYLLABLE, path);
        byte[] bytes = Files.readAllBytes(path);
        Path truncated = tempDir.resolve("truncated.lexsnap");
        Files.write(truncated, Arrays.copyOf(bytes, bytes.length - 20));
        assertThrows(IOException.class, () -> LexiconSnapshotReader.read(truncated));
    }

    @Test
    @DisplayName("Missing snapshot is reported")
    void testMissing() {
        assertThrows(FileNotFoundException.class,
            () -> LexiconSnapshotReader.read(tempDir.resolve("missing.lexsnap")));
    }
}
