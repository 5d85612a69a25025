package pl.marcinmilkowski.initial_combos.lexicon;

import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.ChecksumIndexInput;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.IOContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.initials.UnitKind;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads snapshots written by {@link LexiconSnapshotWriter}.
 *
 * The header and the CRC32 footer are both verified; a truncated or altered
 * file fails with {@link CorruptIndexException} instead of producing a
 * partially loaded lexicon.
 */
public final class LexiconSnapshotReader {

    private static final Logger logger = LoggerFactory.getLogger(LexiconSnapshotReader.class);

    private LexiconSnapshotReader() {
    }

    /**
     * Read a snapshot into a reconciled entry store.
     */
    public static Snapshot read(Path path) throws IOException {
        Path source = path.toAbsolutePath();
        if (!Files.exists(source)) {
            throw new FileNotFoundException("Lexicon snapshot not found: " + path);
        }

        try (Directory dir = FSDirectory.open(source.getParent());
             ChecksumIndexInput in = dir.openChecksumInput(source.getFileName().toString(), IOContext.READONCE)) {
            CodecUtil.checkHeader(in, LexiconSnapshotWriter.CODEC_NAME,
                LexiconSnapshotWriter.VERSION_START, LexiconSnapshotWriter.VERSION_CURRENT);

            UnitKind unitKind;
            try {
                unitKind = UnitKind.valueOf(in.readString());
            } catch (IllegalArgumentException e) {
                throw new CorruptIndexException("Unknown unit kind in snapshot", in, e);
            }

            int count = in.readVInt();
            if (count < 0) {
                throw new CorruptIndexException("Negative entry count: " + count, in);
            }
            List<LexiconEntry> entries = new ArrayList<>(count);
            Map<String, List<String>> sources = new HashMap<>();
            for (int i = 0; i < count; i++) {
                String word = in.readString();
                int unitCount = in.readVInt();
                List<String> initials = new ArrayList<>(unitCount);
                for (int u = 0; u < unitCount; u++) {
                    initials.add(in.readString());
                }
                double score = Double.longBitsToDouble(in.readLong());
                String primarySource = in.readString();
                int sourceCount = in.readVInt();
                List<String> wordSources = new ArrayList<>(sourceCount);
                for (int s = 0; s < sourceCount; s++) {
                    wordSources.add(in.readString());
                }
                try {
                    entries.add(new LexiconEntry(word, initials, score, primarySource));
                } catch (IllegalArgumentException e) {
                    throw new CorruptIndexException("Invalid entry #" + i + ": " + e.getMessage(), in, e);
                }
                sources.put(word, wordSources);
            }
            CodecUtil.checkFooter(in);

            EntryStore store;
            try {
                store = EntryStore.restore(entries, sources);
            } catch (IllegalArgumentException e) {
                throw new CorruptIndexException(e.getMessage(), in, e);
            }
            logger.info("Loaded lexicon snapshot: {} entries ({}) from {}", store.size(), unitKind, source);
            return new Snapshot(unitKind, store);
        }
    }

    /**
     * Read a snapshot and build the index over it.
     */
    public static LexiconIndex readIndex(Path path) throws IOException {
        return LexiconIndex.build(read(path).store());
    }

    /**
     * Contents of a snapshot file.
     */
    public record Snapshot(UnitKind unitKind, EntryStore store) {
        public LexiconIndex toIndex() {
            return LexiconIndex.build(store);
        }
    }
}
