package pl.marcinmilkowski.initial_combos.lexicon;

import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.initials.UnitKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedSet;

/**
 * Writes a reconciled entry store to a single checksummed snapshot file.
 *
 * Layout (Lucene data output encoding):
 * <pre>
 *   header       CodecUtil header, codec "InitialCombosLexicon"
 *   unitKind     string
 *   entryCount   vint
 *   entry*       word:string, unitCount:vint, unit:string*, score:long (double bits),
 *                source:string, sourceCount:vint, source:string*
 *   footer       CodecUtil footer with CRC32
 * </pre>
 */
public final class LexiconSnapshotWriter {

    private static final Logger logger = LoggerFactory.getLogger(LexiconSnapshotWriter.class);

    static final String CODEC_NAME = "InitialCombosLexicon";
    static final int VERSION_START = 1;
    static final int VERSION_CURRENT = VERSION_START;

    /** File extension recognized by {@link LexiconLoader#loadIndex(Path)}. */
    public static final String EXTENSION = ".lexsnap";

    private LexiconSnapshotWriter() {
    }

    /**
     * Write the store, replacing any existing file at {@code path}.
     */
    public static void write(EntryStore store, UnitKind unitKind, Path path) throws IOException {
        Path target = path.toAbsolutePath();
        Path dirPath = target.getParent();
        Files.createDirectories(dirPath);
        Files.deleteIfExists(target);

        try (Directory dir = FSDirectory.open(dirPath);
             IndexOutput out = dir.createOutput(target.getFileName().toString(), IOContext.DEFAULT)) {
            CodecUtil.writeHeader(out, CODEC_NAME, VERSION_CURRENT);
            out.writeString(unitKind.name());
            out.writeVInt(store.size());
            for (LexiconEntry entry : store.entries()) {
                out.writeString(entry.word());
                out.writeVInt(entry.initials().size());
                for (String unit : entry.initials()) {
                    out.writeString(unit);
                }
                out.writeLong(Double.doubleToLongBits(entry.score()));
                out.writeString(entry.source());

                SortedSet<String> sources = store.sourcesOf(entry.word());
                out.writeVInt(sources.size());
                for (String source : sources) {
                    out.writeString(source);
                }
            }
            CodecUtil.writeFooter(out);
        }
        logger.info("Wrote lexicon snapshot: {} entries ({}) to {}", store.size(), unitKind, target);
    }
}
