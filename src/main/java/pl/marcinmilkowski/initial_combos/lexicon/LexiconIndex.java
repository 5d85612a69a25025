package pl.marcinmilkowski.initial_combos.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Prefix tree over initial-units.
 *
 * One branching level per initial-unit (not per character). Every node holds
 * the entries whose initials equal the path to that node, sorted by
 * {@link LexiconEntry#BY_SCORE} once at build time. The index is fully built
 * in the factory methods and never changes afterwards, so one instance can be
 * shared by any number of concurrent searches without locking.
 *
 * <pre>{@code
 * LexiconIndex index = LexiconIndex.build(store);
 * index.lookupPrefix(List.of("결"), 10);     // 결근, 결과, 결합, ...
 * index.lookupExact(List.of("결", "근"));    // 결근
 * index.contains("결근");                    // true
 * }</pre>
 */
public final class LexiconIndex {

    private static final Logger logger = LoggerFactory.getLogger(LexiconIndex.class);

    private final Node root;
    private final Map<String, LexiconEntry> byWord;
    private final EntryStore store;
    private final int nodeCount;

    private LexiconIndex(Node root, Map<String, LexiconEntry> byWord, EntryStore store, int nodeCount) {
        this.root = root;
        this.byWord = byWord;
        this.store = store;
        this.nodeCount = nodeCount;
    }

    /**
     * Build an index over an already reconciled entry store.
     */
    public static LexiconIndex build(EntryStore store) {
        long start = System.nanoTime();
        BuildNode buildRoot = new BuildNode();
        Map<String, LexiconEntry> byWord = new HashMap<>();
        for (LexiconEntry entry : store.entries()) {
            BuildNode node = buildRoot;
            for (String unit : entry.initials()) {
                node = node.children.computeIfAbsent(unit, k -> new BuildNode());
            }
            node.entries.add(entry);
            byWord.put(entry.word(), entry);
        }
        int[] counter = new int[1];
        Node frozen = buildRoot.freeze(counter);

        logger.info("Built lexicon index: {} entries, {} trie nodes in {} ms",
            store.size(), counter[0], (System.nanoTime() - start) / 1_000_000);
        return new LexiconIndex(frozen, Collections.unmodifiableMap(byWord), store, counter[0]);
    }

    /**
     * Reconcile raw entries and build an index over them.
     *
     * @throws DuplicateSourceConflictException only under {@link ReconciliationPolicy#REJECT}
     */
    public static LexiconIndex build(Collection<LexiconEntry> entries, ReconciliationPolicy policy) {
        return build(EntryStore.of(entries, policy));
    }

    /**
     * Entries whose initials begin with {@code prefix}, best first.
     *
     * @param prefix Initials prefix; an empty prefix matches every entry
     * @param limit  Maximum number of entries, or 0 / negative for all
     */
    public List<LexiconEntry> lookupPrefix(List<String> prefix, int limit) {
        Node node = find(prefix);
        if (node == null) {
            return List.of();
        }
        if (limit <= 0) {
            List<LexiconEntry> all = new ArrayList<>();
            collect(node, all);
            all.sort(LexiconEntry.BY_SCORE);
            return all;
        }

        // Bounded heap, worst entry at the head
        PriorityQueue<LexiconEntry> heap = new PriorityQueue<>(limit + 1, LexiconEntry.BY_SCORE.reversed());
        collectTop(node, heap, limit);
        List<LexiconEntry> top = new ArrayList<>(heap);
        top.sort(LexiconEntry.BY_SCORE);
        return top;
    }

    /**
     * Entries whose initials equal {@code initials} exactly, best first.
     */
    public List<LexiconEntry> lookupExact(List<String> initials) {
        Node node = find(initials);
        return node != null ? node.entries : List.of();
    }

    /**
     * Entries whose initials are a prefix of {@code sequence}, shortest first.
     * Within one length entries come best first, and at most {@code perLengthLimit}
     * of them are returned (0 for no limit).
     */
    public List<LexiconEntry> entriesAlong(List<String> sequence, int perLengthLimit) {
        List<LexiconEntry> found = new ArrayList<>();
        Node node = root;
        for (String unit : sequence) {
            node = node.children.get(unit);
            if (node == null) {
                break;
            }
            addLimited(found, node.entries, perLengthLimit);
        }
        return found;
    }

    /**
     * Entries whose initials, taken as a multiset, fit inside {@code available}.
     * Each entry appears once, in trie order (units ascending, shorter paths first).
     *
     * @param available      Unit counts still usable; not modified
     * @param perNodeLimit   Maximum entries taken from one node, 0 for no limit
     */
    public List<LexiconEntry> entriesWithin(Map<String, Integer> available, int perNodeLimit) {
        List<LexiconEntry> found = new ArrayList<>();
        walkWithin(root, new HashMap<>(available), perNodeLimit, found);
        return found;
    }

    /**
     * Check whether any entry's initials start with the given units.
     */
    public boolean hasPrefix(List<String> prefix) {
        return find(prefix) != null;
    }

    public boolean contains(String word) {
        return word != null && byWord.containsKey(word);
    }

    public Optional<LexiconEntry> entryOf(String word) {
        return word == null ? Optional.empty() : Optional.ofNullable(byWord.get(word));
    }

    public OptionalDouble scoreOf(String word) {
        LexiconEntry entry = word == null ? null : byWord.get(word);
        return entry != null ? OptionalDouble.of(entry.score()) : OptionalDouble.empty();
    }

    /**
     * Every dictionary that contributed the word, sorted.
     */
    public SortedSet<String> sourcesOf(String word) {
        return store.sourcesOf(word);
    }

    /**
     * All indexed entries in load order.
     */
    public List<LexiconEntry> entries() {
        return store.entries();
    }

    public EntryStore store() {
        return store;
    }

    public int size() {
        return byWord.size();
    }

    public int nodeCount() {
        return nodeCount;
    }

    private Node find(List<String> units) {
        Node node = root;
        for (String unit : units) {
            node = node.children.get(unit);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private static void collect(Node node, List<LexiconEntry> out) {
        out.addAll(node.entries);
        for (Node child : node.children.values()) {
            collect(child, out);
        }
    }

    private static void collectTop(Node node, PriorityQueue<LexiconEntry> heap, int limit) {
        for (LexiconEntry entry : node.entries) {
            if (heap.size() < limit) {
                heap.add(entry);
            } else if (LexiconEntry.BY_SCORE.compare(entry, heap.peek()) < 0) {
                heap.poll();
                heap.add(entry);
            } else {
                // node entries are sorted, the rest cannot beat the current worst
                break;
            }
        }
        for (Node child : node.children.values()) {
            collectTop(child, heap, limit);
        }
    }

    private static void walkWithin(Node node, Map<String, Integer> available, int perNodeLimit,
                                   List<LexiconEntry> out) {
        for (Map.Entry<String, Node> child : node.children.entrySet()) {
            String unit = child.getKey();
            int count = available.getOrDefault(unit, 0);
            if (count == 0) {
                continue;
            }
            available.put(unit, count - 1);
            addLimited(out, child.getValue().entries, perNodeLimit);
            walkWithin(child.getValue(), available, perNodeLimit, out);
            available.put(unit, count);
        }
    }

    private static void addLimited(List<LexiconEntry> out, List<LexiconEntry> entries, int limit) {
        if (limit <= 0 || entries.size() <= limit) {
            out.addAll(entries);
        } else {
            out.addAll(entries.subList(0, limit));
        }
    }

    @Override
    public String toString() {
        return String.format("LexiconIndex[%d entries, %d nodes]", byWord.size(), nodeCount);
    }

    /**
     * Read-only trie node.
     */
    private static final class Node {
        final Map<String, Node> children;
        final List<LexiconEntry> entries;

        Node(Map<String, Node> children, List<LexiconEntry> entries) {
            this.children = children;
            this.entries = entries;
        }
    }

    /**
     * Mutable node used only while building.
     */
    private static final class BuildNode {
        final Map<String, BuildNode> children = new TreeMap<>();
        final List<LexiconEntry> entries = new ArrayList<>(1);

        Node freeze(int[] counter) {
            counter[0]++;
            Map<String, Node> frozenChildren = new TreeMap<>();
            for (Map.Entry<String, BuildNode> e : children.entrySet()) {
                frozenChildren.put(e.getKey(), e.getValue().freeze(counter));
            }
            List<LexiconEntry> sorted = new ArrayList<>(entries);
            sorted.sort(LexiconEntry.BY_SCORE);
            return new Node(Collections.unmodifiableMap(frozenChildren), List.copyOf(sorted));
        }
    }
}
