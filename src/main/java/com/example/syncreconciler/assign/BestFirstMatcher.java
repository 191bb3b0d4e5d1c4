package com.example.syncreconciler.assign;

import com.example.syncreconciler.tree.Fingerprint;
import com.example.syncreconciler.tree.FsId;
import com.example.syncreconciler.tree.NodeType;
import com.example.syncreconciler.tree.TrackedEntry;
import com.example.syncreconciler.tree.TrackedTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pairs live objects with fingerprint-equal tracked entries, highest {@link PathMatchScorer}
 * score first. Ties go to the live object visited first, then to the lower tracked key.
 *
 * <p>Each fingerprint bucket that a live object falls into is turned into a trie of the
 * recorded paths' components, last component at the top. Walking a live path down that trie
 * reaches the deepest node it shares with any candidate, and the depth in characters is the
 * score. The best remaining candidate of a live object is therefore found without scoring it
 * against every other member of the bucket.
 */
final class BestFirstMatcher {
    private static final Comparator<Proposal> BEST_FIRST = Comparator
            .comparingInt(Proposal::score).reversed()
            .thenComparingLong(proposal -> proposal.live().order());

    record Live(String path, NodeType type, Fingerprint fingerprint, FsId fsid, long order) {
    }

    record Match(Live live, TrackedEntry tracked, int score) {
    }

    private final FingerprintIndex index;
    private final TrackedTree tree;
    private final char separator;
    private final Map<FingerprintIndex.Key, Node> tries = new HashMap<>();
    private final Map<Long, Placement> placements = new HashMap<>();

    BestFirstMatcher(FingerprintIndex index, TrackedTree tree, char separator) {
        this.index = index;
        this.tree = tree;
        this.separator = separator;
    }

    /**
     * Assigns each live object at most one tracked entry and each tracked entry at most one
     * live filesystem id. Returned in the order the pairs were decided.
     */
    List<Match> match(List<Live> live) {
        PriorityQueue<Proposal> proposals = new PriorityQueue<>(BEST_FIRST);
        for (Live entry : live) {
            Node trie = trieFor(entry);
            if (trie == null) {
                continue;
            }
            List<Node> walk = walk(trie, entry.path());
            proposals.add(new Proposal(entry, walk, walk.size() - 1));
        }

        List<Match> matches = new ArrayList<>();
        Set<FsId> claimedIds = new HashSet<>();
        while (!proposals.isEmpty()) {
            Proposal proposal = proposals.poll();
            Live entry = proposal.live();
            if (claimedIds.contains(entry.fsid())) {
                continue;
            }
            Optional<Long> key = proposal.node().first(entry.fingerprint().contentHash());
            if (key.isEmpty()) {
                if (proposal.level() > 0) {
                    proposals.add(new Proposal(entry, proposal.walk(), proposal.level() - 1));
                }
                continue;
            }
            claim(key.get());
            claimedIds.add(entry.fsid());
            matches.add(new Match(entry, tree.entry(key.get()), proposal.score()));
        }
        return matches;
    }

    private Node trieFor(Live entry) {
        FingerprintIndex.Key key = FingerprintIndex.Key.of(entry.type(), entry.fingerprint());
        Node trie = tries.get(key);
        if (trie != null) {
            return trie;
        }
        List<TrackedEntry> bucket = index.bucket(key);
        if (bucket.isEmpty()) {
            return null;
        }
        trie = new Node(0);
        for (TrackedEntry candidate : bucket) {
            insert(trie, candidate);
        }
        tries.put(key, trie);
        return trie;
    }

    private void insert(Node trie, TrackedEntry candidate) {
        String hash = candidate.fingerprint().map(Fingerprint::contentHash).orElse(null);
        List<Node> nodes = new ArrayList<>();
        Node node = trie;
        node.add(candidate.key(), hash);
        nodes.add(node);
        for (String component : tailFirst(tree.path(candidate.key()))) {
            node = node.child(component);
            node.add(candidate.key(), hash);
            nodes.add(node);
        }
        placements.put(candidate.key(), new Placement(nodes, hash));
    }

    private void claim(long key) {
        Placement placement = placements.remove(key);
        for (Node node : placement.nodes()) {
            node.remove(key, placement.hash());
        }
    }

    private List<Node> walk(Node trie, String path) {
        List<Node> walk = new ArrayList<>();
        Node node = trie;
        walk.add(node);
        for (String component : tailFirst(path)) {
            node = node.children.get(component);
            if (node == null) {
                break;
            }
            walk.add(node);
        }
        return walk;
    }

    private List<String> tailFirst(String path) {
        List<String> components = new ArrayList<>();
        int end = path.length();
        while (end >= 0) {
            int start = path.lastIndexOf(separator, end - 1);
            components.add(path.substring(start + 1, end));
            end = start;
        }
        return components;
    }

    private record Proposal(Live live, List<Node> walk, int level) {
        Node node() {
            return walk.get(level);
        }

        int score() {
            return node().score;
        }
    }

    private record Placement(List<Node> nodes, String hash) {
    }

    /**
     * Trie node holding the unclaimed candidates whose recorded path passes through it.
     * Unhashed candidates are filed under the {@code null} hash.
     */
    private static final class Node {
        private final int score;
        private final Map<String, Node> children = new HashMap<>();
        private final TreeSet<Long> all = new TreeSet<>();
        private final Map<String, TreeSet<Long>> byHash = new HashMap<>();

        private Node(int score) {
            this.score = score;
        }

        Node child(String component) {
            return children.computeIfAbsent(component, name -> new Node(score + name.length()));
        }

        void add(long key, String hash) {
            all.add(key);
            byHash.computeIfAbsent(hash, ignored -> new TreeSet<>()).add(key);
        }

        void remove(long key, String hash) {
            all.remove(key);
            TreeSet<Long> keys = byHash.get(hash);
            if (keys != null) {
                keys.remove(key);
            }
        }

        /**
         * Lowest unclaimed key whose hash is compatible with {@code liveHash}. A missing hash on
         * either side matches anything.
         */
        Optional<Long> first(String liveHash) {
            if (liveHash == null) {
                return all.isEmpty() ? Optional.empty() : Optional.of(all.first());
            }
            Long hashed = lowest(byHash.get(liveHash));
            Long unhashed = lowest(byHash.get(null));
            if (hashed == null) {
                return Optional.ofNullable(unhashed);
            }
            if (unhashed == null) {
                return Optional.of(hashed);
            }
            return Optional.of(Math.min(hashed, unhashed));
        }

        private static Long lowest(TreeSet<Long> keys) {
            return keys == null || keys.isEmpty() ? null : keys.first();
        }
    }
}
