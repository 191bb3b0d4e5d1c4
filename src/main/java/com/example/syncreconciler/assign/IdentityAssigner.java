package com.example.syncreconciler.assign;

import com.example.syncreconciler.assign.BestFirstMatcher.Live;
import com.example.syncreconciler.assign.BestFirstMatcher.Match;
import com.example.syncreconciler.fs.DirectoryHandle;
import com.example.syncreconciler.fs.FileHandle;
import com.example.syncreconciler.fs.FileSystemAccess;
import com.example.syncreconciler.fs.SyncablePolicy;
import com.example.syncreconciler.tree.Fingerprint;
import com.example.syncreconciler.tree.FsId;
import com.example.syncreconciler.tree.NodeType;
import com.example.syncreconciler.tree.TrackedEntry;
import com.example.syncreconciler.tree.TrackedTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Re-associates tracked entries with the live filesystem objects they correspond to after
 * filesystem ids were lost, for example after the sync was reloaded from persisted state.
 *
 * <p>Tracked entries are indexed by fingerprint, the local tree is walked depth first, and
 * every live object is paired with the tracked entries sharing its type and fingerprint.
 * Pairs are then assigned best first by {@link PathMatchScorer} score, so the result does
 * not depend on which live object happens to be visited first. Each tracked entry and each
 * live filesystem id is used at most once.
 *
 * <p>Symbolic links are resolved or not by the {@link FileSystemAccess}; a handle that still
 * reports a link is skipped. At most two handles are open at any time: one directory
 * listing, then one file.
 */
public final class IdentityAssigner {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityAssigner.class);

    private final FileSystemAccess fileSystem;
    private final SyncablePolicy policy;
    private final FingerprintGenerator fingerprints;
    private final TraversalInterrupt interrupt;

    public IdentityAssigner(FileSystemAccess fileSystem, SyncablePolicy policy) {
        this(fileSystem, policy, new FingerprintGenerator(), TraversalInterrupt.never());
    }

    public IdentityAssigner(FileSystemAccess fileSystem,
                            SyncablePolicy policy,
                            FingerprintGenerator fingerprints,
                            TraversalInterrupt interrupt) {
        this.fileSystem = fileSystem;
        this.policy = policy;
        this.fingerprints = fingerprints;
        this.interrupt = interrupt;
    }

    /**
     * Assigns filesystem ids to the entries of {@code tree} from the live tree at {@code rootPath}.
     * Objects under {@code debrisPath} are never considered.
     *
     * @return false if anything could not be inspected, the root could not be opened or the
     * traversal was interrupted. Assignments made for the parts that could be inspected are
     * kept, except after an interruption, which assigns nothing.
     */
    public boolean assign(String rootPath, TrackedTree tree, String debrisPath) {
        if (tree.separator() != fileSystem.separator()) {
            throw new IllegalArgumentException("Tree separator '" + tree.separator()
                    + "' does not match filesystem separator '" + fileSystem.separator() + "'");
        }

        FingerprintIndex index = new FingerprintIndex();
        for (TrackedEntry entry : tree.descendants(tree.root().key())) {
            tree.clearFsid(entry.key());
            if (entry.fingerprint().isPresent()) {
                index.add(entry);
            }
        }

        Scan scan = new Scan(rootPath, debrisPath, !index.isEmpty());
        if (!scan.openRoot()) {
            return false;
        }
        if (index.isEmpty()) {
            LOGGER.info("No fingerprinted entries tracked under {}, scanning for errors only.", rootPath);
        } else {
            LOGGER.info("Indexed {} tracked entries under {}", index.size(), rootPath);
        }

        scan.run();
        if (scan.fatal) {
            return false;
        }

        List<Match> matches = new BestFirstMatcher(index, tree, fileSystem.separator()).match(scan.live);
        for (Match match : matches) {
            tree.setFsid(match.tracked().key(), match.live().fsid());
            LOGGER.debug("Assigned {} to {} (score {})", match.live().fsid(), match.live().path(), match.score());
        }
        LOGGER.info("Visited {} entries under {}, assigned {} filesystem ids.",
                scan.visited, rootPath, matches.size());
        return scan.success;
    }

    private final class Scan {
        private final String rootPath;
        private final String debrisPath;
        private final boolean collect;
        private final List<Live> live = new ArrayList<>();
        private final Set<FsId> enteredFolders = new HashSet<>();
        private boolean success = true;
        private boolean fatal;
        private long visited;

        private Scan(String rootPath, String debrisPath, boolean collect) {
            this.rootPath = rootPath;
            this.debrisPath = debrisPath;
            this.collect = collect;
        }

        boolean openRoot() {
            try (FileHandle handle = fileSystem.openFile(rootPath)) {
                if (handle.type() != NodeType.FOLDER) {
                    LOGGER.error("Sync root {} is not a folder.", rootPath);
                    return false;
                }
                handle.filesystemId().ifPresent(enteredFolders::add);
                return true;
            } catch (IOException ex) {
                LOGGER.error("Unable to open sync root {}", rootPath, ex);
                return false;
            }
        }

        void run() {
            Deque<Folder> pending = new ArrayDeque<>();
            pending.push(new Folder(rootPath, null));
            while (!pending.isEmpty()) {
                Folder current = pending.pop();
                List<String> names;
                try {
                    names = list(current.path());
                } catch (IOException ex) {
                    if (current.entry() == null) {
                        LOGGER.error("Failed to list sync root {}", current.path(), ex);
                        fatal = true;
                        return;
                    }
                    LOGGER.warn("Failed to list directory {}", current.path(), ex);
                    success = false;
                    continue;
                }
                if (current.entry() != null && collect) {
                    live.add(current.entry());
                }

                List<Folder> subfolders = new ArrayList<>();
                for (String name : names) {
                    if (interrupt.isRequested()) {
                        LOGGER.info("Assignment under {} interrupted after {} entries.", rootPath, visited);
                        fatal = true;
                        return;
                    }
                    visited++;
                    String path = fileSystem.join(current.path(), name);
                    if (isDebris(path)) {
                        LOGGER.debug("Skipping debris folder {}", path);
                        continue;
                    }
                    if (!policy.isSyncable(path)) {
                        LOGGER.debug("Skipping excluded path {}", path);
                        continue;
                    }
                    Optional<Live> inspected = inspect(path);
                    if (inspected.isEmpty()) {
                        continue;
                    }
                    Live entry = inspected.get();
                    if (entry.type() != NodeType.FOLDER) {
                        if (collect) {
                            live.add(entry);
                        }
                    } else if (enteredFolders.add(entry.fsid())) {
                        subfolders.add(new Folder(path, entry));
                    } else {
                        LOGGER.debug("Folder {} was already visited through another path", path);
                    }
                }
                for (int i = subfolders.size() - 1; i >= 0; i--) {
                    pending.push(subfolders.get(i));
                }
            }
        }

        private List<String> list(String path) throws IOException {
            List<String> names = new ArrayList<>();
            try (DirectoryHandle directory = fileSystem.openDirectory(path)) {
                Optional<String> name;
                while ((name = directory.next()).isPresent()) {
                    names.add(name.get());
                }
            }
            return names;
        }

        private Optional<Live> inspect(String path) {
            try (FileHandle handle = fileSystem.openFile(path)) {
                if (handle.isSymbolicLink()) {
                    LOGGER.debug("Skipping symbolic link {}", path);
                    return Optional.empty();
                }
                NodeType type = handle.type();
                if (type == NodeType.UNKNOWN) {
                    LOGGER.warn("Skipping {}: neither a regular file nor a folder", path);
                    success = false;
                    return Optional.empty();
                }
                Optional<FsId> fsid = handle.filesystemId();
                if (fsid.isEmpty()) {
                    LOGGER.warn("No filesystem id available for {}", path);
                    success = false;
                    return Optional.empty();
                }
                Fingerprint fingerprint = collect
                        ? fingerprints.generate(handle)
                        : Fingerprint.of(handle.stat().size(), handle.stat().modificationTime());
                return Optional.of(new Live(path, type, fingerprint, fsid.get(), visited));
            } catch (IOException ex) {
                LOGGER.warn("Failed to open {}", path, ex);
                success = false;
                return Optional.empty();
            }
        }

        private boolean isDebris(String path) {
            if (debrisPath == null || debrisPath.isEmpty()) {
                return false;
            }
            return path.equals(debrisPath)
                    || path.startsWith(debrisPath + fileSystem.separator());
        }
    }

    private record Folder(String path, Live entry) {
    }
}
