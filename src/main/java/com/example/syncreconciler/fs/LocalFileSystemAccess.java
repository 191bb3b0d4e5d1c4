package com.example.syncreconciler.fs;

import com.example.syncreconciler.tree.FsId;
import com.example.syncreconciler.tree.NodeType;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link FileSystemAccess} backed by {@code java.nio.file}. The filesystem id is the
 * platform file key (device and inode on POSIX systems).
 */
public final class LocalFileSystemAccess implements FileSystemAccess {
    private final LinkOption[] linkOptions;

    public LocalFileSystemAccess() {
        this(false);
    }

    public LocalFileSystemAccess(boolean followLinks) {
        this.linkOptions = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    @Override
    public FileHandle openFile(String path) throws IOException {
        Path file = Path.of(path);
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class, linkOptions);
        FileChannel channel = attributes.isRegularFile()
                ? FileChannel.open(file, StandardOpenOption.READ)
                : null;
        return new LocalFileHandle(path, attributes, channel);
    }

    @Override
    public FileHandle createFile(String path) throws IOException {
        Path file = Path.of(path);
        FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return new LocalFileHandle(path, attributes, channel);
        } catch (IOException ex) {
            channel.close();
            throw ex;
        }
    }

    @Override
    public void setModificationTime(String path, long epochNanos) throws IOException {
        Files.setLastModifiedTime(Path.of(path), FileTime.from(epochNanos, TimeUnit.NANOSECONDS));
    }

    @Override
    public DirectoryHandle openDirectory(String path) throws IOException {
        DirectoryStream<Path> stream = Files.newDirectoryStream(Path.of(path));
        return new LocalDirectoryHandle(stream);
    }

    @Override
    public char separator() {
        return File.separatorChar;
    }

    @Override
    public boolean followsLinks() {
        return linkOptions.length == 0;
    }

    private static final class LocalFileHandle implements FileHandle {
        private final String path;
        private final BasicFileAttributes attributes;
        private final FileChannel channel;

        private LocalFileHandle(String path, BasicFileAttributes attributes, FileChannel channel) {
            this.path = path;
            this.attributes = attributes;
            this.channel = channel;
        }

        @Override
        public String path() {
            return path;
        }

        @Override
        public NodeType type() {
            if (attributes.isDirectory()) {
                return NodeType.FOLDER;
            }
            if (attributes.isRegularFile()) {
                return NodeType.FILE;
            }
            return NodeType.UNKNOWN;
        }

        @Override
        public boolean isSymbolicLink() {
            return attributes.isSymbolicLink();
        }

        @Override
        public FileStat stat() throws IOException {
            FileTime modified = attributes.lastModifiedTime();
            long size = channel != null ? channel.size() : attributes.size();
            return new FileStat(size, modified.to(TimeUnit.SECONDS), modified.to(TimeUnit.NANOSECONDS));
        }

        @Override
        public Optional<FsId> filesystemId() {
            Object fileKey = attributes.fileKey();
            return fileKey == null ? Optional.empty() : Optional.of(new FsId(fileKey.toString()));
        }

        @Override
        public byte[] read(long offset, int length) throws IOException {
            requireChannel();
            ByteBuffer buffer = ByteBuffer.allocate(length);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new EOFException("Unexpected end of " + path + " at " + position);
                }
                position += read;
            }
            return buffer.array();
        }

        @Override
        public void write(long offset, byte[] data) throws IOException {
            requireChannel();
            ByteBuffer buffer = ByteBuffer.wrap(data);
            long position = offset;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        }

        private void requireChannel() throws IOException {
            if (channel == null) {
                throw new IOException("Not a regular file: " + path);
            }
        }

        @Override
        public void close() throws IOException {
            if (channel != null) {
                channel.close();
            }
        }
    }

    private static final class LocalDirectoryHandle implements DirectoryHandle {
        private final DirectoryStream<Path> stream;
        private final Iterator<Path> iterator;

        private LocalDirectoryHandle(DirectoryStream<Path> stream) {
            this.stream = stream;
            this.iterator = stream.iterator();
        }

        @Override
        public Optional<String> next() throws IOException {
            try {
                if (!iterator.hasNext()) {
                    return Optional.empty();
                }
                return Optional.of(iterator.next().getFileName().toString());
            } catch (DirectoryIteratorException ex) {
                throw ex.getCause();
            }
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }
}
