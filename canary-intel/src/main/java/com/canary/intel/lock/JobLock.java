package com.canary.intel.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * One advisory lock per job type, so a job started while the previous run is still
 * going fails fast instead of waiting.
 *
 * <p>Uses an OS file lock on {@code <lockDir>/<job>.lock}; the lock is released by the OS
 * if the process dies, so there are no stale locks. While held, the file contains
 * the holder as JSON:</p>
 * <pre>
 * { "pid": 4242, "job": "LEARNING_MAINTENANCE", "startTime": "2024-05-01T06:00:00Z" }
 * </pre>
 */
public class JobLock {

    private static final Logger log = LoggerFactory.getLogger(JobLock.class);

    private final Path lockDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    /**
     * Lock file contents
     */
    public record LockInfo(
        long pid,
        JobType job,
        String startTime
    ) {}

    public JobLock(Path lockDir) {
        this(lockDir, Clock.systemUTC());
    }

    public JobLock(Path lockDir, Clock clock) {
        this.lockDir = lockDir;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Try to take the lock for a job without blocking.
     *
     * @return a handle to close when the job is done, or empty if the job is already running
     * @throws IOException if the lock file cannot be created
     */
    public Optional<Handle> tryAcquire(JobType job) throws IOException {
        Files.createDirectories(lockDir);
        Path file = lockDir.resolve(job.lockFileName());
        FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ,
            StandardOpenOption.WRITE);

        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // Held by this JVM
            lock = null;
        } catch (IOException e) {
            channel.close();
            throw e;
        }

        if (lock == null) {
            channel.close();
            log.info("{} is already running", job);
            return Optional.empty();
        }

        LockInfo info = new LockInfo(ProcessHandle.current().pid(), job, Instant.now(clock).toString());
        try {
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(mapper.writeValueAsBytes(info)), 0);
            channel.force(false);
        } catch (IOException e) {
            // Holder info is informational; the lock itself is what counts
            log.warn("Failed to write lock info for {}: {}", job, e.getMessage());
        }

        log.debug("Acquired {} lock (PID: {})", job, info.pid());
        return Optional.of(new Handle(job, channel, lock, info));
    }

    /**
     * Current holder as recorded in the lock file, if any.
     */
    public Optional<LockInfo> readLockInfo(JobType job) {
        Path file = lockDir.resolve(job.lockFileName());
        try {
            if (!Files.exists(file) || Files.size(file) == 0) {
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(file.toFile(), LockInfo.class));
        } catch (IOException e) {
            log.debug("Unreadable lock file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * A held job lock. Closing it clears the holder info and releases the lock.
     */
    public static final class Handle implements AutoCloseable {

        private final JobType job;
        private final FileChannel channel;
        private final FileLock lock;
        private final LockInfo info;

        private Handle(JobType job, FileChannel channel, FileLock lock, LockInfo info) {
            this.job = job;
            this.channel = channel;
            this.lock = lock;
            this.info = info;
        }

        public JobType job() {
            return job;
        }

        public LockInfo info() {
            return info;
        }

        @Override
        public void close() throws IOException {
            if (!channel.isOpen()) {
                return;
            }
            try {
                channel.truncate(0);
                lock.release();
            } finally {
                channel.close();
            }
            log.debug("Released {} lock", job);
        }
    }
}
