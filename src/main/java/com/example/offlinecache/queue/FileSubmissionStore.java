package com.example.offlinecache.queue;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON file per submission, named by zero-padded id so directory order is enqueue order.
 */
public class FileSubmissionStore implements SubmissionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSubmissionStore.class);

    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper mapper;
    private long lastId;

    public FileSubmissionStore(Path dir, ObjectMapper mapper) {
        this.dir = dir;
        this.mapper = mapper;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException("Cannot create submission store at " + dir, e);
        }
        this.lastId = recoverLastId();
        log.debug("Submission store at {} resumes after id {}", dir, lastId);
    }

    @Override
    public synchronized QueuedSubmission append(NetRequest request, long enqueuedAt) {
        QueuedSubmission submission = new QueuedSubmission(lastId + 1, request.getMethod(), request.getUrl(),
            request.getHeaders(), request.getBody(), enqueuedAt);
        Path tmp = dir.resolve("." + fileName(submission.getId()) + ".tmp");
        try {
            writeSynced(tmp, mapper.writeValueAsBytes(submission));
            Files.move(tmp, dir.resolve(fileName(submission.getId())), StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Cannot persist submission for " + request, e);
        }
        lastId = submission.getId();
        return submission;
    }

    @Override
    public synchronized List<QueuedSubmission> listInOrder() {
        List<QueuedSubmission> submissions = new ArrayList<>();
        for (Path file : recordFiles()) {
            try {
                submissions.add(mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), QueuedSubmission.class));
            } catch (JsonProcessingException e) {
                quarantine(file, e);
            } catch (IOException e) {
                throw new StoreException("Cannot read submission " + file.getFileName(), e);
            }
        }
        return submissions;
    }

    @Override
    public synchronized boolean remove(long id) {
        try {
            return Files.deleteIfExists(dir.resolve(fileName(id)));
        } catch (IOException e) {
            throw new StoreException("Cannot remove submission #" + id, e);
        }
    }

    @Override
    public synchronized int count() {
        return recordFiles().size();
    }

    private List<Path> recordFiles() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(f -> {
                    String name = f.getFileName().toString();
                    return name.endsWith(SUFFIX) && !name.startsWith(".");
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException("Cannot list submissions in " + dir, e);
        }
    }

    // Record must be on disk before it becomes visible under its final name
    private static void writeSynced(Path file, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private long recoverLastId() {
        long max = 0;
        for (Path file : recordFiles()) {
            String name = file.getFileName().toString();
            try {
                max = Math.max(max, Long.parseLong(name.substring(0, name.length() - SUFFIX.length())));
            } catch (NumberFormatException e) {
                log.warn("Ignoring unexpected file {} in submission store", name);
            }
        }
        return max;
    }

    // kept aside rather than deleted so a broken record can still be inspected
    private void quarantine(Path file, JsonProcessingException cause) {
        log.error("Corrupt submission record {}, moving it aside", file.getFileName(), cause);
        try {
            Files.move(file, file.resolveSibling(file.getFileName() + ".corrupt"), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StoreException("Cannot quarantine corrupt submission " + file.getFileName(), e);
        }
    }

    private static String fileName(long id) {
        return String.format("%020d%s", id, SUFFIX);
    }
}
