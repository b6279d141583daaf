package io.github.drompincen.tablecopilot.persistence.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Schedule records kept as one JSON array in a single file. Every operation
 * re-reads the file and every mutation rewrites it whole, all under one lock
 * shared by the tools and the reminder notifier.
 */
@Service
public class ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);
    private static final TypeReference<List<ScheduleDocument>> RECORDS = new TypeReference<>() {};

    private final Path file;
    private final Clock clock;
    private final AtomicFiles atomicFiles;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public ScheduleStore(@Value("${tablecopilot.schedule.file:data/schedules.json}") String file, Clock clock) {
        this(Path.of(file), clock, new AtomicFiles());
    }

    public ScheduleStore(Path file, Clock clock, AtomicFiles atomicFiles) {
        this.file = file;
        this.clock = clock;
        this.atomicFiles = atomicFiles;
        this.mapper = new ObjectMapper();
        this.mapper.findAndRegisterModules();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Current records; a missing or unreadable file reads as empty. An
     * unreadable file is set aside rather than overwritten by the next write.
     */
    public List<ScheduleDocument> load() {
        return locked(this::readFile);
    }

    public void save(List<ScheduleDocument> records) {
        locked(() -> {
            writeFile(records);
            return null;
        });
    }

    public ScheduleDocument create(ScheduleDocument record) {
        return locked(() -> {
            List<ScheduleDocument> records = readFile();
            if (record.getId() == null || record.getId().isBlank()) {
                record.setId(newId(records));
            } else if (records.stream().anyMatch(r -> record.getId().equals(r.getId()))) {
                throw new IllegalArgumentException("Schedule id already exists: " + record.getId());
            }
            if (record.getCreatedAt() == null) {
                record.setCreatedAt(clock.instant());
            }
            records.add(record);
            writeFile(records);
            log.info("Created schedule {} '{}' at {}", record.getId(), record.getTitle(), record.getDatetime());
            return record.copy();
        });
    }

    /** All records ordered by start time. */
    public List<ScheduleDocument> list() {
        List<ScheduleDocument> records = load();
        records.sort(Comparator.comparing(ScheduleDocument::getDatetime,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return records;
    }

    public Optional<ScheduleDocument> find(String id) {
        return load().stream().filter(r -> id.equals(r.getId())).findFirst();
    }

    public ScheduleDocument update(String id, UnaryOperator<ScheduleDocument> change) {
        return locked(() -> {
            List<ScheduleDocument> records = readFile();
            int idx = indexOf(records, id);
            ScheduleDocument updated = change.apply(records.get(idx).copy());
            updated.setId(id);
            updated.setUpdatedAt(clock.instant());
            records.set(idx, updated);
            writeFile(records);
            log.info("Updated schedule {}", id);
            return updated.copy();
        });
    }

    public ScheduleDocument delete(String id) {
        return locked(() -> {
            List<ScheduleDocument> records = readFile();
            ScheduleDocument removed = records.remove(indexOf(records, id));
            writeFile(records);
            log.info("Deleted schedule {}", id);
            return removed;
        });
    }

    /**
     * Runs {@code action} holding the store lock. The lock is reentrant, so the
     * action may call {@link #load()} and {@link #save(List)} for a multi-record
     * read-modify-write.
     */
    public <R> R locked(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private List<ScheduleDocument> readFile() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<ScheduleDocument> records = mapper.readValue(file.toFile(), RECORDS);
            return records != null ? new ArrayList<>(records) : new ArrayList<>();
        } catch (IOException e) {
            log.warn("Schedule file {} is unreadable, treating as empty: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void writeFile(List<ScheduleDocument> records) {
        try {
            setAsideIfUnreadable();
            atomicFiles.overwrite(file, mapper.writeValueAsBytes(records));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write schedule file " + file, e);
        }
    }

    /**
     * A file that reads as empty because it does not parse is moved to
     * {@code <name>.corrupt-<epoch millis>} before the first overwrite, so the
     * records in it can still be recovered by hand.
     */
    private void setAsideIfUnreadable() throws IOException {
        if (!Files.exists(file)) return;
        try {
            mapper.readValue(file.toFile(), RECORDS);
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved unreadable schedule file {} to {} before rewriting it", file, aside);
        }
    }

    private static int indexOf(List<ScheduleDocument> records, String id) {
        for (int i = 0; i < records.size(); i++) {
            if (id.equals(records.get(i).getId())) return i;
        }
        throw new ScheduleNotFoundException(id);
    }

    private static String newId(List<ScheduleDocument> records) {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (containsId(records, id));
        return id;
    }

    private static boolean containsId(List<ScheduleDocument> records, String id) {
        return records.stream().anyMatch(r -> id.equals(r.getId()));
    }
}
