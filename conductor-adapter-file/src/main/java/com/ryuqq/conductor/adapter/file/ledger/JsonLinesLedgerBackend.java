package com.ryuqq.conductor.adapter.file.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.core.exception.LedgerCorruptedException;
import com.ryuqq.conductor.core.ledger.PlanRecord;
import com.ryuqq.conductor.core.model.TaskId;
import com.ryuqq.conductor.core.spi.LedgerBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Task별 레코드를 JSON Lines 파일로 저장하는 영속 {@link LedgerBackend}.
 *
 * <p>레이아웃: Task마다 파일 하나 ({@code <directory>/<taskId>.jsonl}), 레코드마다 한 줄,
 * 추가 순서대로 기록합니다. 모든 추가는 반환 전에 저장 장치까지 강제 기록됩니다.</p>
 *
 * <p><strong>크래시 내성:</strong> 추가 중 프로세스가 죽으면 마지막 줄이 잘린 채 남을 수 있습니다.</p>
 * <ul>
 *   <li>{@link #readAll(TaskId)}는 해석할 수 없는 <em>마지막</em> 줄을 경고와 함께 건너뜁니다.</li>
 *   <li>{@link #append(PlanRecord)}는 쓰기 전에 줄바꿈으로 끝나지 않는 꼬리를 잘라냅니다.</li>
 *   <li>그 밖의 위치에서 해석할 수 없는 줄은 손상이며 {@link LedgerCorruptedException}으로 실패합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LedgerBackend backend = new JsonLinesLedgerBackend(Path.of("/var/lib/conductor/ledger"));
 * PlanLedger ledger = new PlanLedger(backend);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonLinesLedgerBackend implements LedgerBackend {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesLedgerBackend.class);
    private static final String EXTENSION = ".jsonl";

    private final Path directory;
    private final ObjectMapper objectMapper;

    /**
     * 생성자 (기본 ObjectMapper).
     *
     * @param directory Ledger 디렉토리 (없으면 생성)
     * @throws IllegalArgumentException directory가 null인 경우
     * @throws UncheckedIOException directory를 만들 수 없는 경우
     */
    public JsonLinesLedgerBackend(Path directory) {
        this(directory, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    /**
     * 생성자 (ObjectMapper 주입).
     *
     * @param directory Ledger 디렉토리 (없으면 생성)
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws UncheckedIOException directory를 만들 수 없는 경우
     */
    public JsonLinesLedgerBackend(Path directory, ObjectMapper objectMapper) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create ledger directory: " + directory, e);
        }
    }

    @Override
    public synchronized void append(PlanRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(PlanRecordDocument.from(record)) + "\n")
                .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record for task " + record.taskId().getValue(), e);
        }

        Path file = fileOf(record.taskId());
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            dropPartialTail(channel, file);
            channel.position(channel.size());
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to " + file, e);
        }
    }

    @Override
    public synchronized List<PlanRecord> readAll(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        Path file = fileOf(taskId);
        if (!Files.exists(file)) {
            return List.of();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }

        List<PlanRecord> records = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, PlanRecordDocument.class).toRecord());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                if (i == lines.size() - 1) {
                    log.warn("Skipping partial last line {} of {}", i + 1, file, e);
                    break;
                }
                throw new LedgerCorruptedException("Corrupted ledger line " + (i + 1) + " in " + file, e);
            }
        }
        return records;
    }

    /**
     * 첫 레코드의 타임스탬프, 그 다음 ID 순으로 정렬한 Task ID 목록.
     *
     * <p>읽을 수 없는 파일의 Task도 목록에 포함되며 맨 뒤에 ID 순으로 옵니다.
     * 손상은 해당 Task를 읽을 때 드러나므로 다른 Task의 복구를 막지 않습니다.</p>
     */
    @Override
    public synchronized List<TaskId> taskIds() {
        List<TaskEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                TaskId taskId = TaskId.of(name.substring(0, name.length() - EXTENSION.length()));
                List<PlanRecord> records;
                try {
                    records = readAll(taskId);
                } catch (LedgerCorruptedException | UncheckedIOException e) {
                    log.warn("Listing unreadable ledger file {} last", file, e);
                    entries.add(new TaskEntry(taskId, Long.MAX_VALUE));
                    continue;
                }
                if (!records.isEmpty()) {
                    entries.add(new TaskEntry(taskId, records.get(0).timestamp()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }

        entries.sort(Comparator.comparingLong(TaskEntry::firstTimestamp)
            .thenComparing(entry -> entry.taskId().getValue()));
        List<TaskId> taskIds = new ArrayList<>(entries.size());
        for (TaskEntry entry : entries) {
            taskIds.add(entry.taskId());
        }
        return taskIds;
    }

    /**
     * Ledger 디렉토리.
     */
    public Path getDirectory() {
        return directory;
    }

    /**
     * 줄바꿈으로 끝나지 않는 꼬리를 마지막 줄바꿈 직후까지 잘라냅니다.
     */
    private void dropPartialTail(FileChannel channel, Path file) throws IOException {
        long size = channel.size();
        if (size == 0 || byteAt(channel, size - 1) == '\n') {
            return;
        }
        long keep = size - 1;
        while (keep > 0 && byteAt(channel, keep - 1) != '\n') {
            keep--;
        }
        log.warn("Truncating partial last line of {} ({} bytes)", file, size - keep);
        channel.truncate(keep);
    }

    private static byte byteAt(FileChannel channel, long position) throws IOException {
        ByteBuffer single = ByteBuffer.allocate(1);
        while (single.hasRemaining()) {
            if (channel.read(single, position) < 0) {
                throw new IOException("Unexpected end of file at " + position);
            }
        }
        return single.get(0);
    }

    private Path fileOf(TaskId taskId) {
        return directory.resolve(taskId.getValue() + EXTENSION);
    }

    private record TaskEntry(TaskId taskId, long firstTimestamp) {
    }
}
