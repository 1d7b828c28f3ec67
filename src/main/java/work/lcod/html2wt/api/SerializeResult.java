package work.lcod.html2wt.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.html2wt.diag.LogData;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.runtime.Chunk;

/**
 * Outcome of a {@link WikitextSerializer} call. A failed result carries no wikitext.
 */
public record SerializeResult(
    Status status,
    String wikitext,
    List<Chunk> chunks,
    List<LogData> diagnostics,
    String error,
    String errorCode,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public SerializeResult {
        chunks = List.copyOf(chunks);
        diagnostics = List.copyOf(diagnostics);
    }

    public static SerializeResult success(String wikitext, List<Chunk> chunks, List<LogData> diagnostics, Instant startedAt) {
        return new SerializeResult(Status.SUCCESS, wikitext, chunks, diagnostics, null, null, startedAt, Instant.now());
    }

    public static SerializeResult failure(String message, String code, List<LogData> diagnostics, Instant startedAt) {
        return new SerializeResult(Status.FAILURE, null, List.of(), diagnostics, message, code, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        if (wikitext != null) {
            serializable.put("wikitext", wikitext);
        }
        if (error != null) {
            serializable.put("error", error);
            serializable.put("code", errorCode);
        }
        List<Map<String, Object>> chunkList = new ArrayList<>();
        for (var chunk : chunks) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("text", chunk.text());
            entry.put("node", chunk.origin() instanceof Element element ? element.describe() : String.valueOf(chunk.origin()));
            chunkList.add(entry);
        }
        serializable.put("chunks", chunkList);
        List<Map<String, Object>> logs = new ArrayList<>();
        for (var entry : diagnostics) {
            Map<String, Object> log = new LinkedHashMap<>();
            log.put("type", entry.logType());
            log.put("message", entry.message());
            logs.add(log);
        }
        serializable.put("diagnostics", logs);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
