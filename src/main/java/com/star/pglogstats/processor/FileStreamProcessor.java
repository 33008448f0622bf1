package com.star.pglogstats.processor;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.BiConsumer;

/**
 * Reads a log source line by line and hands each line with its 1-based number
 * to a handler. Lines are never held in memory beyond the current one.
 *
 * <p>With a {@link Builder#maxLines(long) line limit} only the first lines are
 * read, which is how large files are sampled.
 */
@Slf4j
public class FileStreamProcessor {

    private static final int DEFAULT_BUFFER_SIZE = 8 * 1024; // 8KB

    private final int bufferSize;
    private final Charset charset;
    private final long maxLines;

    @Getter
    public static class ProcessingStats {
        private long totalLines;
        private long bytesRead;
        private long processingTimeMs;
        private boolean truncated;

        public double getLinesPerSecond() {
            return processingTimeMs > 0 ? (totalLines * 1000.0) / processingTimeMs : 0;
        }

        @Override
        public String toString() {
            return String.format(
                    "ProcessingStats{lines=%d, bytes=%d, timeMs=%d, truncated=%s}",
                    totalLines, bytesRead, processingTimeMs, truncated);
        }
    }

    private FileStreamProcessor(Builder builder) {
        this.bufferSize = builder.bufferSize;
        this.charset = builder.charset;
        this.maxLines = builder.maxLines;
    }

    public ProcessingStats processFile(Path filePath,
                                       BiConsumer<String, Long> lineHandler) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("File not found: " + filePath);
        }

        try (InputStream in = Files.newInputStream(filePath)) {
            return processStream(in, lineHandler);
        }
    }

    /**
     * Reads {@code in} to the end or to the line limit. The stream is not closed.
     */
    public ProcessingStats processStream(InputStream in,
                                         BiConsumer<String, Long> lineHandler) throws IOException {
        ProcessingStats stats = new ProcessingStats();
        long startTime = System.currentTimeMillis();
        long lineNumber = 0;

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, charset), bufferSize);
        String line;
        while ((line = reader.readLine()) != null) {
            if (maxLines > 0 && lineNumber >= maxLines) {
                stats.truncated = true;
                break;
            }
            lineNumber++;
            lineHandler.accept(line, lineNumber);
            stats.bytesRead += line.length() + 1; // +1 for newline
        }

        stats.totalLines = lineNumber;
        stats.processingTimeMs = System.currentTimeMillis() - startTime;

        log.info("Read {} lines in {} ms ({} lines/sec){}",
                lineNumber, stats.processingTimeMs,
                String.format("%.2f", stats.getLinesPerSecond()),
                stats.truncated ? ", stopped at the sample limit" : "");

        return stats;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FileStreamProcessor createDefault() {
        return builder().build();
    }

    public static class Builder {
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private Charset charset = StandardCharsets.UTF_8;
        private long maxLines = 0;

        // Set buffer size for reading.
        public Builder bufferSize(int bufferSize) {
            if (bufferSize < 1024) {
                throw new IllegalArgumentException("Buffer size must be at least 1024 bytes");
            }
            this.bufferSize = bufferSize;
            return this;
        }

        // Set character encoding.
        public Builder charset(Charset charset) {
            this.charset = charset != null ? charset : StandardCharsets.UTF_8;
            return this;
        }

        // Stop after this many lines; 0 reads everything.
        public Builder maxLines(long maxLines) {
            if (maxLines < 0) {
                throw new IllegalArgumentException("Line limit cannot be negative");
            }
            this.maxLines = maxLines;
            return this;
        }

        public FileStreamProcessor build() {
            return new FileStreamProcessor(this);
        }
    }
}
