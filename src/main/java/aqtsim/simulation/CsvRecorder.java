package aqtsim.simulation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for recorders writing CSV files. Lines are kept in memory until {@code lineLimit} is
 * reached, then appended to the file. The first write replaces any earlier file and starts with
 * the header.
 */
public abstract sealed class CsvRecorder implements Recorder permits BufferLoadRecorder, AbsorptionRecorder {

    public static final int DEFAULT_LINE_LIMIT = 5000;

    private final String fileName;
    private final String header;
    private final int lineLimit;
    private final List<String> lines = new ArrayList<>();
    private Path outputFile;
    private boolean headerWritten = false;

    protected CsvRecorder(String fileName, String header, int lineLimit) {
        if (lineLimit < 1) {
            throw new IllegalArgumentException("Line limit must be positive, got: " + lineLimit);
        }
        this.fileName = fileName;
        this.header = header;
        this.lineLimit = lineLimit;
    }

    @Override
    public void setOutputDirectory(Path directory) {
        this.outputFile = directory.resolve(fileName);
        this.headerWritten = false;
    }

    @Override
    public boolean writesFiles() {
        return true;
    }

    protected void write(String line) {
        if (lines.size() >= lineLimit) {
            flush();
        }
        lines.add(line);
    }

    @Override
    public void close() {
        flush();
    }

    private void flush() {
        if (outputFile == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no output directory");
        }
        List<String> toWrite = new ArrayList<>(lines.size() + 1);
        if (!headerWritten) {
            toWrite.add(header);
        }
        toWrite.addAll(lines);
        try {
            Files.createDirectories(outputFile.getParent());
            if (headerWritten) {
                Files.write(outputFile, toWrite, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.write(outputFile, toWrite, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't write to " + outputFile, e);
        }
        headerWritten = true;
        lines.clear();
    }

    public Path outputFile() {
        return outputFile;
    }

    public int lineLimit() {
        return lineLimit;
    }
}
