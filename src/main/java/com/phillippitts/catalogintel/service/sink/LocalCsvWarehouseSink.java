package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.exception.SinkException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends rows to {@code <baseDir>/<dataset>.<table>.csv}, writing the header when the file is new.
 */
public class LocalCsvWarehouseSink implements WarehouseSink {

    private final Path baseDir;
    private final Lock writeLock = new ReentrantLock();

    public LocalCsvWarehouseSink(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public void writeRows(String dataset, String table, List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        Path destination = baseDir.resolve(dataset + "." + table + ".csv");
        List<String> columns = new ArrayList<>(rows.get(0).keySet());

        writeLock.lock();
        try {
            Files.createDirectories(baseDir);
            boolean writeHeader = !Files.exists(destination);
            try (BufferedWriter out = Files.newBufferedWriter(destination, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (writeHeader) {
                    out.write(line(new ArrayList<>(columns)));
                }
                for (Map<String, Object> row : rows) {
                    List<Object> values = new ArrayList<>(columns.size());
                    for (String column : columns) {
                        values.add(row.get(column));
                    }
                    out.write(line(values));
                }
            }
        } catch (IOException e) {
            throw new SinkException("Failed to write rows to " + destination, e);
        } finally {
            writeLock.unlock();
        }
    }

    private static String line(List<?> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(values.get(i)));
        }
        return sb.append("\r\n").toString();
    }

    static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = String.valueOf(value);
        if (text.indexOf(',') >= 0 || text.indexOf('"') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }
}
