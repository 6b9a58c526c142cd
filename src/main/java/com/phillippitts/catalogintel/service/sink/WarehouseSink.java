package com.phillippitts.catalogintel.service.sink;

import com.phillippitts.catalogintel.exception.SinkException;

import java.util.List;
import java.util.Map;

/**
 * Append-only tabular sink.
 */
public interface WarehouseSink {

    /**
     * Appends rows to {@code dataset.table}. All rows share the first row's columns.
     *
     * @throws SinkException when the rows cannot be written
     */
    void writeRows(String dataset, String table, List<Map<String, Object>> rows);
}
