package com.ogt.exposure.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ogt.exposure.exception.MalformedTableException;
import com.ogt.exposure.model.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV (Jackson CSV) and Excel (Apache POI, first sheet; .xlsx and legacy .xls) tables with a header row.
 */
@Component
@Slf4j
public class TableReader implements TabularDataProvider {

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public DataTable read(String source) {
        Path path = Path.of(source);
        String name = path.getFileName().toString();
        String lower = name.toLowerCase();
        try {
            if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
                log.info("📊 Reading Excel table '{}' with Apache POI", source);
                try (InputStream in = Files.newInputStream(path)) {
                    return readExcel(in, name);
                }
            }
            try (Reader reader = Files.newBufferedReader(path)) {
                return readCsv(reader, name);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read table " + source, e);
        }
    }

    public DataTable readCsv(Reader reader, String name) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerFor(Map.class).with(schema).readValues(reader)) {
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
            if (it.getParserSchema() instanceof CsvSchema actual) {
                for (CsvSchema.Column column : actual) {
                    columns.add(column.getName());
                }
            }
        }
        log.debug("CSV table '{}': {} rows, columns {}", name, rows.size(), columns);
        return new DataTable(name, columns, rows);
    }

    public DataTable readExcel(InputStream in, String name) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);

            // 1. First non-empty row holds the headers
            int headerRowIndex = -1;
            for (int i = 0; i <= sheet.getLastRowNum() && i < 50; i++) {
                Row row = sheet.getRow(i);
                if (row != null && row.getPhysicalNumberOfCells() > 0) {
                    headerRowIndex = i;
                    break;
                }
            }
            if (headerRowIndex == -1) {
                throw new MalformedTableException("Excel table '" + name + "' is empty or has no header row");
            }
            Map<Integer, String> columnMap = buildColumnMap(sheet.getRow(headerRowIndex));

            // 2. Data rows
            List<Map<String, String>> rows = new ArrayList<>();
            for (int i = headerRowIndex + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                Map<String, String> values = new LinkedHashMap<>();
                boolean empty = true;
                for (Map.Entry<Integer, String> col : columnMap.entrySet()) {
                    String value = getCellValueAsString(row.getCell(col.getKey()));
                    values.put(col.getValue(), value);
                    empty &= value == null || value.isBlank();
                }
                if (!empty) {
                    rows.add(values);
                }
            }
            log.info("📊 Excel table '{}': {} rows, columns {}", name, rows.size(), columnMap.values());
            return new DataTable(name, new ArrayList<>(columnMap.values()), rows);
        }
    }

    private Map<Integer, String> buildColumnMap(Row headerRow) {
        Map<Integer, String> map = new LinkedHashMap<>();
        for (Cell cell : headerRow) {
            String rawValue = getCellValueAsString(cell);
            if (rawValue == null || rawValue.isBlank()) continue;
            map.put(cell.getColumnIndex(), rawValue.replaceAll("[\n\r]+", " ").trim());
        }
        return map;
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING: return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) return cell.getDateCellValue().toString();
                double num = cell.getNumericCellValue();
                return (num == (long) num) ? String.valueOf((long) num) : String.valueOf(num);
            case BOOLEAN: return String.valueOf(cell.getBooleanCellValue());
            default: return null;
        }
    }
}
