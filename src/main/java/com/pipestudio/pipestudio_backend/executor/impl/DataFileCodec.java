package com.pipestudio.pipestudio_backend.executor.impl;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the data files used by input and output nodes.
 *
 * Reading picks the parser by extension: .json, .csv (first row is the header, every row becomes a
 * map of strings), .yaml / .yml, anything else is returned as raw text.
 * Writing picks the format by name: json (pretty), csv (columns from the first record), yaml,
 * anything else is written as the value's string form.
 */
@Component
@RequiredArgsConstructor
public class DataFileCodec {

    private final ObjectMapper objectMapper;
    private final YAMLMapper   yamlMapper = new YAMLMapper();
    private final CsvMapper    csvMapper  = CsvMapper.builder().enable(CsvParser.Feature.SKIP_EMPTY_LINES).build();

    public Object read(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase();
        String content = Files.readString(file);

        if (name.endsWith(".json")) {
            return objectMapper.readValue(content, Object.class);
        }
        if (name.endsWith(".csv")) {
            return readCsv(content);
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return yamlMapper.readValue(content, Object.class);
        }
        return content;
    }

    public void write(Path file, Object data, String format) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String fmt = format != null ? format.trim().toLowerCase() : "";
        String content = switch (fmt) {
            case "json" -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
            case "csv"  -> toCsv(data);
            case "yaml", "yml" -> yamlMapper.writeValueAsString(data);
            default -> String.valueOf(data);
        };
        Files.writeString(file, content);
    }

    private List<Map<String, String>> readCsv(String content) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerFor(Map.class).with(schema).readValues(content)) {
            while (it.hasNext()) {
                rows.add(new LinkedHashMap<>(it.next()));
            }
        }
        return rows;
    }

    // Empty string unless data is a non-empty list of records
    private String toCsv(Object data) throws IOException {
        if (!(data instanceof List<?> list) || list.isEmpty() || !(list.get(0) instanceof Map<?, ?> first)) {
            return "";
        }
        List<String> headers = first.keySet().stream().map(String::valueOf).toList();
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        headers.forEach(schema::addColumn);

        List<Map<String, String>> rows = new ArrayList<>();
        for (Object item : list) {
            Map<String, String> row = new LinkedHashMap<>();
            Map<?, ?> record = item instanceof Map<?, ?> m ? m : Map.of();
            for (String header : headers) {
                Object value = record.get(header);
                row.put(header, value != null ? String.valueOf(value) : "");
            }
            rows.add(row);
        }
        return csvMapper.writer(schema.build()).writeValueAsString(rows);
    }
}
