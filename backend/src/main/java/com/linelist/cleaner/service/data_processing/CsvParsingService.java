package com.linelist.cleaner.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.config.ApplicationProperties;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;
import com.linelist.cleaner.model.Wordlist;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class CsvParsingService {

  private final ApplicationProperties applicationProperties;

  /**
   * Reads a dataset. Empty cells and the configured missing tokens become missing values; column
   * kinds are left undeclared.
   */
  public DataTable parseDataTable(InputStream csvStream, String fileName) throws IOException {
    List<String[]> rows = readAll(csvStream);
    String[] headers = rows.get(0);
    if (rows.size() == 1) {
      throw new IllegalArgumentException("CSV file contains no data");
    }

    List<List<String>> cells = new ArrayList<>();
    for (int i = 0; i < headers.length; i++) {
      cells.add(new ArrayList<>());
    }
    for (String[] row : rows.subList(1, rows.size())) {
      for (int i = 0; i < headers.length; i++) {
        cells.get(i).add(toCell(row[i]));
      }
    }
    List<DataColumn> columns = new ArrayList<>(headers.length);
    for (int i = 0; i < headers.length; i++) {
      columns.add(DataColumn.undeclared(headers[i], cells.get(i)));
    }
    log.debug(
        "Parsed dataset '{}': {} columns, {} rows", fileName, headers.length, rows.size() - 1);
    return DataTable.of(extractTableName(fileName), columns);
  }

  /**
   * Reads a wordlist. Cells are kept verbatim so reserved keys such as {@code .default} survive.
   */
  public Wordlist parseWordlist(InputStream csvStream) throws IOException {
    List<String[]> rows = readAll(csvStream);
    String[] headers = rows.get(0);
    if (headers.length < 2) {
      throw new IllegalArgumentException(
          "Wordlist CSV needs at least two columns (keys and values)");
    }
    List<List<String>> body = new ArrayList<>(rows.size() - 1);
    for (String[] row : rows.subList(1, rows.size())) {
      body.add(Arrays.asList(row));
    }
    log.debug("Parsed wordlist: {} columns, {} rows", headers.length, body.size());
    return Wordlist.of(Arrays.asList(headers), body);
  }

  private List<String[]> readAll(InputStream csvStream) throws IOException {
    List<String[]> rows = new ArrayList<>();
    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      rows.add(headers);

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length != headers.length) {
          log.debug(
              "Skipping row with incorrect column count: {} vs {}", row.length, headers.length);
          continue;
        }
        rows.add(row);
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
    }
    return rows;
  }

  private String toCell(String raw) {
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    return applicationProperties.getCsv().getMissingTokens().contains(raw) ? null : raw;
  }

  private String extractTableName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_table";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }
}
