package com.linelist.cleaner.service.data_processing;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;
import com.opencsv.CSVWriter;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class CsvWritingService {

  /** Header row followed by one line per row; missing cells are written empty. */
  public byte[] write(DataTable table) throws IOException {
    List<String> names = table.getColumnNames();
    StringWriter out = new StringWriter();
    try (CSVWriter writer = new CSVWriter(out)) {
      writer.writeNext(names.toArray(new String[0]));
      for (int i = 0; i < table.rowCount(); i++) {
        String[] line = new String[names.size()];
        for (int c = 0; c < names.size(); c++) {
          DataColumn column = table.column(names.get(c));
          String value = column.getValues().get(i);
          line[c] = value != null ? value : "";
        }
        writer.writeNext(line);
      }
    }
    log.debug("Wrote {} rows of table '{}' as CSV", table.rowCount(), table.getName());
    return out.toString().getBytes(StandardCharsets.UTF_8);
  }
}
