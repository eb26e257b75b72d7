package com.intentcluster.clustering.service.data_processing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/** Reads utterance lists from uploaded plain-text or CSV files. */
@Slf4j
@Service
public class UtteranceFileParsingService {

  /**
   * Reads one utterance per line. Blank lines are skipped; surrounding whitespace is trimmed.
   *
   * @throws IllegalArgumentException if the file holds no utterances
   */
  public List<String> parseTextLines(InputStream stream) throws IOException {
    List<String> utterances = new ArrayList<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = stripBom(line).trim();
        if (!trimmed.isEmpty()) {
          utterances.add(trimmed);
        }
      }
    }

    if (utterances.isEmpty()) {
      throw new IllegalArgumentException("File contains no utterances");
    }
    return utterances;
  }

  /**
   * Reads one column of a CSV file with a header row.
   *
   * @param column header name (case-insensitive); the first column when {@code null} or blank
   * @throws IllegalArgumentException if the header is missing, the column is unknown or no
   *     utterances remain
   */
  public List<String> parseCsvColumn(InputStream stream, String column)
      throws IOException, CsvValidationException {
    List<String> utterances = new ArrayList<>();

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String[] headers = reader.readNext();
      if (headers == null || headers.length == 0) {
        throw new IllegalArgumentException("CSV file has no headers");
      }

      int columnIndex = resolveColumn(headers, column);

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (row.length <= columnIndex) {
          log.debug("Skipping row with {} columns, need {}", row.length, columnIndex + 1);
          continue;
        }
        String value = row[columnIndex].trim();
        if (!value.isEmpty()) {
          utterances.add(value);
        }
      }
    }

    if (utterances.isEmpty()) {
      throw new IllegalArgumentException("CSV file contains no utterances");
    }
    return utterances;
  }

  private int resolveColumn(String[] headers, String column) {
    if (column == null || column.isBlank()) {
      return 0;
    }
    for (int i = 0; i < headers.length; i++) {
      if (stripBom(headers[i]).trim().equalsIgnoreCase(column.trim())) {
        return i;
      }
    }
    throw new IllegalArgumentException("CSV column not found: " + column);
  }

  private static String stripBom(String value) {
    return value.startsWith("\uFEFF") ? value.substring(1) : value;
  }
}
