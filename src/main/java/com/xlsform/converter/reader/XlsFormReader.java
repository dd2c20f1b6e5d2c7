package com.xlsform.converter.reader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.xlsform.converter.model.input.ChoiceRow;
import com.xlsform.converter.model.input.SurveyRow;
import com.xlsform.converter.model.input.XlsForm;

/**
 * Reads the "survey" and "choices" sheets of an .xls or .xlsx workbook.
 *
 * The header is the first non-blank row of a sheet. Column names are matched
 * trimmed and case-insensitively, "list name" and "list_name" being the same column.
 * Rows blank in every cell are skipped; line numbers are 1-based sheet rows.
 */
public class XlsFormReader {
    private static final Logger log = LoggerFactory.getLogger(XlsFormReader.class);

    public static final String SURVEY_SHEET = "survey";
    public static final String CHOICES_SHEET = "choices";

    private static final String TYPE = "type";
    private static final String NAME = "name";
    private static final String LABEL = "label";
    private static final String RELEVANT = "relevant";
    private static final String CONSTRAINT = "constraint";
    private static final String CALCULATION = "calculation";
    private static final String REQUIRED = "required";
    private static final String REPEAT_COUNT = "repeat_count";
    private static final String LIST_NAME = "list name";

    private static final List<String> SURVEY_MANDATORY = List.of(TYPE, NAME, LABEL);
    private static final List<String> CHOICES_MANDATORY = List.of(LIST_NAME, NAME, LABEL);

    private final DataFormatter formatter = new DataFormatter();

    public XlsForm read(Path file) {
        String fileName = file.getFileName().toString();
        log.info("Reading XLSForm: {}", fileName);

        try (InputStream in = Files.newInputStream(file)) {
            return read(in, fileName);
        } catch (IOException e) {
            throw new XlsFormReadException("Could not read excel file " + fileName + ": " + e.getMessage(), e);
        }
    }

    public XlsForm read(InputStream in, String fileName) {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            List<SurveyRow> surveyRows = readSurvey(requireSheet(workbook, SURVEY_SHEET, fileName), fileName);
            List<ChoiceRow> choiceRows = readChoices(requireSheet(workbook, CHOICES_SHEET, fileName), fileName);

            log.debug("Read {} survey rows and {} choice rows from {}", surveyRows.size(), choiceRows.size(), fileName);

            return XlsForm.builder()
                    .fileName(fileName)
                    .surveyRows(surveyRows)
                    .choiceRows(choiceRows)
                    .build();
        } catch (XlsFormReadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new XlsFormReadException("Could not read excel file " + fileName + ": " + e.getMessage(), e);
        }
    }

    private List<SurveyRow> readSurvey(Sheet sheet, String fileName) {
        List<SurveyRow> rows = new ArrayList<>();
        int headerIndex = firstNonBlankRow(sheet, fileName);
        Map<String, Integer> header = readHeader(sheet.getRow(headerIndex), SURVEY_MANDATORY, sheet.getSheetName(), fileName);

        for (int i = headerIndex + 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (isBlank(row)) {
                continue;
            }
            rows.add(SurveyRow.builder()
                    .type(cell(row, header, TYPE))
                    .name(cell(row, header, NAME))
                    .label(cell(row, header, LABEL))
                    .relevant(cell(row, header, RELEVANT))
                    .constraint(cell(row, header, CONSTRAINT))
                    .calculation(cell(row, header, CALCULATION))
                    .required(cell(row, header, REQUIRED))
                    .repeatCount(cell(row, header, REPEAT_COUNT))
                    .lineNumber(i + 1)
                    .build());
        }
        return rows;
    }

    private List<ChoiceRow> readChoices(Sheet sheet, String fileName) {
        List<ChoiceRow> rows = new ArrayList<>();
        int headerIndex = firstNonBlankRow(sheet, fileName);
        Map<String, Integer> header = readHeader(sheet.getRow(headerIndex), CHOICES_MANDATORY, sheet.getSheetName(), fileName);

        for (int i = headerIndex + 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (isBlank(row)) {
                continue;
            }
            rows.add(ChoiceRow.builder()
                    .listName(cell(row, header, LIST_NAME))
                    .value(cell(row, header, NAME))
                    .label(cell(row, header, LABEL))
                    .lineNumber(i + 1)
                    .build());
        }
        return rows;
    }

    private Sheet requireSheet(Workbook workbook, String name, String fileName) {
        Sheet sheet = workbook.getSheet(name);
        if (sheet == null) {
            throw new XlsFormReadException("Missing mandatory sheet \"" + name + "\" in file " + fileName);
        }
        return sheet;
    }

    private int firstNonBlankRow(Sheet sheet, String fileName) {
        for (int i = Math.max(0, sheet.getFirstRowNum()); i <= sheet.getLastRowNum(); i++) {
            if (!isBlank(sheet.getRow(i))) {
                return i;
            }
        }
        throw new XlsFormReadException("Empty sheet \"" + sheet.getSheetName() + "\" in file " + fileName);
    }

    private Map<String, Integer> readHeader(Row row, List<String> mandatory, String sheetName, String fileName) {
        Map<String, Integer> header = new HashMap<>();
        for (Cell cell : row) {
            String name = normalizeHeader(formatter.formatCellValue(cell));
            if (!name.isEmpty()) {
                header.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        for (String column : mandatory) {
            if (!header.containsKey(column)) {
                throw new XlsFormReadException("Error in file " + fileName + ", sheet \"" + sheetName
                        + "\": column \"" + column + "\" is mandatory");
            }
        }
        log.debug("Sheet {} columns: {}", sheetName, header.keySet());
        return header;
    }

    static String normalizeHeader(String raw) {
        String name = raw.trim().toLowerCase(Locale.ROOT);
        return "list_name".equals(name) ? LIST_NAME : name;
    }

    private String cell(Row row, Map<String, Integer> header, String column) {
        Integer index = header.get(column);
        if (index == null) {
            return "";
        }
        Cell cell = row.getCell(index);
        return cell == null ? "" : clean(formatter.formatCellValue(cell));
    }

    private boolean isBlank(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (!clean(formatter.formatCellValue(cell)).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String clean(String value) {
        // non breaking spaces are invisible in the sheet
        return value.replace('\u00A0', ' ').trim();
    }
}
