package com.xlsform.converter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Writes small XLSForm workbooks for tests. A null cell value leaves the cell out.
 */
public final class XlsFormWorkbooks {

    private XlsFormWorkbooks() {
    }

    public static Path writeXlsx(Path file, String[][] survey, String[][] choices) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            return write(wb, file, survey, choices);
        }
    }

    public static Path writeXls(Path file, String[][] survey, String[][] choices) throws IOException {
        try (Workbook wb = new HSSFWorkbook()) {
            return write(wb, file, survey, choices);
        }
    }

    private static Path write(Workbook wb, Path file, String[][] survey, String[][] choices) throws IOException {
        if (survey != null) {
            fill(wb.createSheet("survey"), survey);
        }
        if (choices != null) {
            fill(wb.createSheet("choices"), choices);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            wb.write(out);
        }
        return file;
    }

    private static void fill(Sheet sheet, String[][] rows) {
        for (int r = 0; r < rows.length; r++) {
            if (rows[r] == null) {
                continue;
            }
            Row row = sheet.createRow(r);
            for (int c = 0; c < rows[r].length; c++) {
                if (rows[r][c] != null) {
                    row.createCell(c).setCellValue(rows[r][c]);
                }
            }
        }
    }
}
