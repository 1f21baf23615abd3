package org.retreat.placer;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes the result workbook: Placements, Unplaced, AttachWarnings and Summary sheets.
 */
public class PlacementReportWriter {
    private static final Logger LOGGER = Logger.getLogger(PlacementReportWriter.class.getName());

    static final String[] PLACEMENT_HEADERS = {"BuildingName", "RoomName", "FirstName", "LastName", "OrgName",
            "GroupName", "RoomFloor", "Bunk", "AttachName", "AttachResolved"};
    static final int[] PLACEMENT_WIDTHS = {18, 16, 16, 16, 18, 18, 12, 10, 22, 22};

    static final String[] UNPLACED_HEADERS = {"FirstName", "LastName", "OrgName", "GroupName", "AttachName",
            "AttachResolved", "RoomLocationPref", "BunkPref", "Reasons"};
    static final int[] UNPLACED_WIDTHS = {14, 16, 16, 18, 22, 22, 18, 12, 60};

    static final String[] WARNING_HEADERS = {"Person", "AttachName Value", "Resolution"};
    static final int[] WARNING_WIDTHS = {24, 24, 60};

    static final Comparator<PlacementOutcome.PlacementRecord> REPORT_ORDER =
            Comparator.comparing((PlacementOutcome.PlacementRecord r) -> r.building)
                    .thenComparing(r -> r.room)
                    .thenComparing(r -> r.bunk);

    private PlacementReportWriter() {
    }

    public static void write(PlacementOutcome outcome, File outputFile) {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);

            writePlacements(workbook.createSheet("Placements"), headerStyle, outcome.placements);
            writeUnplaced(workbook.createSheet("Unplaced"), headerStyle, outcome.unplaced);
            if (!outcome.auditLog.isEmpty()) {
                writeWarnings(workbook.createSheet("AttachWarnings"), headerStyle, outcome.auditLog);
            }
            writeSummary(workbook.createSheet("Summary"), headerStyle, outcome);

            try (FileOutputStream fos = new FileOutputStream(outputFile)) {
                workbook.write(fos);
            }
            LOGGER.info("Result workbook written: " + outputFile.getAbsolutePath());
        } catch (IOException e) {
            String message = "Cannot write result workbook " + outputFile.getPath();
            LOGGER.log(Level.SEVERE, message, e);
            throw new UncheckedIOException(message, e);
        }
    }

    private static void writePlacements(Sheet sheet, CellStyle headerStyle,
                                        List<PlacementOutcome.PlacementRecord> placements) {
        createHeader(sheet, headerStyle, PLACEMENT_HEADERS, PLACEMENT_WIDTHS);

        List<PlacementOutcome.PlacementRecord> sorted = new ArrayList<>(placements);
        sorted.sort(REPORT_ORDER);

        int rowNum = 1;
        for (PlacementOutcome.PlacementRecord record : sorted) {
            Row row = sheet.createRow(rowNum++);
            PlacementData.Person p = record.person;
            row.createCell(0).setCellValue(record.building);
            row.createCell(1).setCellValue(record.room);
            row.createCell(2).setCellValue(p.firstName);
            row.createCell(3).setCellValue(p.lastName);
            row.createCell(4).setCellValue(p.orgName);
            row.createCell(5).setCellValue(p.groupName);
            row.createCell(6).setCellValue(record.floor);
            row.createCell(7).setCellValue(record.bunk.displayName);
            row.createCell(8).setCellValue(p.attachName);
            row.createCell(9).setCellValue(record.attachResolved);
        }
        sheet.setAutoFilter(new CellRangeAddress(0, Math.max(sorted.size(), 1), 0, PLACEMENT_HEADERS.length - 1));
    }

    private static void writeUnplaced(Sheet sheet, CellStyle headerStyle,
                                      List<PlacementOutcome.UnplacedRecord> unplaced) {
        createHeader(sheet, headerStyle, UNPLACED_HEADERS, UNPLACED_WIDTHS);

        int rowNum = 1;
        for (PlacementOutcome.UnplacedRecord record : unplaced) {
            Row row = sheet.createRow(rowNum++);
            PlacementData.Person p = record.person;
            row.createCell(0).setCellValue(p.firstName);
            row.createCell(1).setCellValue(p.lastName);
            row.createCell(2).setCellValue(p.orgName);
            row.createCell(3).setCellValue(p.groupName);
            row.createCell(4).setCellValue(p.attachName);
            row.createCell(5).setCellValue(record.attachResolved);
            row.createCell(6).setCellValue(p.roomLocationPref);
            row.createCell(7).setCellValue(p.bunkPref);
            row.createCell(8).setCellValue(String.join("; ", record.reasons));
        }
        if (!unplaced.isEmpty()) {
            sheet.setAutoFilter(new CellRangeAddress(0, unplaced.size(), 0, UNPLACED_HEADERS.length - 1));
        }
    }

    private static void writeWarnings(Sheet sheet, CellStyle headerStyle,
                                      List<AttachResolver.ResolutionEntry> auditLog) {
        createHeader(sheet, headerStyle, WARNING_HEADERS, WARNING_WIDTHS);

        int rowNum = 1;
        for (AttachResolver.ResolutionEntry entry : auditLog) {
            Row row = sheet.createRow(rowNum++);
            row.createCell(0).setCellValue(entry.person.getFullName());
            row.createCell(1).setCellValue(entry.attachValue);
            row.createCell(2).setCellValue(entry.message);
        }
    }

    private static void writeSummary(Sheet sheet, CellStyle headerStyle, PlacementOutcome outcome) {
        sheet.setColumnWidth(0, 30 * 256);
        sheet.setColumnWidth(1, 15 * 256);
        sheet.setColumnWidth(2, 20 * 256);

        PlacementSummary summary = outcome.summary;
        int rowNum = 0;
        Row title = sheet.createRow(rowNum++);
        title.createCell(0).setCellValue("Placement Summary");
        title.getCell(0).setCellStyle(headerStyle);
        rowNum++;

        rowNum = summaryLine(sheet, rowNum, "Total Bed Slots", summary.totalBedSlots);
        rowNum = summaryLine(sheet, rowNum, "Total People", summary.totalPeople);
        rowNum = summaryLine(sheet, rowNum, "Placed", summary.placedCount);
        rowNum = summaryLine(sheet, rowNum, "Unplaced", summary.unplacedCount);
        Row statusRow = sheet.createRow(rowNum++);
        statusRow.createCell(0).setCellValue("Solution");
        statusRow.createCell(1).setCellValue(outcome.status.name());
        rowNum++;

        Row section = sheet.createRow(rowNum++);
        section.createCell(0).setCellValue("By Organization & Building");
        section.getCell(0).setCellStyle(headerStyle);

        Row header = sheet.createRow(rowNum++);
        String[] headers = {"Organization", "Building", "Count"};
        for (int i = 0; i < headers.length; i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(headerStyle);
        }

        for (Map.Entry<String, Map<String, Integer>> org : summary.placedByOrgAndBuilding.entrySet()) {
            for (Map.Entry<String, Integer> building : org.getValue().entrySet()) {
                Row row = sheet.createRow(rowNum++);
                row.createCell(0).setCellValue(org.getKey());
                row.createCell(1).setCellValue(building.getKey());
                row.createCell(2).setCellValue(building.getValue());
            }
        }
    }

    private static int summaryLine(Sheet sheet, int rowNum, String label, int value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
        return rowNum + 1;
    }

    private static void createHeader(Sheet sheet, CellStyle headerStyle, String[] headers, int[] widths) {
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, widths[i] * 256);
        }
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }
}
