package org.retreat.placer;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the room map and roster workbooks.
 * Columns are found by header name in the first row of the first sheet.
 */
public class FileProcessor {
    private static final Logger LOGGER = Logger.getLogger(FileProcessor.class.getName());

    public static final List<String> ROOM_COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "BuildingName", "RoomName", "RoomFloor", "#BottomBunk", "#TopBunk"));
    public static final List<String> PEOPLE_COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "FirstName", "LastName", "OrgName", "GroupName", "AttachName", "RoomLocationPref", "BunkPref"));

    private FileProcessor() {
    }

    public static List<RosterPreparer.RawRoom> readRooms(File file) {
        List<RosterPreparer.RawRoom> rooms = new ArrayList<>();
        for (Map.Entry<Integer, String[]> row : readRows(file, ROOM_COLUMNS).entrySet()) {
            String[] v = row.getValue();
            rooms.add(new RosterPreparer.RawRoom(row.getKey(), v[0], v[1], v[2], v[3], v[4]));
        }
        LOGGER.info("Room rows read: " + rooms.size() + " from " + file.getName());
        return rooms;
    }

    public static List<RosterPreparer.RawPerson> readPeople(File file) {
        List<RosterPreparer.RawPerson> people = new ArrayList<>();
        for (Map.Entry<Integer, String[]> row : readRows(file, PEOPLE_COLUMNS).entrySet()) {
            String[] v = row.getValue();
            people.add(new RosterPreparer.RawPerson(row.getKey(), v[0], v[1], v[2], v[3], v[4], v[5], v[6]));
        }
        LOGGER.info("Roster rows read: " + people.size() + " from " + file.getName());
        return people;
    }

    /**
     * Values of the requested columns per nonblank data row, keyed by 1-based sheet row number.
     */
    private static Map<Integer, String[]> readRows(File file, List<String> columns) {
        try (FileInputStream fis = new FileInputStream(file);
             Workbook workbook = new XSSFWorkbook(fis)) {

            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw fail(file.getName() + ": header row is missing");
            }

            Map<String, Integer> headerIndex = new HashMap<>();
            for (Cell cell : headerRow) {
                String header = getCellValueAsString(cell).trim();
                if (!header.isEmpty() && !headerIndex.containsKey(header)) {
                    headerIndex.put(header, cell.getColumnIndex());
                }
            }

            int[] columnIndex = new int[columns.size()];
            List<String> missing = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                Integer index = headerIndex.get(columns.get(i));
                if (index == null) {
                    missing.add(columns.get(i));
                } else {
                    columnIndex[i] = index;
                }
            }
            if (!missing.isEmpty()) {
                throw fail(file.getName() + ": missing required columns " + missing);
            }

            Map<Integer, String[]> rows = new LinkedHashMap<>();
            for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                String[] values = new String[columns.size()];
                boolean blank = true;
                for (int c = 0; c < columns.size(); c++) {
                    values[c] = getCellValueAsString(row.getCell(columnIndex[c])).trim();
                    if (!values[c].isEmpty()) {
                        blank = false;
                    }
                }
                if (!blank) {
                    rows.put(i + 1, values);
                }
            }
            return rows;

        } catch (InputDataException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            String message = "Cannot read workbook " + file.getPath();
            LOGGER.log(Level.SEVERE, message, e);
            throw new InputDataException(message + ": " + e.getMessage(), e);
        }
    }

    private static String getCellValueAsString(Cell cell) {
        if (cell == null) return "";

        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                } else {
                    // whole numbers without ".0"
                    double value = cell.getNumericCellValue();
                    if (value == (int) value) {
                        return String.valueOf((int) value);
                    } else {
                        return String.valueOf(value);
                    }
                }
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                try {
                    return cell.getStringCellValue();
                } catch (IllegalStateException e) {
                    double value = cell.getNumericCellValue();
                    return value == (int) value ? String.valueOf((int) value) : String.valueOf(value);
                }
            case BLANK:
            default:
                return "";
        }
    }

    private static InputDataException fail(String message) {
        LOGGER.severe(message);
        return new InputDataException(message);
    }
}
