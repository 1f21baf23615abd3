package org.retreat.placer;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Small fixture: 9 rooms in 3 buildings and 15 people with two mutual attach pairs.
 */
public class SampleDataGenerator {
    private static final Logger LOGGER = Logger.getLogger(SampleDataGenerator.class.getName());

    private static final Object[][] ROOMS = {
            {"Oak Lodge", "Room 101", 1, 2, 2},
            {"Oak Lodge", "Room 102", 1, 1, 1},
            {"Oak Lodge", "Room 201", 2, 2, 2},
            {"Oak Lodge", "Room 202", 2, 1, 1},
            {"Pine Hall", "Room A", 1, 3, 3},
            {"Pine Hall", "Room B", 1, 2, 2},
            {"Pine Hall", "Room C", 2, 2, 2},
            {"Maple House", "Suite 1", 1, 1, 0},
            {"Maple House", "Suite 2", 1, 1, 1},
    };

    private static final String[][] PEOPLE = {
            {"Alice", "Smith", "Alpha", "Team1", "", "Any", "Any"},
            {"Bob", "Jones", "Alpha", "Team1", "", "Any", "Any"},
            {"Carol", "Davis", "Alpha", "Team1", "", "Any", "Any"},
            {"Dave", "Wilson", "Alpha", "Team2", "Eve Brown", "Any", "Any"},
            {"Eve", "Brown", "Alpha", "Team2", "Dave Wilson", "Any", "Any"},
            {"Frank", "Miller", "Beta", "Sales", "", "1", "Bottom"},
            {"Grace", "Taylor", "Beta", "Sales", "", "Any", "Any"},
            {"Hank", "Anderson", "Beta", "Sales", "", "Any", "Any"},
            {"Irene", "Thomas", "Beta", "", "", "Any", "Bottom"},
            {"Jack", "Moore", "Gamma", "", "Karen White", "1", "Bottom"},
            {"Karen", "White", "Gamma", "", "Jack Moore", "Any", "Any"},
            {"Leo", "Harris", "Gamma", "Dev", "", "Any", "Any"},
            {"Mona", "Martin", "Gamma", "Dev", "", "Any", "Any"},
            {"Nate", "Garcia", "", "", "", "Any", "Any"},
            {"Olivia", "Martinez", "", "", "", "1", "Bottom"},
    };

    private SampleDataGenerator() {
    }

    public static List<RosterPreparer.RawRoom> sampleRooms() {
        List<RosterPreparer.RawRoom> rooms = new ArrayList<>();
        for (int i = 0; i < ROOMS.length; i++) {
            Object[] r = ROOMS[i];
            rooms.add(new RosterPreparer.RawRoom(i + 2, (String) r[0], (String) r[1],
                    String.valueOf(r[2]), String.valueOf(r[3]), String.valueOf(r[4])));
        }
        return rooms;
    }

    public static List<RosterPreparer.RawPerson> samplePeople() {
        List<RosterPreparer.RawPerson> people = new ArrayList<>();
        for (int i = 0; i < PEOPLE.length; i++) {
            String[] p = PEOPLE[i];
            people.add(new RosterPreparer.RawPerson(i + 2, p[0], p[1], p[2], p[3], p[4], p[5], p[6]));
        }
        return people;
    }

    /**
     * Writes the fixture as the two input workbooks.
     */
    public static void generate(File roomFile, File peopleFile) {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Rooms");
            writeHeader(sheet, FileProcessor.ROOM_COLUMNS);
            int rowNum = 1;
            for (Object[] room : ROOMS) {
                Row row = sheet.createRow(rowNum++);
                row.createCell(0).setCellValue((String) room[0]);
                row.createCell(1).setCellValue((String) room[1]);
                row.createCell(2).setCellValue((Integer) room[2]);
                row.createCell(3).setCellValue((Integer) room[3]);
                row.createCell(4).setCellValue((Integer) room[4]);
            }
            save(workbook, roomFile);
        } catch (IOException e) {
            throw writeFailure(roomFile, e);
        }

        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("People");
            writeHeader(sheet, FileProcessor.PEOPLE_COLUMNS);
            int rowNum = 1;
            for (String[] person : PEOPLE) {
                Row row = sheet.createRow(rowNum++);
                for (int c = 0; c < person.length; c++) {
                    row.createCell(c).setCellValue(person[c]);
                }
            }
            save(workbook, peopleFile);
        } catch (IOException e) {
            throw writeFailure(peopleFile, e);
        }

        int slots = 0;
        for (Object[] room : ROOMS) {
            slots += (Integer) room[3] + (Integer) room[4];
        }
        LOGGER.info(String.format("Sample data generated: %s, %s (%d slots, %d people)",
                roomFile.getName(), peopleFile.getName(), slots, PEOPLE.length));
    }

    private static void writeHeader(Sheet sheet, List<String> columns) {
        Row header = sheet.createRow(0);
        for (int c = 0; c < columns.size(); c++) {
            header.createCell(c).setCellValue(columns.get(c));
        }
    }

    private static void save(Workbook workbook, File file) throws IOException {
        try (FileOutputStream fos = new FileOutputStream(file)) {
            workbook.write(fos);
        }
    }

    private static UncheckedIOException writeFailure(File file, IOException e) {
        String message = "Cannot write sample workbook " + file.getPath();
        LOGGER.log(Level.SEVERE, message, e);
        return new UncheckedIOException(message, e);
    }
}
