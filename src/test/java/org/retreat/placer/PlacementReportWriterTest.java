package org.retreat.placer;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlacementReportWriterTest {

    private static PlacementData.Person person(int index, String first, String last, String org) {
        return new PlacementData.Person(index, first, last, org, "", "", "Any", "Any", false, false);
    }

    private static PlacementOutcome outcome(boolean withAuditLog) {
        PlacementData.Person ann = person(0, "Ann", "Lee", "Alpha");
        PlacementData.Person bob = person(1, "Bob", "Jones", "Alpha");
        PlacementData.Person cal = person(2, "Cal", "Diaz", "");

        PlacementOutcome.PlacementRecord annTop = new PlacementOutcome.PlacementRecord(ann, "Pine Hall", "Room A", 1,
                PlacementData.BunkTier.TOP, "");
        PlacementOutcome.PlacementRecord bobBottom = new PlacementOutcome.PlacementRecord(bob, "Pine Hall", "Room A", 1,
                PlacementData.BunkTier.BOTTOM, "Ann Lee");
        PlacementOutcome.PlacementRecord calOak = new PlacementOutcome.PlacementRecord(cal, "Oak Lodge", "Room 201", 2,
                PlacementData.BunkTier.BOTTOM, "");
        PlacementOutcome.UnplacedRecord dee = new PlacementOutcome.UnplacedRecord(person(3, "Dee", "Fox", ""), "",
                Arrays.asList("Needs floor 1 (2 rooms exist)", "Capacity exhausted or competing constraints"));

        PlacementData data = TestRosters.people(TestRosters.person("Eve", "Brown", "", "", "Ann Lee"),
                TestRosters.person("Ann", "Lee", "", "", ""));
        AttachResolver.AttachResolution resolution = new AttachResolver(MatchingTables.defaults()).resolve(data);

        PlacementSummary summary = new PlacementSummary(10, Arrays.asList(annTop, bobBottom, calOak),
                Arrays.asList(dee), null);
        return new PlacementOutcome(Arrays.asList(annTop, bobBottom, calOak), Arrays.asList(dee),
                withAuditLog ? resolution.entries : Collections.<AttachResolver.ResolutionEntry>emptyList(),
                PlacementCPSATOptimizer.SolveStatus.OPTIMAL, summary);
    }

    private static Workbook read(File file) throws IOException {
        try (FileInputStream fis = new FileInputStream(file)) {
            return new XSSFWorkbook(fis);
        }
    }

    @Test
    @DisplayName("placements are sorted by building, room and bottom bunk first")
    void placementsSheet(@TempDir Path dir) throws IOException {
        File file = dir.resolve("FilledRoomMap.xlsx").toFile();
        PlacementReportWriter.write(outcome(true), file);

        try (Workbook workbook = read(file)) {
            assertThat(workbook.getSheetName(0)).isEqualTo("Placements");
            Sheet sheet = workbook.getSheet("Placements");
            assertThat(sheet.getRow(0).getCell(9).getStringCellValue()).isEqualTo("AttachResolved");
            assertThat(sheet.getRow(1).getCell(0).getStringCellValue()).isEqualTo("Oak Lodge");
            assertThat(sheet.getRow(2).getCell(2).getStringCellValue()).isEqualTo("Bob");
            assertThat(sheet.getRow(2).getCell(7).getStringCellValue()).isEqualTo("Bottom");
            assertThat(sheet.getRow(2).getCell(9).getStringCellValue()).isEqualTo("Ann Lee");
            assertThat(sheet.getRow(3).getCell(2).getStringCellValue()).isEqualTo("Ann");
            assertThat(sheet.getRow(3).getCell(6).getNumericCellValue()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("unplaced reasons are joined and the summary counts by org and building")
    void unplacedAndSummarySheets(@TempDir Path dir) throws IOException {
        File file = dir.resolve("FilledRoomMap.xlsx").toFile();
        PlacementReportWriter.write(outcome(true), file);

        try (Workbook workbook = read(file)) {
            Row dee = workbook.getSheet("Unplaced").getRow(1);
            assertThat(dee.getCell(0).getStringCellValue()).isEqualTo("Dee");
            assertThat(dee.getCell(8).getStringCellValue())
                    .isEqualTo("Needs floor 1 (2 rooms exist); Capacity exhausted or competing constraints");

            Sheet warnings = workbook.getSheet("AttachWarnings");
            assertThat(warnings).isNotNull();
            assertThat(warnings.getRow(1).getCell(0).getStringCellValue()).isEqualTo("Eve Brown");
            assertThat(warnings.getRow(1).getCell(1).getStringCellValue()).isEqualTo("Ann Lee");

            Sheet summary = workbook.getSheet("Summary");
            boolean found = false;
            for (Row row : summary) {
                if (row.getCell(0) != null && "Alpha".equals(row.getCell(0).getStringCellValue())) {
                    assertThat(row.getCell(1).getStringCellValue()).isEqualTo("Pine Hall");
                    assertThat(row.getCell(2).getNumericCellValue()).isEqualTo(2.0);
                    found = true;
                }
            }
            assertThat(found).isTrue();
        }
    }

    @Test
    @DisplayName("the AttachWarnings sheet is left out when nothing was resolved")
    void noWarningsSheet(@TempDir Path dir) throws IOException {
        File file = dir.resolve("FilledRoomMap.xlsx").toFile();
        PlacementReportWriter.write(outcome(false), file);

        try (Workbook workbook = read(file)) {
            assertThat(workbook.getSheet("AttachWarnings")).isNull();
            assertThat(workbook.getNumberOfSheets()).isEqualTo(3);
        }
    }
}
