package org.retreat.placer;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 *   RetreatPlacerApplication [RoomMap.xlsx] [PeopleToPlace.xlsx] [FilledRoomMap.xlsx]
 *   RetreatPlacerApplication --generate-sample
 * </pre>
 */
public class RetreatPlacerApplication {
    private static final Logger LOGGER = Logger.getLogger(RetreatPlacerApplication.class.getName());

    static final String DEFAULT_ROOM_FILE = "RoomMap.xlsx";
    static final String DEFAULT_PEOPLE_FILE = "PeopleToPlace.xlsx";
    static final String DEFAULT_OUTPUT_FILE = "FilledRoomMap.xlsx";

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    /**
     * Uses the bundled logging.properties unless a config file was given on the command line.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = RetreatPlacerApplication.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Cannot read bundled logging.properties, using JDK defaults", e);
        }
    }

    static int run(String[] args) {
        List<String> arguments = Arrays.asList(args);
        if (arguments.contains("--generate-sample")) {
            SampleDataGenerator.generate(new File(DEFAULT_ROOM_FILE), new File(DEFAULT_PEOPLE_FILE));
            return 0;
        }

        File roomFile = new File(args.length > 0 ? args[0] : DEFAULT_ROOM_FILE);
        File peopleFile = new File(args.length > 1 ? args[1] : DEFAULT_PEOPLE_FILE);
        File outputFile = new File(args.length > 2 ? args[2] : DEFAULT_OUTPUT_FILE);

        LOGGER.info("Room map : " + roomFile.getPath());
        LOGGER.info("People   : " + peopleFile.getPath());
        LOGGER.info("Output   : " + outputFile.getPath());

        // fail before solving when the output file is locked
        if (outputFile.exists()) {
            if (!outputFile.delete()) {
                LOGGER.severe("Cannot write to '" + outputFile.getPath() + "', is it open in another program?");
                return 1;
            }
            LOGGER.info("Removed existing " + outputFile.getPath());
        }

        try {
            List<RosterPreparer.RawRoom> rooms = FileProcessor.readRooms(roomFile);
            List<RosterPreparer.RawPerson> people = FileProcessor.readPeople(peopleFile);

            RetreatPlacer placer = new RetreatPlacer(PlacementConfig.fromSystemProperties(), MatchingTables.load());
            PlacementOutcome outcome = placer.place(rooms, people);

            outcome.printDetailedSummary();
            PlacementReportWriter.write(outcome, outputFile);

            LOGGER.info(String.format("Output saved to %s (%d placed, %d unplaced, %d attach log entries)",
                    outputFile.getPath(), outcome.summary.placedCount, outcome.summary.unplacedCount,
                    outcome.auditLog.size()));
            return 0;
        } catch (PlacementException | UncheckedIOException | IllegalArgumentException e) {
            LOGGER.severe("Placement failed: " + e.getMessage());
            return 1;
        }
    }
}
