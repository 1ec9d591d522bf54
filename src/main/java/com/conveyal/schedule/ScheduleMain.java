package com.conveyal.schedule;

import com.conveyal.schedule.editor.ServiceBandClassifier;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.stats.BlockSummary;
import com.conveyal.schedule.stats.ScheduleStats;
import com.conveyal.schedule.storage.JsonSchedulePersistence;
import com.conveyal.schedule.util.json.JsonManager;
import com.conveyal.schedule.validator.ValidationResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;

public class ScheduleMain {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleMain.class);

    public static void main (String[] args) throws Exception {
        Options options = getOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse( options, args);
        String[] arguments = cmd.getArgs();
        if (cmd.hasOption("help")) {
            printHelp(options);
            return;
        }
        if (arguments.length < 1) {
            System.out.println("Please specify a schedule JSON file to load.");
            System.exit(1);
        }
        Schedule schedule = new JsonSchedulePersistence(new File(arguments[0])).load();
        if (schedule == null) {
            System.out.println("No schedule found at " + arguments[0]);
            System.exit(1);
        }
        // Edits are only written out when an output file is given.
        JsonSchedulePersistence output = arguments.length >= 2 ? new JsonSchedulePersistence(new File(arguments[1])) : null;
        ScheduleEditor editor = new ScheduleEditor(schedule, new ServiceBandClassifier(), RecoveryTemplates.EMPTY, output);

        if (cmd.hasOption("reassign-blocks")) {
            editor.reassignBlocksIfNeeded();
            editor.getWarnings().forEach(w -> LOG.warn("{}", w.getMessageWithContext()));
        }
        if (cmd.hasOption("enforce-tail")) {
            editor.enforceTailRecoveryRules();
        }
        if (cmd.hasOption("summary")) {
            ScheduleStats stats = new ScheduleStats(editor.getSchedule());
            LOG.info("Summary: {}", stats.getSummary());
            for (BlockSummary block : stats.getBlockSummaries()) {
                LOG.info("  block {}: {} trips, {} - {}, {} min recovery", block.getBlockNumber(), block.getTripCount(),
                    block.getStartTime(), block.getEndTime(), block.getRecoveryMinutes());
            }
        }
        if (cmd.hasOption("validate")) {
            JsonManager<ValidationResult> json = new JsonManager<>(ValidationResult.class);
            ValidationResult result = editor.validate();
            String resultString = json.writePretty(result);
            if (cmd.hasOption("result")) {
                File resultFile = new File(cmd.getOptionValue("result"));
                FileUtils.writeStringToFile(resultFile, resultString, StandardCharsets.UTF_8);
                LOG.info("Storing validation result at: {}", resultFile.getAbsolutePath());
            } else {
                LOG.info("Printing validation result for {}", arguments[0]);
                System.out.print(resultString);
            }
        }
    }

    private static void printHelp(Options options) {
        final String HELP = String.join("\n",
                "java -jar schedule-lib.jar [options] INPUT.json [OUTPUT.json]",
                "Load a schedule snapshot, optionally repair its blocks and tail recovery,",
                "and report on it. Repaired schedules are written to OUTPUT.json.",
                "", // blank lines for legibility
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        System.out.println(); // blank line for legibility
        formatter.printHelp( HELP, options );
        System.out.println(); // blank line for legibility
    }

    private static Options getOptions () {
        Options options = new Options();
        options.addOption(new Option("help", false, "print this message"));
        options.addOption(Option.builder().longOpt("reassign-blocks")
            .desc("recompute vehicle blocks if they overlap or look like import artifacts").build());
        options.addOption(Option.builder().longOpt("enforce-tail")
            .desc("move recovery off the last trip of every block").build());
        options.addOption(Option.builder().longOpt("summary")
            .desc("log trip, travel and recovery totals per schedule and per block").build());
        options.addOption(new Option("validate", false, "check the schedule for consistency problems"));
        options.addOption(Option.builder().longOpt("result").hasArg().argName("file")
            .desc("store the validation result at this location instead of printing it").build());
        return options;
    }

}
