package com.jobd.cli;

import com.jobd.ipc.DaemonClient;
import com.jobd.model.ReportFormat;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "export", description = "Export all jobs with their statistics as JSON or CSV")
public class ExportCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ClientOptions options;

    @CommandLine.Option(names = {"--format"}, description = "json or csv", defaultValue = "json")
    private String format;

    @CommandLine.Option(names = {"--output", "-o"}, description = "Write the export to this file")
    private Path output;

    @Override
    public Integer call() {
        try {
            ReportFormat exportFormat = ReportFormat.fromWire(format);
            if (exportFormat == ReportFormat.TEXT) {
                System.err.println("Export format must be json or csv");
                return 2;
            }
            try (DaemonClient client = options.open()) {
                return JobCommand.write(client.exportJobs(exportFormat), output);
            }
        } catch (Exception ex) {
            System.err.println("Failed to export jobs: " + ex.getMessage());
            return 2;
        }
    }
}
