package com.jobd.cli;

import com.jobd.ipc.DaemonClient;
import com.jobd.model.DaemonStatus;
import com.jobd.model.JobStatus;
import picocli.CommandLine;

import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "status", description = "Show counts of jobs by status")
public class StatusCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ClientOptions options;

    @Override
    public Integer call() {
        try (DaemonClient client = options.open()) {
            DaemonStatus status = client.getStatus();
            Map<String, Integer> counts = status.getJobs().getByStatus();
            System.out.println("Job counts by status:");
            System.out.printf("%-12s %s%n", "status", "count");
            for (JobStatus s : JobStatus.values()) {
                System.out.printf("%-12s %d%n", s.wireName(), counts.getOrDefault(s.wireName(), 0));
            }
            System.out.printf("%n%-12s %d%n", "total", status.getJobs().getTotal());
            System.out.printf("%-12s %d%n", "executions", status.getExecutions());
            return 0;
        } catch (Exception ex) {
            System.err.println(ex.getMessage());
            return 2;
        }
    }
}
