package com.jobd.cli;

import com.jobd.ipc.DaemonClient;
import com.jobd.model.Job;
import com.jobd.model.JobFilter;
import com.jobd.model.JobStatus;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "list", description = "List jobs (filter by --status, --tag, --user, --name)")
public class ListCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ClientOptions options;

    @CommandLine.Option(names = {"--status"}, split = ",",
            description = "Statuses to show: created|running|completed|failed|stopped|killed|paused|all", defaultValue = "all")
    private List<String> statuses;

    @CommandLine.Option(names = {"--tag"}, split = ",", description = "Only jobs carrying any of these tags")
    private List<String> tags;

    @CommandLine.Option(names = {"--user"}, description = "Only jobs owned by this user")
    private String user;

    @CommandLine.Option(names = {"--name"}, description = "Regex matched against job names")
    private String namePattern;

    @CommandLine.Option(names = {"--limit"}, description = "Maximum number of jobs", defaultValue = "0")
    private int limit;

    @Override
    public Integer call() {
        try (DaemonClient client = options.open()) {
            List<Job> jobs = client.listJobs(buildFilter(), limit);
            if (jobs.isEmpty()) {
                System.out.println("No jobs found");
                return 0;
            }
            System.out.printf("%-32s %-20s %-10s %-8s %s%n", "id", "name", "status", "retries", "command");
            for (Job j : jobs) {
                System.out.printf("%-32s %-20s %-10s %-8d %s%n",
                        j.getId(), j.getName(), j.getStatus() == null ? "-" : j.getStatus().wireName(),
                        j.getRetryCount(), j.getCommand());
            }
            return 0;
        } catch (Exception ex) {
            System.err.println(ex.getMessage());
            return 2;
        }
    }

    JobFilter buildFilter() {
        JobFilter filter = new JobFilter();
        List<JobStatus> wanted = new ArrayList<>();
        for (String s : statuses) {
            if (!s.equalsIgnoreCase("all")) wanted.add(JobStatus.fromWire(s.trim().toLowerCase()));
        }
        filter.setStatus(wanted.isEmpty() ? null : wanted);
        filter.setTags(tags);
        filter.setUser(user);
        filter.setNamePattern(namePattern);
        return filter;
    }
}
