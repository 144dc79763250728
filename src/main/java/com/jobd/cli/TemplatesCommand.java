package com.jobd.cli;

import com.jobd.core.JobTemplates;
import com.jobd.model.JobTemplate;
import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "templates", description = "List predefined job templates (use with: jobd add --template <id>)")
public class TemplatesCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        try {
            System.out.printf("%-18s %-16s %-14s %s%n", "id", "category", "schedule", "description");
            for (JobTemplate t : JobTemplates.load().list()) {
                System.out.printf("%-18s %-16s %-14s %s%n", t.getId(), t.getCategory(), t.getSchedule(), t.getDescription());
            }
            return 0;
        } catch (RuntimeException ex) {
            System.err.println("Failed to load templates: " + ex.getMessage());
            return 2;
        }
    }
}
