package com.jobd;

import com.jobd.cli.AddCommand;
import com.jobd.cli.DaemonCommand;
import com.jobd.cli.ExportCommand;
import com.jobd.cli.JobCommand;
import com.jobd.cli.ListCommand;
import com.jobd.cli.StatusCommand;
import com.jobd.cli.TemplatesCommand;
import picocli.CommandLine;

@CommandLine.Command(
    name = "jobd",
    mixinStandardHelpOptions = true,
    version = "jobd 0.0.1",
    description = "jobd - per-user job daemon and its command line"
)
public class JobdApplication implements Runnable {
    public void run() {
        System.out.println("jobd: use --help for commands");
    }

    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new JobdApplication());
        cmd.addSubcommand(new DaemonCommand());
        cmd.addSubcommand(new AddCommand());
        cmd.addSubcommand(new ListCommand());
        cmd.addSubcommand(new StatusCommand());
        cmd.addSubcommand(new JobCommand());
        cmd.addSubcommand(new ExportCommand());
        cmd.addSubcommand(new TemplatesCommand());
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
