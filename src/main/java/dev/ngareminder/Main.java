package dev.ngareminder;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "nga-reminder",
		version = "1.0.0",
		description = "Watches NGA forum threads and notifies when watched authors post",
		mixinStandardHelpOptions = true,
		subcommands = {RunCommand.class, CheckCommand.class, ScheduleCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	private CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
