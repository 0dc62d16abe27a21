package dev.flowdoctor;

import dev.flowdoctor.cli.FlowDoctorCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = FlowDoctorCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
