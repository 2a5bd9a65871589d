package com.suitebridge;

import com.suitebridge.dispatch.cli.SuitebridgeCommand;
import picocli.CommandLine;

public class SuitebridgeApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SuitebridgeCommand()).execute(args);
        System.exit(exitCode);
    }
}
