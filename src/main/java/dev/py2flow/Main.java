package dev.py2flow;

import dev.py2flow.cli.Py2FlowCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new Py2FlowCli()).execute(args);
        System.exit(exitCode);
    }
}
