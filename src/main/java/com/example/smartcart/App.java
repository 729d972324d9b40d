package com.example.smartcart;

import com.example.smartcart.cli.SmartCartCli;
import picocli.CommandLine;

public class App {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SmartCartCli()).execute(args);
        System.exit(exitCode);
    }
}
