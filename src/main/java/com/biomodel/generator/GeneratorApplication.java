package com.biomodel.generator;

import com.biomodel.generator.cli.ConvertCommand;

import picocli.CommandLine;

/**
 * Main entry point for the text-to-ODE model generator.
 * Reads a plain-text list of biochemical events and produces the rate
 * equations and differential equations of the corresponding model.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand()).execute(args);
        System.exit(exitCode);
    }
}
