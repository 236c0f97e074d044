package com.raditha.rlint.cli;

import com.raditha.rlint.workflow.FileOutcome;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Prints the outcome of a run.
 */
public interface Reporter {

    void report(List<FileOutcome> outcomes, PrintStream out) throws IOException;
}
