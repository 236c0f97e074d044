package com.raditha.rlint.cli;

import com.raditha.rlint.model.Diagnostic;
import com.raditha.rlint.model.Location;
import com.raditha.rlint.workflow.FileOutcome;

import java.io.PrintStream;
import java.util.List;

/**
 * GitHub Actions workflow commands, one per diagnostic, so that findings show
 * up as annotations on the pull request:
 * {@code ::warning file=R/a.R,line=3,col=6::[seq] message suggestion}.
 * Files that could not be linted become {@code ::error} commands. No summary is printed.
 */
public class GithubReporter implements Reporter {

    @Override
    public void report(List<FileOutcome> outcomes, PrintStream out) {
        for (FileOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                out.println("::error file=" + property(outcome.path().toString()) + "::" + data(outcome.error()));
                continue;
            }
            for (Diagnostic diagnostic : outcome.diagnostics()) {
                out.println(format(diagnostic));
            }
        }
    }

    static String format(Diagnostic diagnostic) {
        StringBuilder line = new StringBuilder("::warning file=");
        line.append(property(String.valueOf(diagnostic.file())));
        Location location = diagnostic.location();
        if (location != null) {
            line.append(",line=").append(location.row()).append(",col=").append(location.column());
        }
        String message = diagnostic.suggestion() == null
                ? diagnostic.message()
                : diagnostic.message() + " " + diagnostic.suggestion();
        line.append("::[").append(diagnostic.rule().id()).append("] ").append(data(message));
        return line.toString();
    }

    static String data(String value) {
        return value.replace("%", "%25").replace("\r", "%0D").replace("\n", "%0A");
    }

    static String property(String value) {
        return data(value).replace(":", "%3A").replace(",", "%2C");
    }
}
