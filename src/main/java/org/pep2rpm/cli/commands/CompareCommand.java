package org.pep2rpm.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.pep2rpm.translator.TranslationException;
import org.pep2rpm.translator.version.LocalSegmentPolicy;
import org.pep2rpm.translator.version.RpmLabelComparator;
import org.pep2rpm.translator.version.Version;
import org.pep2rpm.translator.version.VersionOrderEncoder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command comparing two versions under PEP 440 and under RPM after encoding.
 * <p>
 * Exits with 0 when both orders agree and 3 when they differ, which can only happen for local
 * labels RPM cannot order exactly.
 */
@Command(
    name = "compare",
    description = "Compare two versions under PEP 440 and, once encoded, under RPM"
)
public class CompareCommand implements Callable<Integer> {

    static final int ORDER_MISMATCH = 3;

    @Parameters(index = "0", paramLabel = "LEFT", description = "First PEP 440 version")
    private String left;

    @Parameters(index = "1", paramLabel = "RIGHT", description = "Second PEP 440 version")
    private String right;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            VersionOrderEncoder encoder = new VersionOrderEncoder(LocalSegmentPolicy.BEST_EFFORT);
            Version leftVersion = Version.parse(left);
            Version rightVersion = Version.parse(right);
            String leftLabel = encoder.encode(leftVersion);
            String rightLabel = encoder.encode(rightVersion);

            int pep440 = Integer.signum(leftVersion.compareTo(rightVersion));
            int rpm = Integer.signum(RpmLabelComparator.INSTANCE.compare(leftLabel, rightLabel));

            out.printf("pep440: %s %s %s%n", leftVersion, symbol(pep440), rightVersion);
            out.printf("rpm:    %s %s %s%n", leftLabel, symbol(rpm), rightLabel);
            out.flush();
            return pep440 == rpm ? 0 : ORDER_MISMATCH;
        } catch (TranslationException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static String symbol(int comparison) {
        return comparison < 0 ? "<" : comparison > 0 ? ">" : "==";
    }
}
