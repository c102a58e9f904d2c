package org.pep2rpm.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;

import org.pep2rpm.cli.CommandLineInterface;
import org.pep2rpm.translator.TranslationException;
import org.pep2rpm.translator.version.LocalSegmentPolicy;
import org.pep2rpm.translator.version.VersionOrderEncoder;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command encoding PEP 440 versions into RPM version labels, one per line.
 */
@Command(
    name = "encode",
    description = "Encode PEP 440 versions into RPM labels that sort the same way"
)
public class EncodeCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "VERSION", description = "PEP 440 versions")
    private List<String> versions;

    @Option(
        names = {"--best-effort"},
        description = "Encode local labels RPM cannot order exactly instead of failing"
    )
    private boolean bestEffort;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            VersionOrderEncoder encoder = bestEffort
                    ? new VersionOrderEncoder(LocalSegmentPolicy.BEST_EFFORT)
                    : parent.getSettings().createEncoder();
            for (String version : versions) {
                out.println(encoder.encode(version));
            }
            out.flush();
            return 0;
        } catch (TranslationException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }
    }
}
