package org.pep2rpm.cli.commands;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.pep2rpm.cli.CommandLineInterface;
import org.pep2rpm.translator.TranslationException;
import org.pep2rpm.translator.requirement.RequirementConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command converting Python requirement strings into RPM dependency clauses.
 * <p>
 * Prints one line per requirement that applies; requirements whose marker is false for the
 * target system are omitted.
 */
@Command(
    name = "convert",
    description = "Convert PEP 508 requirements into RPM dependency clauses"
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(
        arity = "1..*",
        paramLabel = "REQUIREMENT",
        description = "Requirement strings, e.g. 'requests (>=2.8) ; extra == \"socks\"'"
    )
    private List<String> requirements;

    @Option(
        names = {"-x", "--extra"},
        description = "Active extra (repeatable)"
    )
    private List<String> extras = List.of();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            RequirementConverter converter = parent.getSettings().createRequirementConverter();
            Set<String> activeExtras = new LinkedHashSet<>(extras);
            for (String clause : converter.convert(requirements, activeExtras)) {
                out.println(clause);
            }
            out.flush();
            return 0;
        } catch (TranslationException e) {
            log.debug("Conversion failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }
    }
}
