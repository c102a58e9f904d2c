package org.pep2rpm.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;

import org.pep2rpm.cli.CommandLineInterface;
import org.pep2rpm.translator.TranslationException;
import org.pep2rpm.translator.requirement.DependencyTag;
import org.pep2rpm.translator.requirement.PackageDependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command printing the dependency tags of a package from its dependency metadata.
 * <p>
 * Example:
 * <pre>
 *   pep2rpm --flavour fedora tags --requires-dist 'idna (>=2.5)' \
 *       --requires-dist 'PySocks (!=1.5.7) ; extra == "socks"' --provides-extra socks \
 *       --requires-python '>=3.7'
 * </pre>
 */
@Command(
    name = "tags",
    description = "Print BuildRequires, Requires and optional dependency tags of a package"
)
public class TagsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TagsCommand.class);

    @Option(names = {"--build-requires"}, paramLabel = "REQ", description = "Build-system requirement (repeatable)")
    private List<String> buildRequires = List.of();

    @Option(names = {"--requires-dist"}, paramLabel = "REQ", description = "Requires-Dist entry (repeatable)")
    private List<String> requiresDist = List.of();

    @Option(names = {"--provides-extra"}, paramLabel = "EXTRA", description = "Provides-Extra entry (repeatable)")
    private List<String> providesExtra = List.of();

    @Option(names = {"--requires-python"}, paramLabel = "SPEC", description = "Requires-Python specifier set")
    private String requiresPython;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            PackageDependencies dependencies =
                    new PackageDependencies(buildRequires, requiresDist, providesExtra, requiresPython);
            List<DependencyTag> tags = parent.getSettings().createDependencyTagComposer().compose(dependencies);
            for (DependencyTag tag : tags) {
                out.println(tag.render());
            }
            out.flush();
            return 0;
        } catch (TranslationException e) {
            log.debug("Tag composition failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }
    }
}
