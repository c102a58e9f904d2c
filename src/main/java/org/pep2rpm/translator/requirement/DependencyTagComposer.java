package org.pep2rpm.translator.requirement;

import org.pep2rpm.translator.specifier.SpecifierSet;
import org.pep2rpm.translator.specifier.SpecifierTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Composes the dependency tags of a package: {@code BuildRequires}, {@code Requires} and the
 * optional dependency tag (e.g. {@code Suggests}).
 * <p>
 * Extras are selected by glob patterns matched against the extras the package provides.
 * Requirements of the extras selected for {@code Requires} are required; those of the extras
 * selected for the optional tag are suggested unless the same clause is already required.
 * The interpreter constraint comes from the configured Python version, or else from
 * {@code Requires-Python}, and is expressed against the interpreter ABI capability.
 */
public class DependencyTagComposer {

    private static final Logger log = LoggerFactory.getLogger(DependencyTagComposer.class);

    private final RequirementConverter converter;
    private final SpecifierTranslator specifierTranslator;
    private final DependencyTagSettings settings;

    public DependencyTagComposer(RequirementConverter converter, SpecifierTranslator specifierTranslator,
                                 DependencyTagSettings settings) {
        this.converter = converter;
        this.specifierTranslator = specifierTranslator;
        this.settings = settings;
    }

    /**
     * Builds the dependency tags of a package. Tags without clauses are omitted.
     * @param dependencies The package metadata.
     * @return The tags in spec file order.
     */
    public List<DependencyTag> compose(PackageDependencies dependencies) {
        List<DependencyTag> tags = new ArrayList<>();

        List<String> buildRequires = converter.convert(dependencies.buildRequires(), Set.of());
        if (!buildRequires.isEmpty()) {
            tags.add(new DependencyTag(DependencyTag.BUILD_REQUIRES, buildRequires));
        }

        List<String> requiresDist = settings.extractDependencies() ? dependencies.requiresDist() : List.of();
        List<String> providedExtras = settings.extractDependencies() ? dependencies.providesExtra() : List.of();

        Set<String> requiredExtras = selectExtras(providedExtras, settings.requiresExtras());
        List<String> required = new ArrayList<>(settings.staticRequires());
        required.addAll(converter.convert(requiresDist, requiredExtras));

        String python = settings.pythonVersion() != null ? settings.pythonVersion() : dependencies.requiresPython();
        if (python != null && !python.isBlank()) {
            required.add(specifierTranslator.translateToText(settings.abiCapability(), SpecifierSet.parse(python)));
        }
        if (!required.isEmpty()) {
            tags.add(new DependencyTag(DependencyTag.REQUIRES, required));
        }

        String optionalTag = settings.optionalTag();
        if (optionalTag != null && !optionalTag.isBlank()) {
            Set<String> suggestedExtras = selectExtras(providedExtras, settings.suggestsExtras());
            Set<String> optional = new LinkedHashSet<>(settings.staticSuggests());
            optional.addAll(converter.convert(requiresDist, suggestedExtras));
            optional.removeAll(required);
            if (!optional.isEmpty()) {
                tags.add(new DependencyTag(optionalTag.trim(), new ArrayList<>(optional)));
            }
        }
        return tags;
    }

    /**
     * Selects the provided extras matching at least one glob pattern.
     * @param provided The extras the package provides.
     * @param patterns Glob patterns such as {@code test*}.
     * @return The matching extras, in the order they are provided.
     */
    static Set<String> selectExtras(List<String> provided, List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        Set<String> selected = new LinkedHashSet<>();
        for (String extra : provided) {
            if (matchers.stream().anyMatch(matcher -> matcher.matches(Path.of(extra)))) {
                selected.add(extra);
            }
        }
        if (!patterns.isEmpty()) {
            log.debug("Extras {} selected by patterns {}", selected, patterns);
        }
        return selected;
    }
}
