package org.pep2rpm.translator.requirement;

import org.pep2rpm.translator.Names;
import org.pep2rpm.translator.TranslationException;
import org.pep2rpm.translator.capability.CapabilityTemplate;
import org.pep2rpm.translator.marker.MarkerEvaluator;
import org.pep2rpm.translator.marker.TranslationResult;
import org.pep2rpm.translator.specifier.SpecifierTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Converts Python requirement strings into RPM dependency clauses.
 * <p>
 * For each requirement the marker is evaluated first. A statically false marker drops the
 * requirement; otherwise the project name is formatted through the package template, the version
 * specifiers are translated and, when part of the marker is only known at install time, the
 * clause is wrapped into an RPM boolean dependency: {@code (python3-foo >= 1.0 with python(x86-64))}.
 * <p>
 * Output keeps the declaration order of the input and is byte-identical across runs.
 */
public class RequirementConverter {

    private static final Logger log = LoggerFactory.getLogger(RequirementConverter.class);

    private final CapabilityTemplate packageTemplate;
    private final MarkerEvaluator markerEvaluator;
    private final SpecifierTranslator specifierTranslator;
    private final boolean normalizeNames;

    /**
     * @param packageTemplate     Template turning a project name into its RPM capability, e.g. {@code python3-{name}}.
     * @param markerEvaluator     Evaluator for requirement markers.
     * @param specifierTranslator Translator for version specifiers.
     * @param normalizeNames      Whether project names are PEP 503-normalized before templating.
     */
    public RequirementConverter(CapabilityTemplate packageTemplate, MarkerEvaluator markerEvaluator,
                                SpecifierTranslator specifierTranslator, boolean normalizeNames) {
        this.packageTemplate = packageTemplate;
        this.markerEvaluator = markerEvaluator;
        this.specifierTranslator = specifierTranslator;
        this.normalizeNames = normalizeNames;
    }

    public RequirementConverter(CapabilityTemplate packageTemplate, MarkerEvaluator markerEvaluator,
                                SpecifierTranslator specifierTranslator) {
        this(packageTemplate, markerEvaluator, specifierTranslator, false);
    }

    /**
     * Converts requirements in declaration order.
     * @param requirements The requirement strings.
     * @param activeExtras The extras whose requirements are wanted.
     * @return One clause per kept requirement, in input order.
     * @throws TranslationException on the first requirement that cannot be translated.
     */
    public List<String> convert(List<String> requirements, Set<String> activeExtras) {
        List<String> clauses = new ArrayList<>();
        for (String requirement : requirements) {
            convert(requirement, activeExtras).ifPresent(clauses::add);
        }
        return clauses;
    }

    /**
     * Converts independent requirements on an executor and reassembles the clauses in
     * declaration order.
     * @param requirements The requirement strings.
     * @param activeExtras The active extras.
     * @param executor     The executor running the translations.
     * @return The same clauses, in the same order, as {@link #convert(List, Set)}.
     * @throws TranslationException on the first requirement, in input order, that failed.
     */
    public List<String> convertConcurrently(List<String> requirements, Set<String> activeExtras, Executor executor) {
        List<CompletableFuture<Optional<String>>> futures = new ArrayList<>();
        for (String requirement : requirements) {
            futures.add(CompletableFuture.supplyAsync(() -> convert(requirement, activeExtras), executor));
        }
        List<String> clauses = new ArrayList<>();
        for (CompletableFuture<Optional<String>> future : futures) {
            try {
                future.join().ifPresent(clauses::add);
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        return clauses;
    }

    /**
     * Converts one requirement string.
     * @return The clause, or empty when the marker is statically false.
     */
    public Optional<String> convert(String requirement, Set<String> activeExtras) {
        return convert(RequirementParser.parse(requirement), activeExtras);
    }

    /**
     * Converts one parsed requirement.
     * @return The clause, or empty when the marker is statically false.
     */
    public Optional<String> convert(Requirement requirement, Set<String> activeExtras) {
        TranslationResult condition = requirement.markerExpression()
                .map(marker -> markerEvaluator.evaluate(marker, activeExtras))
                .orElse(TranslationResult.TRUE);

        if (condition.isFalse()) {
            log.debug("Dropping requirement '{}': marker '{}' is false", requirement.name(), requirement.marker());
            return Optional.empty();
        }

        String capability = packageTemplate.format(normalizeNames ? Names.normalize(requirement.name()) : requirement.name());
        String versioned = specifierTranslator.translateToText(capability, requirement.specifiers());

        if (condition instanceof TranslationResult.Condition deferred) {
            log.debug("Requirement '{}' deferred to install time: {}", requirement.name(), deferred.text());
            return Optional.of("(" + versioned + " " + deferred.text() + ")");
        }
        return Optional.of(versioned);
    }
}
