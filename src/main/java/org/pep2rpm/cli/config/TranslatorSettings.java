package org.pep2rpm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import org.pep2rpm.translator.capability.CapabilityDescriptor;
import org.pep2rpm.translator.capability.CapabilityKind;
import org.pep2rpm.translator.capability.CapabilityTemplate;
import org.pep2rpm.translator.capability.DynamicVariableMapping;
import org.pep2rpm.translator.marker.MarkerEnvironment;
import org.pep2rpm.translator.marker.MarkerEvaluator;
import org.pep2rpm.translator.requirement.DependencyTagComposer;
import org.pep2rpm.translator.requirement.DependencyTagSettings;
import org.pep2rpm.translator.requirement.RequirementConverter;
import org.pep2rpm.translator.specifier.SpecifierTranslator;
import org.pep2rpm.translator.specifier.VersionRendering;
import org.pep2rpm.translator.version.LocalSegmentPolicy;
import org.pep2rpm.translator.version.VersionOrderEncoder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Translator settings resolved from the {@code pep2rpm} configuration block, and the factory of
 * the translation components they configure.
 * <p>
 * Templates are taken from the selected flavour and the flavours it inherits from, the most
 * specific flavour winning. Dynamic marker capabilities may name a flavour template
 * ({@code template = python-arch}) or a literal capability ({@code capability = kernel}).
 *
 * @param flavour            The selected flavour.
 * @param templates          The merged capability templates of the flavour.
 * @param environment        The statically known marker values.
 * @param dynamicMapping     The install-time marker variables.
 * @param versionRendering   How specifier versions are written into clauses.
 * @param localSegmentPolicy How unorderable local labels are treated by the encoder.
 * @param normalizeNames     Whether project names are normalized before templating.
 * @param tagSettings        Settings of the dependency tag composition.
 */
public record TranslatorSettings(
        String flavour,
        Map<String, String> templates,
        MarkerEnvironment environment,
        DynamicVariableMapping dynamicMapping,
        VersionRendering versionRendering,
        LocalSegmentPolicy localSegmentPolicy,
        boolean normalizeNames,
        DependencyTagSettings tagSettings
) {

    public static final String ROOT_PATH = "pep2rpm";
    public static final String PYTHON_PACKAGE = "python-package";
    public static final String PYTHON_ABI = "python-abi";

    public TranslatorSettings {
        templates = Map.copyOf(templates);
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config          The application configuration containing a {@code pep2rpm} block.
     * @param flavourOverride A flavour overriding {@code pep2rpm.flavour}, or null.
     * @return The settings.
     * @throws IllegalArgumentException for unknown flavours, inheritance cycles, missing templates
     *         or invalid enumerated values.
     * @throws com.typesafe.config.ConfigException for missing or mistyped keys.
     */
    public static TranslatorSettings fromConfig(Config config, String flavourOverride) {
        Config root = config.getConfig(ROOT_PATH);
        String flavour = flavourOverride != null ? flavourOverride : root.getString("flavour");
        Map<String, String> templates = resolveTemplates(root, flavour);
        for (String required : List.of(PYTHON_PACKAGE, PYTHON_ABI)) {
            if (!templates.containsKey(required)) {
                throw new IllegalArgumentException("Flavour '" + flavour + "' defines no '" + required + "' template");
            }
        }

        Config dependencies = root.getConfig("dependencies");
        DependencyTagSettings tagSettings = new DependencyTagSettings(
                dependencies.getBoolean("extract"),
                dependencies.getStringList("requires"),
                dependencies.getStringList("suggests"),
                dependencies.getStringList("requires-extras"),
                dependencies.getStringList("suggests-extras"),
                dependencies.getString("optional-tag"),
                dependencies.hasPath("python-version") ? dependencies.getString("python-version") : null,
                templates.get(PYTHON_ABI));

        return new TranslatorSettings(
                flavour,
                templates,
                MarkerEnvironment.of(readStringMap(root.getConfig("environment"))),
                readDynamicMapping(root.getConfig("dynamic-markers"), templates),
                parseEnum(VersionRendering.class, root.getString("version-rendering")),
                parseEnum(LocalSegmentPolicy.class, root.getString("local-segments")),
                root.getBoolean("normalize-names"),
                tagSettings);
    }

    public VersionOrderEncoder createEncoder() {
        return new VersionOrderEncoder(localSegmentPolicy);
    }

    public SpecifierTranslator createSpecifierTranslator() {
        return new SpecifierTranslator(versionRendering, createEncoder());
    }

    public MarkerEvaluator createMarkerEvaluator() {
        return new MarkerEvaluator(environment, dynamicMapping);
    }

    public RequirementConverter createRequirementConverter() {
        return new RequirementConverter(CapabilityTemplate.of(templates.get(PYTHON_PACKAGE)),
                createMarkerEvaluator(), createSpecifierTranslator(), normalizeNames);
    }

    public DependencyTagComposer createDependencyTagComposer() {
        return new DependencyTagComposer(createRequirementConverter(), createSpecifierTranslator(), tagSettings);
    }

    private static Map<String, String> resolveTemplates(Config root, String flavour) {
        List<Config> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = flavour;
        while (current != null) {
            if (!seen.add(current)) {
                throw new IllegalArgumentException("Flavour inheritance cycle through '" + current + "'");
            }
            String path = ConfigUtil.joinPath("flavours", current);
            if (!root.hasPath(path)) {
                throw new IllegalArgumentException("Unknown flavour '" + current + "'");
            }
            Config definition = root.getConfig(path);
            chain.add(definition);
            current = definition.hasPath("inherits") ? definition.getString("inherits") : null;
        }

        Map<String, String> templates = new LinkedHashMap<>();
        for (int i = chain.size() - 1; i >= 0; i--) {
            Config definition = chain.get(i);
            if (definition.hasPath("templates")) {
                templates.putAll(readStringMap(definition.getConfig("templates")));
            }
        }
        return templates;
    }

    private static DynamicVariableMapping readDynamicMapping(Config markers, Map<String, String> templates) {
        DynamicVariableMapping.Builder builder = DynamicVariableMapping.builder();
        for (String variable : markers.root().keySet()) {
            Config entry = markers.getConfig(ConfigUtil.joinPath(variable));
            CapabilityKind kind = CapabilityKind.fromConfig(entry.getString("kind"));
            String capability;
            if (entry.hasPath("template")) {
                String templateName = entry.getString("template");
                capability = templates.get(templateName);
                if (capability == null) {
                    throw new IllegalArgumentException(
                            "Marker '" + variable + "' refers to unknown template '" + templateName + "'");
                }
            } else {
                capability = entry.getString("capability");
            }
            builder.put(variable, new CapabilityDescriptor(kind, CapabilityTemplate.of(capability)));
        }
        return builder.build();
    }

    private static Map<String, String> readStringMap(Config config) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : config.root().keySet()) {
            values.put(key, config.getString(ConfigUtil.joinPath(key)));
        }
        return values;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
