package com.f1.prediction.inference;

import com.f1.prediction.validation.LeakageValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads model bundles from a versioned directory tree:
 * <pre>
 * base-dir/
 *   1.2.0/win_classifier.json
 *   1.2.0/position_regressor.json
 *   1.2.0/points_regressor.json
 *   current            (directory link, or a text file holding "1.2.0")
 * </pre>
 * All three bundles load or the whole load fails.
 */
public class ModelBundleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelBundleLoader.class);

    public static final String CURRENT = "current";
    public static final String LINEAR_TYPE = "linear";

    private final ObjectMapper objectMapper;
    private final LeakageValidator leakageValidator;
    private final String expectedEncodingScheme;

    public ModelBundleLoader(ObjectMapper objectMapper, LeakageValidator leakageValidator,
                             String expectedEncodingScheme) {
        this.objectMapper = objectMapper;
        this.leakageValidator = leakageValidator;
        this.expectedEncodingScheme = expectedEncodingScheme;
    }

    /**
     * @param version a version directory name under {@code baseDir}, or {@code "current"}
     * @throws ModelBundleLoadException if any bundle is missing, unreadable or inconsistent, or the
     *                                  version resolves outside {@code baseDir}
     * @throws com.f1.prediction.validation.LeakageException if a schema contains outcome fields
     */
    public ModelBundleSet load(Path baseDir, String version) {
        Path versionDir = resolveVersionDirectory(baseDir, version);
        String resolvedVersion = versionDir.getFileName().toString();
        log.info("Loading model bundles {} from {}", resolvedVersion, versionDir);

        List<ModelBundle> bundles = new ArrayList<>();
        for (ModelRole role : ModelRole.values()) {
            bundles.add(loadBundle(versionDir.resolve(role.getFileName()), role, resolvedVersion));
        }

        ModelBundleSet set = ModelBundleSet.of(resolvedVersion, bundles);
        log.info("Loaded {} model bundles, version {}", bundles.size(), resolvedVersion);
        return set;
    }

    /**
     * Version directory names under the base directory, sorted; the current pointer is excluded.
     */
    public List<String> listVersions(Path baseDir) {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(baseDir)) {
            return children
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !CURRENT.equals(name))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ModelBundleLoadException("Cannot list model versions in " + baseDir, e);
        }
    }

    Path resolveVersionDirectory(Path baseDir, String version) {
        if (baseDir == null || !Files.isDirectory(baseDir)) {
            throw new ModelBundleLoadException("Model directory not found: " + baseDir);
        }
        String requested = version == null || version.isBlank() ? CURRENT : version.trim();

        Path candidate = baseDir.resolve(requested);
        if (CURRENT.equals(requested) && Files.isRegularFile(candidate)) {
            // Pointer file naming the version directory
            try {
                String target = Files.readString(candidate, StandardCharsets.UTF_8).trim();
                if (target.isEmpty()) {
                    throw new ModelBundleLoadException("Current version pointer is empty: " + candidate);
                }
                candidate = baseDir.resolve(target);
            } catch (IOException e) {
                throw new ModelBundleLoadException("Cannot read current version pointer " + candidate, e);
            }
        }

        if (!Files.isDirectory(candidate)) {
            throw new ModelBundleLoadException("Model version directory not found: " + candidate);
        }
        Path resolved;
        Path root;
        try {
            // Follows a "current" directory link to the real version name
            resolved = candidate.toRealPath();
            root = baseDir.toRealPath();
        } catch (IOException e) {
            throw new ModelBundleLoadException("Cannot resolve model version directory " + candidate, e);
        }
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new ModelBundleLoadException("Model version " + requested + " resolves outside " + root);
        }
        return resolved;
    }

    private ModelBundle loadBundle(Path file, ModelRole role, String directoryVersion) {
        if (!Files.isRegularFile(file)) {
            throw new ModelBundleLoadException(role + " bundle not found: " + file);
        }

        ModelBundleFile content;
        try {
            content = objectMapper.readValue(file.toFile(), ModelBundleFile.class);
        } catch (IOException e) {
            throw new ModelBundleLoadException("Malformed " + role + " bundle " + file + ": " + e.getMessage(), e);
        }

        if (content.role() != null && content.role() != role) {
            throw new ModelBundleLoadException(file + " declares role " + content.role() + ", expected " + role);
        }

        List<String> features = content.features();
        if (features == null || features.isEmpty()) {
            throw new ModelBundleLoadException(role + " bundle has no feature list: " + file);
        }
        if (features.stream().anyMatch(name -> name == null || name.isBlank())) {
            throw new ModelBundleLoadException(role + " bundle lists a null or blank feature name: " + file);
        }
        if (new HashSet<>(features).size() != features.size()) {
            throw new ModelBundleLoadException(role + " bundle lists duplicate features: " + file);
        }

        String scheme = content.encodingScheme() != null ? content.encodingScheme() : expectedEncodingScheme;
        if (!expectedEncodingScheme.equals(scheme)) {
            throw new ModelBundleLoadException(role + " bundle was trained with encoding " + scheme
                    + " but this build encodes with " + expectedEncodingScheme);
        }

        leakageValidator.validate(features);

        RaceModel model = buildModel(content.model(), features.size(), role);
        String version = content.version() != null ? content.version() : directoryVersion;
        if (!version.equals(directoryVersion)) {
            log.warn("{} bundle declares version {} but lives in directory {}", role, version, directoryVersion);
        }

        log.info("Loaded {} bundle: {} features, version {}", role, features.size(), version);
        return new ModelBundle(role, model, new FeatureSchema(features, scheme),
                new ModelMetadata(version, content.metrics()));
    }

    private RaceModel buildModel(ModelBundleFile.ModelSpec spec, int featureCount, ModelRole role) {
        if (spec == null) {
            throw new ModelBundleLoadException(role + " bundle has no model section");
        }
        if (spec.type() != null && !LINEAR_TYPE.equalsIgnoreCase(spec.type())) {
            throw new ModelBundleLoadException("Unsupported model type for " + role + ": " + spec.type());
        }
        if (spec.coefficients() == null || spec.coefficients().length != featureCount) {
            int actual = spec.coefficients() == null ? 0 : spec.coefficients().length;
            throw new ModelBundleLoadException(role + " bundle has " + actual
                    + " coefficients for " + featureCount + " features");
        }
        try {
            return new LinearRaceModel(spec.intercept() != null ? spec.intercept() : 0.0,
                    spec.coefficients(), spec.link());
        } catch (IllegalArgumentException e) {
            throw new ModelBundleLoadException("Invalid " + role + " model: " + e.getMessage(), e);
        }
    }
}
