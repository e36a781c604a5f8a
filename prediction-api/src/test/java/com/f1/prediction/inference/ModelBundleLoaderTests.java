package com.f1.prediction.inference;

import com.f1.prediction.feature.CategoricalEncoder;
import com.f1.prediction.validation.ForbiddenFeatures;
import com.f1.prediction.validation.LeakageException;
import com.f1.prediction.validation.LeakageValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelBundleLoaderTests {

    @TempDir
    Path baseDir;

    ObjectMapper mapper;
    ModelBundleLoader loader;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        loader = new ModelBundleLoader(mapper, new LeakageValidator(ForbiddenFeatures.DEFAULT),
                CategoricalEncoder.SCHEME);
    }

    private Map<String, Object> bundle(ModelRole role, String version, List<String> features, double[] coefficients) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("type", "linear");
        model.put("link", role == ModelRole.WIN_CLASSIFIER ? "logistic" : "identity");
        model.put("intercept", 0.25);
        model.put("coefficients", coefficients);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("role", role.name().toLowerCase());
        content.put("version", version);
        content.put("encodingScheme", CategoricalEncoder.SCHEME);
        content.put("features", features);
        content.put("metrics", Map.of("rmse", 3.1));
        content.put("model", model);
        content.put("trainedBy", "pipeline-export");
        return content;
    }

    private Path writeVersion(String version) throws IOException {
        Path dir = Files.createDirectories(baseDir.resolve(version));
        for (ModelRole role : ModelRole.values()) {
            write(dir, role, bundle(role, version, List.of("grid_position", "win_rate"), new double[]{-0.5, 2.0}));
        }
        return dir;
    }

    private void write(Path dir, ModelRole role, Map<String, Object> content) throws IOException {
        mapper.writeValue(dir.resolve(role.getFileName()).toFile(), content);
    }

    @Test
    void loadsAllThreeBundles_fromExplicitVersion() throws IOException {
        writeVersion("1.2.0");

        ModelBundleSet set = loader.load(baseDir, "1.2.0");

        assertEquals("1.2.0", set.getVersion());
        assertEquals(3, set.all().size());
        ModelBundle win = set.get(ModelRole.WIN_CLASSIFIER);
        assertEquals(List.of("grid_position", "win_rate"), win.getSchema().getFeatureNames());
        assertEquals(CategoricalEncoder.SCHEME, win.getSchema().getEncodingScheme());
        assertEquals(Map.of("rmse", 3.1), win.getMetadata().trainingMetrics());
        double p = win.getModel().predict(new double[]{1.0, 0.5});
        assertEquals(1.0 / (1.0 + Math.exp(-0.75)), p, 1e-12);
    }

    @Test
    void currentPointerFile_resolvesToNamedVersion() throws IOException {
        writeVersion("1.0.0");
        writeVersion("1.1.0");
        Files.writeString(baseDir.resolve(ModelBundleLoader.CURRENT), "1.1.0\n");

        ModelBundleSet set = loader.load(baseDir, "current");

        assertEquals("1.1.0", set.getVersion());
        assertEquals(List.of("1.0.0", "1.1.0"), loader.listVersions(baseDir));
    }

    @Test
    void missingBundle_failsTheWholeLoad() throws IOException {
        Path dir = writeVersion("2.0.0");
        Files.delete(dir.resolve(ModelRole.POINTS_REGRESSOR.getFileName()));

        ModelBundleLoadException e = assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "2.0.0"));
        assertTrue(e.getMessage().contains("POINTS_REGRESSOR"));
    }

    @Test
    void missingVersionDirectory_fails() {
        assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "9.9.9"));
        assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir.resolve("absent"), "current"));
    }

    @Test
    void coefficientCountMismatch_fails() throws IOException {
        Path dir = writeVersion("1.3.0");
        write(dir, ModelRole.POSITION_REGRESSOR,
                bundle(ModelRole.POSITION_REGRESSOR, "1.3.0", List.of("grid_position", "win_rate"), new double[]{1.0}));

        assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "1.3.0"));
    }

    @Test
    void otherEncodingScheme_isRefused() throws IOException {
        Path dir = writeVersion("1.4.0");
        Map<String, Object> content = bundle(ModelRole.WIN_CLASSIFIER, "1.4.0", List.of("grid_position"), new double[]{1.0});
        content.put("encodingScheme", "python-hash/v0");
        write(dir, ModelRole.WIN_CLASSIFIER, content);

        ModelBundleLoadException e = assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "1.4.0"));
        assertTrue(e.getMessage().contains("python-hash/v0"));
    }

    @Test
    void leakingSchema_isRejected() throws IOException {
        Path dir = writeVersion("1.5.0");
        write(dir, ModelRole.POINTS_REGRESSOR, bundle(ModelRole.POINTS_REGRESSOR, "1.5.0",
                List.of("grid_position", "points"), new double[]{1.0, 1.0}));

        LeakageException e = assertThrows(LeakageException.class, () -> loader.load(baseDir, "1.5.0"));
        assertTrue(e.getLeakedFeatures().contains("points"));
    }

    @Test
    void malformedJson_isALoadFailure() throws IOException {
        Path dir = writeVersion("1.6.0");
        Files.writeString(dir.resolve(ModelRole.WIN_CLASSIFIER.getFileName()), "{ not json");

        assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "1.6.0"));
    }

    @Test
    void wrongRoleInFile_isRejected() throws IOException {
        Path dir = writeVersion("1.7.0");
        write(dir, ModelRole.WIN_CLASSIFIER, bundle(ModelRole.POINTS_REGRESSOR, "1.7.0",
                List.of("grid_position"), new double[]{1.0}));

        assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "1.7.0"));
    }

    @Test
    void nullFeatureName_isALoadFailure() throws IOException {
        Path dir = writeVersion("1.8.0");
        for (ModelRole role : ModelRole.values()) {
            write(dir, role, bundle(role, "1.8.0", Arrays.asList("grid_position", null), new double[]{1.0, 1.0}));
        }

        ModelBundleLoadException e = assertThrows(ModelBundleLoadException.class, () -> loader.load(baseDir, "1.8.0"));
        assertTrue(e.getMessage().contains("null or blank feature name"));
    }

    @Test
    void versionOutsideBaseDirectory_isRefused() throws IOException {
        Path models = Files.createDirectories(baseDir.resolve("models"));
        writeVersion("elsewhere");

        assertThrows(ModelBundleLoadException.class, () -> loader.load(models, "../elsewhere"));
        assertThrows(ModelBundleLoadException.class, () -> loader.load(models, ".."));

        Files.writeString(models.resolve(ModelBundleLoader.CURRENT), "../elsewhere");
        assertThrows(ModelBundleLoadException.class, () -> loader.load(models, "current"));
    }
}
