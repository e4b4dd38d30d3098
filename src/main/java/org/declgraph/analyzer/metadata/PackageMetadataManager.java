package org.declgraph.analyzer.metadata;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.declgraph.analyzer.AnalysisException;
import org.declgraph.config.AnalyzerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up documentation metadata support on the file system.
 * <p>
 * For a given file, the nearest enclosing folder with a {@code package.json} is the package
 * folder. The metadata file is located, in order of preference:
 * <ol>
 *   <li>at the path named by the configured {@code package.json} field, relative to the package folder</li>
 *   <li>next to the {@code types} (or {@code typings}) entry point</li>
 *   <li>in the package folder itself</li>
 * </ol>
 * The package supports documentation metadata iff that file exists.
 * <p>
 * Lookups are cached per directory, including negative results. Not thread-safe.
 */
public class PackageMetadataManager implements PackageMetadataProvider {

    private static final Logger LOG = LoggerFactory.getLogger(PackageMetadataManager.class);

    private static final String PACKAGE_JSON = "package.json";

    private final String packageJsonField;
    private final String metadataFileName;

    /** Directory to its package folder; empty if no package.json encloses it. */
    private final Map<Path, Optional<Path>> packageFoldersByDirectory = new HashMap<>();
    private final Map<Path, Boolean> supportByPackageFolder = new HashMap<>();

    /**
     * @param settings supplies the {@code package.json} field and the metadata file name.
     */
    public PackageMetadataManager(AnalyzerSettings settings) {
        this.packageJsonField = settings.packageJsonField();
        this.metadataFileName = settings.metadataFileName();
    }

    @Override
    public boolean supportsDocumentationMetadata(String fileName) {
        Path directory = Path.of(fileName).toAbsolutePath().normalize().getParent();
        if (directory == null) {
            return false;
        }

        Optional<Path> packageFolder = findPackageFolder(directory);
        if (packageFolder.isEmpty()) {
            LOG.debug("No {} encloses {}", PACKAGE_JSON, fileName);
            return false;
        }
        return supportByPackageFolder.computeIfAbsent(packageFolder.get(), this::hasMetadataFile);
    }

    /**
     * Resolves where the metadata file of the package in {@code packageFolder} should be.
     *
     * @param packageFolder a folder containing a {@code package.json}.
     * @return the expected metadata file path (which may not exist).
     * @throws AnalysisException     if the {@code package.json} is not a JSON object.
     * @throws UncheckedIOException  if the {@code package.json} cannot be read.
     */
    public Path resolveMetadataPath(Path packageFolder) {
        JsonObject packageJson = readPackageJson(packageFolder.resolve(PACKAGE_JSON));

        String explicitPath = stringField(packageJson, packageJsonField);
        if (explicitPath != null) {
            return packageFolder.resolve(explicitPath).normalize();
        }

        String typesPath = stringField(packageJson, "types");
        if (typesPath == null) {
            typesPath = stringField(packageJson, "typings");
        }
        if (typesPath != null) {
            Path typesFolder = packageFolder.resolve(typesPath).normalize().getParent();
            if (typesFolder != null) {
                return typesFolder.resolve(metadataFileName);
            }
        }
        return packageFolder.resolve(metadataFileName);
    }

    private boolean hasMetadataFile(Path packageFolder) {
        Path metadataPath = resolveMetadataPath(packageFolder);
        boolean supported = Files.isRegularFile(metadataPath);
        LOG.debug("Package {} {} documentation metadata ({})", packageFolder,
                supported ? "supports" : "does not support", metadataPath);
        return supported;
    }

    private Optional<Path> findPackageFolder(Path directory) {
        Optional<Path> cached = packageFoldersByDirectory.get(directory);
        if (cached != null) {
            return cached;
        }

        Optional<Path> result;
        if (Files.isRegularFile(directory.resolve(PACKAGE_JSON))) {
            result = Optional.of(directory);
        } else {
            Path parent = directory.getParent();
            result = parent != null ? findPackageFolder(parent) : Optional.empty();
        }
        packageFoldersByDirectory.put(directory, result);
        return result;
    }

    private static JsonObject readPackageJson(Path packageJsonPath) {
        String content;
        try {
            content = Files.readString(packageJsonPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + packageJsonPath, e);
        }

        try {
            JsonElement parsed = JsonParser.parseString(content);
            if (!parsed.isJsonObject()) {
                throw new AnalysisException("Expected a JSON object in " + packageJsonPath);
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new AnalysisException("Malformed " + packageJsonPath + ": " + e.getMessage(), e);
        }
    }

    private static String stringField(JsonObject json, String name) {
        JsonElement element = json.get(name);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }
        String value = element.getAsString();
        return value.isBlank() ? null : value;
    }
}
