package dev.py2flow.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.py2flow.config.Py2FlowConfig;
import dev.py2flow.engine.FlowOptimizer;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes a flow as a Dataiku DSS project bundle.
 *
 * <p>Layout of {@code <destination>/<PROJECT_KEY>/}: {@code project.json},
 * {@code params.json}, {@code datasets/*.json}, {@code recipes/*.json},
 * {@code flow/zones.json}, {@code manifest.json} and {@code README.md}.</p>
 *
 * <p>An export either completes or leaves nothing behind: every file and
 * directory it created is deleted before the failure is reported. An
 * existing project directory or zip is never overwritten.</p>
 */
public final class DssExporter {

    private static final Logger LOG = LoggerFactory.getLogger(DssExporter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Py2FlowConfig config;
    private final BundleFileWriter writer;
    private final Clock clock;

    public DssExporter(Py2FlowConfig config) {
        this(config, BundleFileWriter.FILES, Clock.systemUTC());
    }

    public DssExporter(Py2FlowConfig config, BundleFileWriter writer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Export the flow under {@code destination}.
     *
     * @param createZip archive the project to {@code <PROJECT_KEY>.zip} and remove the directory
     * @return the project directory, or the zip when {@code createZip} is set
     * @throws dev.py2flow.engine.CycleDetectedException if the flow has a cycle; nothing is written
     * @throws BundleExportException if writing fails or the target already exists
     */
    public Path export(Flow flow, Path destination, boolean createZip) {
        Objects.requireNonNull(flow, "flow");
        Objects.requireNonNull(destination, "destination");
        Flow toExport = flow;
        if (config.optimize()) {
            toExport = FlowOptimizer.optimize(flow, config.effectiveOptimizationLevel()).flow();
        }
        List<Recipe> buildOrder = toExport.graph().topologicalSort();

        String key = config.normalizedProjectKey();
        Path projectDir = destination.resolve(key);
        Path zip = destination.resolve(key + ".zip");
        if (Files.exists(projectDir)) {
            throw new BundleExportException("project directory already exists: " + projectDir, destination);
        }
        if (createZip && Files.exists(zip)) {
            throw new BundleExportException("bundle already exists: " + zip, destination);
        }

        requireInside(destination, projectDir, toExport);

        Deque<Path> created = new ArrayDeque<>();
        try {
            createDirectories(projectDir, created);
            writeProject(toExport, buildOrder, projectDir, key, created);
            if (!createZip) {
                LOG.info("Exported flow '{}' to {}", toExport.name(), projectDir);
                return projectDir;
            }
            created.push(zip);
            zip(projectDir, zip);
            deleteTree(projectDir);
            LOG.info("Exported flow '{}' to {}", toExport.name(), zip);
            return zip;
        } catch (IOException | RuntimeException e) {
            rollback(created, e);
            throw new BundleExportException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                destination, e);
        }
    }

    private void writeProject(Flow flow, List<Recipe> buildOrder, Path projectDir, String key,
                              Deque<Path> created) throws IOException {
        Instant now = clock.instant();
        var documents = new DssDocuments(MAPPER, key, config.defaultConnection(), now.toEpochMilli());
        Path datasets = projectDir.resolve("datasets");
        Path recipes = projectDir.resolve("recipes");
        Path flowDir = projectDir.resolve("flow");
        createDirectories(datasets, created);
        createDirectories(recipes, created);
        createDirectories(flowDir, created);

        write(projectDir.resolve("project.json"), documents.project(flow), created);
        write(projectDir.resolve("params.json"), documents.params(), created);
        for (Dataset dataset : flow.datasets()) {
            write(entry(projectDir, datasets, dataset.name()), documents.dataset(dataset), created);
        }
        for (Recipe recipe : flow.recipes()) {
            write(entry(projectDir, recipes, recipe.name()), documents.recipe(recipe), created);
        }
        write(flowDir.resolve("zones.json"), documents.zones(flow), created);
        write(projectDir.resolve("manifest.json"), documents.manifest(flow, buildOrder), created);
        Path readme = projectDir.resolve("README.md");
        created.push(readme);
        writer.write(readme, documents.readme(flow, now.toString()));
    }

    /** Fails before anything is created when a dataset or recipe name would leave the project directory. */
    private static void requireInside(Path destination, Path projectDir, Flow flow) {
        Path datasets = projectDir.resolve("datasets");
        Path recipes = projectDir.resolve("recipes");
        try {
            for (Dataset dataset : flow.datasets()) {
                entry(projectDir, datasets, dataset.name());
            }
            for (Recipe recipe : flow.recipes()) {
                entry(projectDir, recipes, recipe.name());
            }
        } catch (IOException e) {
            throw new BundleExportException(e.getMessage(), destination, e);
        }
    }

    private static Path entry(Path projectDir, Path dir, String name) throws IOException {
        Path file = dir.resolve(name + ".json").toAbsolutePath().normalize();
        Path parent = file.getParent();
        if (parent == null || !parent.equals(dir.toAbsolutePath().normalize())
            || !file.startsWith(projectDir.toAbsolutePath().normalize())) {
            throw new IOException("name '%s' resolves outside %s".formatted(name, dir));
        }
        return file;
    }

    private void write(Path file, JsonNode document, Deque<Path> created) throws IOException {
        String content;
        try {
            content = MAPPER.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new IOException("Cannot serialize " + file.getFileName(), e);
        }
        created.push(file);
        writer.write(file, content);
    }

    /** Create a directory and any missing parents, remembering the ones this export made. */
    private static void createDirectories(Path dir, Deque<Path> created) throws IOException {
        List<Path> missing = new ArrayList<>();
        for (Path p = dir.toAbsolutePath(); p != null && !Files.exists(p); p = p.getParent()) {
            missing.add(0, p);
        }
        for (Path p : missing) {
            Files.createDirectory(p);
            created.push(p);
        }
    }

    private static void zip(Path projectDir, Path zip) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(projectDir)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        }
        try (OutputStream out = Files.newOutputStream(zip); var zipOut = new ZipOutputStream(out)) {
            for (Path file : files) {
                String entry = projectDir.relativize(file).toString().replace('\\', '/');
                zipOut.putNextEntry(new ZipEntry(entry));
                Files.copy(file, zipOut);
                zipOut.closeEntry();
            }
        }
    }

    private static void deleteTree(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.delete(path);
        }
    }

    private static void rollback(Deque<Path> created, Exception failure) {
        LOG.warn("Export failed, removing {} created path(s): {}", created.size(), failure.toString());
        while (!created.isEmpty()) {
            Path path = created.pop();
            try {
                if (Files.isDirectory(path)) {
                    deleteTree(path);
                } else {
                    Files.deleteIfExists(path);
                }
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
