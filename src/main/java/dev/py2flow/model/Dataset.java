package dev.py2flow.model;

import java.util.List;
import java.util.Objects;

/**
 * A named data container at one point of the pipeline.
 *
 * <p>Datasets are immutable. A role change (for example promoting a dangling
 * intermediate to an output) is done by replacing the dataset in its flow.</p>
 *
 * @param name           unique name within the owning flow
 * @param role           input, intermediate or output
 * @param schema         known fields in order; empty when unknown
 * @param formatHint     storage format hint (csv, parquet, model...), or null
 * @param location       source or destination path, or null
 * @param sourceVariable script variable the dataset was created for, or null
 * @param sourceLine     script line that created the dataset, or null
 */
public record Dataset(
    String name,
    DatasetRole role,
    List<FieldSchema> schema,
    String formatHint,
    String location,
    String sourceVariable,
    Integer sourceLine
) {

    public Dataset {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Dataset name must not be blank");
        }
        schema = schema == null ? List.of() : List.copyOf(schema);
    }

    public static Dataset of(String name, DatasetRole role) {
        return new Dataset(name, role, List.of(), null, null, null, null);
    }

    public boolean hasSchema() {
        return !schema.isEmpty();
    }

    public boolean hasField(String field) {
        return schema.stream().anyMatch(f -> f.name().equals(field));
    }

    public List<String> fieldNames() {
        return schema.stream().map(FieldSchema::name).toList();
    }

    public Dataset withRole(DatasetRole newRole) {
        return new Dataset(name, newRole, schema, formatHint, location, sourceVariable, sourceLine);
    }

    public Dataset withSchema(List<FieldSchema> newSchema) {
        return new Dataset(name, role, newSchema, formatHint, location, sourceVariable, sourceLine);
    }
}
