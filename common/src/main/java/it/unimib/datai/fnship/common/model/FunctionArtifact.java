package it.unimib.datai.fnship.common.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Packaged function code ready for upload. Built for a single create or update call.
 */
public record FunctionArtifact(
        String entryName,
        byte[] archive,
        FunctionConfiguration configuration
) {
    public FunctionArtifact {
        Objects.requireNonNull(entryName, "entryName");
        Objects.requireNonNull(archive, "archive");
    }

    public int size() {
        return archive.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionArtifact other)) {
            return false;
        }
        return entryName.equals(other.entryName)
                && Arrays.equals(archive, other.archive)
                && Objects.equals(configuration, other.configuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryName, Arrays.hashCode(archive), configuration);
    }

    @Override
    public String toString() {
        return "FunctionArtifact[entryName=" + entryName + ", size=" + archive.length
                + ", configuration=" + configuration + "]";
    }
}
