package it.unimib.datai.fnship.deployer.packaging;

import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.common.model.FunctionConfiguration;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs a single source file into an in-memory zip archive.
 * The archive holds one entry named {@code index} plus the runtime's file extension,
 * stamped with a fixed time so identical sources produce identical bytes.
 */
public final class CodePackager {
    static final String ENTRY_BASE_NAME = "index";
    static final LocalDateTime FIXED_ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0);

    private final String entryName;

    private CodePackager(String entryName) {
        this.entryName = entryName;
    }

    public static CodePackager forRuntime(String runtime) {
        return new CodePackager(ENTRY_BASE_NAME + extensionFor(runtime));
    }

    public String entryName() {
        return entryName;
    }

    public byte[] pack(String sourceText) {
        if (sourceText == null || sourceText.isBlank()) {
            throw new InvalidInputException("Function code must not be empty");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes, StandardCharsets.UTF_8)) {
            ZipEntry entry = new ZipEntry(entryName);
            entry.setTimeLocal(FIXED_ENTRY_TIME);
            zip.putNextEntry(entry);
            zip.write(sourceText.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to package function code", e);
        }
        return bytes.toByteArray();
    }

    public FunctionArtifact artifact(String sourceText, FunctionConfiguration configuration) {
        return new FunctionArtifact(entryName, pack(sourceText), configuration);
    }

    static String extensionFor(String runtime) {
        if (runtime == null) {
            return ".js";
        }
        String r = runtime.toLowerCase(Locale.ROOT);
        if (r.startsWith("python")) {
            return ".py";
        }
        if (r.startsWith("ruby")) {
            return ".rb";
        }
        return ".js";
    }
}
