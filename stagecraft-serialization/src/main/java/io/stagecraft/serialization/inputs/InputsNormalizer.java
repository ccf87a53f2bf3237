package io.stagecraft.serialization.inputs;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/// Normalisation and validation helpers shared by all typed step inputs.
public final class InputsNormalizer {

    private static final Pattern LOWER_HEX_64 = Pattern.compile("^[0-9a-f]{64}$");

    private InputsNormalizer() {}

    /// Trims surrounding whitespace; null becomes empty.
    public static String trim(String value) {
        return value == null ? "" : value.strip();
    }

    /// Trims every element, keeping order.
    public static List<String> trimAll(List<String> values) {
        List<String> trimmed = new ArrayList<>(values.size());
        for (String value : values) {
            trimmed.add(trim(value));
        }
        return trimmed;
    }

    /// Trims every element, then sorts lexicographically (set-like lists).
    public static List<String> trimAndSort(List<String> values) {
        List<String> sorted = trimAll(values);
        sorted.sort(Comparator.naturalOrder());
        return sorted;
    }

    /// Sorts entries by key. The sort is stable; entries with equal keys keep their order.
    ///
    /// @param values entries, not null
    /// @param key    key extractor, not null
    /// @param <T>    entry type
    /// @return sorted copy, never null
    public static <T> List<T> sortByKey(List<T> values, Function<T, String> key) {
        List<T> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparing(key));
        return sorted;
    }

    /// Normalises a relative path.
    ///
    /// Backslashes become forward slashes, duplicate and trailing slashes collapse, and
    /// `.` alone is allowed. Absolute paths (`/`, `~`, drive letters, URLs) and `.` or
    /// `..` segments are rejected.
    ///
    /// @param path path to normalise, may be null
    /// @return normalised path, never empty
    /// @throws InputsValidationException if the path is empty or not a plain relative path
    public static String normalizePath(String path) throws InputsValidationException {
        String p = trim(path == null ? null : path.replace('\\', '/'));
        if (p.isEmpty()) {
            throw new InputsValidationException("path is empty");
        }
        if (p.startsWith("/") || p.startsWith("~") || p.contains(":/") || p.contains(":\\")) {
            throw new InputsValidationException("path must be relative: \"" + p + "\"");
        }
        if (p.equals(".")) {
            return ".";
        }

        List<String> segments = new ArrayList<>();
        for (String segment : p.split("/")) {
            if (segment.equals(".") || segment.equals("..")) {
                throw new InputsValidationException(
                        "path must not contain '.' or '..' segments: \"" + p + "\"");
            }
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return String.join("/", segments);
    }

    /// Checks that a hash is exactly 64 lower-case hex characters.
    ///
    /// @param hash hash text, may be null
    /// @throws InputsValidationException if the format does not match
    public static void validateSha256Hex64(String hash) throws InputsValidationException {
        if (hash == null || !LOWER_HEX_64.matcher(hash).matches()) {
            throw new InputsValidationException(
                    "sha256 hash must be 64 lowercase hex chars: \"" + hash + "\"");
        }
    }

    /// Computes the lower-case hex SHA-256 digest of some bytes.
    ///
    /// @param data bytes to hash, not null
    /// @return 64-character lower-case hex digest
    public static String sha256HexLower(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// Computes the lower-case hex SHA-256 digest of a UTF-8 string.
    public static String sha256HexLower(String text) {
        return sha256HexLower(text.getBytes(StandardCharsets.UTF_8));
    }

    static void requireNonEmpty(String value, String message) throws InputsValidationException {
        if (value == null || value.isEmpty()) {
            throw new InputsValidationException(message);
        }
    }

    static void requirePositiveIfPresent(Integer value, String field)
            throws InputsValidationException {
        if (value != null && value < 0) {
            throw new InputsValidationException(field + " must be > 0 if present");
        }
    }

    static void requireNoBlankEntries(List<String> values, String field)
            throws InputsValidationException {
        for (String value : values) {
            if (trim(value).isEmpty()) {
                throw new InputsValidationException(field + " contains empty value");
            }
        }
    }

    static void validateExpectedHash(String alg, String hash) throws InputsValidationException {
        if (alg.isEmpty() && hash.isEmpty()) {
            return;
        }
        if (!"sha256".equals(alg)) {
            throw new InputsValidationException("expected_compose_hash_alg must be 'sha256' in v1");
        }
        try {
            validateSha256Hex64(hash);
        } catch (InputsValidationException e) {
            throw InputsValidationException.forField("expected_compose_hash", e);
        }
    }

    static String normalizePath(String path, String field) throws InputsValidationException {
        try {
            return normalizePath(path);
        } catch (InputsValidationException e) {
            throw InputsValidationException.forField(field, e);
        }
    }
}
