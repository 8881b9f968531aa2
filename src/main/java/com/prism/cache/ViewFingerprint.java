package com.prism.cache;

import com.prism.catalog.LogTypeCatalog;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Content hash identifying an unordered set of cache columns.
 *
 * Names are sorted and the time-partition columns removed before hashing, so
 * request order and the presence of {@code date}/{@code hour} never change the
 * value. Digest is SHA-256 over the names, each followed by a zero byte, encoded
 * as base64.
 */
public final class ViewFingerprint {

    private final String value;
    private final List<String> columns;

    private ViewFingerprint(String value, List<String> columns) {
        this.value = value;
        this.columns = columns;
    }

    public static ViewFingerprint of(Collection<String> cacheColumns) {
        TreeSet<String> sorted = new TreeSet<>(cacheColumns);
        sorted.removeAll(LogTypeCatalog.TIME_PARTITION_COLUMNS);

        MessageDigest digest = sha256();
        for (String column : sorted) {
            digest.update(column.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
        }
        return new ViewFingerprint(Base64.getEncoder().encodeToString(digest.digest()), List.copyOf(sorted));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getValue() {
        return value;
    }

    /**
     * The hashed columns: sorted, without time-partition columns
     */
    public List<String> getColumns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((ViewFingerprint) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
