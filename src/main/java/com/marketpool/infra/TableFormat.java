package com.marketpool.infra;

/**
 * Serialization of a {@link Table} before encryption. The format is carried in
 * the artifact file name: {@code <name>.<format>.encrypted}.
 */
public enum TableFormat {
    PARQUET("parquet"),
    CSV("csv");

    private final String extension;

    TableFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public String encryptedFileName(String baseName) {
        return baseName + "." + extension + ".encrypted";
    }

    public static TableFormat fromExtension(String value) {
        for (TableFormat format : values()) {
            if (format.extension.equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported table format: " + value);
    }
}
