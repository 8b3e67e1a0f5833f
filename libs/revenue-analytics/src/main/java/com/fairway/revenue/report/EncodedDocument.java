package com.fairway.revenue.report;

import java.util.Arrays;

/**
 * Bytes produced by a report or export encoder.
 */
public record EncodedDocument(String contentType, String fileName, byte[] content) {

    public EncodedDocument {
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncodedDocument other)) {
            return false;
        }
        return contentType.equals(other.contentType) && fileName.equals(other.fileName)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * contentType.hashCode() + fileName.hashCode()) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "EncodedDocument[contentType=" + contentType + ", fileName=" + fileName
                + ", size=" + content.length + "]";
    }
}
