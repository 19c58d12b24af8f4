/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import java.util.Objects;

/**
 * Typed result of decoding one element value.
 *
 * Exactly one of the accessors matching {@link #getKind()} returns a value;
 * the others throw {@link IllegalStateException}.
 */
public final class DecodedValue {

    public enum Kind {
        TEXT,
        /** ISO-8601 date, YYYY-MM-DD. */
        DATE,
        /** HH:MM:SS. */
        TIME,
        INTEGER,
        BINARY
    }

    private final Kind kind;
    private final String text;
    private final long integer;
    private final BinaryReference binary;

    private DecodedValue(Kind kind, String text, long integer, BinaryReference binary) {
        this.kind = kind;
        this.text = text;
        this.integer = integer;
        this.binary = binary;
    }

    public static DecodedValue text(String text) {
        return new DecodedValue(Kind.TEXT, Objects.requireNonNull(text), 0, null);
    }

    public static DecodedValue date(String isoDate) {
        return new DecodedValue(Kind.DATE, Objects.requireNonNull(isoDate), 0, null);
    }

    public static DecodedValue time(String isoTime) {
        return new DecodedValue(Kind.TIME, Objects.requireNonNull(isoTime), 0, null);
    }

    public static DecodedValue integer(long value) {
        return new DecodedValue(Kind.INTEGER, null, value, null);
    }

    public static DecodedValue binary(BinaryReference reference) {
        return new DecodedValue(Kind.BINARY, null, 0, Objects.requireNonNull(reference));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Text for TEXT, DATE and TIME values.
     */
    public String asText() {
        if (text == null) {
            throw new IllegalStateException("Value of kind " + kind + " has no text form");
        }
        return text;
    }

    public long asLong() {
        if (kind != Kind.INTEGER) {
            throw new IllegalStateException("Value of kind " + kind + " is not an integer");
        }
        return integer;
    }

    public BinaryReference asBinary() {
        if (kind != Kind.BINARY) {
            throw new IllegalStateException("Value of kind " + kind + " is not binary");
        }
        return binary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedValue)) return false;
        DecodedValue that = (DecodedValue) o;
        return kind == that.kind && integer == that.integer
                && Objects.equals(text, that.text) && Objects.equals(binary, that.binary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, integer, binary);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INTEGER:
                return Long.toString(integer);
            case BINARY:
                return binary.toString();
            default:
                return text;
        }
    }
}
