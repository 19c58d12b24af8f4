/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import java.util.Locale;

/**
 * A DICOM data element tag: (group, element), both unsigned 16-bit.
 */
public final class Tag implements Comparable<Tag> {

    public static final Tag TRANSFER_SYNTAX_UID = new Tag(0x0002, 0x0010);
    public static final Tag SOP_CLASS_UID = new Tag(0x0008, 0x0016);
    public static final Tag SOP_INSTANCE_UID = new Tag(0x0008, 0x0018);
    public static final Tag STUDY_DATE = new Tag(0x0008, 0x0020);
    public static final Tag SERIES_DATE = new Tag(0x0008, 0x0021);
    public static final Tag STUDY_TIME = new Tag(0x0008, 0x0030);
    public static final Tag SERIES_TIME = new Tag(0x0008, 0x0031);
    public static final Tag ACCESSION_NUMBER = new Tag(0x0008, 0x0050);
    public static final Tag MODALITY = new Tag(0x0008, 0x0060);
    public static final Tag STUDY_DESCRIPTION = new Tag(0x0008, 0x1030);
    public static final Tag SERIES_DESCRIPTION = new Tag(0x0008, 0x103E);
    public static final Tag PATIENT_NAME = new Tag(0x0010, 0x0010);
    public static final Tag PATIENT_ID = new Tag(0x0010, 0x0020);
    public static final Tag PATIENT_BIRTH_DATE = new Tag(0x0010, 0x0030);
    public static final Tag PATIENT_SEX = new Tag(0x0010, 0x0040);
    public static final Tag BODY_PART_EXAMINED = new Tag(0x0018, 0x0015);
    public static final Tag STUDY_INSTANCE_UID = new Tag(0x0020, 0x000D);
    public static final Tag SERIES_INSTANCE_UID = new Tag(0x0020, 0x000E);
    public static final Tag STUDY_ID = new Tag(0x0020, 0x0010);
    public static final Tag SERIES_NUMBER = new Tag(0x0020, 0x0011);
    public static final Tag INSTANCE_NUMBER = new Tag(0x0020, 0x0013);
    public static final Tag NUMBER_OF_STUDY_RELATED_INSTANCES = new Tag(0x0020, 0x1208);
    public static final Tag NUMBER_OF_SERIES_RELATED_INSTANCES = new Tag(0x0020, 0x1209);
    public static final Tag NUMBER_OF_FRAMES = new Tag(0x0028, 0x0008);
    public static final Tag ROWS = new Tag(0x0028, 0x0010);
    public static final Tag COLUMNS = new Tag(0x0028, 0x0011);
    public static final Tag BITS_ALLOCATED = new Tag(0x0028, 0x0100);
    public static final Tag BITS_STORED = new Tag(0x0028, 0x0101);
    public static final Tag PIXEL_DATA = new Tag(0x7FE0, 0x0010);

    private final int group;
    private final int element;

    public Tag(int group, int element) {
        if (group < 0 || group > 0xFFFF || element < 0 || element > 0xFFFF) {
            throw new IllegalArgumentException(
                    String.format("Tag components must be 16-bit unsigned: group=%d element=%d", group, element));
        }
        this.group = group;
        this.element = element;
    }

    /**
     * Parse a tag from {@code 0010,0010}, {@code (0010,0010)} or {@code 00100010}.
     * Hex digits are accepted in either case.
     */
    public static Tag parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Tag text is null");
        }
        String hex = text.trim()
                .replace("(", "")
                .replace(")", "")
                .replace(",", "")
                .toUpperCase(Locale.ROOT);
        if (!hex.matches("[0-9A-F]{8}")) {
            throw new IllegalArgumentException("Invalid DICOM tag: " + text);
        }
        return new Tag(Integer.parseInt(hex.substring(0, 4), 16), Integer.parseInt(hex.substring(4), 16));
    }

    public int getGroup() { return group; }
    public int getElement() { return element; }

    /**
     * Packed 32-bit form (group in the high word).
     */
    public int toInt() {
        return (group << 16) | element;
    }

    @Override
    public int compareTo(Tag other) {
        return Integer.compareUnsigned(toInt(), other.toInt());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tag)) return false;
        Tag other = (Tag) o;
        return group == other.group && element == other.element;
    }

    @Override
    public int hashCode() {
        return toInt();
    }

    @Override
    public String toString() {
        return String.format("(%04X,%04X)", group, element);
    }
}
