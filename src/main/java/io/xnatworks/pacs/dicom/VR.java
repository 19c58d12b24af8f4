/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DICOM value representations for explicit VR little endian.
 *
 * Each code carries the size of its length field and the strategy used to decode
 * its value bytes. Decoding dispatches once per element on {@link Strategy}.
 */
public enum VR {
    AE("Application Entity", false, Strategy.TEXT),
    AS("Age String", false, Strategy.TEXT),
    AT("Attribute Tag", false, Strategy.ATTRIBUTE_TAG),
    CS("Code String", false, Strategy.TEXT),
    DA("Date", false, Strategy.DATE),
    DS("Decimal String", false, Strategy.TEXT),
    DT("Date Time", false, Strategy.TEXT),
    FL("Floating Point Single", false, Strategy.FLOAT),
    FD("Floating Point Double", false, Strategy.FLOAT),
    IS("Integer String", false, Strategy.TEXT),
    LO("Long String", false, Strategy.TEXT),
    LT("Long Text", false, Strategy.TEXT),
    OB("Other Byte String", true, Strategy.BINARY),
    OD("Other Double String", true, Strategy.BINARY),
    OF("Other Float String", true, Strategy.BINARY),
    OL("Other Long String", true, Strategy.BINARY),
    OW("Other Word String", true, Strategy.BINARY),
    PN("Person Name", false, Strategy.PERSON_NAME),
    SH("Short String", false, Strategy.TEXT),
    SL("Signed Long", false, Strategy.SIGNED),
    SQ("Sequence of Items", true, Strategy.BINARY),
    SS("Signed Short", false, Strategy.SIGNED),
    ST("Short Text", false, Strategy.TEXT),
    TM("Time", false, Strategy.TIME),
    UC("Unlimited Characters", true, Strategy.TEXT),
    UI("Unique Identifier", false, Strategy.TEXT),
    UL("Unsigned Long", false, Strategy.UNSIGNED),
    UN("Unknown", true, Strategy.BINARY),
    UR("Universal Resource Identifier", true, Strategy.TEXT),
    US("Unsigned Short", false, Strategy.UNSIGNED),
    UT("Unlimited Text", true, Strategy.TEXT);

    /**
     * How the value bytes of a VR are turned into a {@link DecodedValue}.
     */
    public enum Strategy {
        TEXT,
        PERSON_NAME,
        DATE,
        TIME,
        UNSIGNED,
        SIGNED,
        FLOAT,
        ATTRIBUTE_TAG,
        BINARY
    }

    private static final Map<String, VR> BY_CODE = new HashMap<>();
    static {
        for (VR vr : values()) {
            BY_CODE.put(vr.name(), vr);
        }
    }

    private static final DateTimeFormatter DICOM_DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{8}$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{2})(\\d{2})(\\d{2})(\\.\\d{1,6})?$");

    private final String description;
    private final boolean longForm;
    private final Strategy strategy;

    VR(String description, boolean longForm, Strategy strategy) {
        this.description = description;
        this.longForm = longForm;
        this.strategy = strategy;
    }

    /**
     * Look up a two-character VR code. Returns null for codes that are not recognised.
     */
    public static VR fromCode(String code) {
        return code == null ? null : BY_CODE.get(code);
    }

    public String getDescription() { return description; }
    public Strategy getStrategy() { return strategy; }

    /**
     * True for VRs encoded with two reserved bytes followed by a 4-byte length.
     */
    public boolean isLongForm() {
        return longForm;
    }

    /**
     * Header size in bytes for an explicit VR element of this type.
     */
    public int headerSize() {
        return longForm ? 12 : 8;
    }

    /**
     * Byte width of a fixed-size numeric value, or 0 when the VR is not fixed width.
     */
    public int numericWidth() {
        switch (this) {
            case US:
            case SS:
                return 2;
            case UL:
            case SL:
            case FL:
            case AT:
                return 4;
            case FD:
                return 8;
            default:
                return 0;
        }
    }

    /**
     * Decode {@code length} bytes at {@code offset} of {@code buffer}.
     *
     * @return the decoded value, or null for an empty span
     * @throws DicomParseException if the span does not fit the buffer, a numeric value is too
     *                             short, or a date/time does not follow the DICOM format
     */
    public DecodedValue decode(byte[] buffer, int offset, int length, Tag tag) throws DicomParseException {
        if (offset < 0 || length < 0 || (long) offset + length > buffer.length) {
            throw new DicomParseException(DicomParseException.Reason.TRUNCATED_ELEMENT,
                    String.format("Value of %s (%s) needs %d bytes at offset %d but buffer has %d",
                            tag, name(), length, offset, buffer.length), offset);
        }
        if (length == 0) {
            return null;
        }

        switch (strategy) {
            case TEXT:
                return DecodedValue.text(decodeText(buffer, offset, length));
            case PERSON_NAME:
                return DecodedValue.text(stripPadding(new String(buffer, offset, length, StandardCharsets.UTF_8)));
            case DATE:
                return DecodedValue.date(decodeDate(buffer, offset, length, tag));
            case TIME:
                return DecodedValue.time(decodeTime(buffer, offset, length, tag));
            case UNSIGNED:
                requireWidth(length, offset, tag);
                return DecodedValue.integer(numericWidth() == 2
                        ? Short.toUnsignedLong(littleEndian(buffer, offset, length).getShort())
                        : Integer.toUnsignedLong(littleEndian(buffer, offset, length).getInt()));
            case SIGNED:
                requireWidth(length, offset, tag);
                return DecodedValue.integer(numericWidth() == 2
                        ? littleEndian(buffer, offset, length).getShort()
                        : littleEndian(buffer, offset, length).getInt());
            case FLOAT:
                requireWidth(length, offset, tag);
                return DecodedValue.text(numericWidth() == 4
                        ? Float.toString(littleEndian(buffer, offset, length).getFloat())
                        : Double.toString(littleEndian(buffer, offset, length).getDouble()));
            case ATTRIBUTE_TAG:
                requireWidth(length, offset, tag);
                ByteBuffer bb = littleEndian(buffer, offset, length);
                int group = Short.toUnsignedInt(bb.getShort());
                int element = Short.toUnsignedInt(bb.getShort());
                return DecodedValue.text(new Tag(group, element).toString());
            case BINARY:
                String type = Tag.PIXEL_DATA.equals(tag) ? BinaryReference.TYPE_PIXEL_DATA : BinaryReference.TYPE_BINARY;
                return DecodedValue.binary(new BinaryReference(type, offset, length));
            default:
                throw new IllegalStateException("Unhandled decode strategy: " + strategy);
        }
    }

    private void requireWidth(int length, int offset, Tag tag) throws DicomParseException {
        if (length < numericWidth()) {
            throw new DicomParseException(DicomParseException.Reason.INVALID_NUMERIC_WIDTH,
                    String.format("%s value of %s has %d bytes, expected at least %d",
                            name(), tag, length, numericWidth()), offset);
        }
    }

    private static ByteBuffer littleEndian(byte[] buffer, int offset, int length) {
        return ByteBuffer.wrap(buffer, offset, length).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static String decodeText(byte[] buffer, int offset, int length) {
        return new String(buffer, offset, length, StandardCharsets.UTF_8).replace("\0", "").trim();
    }

    private static String decodeDate(byte[] buffer, int offset, int length, Tag tag) throws DicomParseException {
        String raw = stripPadding(new String(buffer, offset, length, StandardCharsets.US_ASCII));
        if (!DATE_PATTERN.matcher(raw).matches()) {
            throw new DicomParseException(DicomParseException.Reason.INVALID_VALUE_FORMAT,
                    "DA value of " + tag + " is not YYYYMMDD: '" + raw + "'", offset);
        }
        try {
            return LocalDate.parse(raw, DICOM_DATE_FORMAT).toString();
        } catch (DateTimeParseException e) {
            throw new DicomParseException(DicomParseException.Reason.INVALID_VALUE_FORMAT,
                    "DA value of " + tag + " is not a calendar date: '" + raw + "'", offset);
        }
    }

    private static String decodeTime(byte[] buffer, int offset, int length, Tag tag) throws DicomParseException {
        String raw = stripPadding(new String(buffer, offset, length, StandardCharsets.US_ASCII));
        Matcher m = TIME_PATTERN.matcher(raw);
        if (!m.matches()) {
            throw new DicomParseException(DicomParseException.Reason.INVALID_VALUE_FORMAT,
                    "TM value of " + tag + " is not HHMMSS[.FFFFFF]: '" + raw + "'", offset);
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        int seconds = Integer.parseInt(m.group(3));
        if (hours > 23 || minutes > 59 || seconds > 59) {
            throw new DicomParseException(DicomParseException.Reason.INVALID_VALUE_FORMAT,
                    "TM value of " + tag + " is out of range: '" + raw + "'", offset);
        }
        return m.group(1) + ":" + m.group(2) + ":" + m.group(3);
    }

    /**
     * Remove the space/NUL padding DICOM puts around string values, leaving the interior untouched.
     */
    static String stripPadding(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isPad(value.charAt(start))) {
            start++;
        }
        while (end > start && isPad(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isPad(char c) {
        return c == ' ' || c == '\0';
    }
}
