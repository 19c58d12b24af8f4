/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks the flat sequence of data elements in a Part-10-like buffer.
 *
 * Each call to {@link #iterator()} starts a fresh pass from the start offset, so a walker can be
 * re-run, and a new walker can resume from any element's {@link DataElement#getNextOffset()}.
 * Iteration ends at the end of the buffer or at the first element whose header or value does not
 * fit; elements already returned stay valid. Value decode failures are attached to the element and
 * do not end the walk.
 */
public class ElementWalker implements Iterable<DataElement> {
    private static final Logger log = LoggerFactory.getLogger(ElementWalker.class);

    public static final int PREAMBLE_LENGTH = 128;
    public static final int DATASET_OFFSET = 132;
    private static final byte[] MAGIC = {'D', 'I', 'C', 'M'};
    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    /**
     * Why the most recent pass stopped.
     */
    public enum Termination {
        /** The pass has not finished yet. */
        NONE,
        /** Fewer bytes remain than an element header needs. */
        END_OF_BUFFER,
        /** A header or value ran past the end of the buffer. */
        TRUNCATED_ELEMENT,
        /** An element declared undefined length, which needs sequence parsing. */
        UNDEFINED_LENGTH
    }

    private final byte[] buffer;
    private final int startOffset;
    private volatile Termination termination = Termination.NONE;
    private volatile DicomParseException terminationError;

    private ElementWalker(byte[] buffer, int startOffset) {
        this.buffer = buffer;
        this.startOffset = startOffset;
    }

    /**
     * True when the buffer is at least 132 bytes long and carries {@code DICM} at offset 128.
     */
    public static boolean isValidDicom(byte[] buffer) {
        if (buffer == null || buffer.length < DATASET_OFFSET) {
            return false;
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (buffer[PREAMBLE_LENGTH + i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Create a walker over {@code buffer} starting at {@code startOffset}.
     *
     * @throws DicomParseException with {@code MALFORMED_CONTAINER} if the buffer is not a DICOM container
     */
    public static ElementWalker walk(byte[] buffer, int startOffset) throws DicomParseException {
        Objects.requireNonNull(buffer, "buffer");
        if (!isValidDicom(buffer)) {
            throw new DicomParseException(DicomParseException.Reason.MALFORMED_CONTAINER,
                    "Buffer of " + buffer.length + " bytes has no DICM marker at offset " + PREAMBLE_LENGTH);
        }
        if (startOffset < 0 || startOffset > buffer.length) {
            throw new IllegalArgumentException("Start offset " + startOffset + " outside buffer of " + buffer.length);
        }
        return new ElementWalker(buffer, startOffset);
    }

    /**
     * Walker over the whole dataset, starting right after the DICM marker.
     */
    public static ElementWalker walk(byte[] buffer) throws DicomParseException {
        return walk(buffer, DATASET_OFFSET);
    }

    @Override
    public Iterator<DataElement> iterator() {
        termination = Termination.NONE;
        terminationError = null;
        return new Cursor(startOffset);
    }

    public Stream<DataElement> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public byte[] getBuffer() {
        return buffer;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public Termination getTermination() {
        return termination;
    }

    /**
     * Error that ended the most recent pass early, if any.
     */
    public DicomParseException getTerminationError() {
        return terminationError;
    }

    private DataElement readElement(int offset) {
        if ((long) offset + 8 > buffer.length) {
            stop(Termination.END_OF_BUFFER, null);
            return null;
        }

        ByteBuffer header = ByteBuffer.wrap(buffer).order(ByteOrder.LITTLE_ENDIAN);
        Tag tag = new Tag(Short.toUnsignedInt(header.getShort(offset)), Short.toUnsignedInt(header.getShort(offset + 2)));
        VR vr = VR.fromCode(new String(buffer, offset + 4, 2, StandardCharsets.US_ASCII));
        boolean explicit = vr != null;

        long length;
        int valueOffset;
        if (explicit && vr.isLongForm()) {
            if ((long) offset + 12 > buffer.length) {
                stop(Termination.TRUNCATED_ELEMENT, new DicomParseException(DicomParseException.Reason.TRUNCATED_ELEMENT,
                        "Header of " + tag + " truncated at offset " + offset, offset));
                return null;
            }
            length = Integer.toUnsignedLong(header.getInt(offset + 8));
            valueOffset = offset + 12;
        } else if (explicit) {
            length = Short.toUnsignedInt(header.getShort(offset + 6));
            valueOffset = offset + 8;
        } else {
            // Implicit VR little endian: 4-byte length, VR from the dictionary
            vr = TagDictionary.vrOf(tag).orElse(VR.UN);
            length = Integer.toUnsignedLong(header.getInt(offset + 4));
            valueOffset = offset + 8;
        }

        if (length == UNDEFINED_LENGTH) {
            stop(Termination.UNDEFINED_LENGTH, null);
            log.debug("Element {} at offset {} has undefined length; stopping walk", tag, offset);
            return null;
        }
        if (valueOffset + length > buffer.length) {
            stop(Termination.TRUNCATED_ELEMENT, new DicomParseException(DicomParseException.Reason.TRUNCATED_ELEMENT,
                    String.format("Element %s at offset %d declares %d bytes but only %d remain",
                            tag, offset, length, buffer.length - valueOffset), offset));
            return null;
        }

        int valueLength = (int) length;
        DecodedValue value = null;
        DicomParseException decodeError = null;
        try {
            value = vr.decode(buffer, valueOffset, valueLength, tag);
        } catch (DicomParseException e) {
            decodeError = e;
            log.debug("Could not decode {} ({}) at offset {}: {}", tag, vr, offset, e.getMessage());
        }
        return new DataElement(buffer, tag, vr, explicit, offset, valueOffset, valueLength, value, decodeError);
    }

    private void stop(Termination reason, DicomParseException error) {
        termination = reason;
        terminationError = error;
    }

    private final class Cursor implements Iterator<DataElement> {
        private int offset;
        private DataElement next;
        private boolean done;

        Cursor(int offset) {
            this.offset = offset;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = readElement(offset);
                if (next == null) {
                    done = true;
                } else {
                    offset = next.getNextOffset();
                }
            }
            return next != null;
        }

        @Override
        public DataElement next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DataElement element = next;
            next = null;
            return element;
        }
    }
}
