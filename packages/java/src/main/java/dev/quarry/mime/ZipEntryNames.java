package dev.quarry.mime;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads entry names out of a ZIP archive held in memory, without inflating anything.
 *
 * <p>The central directory is used when the buffer contains it. A truncated prefix falls back
 * to scanning local file headers. All declared counts and offsets are treated as untrusted and
 * bounds-checked against the buffer.</p>
 */
final class ZipEntryNames {
    static final int MAX_ENTRIES = 10_000;

    private static final int LOCAL_HEADER = 0x04034b50;
    private static final int CENTRAL_HEADER = 0x02014b50;
    private static final int END_OF_CENTRAL_DIRECTORY = 0x06054b50;
    private static final int EOCD_MIN_SIZE = 22;
    private static final int EOCD_MAX_COMMENT = 0xFFFF;

    private ZipEntryNames() {
    }

    static List<String> read(byte[] data) {
        List<String> names = fromCentralDirectory(data);
        if (names != null) {
            return names;
        }
        return fromLocalHeaders(data);
    }

    /**
     * Content of a stored (uncompressed) {@code mimetype} entry, as written by ODF and EPUB.
     *
     * @param data archive bytes
     * @return the entry text, or null if absent or compressed
     */
    static String storedMimetype(byte[] data) {
        int offset = 0;
        int scanned = 0;
        while (offset + 30 <= data.length && scanned < MAX_ENTRIES) {
            if (readInt(data, offset) != LOCAL_HEADER) {
                return null;
            }
            int method = readShort(data, offset + 8);
            long compressedSize = readInt(data, offset + 18) & 0xFFFFFFFFL;
            int nameLength = readShort(data, offset + 26);
            int extraLength = readShort(data, offset + 28);
            int nameStart = offset + 30;
            int dataStart = nameStart + nameLength + extraLength;
            if (dataStart > data.length) {
                return null;
            }
            String name = new String(data, nameStart, nameLength, StandardCharsets.UTF_8);
            if ("mimetype".equals(name)) {
                if (method != 0 || compressedSize > 256 || dataStart + compressedSize > data.length) {
                    return null;
                }
                return new String(data, dataStart, (int) compressedSize, StandardCharsets.US_ASCII).trim();
            }
            long next = dataStart + compressedSize;
            if (next > data.length || compressedSize == 0) {
                return null;
            }
            offset = (int) next;
            scanned++;
        }
        return null;
    }

    private static List<String> fromCentralDirectory(byte[] data) {
        int eocd = findEndOfCentralDirectory(data);
        if (eocd < 0) {
            return null;
        }
        int declaredEntries = readShort(data, eocd + 10);
        long directoryOffset = readInt(data, eocd + 16) & 0xFFFFFFFFL;
        if (directoryOffset >= data.length) {
            return null;
        }
        List<String> names = new ArrayList<>();
        int offset = (int) directoryOffset;
        int limit = Math.min(declaredEntries, MAX_ENTRIES);
        for (int i = 0; i < limit; i++) {
            if (offset + 46 > data.length || readInt(data, offset) != CENTRAL_HEADER) {
                break;
            }
            int nameLength = readShort(data, offset + 28);
            int extraLength = readShort(data, offset + 30);
            int commentLength = readShort(data, offset + 32);
            int nameStart = offset + 46;
            if (nameStart + nameLength > data.length) {
                break;
            }
            names.add(new String(data, nameStart, nameLength, StandardCharsets.UTF_8));
            offset = nameStart + nameLength + extraLength + commentLength;
        }
        return names.isEmpty() ? null : names;
    }

    private static List<String> fromLocalHeaders(byte[] data) {
        List<String> names = new ArrayList<>();
        int offset = 0;
        while (offset + 30 <= data.length && names.size() < MAX_ENTRIES) {
            int found = indexOfLocalHeader(data, offset);
            if (found < 0 || found + 30 > data.length) {
                break;
            }
            int nameLength = readShort(data, found + 26);
            int nameStart = found + 30;
            if (nameStart + nameLength > data.length) {
                break;
            }
            names.add(new String(data, nameStart, nameLength, StandardCharsets.UTF_8));
            offset = nameStart + nameLength;
        }
        return names;
    }

    private static int findEndOfCentralDirectory(byte[] data) {
        int start = data.length - EOCD_MIN_SIZE;
        int stop = Math.max(0, data.length - EOCD_MIN_SIZE - EOCD_MAX_COMMENT);
        for (int i = start; i >= stop; i--) {
            if (readInt(data, i) == END_OF_CENTRAL_DIRECTORY) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfLocalHeader(byte[] data, int from) {
        for (int i = from; i + 4 <= data.length; i++) {
            if (data[i] == 'P' && data[i + 1] == 'K' && data[i + 2] == 3 && data[i + 3] == 4) {
                return i;
            }
        }
        return -1;
    }

    private static int readShort(byte[] data, int offset) {
        return (data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8);
    }

    private static int readInt(byte[] data, int offset) {
        if (offset < 0 || offset + 4 > data.length) {
            return 0;
        }
        return (data[offset] & 0xFF)
            | ((data[offset + 1] & 0xFF) << 8)
            | ((data[offset + 2] & 0xFF) << 16)
            | ((data[offset + 3] & 0xFF) << 24);
    }
}
