package dev.quarry.extraction;

import dev.quarry.QuarryException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads selected parts of a ZIP package into memory.
 *
 * <p>Inflation is bounded twice: per part, and across all parts read from one package, so that
 * many moderately sized parts cannot add up to a decompression bomb.</p>
 */
final class ZipParts {
    /** Upper bound on the inflated size of one part. */
    static final long MAX_PART_BYTES = 512L * 1024 * 1024;

    /** Upper bound on the inflated size of all parts read from one package. */
    static final long MAX_PACKAGE_BYTES = 1024L * 1024 * 1024;

    private ZipParts() {
    }

    static Map<String, byte[]> read(byte[] data, Predicate<String> wanted) throws QuarryException {
        return read(data, wanted, MAX_PART_BYTES, MAX_PACKAGE_BYTES);
    }

    static Map<String, byte[]> read(byte[] data, Predicate<String> wanted, long maxPartBytes, long maxPackageBytes)
        throws QuarryException {
        Map<String, byte[]> parts = new LinkedHashMap<>();
        long packageTotal = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(data))) {
            ZipEntry entry;
            byte[] buffer = new byte[8192];
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (entry.isDirectory() || !wanted.test(name)) {
                    continue;
                }
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                long total = 0;
                int read;
                while ((read = zip.read(buffer)) > 0) {
                    total += read;
                    packageTotal += read;
                    if (total > maxPartBytes) {
                        throw new QuarryException.Parsing("Package part " + name + " inflates beyond "
                            + maxPartBytes + " bytes");
                    }
                    if (packageTotal > maxPackageBytes) {
                        throw new QuarryException.Parsing("Package inflates beyond " + maxPackageBytes
                            + " bytes in total (stopped at " + name + ")");
                    }
                    out.write(buffer, 0, read);
                }
                parts.put(name, out.toByteArray());
            }
        } catch (IOException e) {
            throw new QuarryException.Parsing("Corrupt ZIP package: " + e.getMessage(), e);
        }
        if (parts.isEmpty() && !looksLikeZip(data)) {
            throw new QuarryException.Parsing("Not a ZIP package");
        }
        return parts;
    }

    private static boolean looksLikeZip(byte[] data) {
        return data.length >= 4 && data[0] == 'P' && data[1] == 'K';
    }
}
