package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.QuarryException;
import dev.quarry.TestDocuments;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class ZipPartsTest {

    private static byte[] packageOf(int parts, int partSize) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < parts; i++) {
            entries.put("xl/worksheets/sheet" + i + ".xml", "x".repeat(partSize));
        }
        return TestDocuments.zip(entries);
    }

    @Test
    void shouldReadOnlyWantedParts() throws QuarryException {
        byte[] data = TestDocuments.zip(Map.of("keep.xml", "<a/>", "skip.bin", "zz"));

        Map<String, byte[]> parts = ZipParts.read(data, name -> name.endsWith(".xml"));

        assertThat(parts).containsOnlyKeys("keep.xml");
    }

    @Test
    void shouldRejectSinglePartOverItsLimit() {
        byte[] data = packageOf(1, 5_000);

        assertThatThrownBy(() -> ZipParts.read(data, name -> true, 4_000, 100_000))
            .isInstanceOf(QuarryException.Parsing.class)
            .hasMessageContaining("sheet0.xml");
    }

    @Test
    void shouldRejectManyPartsThatTogetherExceedThePackageBudget() {
        // Each part is within its own limit; only the sum is too large.
        byte[] data = packageOf(8, 3_000);

        assertThatThrownBy(() -> ZipParts.read(data, name -> true, 4_000, 20_000))
            .isInstanceOf(QuarryException.Parsing.class)
            .hasMessageContaining("in total");
    }

    @Test
    void shouldAcceptPackageWithinBothLimits() throws QuarryException {
        byte[] data = packageOf(6, 3_000);

        assertThat(ZipParts.read(data, name -> true, 4_000, 20_000)).hasSize(6);
    }

    @Test
    void shouldRejectBytesThatAreNotAZip() {
        assertThatThrownBy(() -> ZipParts.read(new byte[] {1, 2, 3}, name -> true))
            .isInstanceOf(QuarryException.Parsing.class);
    }
}
