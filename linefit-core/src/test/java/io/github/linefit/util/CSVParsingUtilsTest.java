/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CSVParsingUtilsTest {

  @TempDir
  Path tempDir;

  @Test
  void testReadDataSkipsCommentsAndBlankLines() throws IOException {
    final String csv = """
        # frequency, intensity
        6668000000, 1.5

        6668001000 ,nan
        """;
    final List<String[]> rows = CSVParsingUtils.readData(
        new BufferedReader(new StringReader(csv)), ",");
    Assertions.assertEquals(2, rows.size());
    Assertions.assertArrayEquals(new String[]{"6668000000", "1.5"}, rows.get(0));
    Assertions.assertArrayEquals(new String[]{"6668001000", "nan"}, rows.get(1));
  }

  @Test
  void testSeparatorDetection() throws IOException {
    final File tab = tempDir.resolve("tab.tsv").toFile();
    Files.writeString(tab.toPath(), "# header, with comma\n1\t2\n");
    Assertions.assertEquals('\t', CSVParsingUtils.autoDetermineSeparatorDefaultFallback(tab));

    final File single = tempDir.resolve("single.csv").toFile();
    Files.writeString(single.toPath(), "42\n");
    Assertions.assertEquals(',', CSVParsingUtils.autoDetermineSeparatorDefaultFallback(single));
  }

  @Test
  void testParseDoubleOrNull() {
    Assertions.assertEquals(1.25, CSVParsingUtils.parseDoubleOrNull(" 1.25 "));
    Assertions.assertTrue(Double.isNaN(CSVParsingUtils.parseDoubleOrNull("NaN")));
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, CSVParsingUtils.parseDoubleOrNull("-inf"));
    Assertions.assertNull(CSVParsingUtils.parseDoubleOrNull("frequency"));
    Assertions.assertNull(CSVParsingUtils.parseDoubleOrNull(""));
    Assertions.assertNull(CSVParsingUtils.parseDoubleOrNull(null));
  }
}
