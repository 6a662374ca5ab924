package com.instaclustr.hasher.measure;

import com.instaclustr.hasher.measure.DataSize.DataSizeUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DataSizeTest {

    @Test
    public void testParsing() {
        assertEquals(new DataSize(1L, DataSizeUnit.MEBIBYTES), DataSize.parse("1MiB"));
        assertEquals(new DataSize(512L, DataSizeUnit.KIBIBYTES), DataSize.parse(" 512 kib "));
        assertEquals(DataSize.bytes(100), DataSize.parse("100"));
        assertEquals(DataSize.bytes(100), DataSize.parse("100B"));
        assertEquals(2L * 1024 * 1024 * 1024, DataSize.parse("2GiB").toBytes());
    }

    @Test
    public void testInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> DataSize.parse("1XB"));
        assertThrows(IllegalArgumentException.class, () -> DataSize.parse("-1MiB"));
        assertThrows(IllegalArgumentException.class, () -> DataSize.parse("MiB"));
        assertThrows(IllegalArgumentException.class, () -> DataSize.parse(null));
        assertThrows(IllegalArgumentException.class, () -> new DataSize(1L, null));
    }

    @Test
    public void testToString() {
        assertEquals("1MiB", DataSize.parse("1 mib").toString());
        assertEquals("512 B", DataSize.bytesToHumanReadable(512));
        assertEquals("1.0 KiB", DataSize.bytesToHumanReadable(1024));
        assertEquals("1.5 MiB", DataSize.bytesToHumanReadable(1024 * 1024 * 3 / 2));
        assertEquals("1.0 GiB", DataSize.bytesToHumanReadable(1024L * 1024 * 1024));
    }
}
