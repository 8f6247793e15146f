package com.plant.hierarchy.service;

import com.plant.hierarchy.exception.InvalidHierarchyInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyFileReaderTest {

    private HierarchyFileReader reader;

    @BeforeEach
    void setUp() {
        reader = new HierarchyFileReader();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testReadPlainLines() {
        List<String> paths = reader.readPaths(bytes("Equipment:Process\nEquipment:Safety\n\n"));

        assertEquals(List.of("Equipment:Process", "Equipment:Safety"), paths);
    }

    @Test
    void testSkipsPathHeaderAndBom() {
        List<String> paths = reader.readPaths(bytes("\uFEFFpath\r\nA:B\r\nC\r\n"));

        assertEquals(List.of("A:B", "C"), paths);
    }

    @Test
    void testReadCsvPathColumn() {
        List<String> paths = reader.readPaths(bytes("id,path,note\n1,A:B,\"x, y\"\n2,\"C:D\",z\n3\n"));

        assertEquals(3, paths.size());
        assertEquals("A:B", paths.get(0));
        assertEquals("C:D", paths.get(1));
        assertNull(paths.get(2));
    }

    @Test
    void testCommaInFirstPathIsNotCsv() {
        List<String> paths = reader.readPaths(bytes("Equipment:Pump, Large\nEquipment:Valve\n"));

        assertEquals(List.of("Equipment:Pump, Large", "Equipment:Valve"), paths);
    }

    @Test
    void testEmptyFileIsRejected() {
        assertThrows(InvalidHierarchyInputException.class, () -> reader.readPaths(new byte[0]));
        assertThrows(InvalidHierarchyInputException.class, () -> reader.readPaths(bytes("\n  \n")));
    }

    @Test
    void testSplitCsvLine() {
        assertEquals(List.of("a", "b \"q\"", ""), HierarchyFileReader.splitCsvLine("a,\"b \"\"q\"\"\","));
    }
}
