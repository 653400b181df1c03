/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of VoxelFit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.voxelfit.processing;

import com.hellblazer.voxelfit.balancing.WorkRange;
import com.hellblazer.voxelfit.protocol.ColumnTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the file backed result store
 */
public class FileResultStoreTest {

    @TempDir
    Path root;

    private FileResultStore store;

    @BeforeEach
    void setUp() {
        store = new FileResultStore(root);
    }

    @Test
    void testChunksAreDurable() {
        var values = new LinkedHashMap<String, double[]>();
        values.put("S0.s0", new double[] { 1000, 1001 });
        values.put("ADC.d", new double[] { 1e-9, Double.NaN });
        store.write("ADC (Cascade)/ADC", WorkRange.of(4, 6), values);

        var reopened = new FileResultStore(root);
        assertTrue(reopened.exists("ADC (Cascade)/ADC", WorkRange.of(4, 6)));
        assertFalse(reopened.exists("ADC (Cascade)/ADC", WorkRange.of(0, 4)));
        assertFalse(reopened.exists("ADC", WorkRange.of(4, 6)));

        var read = reopened.read("ADC (Cascade)/ADC", WorkRange.of(4, 6));
        assertEquals(List.of("S0.s0", "ADC.d"), List.copyOf(read.keySet()));
        assertArrayEquals(new double[] { 1000, 1001 }, read.get("S0.s0"));
        assertTrue(Double.isNaN(read.get("ADC.d")[1]));
    }

    @Test
    void testMissingChunk() {
        assertThrows(IllegalStateException.class, () -> store.read("S0", WorkRange.of(0, 1)));
    }

    @Test
    void testColumnTableMarksCompletion() {
        assertFalse(store.isComplete("S0"));
        store.writeColumnTable("S0", new ColumnTable().addColumn("b", new double[] { 0, 1e9 }));

        assertTrue(store.isComplete("S0"));
        assertTrue(Files.isRegularFile(store.modelDirectory("S0").resolve(FileResultStore.USED_PROTOCOL)));
        var protocol = store.readColumnTable("S0");
        assertArrayEquals(new double[] { 0, 1e9 }, protocol.getColumn("b"));
        assertTrue(protocol.isColumnReal("Delta"), "Estimated columns are recorded as used");
    }

    @Test
    void testReadAllMergesChunksInOrder() {
        store.write("S0", WorkRange.of(10, 25), Map.of("S0.s0", new double[15]));
        store.write("S0", WorkRange.of(0, 10), Map.of("S0.s0", new double[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 }));

        assertEquals(List.of(WorkRange.of(0, 10), WorkRange.of(10, 25)), store.chunks("S0"));
        var merged = store.readAll("S0", List.of("S0.s0"), 25);
        assertEquals(7.0, merged.get("S0.s0")[7]);
        assertEquals(25, merged.get("S0.s0").length);

        assertThrows(IllegalStateException.class, () -> store.readAll("S0", List.of("S0.s0"), 30),
                     "Voxels past the stored chunks are missing");
        assertThrows(IllegalStateException.class, () -> store.readAll("S0", List.of("ADC.d"), 25));
        assertEquals(List.of(), store.chunks("never-written"));
    }

    @Test
    void testInvalidateRemovesChunksAndProtocol() throws IOException {
        store.write("S0", WorkRange.of(0, 2), Map.of("S0.s0", new double[] { 1, 2 }));
        store.write("S0", WorkRange.of(2, 4), Map.of("S0.s0", new double[] { 3, 4 }));
        store.writeColumnTable("S0", new ColumnTable().addColumn("b", new double[] { 0 }));
        var unrelated = Files.writeString(store.modelDirectory("S0").resolve("notes.txt"), "keep");

        store.invalidate("S0");

        assertFalse(store.exists("S0", WorkRange.of(0, 2)));
        assertFalse(store.exists("S0", WorkRange.of(2, 4)));
        assertFalse(store.isComplete("S0"));
        assertTrue(Files.exists(unrelated));
        store.invalidate("never-written");
    }
}
