/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingMatrixTest {

    private EmbeddingMatrix emb(String... dimLabels){
        double coords[][] = { {1,2}, {3,4}, {5,6} };
        return new EmbeddingMatrix(coords, Arrays.asList("x","y","z"), Arrays.asList(dimLabels));
    }

    @Test
    void testRealignTo() {
        EmbeddingMatrix ref = emb("PC1","PC2");
        EmbeddingMatrix enh = emb("PC2","PC1");
        assertFalse(enh.labelsMatch(ref));

        EmbeddingMatrix realigned = enh.realignTo(ref);

        assertTrue(realigned.labelsMatch(ref));
        assertEquals(Arrays.asList("PC1","PC2"), realigned.getDimLabels());
        assertArrayEquals(new double[] {1,2}, realigned.getSample(0));//positions unchanged
        assertEquals(Arrays.asList("x","y","z"), realigned.getSampleIds());
        assertEquals(Arrays.asList("PC2","PC1"), enh.getDimLabels());//original untouched
    }

    @Test
    void testRealignNeedsSameDims() {
        EmbeddingMatrix ref = new EmbeddingMatrix(new double[][] {{1,2,3}}, Arrays.asList("x"), Arrays.asList("a","b","c"));
        assertThrows(IllegalArgumentException.class, () -> emb("PC1","PC2").realignTo(ref));
    }

    @Test
    void testTable() {
        EmbeddingTable table = emb("PC1","PC2").toTable();

        assertEquals(3, table.numRows());
        assertEquals(Arrays.asList("x","y","z"), table.getRowIds());
        assertTrue(table.hasColumn("PC2"));
        assertArrayEquals(new double[] {2,4,6}, table.getColumn("PC2"));

        double design[][] = table.designMatrix(Arrays.asList("PC2","PC1"));
        assertArrayEquals(new double[] {4,3}, design[1]);
        assertThrows(IllegalArgumentException.class, () -> table.designMatrix(Arrays.asList("PC3")));
    }

    @Test
    void testDuplicateLabelsRejectedByTable() {
        assertThrows(IllegalArgumentException.class, () -> emb("PC1","PC1").toTable());
    }

    @Test
    void testBadShape() {
        double coords[][] = { {1,2}, {3,4} };
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingMatrix(coords, Arrays.asList("x"), Arrays.asList("a","b")));
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingMatrix(coords, Arrays.asList("x","y"), Arrays.asList("a")));
    }
}
