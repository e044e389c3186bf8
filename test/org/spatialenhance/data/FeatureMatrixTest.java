/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeatureMatrixTest {

    private FeatureMatrix threeGenes(){
        double vals[][] = { {1,2,3,4}, {5,6,7,8}, {9,10,11,12} };
        return new FeatureMatrix(vals, Arrays.asList("a","b","c"), Arrays.asList("s1","s2","s3","s4"));
    }

    @Test
    void testSelectRowsKeepsRequestedOrder() {
        FeatureMatrix sub = threeGenes().selectRows(Arrays.asList("c","a"));

        assertEquals(2, sub.numFeatures());
        assertEquals(4, sub.numSamples());
        assertEquals(Arrays.asList("c","a"), sub.getRowNames());
        assertArrayEquals(new double[] {9,10,11,12}, sub.getRow(0));
        assertArrayEquals(new double[] {1,2,3,4}, sub.getRow("a"));
        assertEquals(Arrays.asList("s1","s2","s3","s4"), sub.getColNames());
    }

    @Test
    void testUnknownFeature() {
        FeatureMatrix m = threeGenes();
        assertFalse(m.hasFeature("z"));
        assertThrows(IllegalArgumentException.class, () -> m.getRow("z"));
    }

    @Test
    void testUnnamedRows() {
        FeatureMatrix m = new FeatureMatrix(new double[][] {{1,2}}, null, null);
        assertFalse(m.hasRowNames());
        assertFalse(m.hasFeature("a"));
        assertThrows(IllegalArgumentException.class, () -> m.getRow("a"));
    }

    @Test
    void testBadNames() {
        double vals[][] = { {1,2}, {3,4} };
        assertThrows(IllegalArgumentException.class, () -> new FeatureMatrix(vals, Arrays.asList("a","a"), null));
        assertThrows(IllegalArgumentException.class, () -> new FeatureMatrix(vals, Arrays.asList("a"), null));
        assertThrows(IllegalArgumentException.class, () -> new FeatureMatrix(vals, Arrays.asList("a", null), null));
        assertThrows(IllegalArgumentException.class, () -> new FeatureMatrix(vals, null, Arrays.asList("s1","s2","s3")));
    }

    @Test
    void testValuesAreCopied() {
        double vals[][] = { {1,2}, {3,4} };
        FeatureMatrix m = new FeatureMatrix(vals, Arrays.asList("a","b"), null);
        vals[0][0] = 100;
        m.getValues().set(1, 1, 100);
        m.getRow(0)[1] = 100;

        assertEquals(1, m.get(0,0));
        assertEquals(2, m.get("a",1));
        assertEquals(4, m.get(1,1));
    }
}
