/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import java.util.Random;
import org.junit.jupiter.api.Test;
import org.spatialenhance.data.EmbeddingMatrix;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.enhance.EnhanceTestData;
import org.spatialenhance.enhance.EnhancedFeatures;
import org.spatialenhance.enhance.FitDiagnostics;
import org.spatialenhance.regression.boost.BoostingParams;

import static org.junit.jupiter.api.Assertions.*;

class BoostedTreeFeatureRegressorTest {

    @Test
    void testThreadsDontChangeResults() {
        EmbeddingMatrix ref = EnhanceTestData.embedding(60, 4, "spot", new Random(51));
        EmbeddingMatrix enh = EnhanceTestData.embedding(100, 4, "subspot", new Random(52));
        FeatureMatrix features = EnhanceTestData.linearFeatures(ref, 6, new Random(53));
        BoostingParams params = new BoostingParams(3, 0.2, 30);

        EnhancedFeatures serial = new BoostedTreeFeatureRegressor(params, 1).fitAndPredict(ref, enh, features, features.getRowNames());
        EnhancedFeatures parallel = new BoostedTreeFeatureRegressor(params, 4).fitAndPredict(ref, enh, features, features.getRowNames());

        assertEquals(FitDiagnostics.Kind.TRAIN_RMSE, parallel.getDiagnostics().getKind());
        assertEquals(enh.getSampleIds(), parallel.getSampleIds());
        for(String feature : features.getRowNames()){
            assertArrayEquals(serial.getPredictions().getRow(feature), parallel.getPredictions().getRow(feature), 0);
            assertEquals(serial.getDiagnostics().get(feature), parallel.getDiagnostics().get(feature));
            assertTrue(parallel.getDiagnostics().get(feature) >= 0);
        }
    }
}
