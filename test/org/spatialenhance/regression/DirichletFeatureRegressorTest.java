/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.spatialenhance.data.EmbeddingMatrix;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.enhance.EnhanceTestData;
import org.spatialenhance.enhance.EnhancedFeatures;
import org.spatialenhance.enhance.FitDiagnostics;

import static org.junit.jupiter.api.Assertions.*;

class DirichletFeatureRegressorTest {

    @Test
    void testPredictionsOnSimplex() {
        EmbeddingMatrix ref = EnhanceTestData.embedding(40, 3, "spot", new Random(41));
        EmbeddingMatrix enh = EnhanceTestData.embedding(90, 3, "subspot", new Random(42));
        FeatureMatrix features = EnhanceTestData.linearFeatures(ref, 5, new Random(43));
        List<String> subset = Arrays.asList("gene1","gene3","gene5");

        EnhancedFeatures ans = new DirichletFeatureRegressor().fitAndPredict(ref.toTable(), enh.toTable(), features, subset);

        assertEquals(subset, ans.getFeatureNames());
        assertEquals(enh.getSampleIds(), ans.getSampleIds());
        assertEquals(FitDiagnostics.Kind.NONE, ans.getDiagnostics().getKind());
        for(int s=0; s<ans.numSamples(); s++){
            double sum = 0;
            for(double val : ans.getPredictions().getColumn(s)){
                assertTrue(val>0 && val<1);
                sum += val;
            }
            assertEquals(1, sum, 1e-9);
        }
    }

    @Test
    void testFollowsPredictor() {
        //share of "a" rises with the first coordinate
        Random rand = new Random(44);
        int numSamp = 80;
        double x[][] = new double[numSamp][1];
        double vals[][] = new double[2][numSamp];
        for(int s=0; s<numSamp; s++){
            x[s][0] = 4*rand.nextDouble() - 2;
            double share = 1 / (1 + Math.exp(-2*x[s][0] + 0.3*rand.nextGaussian()));
            vals[0][s] = share;
            vals[1][s] = 1 - share;
        }
        EmbeddingMatrix ref = new EmbeddingMatrix(x, EnhanceTestData.names("spot", numSamp), Arrays.asList("PC1"));
        FeatureMatrix features = new FeatureMatrix(vals, Arrays.asList("a","b"), ref.getSampleIds());
        EmbeddingMatrix enh = new EmbeddingMatrix(new double[][] {{-1.5},{0},{1.5}}, Arrays.asList("s1","s2","s3"), Arrays.asList("PC1"));

        EnhancedFeatures ans = new DirichletFeatureRegressor().fitAndPredict(ref.toTable(), enh.toTable(), features, Arrays.asList("a","b"));

        double a[] = ans.getPredictions().getRow("a");
        assertTrue(a[0] < 0.2);
        assertEquals(0.5, a[1], 0.15);
        assertTrue(a[2] > 0.8);
    }

    @Test
    void testNeedsTwoFeatures() {
        EmbeddingMatrix ref = EnhanceTestData.embedding(20, 2, "spot", new Random(45));
        FeatureMatrix features = EnhanceTestData.linearFeatures(ref, 3, new Random(46));
        assertThrows(IllegalArgumentException.class, () -> new DirichletFeatureRegressor()
                .fitAndPredict(ref.toTable(), ref.toTable(), features, Arrays.asList("gene2")));
    }

    @Test
    void testRejectsNegativeFeatures() {
        EmbeddingMatrix ref = EnhanceTestData.embedding(10, 2, "spot", new Random(47));
        double vals[][] = new double[2][10];
        for(int s=0; s<10; s++){
            vals[0][s] = 1;
            vals[1][s] = (s==4) ? -1 : 1;
        }
        FeatureMatrix features = new FeatureMatrix(vals, Arrays.asList("a","b"), ref.getSampleIds());
        assertThrows(IllegalArgumentException.class, () -> new DirichletFeatureRegressor()
                .fitAndPredict(ref.toTable(), ref.toTable(), features, Arrays.asList("a","b")));
    }

    @Test
    void testRegressionDirectly() {
        double x[][] = { {0}, {1}, {2}, {3}, {1.5}, {0.5} };
        double y[][] = { {0.25,0.75}, {0.35,0.65}, {0.65,0.35}, {0.7,0.3}, {0.45,0.55}, {0.4,0.6} };
        DirichletRegression fit = DirichletRegression.fit(x, y, 500);

        assertEquals(2, fit.getNumComponents());
        assertTrue(fit.getNumIterations() <= 500);
        assertTrue(Double.isFinite(fit.getLogLikelihood()));
        double pred[][] = fit.predict(new double[][] { {0}, {3} });
        assertTrue(pred[0][0] < pred[1][0]);

        assertThrows(IllegalArgumentException.class, () -> DirichletRegression.fit(x, new double[][] { {0,1}, {0.5,0.5}, {0.5,0.5}, {0.5,0.5}, {0.5,0.5}, {0.5,0.5} }));
        assertThrows(IllegalArgumentException.class, () -> fit.predict(new double[][] { {1,2} }));
    }
}
