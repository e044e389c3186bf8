/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression.boost;

import cern.colt.matrix.DoubleFactory2D;
import cern.colt.matrix.DoubleMatrix2D;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.spatialenhance.control.ParamSet;

import static org.junit.jupiter.api.Assertions.*;

class TreeBoosterTest {

    private static DoubleMatrix2D randomX(int numSamp, int numDims, Random rand){
        DoubleMatrix2D X = DoubleFactory2D.dense.make(numSamp, numDims);
        for(int s=0; s<numSamp; s++){
            for(int d=0; d<numDims; d++)
                X.setQuick(s, d, rand.nextDouble());
        }
        return X;
    }

    @Test
    void testLearnsStep() {
        Random rand = new Random(61);
        DoubleMatrix2D X = randomX(100, 2, rand);
        double y[] = new double[100];
        for(int s=0; s<100; s++)
            y[s] = (X.getQuick(s,0) > 0.5) ? 1 : 0;

        BoostedEnsemble ensemble = new TreeBooster(new BoostingParams(2, 0.3, 50)).fit(X, y);

        DoubleMatrix2D test = DoubleFactory2D.dense.make(new double[][] { {0.9, 0.5}, {0.1, 0.5} });
        assertTrue(ensemble.predict(test, 0) > 0.9);
        assertTrue(ensemble.predict(test, 1) < 0.1);
        assertEquals(50, ensemble.numRounds());
    }

    @Test
    void testDeterministic() {
        Random rand = new Random(62);
        DoubleMatrix2D X = randomX(80, 3, rand);
        double y[] = new double[80];
        for(int s=0; s<80; s++)
            y[s] = Math.sin(4*X.getQuick(s,0)) + X.getQuick(s,2) + 0.1*rand.nextGaussian();

        BoostingParams params = new BoostingParams(3, 0.1, 40);
        double pred1[] = new TreeBooster(params).fit(X, y).predict(X);
        double pred2[] = new TreeBooster(params).fit(X, y).predict(X);
        assertArrayEquals(pred1, pred2, 0);
    }

    @Test
    void testTreesRespectMaxDepth() {
        Random rand = new Random(63);
        DoubleMatrix2D X = randomX(120, 4, rand);
        double y[] = new double[120];
        for(int s=0; s<120; s++)
            y[s] = 5*X.getQuick(s,1)*X.getQuick(s,3) + rand.nextGaussian();

        for(int maxDepth=1; maxDepth<=4; maxDepth++){
            BoostedEnsemble ensemble = new TreeBooster(new BoostingParams(maxDepth, 0.3, 15)).fit(X, y);
            for(RegressionTree tree : ensemble.getTrees()){
                assertTrue(tree.getDepth() <= maxDepth);
                assertEquals(tree.numLeaves(), (tree.numNodes()+1)/2);//binary tree
            }
        }
    }

    @Test
    void testTrainingErrorNeverIncreases() {
        Random rand = new Random(64);
        DoubleMatrix2D X = randomX(60, 2, rand);
        double y[] = new double[60];
        for(int s=0; s<60; s++)
            y[s] = 3*X.getQuick(s,0) - X.getQuick(s,1) + 0.2*rand.nextGaussian();

        BoostedEnsemble ensemble = new TreeBooster(new BoostingParams()).fit(X, y);
        double rmse[] = ensemble.getTrainRMSELog();
        assertEquals(100, rmse.length);
        for(int r=1; r<rmse.length; r++)
            assertTrue(rmse[r] <= rmse[r-1] + 1e-12);
        assertEquals(rmse[99], ensemble.finalTrainRMSE());
    }

    @Test
    void testConstantFeatureGivesNoSplits() {
        DoubleMatrix2D X = DoubleFactory2D.dense.make(10, 1, 2.0);
        double y[] = new double[10];
        for(int s=0; s<10; s++)
            y[s] = s;

        BoostedEnsemble ensemble = new TreeBooster(new BoostingParams(2, 0.5, 3)).fit(X, y);
        for(RegressionTree tree : ensemble.getTrees())
            assertEquals(1, tree.numNodes());
    }

    @Test
    void testLeafWeight() {
        assertEquals(-2, RegressionTree.leafWeight(6, 2, 1), 1e-12);
    }

    @Test
    void testParamsFromConfig() {
        ParamSet config = new ParamSet();
        config.setValue("XGBMAXDEPTH", "4");
        config.setValue("XGBLAMBDA", "0.5");
        BoostingParams params = new BoostingParams(config);

        assertEquals(4, params.maxDepth);
        assertEquals(0.5, params.lambda, 0);
        assertEquals(100, params.numRounds);
        assertEquals("max_depth=4 eta=0.03 nrounds=100 lambda=0.5 min_child_weight=1.0 base_score=0.5",
                params.getDescription());
    }

    @Test
    void testBadInput() {
        TreeBooster booster = new TreeBooster(new BoostingParams());
        DoubleMatrix2D X = DoubleFactory2D.dense.make(3, 1);
        assertThrows(IllegalArgumentException.class, () -> booster.fit(X, new double[2]));
        assertThrows(IllegalArgumentException.class, () -> booster.fit(X, new double[] {1, Double.NaN, 2}));
        assertThrows(IllegalArgumentException.class, () -> new BoostingParams(0, 0.1, 10));
        assertThrows(IllegalArgumentException.class, () -> new BoostingParams(2, 1.5, 10));
        assertThrows(IllegalArgumentException.class, () -> new BoostingParams(2, 0.1, 0));
    }
}
