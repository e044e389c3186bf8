/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression.boost;

import cern.colt.matrix.DoubleMatrix2D;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 *
 * Gradient boosting of regression trees for a squared-error objective
 * Each round fits a tree to the gradient (pred - y) and hessian (1) at the current predictions,
 * then adds the tree (shrunk by eta) to the ensemble.
 *
 * No row or column subsampling, so fitting is deterministic.
 *
 */
public class TreeBooster {

    private static final Logger logger = LogManager.getLogger(TreeBooster.class);

    private final BoostingParams params;


    public TreeBooster(BoostingParams params) {
        params.checkValid();
        this.params = params;
    }


    public BoostedEnsemble fit(DoubleMatrix2D X, double[] y){
        int numSamp = X.rows();
        if(y.length!=numSamp)
            throw new IllegalArgumentException("ERROR: "+y.length+" labels for "+numSamp+" training samples");
        if(numSamp==0)
            throw new IllegalArgumentException("ERROR: can't boost with no training samples");
        for(double label : y){
            if(Double.isNaN(label) || Double.isInfinite(label))
                throw new IllegalArgumentException("ERROR: non-finite training label");
        }

        int[][] sortedByDim = presort(X);

        double pred[] = new double[numSamp];
        Arrays.fill(pred, params.baseScore);
        double grad[] = new double[numSamp];
        double hess[] = new double[numSamp];
        Arrays.fill(hess, 1);//squared error

        ArrayList<RegressionTree> trees = new ArrayList<>();
        double trainRMSE[] = new double[params.numRounds];

        for(int round=0; round<params.numRounds; round++){
            for(int s=0; s<numSamp; s++)
                grad[s] = pred[s] - y[s];

            RegressionTree tree = RegressionTree.grow(X, sortedByDim, grad, hess, params);
            trees.add(tree);

            double sumSq = 0;
            for(int s=0; s<numSamp; s++){
                pred[s] += tree.predict(X, s);
                sumSq += (pred[s]-y[s]) * (pred[s]-y[s]);
            }
            trainRMSE[round] = Math.sqrt(sumSq/numSamp);
            logger.debug("[{}] train-rmse: {}", round, trainRMSE[round]);
        }

        return new BoostedEnsemble(params.baseScore, trees, trainRMSE);
    }


    private static int[][] presort(DoubleMatrix2D X){
        int ans[][] = new int[X.columns()][];
        for(int dim=0; dim<X.columns(); dim++){
            final int d = dim;
            Integer order[] = new Integer[X.rows()];
            for(int s=0; s<order.length; s++)
                order[s] = s;
            Arrays.sort(order, Comparator.comparingDouble(s -> X.getQuick(s,d)));//stable, ties keep sample order
            ans[dim] = Arrays.stream(order).mapToInt(Integer::intValue).toArray();
        }
        return ans;
    }
}
