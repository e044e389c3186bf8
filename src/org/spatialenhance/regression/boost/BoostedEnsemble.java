/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression.boost;

import cern.colt.matrix.DoubleMatrix2D;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * Result of boosting: base score + trees, and the training RMSE after each round
 *
 */
@SuppressWarnings("serial")
public class BoostedEnsemble implements Serializable {

    private final double baseScore;
    private final List<RegressionTree> trees;
    private final double[] trainRMSE;//evaluation log, one entry per round


    BoostedEnsemble(double baseScore, ArrayList<RegressionTree> trees, double[] trainRMSE){
        this.baseScore = baseScore;
        this.trees = Collections.unmodifiableList(trees);
        this.trainRMSE = trainRMSE;
    }


    public double predict(DoubleMatrix2D X, int row){
        double ans = baseScore;
        for(RegressionTree tree : trees)
            ans += tree.predict(X, row);
        return ans;
    }

    public double[] predict(DoubleMatrix2D X){
        double ans[] = new double[X.rows()];
        for(int row=0; row<ans.length; row++)
            ans[row] = predict(X, row);
        return ans;
    }

    public int numRounds(){
        return trees.size();
    }

    public List<RegressionTree> getTrees(){
        return trees;
    }

    public double[] getTrainRMSELog(){
        return trainRMSE.clone();
    }

    public double finalTrainRMSE(){
        return trainRMSE[trainRMSE.length-1];
    }
}
