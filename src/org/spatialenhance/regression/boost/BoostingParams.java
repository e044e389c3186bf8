/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression.boost;

import java.io.Serializable;
import org.spatialenhance.control.ParamSet;

/**
 *
 * Hyperparameters for gradient boosting of regression trees (squared-error objective)
 * Defaults: shallow trees, slow learning, 100 rounds, nothing random
 *
 */
@SuppressWarnings("serial")
public class BoostingParams implements Serializable {

    public int maxDepth = 2;
    public double eta = 0.03;//learning rate (shrinkage applied to each tree)
    public int numRounds = 100;
    public double lambda = 1;//L2 regularization on leaf weights
    public double minChildWeight = 1;//min hessian sum per child.  For squared error, min # samples
    public double baseScore = 0.5;//initial prediction for every sample


    public BoostingParams(){}

    public BoostingParams(int maxDepth, double eta, int numRounds){
        this.maxDepth = maxDepth;
        this.eta = eta;
        this.numRounds = numRounds;
        checkValid();
    }

    public BoostingParams(ParamSet params){
        maxDepth = params.getInt("XGBMAXDEPTH", maxDepth);
        eta = params.getDouble("XGBETA", eta);
        numRounds = params.getInt("XGBNROUNDS", numRounds);
        lambda = params.getDouble("XGBLAMBDA", lambda);
        minChildWeight = params.getDouble("XGBMINCHILDWEIGHT", minChildWeight);
        baseScore = params.getDouble("XGBBASESCORE", baseScore);
        checkValid();
    }


    public final void checkValid(){
        if(maxDepth<1)
            throw new IllegalArgumentException("ERROR: boosting max depth must be at least 1, got "+maxDepth);
        if( !(eta>0 && eta<=1) )
            throw new IllegalArgumentException("ERROR: boosting learning rate must be in (0,1], got "+eta);
        if(numRounds<1)
            throw new IllegalArgumentException("ERROR: need at least 1 boosting round, got "+numRounds);
        if(lambda<0 || minChildWeight<0)
            throw new IllegalArgumentException("ERROR: boosting regularization can't be negative");
        if(Double.isNaN(baseScore) || Double.isInfinite(baseScore))
            throw new IllegalArgumentException("ERROR: boosting base score must be finite");
    }

    public String getDescription(){
        return "max_depth="+maxDepth+" eta="+eta+" nrounds="+numRounds+" lambda="+lambda
                +" min_child_weight="+minChildWeight+" base_score="+baseScore;
    }
}
