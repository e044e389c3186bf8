/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.spatialenhance.data.EmbeddingMatrix;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.regression.BoostedTreeFeatureRegressor;
import org.spatialenhance.regression.DirichletFeatureRegressor;
import org.spatialenhance.regression.LinearFeatureRegressor;
import org.spatialenhance.regression.boost.BoostingParams;

/**
 *
 * Checks that the embeddings and reference features line up, then hands them
 * (in the form the chosen model wants) to the model's regressor
 *
 */
public class EnhancementDispatcher {

    private static final Logger logger = LogManager.getLogger(EnhancementDispatcher.class);

    private final int numThreads;//for per-feature fitting
    private final BoostingParams boostingParams;


    public EnhancementDispatcher(){
        this(1, new BoostingParams());
    }

    public EnhancementDispatcher(int numThreads, BoostingParams boostingParams){
        if(numThreads<1)
            throw new IllegalArgumentException("ERROR: need at least one thread, got "+numThreads);
        boostingParams.checkValid();
        this.numThreads = numThreads;
        this.boostingParams = boostingParams;
    }


    /**
     * @param xEnh enhanced embedding (n_enh x d)
     * @param xRef reference embedding (n_ref x d)
     * @param yRef reference features (features x n_ref)
     * @param featureNames features of yRef to predict
     */
    public EnhancedFeatures enhance(EmbeddingMatrix xEnh, EmbeddingMatrix xRef, FeatureMatrix yRef,
            List<String> featureNames, EnhancementModel model){

        if(model==null)
            throw new IllegalArgumentException("ERROR: no enhancement model specified");
        if(xEnh.numDims()!=xRef.numDims()){
            throw new IllegalArgumentException("ERROR: enhanced embedding has "+xEnh.numDims()
                    +" dimensions but reference embedding has "+xRef.numDims());
        }
        if(yRef.numSamples()!=xRef.numSamples()){
            throw new IllegalArgumentException("ERROR: reference features cover "+yRef.numSamples()
                    +" samples but reference embedding has "+xRef.numSamples());
        }
        if(!yRef.hasRowNames())
            throw new IllegalArgumentException("ERROR: Spot features must have assigned rownames.");

        xEnh = realign(xEnh, xRef);

        FeatureMatrix selectedRef = yRef.selectRows(featureNames);

        FeatureRegressor<?> regressor = makeRegressor(model);
        logger.info("Enhancing {} features with {} ({} reference -> {} enhanced samples)",
                featureNames.size(), model, xRef.numSamples(), xEnh.numSamples());
        return runRegressor(regressor, xRef, xEnh, selectedRef, featureNames);
    }


    /**
     * xEnh with xRef's dimension labels, warning if they differed
     */
    public static EmbeddingMatrix realign(EmbeddingMatrix xEnh, EmbeddingMatrix xRef){
        if(xEnh.labelsMatch(xRef))
            return xEnh;
        logger.warn("Dimension labels of enhanced embedding {} do not match reference embedding {}",
                xEnh.getDimLabels(), xRef.getDimLabels());
        logger.warn("Setting enhanced embedding dimension labels to match reference embedding");
        return xEnh.realignTo(xRef);
    }


    FeatureRegressor<?> makeRegressor(EnhancementModel model){
        switch(model){
            case LM:
                return new LinearFeatureRegressor(numThreads);
            case DIRICHLET:
                return new DirichletFeatureRegressor();
            case XGBOOST:
                return new BoostedTreeFeatureRegressor(boostingParams, numThreads);
            default:
                throw new IllegalArgumentException("ERROR: unsupported enhancement model "+model);
        }
    }


    private static <E> EnhancedFeatures runRegressor(FeatureRegressor<E> regressor, EmbeddingMatrix xRef,
            EmbeddingMatrix xEnh, FeatureMatrix yRef, List<String> featureNames){
        EmbeddingForm<E> form = regressor.inputForm();
        logger.debug("Presenting embeddings to {} as a {}", regressor.getClass().getSimpleName(), form.getName());
        return regressor.fitAndPredict(form.present(xRef), form.present(xEnh), yRef, featureNames);
    }
}
