/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.control;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.spatialenhance.enhance.EnhancementModel;
import org.spatialenhance.regression.boost.BoostingParams;

/**
 *
 * Settings for feature enhancement
 *
 */
@SuppressWarnings("serial")
public class EnhanceSettings implements Serializable {

    public String useDimred = "PCA";//embedding to use, at both resolutions
    public String assayType = "logcounts";
    public String altExpType = null;//if set, enhance this alternate experiment instead of assayType
    public EnhancementModel model = EnhancementModel.XGBOOST;
    public List<String> featureNames = null;//null means all features
    public int numThreads = 1;//for fitting features in parallel (lm and xgboost)
    public BoostingParams boostingParams = new BoostingParams();


    public EnhanceSettings(){
        //defaults
    }

    public EnhanceSettings(ParamSet params){
        //initialize from input parameter set
        useDimred = params.getValue("USEDIMRED", useDimred);
        assayType = params.getValue("ASSAYTYPE", assayType);
        altExpType = params.getValue("ALTEXPTYPE", null);
        model = EnhancementModel.fromName(params.getValue("ENHANCEMODEL", model.getModelName()));

        String names = params.getValue("FEATURENAMES", "").trim();
        if(!names.isEmpty())
            featureNames = new ArrayList<>(Arrays.asList(names.split("\\s+")));

        numThreads = params.getInt("ENHANCETHREADS", numThreads);
        if(numThreads<1)
            throw new IllegalArgumentException("ERROR: ENHANCETHREADS must be at least 1, got "+numThreads);

        boostingParams = new BoostingParams(params);
    }
}
