/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.List;
import org.spatialenhance.data.FeatureMatrix;

/**
 *
 * Predicted features at the enhanced resolution (selected features x enhanced samples),
 * with the diagnostics of the fits that produced them attached
 *
 */
public class EnhancedFeatures {

    private final FeatureMatrix predictions;
    private final FitDiagnostics diagnostics;


    public EnhancedFeatures(FeatureMatrix predictions, FitDiagnostics diagnostics) {
        if(!predictions.hasRowNames())
            throw new IllegalArgumentException("ERROR: enhanced features must be named");
        this.predictions = predictions;
        this.diagnostics = diagnostics;
    }


    public FeatureMatrix getPredictions() {
        return predictions;
    }

    public FitDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public List<String> getFeatureNames(){
        return predictions.getRowNames();
    }

    public List<String> getSampleIds(){
        return predictions.getColNames();
    }

    public int numFeatures(){
        return predictions.numFeatures();
    }

    public int numSamples(){
        return predictions.numSamples();
    }

    @Override
    public String toString(){
        return "EnhancedFeatures["+numFeatures()+" features x "+numSamples()+" samples, "+diagnostics.getKind()+"]";
    }
}
