/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import org.spatialenhance.data.SpatialDataset;

/**
 *
 * What enhancement hands back: either the raw enhanced features,
 * or a copy of the enhanced dataset with the enhanced features attached
 *
 */
public class EnhancementOutput {

    private final EnhancedFeatures features;//always set
    private final SpatialDataset dataset;//null if returning the raw matrix


    private EnhancementOutput(EnhancedFeatures features, SpatialDataset dataset) {
        this.features = features;
        this.dataset = dataset;
    }

    static EnhancementOutput rawMatrix(EnhancedFeatures features){
        return new EnhancementOutput(features, null);
    }

    static EnhancementOutput attached(EnhancedFeatures features, SpatialDataset dataset){
        return new EnhancementOutput(features, dataset);
    }


    public boolean isDataset(){
        return dataset!=null;
    }

    /**
     * The updated enhanced dataset.  Only available if isDataset()
     */
    public SpatialDataset getDataset(){
        if(dataset==null)
            throw new IllegalStateException("ERROR: enhanced features were returned as a matrix, not attached to a dataset");
        return dataset;
    }

    /**
     * The enhanced features and their diagnostics (available either way)
     */
    public EnhancedFeatures getFeatures(){
        return features;
    }
}
