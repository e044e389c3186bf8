/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.data.SpatialDataset;

/**
 *
 * Picks the reference feature matrix to enhance:
 * an explicitly supplied matrix, else the named alternate experiment, else the named assay
 *
 */
public class FeatureMatrixResolver {

    public enum FeatureSource {
        EXPLICIT,//matrix supplied by the caller, not attached to the reference dataset
        ALT_EXPERIMENT,
        ASSAY
    }

    public static class ResolvedFeatures {
        final FeatureMatrix matrix;
        final FeatureSource source;
        final String setName;//alt experiment or assay name, null if EXPLICIT

        ResolvedFeatures(FeatureMatrix matrix, FeatureSource source, String setName) {
            this.matrix = matrix;
            this.source = source;
            this.setName = setName;
        }

        public FeatureMatrix getMatrix() {
            return matrix;
        }

        public FeatureSource getSource() {
            return source;
        }

        public String getSetName() {
            return setName;
        }
    }


    /**
     * @param featureMatrix explicit matrix, or null
     * @param altExpType alternate experiment to read (the measurement of the same name inside it), or null
     * @param assayType assay to read if neither of the above is given
     */
    public static ResolvedFeatures resolve(SpatialDataset ref, FeatureMatrix featureMatrix, String altExpType, String assayType){
        ResolvedFeatures ans;
        if(featureMatrix!=null)
            ans = new ResolvedFeatures(featureMatrix, FeatureSource.EXPLICIT, null);
        else if(altExpType!=null)
            ans = new ResolvedFeatures(ref.getAltExperiment(altExpType).getMeasurement(altExpType), FeatureSource.ALT_EXPERIMENT, altExpType);
        else {
            if(assayType==null)
                throw new IllegalArgumentException("ERROR: no feature matrix, alternate experiment, or assay specified");
            ans = new ResolvedFeatures(ref.getAssay(assayType), FeatureSource.ASSAY, assayType);
        }

        if(!ans.matrix.hasRowNames())
            throw new IllegalArgumentException("ERROR: Spot features must have assigned rownames.");

        return ans;
    }
}
