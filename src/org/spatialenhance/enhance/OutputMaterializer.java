/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.spatialenhance.data.MeasurementSet;
import org.spatialenhance.data.SpatialDataset;
import org.spatialenhance.enhance.FeatureMatrixResolver.FeatureSource;
import org.spatialenhance.enhance.FeatureMatrixResolver.ResolvedFeatures;
import org.spatialenhance.enhance.FeatureSelector.FeatureSelection;

/**
 *
 * Returns enhanced features in the same form they came in:
 * explicitly supplied or partially selected features come back as a raw matrix
 * (they have no natural home in the dataset); otherwise they go into a copy of the
 * enhanced dataset, in the alternate experiment or assay they were read from.
 *
 */
public class OutputMaterializer {

    private static final Logger logger = LogManager.getLogger(OutputMaterializer.class);


    public static EnhancementOutput materialize(EnhancedFeatures enhanced, SpatialDataset enhancedDataset,
            ResolvedFeatures resolved, FeatureSelection selection){

        if(resolved.getSource()==FeatureSource.EXPLICIT || selection.isPartial()){
            logger.debug("Returning {} enhanced features as a matrix", enhanced.numFeatures());
            return EnhancementOutput.rawMatrix(enhanced);
        }
        else if(resolved.getSource()==FeatureSource.ALT_EXPERIMENT){
            String altExpType = resolved.getSetName();
            MeasurementSet altExp = new MeasurementSet(altExpType, enhanced.getPredictions());
            logger.debug("Storing enhanced features in alternate experiment {}", altExpType);
            return EnhancementOutput.attached(enhanced, enhancedDataset.withAltExperiment(altExpType, altExp));
        }
        else {
            String assayType = resolved.getSetName();
            logger.debug("Storing enhanced features in assay {}", assayType);
            return EnhancementOutput.attached(enhanced, enhancedDataset.withAssay(assayType, enhanced.getPredictions()));
        }
    }
}
