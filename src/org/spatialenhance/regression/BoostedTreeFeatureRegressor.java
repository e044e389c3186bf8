/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import cern.colt.matrix.DoubleMatrix2D;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.spatialenhance.data.EmbeddingMatrix;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.enhance.EmbeddingForm;
import org.spatialenhance.enhance.EnhancedFeatures;
import org.spatialenhance.enhance.FeatureRegressor;
import org.spatialenhance.enhance.FitDiagnostics;
import org.spatialenhance.enhance.PerFeatureFitter;
import org.spatialenhance.regression.boost.BoostedEnsemble;
import org.spatialenhance.regression.boost.BoostingParams;
import org.spatialenhance.regression.boost.TreeBooster;

/**
 *
 * A boosted tree ensemble per feature, on the raw embedding coordinates
 * Diagnostic is the training RMSE after the last round.
 *
 */
public class BoostedTreeFeatureRegressor implements FeatureRegressor<EmbeddingMatrix> {

    private static final Logger logger = LogManager.getLogger(BoostedTreeFeatureRegressor.class);

    private final TreeBooster booster;
    private final PerFeatureFitter fitter;


    public BoostedTreeFeatureRegressor(BoostingParams params, int numThreads){
        logger.info("Boosted trees: {}", params.getDescription());
        booster = new TreeBooster(params);
        fitter = new PerFeatureFitter(numThreads);
    }

    @Override
    public EmbeddingForm<EmbeddingMatrix> inputForm() {
        return EmbeddingForm.MATRIX;
    }

    @Override
    public EnhancedFeatures fitAndPredict(EmbeddingMatrix xRef, EmbeddingMatrix xEnh, FeatureMatrix yRef, List<String> featureNames) {
        //shared read-only by all the fits
        final DoubleMatrix2D refCoords = xRef.getCoords();
        final DoubleMatrix2D enhCoords = xEnh.getCoords();

        return fitter.fitAll(featureNames, xEnh.getSampleIds(), FitDiagnostics.Kind.TRAIN_RMSE, feature -> {
            BoostedEnsemble ensemble = booster.fit(refCoords, yRef.getRow(feature));
            return new PerFeatureFitter.FeatureFit(feature, ensemble.predict(enhCoords), ensemble.finalTrainRMSE());
        });
    }
}
