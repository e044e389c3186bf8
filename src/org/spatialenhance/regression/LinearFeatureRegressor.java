/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import java.util.List;
import org.spatialenhance.data.EmbeddingTable;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.enhance.EmbeddingForm;
import org.spatialenhance.enhance.EnhancedFeatures;
import org.spatialenhance.enhance.FeatureRegressor;
import org.spatialenhance.enhance.FitDiagnostics;
import org.spatialenhance.enhance.PerFeatureFitter;

/**
 *
 * feature ~ . for each feature: a linear model on all embedding dimensions, reporting R^2
 *
 */
public class LinearFeatureRegressor implements FeatureRegressor<EmbeddingTable> {

    private final PerFeatureFitter fitter;

    public LinearFeatureRegressor(int numThreads){
        fitter = new PerFeatureFitter(numThreads);
    }

    @Override
    public EmbeddingForm<EmbeddingTable> inputForm() {
        return EmbeddingForm.TABLE;
    }

    @Override
    public EnhancedFeatures fitAndPredict(EmbeddingTable xRef, EmbeddingTable xEnh, FeatureMatrix yRef, List<String> featureNames) {
        return fitter.fitAll(featureNames, xEnh.getRowIds(), FitDiagnostics.Kind.R_SQUARED, feature -> {
            LinearFit fit = LinearFit.fit(ModelFormula.allColumns(feature, xRef), xRef, yRef.getRow(feature));
            return new PerFeatureFitter.FeatureFit(feature, fit.predict(xEnh), fit.getRSquared());
        });
    }
}
