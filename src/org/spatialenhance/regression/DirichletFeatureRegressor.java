/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import cern.colt.matrix.DoubleFactory2D;
import cern.colt.matrix.DoubleMatrix2D;
import java.util.List;
import org.spatialenhance.data.EmbeddingTable;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.enhance.EmbeddingForm;
import org.spatialenhance.enhance.EnhancedFeatures;
import org.spatialenhance.enhance.FeatureRegressor;
import org.spatialenhance.enhance.FitDiagnostics;

/**
 *
 * Treats the selected features of each sample as one composition and fits them jointly:
 * (feature_1, ..., feature_p) ~ . as a Dirichlet regression.
 * Only the selected features make up the composition.  No per-feature diagnostics.
 *
 */
public class DirichletFeatureRegressor implements FeatureRegressor<EmbeddingTable> {

    private final int maxIter;

    public DirichletFeatureRegressor(){
        this(DirichletRegression.DEFAULT_MAX_ITER);
    }

    public DirichletFeatureRegressor(int maxIter){
        if(maxIter<1)
            throw new IllegalArgumentException("ERROR: need at least one Dirichlet fitting iteration");
        this.maxIter = maxIter;
    }

    @Override
    public EmbeddingForm<EmbeddingTable> inputForm() {
        return EmbeddingForm.TABLE;
    }

    @Override
    public EnhancedFeatures fitAndPredict(EmbeddingTable xRef, EmbeddingTable xEnh, FeatureMatrix yRef, List<String> featureNames) {
        ModelFormula formula = ModelFormula.allColumns("composition("+String.join(", ", featureNames)+")", xRef);

        double comps[][] = CompositionalData.prepare(yRef, featureNames);
        DirichletRegression fit = DirichletRegression.fit(formula.designMatrix(xRef), comps, maxIter);
        double predComps[][] = fit.predict(formula.designMatrix(xEnh));//samples x features

        DoubleMatrix2D pred = DoubleFactory2D.dense.make(featureNames.size(), predComps.length);
        for(int s=0; s<predComps.length; s++){
            for(int f=0; f<featureNames.size(); f++)
                pred.setQuick(f, s, predComps[s][f]);
        }

        return new EnhancedFeatures(new FeatureMatrix(pred, featureNames, xEnh.getRowIds()), FitDiagnostics.none());
    }
}
