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
 * Fits a model of the reference features on the reference embedding,
 * then evaluates it on the enhanced embedding
 *
 * Implementations are stateless between calls; any fitted model lives only inside one call.
 * E is the embedding representation the regressor consumes (see EmbeddingForm).
 *
 */
public interface FeatureRegressor<E> {

    EmbeddingForm<E> inputForm();

    /**
     * @param xRef reference embedding (n_ref samples)
     * @param xEnh enhanced embedding (n_enh samples), same dimensions as xRef
     * @param yRef reference features (features x n_ref), named
     * @param featureNames features to predict, all present in yRef
     * @return predictions (featureNames x n_enh, columns named by enhanced sample) and fit diagnostics
     */
    EnhancedFeatures fitAndPredict(E xRef, E xEnh, FeatureMatrix yRef, List<String> featureNames);

}
