/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.List;
import org.spatialenhance.control.EnhanceSettings;
import org.spatialenhance.data.EmbeddingMatrix;
import org.spatialenhance.data.FeatureMatrix;
import org.spatialenhance.data.SpatialDataset;
import org.spatialenhance.enhance.FeatureMatrixResolver.ResolvedFeatures;
import org.spatialenhance.enhance.FeatureSelector.FeatureSelection;

/**
 *
 * Predicts feature values at the enhanced resolution from the enhanced embedding
 *
 * A model is fit to the reference (spot-level) embedding and features,
 * e.g. for the default linear case lm(feature ~ PCs) per feature,
 * and then evaluated on the enhanced (subspot-level) embedding.
 *
 * Feature matrices are p x n: p-dimensional feature vectors over n samples.
 *
 */
public class FeatureEnhancer {

    private final EnhanceSettings settings;
    private final EnhancementDispatcher dispatcher;


    public FeatureEnhancer(){
        this(new EnhanceSettings());
    }

    public FeatureEnhancer(EnhanceSettings settings){
        this.settings = settings;
        dispatcher = new EnhancementDispatcher(settings.numThreads, settings.boostingParams);
    }


    /**
     * Enhance the features named by the settings (assay or alternate experiment of ref)
     */
    public EnhancementOutput enhanceFeatures(SpatialDataset enhanced, SpatialDataset ref){
        return enhanceFeatures(enhanced, ref, null, settings.featureNames, settings.model);
    }

    /**
     * Enhance an externally supplied feature matrix, whose columns are the samples of ref.
     * The result is always returned as a matrix.
     */
    public EnhancementOutput enhanceFeatures(SpatialDataset enhanced, SpatialDataset ref, FeatureMatrix featureMatrix){
        return enhanceFeatures(enhanced, ref, featureMatrix, settings.featureNames, settings.model);
    }

    /**
     * @param enhanced dataset with the enhanced embedding
     * @param ref dataset with the reference embedding (and features, unless featureMatrix is given)
     * @param featureMatrix features to enhance if not attached to ref; overrides the alt experiment and assay
     * @param featureNames features to predict (null for all)
     * @param model model used to predict enhanced values
     * @return If the features came from an assay or alternate experiment and all of them were enhanced,
     * a copy of enhanced with the enhanced features stored in the same slot.
     * If featureMatrix was given or only some features were requested, the enhanced features as a matrix.
     */
    public EnhancementOutput enhanceFeatures(SpatialDataset enhanced, SpatialDataset ref, FeatureMatrix featureMatrix,
            List<String> featureNames, EnhancementModel model){

        EmbeddingMatrix xEnh = enhanced.getEmbedding(settings.useDimred);
        EmbeddingMatrix xRef = ref.getEmbedding(settings.useDimred);

        ResolvedFeatures resolved = FeatureMatrixResolver.resolve(ref, featureMatrix, settings.altExpType, settings.assayType);
        FeatureSelection selection = FeatureSelector.select(featureNames, resolved.getMatrix());

        EnhancedFeatures yEnh = dispatcher.enhance(xEnh, xRef, resolved.getMatrix(), selection.getSelected(), model);

        return OutputMaterializer.materialize(yEnh, enhanced, resolved, selection);
    }
}
