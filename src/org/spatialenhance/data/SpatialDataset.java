/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import java.util.List;

/**
 *
 * Data object holding the embeddings and feature measurements of one set of samples
 * (spots at the reference resolution, or subspots at the enhanced resolution)
 *
 * Implementations are immutable: the with* methods return an updated copy
 * and leave the original untouched.
 *
 */
public interface SpatialDataset {

    List<String> getSampleIds();

    EmbeddingMatrix getEmbedding(String name);//e.g. "PCA"

    FeatureMatrix getAssay(String assayType);//primary measurements, e.g. "logcounts"

    MeasurementSet getAltExperiment(String altExpType);//alternate feature sets, each with their own features

    boolean hasAltExperiment(String altExpType);

    SpatialDataset withAssay(String assayType, FeatureMatrix matrix);

    SpatialDataset withAltExperiment(String altExpType, MeasurementSet measurements);

}
