/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 *
 * Just a list of samples with their embeddings, assays, and alternate experiments, all in memory
 * Every attached matrix must cover exactly the dataset's samples.
 *
 */
public class BasicSpatialDataset implements SpatialDataset {

    private final List<String> sampleIds;
    private final HashMap<String,EmbeddingMatrix> embeddings;
    private final MeasurementSet assays;
    private final HashMap<String,MeasurementSet> altExps;


    public BasicSpatialDataset(List<String> sampleIds){
        this(Collections.unmodifiableList(new ArrayList<>(sampleIds)), new HashMap<>(), new MeasurementSet(), new HashMap<>());
    }

    private BasicSpatialDataset(List<String> sampleIds, HashMap<String,EmbeddingMatrix> embeddings,
            MeasurementSet assays, HashMap<String,MeasurementSet> altExps){
        this.sampleIds = sampleIds;
        this.embeddings = embeddings;
        this.assays = assays;
        this.altExps = altExps;
    }


    @Override
    public List<String> getSampleIds() {
        return sampleIds;
    }

    public int numSamples(){
        return sampleIds.size();
    }

    @Override
    public EmbeddingMatrix getEmbedding(String name) {
        EmbeddingMatrix ans = embeddings.get(name);
        if(ans==null)
            throw new IllegalArgumentException("ERROR: no embedding named "+name+" (have "+embeddings.keySet()+")");
        return ans;
    }

    @Override
    public FeatureMatrix getAssay(String assayType) {
        return assays.getMeasurement(assayType);
    }

    @Override
    public boolean hasAltExperiment(String altExpType) {
        return altExps.containsKey(altExpType);
    }

    @Override
    public MeasurementSet getAltExperiment(String altExpType) {
        MeasurementSet ans = altExps.get(altExpType);
        if(ans==null)
            throw new IllegalArgumentException("ERROR: no alternate experiment named "+altExpType+" (have "+altExps.keySet()+")");
        return ans;
    }


    public BasicSpatialDataset withEmbedding(String name, EmbeddingMatrix emb){
        if(emb.numSamples()!=numSamples())
            throw new IllegalArgumentException("ERROR: embedding "+name+" has "+emb.numSamples()+" samples, dataset has "+numSamples());
        HashMap<String,EmbeddingMatrix> newEmbeddings = new HashMap<>(embeddings);
        newEmbeddings.put(name, emb);
        return new BasicSpatialDataset(sampleIds, newEmbeddings, assays, altExps);
    }

    @Override
    public BasicSpatialDataset withAssay(String assayType, FeatureMatrix matrix) {
        if(matrix.numSamples()!=numSamples())
            throw new IllegalArgumentException("ERROR: assay "+assayType+" has "+matrix.numSamples()+" samples, dataset has "+numSamples());
        return new BasicSpatialDataset(sampleIds, embeddings, assays.withMeasurement(assayType, matrix), altExps);
    }

    @Override
    public BasicSpatialDataset withAltExperiment(String altExpType, MeasurementSet measurements) {
        if(measurements.numSamples()>=0 && measurements.numSamples()!=numSamples()){
            throw new IllegalArgumentException("ERROR: alternate experiment "+altExpType+" has "
                    +measurements.numSamples()+" samples, dataset has "+numSamples());
        }
        HashMap<String,MeasurementSet> newAltExps = new HashMap<>(altExps);
        newAltExps.put(altExpType, measurements);
        return new BasicSpatialDataset(sampleIds, embeddings, assays, newAltExps);
    }
}
