/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import cern.colt.matrix.DoubleFactory2D;
import cern.colt.matrix.DoubleMatrix2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * Low-dimensional embedding of a set of samples (e.g. the top principal components of each spot)
 * samples x dimensions, with sample ids as row labels and dimension labels as column labels
 *
 * The reference and enhanced embeddings of one enhancement share the same dimensions,
 * so matching them up is a matter of checking dimensionality and labels.
 * Immutable.
 *
 */
public class EmbeddingMatrix {

    private final DoubleMatrix2D coords;//samples x dims
    private final List<String> sampleIds;
    private final List<String> dimLabels;


    public EmbeddingMatrix(DoubleMatrix2D coords, List<String> sampleIds, List<String> dimLabels){
        if(sampleIds.size()!=coords.rows())
            throw new IllegalArgumentException("ERROR: "+sampleIds.size()+" sample ids for "+coords.rows()+" embedded samples");
        if(dimLabels.size()!=coords.columns())
            throw new IllegalArgumentException("ERROR: "+dimLabels.size()+" dimension labels for "+coords.columns()+" dimensions");

        this.coords = coords.copy();
        this.sampleIds = Collections.unmodifiableList(new ArrayList<>(sampleIds));
        this.dimLabels = Collections.unmodifiableList(new ArrayList<>(dimLabels));
    }

    public EmbeddingMatrix(double[][] coords, List<String> sampleIds, List<String> dimLabels){
        this(DoubleFactory2D.dense.make(coords), sampleIds, dimLabels);
    }


    public int numSamples(){
        return coords.rows();
    }

    public int numDims(){
        return coords.columns();
    }

    public List<String> getSampleIds(){
        return sampleIds;
    }

    public List<String> getDimLabels(){
        return dimLabels;
    }

    public double get(int sample, int dim){
        return coords.getQuick(sample, dim);
    }

    public double[] getSample(int sample){
        return coords.viewRow(sample).toArray();
    }

    public DoubleMatrix2D getCoords(){
        return coords.copy();
    }

    public boolean labelsMatch(EmbeddingMatrix other){
        return dimLabels.equals(other.dimLabels);
    }


    /**
     * Same coordinates, but with the dimension labels of ref
     * Positions are trusted over labels: column k here is taken to be dimension k of ref.
     */
    public EmbeddingMatrix realignTo(EmbeddingMatrix ref){
        if(ref.numDims()!=numDims())
            throw new IllegalArgumentException("ERROR: can't realign "+numDims()+"-dimensional embedding to "+ref.numDims()+" dimensions");
        return new EmbeddingMatrix(coords, sampleIds, ref.dimLabels);
    }

    /**
     * Tabular view: one row per sample, one named column per dimension
     */
    public EmbeddingTable toTable(){
        return new EmbeddingTable(this);
    }


    @Override
    public String toString(){
        return "EmbeddingMatrix["+numSamples()+" samples x "+numDims()+" dims]";
    }
}
