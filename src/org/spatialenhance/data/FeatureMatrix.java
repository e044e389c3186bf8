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
import java.util.HashMap;
import java.util.List;

/**
 *
 * A p x n matrix of feature vectors: one row per feature (e.g. a gene), one column per sample
 * (e.g. a spot or subspot)
 *
 * Row names are optional here since externally supplied matrices may lack them,
 * but every enhancement step downstream of input resolution addresses features by name.
 * Column names are optional too.  Instances are immutable.
 *
 */
public class FeatureMatrix {

    private final DoubleMatrix2D values;//features x samples
    private final List<String> rowNames;//null if unnamed
    private final List<String> colNames;//null if unnamed
    private final HashMap<String,Integer> rowIndex;//null if unnamed


    public FeatureMatrix(DoubleMatrix2D values, List<String> rowNames, List<String> colNames){
        if(rowNames!=null && rowNames.size()!=values.rows())
            throw new IllegalArgumentException("ERROR: "+rowNames.size()+" row names for "+values.rows()+" features");
        if(colNames!=null && colNames.size()!=values.columns())
            throw new IllegalArgumentException("ERROR: "+colNames.size()+" column names for "+values.columns()+" samples");

        this.values = values.copy();
        this.rowNames = (rowNames==null) ? null : Collections.unmodifiableList(new ArrayList<>(rowNames));
        this.colNames = (colNames==null) ? null : Collections.unmodifiableList(new ArrayList<>(colNames));

        if(rowNames==null)
            rowIndex = null;
        else {
            rowIndex = new HashMap<>();
            for(int r=0; r<rowNames.size(); r++){
                if(rowNames.get(r)==null)
                    throw new IllegalArgumentException("ERROR: null feature name at row "+r);
                if(rowIndex.put(rowNames.get(r), r)!=null)
                    throw new IllegalArgumentException("ERROR: duplicate feature name "+rowNames.get(r));
            }
        }
    }

    public FeatureMatrix(double[][] values, List<String> rowNames, List<String> colNames){
        this(DoubleFactory2D.dense.make(values), rowNames, colNames);
    }


    public int numFeatures(){
        return values.rows();
    }

    public int numSamples(){
        return values.columns();
    }

    public boolean hasRowNames(){
        return rowNames!=null;
    }

    public List<String> getRowNames(){
        return rowNames;
    }

    public List<String> getColNames(){
        return colNames;
    }

    public boolean hasFeature(String name){
        return rowIndex!=null && rowIndex.containsKey(name);
    }

    public int featureIndex(String name){
        Integer index = (rowIndex==null) ? null : rowIndex.get(name);
        if(index==null)
            throw new IllegalArgumentException("ERROR: no feature named "+name);
        return index;
    }

    public double get(int feature, int sample){
        return values.getQuick(feature, sample);
    }

    public double get(String feature, int sample){
        return values.getQuick(featureIndex(feature), sample);
    }

    public double[] getRow(int feature){
        return values.viewRow(feature).toArray();
    }

    public double[] getRow(String feature){
        return getRow(featureIndex(feature));
    }

    public double[] getColumn(int sample){
        return values.viewColumn(sample).toArray();
    }

    public DoubleMatrix2D getValues(){
        return values.copy();
    }


    /**
     * The named rows, in the order given
     */
    public FeatureMatrix selectRows(List<String> names){
        DoubleMatrix2D sub = DoubleFactory2D.dense.make(names.size(), numSamples());
        for(int r=0; r<names.size(); r++)
            sub.viewRow(r).assign(values.viewRow(featureIndex(names.get(r))));
        return new FeatureMatrix(sub, names, colNames);
    }


    @Override
    public String toString(){
        return "FeatureMatrix["+numFeatures()+" features x "+numSamples()+" samples]";
    }
}
