/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import java.util.LinkedHashMap;
import java.util.List;

/**
 *
 * Tabular form of an embedding: a row per sample and a named column per dimension
 * Columns are looked up by name, so a model fit to one table can be evaluated on another
 * whose columns carry the same names (in any order).
 *
 */
public class EmbeddingTable {

    private final List<String> rowIds;
    private final LinkedHashMap<String,double[]> columns = new LinkedHashMap<>();//dim label -> values over rows


    EmbeddingTable(EmbeddingMatrix emb){
        rowIds = emb.getSampleIds();
        List<String> labels = emb.getDimLabels();
        for(int d=0; d<labels.size(); d++){
            double col[] = new double[emb.numSamples()];
            for(int s=0; s<col.length; s++)
                col[s] = emb.get(s, d);
            if(columns.put(labels.get(d), col)!=null)
                throw new IllegalArgumentException("ERROR: duplicate embedding column "+labels.get(d));
        }
    }


    public int numRows(){
        return rowIds.size();
    }

    public List<String> getRowIds(){
        return rowIds;
    }

    public Iterable<String> getColumnNames(){
        return columns.keySet();
    }

    public boolean hasColumn(String name){
        return columns.containsKey(name);
    }

    public double[] getColumn(String name){
        double[] col = columns.get(name);
        if(col==null)
            throw new IllegalArgumentException("ERROR: embedding table has no column "+name);
        return col.clone();
    }

    /**
     * rows x terms matrix of the named columns (no intercept column)
     */
    public double[][] designMatrix(List<String> terms){
        double ans[][] = new double[numRows()][terms.size()];
        for(int t=0; t<terms.size(); t++){
            double col[] = columns.get(terms.get(t));
            if(col==null)
                throw new IllegalArgumentException("ERROR: embedding table has no column "+terms.get(t));
            for(int r=0; r<ans.length; r++)
                ans[r][t] = col[r];
        }
        return ans;
    }
}
