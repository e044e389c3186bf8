/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.spatialenhance.data.EmbeddingTable;

/**
 *
 * response ~ term1 + term2 + ... (+ intercept), with terms naming columns of an EmbeddingTable
 *
 */
public class ModelFormula {

    private final String response;
    private final List<String> terms;


    public ModelFormula(String response, List<String> terms){
        if(terms.isEmpty())
            throw new IllegalArgumentException("ERROR: formula for "+response+" needs at least one term");
        this.response = response;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    /**
     * response ~ . : one term for every column of the data
     */
    public static ModelFormula allColumns(String response, EmbeddingTable data){
        ArrayList<String> terms = new ArrayList<>();
        for(String col : data.getColumnNames())
            terms.add(col);
        return new ModelFormula(response, terms);
    }


    /**
     * samples x terms (the intercept is left to the fitter)
     */
    public double[][] designMatrix(EmbeddingTable data){
        return data.designMatrix(terms);
    }

    @Override
    public String toString(){
        return response + " ~ " + String.join(" + ", terms);
    }
}
