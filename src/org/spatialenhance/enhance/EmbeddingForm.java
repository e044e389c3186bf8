/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import org.spatialenhance.data.EmbeddingMatrix;
import org.spatialenhance.data.EmbeddingTable;

/**
 *
 * How a regressor wants its embeddings presented
 * Formula-based models get a table (one named column per dimension);
 * models that work on raw numbers get the matrix itself.
 *
 */
public interface EmbeddingForm<E> {

    E present(EmbeddingMatrix emb);

    String getName();


    EmbeddingForm<EmbeddingTable> TABLE = new EmbeddingForm<EmbeddingTable>() {
        @Override
        public EmbeddingTable present(EmbeddingMatrix emb) {
            return emb.toTable();
        }

        @Override
        public String getName() {
            return "table";
        }
    };

    EmbeddingForm<EmbeddingMatrix> MATRIX = new EmbeddingForm<EmbeddingMatrix>() {
        @Override
        public EmbeddingMatrix present(EmbeddingMatrix emb) {
            return emb;
        }

        @Override
        public String getName() {
            return "matrix";
        }
    };
}
