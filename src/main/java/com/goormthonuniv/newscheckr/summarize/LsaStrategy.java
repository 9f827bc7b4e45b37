package com.goormthonuniv.newscheckr.summarize;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

import java.util.*;

/**
 * LSA: 단어 x 문장 행렬의 SVD.
 * 문장 j의 중요도 = sqrt( sum_k sigma_k^2 * v_jk^2 ), 상위 개념 k개만 사용.
 */
public class LsaStrategy extends SentenceRanker {

    static final int TOP_CONCEPTS = 3;
    private static final double ZERO = 1e-10;

    @Override
    public String name() {
        return "lsa";
    }

    @Override
    protected double[] score(List<String> sentences, List<List<String>> tokens) {
        Map<String, Integer> termIndex = new TreeMap<>();
        for (List<String> t : tokens) {
            for (String term : t) termIndex.putIfAbsent(term, 0);
        }
        if (termIndex.isEmpty()) {
            throw new IllegalStateException("no terms to build the LSA matrix");
        }
        int row = 0;
        for (Map.Entry<String, Integer> e : termIndex.entrySet()) e.setValue(row++);

        int n = tokens.size();
        DMatrixRMaj matrix = new DMatrixRMaj(termIndex.size(), n);
        for (int j = 0; j < n; j++) {
            for (String term : tokens.get(j)) {
                int i = termIndex.get(term);
                matrix.set(i, j, matrix.get(i, j) + 1.0);
            }
        }

        SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(true, true, true);
        if (!svd.decompose(matrix)) {
            throw new IllegalStateException("SVD did not converge");
        }
        double[] sigma = svd.getSingularValues();
        int count = svd.numberOfSingularValues();
        DMatrixRMaj v = svd.getV(null, false);    // n x count

        // 특이값은 정렬되어 있지 않다
        Integer[] order = new Integer[count];
        for (int k = 0; k < count; k++) order[k] = k;
        Arrays.sort(order, (a, b) -> Double.compare(sigma[b], sigma[a]));
        if (count == 0 || sigma[order[0]] < ZERO) {
            throw new IllegalStateException("term-sentence matrix is degenerate");
        }

        int concepts = Math.min(TOP_CONCEPTS, count);
        double[] scores = new double[n];
        for (int j = 0; j < n; j++) {
            double sum = 0.0;
            for (int c = 0; c < concepts; c++) {
                int k = order[c];
                double x = sigma[k] * v.get(j, k);
                sum += x * x;
            }
            scores[j] = Math.sqrt(sum);
        }
        return scores;
    }
}
