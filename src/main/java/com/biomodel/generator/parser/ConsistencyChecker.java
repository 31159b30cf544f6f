package com.biomodel.generator.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.biomodel.generator.model.ProteinPair;
import com.biomodel.generator.parser.exception.InconsistentNamingException;

/**
 * Detects one phosphorylation event written with two different species names.
 *
 * <p>Forward and reverse reactions normally record the same pair twice, so a
 * pair seen an odd number of times is compared with every distinct pair: one
 * shared name and one differing name is reported.
 */
public class ConsistencyChecker {

    public void check(List<ProteinPair> pairs) {
        Map<ProteinPair, Integer> counts = new LinkedHashMap<>();
        for (ProteinPair pair : pairs) {
            counts.merge(pair, 1, Integer::sum);
        }
        Set<ProteinPair> distinct = counts.keySet();

        for (ProteinPair one : pairs) {
            if (counts.get(one) % 2 == 0) {
                continue;
            }
            for (ProteinPair another : distinct) {
                boolean sameUnphosphorylated = one.getUnphosphorylated().equals(another.getUnphosphorylated());
                boolean samePhosphorylated = one.getPhosphorylated().equals(another.getPhosphorylated());
                if (sameUnphosphorylated != samePhosphorylated) {
                    if (sameUnphosphorylated) {
                        throw new InconsistentNamingException(one.getPhosphorylated(), another.getPhosphorylated());
                    }
                    throw new InconsistentNamingException(one.getUnphosphorylated(), another.getUnphosphorylated());
                }
            }
        }
    }
}
