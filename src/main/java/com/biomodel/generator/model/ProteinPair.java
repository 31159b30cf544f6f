package com.biomodel.generator.model;

import lombok.Value;

/**
 * Unphosphorylated and phosphorylated names of one protein as written in a
 * phosphorylation-type reaction.
 */
@Value
public class ProteinPair {
    String unphosphorylated;
    String phosphorylated;
}
